package org.javai.formflow.workflow;

public enum WorkflowStatus {
	CREATED,
	IN_PROGRESS,
	COMPLETED,
	FAILED;

	public boolean isTerminal() {
		return this == COMPLETED || this == FAILED;
	}
}
