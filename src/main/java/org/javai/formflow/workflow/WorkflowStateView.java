package org.javai.formflow.workflow;

/**
 * A workflow together with a digest of where it stands.
 */
public record WorkflowStateView(WorkflowContext workflow, Summary summary) {

	public record Summary(WorkflowStatus status, int operationsCompleted, boolean hasErrors) {
	}

	static WorkflowStateView of(WorkflowContext workflow) {
		return new WorkflowStateView(workflow,
				new Summary(workflow.status(), workflow.history().size(), !workflow.errors().isEmpty()));
	}
}
