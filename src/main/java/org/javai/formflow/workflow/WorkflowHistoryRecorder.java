package org.javai.formflow.workflow;

import java.util.Map;
import java.util.Objects;
import org.javai.formflow.core.OperationResult;
import org.javai.formflow.core.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends the outcome of a record operation to the workflow a caller referenced.
 * Recording never affects the operation's own result: an unknown or finished workflow
 * is logged and skipped.
 */
public class WorkflowHistoryRecorder {

	private static final Logger logger = LoggerFactory.getLogger(WorkflowHistoryRecorder.class);

	private final WorkflowRegistry workflows;
	private final boolean enabled;

	public WorkflowHistoryRecorder(WorkflowRegistry workflows, boolean enabled) {
		this.workflows = Objects.requireNonNull(workflows, "workflows must not be null");
		this.enabled = enabled;
	}

	public void record(String workflowId, String tool, Map<String, Object> parameters, OperationResult<?> outcome) {
		if (!enabled || workflowId == null) {
			return;
		}
		WorkflowOperation operation = outcome.isSuccess()
				? WorkflowOperation.succeeded(tool, parameters)
				: WorkflowOperation.failed(tool, parameters, outcome.error().getMessage());
		try {
			workflows.appendHistory(workflowId, operation);
		}
		catch (ValidationException e) {
			logger.warn("Not recording {} in workflow {}: {}", tool, workflowId, e.getMessage());
		}
	}
}
