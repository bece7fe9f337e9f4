package org.javai.formflow.workflow;

import java.time.Instant;
import java.util.List;

public record EndWorkflowResult(
		String workflowId,
		String goal,
		WorkflowStatus status,
		int operationsCompleted,
		List<String> errors,
		Instant updatedAt,
		String message
) {
}
