package org.javai.formflow.workflow;

import java.time.Instant;

public record StartWorkflowResult(
		String workflowId,
		String sessionId,
		String goal,
		WorkflowStatus status,
		Instant createdAt,
		String message
) {
}
