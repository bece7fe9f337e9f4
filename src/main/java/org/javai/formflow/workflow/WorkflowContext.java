package org.javai.formflow.workflow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * State of one tracked multi-step business operation.
 *
 * <p>Immutable. {@link WorkflowRegistry} swaps in a new instance on every change;
 * {@code history} and {@code errors} only ever grow.</p>
 *
 * @param workflowId unique id
 * @param sessionId the session the workflow runs in; the workflow does not own it
 * @param goal free-text name of what the workflow is for
 * @param parameters caller supplied inputs, opaque to the registry
 */
public record WorkflowContext(
		String workflowId,
		String sessionId,
		String goal,
		Map<String, Object> parameters,
		WorkflowStatus status,
		Instant createdAt,
		Instant updatedAt,
		List<WorkflowOperation> history,
		List<String> errors
) {

	public WorkflowContext {
		Objects.requireNonNull(workflowId, "workflowId must not be null");
		Objects.requireNonNull(status, "status must not be null");
		parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
		history = history != null ? List.copyOf(history) : List.of();
		errors = errors != null ? List.copyOf(errors) : List.of();
	}

	WorkflowContext withOperation(WorkflowOperation operation) {
		List<WorkflowOperation> appended = new ArrayList<>(history);
		appended.add(operation);
		WorkflowStatus next = status == WorkflowStatus.CREATED ? WorkflowStatus.IN_PROGRESS : status;
		return new WorkflowContext(workflowId, sessionId, goal, parameters, next, createdAt, Instant.now(),
				appended, errors);
	}

	WorkflowContext withStatus(WorkflowStatus newStatus, String error) {
		List<String> newErrors = errors;
		if (error != null) {
			newErrors = new ArrayList<>(errors);
			newErrors.add(error);
		}
		return new WorkflowContext(workflowId, sessionId, goal, parameters, newStatus, createdAt, Instant.now(),
				history, newErrors);
	}

	public WorkflowOperation lastOperation() {
		return history.isEmpty() ? null : history.get(history.size() - 1);
	}
}
