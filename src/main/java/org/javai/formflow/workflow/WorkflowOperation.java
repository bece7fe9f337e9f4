package org.javai.formflow.workflow;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One step recorded in a workflow's history.
 *
 * @param operationId unique id of this entry
 * @param tool the operation that ran, e.g. {@code update_record}
 * @param timestamp when the entry was recorded
 * @param parameters the inputs the operation ran with
 * @param success whether it succeeded
 * @param error failure message, {@code null} on success
 */
public record WorkflowOperation(
		String operationId,
		String tool,
		Instant timestamp,
		Map<String, Object> parameters,
		boolean success,
		String error
) {

	public WorkflowOperation {
		Objects.requireNonNull(operationId, "operationId must not be null");
		Objects.requireNonNull(tool, "tool must not be null");
		Objects.requireNonNull(timestamp, "timestamp must not be null");
		parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
	}

	public static WorkflowOperation succeeded(String tool, Map<String, Object> parameters) {
		return new WorkflowOperation(UUID.randomUUID().toString(), tool, Instant.now(), parameters, true, null);
	}

	public static WorkflowOperation failed(String tool, Map<String, Object> parameters, String error) {
		return new WorkflowOperation(UUID.randomUUID().toString(), tool, Instant.now(), parameters, false, error);
	}
}
