package org.javai.formflow.page;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What the writer reports after a write.
 *
 * @param success overall outcome as computed by the writer
 * @param pageContextId the page the fields were written to
 * @param record snapshot of the record after the write, may be empty
 * @param saved whether the writer itself persisted the record
 * @param updatedFields fields that were set, or {@code null} if the writer does not report them
 * @param failedFields fields that were attempted and failed
 */
public record FieldWriteResult(
		boolean success,
		PageContextId pageContextId,
		Map<String, Object> record,
		boolean saved,
		List<String> updatedFields,
		List<FieldFailure> failedFields
) {

	public FieldWriteResult {
		record = record != null ? Collections.unmodifiableMap(new LinkedHashMap<>(record)) : Map.of();
		updatedFields = updatedFields != null ? List.copyOf(updatedFields) : null;
		failedFields = failedFields != null ? List.copyOf(failedFields) : List.of();
	}
}
