package org.javai.formflow.record;

import java.util.Map;

/**
 * Input to {@link UpdateRecordPipeline}. Each flag is on unless explicitly {@code false};
 * {@code null} means on.
 *
 * @param pageId the page holding the record; a string or a number
 * @param fields field name to value, in the order they should be written
 * @param autoEdit run the Edit action before writing
 * @param save run the Save action after a successful write
 * @param stopOnError stop writing at the first failing field
 * @param workflowId optional workflow to record this call in
 */
public record UpdateRecordRequest(
		Object pageId,
		Map<String, Object> fields,
		Boolean autoEdit,
		Boolean save,
		Boolean stopOnError,
		String workflowId
) {

	public static UpdateRecordRequest of(Object pageId, Map<String, Object> fields) {
		return new UpdateRecordRequest(pageId, fields, null, null, null, null);
	}

	public boolean autoEditEnabled() {
		return !Boolean.FALSE.equals(autoEdit);
	}

	public boolean saveEnabled() {
		return !Boolean.FALSE.equals(save);
	}

	public boolean stopOnErrorEnabled() {
		return !Boolean.FALSE.equals(stopOnError);
	}
}
