package org.javai.formflow.record;

import java.util.Map;

/**
 * @param pageId the page to create the record on; a string or a number
 * @param fields field name to value, in the order they should be written
 * @param workflowId optional workflow to record this call in
 */
public record CreateRecordRequest(Object pageId, Map<String, Object> fields, String workflowId) {

	public static CreateRecordRequest of(Object pageId, Map<String, Object> fields) {
		return new CreateRecordRequest(pageId, fields, null);
	}
}
