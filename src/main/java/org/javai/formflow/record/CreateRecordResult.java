package org.javai.formflow.record;

import java.util.List;
import java.util.Map;
import org.javai.formflow.page.FieldFailure;
import org.javai.formflow.page.PageContextId;

public record CreateRecordResult(
		boolean success,
		PageContextId pageContextId,
		String pageId,
		Map<String, Object> record,
		boolean saved,
		List<String> setFields,
		List<FieldFailure> failedFields,
		String message
) {
}
