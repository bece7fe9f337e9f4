package org.javai.formflow.record;

import java.util.List;
import java.util.Map;
import org.javai.formflow.page.FieldFailure;
import org.javai.formflow.page.PageContextId;

public record UpdateRecordResult(
		boolean success,
		PageContextId pageContextId,
		String pageId,
		Map<String, Object> record,
		boolean saved,
		List<String> updatedFields,
		List<FieldFailure> failedFields,
		String message
) {
}
