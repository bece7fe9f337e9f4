package org.javai.formflow.page;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Input to {@link FieldWriter#write(FieldWriteRequest)}.
 *
 * <p>The target page is addressed either by {@code pageContextId} or by
 * {@code pageId} plus an optional {@code sessionId}. Field order is preserved
 * and is the order in which fields are attempted.</p>
 */
public record FieldWriteRequest(
		String pageId,
		String sessionId,
		PageContextId pageContextId,
		Map<String, FieldValue> fields,
		boolean stopOnError,
		boolean immediateValidation
) {

	public FieldWriteRequest {
		if (pageId == null && pageContextId == null) {
			throw new IllegalArgumentException("Either pageId or pageContextId is required");
		}
		Objects.requireNonNull(fields, "fields must not be null");
		fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
	}

	/**
	 * Addresses the page by id and session, with the writer's default policy of stopping on the first error.
	 */
	public static FieldWriteRequest forPage(String pageId, String sessionId, Map<String, FieldValue> fields) {
		return new FieldWriteRequest(pageId, sessionId, null, fields, true, true);
	}

	public static FieldWriteRequest forContext(PageContextId pageContextId, Map<String, FieldValue> fields,
			boolean stopOnError, boolean immediateValidation) {
		return new FieldWriteRequest(pageContextId.pageId(), pageContextId.sessionId(), pageContextId,
				fields, stopOnError, immediateValidation);
	}
}
