package org.javai.formflow.page;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Map;
import org.javai.formflow.core.ValidationException;

/**
 * Handle to one open instance of a record-bearing page.
 *
 * <p>The wire form is {@code sessionId:page:pageId:timestamp}. {@link #format()}
 * and {@link #parse(String)} are the only places that know this layout.</p>
 *
 * @param sessionId the session the page was opened in, never blank
 * @param pageId the page identifier, never blank
 * @param timestamp epoch millis at which the page was opened
 */
public record PageContextId(String sessionId, String pageId, long timestamp) {

	static final String DELIMITER = ":";
	static final String PAGE_TAG = "page";

	public PageContextId {
		if (sessionId == null || sessionId.isBlank()) {
			throw new ValidationException("pageContextId requires a sessionId", "sessionId");
		}
		if (pageId == null || pageId.isBlank()) {
			throw new ValidationException("pageContextId requires a pageId", "pageId");
		}
		if (sessionId.contains(DELIMITER) || pageId.contains(DELIMITER)) {
			throw new ValidationException("pageContextId parts must not contain '" + DELIMITER + "'",
					"pageContextId", Map.of("sessionId", sessionId, "pageId", pageId));
		}
	}

	public static PageContextId of(String sessionId, String pageId) {
		return new PageContextId(sessionId, pageId, System.currentTimeMillis());
	}

	/**
	 * Parses the wire form produced by {@link #format()}.
	 *
	 * @throws ValidationException if the text does not have the expected layout
	 */
	public static PageContextId parse(String text) {
		if (text == null || text.isBlank()) {
			throw new ValidationException("pageContextId must be a non-empty string", "pageContextId");
		}
		String[] parts = text.split(DELIMITER, -1);
		if (parts.length != 4 || parts[0].isEmpty() || !PAGE_TAG.equals(parts[1]) || parts[2].isEmpty()) {
			throw new ValidationException("Invalid pageContextId format: " + text, "pageContextId");
		}
		long timestamp;
		try {
			timestamp = Long.parseLong(parts[3]);
		} catch (NumberFormatException e) {
			throw new ValidationException("Invalid pageContextId timestamp: " + text, "pageContextId");
		}
		return new PageContextId(parts[0], parts[2], timestamp);
	}

	@JsonValue
	public String format() {
		return sessionId + DELIMITER + PAGE_TAG + DELIMITER + pageId + DELIMITER + timestamp;
	}

	@Override
	public String toString() {
		return format();
	}
}
