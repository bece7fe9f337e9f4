package org.javai.formflow.session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.formflow.page.PageContextId;

/**
 * Identity of one logical connection to the form system, with the pages opened in it.
 *
 * <p>Instances are immutable; {@link SessionRegistry} replaces them as pages are recorded.</p>
 */
public record SessionContext(String sessionId, Instant createdAt, List<PageContextId> openPages) {

	public SessionContext {
		if (sessionId == null || sessionId.isBlank()) {
			throw new IllegalArgumentException("sessionId must be non-empty");
		}
		Objects.requireNonNull(createdAt, "createdAt must not be null");
		openPages = openPages != null ? List.copyOf(openPages) : List.of();
	}

	static SessionContext open(String sessionId) {
		return new SessionContext(sessionId, Instant.now(), List.of());
	}

	SessionContext withOpenPage(PageContextId page) {
		List<PageContextId> pages = new ArrayList<>(openPages);
		pages.add(page);
		return new SessionContext(sessionId, createdAt, pages);
	}

	public boolean hasOpenPage(PageContextId page) {
		return openPages.contains(page);
	}
}
