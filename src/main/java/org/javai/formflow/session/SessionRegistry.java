package org.javai.formflow.session;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.formflow.core.ValidationException;
import org.javai.formflow.page.PageContextId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory store of the sessions known to this process.
 *
 * <p>One instance is shared by every pipeline and workflow operation; it is created once
 * by {@link org.javai.formflow.FormFlowRuntime} and injected. All operations are atomic.
 * Sessions live until {@link #close(String)} is called; nothing expires them.</p>
 */
public class SessionRegistry {

	private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

	private final Map<String, SessionContext> sessions = new ConcurrentHashMap<>();

	/**
	 * Creates a session under a freshly generated id.
	 */
	public SessionContext create() {
		while (true) {
			SessionContext session = SessionContext.open(UUID.randomUUID().toString());
			if (sessions.putIfAbsent(session.sessionId(), session) == null) {
				logger.debug("Created session {}", session.sessionId());
				return session;
			}
		}
	}

	/**
	 * Returns the session with the given id, creating it if this process has not seen it yet.
	 * Used when the form system hands back a session it opened on its own.
	 *
	 * @throws ValidationException if {@code sessionId} is blank
	 */
	public SessionContext register(String sessionId) {
		if (sessionId == null || sessionId.isBlank()) {
			throw new ValidationException("sessionId must be a non-empty string", "sessionId");
		}
		return sessions.computeIfAbsent(sessionId, id -> {
			logger.debug("Registered session {}", id);
			return SessionContext.open(id);
		});
	}

	public Optional<SessionContext> get(String sessionId) {
		if (sessionId == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(sessions.get(sessionId));
	}

	public boolean exists(String sessionId) {
		return get(sessionId).isPresent();
	}

	/**
	 * Records that a page was opened, registering its session if needed. Recording the same
	 * page twice is a no-op.
	 */
	public SessionContext recordOpenPage(PageContextId page) {
		return sessions.compute(page.sessionId(), (id, existing) -> {
			SessionContext session = existing != null ? existing : SessionContext.open(id);
			if (session.hasOpenPage(page)) {
				return session;
			}
			logger.debug("Session {} opened page {}", id, page.pageId());
			return session.withOpenPage(page);
		});
	}

	/**
	 * @return {@code true} if a session was removed
	 */
	public boolean close(String sessionId) {
		if (sessionId == null || sessions.remove(sessionId) == null) {
			logger.debug("Session {} not found for close", sessionId);
			return false;
		}
		logger.debug("Closed session {}", sessionId);
		return true;
	}

	public List<SessionContext> snapshot() {
		return List.copyOf(sessions.values());
	}

	public int size() {
		return sessions.size();
	}
}
