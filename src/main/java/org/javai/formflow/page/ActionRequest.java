package org.javai.formflow.page;

import java.util.Objects;

/**
 * Request to run one action against an open page.
 *
 * @param pageId the page the action targets
 * @param sessionId the session to run in, or {@code null} to let the executor pick the page's current session
 * @param action the action to run
 */
public record ActionRequest(String pageId, String sessionId, ActionName action) {

	public ActionRequest {
		Objects.requireNonNull(pageId, "pageId must not be null");
		Objects.requireNonNull(action, "action must not be null");
	}
}
