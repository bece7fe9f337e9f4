package org.javai.formflow.workflow;

import java.util.Map;

/**
 * @param sessionId the session to attach to; must already be known to the session registry
 * @param goal non-blank name of the workflow
 * @param parameters optional opaque inputs
 */
public record CreateWorkflowRequest(String sessionId, String goal, Map<String, Object> parameters) {
}
