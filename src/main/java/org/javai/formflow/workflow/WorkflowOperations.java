package org.javai.formflow.workflow;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.javai.formflow.core.FormFlowException;
import org.javai.formflow.core.OperationResult;
import org.javai.formflow.core.ProtocolException;
import org.javai.formflow.core.ValidationException;
import org.javai.formflow.session.SessionContext;
import org.javai.formflow.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts, inspects and ends workflows. Every method returns an {@link OperationResult};
 * none of them throws for bad input.
 */
public class WorkflowOperations {

	private static final Logger logger = LoggerFactory.getLogger(WorkflowOperations.class);

	static final String STEP_VALIDATE = "validate";
	static final String STEP_CREATE_SESSION = "createSession";
	static final String STEP_CREATE_WORKFLOW = "createWorkflow";
	static final String STEP_LOOKUP = "lookupWorkflow";
	static final String STEP_UPDATE = "updateWorkflow";

	private final SessionRegistry sessions;
	private final WorkflowRegistry workflows;

	public WorkflowOperations(SessionRegistry sessions, WorkflowRegistry workflows) {
		this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
		this.workflows = Objects.requireNonNull(workflows, "workflows must not be null");
	}

	/**
	 * Creates a workflow, attaching it to {@code sessionId} or, when that is {@code null},
	 * to a session created for it.
	 *
	 * @param goal non-blank workflow name
	 * @param parameters optional inputs
	 * @param sessionId optional existing session
	 */
	public OperationResult<StartWorkflowResult> startWorkflow(String goal, Map<String, Object> parameters,
			String sessionId) {
		logger.info("Starting workflow: {}", goal);
		if (goal == null || goal.isBlank()) {
			return OperationResult.failure(STEP_VALIDATE,
					new ValidationException("goal must be a non-empty string", "goal"));
		}
		if (sessionId != null && !sessions.exists(sessionId)) {
			return OperationResult.failure(STEP_VALIDATE,
					new ValidationException("Session not found: " + sessionId, "sessionId",
							Map.of("sessionId", sessionId)));
		}

		String step = STEP_CREATE_SESSION;
		try {
			String effectiveSessionId = sessionId;
			if (effectiveSessionId == null) {
				SessionContext session = sessions.create();
				effectiveSessionId = session.sessionId();
				logger.debug("Created session {} for workflow '{}'", effectiveSessionId, goal);
			}

			step = STEP_CREATE_WORKFLOW;
			WorkflowContext workflow = workflows.create(
					new CreateWorkflowRequest(effectiveSessionId, goal, parameters));
			logger.info("Workflow created: {}, session: {}, goal: {}",
					workflow.workflowId(), workflow.sessionId(), workflow.goal());

			return OperationResult.success(new StartWorkflowResult(
					workflow.workflowId(),
					workflow.sessionId(),
					workflow.goal(),
					workflow.status(),
					workflow.createdAt(),
					"Workflow started: " + workflow.goal()));
		}
		catch (FormFlowException e) {
			return OperationResult.failure(step, e);
		}
		catch (RuntimeException e) {
			logger.error("Failed to start workflow '{}'", goal, e);
			return OperationResult.failure(step, new ProtocolException("Failed to start workflow: " + e.getMessage(),
					Map.of("goal", goal, "error", String.valueOf(e.getMessage())), e));
		}
	}

	public OperationResult<WorkflowStateView> getWorkflowState(String workflowId) {
		if (workflowId == null || workflowId.isBlank()) {
			return OperationResult.failure(STEP_VALIDATE,
					new ValidationException("workflowId must be a non-empty string", "workflowId"));
		}
		return workflows.get(workflowId)
				.map(WorkflowStateView::of)
				.<OperationResult<WorkflowStateView>>map(OperationResult::success)
				.orElseGet(() -> OperationResult.failure(STEP_LOOKUP,
						new ValidationException("Workflow not found: " + workflowId, "workflowId")));
	}

	/**
	 * Moves a workflow to a terminal status.
	 *
	 * @param status {@code completed} or {@code failed}, case-insensitive
	 * @param message optional; for a failed workflow it becomes the recorded error
	 */
	public OperationResult<EndWorkflowResult> endWorkflow(String workflowId, String status, String message) {
		logger.info("Ending workflow {} with status {}", workflowId, status);
		if (workflowId == null || workflowId.isBlank()) {
			return OperationResult.failure(STEP_VALIDATE,
					new ValidationException("workflowId must be a non-empty string", "workflowId"));
		}
		WorkflowStatus target = parseTerminalStatus(status);
		if (target == null) {
			return OperationResult.failure(STEP_VALIDATE,
					new ValidationException("status must be completed or failed", "status"));
		}

		try {
			WorkflowContext updated = target == WorkflowStatus.COMPLETED
					? workflows.complete(workflowId)
					: workflows.fail(workflowId, message != null ? message : "Workflow failed");
			logger.info("Workflow ended: {}, status: {}, operations: {}, errors: {}",
					workflowId, updated.status(), updated.history().size(), updated.errors().size());
			return OperationResult.success(new EndWorkflowResult(
					updated.workflowId(),
					updated.goal(),
					updated.status(),
					updated.history().size(),
					updated.errors(),
					updated.updatedAt(),
					message != null ? message : "Workflow " + target.name().toLowerCase(Locale.ROOT)));
		}
		catch (FormFlowException e) {
			return OperationResult.failure(STEP_UPDATE, e);
		}
	}

	private static WorkflowStatus parseTerminalStatus(String status) {
		if (status == null) {
			return null;
		}
		return switch (status.trim().toLowerCase(Locale.ROOT)) {
			case "completed" -> WorkflowStatus.COMPLETED;
			case "failed" -> WorkflowStatus.FAILED;
			default -> null;
		};
	}
}
