package org.javai.formflow.workflow;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.javai.formflow.core.ValidationException;
import org.javai.formflow.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory store of workflow contexts.
 *
 * <h2>Thread Safety</h2>
 * <p>Every mutation goes through {@link ConcurrentHashMap#compute}, so changes to one
 * workflow are applied one at a time in arrival order while different workflows are
 * updated independently. Readers always see a complete, immutable {@link WorkflowContext}.</p>
 */
public class WorkflowRegistry {

	private static final Logger logger = LoggerFactory.getLogger(WorkflowRegistry.class);

	private final Map<String, WorkflowContext> workflows = new ConcurrentHashMap<>();
	private final SessionRegistry sessions;

	public WorkflowRegistry(SessionRegistry sessions) {
		this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
	}

	/**
	 * Creates a workflow in status {@link WorkflowStatus#CREATED} with an empty history.
	 *
	 * @throws ValidationException if the goal is blank or the session is unknown
	 */
	public WorkflowContext create(CreateWorkflowRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		if (request.goal() == null || request.goal().isBlank()) {
			throw new ValidationException("goal must be a non-empty string", "goal");
		}
		if (request.sessionId() == null || request.sessionId().isBlank()) {
			throw new ValidationException("sessionId is required", "sessionId");
		}
		if (!sessions.exists(request.sessionId())) {
			throw new ValidationException("Session not found: " + request.sessionId(), "sessionId",
					Map.of("sessionId", request.sessionId()));
		}

		while (true) {
			Instant now = Instant.now();
			WorkflowContext workflow = new WorkflowContext(UUID.randomUUID().toString(), request.sessionId(),
					request.goal(), request.parameters(), WorkflowStatus.CREATED, now, now, List.of(), List.of());
			if (workflows.putIfAbsent(workflow.workflowId(), workflow) == null) {
				logger.debug("Created workflow {} (goal={}, session={})",
						workflow.workflowId(), workflow.goal(), workflow.sessionId());
				return workflow;
			}
		}
	}

	public Optional<WorkflowContext> get(String workflowId) {
		if (workflowId == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(workflows.get(workflowId));
	}

	/**
	 * Appends an entry to the workflow's history. The first entry moves the workflow to
	 * {@link WorkflowStatus#IN_PROGRESS}.
	 *
	 * @throws ValidationException if the workflow is unknown or already terminated
	 */
	public WorkflowContext appendHistory(String workflowId, WorkflowOperation operation) {
		Objects.requireNonNull(operation, "operation must not be null");
		WorkflowContext updated = mutate(workflowId, existing -> {
			requireActive(existing);
			return existing.withOperation(operation);
		});
		logger.debug("Recorded {} in workflow {} (success={})", operation.tool(), workflowId, operation.success());
		return updated;
	}

	/**
	 * @throws ValidationException if the workflow is unknown or already terminated
	 */
	public WorkflowContext complete(String workflowId) {
		WorkflowContext updated = mutate(workflowId, existing -> {
			requireActive(existing);
			return existing.withStatus(WorkflowStatus.COMPLETED, null);
		});
		logger.debug("Completed workflow {}", workflowId);
		return updated;
	}

	/**
	 * Marks the workflow failed and appends {@code error} to its error list.
	 *
	 * @throws ValidationException if the workflow is unknown or already terminated
	 */
	public WorkflowContext fail(String workflowId, String error) {
		Objects.requireNonNull(error, "error must not be null");
		WorkflowContext updated = mutate(workflowId, existing -> {
			requireActive(existing);
			return existing.withStatus(WorkflowStatus.FAILED, error);
		});
		logger.warn("Workflow {} failed: {}", workflowId, error);
		return updated;
	}

	public List<WorkflowContext> findBySession(String sessionId) {
		return workflows.values().stream()
				.filter(w -> w.sessionId().equals(sessionId))
				.toList();
	}

	public List<WorkflowContext> active() {
		return workflows.values().stream()
				.filter(w -> !w.status().isTerminal())
				.toList();
	}

	/**
	 * Explicit cleanup; nothing else ever removes a workflow.
	 *
	 * @return {@code true} if a workflow was removed
	 */
	public boolean remove(String workflowId) {
		if (workflowId == null || workflows.remove(workflowId) == null) {
			logger.debug("Workflow {} not found for removal", workflowId);
			return false;
		}
		logger.debug("Removed workflow {}", workflowId);
		return true;
	}

	public int size() {
		return workflows.size();
	}

	private WorkflowContext mutate(String workflowId, UnaryOperator<WorkflowContext> change) {
		if (workflowId == null || workflowId.isBlank()) {
			throw new ValidationException("workflowId must be a non-empty string", "workflowId");
		}
		WorkflowContext updated = workflows.computeIfPresent(workflowId, (id, existing) -> change.apply(existing));
		if (updated == null) {
			throw new ValidationException("Workflow not found: " + workflowId, "workflowId",
					Map.of("workflowId", workflowId));
		}
		return updated;
	}

	private static void requireActive(WorkflowContext workflow) {
		if (workflow.status().isTerminal()) {
			throw new ValidationException("Workflow already terminated with status: " + workflow.status(),
					"workflowId", Map.of("workflowId", workflow.workflowId()));
		}
	}
}
