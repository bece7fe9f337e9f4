package org.javai.formflow.record;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.formflow.config.FormFlowConfig;
import org.javai.formflow.core.FormFlowException;
import org.javai.formflow.core.OperationResult;
import org.javai.formflow.core.ProtocolException;
import org.javai.formflow.core.ValidationException;
import org.javai.formflow.page.ActionExecutor;
import org.javai.formflow.page.ActionName;
import org.javai.formflow.page.ActionRequest;
import org.javai.formflow.page.FieldWriteRequest;
import org.javai.formflow.page.FieldWriteResult;
import org.javai.formflow.page.FieldWriter;
import org.javai.formflow.page.PageContextId;
import org.javai.formflow.page.PageResolver;
import org.javai.formflow.session.SessionRegistry;
import org.javai.formflow.workflow.WorkflowHistoryRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Updates a record in one call: open the page, optionally run Edit, write the fields,
 * optionally run Save.
 *
 * <p>Only page resolution and the field write are fatal. Whether Edit is needed, and
 * whether Save is available, cannot be known up front, so their failures are logged and
 * the call carries on. The returned success is decided by the write alone; Save only
 * runs after a successful write and only affects {@code saved}.</p>
 */
public class UpdateRecordPipeline {

	private static final Logger logger = LoggerFactory.getLogger(UpdateRecordPipeline.class);

	public static final String TOOL_NAME = "update_record";

	static final String STEP_VALIDATE = "validate";
	static final String STEP_RESOLVE = "resolvePage";
	static final String STEP_WRITE = "writeFields";

	private final PageResolver resolver;
	private final ActionExecutor actions;
	private final FieldWriter writer;
	private final SessionRegistry sessions;
	private final WorkflowHistoryRecorder history;
	private final StopOnErrorSuccessPolicy successPolicy;

	public UpdateRecordPipeline(PageResolver resolver, ActionExecutor actions, FieldWriter writer,
			SessionRegistry sessions, WorkflowHistoryRecorder history, FormFlowConfig config) {
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
		this.actions = Objects.requireNonNull(actions, "actions must not be null");
		this.writer = Objects.requireNonNull(writer, "writer must not be null");
		this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
		this.history = Objects.requireNonNull(history, "history must not be null");
		this.successPolicy = (config != null ? config : FormFlowConfig.defaults()).stopOnErrorSuccessPolicy();
	}

	public OperationResult<UpdateRecordResult> execute(UpdateRecordRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		String pageId;
		Map<String, Object> fields;
		try {
			pageId = RecordRequests.pageId(request.pageId());
			fields = RecordRequests.fields(request.fields(), pageId, "No fields provided to update");
		}
		catch (ValidationException e) {
			return OperationResult.failure(STEP_VALIDATE, e);
		}

		OperationResult<UpdateRecordResult> result = run(pageId, fields, request);

		Map<String, Object> parameters = new LinkedHashMap<>();
		parameters.put("pageId", pageId);
		parameters.put("fields", fields);
		parameters.put("autoEdit", request.autoEditEnabled());
		parameters.put("save", request.saveEnabled());
		parameters.put("stopOnError", request.stopOnErrorEnabled());
		history.record(request.workflowId(), TOOL_NAME, parameters, result);
		return result;
	}

	private OperationResult<UpdateRecordResult> run(String pageId, Map<String, Object> fields,
			UpdateRecordRequest request) {
		boolean autoEdit = request.autoEditEnabled();
		boolean save = request.saveEnabled();
		boolean stopOnError = request.stopOnErrorEnabled();
		logger.info("Updating record on page {} (autoEdit={}, save={}, stopOnError={})",
				pageId, autoEdit, save, stopOnError);

		String step = STEP_RESOLVE;
		try {
			PageContextId page = resolver.resolve(pageId);
			if (page == null) {
				throw new ProtocolException("Page resolver returned no page context", Map.of("pageId", pageId));
			}
			sessions.recordOpenPage(page);
			logger.info("Page opened with context {}", page);

			if (autoEdit) {
				tryAction(pageId, ActionName.EDIT);
			}

			step = STEP_WRITE;
			FieldWriteResult written = writer.write(
					FieldWriteRequest.forContext(page, RecordRequests.toFieldValues(fields), stopOnError, true));
			if (written == null) {
				throw new ProtocolException("Field writer returned no result", Map.of("pageId", pageId));
			}
			List<String> updated = RecordRequests.updatedFields(written, fields.keySet(), stopOnError);
			boolean success = stopOnError
					? successPolicy.isSuccess(written.success(), updated, fields.keySet())
					: written.success();
			logger.info("Fields updated on page {}: {} succeeded, {} failed",
					pageId, updated.size(), written.failedFields().size());

			boolean saved = false;
			if (save && success) {
				saved = tryAction(pageId, ActionName.SAVE);
			}

			return OperationResult.success(new UpdateRecordResult(
					success,
					written.pageContextId() != null ? written.pageContextId() : page,
					pageId,
					written.record(),
					saved,
					updated,
					written.failedFields(),
					message(pageId, success, saved, updated.size(), written.failedFields().size())));
		}
		catch (FormFlowException e) {
			logger.warn("Update record on page {} failed at {}: {}", pageId, step, e.getMessage());
			return OperationResult.failure(step, e);
		}
		catch (RuntimeException e) {
			logger.error("Unexpected failure updating record on page {} at {}", pageId, step, e);
			String message = String.valueOf(e.getMessage());
			return OperationResult.failure(step, new ProtocolException("Failed to update record: " + message,
					RecordRequests.errorContext(pageId, fields, message), e));
		}
	}

	private static String message(String pageId, boolean success, boolean saved, int updated, int failed) {
		if (success) {
			return "Successfully updated " + updated + " field(s) on page " + pageId + (saved ? " (saved)" : "");
		}
		return "Update on page " + pageId + " incomplete: " + updated + " field(s) updated, " + failed + " failed";
	}

	/**
	 * Runs a non-fatal action.
	 *
	 * @return whether the action succeeded
	 */
	private boolean tryAction(String pageId, ActionName action) {
		try {
			actions.execute(new ActionRequest(pageId, null, action));
			logger.info("{} action succeeded on page {}", action.caption(), pageId);
			return true;
		}
		catch (RuntimeException e) {
			logger.warn("{} action failed on page {}, continuing: {}", action.caption(), pageId, e.getMessage());
			return false;
		}
	}
}
