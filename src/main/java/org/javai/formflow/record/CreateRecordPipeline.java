package org.javai.formflow.record;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
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
 * Creates a record in one call: open the page, run New, write the fields.
 *
 * <p>Every step is fatal. A failure raised by a collaborator is returned as is, tagged
 * with the step that raised it; anything else is wrapped in a {@link ProtocolException}.</p>
 */
public class CreateRecordPipeline {

	private static final Logger logger = LoggerFactory.getLogger(CreateRecordPipeline.class);

	public static final String TOOL_NAME = "create_record";

	static final String STEP_VALIDATE = "validate";
	static final String STEP_RESOLVE = "resolvePage";
	static final String STEP_NEW = "newAction";
	static final String STEP_WRITE = "writeFields";

	private final PageResolver resolver;
	private final ActionExecutor actions;
	private final FieldWriter writer;
	private final SessionRegistry sessions;
	private final WorkflowHistoryRecorder history;

	public CreateRecordPipeline(PageResolver resolver, ActionExecutor actions, FieldWriter writer,
			SessionRegistry sessions, WorkflowHistoryRecorder history) {
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
		this.actions = Objects.requireNonNull(actions, "actions must not be null");
		this.writer = Objects.requireNonNull(writer, "writer must not be null");
		this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
		this.history = Objects.requireNonNull(history, "history must not be null");
	}

	public OperationResult<CreateRecordResult> execute(CreateRecordRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		String pageId;
		Map<String, Object> fields;
		try {
			pageId = RecordRequests.pageId(request.pageId());
			fields = RecordRequests.fields(request.fields(), pageId, "No fields provided for new record");
		}
		catch (ValidationException e) {
			return OperationResult.failure(STEP_VALIDATE, e);
		}

		OperationResult<CreateRecordResult> result = run(pageId, fields);

		Map<String, Object> parameters = new LinkedHashMap<>();
		parameters.put("pageId", pageId);
		parameters.put("fields", fields);
		history.record(request.workflowId(), TOOL_NAME, parameters, result);
		return result;
	}

	private OperationResult<CreateRecordResult> run(String pageId, Map<String, Object> fields) {
		logger.info("Creating new record on page {}", pageId);
		String step = STEP_RESOLVE;
		try {
			PageContextId page = resolver.resolve(pageId);
			if (page == null) {
				throw new ProtocolException("Page resolver returned no page context", Map.of("pageId", pageId));
			}
			sessions.recordOpenPage(page);
			String sessionId = page.sessionId();
			logger.info("Page {} opened, session {}", pageId, sessionId);

			step = STEP_NEW;
			actions.execute(new ActionRequest(pageId, sessionId, ActionName.NEW));
			logger.info("New record started on page {}", pageId);

			step = STEP_WRITE;
			logger.info("Setting {} field(s) on page {}", fields.size(), pageId);
			FieldWriteResult written = writer.write(
					FieldWriteRequest.forPage(pageId, sessionId, RecordRequests.toFieldValues(fields)));
			if (written == null) {
				throw new ProtocolException("Field writer returned no result", Map.of("pageId", pageId));
			}
			List<String> setFields = RecordRequests.updatedFields(written, fields.keySet(), true);
			logger.info("Fields written on page {} (success={})", pageId, written.success());

			return OperationResult.success(new CreateRecordResult(
					written.success(),
					written.pageContextId() != null ? written.pageContextId() : page,
					pageId,
					written.record(),
					written.saved(),
					setFields,
					written.failedFields(),
					written.success()
							? "Successfully created new record on page " + pageId + " with " + setFields.size() + " field(s)"
							: "New record on page " + pageId + " incomplete: " + setFields.size() + " field(s) set, "
									+ written.failedFields().size() + " failed"));
		}
		catch (FormFlowException e) {
			logger.warn("Create record on page {} failed at {}: {}", pageId, step, e.getMessage());
			return OperationResult.failure(step, e);
		}
		catch (RuntimeException e) {
			logger.error("Unexpected failure creating record on page {} at {}", pageId, step, e);
			String message = String.valueOf(e.getMessage());
			return OperationResult.failure(step, new ProtocolException("Failed to create record: " + message,
					RecordRequests.errorContext(pageId, fields, message), e));
		}
	}
}
