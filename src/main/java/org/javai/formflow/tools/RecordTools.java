package org.javai.formflow.tools;

import java.util.Map;
import java.util.Objects;
import org.javai.formflow.record.CreateRecordPipeline;
import org.javai.formflow.record.CreateRecordRequest;
import org.javai.formflow.record.UpdateRecordPipeline;
import org.javai.formflow.record.UpdateRecordRequest;
import org.javai.formflow.workflow.WorkflowOperations;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;

/**
 * Tool surface over the record pipelines and workflow operations.
 *
 * <p>Every method returns JSON. Failures come back as an {@code error} object rather
 * than an exception, so a calling model always receives something it can act on.</p>
 */
public class RecordTools {

	private final CreateRecordPipeline createPipeline;
	private final UpdateRecordPipeline updatePipeline;
	private final WorkflowOperations workflowOperations;
	private final ToolResponseWriter responses;

	public RecordTools(CreateRecordPipeline createPipeline, UpdateRecordPipeline updatePipeline,
			WorkflowOperations workflowOperations, ToolResponseWriter responses) {
		this.createPipeline = Objects.requireNonNull(createPipeline, "createPipeline must not be null");
		this.updatePipeline = Objects.requireNonNull(updatePipeline, "updatePipeline must not be null");
		this.workflowOperations = Objects.requireNonNull(workflowOperations, "workflowOperations must not be null");
		this.responses = Objects.requireNonNull(responses, "responses must not be null");
	}

	@Tool(name = "create_record", description = """
			Create a new record on a page in one call: opens the page, runs the New action
			and writes the given fields.
			Returns: success, pageContextId, pageId, record, saved, setFields, failedFields, message.""")
	public String createRecord(
			@ToolParam(description = "The page id, e.g. \"21\" for the customer card") String pageId,
			@ToolParam(description = "Field values for the new record, keyed by field name") Map<String, Object> fields,
			@ToolParam(description = "Workflow to record this call in", required = false) String workflowId) {
		return responses.write(createPipeline.execute(new CreateRecordRequest(pageId, fields, workflowId)));
	}

	@Tool(name = "update_record", description = """
			Update an existing record in one call: opens the page, runs Edit (unless autoEdit=false),
			writes the fields and runs Save after a successful write (unless save=false).
			Edit and Save failures do not fail the call; only the field write decides success.
			Returns: success, pageContextId, pageId, record, saved, updatedFields, failedFields, message.""")
	public String updateRecord(
			@ToolParam(description = "The page id holding the record") String pageId,
			@ToolParam(description = "Field values to update, keyed by field name") Map<String, Object> fields,
			@ToolParam(description = "Run the Edit action first (default true)", required = false) Boolean autoEdit,
			@ToolParam(description = "Run the Save action after writing (default true)", required = false) Boolean save,
			@ToolParam(description = "Stop at the first field that fails (default true)", required = false) Boolean stopOnError,
			@ToolParam(description = "Workflow to record this call in", required = false) String workflowId) {
		return responses.write(updatePipeline.execute(
				new UpdateRecordRequest(pageId, fields, autoEdit, save, stopOnError, workflowId)));
	}

	@Tool(name = "start_workflow", description = """
			Start tracking a multi-step business process. Returns a workflowId and the sessionId
			it is linked to; a new session is created when none is given.""")
	public String startWorkflow(
			@ToolParam(description = "What the workflow is for, e.g. \"create_sales_invoice\"") String goal,
			@ToolParam(description = "Workflow inputs such as customer number or amounts", required = false) Map<String, Object> parameters,
			@ToolParam(description = "Existing session to link to", required = false) String sessionId) {
		return responses.write(workflowOperations.startWorkflow(goal, parameters, sessionId));
	}

	@Tool(name = "get_workflow_state", description = """
			Get the current state of a workflow: status, operation history and errors.""")
	public String getWorkflowState(
			@ToolParam(description = "The workflow id") String workflowId) {
		return responses.write(workflowOperations.getWorkflowState(workflowId));
	}

	@Tool(name = "end_workflow", description = """
			End a workflow as completed or failed. The workflow is kept for inspection.""")
	public String endWorkflow(
			@ToolParam(description = "The workflow id") String workflowId,
			@ToolParam(description = "Final status: completed or failed") String status,
			@ToolParam(description = "Completion or failure message", required = false) String message) {
		return responses.write(workflowOperations.endWorkflow(workflowId, status, message));
	}
}
