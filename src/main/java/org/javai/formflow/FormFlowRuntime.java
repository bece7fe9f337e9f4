package org.javai.formflow;

import java.util.Objects;
import org.javai.formflow.config.FormFlowConfig;
import org.javai.formflow.page.ActionExecutor;
import org.javai.formflow.page.FieldWriter;
import org.javai.formflow.page.PageResolver;
import org.javai.formflow.record.CreateRecordPipeline;
import org.javai.formflow.record.UpdateRecordPipeline;
import org.javai.formflow.session.SessionRegistry;
import org.javai.formflow.tools.RecordTools;
import org.javai.formflow.tools.ToolResponseWriter;
import org.javai.formflow.workflow.WorkflowHistoryRecorder;
import org.javai.formflow.workflow.WorkflowOperations;
import org.javai.formflow.workflow.WorkflowRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the registries, pipelines and tools around one set of form-system collaborators.
 *
 * <p>Build one runtime per process. It owns the only {@link SessionRegistry} and
 * {@link WorkflowRegistry}; everything else receives them by injection.</p>
 *
 * <pre>{@code
 * FormFlowRuntime runtime = FormFlowRuntime.builder()
 *         .resolver(resolver)
 *         .actionExecutor(actions)
 *         .fieldWriter(writer)
 *         .config(FormFlowConfig.fromClasspath())
 *         .build();
 * chatClient.prompt().tools(runtime.tools())...
 * }</pre>
 */
public final class FormFlowRuntime {

	private static final Logger logger = LoggerFactory.getLogger(FormFlowRuntime.class);

	private final FormFlowConfig config;
	private final SessionRegistry sessions;
	private final WorkflowRegistry workflows;
	private final CreateRecordPipeline createPipeline;
	private final UpdateRecordPipeline updatePipeline;
	private final WorkflowOperations workflowOperations;
	private final RecordTools tools;

	private FormFlowRuntime(Builder builder) {
		this.config = builder.config != null ? builder.config : FormFlowConfig.defaults();
		this.sessions = new SessionRegistry();
		this.workflows = new WorkflowRegistry(sessions);
		WorkflowHistoryRecorder history = new WorkflowHistoryRecorder(workflows, config.recordWorkflowHistory());
		this.createPipeline = new CreateRecordPipeline(builder.resolver, builder.actionExecutor, builder.fieldWriter,
				sessions, history);
		this.updatePipeline = new UpdateRecordPipeline(builder.resolver, builder.actionExecutor, builder.fieldWriter,
				sessions, history, config);
		this.workflowOperations = new WorkflowOperations(sessions, workflows);
		this.tools = new RecordTools(createPipeline, updatePipeline, workflowOperations, new ToolResponseWriter());
		logger.info("FormFlow runtime ready (stopOnErrorSuccessPolicy={}, recordWorkflowHistory={})",
				config.stopOnErrorSuccessPolicy(), config.recordWorkflowHistory());
	}

	public static Builder builder() {
		return new Builder();
	}

	public FormFlowConfig config() {
		return config;
	}

	public SessionRegistry sessions() {
		return sessions;
	}

	public WorkflowRegistry workflows() {
		return workflows;
	}

	public CreateRecordPipeline createPipeline() {
		return createPipeline;
	}

	public UpdateRecordPipeline updatePipeline() {
		return updatePipeline;
	}

	public WorkflowOperations workflowOperations() {
		return workflowOperations;
	}

	public RecordTools tools() {
		return tools;
	}

	public static final class Builder {
		private PageResolver resolver;
		private ActionExecutor actionExecutor;
		private FieldWriter fieldWriter;
		private FormFlowConfig config;

		private Builder() {}

		public Builder resolver(PageResolver resolver) {
			this.resolver = resolver;
			return this;
		}

		public Builder actionExecutor(ActionExecutor actionExecutor) {
			this.actionExecutor = actionExecutor;
			return this;
		}

		public Builder fieldWriter(FieldWriter fieldWriter) {
			this.fieldWriter = fieldWriter;
			return this;
		}

		public Builder config(FormFlowConfig config) {
			this.config = config;
			return this;
		}

		public FormFlowRuntime build() {
			Objects.requireNonNull(resolver, "resolver must not be null");
			Objects.requireNonNull(actionExecutor, "actionExecutor must not be null");
			Objects.requireNonNull(fieldWriter, "fieldWriter must not be null");
			return new FormFlowRuntime(this);
		}
	}
}
