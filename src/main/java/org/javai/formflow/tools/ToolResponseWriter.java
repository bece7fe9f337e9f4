package org.javai.formflow.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.javai.formflow.core.FormFlowException;
import org.javai.formflow.core.OperationResult;
import org.javai.formflow.core.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders operation results as the JSON handed back to tool callers.
 *
 * <p>A success renders its payload. A failure renders
 * {@code {"error": {"code", "type", "message", "step", "field", "context"}}}.</p>
 */
public class ToolResponseWriter {

	private static final Logger logger = LoggerFactory.getLogger(ToolResponseWriter.class);

	private final ObjectMapper mapper;

	public ToolResponseWriter() {
		this.mapper = new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
	}

	public String write(OperationResult<?> result) {
		if (result instanceof OperationResult.Success<?> success) {
			try {
				return mapper.writeValueAsString(success.payload());
			}
			catch (JsonProcessingException e) {
				logger.error("Failed to render tool result", e);
				return errorJson("serialize", "RENDER_ERROR", "ToolResponseWriter",
						"Failed to render result: " + e.getOriginalMessage(), null, false, null);
			}
		}
		OperationResult.Failure<?> failure = (OperationResult.Failure<?>) result;
		FormFlowException error = failure.cause();
		String field = error instanceof ValidationException validation ? validation.field() : null;
		return errorJson(failure.step(), error.code(), error.getClass().getSimpleName(), error.getMessage(),
				field, true, error);
	}

	private String errorJson(String step, String code, String type, String message, String field,
			boolean includeContext, FormFlowException error) {
		ObjectNode root = mapper.createObjectNode();
		ObjectNode body = root.putObject("error");
		body.put("code", code);
		body.put("type", type);
		body.put("message", message);
		body.put("step", step);
		if (field != null) {
			body.put("field", field);
		}
		if (includeContext && error != null && !error.context().isEmpty()) {
			try {
				body.set("context", mapper.valueToTree(error.context()));
			}
			catch (IllegalArgumentException e) {
				body.put("context", error.context().toString());
			}
		}
		return root.toString();
	}
}
