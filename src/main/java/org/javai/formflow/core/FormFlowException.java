package org.javai.formflow.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for every failure surfaced by the record pipelines, the registries
 * and the form-system collaborators.
 *
 * <p>Each subclass carries a stable {@link #code()} so callers can tell failures
 * apart without inspecting the message, plus an immutable context map describing
 * the inputs that were in play when the failure occurred.</p>
 */
public abstract class FormFlowException extends RuntimeException {

	private final String code;
	private final Map<String, Object> context;
	private final Instant timestamp;

	protected FormFlowException(String message, String code, Map<String, Object> context) {
		this(message, code, context, null);
	}

	protected FormFlowException(String message, String code, Map<String, Object> context, Throwable cause) {
		super(message, cause);
		this.code = code;
		this.context = context != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(context))
				: Map.of();
		this.timestamp = Instant.now();
	}

	public String code() {
		return code;
	}

	public Map<String, Object> context() {
		return context;
	}

	public Instant timestamp() {
		return timestamp;
	}

	@Override
	public String toString() {
		String contextText = context.isEmpty() ? "" : " | Context: " + context;
		return "[" + code + "] " + getClass().getSimpleName() + ": " + getMessage() + contextText;
	}
}
