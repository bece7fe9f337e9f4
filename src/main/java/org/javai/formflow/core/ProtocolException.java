package org.javai.formflow.core;

import java.util.Map;

/**
 * Failure of a fatal orchestration step, or an unexpected fault caught at a
 * pipeline boundary.
 */
public class ProtocolException extends FormFlowException {

	public static final String CODE = "PROTOCOL_ERROR";

	public ProtocolException(String message) {
		this(message, Map.of());
	}

	public ProtocolException(String message, Map<String, Object> context) {
		super(message, CODE, context);
	}

	public ProtocolException(String message, Map<String, Object> context, Throwable cause) {
		super(message, CODE, context, cause);
	}
}
