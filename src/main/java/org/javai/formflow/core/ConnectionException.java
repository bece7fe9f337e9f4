package org.javai.formflow.core;

import java.util.Map;

/**
 * Raised by collaborators when the form system cannot be reached.
 */
public class ConnectionException extends FormFlowException {

	public static final String CODE = "CONNECTION_ERROR";

	public ConnectionException(String message) {
		this(message, Map.of(), null);
	}

	public ConnectionException(String message, Map<String, Object> context, Throwable cause) {
		super(message, CODE, context, cause);
	}
}
