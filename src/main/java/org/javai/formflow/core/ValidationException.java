package org.javai.formflow.core;

import java.util.Map;

/**
 * Raised for malformed or missing input before any call reaches the form system.
 */
public class ValidationException extends FormFlowException {

	public static final String CODE = "VALIDATION_ERROR";

	private final String field;

	public ValidationException(String message) {
		this(message, null, Map.of());
	}

	public ValidationException(String message, String field) {
		this(message, field, Map.of());
	}

	public ValidationException(String message, String field, Map<String, Object> context) {
		super(message, CODE, context);
		this.field = field;
	}

	/**
	 * @return the offending input field, or {@code null} when the failure is not tied to one
	 */
	public String field() {
		return field;
	}
}
