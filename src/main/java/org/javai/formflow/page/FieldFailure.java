package org.javai.formflow.page;

import java.util.Objects;

/**
 * A field the writer attempted and could not set.
 *
 * @param field the field name
 * @param error what went wrong
 * @param validationMessage the form system's validation text, if it produced one
 */
public record FieldFailure(String field, String error, String validationMessage) {

	public FieldFailure {
		Objects.requireNonNull(field, "field must not be null");
		Objects.requireNonNull(error, "error must not be null");
	}

	public FieldFailure(String field, String error) {
		this(field, error, null);
	}
}
