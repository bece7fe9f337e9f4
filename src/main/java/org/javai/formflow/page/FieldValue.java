package org.javai.formflow.page;

/**
 * One value to write, optionally pinned to a specific control.
 *
 * @param value the requested value
 * @param controlPath overrides the control the writer would otherwise locate by field name; may be {@code null}
 */
public record FieldValue(Object value, String controlPath) {

	public static FieldValue of(Object value) {
		return new FieldValue(value, null);
	}
}
