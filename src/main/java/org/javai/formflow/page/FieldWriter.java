package org.javai.formflow.page;

/**
 * Applies a set of field values to an open record.
 *
 * <p>Two policies are supported through {@link FieldWriteRequest#stopOnError()}:</p>
 * <ul>
 *   <li>{@code true}: stop at the first failing field. Fields after it are reported in
 *   neither {@code updatedFields} nor {@code failedFields}.</li>
 *   <li>{@code false}: attempt every field. {@code updatedFields} and {@code failedFields}
 *   partition the requested set and success is true iff nothing failed.</li>
 * </ul>
 *
 * <p>A failure of the write as a whole (as opposed to a single field) is thrown as a
 * {@link org.javai.formflow.core.FormFlowException} subclass.</p>
 *
 * @see AbstractFieldWriter
 */
@FunctionalInterface
public interface FieldWriter {

	FieldWriteResult write(FieldWriteRequest request);
}
