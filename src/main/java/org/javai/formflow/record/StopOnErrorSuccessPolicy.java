package org.javai.formflow.record;

import java.util.Collection;
import java.util.List;

/**
 * How the update pipeline reads the writer's success flag when the write stopped on
 * the first error. Writers differ on whether success under that policy speaks for the
 * fields actually attempted or for the whole requested set.
 */
public enum StopOnErrorSuccessPolicy {

	/**
	 * Trust the writer: success reflects only the fields it attempted.
	 */
	ATTEMPTED_FIELDS {
		@Override
		boolean isSuccess(boolean writerSuccess, List<String> updatedFields, Collection<String> requestedFields) {
			return writerSuccess;
		}
	},

	/**
	 * Success additionally requires every requested field to have been updated.
	 */
	REQUESTED_FIELDS {
		@Override
		boolean isSuccess(boolean writerSuccess, List<String> updatedFields, Collection<String> requestedFields) {
			return writerSuccess && updatedFields.containsAll(requestedFields);
		}
	};

	/**
	 * @param writerSuccess the success flag the writer reported
	 * @param updatedFields the fields known to be updated; never {@code null}
	 */
	abstract boolean isSuccess(boolean writerSuccess, List<String> updatedFields, Collection<String> requestedFields);
}
