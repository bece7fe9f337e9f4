package org.javai.formflow.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of one exposed operation. Operations never throw past their boundary;
 * they return either the produced value or the failure together with the name of
 * the step that failed.
 *
 * @param <T> the success payload type
 */
public sealed interface OperationResult<T> {

	static <T> OperationResult<T> success(T value) {
		return new Success<>(value);
	}

	static <T> OperationResult<T> failure(String step, FormFlowException error) {
		return new Failure<>(step, error);
	}

	boolean isSuccess();

	/**
	 * @return the success payload
	 * @throws IllegalStateException if this is a failure
	 */
	default T value() {
		if (this instanceof Success<T> success) {
			return success.payload();
		}
		throw new IllegalStateException("Operation failed: " + ((Failure<T>) this).error().getMessage());
	}

	/**
	 * @return the failure
	 * @throws IllegalStateException if this is a success
	 */
	default FormFlowException error() {
		if (this instanceof Failure<T> failure) {
			return failure.cause();
		}
		throw new IllegalStateException("Operation succeeded; no error present");
	}

	default <R> OperationResult<R> map(Function<T, R> mapper) {
		if (this instanceof Success<T> success) {
			return new Success<>(mapper.apply(success.payload()));
		}
		Failure<T> failure = (Failure<T>) this;
		return new Failure<>(failure.step(), failure.cause());
	}

	record Success<T>(T payload) implements OperationResult<T> {
		@Override
		public boolean isSuccess() {
			return true;
		}
	}

	record Failure<T>(String step, FormFlowException cause) implements OperationResult<T> {
		public Failure {
			Objects.requireNonNull(step, "step must not be null");
			Objects.requireNonNull(cause, "cause must not be null");
		}

		@Override
		public boolean isSuccess() {
			return false;
		}
	}
}
