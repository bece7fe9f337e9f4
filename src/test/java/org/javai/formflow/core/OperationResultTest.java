package org.javai.formflow.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OperationResultTest {

	@Test
	void successExposesValueAndMaps() {
		OperationResult<String> result = OperationResult.success("21");

		assertThat(result.isSuccess()).isTrue();
		assertThat(result.map(Integer::parseInt).value()).isEqualTo(21);
		assertThatThrownBy(result::error).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void failureKeepsStepAcrossMap() {
		ProtocolException cause = new ProtocolException("Page not found", Map.of("pageId", "99"));
		OperationResult<String> result = OperationResult.failure("resolvePage", cause);

		OperationResult<Integer> mapped = result.map(Integer::parseInt);

		assertThat(mapped.isSuccess()).isFalse();
		assertThat(mapped.error()).isSameAs(cause);
		assertThat(((OperationResult.Failure<Integer>) mapped).step()).isEqualTo("resolvePage");
		assertThatThrownBy(mapped::value)
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("Page not found");
	}

	@Test
	void exceptionsCarryCodeAndContext() {
		ValidationException validation = new ValidationException("pageId is required", "pageId");
		ConnectionException connection = new ConnectionException("Socket closed", Map.of("host", "bc"), null);

		assertThat(validation.code()).isEqualTo("VALIDATION_ERROR");
		assertThat(validation.field()).isEqualTo("pageId");
		assertThat(connection.code()).isEqualTo("CONNECTION_ERROR");
		assertThat(connection.context()).containsEntry("host", "bc");
		assertThat(connection.toString()).startsWith("[CONNECTION_ERROR] ConnectionException: Socket closed");
	}
}
