package org.javai.formflow.page;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AbstractFieldWriterTest {

	private static final PageContextId PAGE = new PageContextId("s-1", "30", 5L);

	private final RecordingWriter writer = new RecordingWriter(Set.of("Unit Price"));

	private static Map<String, FieldValue> fields() {
		Map<String, FieldValue> fields = new LinkedHashMap<>();
		fields.put("Description", FieldValue.of("Bicycle"));
		fields.put("Unit Price", FieldValue.of(-4));
		fields.put("Base Unit of Measure", new FieldValue("PCS", "control:uom"));
		return fields;
	}

	@Test
	void stopOnErrorLeavesLaterFieldsUnreported() {
		FieldWriteResult result = writer.write(FieldWriteRequest.forContext(PAGE, fields(), true, true));

		assertThat(result.success()).isFalse();
		assertThat(result.updatedFields()).containsExactly("Description");
		assertThat(result.failedFields()).extracting(FieldFailure::field).containsExactly("Unit Price");
		assertThat(writer.attempted).containsExactly("Description", "Unit Price");
	}

	@Test
	void fullAttemptPartitionsEveryField() {
		FieldWriteResult result = writer.write(FieldWriteRequest.forContext(PAGE, fields(), false, true));

		assertThat(result.success()).isFalse();
		assertThat(result.updatedFields()).containsExactly("Description", "Base Unit of Measure");
		assertThat(result.failedFields()).extracting(FieldFailure::field).containsExactly("Unit Price");
		List<String> all = new ArrayList<>(result.updatedFields());
		result.failedFields().forEach(f -> all.add(f.field()));
		assertThat(all).containsExactlyInAnyOrderElementsOf(fields().keySet());
	}

	@Test
	void succeedsWhenNothingFails() {
		RecordingWriter lenient = new RecordingWriter(Set.of());

		FieldWriteResult result = lenient.write(FieldWriteRequest.forPage("30", "s-1", fields()));

		assertThat(result.success()).isTrue();
		assertThat(result.failedFields()).isEmpty();
		assertThat(result.pageContextId().pageId()).isEqualTo("30");
		assertThat(result.record()).containsEntry("Description", "Bicycle");
		assertThat(lenient.controlPaths).containsEntry("Base Unit of Measure", "control:uom");
	}

	private static final class RecordingWriter extends AbstractFieldWriter {
		private final Set<String> rejected;
		private final List<String> attempted = new ArrayList<>();
		private final Map<String, Object> values = new LinkedHashMap<>();
		private final Map<String, String> controlPaths = new LinkedHashMap<>();

		RecordingWriter(Set<String> rejected) {
			this.rejected = rejected;
		}

		@Override
		protected PageContextId openContext(FieldWriteRequest request) {
			return new PageContextId(request.sessionId(), request.pageId(), 9L);
		}

		@Override
		protected FieldFailure setField(PageContextId context, String fieldName, FieldValue value,
				boolean immediateValidation) {
			attempted.add(fieldName);
			if (rejected.contains(fieldName)) {
				return new FieldFailure(fieldName, "rejected");
			}
			values.put(fieldName, value.value());
			if (value.controlPath() != null) {
				controlPaths.put(fieldName, value.controlPath());
			}
			return null;
		}

		@Override
		protected Map<String, Object> snapshot(PageContextId context) {
			return values;
		}
	}
}
