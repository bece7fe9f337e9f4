package org.javai.formflow.record;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.formflow.core.ValidationException;
import org.javai.formflow.page.FieldFailure;
import org.javai.formflow.page.FieldValue;
import org.javai.formflow.page.FieldWriteResult;

/**
 * Helpers shared by the record pipelines: input checks that run before the form
 * system is contacted, and reading of the writer's result.
 */
final class RecordRequests {

	private RecordRequests() {
	}

	/**
	 * Accepts a non-blank string or a number and returns the page id as a string.
	 */
	static String pageId(Object pageId) {
		if (pageId instanceof String text) {
			if (text.isBlank()) {
				throw new ValidationException("pageId must be a non-empty string or a number", "pageId");
			}
			return text;
		}
		if (pageId instanceof Number number) {
			return numberText(number);
		}
		if (pageId == null) {
			throw new ValidationException("pageId is required", "pageId");
		}
		throw new ValidationException("pageId must be a string or a number, got " + pageId.getClass().getSimpleName(),
				"pageId");
	}

	static Map<String, Object> fields(Map<String, Object> fields, String pageId, String emptyMessage) {
		if (fields == null || fields.isEmpty()) {
			throw new ValidationException(emptyMessage, "fields", Map.of("pageId", pageId));
		}
		return fields;
	}

	static Map<String, FieldValue> toFieldValues(Map<String, Object> fields) {
		Map<String, FieldValue> values = new LinkedHashMap<>();
		fields.forEach((name, value) -> values.put(name, FieldValue.of(value)));
		return values;
	}

	static Map<String, Object> errorContext(String pageId, Map<String, Object> fields, String error) {
		Map<String, Object> context = new LinkedHashMap<>();
		context.put("pageId", pageId);
		context.put("fields", fields);
		context.put("error", error);
		return context;
	}

	/**
	 * The writer's list of updated fields, or when it reports none, the requested fields that
	 * did not fail. Under stopOnError nothing after the first failed field counts as updated.
	 */
	static List<String> updatedFields(FieldWriteResult written, Collection<String> requested, boolean stopOnError) {
		if (written.updatedFields() != null) {
			return written.updatedFields();
		}
		Set<String> failed = new HashSet<>();
		for (FieldFailure failure : written.failedFields()) {
			failed.add(failure.field());
		}
		List<String> updated = new ArrayList<>();
		for (String field : requested) {
			if (failed.contains(field)) {
				if (stopOnError) {
					break;
				}
				continue;
			}
			updated.add(field);
		}
		return updated;
	}

	private static String numberText(Number number) {
		if (number instanceof Double || number instanceof Float) {
			double value = number.doubleValue();
			if (Double.isNaN(value) || Double.isInfinite(value)) {
				throw new ValidationException("pageId must be a finite number", "pageId");
			}
			return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
		}
		if (number instanceof BigDecimal decimal) {
			return decimal.stripTrailingZeros().toPlainString();
		}
		return number.toString();
	}
}
