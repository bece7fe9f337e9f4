package org.javai.formflow.page;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base {@link FieldWriter} implementing both error policies on top of a
 * single-field setter. Adapters for a concrete form system supply
 * {@link #openContext(FieldWriteRequest)}, {@link #setField} and
 * {@link #snapshot(PageContextId)}.
 */
public abstract class AbstractFieldWriter implements FieldWriter {

	private static final Logger logger = LoggerFactory.getLogger(AbstractFieldWriter.class);

	@Override
	public final FieldWriteResult write(FieldWriteRequest request) {
		PageContextId context = request.pageContextId() != null
				? request.pageContextId()
				: openContext(request);

		List<String> updated = new ArrayList<>();
		List<FieldFailure> failed = new ArrayList<>();

		for (Map.Entry<String, FieldValue> entry : request.fields().entrySet()) {
			String name = entry.getKey();
			FieldFailure failure = setField(context, name, entry.getValue(), request.immediateValidation());
			if (failure == null) {
				updated.add(name);
				continue;
			}
			failed.add(failure);
			logger.debug("Field '{}' failed on {}: {}", name, context, failure.error());
			if (request.stopOnError()) {
				break;
			}
		}

		return new FieldWriteResult(failed.isEmpty(), context, snapshot(context), false, updated, failed);
	}

	/**
	 * Locates the page addressed by {@code pageId}/{@code sessionId} when no context was supplied.
	 */
	protected abstract PageContextId openContext(FieldWriteRequest request);

	/**
	 * Sets one field.
	 *
	 * @return {@code null} on success, otherwise the failure to report for this field
	 */
	protected abstract FieldFailure setField(PageContextId context, String fieldName, FieldValue value,
			boolean immediateValidation);

	/**
	 * @return the current record values on the page, used as the result snapshot
	 */
	protected abstract Map<String, Object> snapshot(PageContextId context);
}
