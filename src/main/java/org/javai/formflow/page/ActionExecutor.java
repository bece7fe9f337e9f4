package org.javai.formflow.page;

import java.util.Map;

/**
 * Invokes a named action on an open page. Failures are thrown as
 * {@link org.javai.formflow.core.FormFlowException} subclasses.
 */
@FunctionalInterface
public interface ActionExecutor {

	/**
	 * @return whatever the form system reported for the action; may be empty
	 */
	Map<String, Object> execute(ActionRequest request);
}
