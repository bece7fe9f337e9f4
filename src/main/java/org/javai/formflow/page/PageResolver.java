package org.javai.formflow.page;

/**
 * Opens or locates a page in the form system.
 *
 * <p>Implementations signal failure by throwing a
 * {@link org.javai.formflow.core.FormFlowException} subclass.</p>
 */
@FunctionalInterface
public interface PageResolver {

	/**
	 * @param pageId the page to open
	 * @return the context of the opened page; its session is the one the page lives in
	 */
	PageContextId resolve(String pageId);
}
