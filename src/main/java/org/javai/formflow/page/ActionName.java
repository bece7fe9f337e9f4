package org.javai.formflow.page;

/**
 * Named commands the pipelines invoke on an open page.
 */
public enum ActionName {
	NEW("New"),
	EDIT("Edit"),
	SAVE("Save");

	private final String caption;

	ActionName(String caption) {
		this.caption = caption;
	}

	/**
	 * @return the caption the form system knows the action by
	 */
	public String caption() {
		return caption;
	}
}
