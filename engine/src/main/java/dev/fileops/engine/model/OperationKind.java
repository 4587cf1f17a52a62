package dev.fileops.engine.model;

/**
 * Kinds of mutation the engine executes and records.
 */
public enum OperationKind {

	COPY("copy", "Copied"),

	MOVE("move", "Moved"),

	DELETE("delete", "Deleted"),

	RENAME("rename", "Renamed"),

	CREATE_FILE("create_file", "Created file"),

	CREATE_DIRECTORY("create_directory", "Created directory"),

	DUPLICATE("duplicate", "Duplicated");

	private final String id;

	private final String verb;

	OperationKind(String id, String verb) {
		this.id = id;
		this.verb = verb;
	}

	/**
	 * Stable lower-case identifier used in notifications and structured output.
	 * @return identifier such as {@code create_file}
	 */
	public String id() {
		return this.id;
	}

	/**
	 * Past-tense verb used when deriving operation descriptions.
	 * @return verb phrase
	 */
	public String verb() {
		return this.verb;
	}

}
