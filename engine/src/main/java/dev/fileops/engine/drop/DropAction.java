package dev.fileops.engine.drop;

/**
 * Drop actions, as requested by the caller and as resolved.
 */
public enum DropAction {

	/** Infer copy or move from the volumes involved. Request only. */
	AUTO,

	COPY,

	MOVE,

	/** Carried out as a copy. */
	LINK,

	/** Nothing to do. Resolution only. */
	NONE

}
