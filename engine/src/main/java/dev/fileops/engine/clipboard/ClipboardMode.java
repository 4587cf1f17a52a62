package dev.fileops.engine.clipboard;

/**
 * Pending clipboard action. A copy can be pasted repeatedly; a cut is consumed by one paste.
 */
public enum ClipboardMode {

	COPY, CUT, EMPTY

}
