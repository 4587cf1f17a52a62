package dev.fileops.engine.clipboard;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Snapshot of the clipboard.
 * @param mode pending action
 * @param paths unique selected paths in selection order, empty when the mode is {@link ClipboardMode#EMPTY}
 */
public record ClipboardContents(ClipboardMode mode, Set<Path> paths) {

	public static final ClipboardContents EMPTY = new ClipboardContents(ClipboardMode.EMPTY, Set.of());

	public ClipboardContents {
		paths = Collections.unmodifiableSet(new LinkedHashSet<>(paths));
	}

	public boolean isEmpty() {
		return this.mode == ClipboardMode.EMPTY || this.paths.isEmpty();
	}

}
