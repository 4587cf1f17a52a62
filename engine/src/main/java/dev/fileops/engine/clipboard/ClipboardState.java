package dev.fileops.engine.clipboard;

import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selection buffer consumed by paste. Holds paths only and never touches the filesystem.
 */
public class ClipboardState {

	private static final Logger logger = LoggerFactory.getLogger(ClipboardState.class);

	private ClipboardContents contents = ClipboardContents.EMPTY;

	/**
	 * Replace the clipboard wholesale.
	 * @param paths selected paths; duplicates collapse
	 * @param cut {@code true} for a cut, {@code false} for a copy
	 */
	public synchronized void set(Collection<Path> paths, boolean cut) {
		Set<Path> unique = new LinkedHashSet<>();
		for (Path path : paths) {
			unique.add(path.toAbsolutePath().normalize());
		}
		if (unique.isEmpty()) {
			clear();
			return;
		}
		this.contents = new ClipboardContents(cut ? ClipboardMode.CUT : ClipboardMode.COPY, unique);
		logger.debug("Clipboard set to {} of {} paths", this.contents.mode(), unique.size());
	}

	public synchronized ClipboardContents contents() {
		return this.contents;
	}

	public synchronized void clear() {
		this.contents = ClipboardContents.EMPTY;
		logger.debug("Clipboard cleared");
	}

	public synchronized boolean isEmpty() {
		return this.contents.isEmpty();
	}

}
