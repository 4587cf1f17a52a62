package dev.fileops.engine.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A single source to destination pair captured while an operation executed.
 * @param source path the item was read from (or lived at before the operation)
 * @param destination path the item was written to (or lives at after the operation)
 */
public record PathMapping(Path source, Path destination) {

	public PathMapping {
		Objects.requireNonNull(source, "source");
		Objects.requireNonNull(destination, "destination");
	}

}
