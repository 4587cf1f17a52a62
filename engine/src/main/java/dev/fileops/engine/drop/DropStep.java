package dev.fileops.engine.drop;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One dragged item and what will be done with it.
 * @param source dragged item
 * @param action {@link DropAction#COPY} or {@link DropAction#MOVE}
 * @param targetDirectory directory the item goes into
 */
public record DropStep(Path source, DropAction action, Path targetDirectory) {

	public DropStep {
		Objects.requireNonNull(source, "source");
		Objects.requireNonNull(targetDirectory, "targetDirectory");
		if (action != DropAction.COPY && action != DropAction.MOVE) {
			throw new IllegalArgumentException("A drop step copies or moves, not " + action);
		}
	}

}
