package dev.fileops.engine.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Data that alone determines how a recorded operation is reversed (and re-applied) without
 * rescanning the filesystem.
 */
public sealed interface UndoPayload permits UndoPayload.Transfers, UndoPayload.Renamed, UndoPayload.Created {

	/**
	 * @return {@code true} when the payload carries nothing to reverse
	 */
	boolean isEmpty();

	/**
	 * Items copied, moved, duplicated or relocated to the trash. Undoing a copy or duplicate
	 * removes each destination; undoing a move or delete moves each destination back to its
	 * source.
	 * @param entries ordered source/destination pairs
	 */
	record Transfers(List<PathMapping> entries) implements UndoPayload {

		public Transfers {
			entries = List.copyOf(entries);
		}

		@Override
		public boolean isEmpty() {
			return this.entries.isEmpty();
		}

	}

	/**
	 * A rename within one directory.
	 * @param originalPath path before the rename
	 * @param renamedPath path after the rename
	 */
	record Renamed(Path originalPath, Path renamedPath) implements UndoPayload {

		public Renamed {
			Objects.requireNonNull(originalPath, "originalPath");
			Objects.requireNonNull(renamedPath, "renamedPath");
		}

		/**
		 * @return the file name the item carried before the rename
		 */
		public String originalName() {
			return this.originalPath.getFileName().toString();
		}

		@Override
		public boolean isEmpty() {
			return false;
		}

	}

	/**
	 * A freshly created file or directory.
	 * @param createdPath path that did not exist before the operation
	 * @param directory {@code true} when a directory was created
	 */
	record Created(Path createdPath, boolean directory) implements UndoPayload {

		public Created {
			Objects.requireNonNull(createdPath, "createdPath");
		}

		@Override
		public boolean isEmpty() {
			return false;
		}

	}

}
