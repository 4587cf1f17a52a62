package dev.fileops.engine.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable record of one executed mutation.
 * <p>
 * An undoable operation always carries a non-empty {@link UndoPayload}; the description is
 * derived from the other fields and never supplied by callers.
 * @param kind what kind of mutation was executed
 * @param sourcePaths ordered source paths (order drives undo order)
 * @param targetPath destination directory, renamed path or created path; {@code null} for deletes
 * @param timestamp wall-clock time the operation was recorded
 * @param monotonicNanos monotonic creation time used for ordering and merge windows
 * @param undoable whether the operation can be reversed
 * @param undoPayload data that alone determines the reverse action, {@code null} when not undoable
 */
public record Operation(OperationKind kind, List<Path> sourcePaths, Path targetPath, Instant timestamp,
		long monotonicNanos, boolean undoable, UndoPayload undoPayload) {

	public Operation {
		Objects.requireNonNull(kind, "kind");
		Objects.requireNonNull(timestamp, "timestamp");
		sourcePaths = List.copyOf(sourcePaths);
		if (undoable && (undoPayload == null || undoPayload.isEmpty())) {
			throw new IllegalArgumentException("Undoable " + kind.id() + " operation requires an undo payload");
		}
	}

	/**
	 * Create an operation stamped with the current wall-clock and monotonic time.
	 * @param kind mutation kind
	 * @param sourcePaths ordered source paths
	 * @param targetPath target path, may be {@code null}
	 * @param undoPayload reverse data; {@code null} marks the operation as not undoable
	 * @return new operation
	 */
	public static Operation of(OperationKind kind, List<Path> sourcePaths, Path targetPath, UndoPayload undoPayload) {
		return new Operation(kind, sourcePaths, targetPath, Instant.now(), System.nanoTime(), undoPayload != null,
				undoPayload);
	}

	/**
	 * Human-readable summary derived from the kind, paths and payload.
	 * @return description such as {@code Renamed a.txt to b.txt}
	 */
	public String description() {
		String subject = subject();
		return switch (this.kind) {
			case COPY, MOVE -> "%s %s to %s".formatted(this.kind.verb(), subject, displayName(this.targetPath));
			case DELETE -> (this.undoable ? "Deleted %s" : "Permanently deleted %s").formatted(subject);
			case RENAME -> "Renamed %s to %s".formatted(subject, displayName(this.targetPath));
			case CREATE_FILE, CREATE_DIRECTORY -> "%s %s".formatted(this.kind.verb(), displayName(this.targetPath));
			case DUPLICATE -> "Duplicated %s as %s".formatted(subject, displayName(this.targetPath));
		};
	}

	private String subject() {
		if (this.sourcePaths.size() == 1) {
			return displayName(this.sourcePaths.get(0));
		}
		return "%d items".formatted(this.sourcePaths.size());
	}

	private static String displayName(Path path) {
		if (path == null) {
			return "";
		}
		Path name = path.getFileName();
		return name != null ? name.toString() : path.toString();
	}

}
