package dev.fileops.engine.event;

import java.nio.file.Path;
import java.util.List;

import dev.fileops.engine.clipboard.ClipboardContents;
import dev.fileops.engine.model.Operation;
import dev.fileops.engine.model.OperationError;
import dev.fileops.engine.model.OperationKind;

/**
 * Observer of engine activity. Every mutating call emits {@link #operationStarted} before it
 * touches the filesystem and exactly one of {@link #operationCompleted} or
 * {@link #operationFailed} afterwards. All callbacks default to no-ops.
 */
public interface OperationListener {

	default void operationStarted(OperationKind kind, List<Path> sources) {
	}

	/**
	 * @param target destination directory or resulting path, {@code null} for deletes
	 */
	default void operationCompleted(OperationKind kind, List<Path> sources, Path target) {
	}

	/**
	 * @param error first error of the failed call; further errors are in the returned result
	 */
	default void operationFailed(OperationKind kind, List<Path> sources, OperationError error) {
	}

	/** An entry was reversed by undo and moved to the redo stack. */
	default void operationUndone(Operation operation) {
	}

	default void operationRedone(Operation operation) {
	}

	default void clipboardChanged(ClipboardContents contents) {
	}

}
