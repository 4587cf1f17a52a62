package dev.fileops.engine.model;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.util.Locale;

/**
 * Typed failure conditions reported in an {@link OperationResult}.
 */
public enum ErrorKind {

	NOT_FOUND,

	PERMISSION_DENIED,

	NAME_CONFLICT,

	/** Target locked by another process. */
	IN_USE,

	CROSS_DEVICE,

	EMPTY_CLIPBOARD,

	CANCELLED,

	NOTHING_TO_UNDO,

	NOTHING_TO_REDO,

	/** A history entry no longer matches the filesystem and was dropped. */
	HISTORY_DIVERGED,

	/** Permanent delete of a directory or of several items without explicit confirmation. */
	CONFIRMATION_REQUIRED,

	/** Target is not a directory, or a directory would land inside its own subtree. */
	INVALID_TARGET,

	IO_ERROR;

	/**
	 * Map an I/O failure raised by the filesystem layer onto the taxonomy.
	 * @param exception failure to classify
	 * @return matching kind, {@link #IO_ERROR} when nothing more specific applies
	 */
	public static ErrorKind classify(IOException exception) {
		if (exception instanceof InterruptedIOException) {
			return CANCELLED;
		}
		if (exception instanceof NoSuchFileException) {
			return NOT_FOUND;
		}
		if (exception instanceof AccessDeniedException) {
			return PERMISSION_DENIED;
		}
		if (exception instanceof FileAlreadyExistsException) {
			return NAME_CONFLICT;
		}
		if (exception instanceof AtomicMoveNotSupportedException) {
			return CROSS_DEVICE;
		}
		if (exception instanceof FileSystemException fse && fse.getReason() != null) {
			String reason = fse.getReason().toLowerCase(Locale.ROOT);
			if (reason.contains("busy") || reason.contains("being used") || reason.contains("locked")) {
				return IN_USE;
			}
			if (reason.contains("cross-device") || reason.contains("different device")) {
				return CROSS_DEVICE;
			}
		}
		return IO_ERROR;
	}

}
