package dev.fileops.engine.model;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One typed failure, attached to the path that caused it when there is one.
 * @param kind failure category
 * @param path originating path, may be {@code null} for operation-wide failures
 * @param message human-readable detail
 */
public record OperationError(ErrorKind kind, Path path, String message) {

	public OperationError {
		Objects.requireNonNull(kind, "kind");
		message = message == null ? kind.name() : message;
	}

	/**
	 * Build an error from a filesystem failure.
	 * @param path path being processed when the failure occurred
	 * @param exception the failure
	 * @return classified error
	 */
	public static OperationError from(Path path, IOException exception) {
		String detail = exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName();
		return new OperationError(ErrorKind.classify(exception), path, detail);
	}

}
