package dev.fileops.engine.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome returned to callers of every engine operation.
 * <p>
 * Batch operations keep going after a per-item failure, so a result may carry both result
 * paths and errors; {@code success} is {@code true} only when there are no errors.
 * @param success {@code true} when every item succeeded
 * @param resultPaths paths created, moved to, or otherwise affected
 * @param errors typed per-item failures
 * @param warnings non-fatal notes such as skipped items
 * @param operation the recorded (or reversed) operation, {@code null} when nothing executed
 */
public record OperationResult(boolean success, List<Path> resultPaths, List<OperationError> errors,
		List<String> warnings, Operation operation) {

	public OperationResult {
		resultPaths = List.copyOf(resultPaths);
		errors = List.copyOf(errors);
		warnings = List.copyOf(warnings);
	}

	/**
	 * Combine collected outcomes; success is derived from the absence of errors.
	 * @param resultPaths affected paths
	 * @param errors collected errors
	 * @param warnings collected warnings
	 * @param operation associated operation, may be {@code null}
	 * @return combined result
	 */
	public static OperationResult of(List<Path> resultPaths, List<OperationError> errors, List<String> warnings,
			Operation operation) {
		return new OperationResult(errors.isEmpty(), resultPaths, errors, warnings, operation);
	}

	/**
	 * Failed result carrying a single error.
	 * @param error the failure
	 * @return failed result
	 */
	public static OperationResult failure(OperationError error) {
		return new OperationResult(false, List.of(), List.of(error), List.of(), null);
	}

	/**
	 * Failed result carrying a single error built from its parts.
	 * @param kind failure category
	 * @param path originating path, may be {@code null}
	 * @param message detail
	 * @return failed result
	 */
	public static OperationResult failure(ErrorKind kind, Path path, String message) {
		return failure(new OperationError(kind, path, message));
	}

	/**
	 * Successful result that did nothing, with an explanatory warning.
	 * @param warning reason nothing happened
	 * @return no-op result
	 */
	public static OperationResult noOp(String warning) {
		return new OperationResult(true, List.of(), List.of(), List.of(warning), null);
	}

	/**
	 * @param kind kind to look for
	 * @return {@code true} when any error has the given kind
	 */
	public boolean hasError(ErrorKind kind) {
		return this.errors.stream().anyMatch(error -> error.kind() == kind);
	}

	/**
	 * Provide a concise textual summary of the outcome.
	 * @return summary line
	 */
	public String summaryLine() {
		if (success) {
			if (operation != null) {
				return operation.description();
			}
			return warnings.isEmpty() ? "Nothing to do" : warnings.get(0);
		}
		String first = errors.get(0).message();
		if (errors.size() == 1) {
			return "Failed: %s".formatted(first);
		}
		return "Failed for %d items, first: %s".formatted(errors.size(), first);
	}

}
