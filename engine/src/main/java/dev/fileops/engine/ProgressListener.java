package dev.fileops.engine;

import java.nio.file.Path;

/**
 * Receives per-item progress of long-running operations.
 */
@FunctionalInterface
public interface ProgressListener {

	ProgressListener NONE = (current, completed, total) -> {
	};

	/**
	 * @param current item just processed
	 * @param completed number of top-level items processed so far
	 * @param total number of top-level items in the operation
	 */
	void onProgress(Path current, int completed, int total);

}
