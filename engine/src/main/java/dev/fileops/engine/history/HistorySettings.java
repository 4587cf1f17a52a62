package dev.fileops.engine.history;

import java.time.Duration;
import java.util.Objects;

/**
 * History configuration.
 * @param maxSize bound on the undo stack
 * @param mergeEnabled whether consecutive compatible operations are merged into one entry
 * @param mergeWindow largest gap between two operations that may still be merged
 */
public record HistorySettings(int maxSize, boolean mergeEnabled, Duration mergeWindow) {

	public HistorySettings {
		if (maxSize < 1) {
			throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
		}
		Objects.requireNonNull(mergeWindow, "mergeWindow");
		if (mergeWindow.isNegative()) {
			throw new IllegalArgumentException("mergeWindow must not be negative: " + mergeWindow);
		}
	}

	/**
	 * @return 100 entries, merging disabled, one second window
	 */
	public static HistorySettings defaults() {
		return new HistorySettings(100, false, Duration.ofSeconds(1));
	}

}
