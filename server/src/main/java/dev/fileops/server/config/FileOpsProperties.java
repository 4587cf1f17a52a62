package dev.fileops.server.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import dev.fileops.engine.history.HistorySettings;
import dev.fileops.engine.numbering.NumberingSettings;

/**
 * Configuration of the file operation engine: workspace location, trash and state files,
 * numbering template and history limits.
 */
@ConfigurationProperties(prefix = "fileops")
public class FileOpsProperties {

	/**
	 * Workspace root. Falls back to {@code FILEOPS_BASE_DIR}, then {@code ~/fileops-play}.
	 */
	private String baseDir;

	/**
	 * Recoverable location for non-permanent deletes. Defaults to {@code .fileops-trash} inside the
	 * workspace.
	 */
	private String trashDir;

	/**
	 * JSON file holding numbering counters and recent history. Defaults to
	 * {@code .fileops-state.json} inside the workspace; set to {@code none} to disable.
	 */
	private String stateFile;

	private final Numbering numbering = new Numbering();

	private final History history = new History();

	public String getBaseDir() {
		return baseDir;
	}

	public void setBaseDir(String baseDir) {
		this.baseDir = baseDir;
	}

	public String getTrashDir() {
		return trashDir;
	}

	public void setTrashDir(String trashDir) {
		this.trashDir = trashDir;
	}

	public String getStateFile() {
		return stateFile;
	}

	public void setStateFile(String stateFile) {
		this.stateFile = stateFile;
	}

	public Numbering getNumbering() {
		return numbering;
	}

	public History getHistory() {
		return history;
	}

	/**
	 * Resolve the workspace root, preferring the configured property, then the
	 * {@code FILEOPS_BASE_DIR} environment variable, and finally a directory under the user home.
	 * @return normalized workspace root
	 */
	public Path determineBaseDir() {
		if (StringUtils.hasText(this.baseDir)) {
			return normalize(Paths.get(this.baseDir));
		}
		String environmentOverride = System.getenv("FILEOPS_BASE_DIR");
		if (StringUtils.hasText(environmentOverride)) {
			return normalize(Paths.get(environmentOverride));
		}
		return normalize(Paths.get(System.getProperty("user.home"), "fileops-play"));
	}

	public Path determineTrashDir() {
		if (StringUtils.hasText(this.trashDir)) {
			return determineBaseDir().resolve(this.trashDir).normalize();
		}
		return determineBaseDir().resolve(".fileops-trash");
	}

	/**
	 * @return state file location, or {@code null} when persistence is disabled
	 */
	public Path determineStateFile() {
		if ("none".equalsIgnoreCase(this.stateFile)) {
			return null;
		}
		if (StringUtils.hasText(this.stateFile)) {
			return determineBaseDir().resolve(this.stateFile).normalize();
		}
		return determineBaseDir().resolve(".fileops-state.json");
	}

	private static Path normalize(Path candidate) {
		return candidate.toAbsolutePath().normalize();
	}

	/**
	 * Numbered-name generation for duplicates and collisions.
	 */
	public static class Numbering {

		/**
		 * Template with {@code {name}}, {@code {number}} or {@code {number:0Nd}}, and {@code {ext}}.
		 */
		private String template = NumberingSettings.DEFAULT_TEMPLATE;

		/**
		 * Digit width for a bare {@code {number}} placeholder.
		 */
		private int digitWidth = 5;

		/**
		 * Highest number issued at the template width before the suffix widens.
		 */
		private long rolloverThreshold = 99_999L;

		private long startNumber = 1L;

		public String getTemplate() {
			return template;
		}

		public void setTemplate(String template) {
			this.template = template;
		}

		public int getDigitWidth() {
			return digitWidth;
		}

		public void setDigitWidth(int digitWidth) {
			this.digitWidth = digitWidth;
		}

		public long getRolloverThreshold() {
			return rolloverThreshold;
		}

		public void setRolloverThreshold(long rolloverThreshold) {
			this.rolloverThreshold = rolloverThreshold;
		}

		public long getStartNumber() {
			return startNumber;
		}

		public void setStartNumber(long startNumber) {
			this.startNumber = startNumber;
		}

		public NumberingSettings toSettings() {
			return new NumberingSettings(this.template, this.digitWidth, this.rolloverThreshold, this.startNumber);
		}

	}

	/**
	 * Undo/redo history limits.
	 */
	public static class History {

		private int maxSize = 100;

		/**
		 * Merge rapid chained renames or moves of the same item into one entry.
		 */
		private boolean mergeEnabled = false;

		private Duration mergeWindow = Duration.ofSeconds(1);

		/**
		 * Number of recent history descriptions written to the state file.
		 */
		private int snapshotSize = 20;

		public int getMaxSize() {
			return maxSize;
		}

		public void setMaxSize(int maxSize) {
			this.maxSize = maxSize;
		}

		public boolean isMergeEnabled() {
			return mergeEnabled;
		}

		public void setMergeEnabled(boolean mergeEnabled) {
			this.mergeEnabled = mergeEnabled;
		}

		public Duration getMergeWindow() {
			return mergeWindow;
		}

		public void setMergeWindow(Duration mergeWindow) {
			this.mergeWindow = mergeWindow;
		}

		public int getSnapshotSize() {
			return snapshotSize;
		}

		public void setSnapshotSize(int snapshotSize) {
			this.snapshotSize = snapshotSize;
		}

		public HistorySettings toSettings() {
			return new HistorySettings(this.maxSize, this.mergeEnabled, this.mergeWindow);
		}

	}

}
