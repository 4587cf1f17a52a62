package dev.fileops.engine.numbering;

/**
 * Result of splitting a file name into its base name and numeric suffix.
 * @param baseName name with extension and recognised suffix removed
 * @param number parsed number, {@code 0} when the name carries no suffix
 * @param width digit count of the parsed suffix, {@code 0} when there is none
 * @param extension extension including the leading dot, empty for directories and bare names
 */
public record NumberedName(String baseName, long number, int width, String extension) {

	/**
	 * @return {@code true} when a numeric suffix was recognised
	 */
	public boolean numbered() {
		return this.width > 0;
	}

}
