package dev.fileops.engine.numbering;

import java.util.Objects;

/**
 * Numbering configuration supplied by the settings layer.
 * @param template format with {@code {name}}, {@code {number}} (optionally {@code {number:0Nd}}) and
 * {@code {ext}} placeholders
 * @param digitWidth zero-padding width used when the template has a bare {@code {number}}
 * @param rolloverThreshold highest number issued at the base width before the width grows
 * @param startNumber first number issued for a base name
 */
public record NumberingSettings(String template, int digitWidth, long rolloverThreshold, long startNumber) {

	public static final String DEFAULT_TEMPLATE = "{name}_{number:05d}{ext}";

	public NumberingSettings {
		Objects.requireNonNull(template, "template");
		if (digitWidth < 1) {
			throw new IllegalArgumentException("digitWidth must be positive: " + digitWidth);
		}
		if (rolloverThreshold < 1) {
			throw new IllegalArgumentException("rolloverThreshold must be positive: " + rolloverThreshold);
		}
		if (startNumber < 0) {
			throw new IllegalArgumentException("startNumber must not be negative: " + startNumber);
		}
	}

	/**
	 * @return {@code {name}_{number:05d}{ext}}, width 5, rollover after 99999, starting at 1
	 */
	public static NumberingSettings defaults() {
		return new NumberingSettings(DEFAULT_TEMPLATE, 5, 99_999L, 1L);
	}

}
