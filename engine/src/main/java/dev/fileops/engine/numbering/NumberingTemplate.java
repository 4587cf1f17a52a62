package dev.fileops.engine.numbering;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed numbering template of the form {@code {name}<prefix>{number}<suffix>{ext}}.
 * <p>
 * The literal text around {@code {number}} is used both to format new names and to recognise
 * suffixes that were produced by the same template.
 */
final class NumberingTemplate {

	private static final Pattern NUMBER_PLACEHOLDER = Pattern.compile("\\{number(?::0?(\\d+)d)?}");

	private static final String NAME = "{name}";

	private static final String EXT = "{ext}";

	private final String source;

	private final String prefix;

	private final String suffix;

	private final int width;

	private final Pattern recognizer;

	NumberingTemplate(String template, int defaultWidth) {
		if (!template.startsWith(NAME) || !template.endsWith(EXT)) {
			throw new IllegalArgumentException("Template must start with {name} and end with {ext}: " + template);
		}
		String middle = template.substring(NAME.length(), template.length() - EXT.length());
		Matcher matcher = NUMBER_PLACEHOLDER.matcher(middle);
		if (!matcher.find()) {
			throw new IllegalArgumentException("Template has no {number} placeholder: " + template);
		}
		this.source = template;
		this.prefix = middle.substring(0, matcher.start());
		this.suffix = middle.substring(matcher.end());
		if (this.prefix.contains("{") || this.suffix.contains("{")) {
			throw new IllegalArgumentException("Unsupported placeholder in template: " + template);
		}
		this.width = matcher.group(1) != null ? Integer.parseInt(matcher.group(1)) : defaultWidth;
		if (this.width < 1) {
			throw new IllegalArgumentException("Template width must be positive: " + template);
		}
		this.recognizer = Pattern.compile(
				"^(.+?)" + Pattern.quote(this.prefix) + "(\\d{" + this.width + ",})" + Pattern.quote(this.suffix) + "$");
	}

	int width() {
		return this.width;
	}

	String format(String name, long number, int digits, String extension) {
		String padded = String.format("%0" + digits + "d", number);
		return name + this.prefix + padded + this.suffix + extension;
	}

	/**
	 * Recognise a suffix produced by this template on a name stripped of its extension.
	 * @param stem file name without extension
	 * @return base name and number when the suffix is present
	 */
	Optional<NumberedName> parse(String stem, String extension) {
		Matcher matcher = this.recognizer.matcher(stem);
		if (!matcher.matches()) {
			return Optional.empty();
		}
		String digits = matcher.group(2);
		long number;
		try {
			number = Long.parseLong(digits);
		}
		catch (NumberFormatException ex) {
			return Optional.empty();
		}
		return Optional.of(new NumberedName(matcher.group(1), number, digits.length(), extension));
	}

	@Override
	public String toString() {
		return this.source;
	}

}
