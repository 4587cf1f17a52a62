package dev.fileops.engine.numbering;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates collision-free names for duplicates using a configurable template and a counter per
 * {@code (directory, base name)}.
 * <p>
 * Counters only ever grow for the lifetime of an instance. Counters are ordered by width first,
 * then number: once the number for a base name exceeds the rollover threshold the width grows by
 * one digit for good and numbering restarts at the start number, so the new names still sort and
 * compare after every name issued before. Persisted counters passed to {@link #seed(Collection)}
 * are combined with a directory scan on first use and never lower what the scan finds.
 */
public class NumberingService {

	private static final Logger logger = LoggerFactory.getLogger(NumberingService.class);

	private final NumberingSettings settings;

	private final NumberingTemplate template;

	private final Map<CounterKey, Counter> counters = new HashMap<>();

	/**
	 * Create a service using the supplied settings.
	 * @param settings template, widths and thresholds
	 */
	public NumberingService(NumberingSettings settings) {
		this.settings = settings;
		this.template = new NumberingTemplate(settings.template(), settings.digitWidth());
		logger.debug("Numbering template {} (width {}, rollover after {})", this.template, this.template.width(),
				settings.rolloverThreshold());
	}

	/**
	 * Produce a path in the same directory as {@code path} that does not currently exist and whose
	 * number follows every number previously issued for the same base name.
	 * @param path existing (or prospective) path whose name should be numbered
	 * @return new, non-existent sibling path
	 */
	public synchronized Path generateNumberedName(Path path) {
		Path absolute = path.toAbsolutePath().normalize();
		Path directory = absolute.getParent();
		if (directory == null) {
			throw new IllegalArgumentException("Cannot number a filesystem root: " + path);
		}
		NumberedName parsed = parseNumberedName(absolute);
		CounterKey key = new CounterKey(directory, parsed.baseName());

		Counter counter = this.counters.get(key);
		if (counter == null || !counter.scanned()) {
			Counter scanned = scan(directory, parsed.baseName());
			counter = counter == null ? scanned : max(counter, scanned).markScanned();
		}
		if (parsed.numbered()) {
			counter = max(counter, new Counter(parsed.number(), parsed.width(), true));
		}

		Counter next = advance(counter);
		Path candidate = directory.resolve(render(parsed, next));
		while (Files.exists(candidate)) {
			logger.debug("Numbered candidate {} already exists, advancing", candidate);
			next = advance(next);
			candidate = directory.resolve(render(parsed, next));
		}
		this.counters.put(key, next);
		logger.debug("Issued {} for base name {} in {}", candidate.getFileName(), parsed.baseName(), directory);
		return candidate;
	}

	/**
	 * Split a path's file name into base name and numeric suffix.
	 * @param path path to parse
	 * @return parsed name; number {@code 0} when no suffix is recognised
	 */
	public NumberedName parseNumberedName(Path path) {
		Path fileName = path.getFileName();
		if (fileName == null) {
			return new NumberedName("", 0, 0, "");
		}
		String name = fileName.toString();
		int dot = name.lastIndexOf('.');
		boolean hasExtension = dot > 0 && !Files.isDirectory(path);
		String stem = hasExtension ? name.substring(0, dot) : name;
		String extension = hasExtension ? name.substring(dot) : "";
		return this.template.parse(stem, extension).orElseGet(() -> new NumberedName(stem, 0, 0, extension));
	}

	/**
	 * Seed counters from persisted state. Seeded values are raised, never lowered.
	 * @param snapshots persisted counters
	 */
	public synchronized void seed(Collection<CounterSnapshot> snapshots) {
		for (CounterSnapshot snapshot : snapshots) {
			if (snapshot.directory() == null || snapshot.baseName() == null) {
				continue;
			}
			CounterKey key = new CounterKey(Path.of(snapshot.directory()).toAbsolutePath().normalize(),
					snapshot.baseName());
			Counter seeded = new Counter(snapshot.highest(), Math.max(snapshot.width(), this.template.width()), false);
			this.counters.merge(key, seeded, (current, incoming) -> {
				Counter higher = max(current, incoming);
				return current.scanned() ? higher.markScanned() : higher;
			});
		}
		logger.info("Seeded {} numbering counters", snapshots.size());
	}

	/**
	 * Export the current counters for persistence.
	 * @return counters ordered by directory and base name
	 */
	public synchronized List<CounterSnapshot> snapshot() {
		List<CounterSnapshot> snapshots = new ArrayList<>();
		this.counters.forEach((key, counter) -> snapshots.add(
				new CounterSnapshot(key.directory().toString(), key.baseName(), counter.highest(), counter.width())));
		snapshots.sort(Comparator.comparing(CounterSnapshot::directory).thenComparing(CounterSnapshot::baseName));
		return snapshots;
	}

	/**
	 * Look up the highest number issued so far for a base name.
	 * @param directory directory the counter belongs to
	 * @param baseName base name without suffix or extension
	 * @return the counter when one is cached
	 */
	public synchronized Optional<CounterSnapshot> counter(Path directory, String baseName) {
		Path normalized = directory.toAbsolutePath().normalize();
		Counter counter = this.counters.get(new CounterKey(normalized, baseName));
		if (counter == null) {
			return Optional.empty();
		}
		return Optional.of(new CounterSnapshot(normalized.toString(), baseName, counter.highest(), counter.width()));
	}

	private String render(NumberedName parsed, Counter counter) {
		return this.template.format(parsed.baseName(), counter.highest(), counter.width(), parsed.extension());
	}

	private Counter advance(Counter counter) {
		long next = Math.max(this.settings.startNumber(), counter.highest() + 1);
		if (next > thresholdFor(counter.width())) {
			int widened = counter.width() + 1;
			logger.info("Numbering rolled over past {} digits, continuing with {} digits", counter.width(), widened);
			return new Counter(this.settings.startNumber(), widened, true);
		}
		return new Counter(next, counter.width(), true);
	}

	private long thresholdFor(int width) {
		if (width <= this.template.width()) {
			return this.settings.rolloverThreshold();
		}
		if (width >= 18) {
			return Long.MAX_VALUE;
		}
		long limit = 1;
		for (int i = 0; i < width; i++) {
			limit *= 10;
		}
		return limit - 1;
	}

	private Counter scan(Path directory, String baseName) {
		Counter highest = new Counter(0, this.template.width(), true);
		if (!Files.isDirectory(directory)) {
			return highest;
		}
		try (DirectoryStream<Path> entries = openDirectory(directory)) {
			for (Path entry : entries) {
				NumberedName candidate = parseNumberedName(entry);
				if (candidate.numbered() && candidate.baseName().equals(baseName)) {
					highest = max(highest, new Counter(candidate.number(), candidate.width(), true));
				}
			}
		}
		catch (IOException | DirectoryIteratorException ex) {
			logger.warn("Unable to scan {} for numbered names of {}, assuming none", directory, baseName, ex);
		}
		return highest;
	}

	DirectoryStream<Path> openDirectory(Path directory) throws IOException {
		return Files.newDirectoryStream(directory);
	}

	private static Counter max(Counter left, Counter right) {
		if (left.width() != right.width()) {
			return left.width() > right.width() ? left : right;
		}
		return left.highest() >= right.highest() ? left : right;
	}

	private record CounterKey(Path directory, String baseName) {
	}

	private record Counter(long highest, int width, boolean scanned) {

		Counter markScanned() {
			return this.scanned ? this : new Counter(this.highest, this.width, true);
		}

	}

}
