package dev.fileops.engine.state;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import dev.fileops.engine.history.HistoryManager;
import dev.fileops.engine.model.Operation;
import dev.fileops.engine.numbering.NumberingService;

/**
 * Reads and writes {@link PersistedState} as a single JSON document. A missing file is empty
 * state; an unreadable or corrupt file is logged and treated as empty.
 */
public class JsonStateStore {

	private static final Logger logger = LoggerFactory.getLogger(JsonStateStore.class);

	private final Path file;

	private final ObjectMapper objectMapper;

	public JsonStateStore(Path file) {
		this(file, new ObjectMapper());
	}

	public JsonStateStore(Path file, ObjectMapper objectMapper) {
		this.file = file.toAbsolutePath().normalize();
		this.objectMapper = objectMapper.copy()
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
			.enable(SerializationFeature.INDENT_OUTPUT);
	}

	public Path file() {
		return this.file;
	}

	public PersistedState load() {
		if (!Files.exists(this.file)) {
			logger.debug("No state file at {}", this.file);
			return PersistedState.EMPTY;
		}
		try {
			PersistedState state = this.objectMapper.readValue(this.file.toFile(), PersistedState.class);
			if (state == null) {
				return PersistedState.EMPTY;
			}
			logger.info("Loaded {} numbering counter(s) from {}", state.counters().size(), this.file);
			return state;
		}
		catch (JacksonException ex) {
			logger.warn("State file {} is corrupt, starting with empty state", this.file, ex);
			return PersistedState.EMPTY;
		}
		catch (IOException ex) {
			logger.warn("Could not read state file {}, starting with empty state", this.file, ex);
			return PersistedState.EMPTY;
		}
	}

	/**
	 * Write the state through a temporary sibling file that replaces the previous document.
	 * @param state state to write
	 * @throws IOException when the document cannot be written
	 */
	public void save(PersistedState state) throws IOException {
		Path parent = this.file.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Path temporary = this.file.resolveSibling(this.file.getFileName() + ".tmp");
		this.objectMapper.writeValue(temporary.toFile(), state);
		Files.move(temporary, this.file, StandardCopyOption.REPLACE_EXISTING);
		logger.debug("Saved {} numbering counter(s) to {}", state.counters().size(), this.file);
	}

	/**
	 * Capture the current numbering counters and the newest history descriptions.
	 * @param numbering source of the counters
	 * @param history source of the descriptions
	 * @param historySize maximum number of descriptions kept
	 * @return state ready to save
	 */
	public static PersistedState capture(NumberingService numbering, HistoryManager history, int historySize) {
		List<String> descriptions = history.undoHistory()
			.stream()
			.map(Operation::description)
			.collect(Collectors.toList());
		int from = Math.max(0, descriptions.size() - Math.max(0, historySize));
		return new PersistedState(numbering.snapshot(), descriptions.subList(from, descriptions.size()));
	}

	/**
	 * Seed the numbering service from previously saved state.
	 * @return the loaded state
	 */
	public PersistedState restoreInto(NumberingService numbering) {
		PersistedState state = load();
		numbering.seed(state.counters());
		return state;
	}

}
