package dev.fileops.server.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import dev.fileops.engine.OperationEngine;
import dev.fileops.engine.event.OperationListener;
import dev.fileops.engine.history.HistoryManager;
import dev.fileops.engine.model.Operation;
import dev.fileops.engine.model.OperationError;
import dev.fileops.engine.model.OperationKind;
import dev.fileops.engine.numbering.NumberingService;
import dev.fileops.engine.state.JsonStateStore;
import dev.fileops.engine.state.PersistedState;
import dev.fileops.server.config.FileOpsProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

/**
 * Keeps numbering counters and a short history snapshot on disk. Counters are restored at startup
 * and the state file is rewritten after every finished operation, undo and redo, and at shutdown.
 */
@Component
public class StatePersistence implements OperationListener {

	private static final Logger logger = LoggerFactory.getLogger(StatePersistence.class);

	private final JsonStateStore store;

	private final OperationEngine engine;

	private final NumberingService numbering;

	private final HistoryManager history;

	private final int snapshotSize;

	private List<String> previousSession = List.of();

	private Runnable subscription;

	public StatePersistence(FileOpsProperties properties, OperationEngine engine, NumberingService numbering,
			HistoryManager history) {
		Path stateFile = properties.determineStateFile();
		this.store = stateFile != null ? new JsonStateStore(stateFile) : null;
		this.engine = engine;
		this.numbering = numbering;
		this.history = history;
		this.snapshotSize = properties.getHistory().getSnapshotSize();
	}

	@PostConstruct
	void restore() {
		if (this.store == null) {
			logger.info("State persistence disabled");
			return;
		}
		PersistedState state = this.store.restoreInto(this.numbering);
		this.previousSession = state.recentHistory();
		this.subscription = this.engine.subscribe(this);
		logger.info("Persisting engine state to {}", this.store.file());
	}

	@PreDestroy
	void shutdown() {
		if (this.subscription != null) {
			this.subscription.run();
		}
		save();
	}

	/**
	 * @return descriptions of the operations recorded in the previous session, oldest first
	 */
	public List<String> previousSession() {
		return this.previousSession;
	}

	public boolean enabled() {
		return this.store != null;
	}

	@Override
	public void operationCompleted(OperationKind kind, List<Path> sources, Path target) {
		save();
	}

	/**
	 * A partly failed batch has still issued numbers and recorded the items that succeeded.
	 */
	@Override
	public void operationFailed(OperationKind kind, List<Path> sources, OperationError error) {
		save();
	}

	@Override
	public void operationUndone(Operation operation) {
		save();
	}

	@Override
	public void operationRedone(Operation operation) {
		save();
	}

	/**
	 * Write the current state. Failures are logged; the in-memory state stays authoritative.
	 */
	public void save() {
		if (this.store == null) {
			return;
		}
		try {
			this.store.save(JsonStateStore.capture(this.numbering, this.history, this.snapshotSize));
		}
		catch (IOException ex) {
			logger.warn("Failed to save engine state to {}", this.store.file(), ex);
		}
	}

}
