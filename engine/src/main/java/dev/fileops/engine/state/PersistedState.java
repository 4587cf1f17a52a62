package dev.fileops.engine.state;

import java.util.List;

import dev.fileops.engine.numbering.CounterSnapshot;

/**
 * Engine state that survives restarts.
 * @param counters numbering counters per directory and base name
 * @param recentHistory descriptions of the most recent operations, oldest first; informational
 */
public record PersistedState(List<CounterSnapshot> counters, List<String> recentHistory) {

	public static final PersistedState EMPTY = new PersistedState(List.of(), List.of());

	public PersistedState {
		counters = counters == null ? List.of() : List.copyOf(counters);
		recentHistory = recentHistory == null ? List.of() : List.copyOf(recentHistory);
	}

}
