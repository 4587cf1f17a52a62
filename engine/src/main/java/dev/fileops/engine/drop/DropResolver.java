package dev.fileops.engine.drop;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.fileops.engine.OperationEngine;
import dev.fileops.engine.fs.FileSystemAccess;
import dev.fileops.engine.model.OperationResult;

/**
 * Decides which engine operation a drag-and-drop turns into.
 * <p>
 * A forced action (copy, move or link) is honoured; otherwise items are moved when every dragged
 * item lives on the target's volume and copied when any does not. Before anything is dispatched,
 * items whose drop would land inside themselves are guarded: a move becomes a no-op for that item
 * while a copy is redirected to the item's own parent, producing a numbered copy outside the
 * dragged subtree. Links are carried out as copies.
 */
public class DropResolver {

	private static final Logger logger = LoggerFactory.getLogger(DropResolver.class);

	private final OperationEngine engine;

	private final FileSystemAccess fileSystem;

	public DropResolver(OperationEngine engine) {
		this.engine = Objects.requireNonNull(engine, "engine");
		this.fileSystem = engine.fileSystem();
	}

	/**
	 * Resolve a drop without touching the filesystem.
	 * @param draggedPaths items being dragged
	 * @param target drop target; a file target stands for its directory
	 * @param requested requested action, {@link DropAction#AUTO} to infer
	 * @return the plan to execute
	 */
	public DropPlan resolve(List<Path> draggedPaths, Path target, DropAction requested) {
		DropAction request = requested == null ? DropAction.AUTO : requested;
		if (request == DropAction.NONE) {
			return new DropPlan(request, DropAction.NONE, List.of(), List.of("No drop action requested"));
		}
		Path dropTarget = target.toAbsolutePath().normalize();
		List<Path> dragged = draggedPaths.stream()
			.map(path -> path.toAbsolutePath().normalize())
			.distinct()
			.collect(Collectors.toList());
		List<String> warnings = new ArrayList<>();

		Path targetDirectory = dropTarget;
		if (this.fileSystem.exists(dropTarget) && !this.fileSystem.isDirectory(dropTarget)
				&& dropTarget.getParent() != null) {
			targetDirectory = dropTarget.getParent();
		}
		DropAction effective = effectiveAction(request, dragged, targetDirectory, warnings);

		List<DropStep> steps = new ArrayList<>();
		for (Path source : dragged) {
			if (dropTarget.startsWith(source)) {
				Path parent = source.getParent();
				if (effective == DropAction.MOVE || parent == null) {
					warnings.add("Skipped %s: cannot drop an item into itself".formatted(source));
					continue;
				}
				warnings.add("Copying %s next to itself instead of into its own subtree".formatted(source));
				steps.add(new DropStep(source, DropAction.COPY, parent));
				continue;
			}
			if (effective == DropAction.MOVE && targetDirectory.equals(source.getParent())) {
				warnings.add("Skipped %s: already in %s".formatted(source.getFileName(), targetDirectory));
				continue;
			}
			steps.add(new DropStep(source, effective, targetDirectory));
		}
		DropPlan plan = new DropPlan(request, steps.isEmpty() ? DropAction.NONE : effective, steps, warnings);
		logger.debug("Resolved {} drop of {} item(s) onto {} as {} with {} step(s)", request, dragged.size(),
				dropTarget, plan.effective(), steps.size());
		return plan;
	}

	/**
	 * Run a resolved plan through the engine. Consecutive steps with the same action and target
	 * directory run as one engine call, so they are recorded as one history entry.
	 * @param plan plan from {@link #resolve}
	 * @return the engine results
	 */
	public DropOutcome execute(DropPlan plan) {
		Map<DropStep, List<Path>> groups = new LinkedHashMap<>();
		DropStep current = null;
		for (DropStep step : plan.steps()) {
			if (current == null || current.action() != step.action()
					|| !current.targetDirectory().equals(step.targetDirectory())) {
				current = step;
				groups.put(current, new ArrayList<>());
			}
			groups.get(current).add(step.source());
		}
		List<OperationResult> results = new ArrayList<>();
		groups.forEach((group, sources) -> results.add(group.action() == DropAction.MOVE
				? this.engine.move(sources, group.targetDirectory())
				: this.engine.copy(sources, group.targetDirectory())));
		return new DropOutcome(plan, results);
	}

	/**
	 * Resolve and execute in one call.
	 */
	public DropOutcome drop(List<Path> draggedPaths, Path target, DropAction requested) {
		return execute(resolve(draggedPaths, target, requested));
	}

	private DropAction effectiveAction(DropAction request, List<Path> dragged, Path targetDirectory,
			List<String> warnings) {
		switch (request) {
			case COPY:
			case MOVE:
				return request;
			case LINK:
				warnings.add("Links are not supported, copying instead");
				return DropAction.COPY;
			default:
				boolean sameVolume = dragged.stream().allMatch(path -> this.fileSystem.sameVolume(path, targetDirectory));
				return sameVolume ? DropAction.MOVE : DropAction.COPY;
		}
	}

}
