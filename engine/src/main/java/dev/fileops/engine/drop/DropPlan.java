package dev.fileops.engine.drop;

import java.util.List;

/**
 * Resolved drop: the action chosen and the engine calls it expands to. Items excluded by the
 * self-drop guard appear only as warnings.
 * @param requested action the caller asked for
 * @param effective action that will run, {@link DropAction#NONE} when every item was excluded
 * @param steps per-item calls in drag order
 * @param warnings notes on excluded or redirected items
 */
public record DropPlan(DropAction requested, DropAction effective, List<DropStep> steps, List<String> warnings) {

	public DropPlan {
		steps = List.copyOf(steps);
		warnings = List.copyOf(warnings);
	}

	public boolean isNoOp() {
		return this.steps.isEmpty();
	}

}
