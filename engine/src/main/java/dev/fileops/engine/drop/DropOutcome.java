package dev.fileops.engine.drop;

import java.util.List;
import java.util.stream.Collectors;

import dev.fileops.engine.model.OperationResult;

/**
 * Results of executing a {@link DropPlan}; one engine result per group of steps sharing an action
 * and target directory.
 * @param plan the executed plan
 * @param results engine results in execution order
 */
public record DropOutcome(DropPlan plan, List<OperationResult> results) {

	public DropOutcome {
		results = List.copyOf(results);
	}

	public boolean success() {
		return this.results.stream().allMatch(OperationResult::success);
	}

	public String summaryLine() {
		if (this.results.isEmpty()) {
			return this.plan.warnings().isEmpty() ? "Nothing to drop" : this.plan.warnings().get(0);
		}
		return this.results.stream().map(OperationResult::summaryLine).collect(Collectors.joining("; "));
	}

}
