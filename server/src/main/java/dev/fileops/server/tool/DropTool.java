package dev.fileops.server.tool;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import lombok.RequiredArgsConstructor;

import dev.fileops.engine.drop.DropAction;
import dev.fileops.engine.drop.DropOutcome;
import dev.fileops.engine.drop.DropPlan;
import dev.fileops.engine.drop.DropResolver;
import dev.fileops.server.service.WorkspaceService;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * Drag-and-drop as a tool: the resolver picks copy or move, guards self-drops, and the engine runs
 * the result.
 */
@Component
@RequiredArgsConstructor
public class DropTool {

	private static final Logger logger = LoggerFactory.getLogger(DropTool.class);

	private static final List<String> ACTIONS = List.of("auto", "copy", "move", "link");

	private final DropResolver dropResolver;

	private final WorkspaceService workspace;

	private final ToolResults results;

	public McpServerFeatures.SyncToolSpecification dropItemsTool() {
		return ToolSchemas.tool("drop_items", "Drop items",
				"Drop dragged items onto a directory. 'auto' moves within a volume and copies across volumes; "
						+ "dropping an item into itself never moves it.",
				ToolSchemas.object(List.of("paths", "target"), "paths", ToolSchemas.paths("Relative paths being dragged."),
						"target", ToolSchemas.string("Relative drop target."), "action",
						ToolSchemas.stringEnum("Requested action (defaults to auto).", ACTIONS)),
				(exchange, request) -> handleDrop(request));
	}

	private McpSchema.CallToolResult handleDrop(McpSchema.CallToolRequest callToolRequest) {
		Map<String, Object> arguments = ToolRequestUtils.safeArguments(callToolRequest);
		List<String> paths = ToolRequestUtils.stringListArgument(arguments, "paths");
		String target = ToolRequestUtils.stringArgument(arguments, "target", null);
		String action = ToolRequestUtils.stringArgument(arguments, "action", "auto").toLowerCase(Locale.ROOT);
		if (paths.isEmpty()) {
			return this.results.missingArgument("paths");
		}
		if (!StringUtils.hasText(target)) {
			return this.results.missingArgument("target");
		}
		if (!ACTIONS.contains(action)) {
			return this.results.error("Unsupported drop action: " + action, Map.of("action", action, "allowed", ACTIONS));
		}
		try {
			List<Path> dragged = this.workspace.resolveAll(paths);
			DropPlan plan = this.dropResolver.resolve(dragged, this.workspace.resolve(target),
					DropAction.valueOf(action.toUpperCase(Locale.ROOT)));
			logger.debug("Drop of {} resolved to {}", paths, plan.effective());
			DropOutcome outcome = this.dropResolver.execute(plan);
			Map<String, Object> structured = Map.of("requested", plan.requested().name(), "effective",
					plan.effective().name(), "success", outcome.success(), "warnings", plan.warnings(), "results",
					outcome.results().stream().map(this.results::structured).collect(Collectors.toList()));
			return outcome.success() ? this.results.success(outcome.summaryLine(), structured)
					: this.results.error(outcome.summaryLine(), structured);
		}
		catch (IOException ex) {
			return this.results.error(ex.getMessage(), Map.of("reason", "INVALID_PATH"));
		}
	}

}
