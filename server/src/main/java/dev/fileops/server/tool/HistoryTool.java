package dev.fileops.server.tool;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

import dev.fileops.engine.OperationEngine;
import dev.fileops.engine.model.Operation;
import dev.fileops.engine.model.OperationResult;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * Undo and redo tools over the engine's operation history.
 */
@Component
@RequiredArgsConstructor
public class HistoryTool {

	private final OperationEngine engine;

	private final ToolResults results;

	public List<McpServerFeatures.SyncToolSpecification> tools() {
		return List.of(undoTool(), redoTool());
	}

	public McpServerFeatures.SyncToolSpecification undoTool() {
		return ToolSchemas.tool("undo", "Undo", "Reverse the most recent file operation.", ToolSchemas.object(List.of()),
				(exchange, request) -> respond(this.engine.undo(), "Undid"));
	}

	public McpServerFeatures.SyncToolSpecification redoTool() {
		return ToolSchemas.tool("redo", "Redo", "Re-apply the most recently undone file operation.",
				ToolSchemas.object(List.of()), (exchange, request) -> respond(this.engine.redo(), "Redid"));
	}

	private McpSchema.CallToolResult respond(OperationResult result, String verb) {
		Map<String, Object> structured = this.results.structured(result);
		structured.put("nextUndo", this.engine.peekUndo().map(Operation::description).orElse(null));
		structured.put("nextRedo", this.engine.peekRedo().map(Operation::description).orElse(null));
		if (!result.success()) {
			return this.results.error(result.summaryLine(), structured);
		}
		return this.results.success("%s: %s".formatted(verb, result.operation().description()), structured);
	}

}
