package dev.fileops.server.resource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

import dev.fileops.engine.OperationEngine;
import dev.fileops.engine.model.Operation;
import dev.fileops.server.service.StatePersistence;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * Serves the undo/redo history as a {@code text/markdown} resource, so clients can show what undo
 * and redo would do without calling a tool.
 */
@Component
@RequiredArgsConstructor
public class HistoryResourceProvider {

	private static final Logger logger = LoggerFactory.getLogger(HistoryResourceProvider.class);

	static final String HISTORY_RESOURCE_URI = "resource://history";

	private final OperationEngine engine;

	private final StatePersistence statePersistence;

	public McpServerFeatures.SyncResourceSpecification historyResource() {
		McpSchema.Resource resource = McpSchema.Resource.builder()
			.uri(HISTORY_RESOURCE_URI)
			.name("operation_history")
			.title("Operation history")
			.description("Undo and redo stacks of the file operation engine, newest first.")
			.mimeType("text/markdown")
			.build();
		return new McpServerFeatures.SyncResourceSpecification(resource, this::handleHistoryResource);
	}

	McpSchema.ReadResourceResult handleHistoryResource(McpSyncServerExchange exchange,
			McpSchema.ReadResourceRequest request) {
		logger.debug("Serving history resource request for {}",
				request != null ? request.uri() : HISTORY_RESOURCE_URI);
		McpSchema.TextResourceContents contents = new McpSchema.TextResourceContents(HISTORY_RESOURCE_URI,
				"text/markdown", render());
		return new McpSchema.ReadResourceResult(List.of(contents));
	}

	String render() {
		StringBuilder markdown = new StringBuilder("# Operation history\n");
		section(markdown, "Undo", descriptions(this.engine.undoHistory()));
		section(markdown, "Redo", descriptions(this.engine.redoHistory()));
		List<String> previous = new ArrayList<>(this.statePersistence.previousSession());
		if (!previous.isEmpty()) {
			Collections.reverse(previous);
			section(markdown, "Previous session (not undoable)", previous);
		}
		return markdown.toString();
	}

	private static void section(StringBuilder markdown, String title, List<String> lines) {
		markdown.append("\n## ").append(title).append('\n');
		if (lines.isEmpty()) {
			markdown.append("_empty_\n");
			return;
		}
		lines.forEach(line -> markdown.append("- ").append(line).append('\n'));
	}

	/**
	 * @return descriptions newest first
	 */
	private static List<String> descriptions(List<Operation> oldestFirst) {
		List<String> lines = new ArrayList<>(oldestFirst.size());
		for (int i = oldestFirst.size() - 1; i >= 0; i--) {
			lines.add(oldestFirst.get(i).description());
		}
		return lines;
	}

}
