package dev.fileops.server.tool;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

import dev.fileops.engine.model.Operation;
import dev.fileops.engine.model.OperationError;
import dev.fileops.engine.model.OperationResult;
import dev.fileops.server.service.WorkspaceService;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * Converts engine results into MCP tool results, rendering paths relative to the workspace. Failed
 * operations become {@code isError} results; nothing is thrown to the transport.
 */
@Component
@RequiredArgsConstructor
public class ToolResults {

	private static final Logger logger = LoggerFactory.getLogger(ToolResults.class);

	private final WorkspaceService workspace;

	public McpSchema.CallToolResult fromResult(OperationResult result) {
		String message = describe(result);
		return result.success() ? success(message, structured(result)) : error(message, structured(result));
	}

	/**
	 * Structured form of a result with workspace-relative paths.
	 */
	public Map<String, Object> structured(OperationResult result) {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("success", result.success());
		Operation operation = result.operation();
		if (operation != null) {
			structured.put("operation", operation.kind().id());
			structured.put("description", operation.description());
			structured.put("undoable", operation.undoable());
		}
		structured.put("paths", relative(result.resultPaths()));
		if (!result.errors().isEmpty()) {
			structured.put("errors", result.errors().stream().map(this::structured).collect(Collectors.toList()));
		}
		if (!result.warnings().isEmpty()) {
			structured.put("warnings", result.warnings());
		}
		return structured;
	}

	public List<String> relative(List<Path> paths) {
		return paths.stream().map(this.workspace::relativeString).collect(Collectors.toList());
	}

	public McpSchema.CallToolResult success(String message, Map<String, Object> structuredContent) {
		logger.info("Success response: {}", message);
		return McpSchema.CallToolResult.builder()
			.addTextContent(message)
			.structuredContent(structuredContent)
			.build();
	}

	public McpSchema.CallToolResult error(String message, Map<String, Object> structuredContent) {
		logger.warn("Error response: {}", message);
		return McpSchema.CallToolResult.builder()
			.addTextContent(message)
			.isError(true)
			.structuredContent(structuredContent)
			.build();
	}

	/**
	 * Error result for a missing required argument.
	 */
	public McpSchema.CallToolResult missingArgument(String name) {
		return error(name + " argument is required", Map.of("missing", name));
	}

	private Map<String, Object> structured(OperationError error) {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("kind", error.kind().name());
		if (error.path() != null) {
			structured.put("path", this.workspace.relativeString(error.path()));
		}
		structured.put("message", error.message());
		return structured;
	}

	private String describe(OperationResult result) {
		List<String> lines = new ArrayList<>();
		lines.add(result.summaryLine());
		if (result.success() && !result.resultPaths().isEmpty()) {
			relative(result.resultPaths()).forEach(path -> lines.add("- " + path));
		}
		if (result.errors().size() > 1) {
			result.errors().forEach(error -> lines.add("! %s: %s".formatted(error.kind(), error.message())));
		}
		if (result.success() && result.operation() != null) {
			result.warnings().forEach(warning -> lines.add("note: " + warning));
		}
		return String.join(System.lineSeparator(), lines);
	}

}
