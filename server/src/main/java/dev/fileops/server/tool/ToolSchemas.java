package dev.fileops.server.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * Tool specification and JSON schema helpers shared by the tool classes.
 */
final class ToolSchemas {

	private ToolSchemas() {
	}

	static Map<String, Object> string(String description) {
		return Map.of("type", "string", "description", description);
	}

	static Map<String, Object> stringEnum(String description, List<String> values) {
		return Map.of("type", "string", "description", description, "enum", values);
	}

	static Map<String, Object> bool(String description) {
		return Map.of("type", "boolean", "description", description);
	}

	static Map<String, Object> paths(String description) {
		return Map.of("type", "array", "description", description, "items", Map.of("type", "string"), "minItems", 1);
	}

	/**
	 * @param properties alternating property names and schemas, in display order
	 */
	static McpSchema.JsonSchema object(List<String> required, Object... properties) {
		Map<String, Object> ordered = new LinkedHashMap<>();
		for (int i = 0; i + 1 < properties.length; i += 2) {
			ordered.put((String) properties[i], properties[i + 1]);
		}
		return new McpSchema.JsonSchema("object", ordered, required, false, null, null);
	}

	static McpServerFeatures.SyncToolSpecification tool(String name, String title, String description,
			McpSchema.JsonSchema inputSchema,
			BiFunction<McpSyncServerExchange, McpSchema.CallToolRequest, McpSchema.CallToolResult> handler) {
		return McpServerFeatures.SyncToolSpecification.builder()
			.tool(McpSchema.Tool.builder()
				.name(name)
				.title(title)
				.description(description)
				.inputSchema(inputSchema)
				.build())
			.callHandler(handler)
			.build();
	}

}
