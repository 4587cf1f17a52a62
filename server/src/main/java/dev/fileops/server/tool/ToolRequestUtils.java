package dev.fileops.server.tool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import io.modelcontextprotocol.spec.McpSchema;

/**
 * Lenient readers for tool call arguments, which arrive as loosely typed JSON.
 */
public final class ToolRequestUtils {

	private ToolRequestUtils() {
	}

	public static Map<String, Object> safeArguments(McpSchema.CallToolRequest request) {
		if (request == null || request.arguments() == null) {
			return Map.of();
		}
		return request.arguments();
	}

	public static String stringArgument(Map<String, Object> arguments, String name, String defaultValue) {
		Object value = arguments.get(name);
		if (value == null) {
			return defaultValue;
		}
		String text = value.toString();
		return text.isBlank() ? defaultValue : text;
	}

	/**
	 * Read a boolean, accepting JSON booleans and the strings {@code true}/{@code false}.
	 */
	public static boolean booleanArgument(Map<String, Object> arguments, String name, boolean defaultValue) {
		Object value = arguments.get(name);
		if (value instanceof Boolean flag) {
			return flag;
		}
		if (value instanceof String text && !text.isBlank()) {
			return Boolean.parseBoolean(text.trim());
		}
		return defaultValue;
	}

	/**
	 * Read a list of strings; a single string is treated as a one-element list.
	 * @return the non-blank entries, empty when the argument is missing
	 */
	public static List<String> stringListArgument(Map<String, Object> arguments, String name) {
		Object value = arguments.get(name);
		List<String> values = new ArrayList<>();
		if (value instanceof Collection<?> items) {
			for (Object item : items) {
				if (item != null && !item.toString().isBlank()) {
					values.add(item.toString());
				}
			}
		}
		else if (value != null && !value.toString().isBlank()) {
			values.add(value.toString());
		}
		return values;
	}

}
