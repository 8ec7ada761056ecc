package io.github.drompincen.toolguard.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Set;

/** Which tool calls leave the workspace untouched, and how mutating calls are summarised in commits. */
public final class ToolCallClassifier {

    private static final Set<String> READ_ONLY_TOOLS =
            Set.of("read_file", "read_many_files", "list_directory", "glob", "search_files");

    private ToolCallClassifier() {}

    public static boolean isReadOnly(String toolName) {
        return toolName != null && READ_ONLY_TOOLS.contains(toolName.toLowerCase(Locale.ROOT));
    }

    public static String summarize(String toolName, JsonNode arguments) {
        String filePath = text(arguments, "file_path");
        String command = text(arguments, "command");
        return switch (toolName) {
            case "write_file" -> filePath != null ? "Write " + filePath : toolName;
            case "replace_in_file" -> filePath != null ? "Edit " + filePath : toolName;
            case "run_shell_command" -> command != null ? "Run: " + firstWord(command) : toolName;
            default -> toolName;
        };
    }

    private static String firstWord(String command) {
        String trimmed = command.strip();
        int space = trimmed.indexOf(' ');
        String word = space < 0 ? trimmed : trimmed.substring(0, space);
        return word.isEmpty() ? "command" : word;
    }

    private static String text(JsonNode arguments, String field) {
        if (arguments == null || !arguments.hasNonNull(field)) {
            return null;
        }
        return arguments.get(field).asText();
    }
}
