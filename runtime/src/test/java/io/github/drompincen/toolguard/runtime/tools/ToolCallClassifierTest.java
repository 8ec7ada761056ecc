package io.github.drompincen.toolguard.runtime.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ToolCallClassifierTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @ParameterizedTest
    @ValueSource(strings = {"read_file", "READ_FILE", "read_many_files", "list_directory", "glob", "Search_Files"})
    void readOnlyToolsAreExempt(String toolName) {
        assertThat(ToolCallClassifier.isReadOnly(toolName)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"write_file", "replace_in_file", "run_shell_command", "restore_checkpoint", "unknown"})
    void everythingElseMutates(String toolName) {
        assertThat(ToolCallClassifier.isReadOnly(toolName)).isFalse();
    }

    @Test
    void summariesNameTheTarget() {
        ObjectNode file = MAPPER.createObjectNode().put("file_path", "src/Main.java");
        ObjectNode command = MAPPER.createObjectNode().put("command", "  mvn -q test");

        assertThat(ToolCallClassifier.summarize("write_file", file)).isEqualTo("Write src/Main.java");
        assertThat(ToolCallClassifier.summarize("replace_in_file", file)).isEqualTo("Edit src/Main.java");
        assertThat(ToolCallClassifier.summarize("run_shell_command", command)).isEqualTo("Run: mvn");
    }

    @Test
    void summaryFallsBackToToolName() {
        assertThat(ToolCallClassifier.summarize("write_file", MAPPER.createObjectNode())).isEqualTo("write_file");
        assertThat(ToolCallClassifier.summarize("restore_checkpoint", null)).isEqualTo("restore_checkpoint");
    }
}
