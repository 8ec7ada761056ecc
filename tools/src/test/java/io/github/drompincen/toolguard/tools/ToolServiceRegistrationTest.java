package io.github.drompincen.toolguard.tools;

import io.github.drompincen.toolguard.runtime.tools.Tool;
import org.junit.jupiter.api.Test;

import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

class ToolServiceRegistrationTest {

    @Test
    void allBuiltInToolsAreDiscoverable() {
        var names = ServiceLoader.load(Tool.class).stream()
                .map(provider -> provider.get().name())
                .toList();

        assertThat(names).containsExactlyInAnyOrder("read_file", "list_directory", "search_files",
                "write_file", "replace_in_file", "run_shell_command", "restore_checkpoint");
    }
}
