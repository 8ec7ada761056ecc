package io.github.drompincen.toolguard.runtime.tools;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolResultTest {

    @Test
    void successCreatesSuccessfulResult() {
        ToolResult result = ToolResult.success(new TextNode("output data"));

        assertThat(result.success()).isTrue();
        assertThat(result.isError()).isFalse();
        assertThat(result.userCancelled()).isFalse();
        assertThat(result.content()).isEqualTo("output data");
        assertThat(result.error()).isNull();
    }

    @Test
    void failureCarriesErrorAsContent() {
        ToolResult result = ToolResult.failure("File not found");

        assertThat(result.isError()).isTrue();
        assertThat(result.userCancelled()).isFalse();
        assertThat(result.content()).isEqualTo("File not found");
    }

    @Test
    void cancelledIsAnErrorFlaggedAsUserCancelled() {
        ToolResult result = ToolResult.cancelled("Command cancelled");

        assertThat(result.isError()).isTrue();
        assertThat(result.userCancelled()).isTrue();
    }

    @Test
    void structuredOutputRendersAsJson() {
        ToolResult result = ToolResult.success(JsonNodeFactory.instance.objectNode().put("bytes", 5));

        assertThat(result.content()).isEqualTo("{\"bytes\":5}");
    }
}
