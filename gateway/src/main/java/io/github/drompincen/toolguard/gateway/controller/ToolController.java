package io.github.drompincen.toolguard.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.toolguard.protocol.api.LlmToolDefinition;
import io.github.drompincen.toolguard.protocol.api.ToolDescriptor;
import io.github.drompincen.toolguard.protocol.api.ToolInvocationResponse;
import io.github.drompincen.toolguard.runtime.agent.ToolCallPipeline;
import io.github.drompincen.toolguard.runtime.tools.Tool;
import io.github.drompincen.toolguard.runtime.tools.ToolDispatcher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tools")
public class ToolController {

    private final ToolDispatcher dispatcher;
    private final ToolCallPipeline pipeline;

    public ToolController(ToolDispatcher dispatcher, ToolCallPipeline pipeline) {
        this.dispatcher = dispatcher;
        this.pipeline = pipeline;
    }

    @GetMapping
    public List<ToolDescriptor> list() {
        return dispatcher.getTools().stream().map(Tool::descriptor).toList();
    }

    @GetMapping("/llm")
    public List<LlmToolDefinition> llmDefinitions() {
        return dispatcher.getLlmTools();
    }

    @GetMapping("/{name}")
    public ResponseEntity<ToolDescriptor> describe(@PathVariable String name) {
        return dispatcher.getTool(name)
                .map(t -> ResponseEntity.ok(t.descriptor()))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{name}/invoke")
    public ResponseEntity<ToolInvocationResponse> invoke(@PathVariable String name,
                                                         @RequestParam(required = false) String toolCallId,
                                                         @RequestBody(required = false) JsonNode input) {
        if (dispatcher.getTool(name).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(pipeline.execute(toolCallId, name, input).toResponse());
    }
}
