package com.canihazhouze.agent.api;

import com.canihazhouze.agent.engine.ExecutionQueue;
import com.canihazhouze.agent.model.ModelDeployment;
import com.canihazhouze.agent.tool.ToolDescriptor;
import com.canihazhouze.agent.tool.ToolProviderPort;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class CatalogController {

    private final ToolProviderPort toolProvider;
    private final ExecutionQueue queue;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "queueDepth", queue.size(),
                "queueCapacity", queue.capacity()));
    }

    @GetMapping("/models")
    public List<ModelDeployment> models() {
        return ModelDeployment.AVAILABLE;
    }

    @GetMapping("/tools")
    public List<ToolDescriptor> tools() {
        return toolProvider.listTools();
    }
}
