package com.example.zenflow.controller;

import com.example.zenflow.exception.InvalidDurationException;
import com.example.zenflow.mcp.CapabilitiesTools;
import com.example.zenflow.mcp.ProgressTools;
import com.example.zenflow.mcp.SyncVerificationTools;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Minimal JSON-RPC endpoint exposing the progress tools over MCP.
 */
@RestController
@ConditionalOnProperty(name = "zenflow.role", havingValue = "writer", matchIfMissing = true)
public class McpServerController {

    private static final Logger logger = LoggerFactory.getLogger(McpServerController.class);

    private static final Set<String> OPTIONAL_ARGUMENTS = Set.of("at", "limit");

    private final ProgressTools progressTools;
    private final SyncVerificationTools syncVerificationTools;
    private final CapabilitiesTools capabilitiesTools;
    private final ObjectMapper objectMapper;

    public McpServerController(ProgressTools progressTools, SyncVerificationTools syncVerificationTools,
                               CapabilitiesTools capabilitiesTools, ObjectMapper objectMapper) {
        this.progressTools = progressTools;
        this.syncVerificationTools = syncVerificationTools;
        this.capabilitiesTools = capabilitiesTools;
        this.objectMapper = objectMapper;
    }

    @PostMapping(value = "/mcp/message", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> handleMcpMessage(@RequestBody Map<String, Object> request) {
        return Mono.fromCallable(() -> {
            try {
                String method = (String) request.get("method");
                if (method == null) {
                    return createErrorResponse("Missing method field", -32600);
                }

                switch (method) {
                    case "initialize":
                        return handleInitialize();
                    case "tools/list":
                        return handleToolsList();
                    case "tools/call":
                        return handleToolCall(request);
                    default:
                        return createErrorResponse("Method not found: " + method, -32601);
                }
            } catch (Exception e) {
                logger.error("MCP request failed", e);
                return createErrorResponse("Internal error: " + e.getMessage(), -32603);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private Map<String, Object> handleInitialize() {
        return Map.of(
                "protocolVersion", "2024-11-05",
                "capabilities", Map.of(
                        "tools", Map.of("listChanged", false),
                        "resources", Map.of(),
                        "prompts", Map.of(),
                        "completion", Map.of()
                ),
                "serverInfo", Map.of(
                        "name", "zenflow-progress",
                        "version", "0.1.0"
                )
        );
    }

    Map<String, Object> handleToolsList() {
        List<Map<String, Object>> tools = new ArrayList<>();

        tools.add(createToolInfo("progress_record_session", "Record a completed practice session",
                Map.of(
                        "durationMinutes", Map.of("type", "integer", "description", "Session length in minutes, must be positive"),
                        "at", Map.of("type", "string", "description", "ISO-8601 instant the session ended (optional, default now)")
                )));
        tools.add(createToolInfo("progress_state", "Get total minutes, session count and streaks", Map.of()));
        tools.add(createToolInfo("progress_sessions", "List recorded sessions, newest first",
                Map.of("limit", Map.of("type", "integer", "description", "Maximum number of sessions (optional)"))));
        tools.add(createToolInfo("progress_gateway_status", "Report whether the shared store or the local fallback is in use", Map.of()));
        tools.add(createToolInfo("progress_verify_sync", "Compare shared progress state with the event store", Map.of()));
        tools.add(createToolInfo("progress_force_repair", "Rebuild shared progress state from the event store", Map.of()));
        tools.add(createToolInfo("capabilities_list", "List available tool names and counts for introspection", Map.of()));

        return Map.of("tools", tools);
    }

    private Map<String, Object> createToolInfo(String name, String description, Map<String, Object> properties) {
        return Map.of(
                "name", name,
                "description", description,
                "inputSchema", Map.of(
                        "type", "object",
                        "properties", properties,
                        "required", properties.keySet().stream()
                                .filter(key -> !OPTIONAL_ARGUMENTS.contains(key))
                                .toList()
                )
        );
    }

    Map<String, Object> handleToolCall(Map<String, Object> request) {
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> params = (Map<String, Object>) request.get("params");
            String toolName = params == null ? null : (String) params.get("name");
            if (toolName == null) {
                return createErrorResponse("Missing tool name", -32602);
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> arguments = (Map<String, Object>) params.get("arguments");

            Object result = callTool(toolName, arguments != null ? arguments : Map.of());

            return Map.of(
                    "content", Map.of(
                            "type", "text",
                            "text", objectMapper.writeValueAsString(result)
                    ),
                    "isError", false
            );
        } catch (InvalidDurationException | DateTimeParseException | IllegalArgumentException e) {
            return createErrorResponse("Invalid params: " + e.getMessage(), -32602);
        } catch (Exception e) {
            logger.error("Tool execution failed", e);
            return createErrorResponse("Tool execution failed: " + e.getMessage(), -32603);
        }
    }

    private Object callTool(String toolName, Map<String, Object> arguments) {
        switch (toolName) {
            case "progress_record_session":
                return progressTools.progress_record_session(
                        toInteger(arguments.get("durationMinutes")),
                        (String) arguments.get("at")
                );
            case "progress_state":
                return progressTools.progress_state();
            case "progress_sessions":
                return progressTools.progress_sessions(toInteger(arguments.get("limit")));
            case "progress_gateway_status":
                return progressTools.progress_gateway_status();
            case "progress_verify_sync":
                return syncVerificationTools.progress_verify_sync();
            case "progress_force_repair":
                return syncVerificationTools.progress_force_repair();
            case "capabilities_list":
                return capabilitiesTools.capabilities_list();
            default:
                throw new IllegalArgumentException("Unknown tool: " + toolName);
        }
    }

    private static Integer toInteger(Object value) {
        if (value == null) return null;
        if (value instanceof Number) return ((Number) value).intValue();
        return Integer.valueOf(value.toString());
    }

    private Map<String, Object> createErrorResponse(String message, int code) {
        return Map.of(
                "error", Map.of(
                        "code", code,
                        "message", message
                ),
                "isError", true
        );
    }

    @GetMapping("/mcp/capabilities")
    public Map<String, Object> getCapabilities() {
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> tools = (List<Map<String, Object>>) handleToolsList().get("tools");

        return Map.of(
                "server", Map.of(
                        "name", "zenflow-progress",
                        "version", "0.1.0"
                ),
                "capabilities", Map.of(
                        "tools", true,
                        "resources", false,
                        "prompts", false,
                        "completion", false
                ),
                "tools", tools.stream()
                        .map(tool -> Map.of(
                                "name", tool.get("name"),
                                "description", tool.get("description")
                        ))
                        .toList()
        );
    }
}
