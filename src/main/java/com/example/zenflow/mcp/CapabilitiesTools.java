package com.example.zenflow.mcp;

import org.springframework.ai.tool.annotation.Tool;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.lang.reflect.Method;
import java.util.*;

@Service
@ConditionalOnProperty(name = "zenflow.role", havingValue = "writer", matchIfMissing = true)
public class CapabilitiesTools {

    private static final Map<String, Class<?>> TOOL_GROUPS = new LinkedHashMap<>();

    static {
        TOOL_GROUPS.put("progress", ProgressTools.class);
        TOOL_GROUPS.put("sync", SyncVerificationTools.class);
        TOOL_GROUPS.put("capabilities", CapabilitiesTools.class);
    }

    @Tool(description = "List available tool names and counts for introspection")
    public Map<String,Object> capabilities_list() {
        Map<String, Object> groups = new LinkedHashMap<>();
        int total = 0;
        for (Map.Entry<String, Class<?>> group : TOOL_GROUPS.entrySet()) {
            List<String> names = toolNames(group.getValue());
            groups.put(group.getKey(), Map.of("count", names.size(), "tools", names));
            total += names.size();
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("server", Map.of("name", "zenflow-progress", "version", "0.1.0"));
        result.put("groups", groups);
        result.put("totalTools", total);
        return result;
    }

    static List<String> toolNames(Class<?> toolClass) {
        List<String> names = new ArrayList<>();
        for (Method method : toolClass.getDeclaredMethods()) {
            Tool tool = method.getAnnotation(Tool.class);
            if (tool != null) {
                names.add(tool.name().isEmpty() ? method.getName() : tool.name());
            }
        }
        Collections.sort(names);
        return names;
    }
}
