package com.example.zenflow.mcp;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

@Configuration
@ConditionalOnProperty(name = "zenflow.role", havingValue = "writer", matchIfMissing = true)
public class ToolRegistrationConfig {

    private final ProgressTools progressTools;
    private final SyncVerificationTools syncTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(ProgressTools progressTools, SyncVerificationTools syncTools,
                                  CapabilitiesTools capTools) {
        this.progressTools = progressTools;
        this.syncTools = syncTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(progressTools, syncTools, capTools)
                .build();
    }
}
