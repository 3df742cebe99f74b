package com.example.zenflow.mcp;

import com.example.zenflow.service.ProgressSyncVerificationService;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
@ConditionalOnProperty(name = "zenflow.role", havingValue = "writer", matchIfMissing = true)
public class SyncVerificationTools {

    private final ProgressSyncVerificationService syncVerificationService;

    public SyncVerificationTools(ProgressSyncVerificationService syncVerificationService) {
        this.syncVerificationService = syncVerificationService;
    }

    @Tool(description = "Compare the shared progress state with a replay of the session event store")
    public Map<String, Object> progress_verify_sync() {
        return syncVerificationService.verifySync();
    }

    @Tool(description = "Rebuild shared progress state from the session event store (emergency use only)")
    public Map<String, Object> progress_force_repair() {
        return syncVerificationService.forceRepair();
    }
}
