package com.platform.secretsync.api;

import com.platform.secretsync.lifecycle.ApplicationLifecycleManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/lifecycle")
public class LifecycleController {

    private final ApplicationLifecycleManager lifecycleManager;

    public LifecycleController(ApplicationLifecycleManager lifecycleManager) {
        this.lifecycleManager = lifecycleManager;
    }

    @GetMapping("/status")
    public ApplicationLifecycleManager.LifecycleStatus status() {
        return lifecycleManager.getStatus();
    }

    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        boolean ready = lifecycleManager.isReady();
        return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
            .body(Map.of("ready", ready, "phase", lifecycleManager.getCurrentPhase()));
    }
}
