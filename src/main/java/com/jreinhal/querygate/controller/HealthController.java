package com.jreinhal.querygate.controller;

import com.jreinhal.querygate.catalog.ResourceCatalog;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "System", description = "Liveness")
public class HealthController {
    private final ResourceCatalog catalog;

    public HealthController(ResourceCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of("status", "UP", "catalogVersion", this.catalog.version());
    }
}
