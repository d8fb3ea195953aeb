package com.bko.controltower.api;

import com.bko.controltower.config.ControlTowerProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final ControlTowerProperties properties;

    public HealthController(ControlTowerProperties properties) {
        this.properties = properties;
    }

    @GetMapping
    public HealthResponse health() {
        return new HealthResponse("healthy", "control-tower",
                properties.getVision().getUrl(), properties.getSupplier().getUrl());
    }
}
