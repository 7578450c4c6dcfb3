package com.pawshugs.adoption.controller;

import com.pawshugs.adoption.model.StatusReport;
import com.pawshugs.adoption.service.DiagnosticsService;
import com.pawshugs.adoption.service.SchemaRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Welcome message, store diagnostics and schema introspection.
 */
@RestController
@RequiredArgsConstructor
public class StatusController {

    private final DiagnosticsService diagnosticsService;
    private final SchemaRegistry schemaRegistry;

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", "Welcome to Paws & Hugs API");
    }

    /**
     * Always 200; store problems are reported inside the body.
     */
    @GetMapping("/test")
    public StatusReport test() {
        return diagnosticsService.reportStatus();
    }

    @GetMapping("/schema")
    public Map<String, List<String>> schema() {
        return Map.of("models", schemaRegistry.modelNames());
    }
}
