package org.example.mystery.controller;

import org.example.mystery.service.InvestigationSessionService;
import org.example.mystery.service.cache.GameContentCache;
import org.example.mystery.service.context.ContextIndex;
import org.example.mystery.service.llm.GenerationBackend;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/status")
public class StatusController {

    private final GenerationBackend generationBackend;
    private final GameContentCache contentCache;
    private final ContextIndex contextIndex;
    private final InvestigationSessionService sessionService;

    public StatusController(GenerationBackend generationBackend,
                            GameContentCache contentCache,
                            ContextIndex contextIndex,
                            InvestigationSessionService sessionService) {
        this.generationBackend = generationBackend;
        this.contentCache = contentCache;
        this.contextIndex = contextIndex;
        this.sessionService = sessionService;
    }

    @GetMapping
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("provider", generationBackend.getBackendName());
        status.put("providerAvailable", generationBackend.isAvailable());
        status.put("activeSessions", sessionService.activeSessionCount());
        status.put("cache", contentCache.stats());
        status.put("context", contextIndex.stats());
        return status;
    }
}
