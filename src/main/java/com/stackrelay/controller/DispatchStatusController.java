package com.stackrelay.controller;

import com.stackrelay.model.dto.DispatchStatus;
import com.stackrelay.service.cache.ResultCache;
import com.stackrelay.service.dispatch.RequestDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Status and cache management for the dispatch layer.
 */
@Slf4j
@RestController
@RequestMapping("/v1/dispatch")
public class DispatchStatusController {

    private final RequestDispatcher dispatcher;
    private final ResultCache cache;

    public DispatchStatusController(RequestDispatcher dispatcher, ResultCache cache) {
        this.dispatcher = dispatcher;
        this.cache = cache;
    }

    /**
     * Queue depth, counters, cache statistics and per-mode quota.
     */
    @GetMapping("/status")
    public ResponseEntity<DispatchStatus> getStatus() {
        return ResponseEntity.ok(dispatcher.statusSnapshot());
    }

    /**
     * Clear the result cache. In-flight requests are not affected.
     */
    @PostMapping("/cache/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        log.info("Cache clear requested");
        cache.clear();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Result cache cleared"
        ));
    }
}
