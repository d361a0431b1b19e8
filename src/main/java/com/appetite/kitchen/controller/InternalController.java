package com.appetite.kitchen.controller;

import com.appetite.kitchen.model.dto.CacheStats;
import com.appetite.kitchen.service.bootstrap.TicketCacheBootstrapService;
import com.appetite.kitchen.service.bootstrap.WarmResult;
import com.appetite.kitchen.service.cache.TicketStateCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational endpoints for the ticket cache.
 */
@Slf4j
@RestController
@RequestMapping("/api/internal")
@RequiredArgsConstructor
public class InternalController {

    private final TicketCacheBootstrapService bootstrapService;
    private final TicketStateCache ticketStateCache;

    /**
     * Reloads the cache from the repository, e.g. after seeding demo data.
     */
    @PostMapping("/reload-cache")
    public ResponseEntity<WarmResult> reloadCache() {
        log.info("🔄 Manual ticket cache reload requested");
        WarmResult result = bootstrapService.warmFromRepository();
        return ResponseEntity.ok(result);
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStats> cacheStats() {
        return ResponseEntity.ok(ticketStateCache.stats());
    }
}
