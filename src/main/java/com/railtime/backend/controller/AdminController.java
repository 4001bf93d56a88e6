package com.railtime.backend.controller;

import com.railtime.backend.model.CacheSnapshot;
import com.railtime.backend.model.RefreshSummary;
import com.railtime.backend.service.ArrivalsCacheService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Admin", description = "Cache inspection and manual refresh")
public class AdminController {

    private final ArrivalsCacheService arrivalsCacheService;

    @Value("${marta.api.key:}")
    private String apiKey;

    @Operation(summary = "Inspect Cache", description = "Returns the state of the arrivals cache, the retry timer and lookup statistics.")
    @ApiResponse(responseCode = "200", description = "Cache state")
    @GetMapping("/cache")
    public ResponseEntity<CacheSnapshot> cache() {
        return ResponseEntity.ok(arrivalsCacheService.snapshot());
    }

    @Operation(summary = "Trigger Manual Refresh", description = "Refreshes the arrivals cache from MARTA, ignoring the TTL.")
    @ApiResponse(responseCode = "200", description = "Refresh attempted; see status in the summary")
    @PostMapping("/refresh")
    public ResponseEntity<RefreshSummary> refresh() {
        log.info("🔄 ADMIN: Manual arrivals refresh triggered");
        return ResponseEntity.ok(arrivalsCacheService.forceRefresh(apiKey));
    }
}
