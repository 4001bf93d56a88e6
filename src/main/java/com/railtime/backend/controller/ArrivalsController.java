package com.railtime.backend.controller;

import com.railtime.backend.model.ArrivalsResult;
import com.railtime.backend.model.ErrorResponse;
import com.railtime.backend.service.ArrivalsCacheService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/realtime")
@RequiredArgsConstructor
@Tag(name = "Realtime Arrivals", description = "Cached MARTA rail arrivals")
public class ArrivalsController {

    private final ArrivalsCacheService arrivalsCacheService;

    @Value("${marta.api.key:}")
    private String apiKey;

    @Operation(summary = "Get Rail Arrivals", description = "Returns the latest MARTA rail arrivals. Data is cached for one minute and served stale while the MARTA API is failing.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Arrivals returned (possibly stale)", content = @Content(mediaType = "application/json", schema = @Schema(implementation = ArrivalsResult.class))),
            @ApiResponse(responseCode = "500", description = "No credential configured, or MARTA failed with nothing cached", content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping
    public ResponseEntity<ArrivalsResult> getArrivals() {
        ArrivalsResult result = arrivalsCacheService.getArrivals(apiKey);
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(result);
    }
}
