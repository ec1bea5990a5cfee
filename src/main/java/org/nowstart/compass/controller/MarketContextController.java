package org.nowstart.compass.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.nowstart.compass.data.dto.MarketContextDto;
import org.nowstart.compass.data.dto.MarketContextRequest;
import org.nowstart.compass.service.MarketContextService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/market-contexts")
@RequiredArgsConstructor
@Tag(name = "Market context", description = "Market snapshots from the ingestion service")
public class MarketContextController {

    private final MarketContextService marketContextService;

    @PostMapping
    @Operation(summary = "Push snapshot", description = "Stores a market snapshot. Re-sending identical content is a no-op.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Snapshot stored"),
            @ApiResponse(responseCode = "400", description = "Validation failed"),
            @ApiResponse(responseCode = "409", description = "Snapshot already stored with different content")
    })
    public ResponseEntity<MarketContextDto> register(@RequestBody @Valid MarketContextRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(marketContextService.register(request));
    }

    @PostMapping("/{contextId}/import")
    @Operation(summary = "Pull snapshot", description = "Fetches the latest snapshot of a context from the ingestion service and stores it.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Snapshot stored"),
            @ApiResponse(responseCode = "404", description = "Unknown context"),
            @ApiResponse(responseCode = "502", description = "Market data service failed")
    })
    public ResponseEntity<MarketContextDto> importLatest(@PathVariable String contextId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(marketContextService.importLatest(contextId));
    }
}
