package org.nowstart.compass.repository;

import org.nowstart.compass.data.dto.MarketContextRequest;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

/**
 * Market-data ingestion service. Returns already filtered and scored snapshots.
 */
@FeignClient(
        name = "marketDataClient",
        url = "${compass.market-data.base-url}"
)
public interface MarketDataFeignClient {

    @GetMapping("/v1/contexts/{contextId}/latest")
    MarketContextRequest getLatestSnapshot(@PathVariable("contextId") String contextId);
}
