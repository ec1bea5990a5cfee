package org.nowstart.compass.data.dto;

import java.util.List;

public record StrategyLineageDto(
        String strategyId,
        int headVersion,
        List<StrategyDto> versions
) {
}
