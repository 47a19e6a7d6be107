package org.nowstart.optimizer.data.dto;

public record PortfolioStats(
        Double score,
        Double winRate,
        Integer trades,
        Double profitFactor,
        Double expectancyPerTrade,
        Double sortinoRatio
) {
}
