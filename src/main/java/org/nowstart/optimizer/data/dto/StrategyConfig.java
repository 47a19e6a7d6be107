package org.nowstart.optimizer.data.dto;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.Builder;
import org.nowstart.optimizer.data.type.Direction;
import org.nowstart.optimizer.data.type.StrategyType;

@Builder(toBuilder = true)
public record StrategyConfig(
        String ticker,
        String timeframe,
        StrategyType strategyType,
        Direction direction,
        Integer fastPeriod,
        Integer slowPeriod,
        Integer signalPeriod,
        double allocation,
        Double stopLoss,
        PortfolioStats portfolioStats
) {

    public static final String UNKNOWN_TICKER = "unknown";

    public StrategyConfig {
        if (!Double.isFinite(allocation) || allocation < 0.0 || allocation > 1.0) {
            throw new IllegalArgumentException("allocation must be in [0, 1], got: " + allocation);
        }
        ticker = ticker == null || ticker.isBlank() ? null : ticker.trim();
        direction = direction != null ? direction : Direction.LONG;
    }

    public StrategyConfig withAllocation(double value) {
        return toBuilder().allocation(value).build();
    }

    public String tickerOrUnknown() {
        return ticker != null ? ticker : UNKNOWN_TICKER;
    }

    /**
     * Stable identifier in the form {@code TICKER_TYPE_FAST_SLOW[_SIGNAL]}.
     * The signal period is only part of the id for strategy types that use one.
     */
    public String strategyId() {
        List<String> parts = new ArrayList<>(5);
        parts.add(tickerOrUnknown().toUpperCase(Locale.ROOT));
        parts.add(strategyType == null ? "UNKNOWN" : strategyType.name());
        parts.add(periodText(fastPeriod));
        parts.add(periodText(slowPeriod));
        if (strategyType == null || strategyType.usesSignalPeriod()) {
            parts.add(periodText(signalPeriod));
        }
        return String.join("_", parts);
    }

    private static String periodText(Integer period) {
        return period == null ? "0" : period.toString();
    }
}
