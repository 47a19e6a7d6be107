package org.nowstart.optimizer.data.type;

import java.util.Locale;

public enum StrategyType {
    SMA,
    EMA,
    MACD,
    ATR;

    public boolean usesSignalPeriod() {
        return this != SMA && this != EMA;
    }

    public static StrategyType from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("strategy type is required");
        }
        return StrategyType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
