package org.nowstart.optimizer.service;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.nowstart.optimizer.data.dto.Candidate;
import org.nowstart.optimizer.data.dto.StrategyConfig;

/**
 * Rejects candidates that hold more strategies of one sector than its limit allows.
 * Tickers without a sector mapping fall into {@value #OTHER_SECTOR}.
 */
public class SectorLimitFilter implements CandidateFilter {

    public static final String OTHER_SECTOR = "other";

    private final Map<String, Integer> sectorLimits;
    private final Map<String, String> sectorByTicker;

    public SectorLimitFilter(Map<String, Integer> sectorLimits, Map<String, String> tickerSectors) {
        Map<String, Integer> limits = new HashMap<>();
        sectorLimits.forEach((sector, limit) -> {
            if (limit == null || limit < 0) {
                throw new IllegalArgumentException("sector limit must be >= 0 for sector=" + sector);
            }
            limits.put(normalize(sector), limit);
        });
        Map<String, String> sectors = new HashMap<>();
        tickerSectors.forEach((ticker, sector) -> sectors.put(normalize(ticker), normalize(sector)));
        this.sectorLimits = Map.copyOf(limits);
        this.sectorByTicker = Map.copyOf(sectors);
    }

    @Override
    public boolean accept(Candidate candidate) {
        Map<String, Integer> counts = new HashMap<>();
        for (StrategyConfig strategy : candidate.strategies()) {
            counts.merge(sectorOf(strategy.ticker()), 1, Integer::sum);
        }
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            Integer limit = sectorLimits.get(entry.getKey());
            if (limit != null && entry.getValue() > limit) {
                return false;
            }
        }
        return true;
    }

    public String sectorOf(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            return OTHER_SECTOR;
        }
        return sectorByTicker.getOrDefault(normalize(ticker), OTHER_SECTOR);
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
