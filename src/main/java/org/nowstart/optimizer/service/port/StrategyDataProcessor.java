package org.nowstart.optimizer.service.port;

import org.nowstart.optimizer.data.dto.Candidate;
import org.nowstart.optimizer.data.dto.ProcessedCandidate;

/**
 * Loads and aligns the time series of every strategy in a candidate. Implementations may throw
 * any runtime exception; the search treats it as a failure of that candidate only.
 */
public interface StrategyDataProcessor {

    ProcessedCandidate process(Candidate candidate);
}
