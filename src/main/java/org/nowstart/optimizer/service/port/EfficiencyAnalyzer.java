package org.nowstart.optimizer.service.port;

import java.util.List;
import org.nowstart.optimizer.data.dto.Candidate;
import org.nowstart.optimizer.data.dto.CandidateAnalysis;
import org.nowstart.optimizer.data.dto.StrategySeries;

/**
 * Scores an aligned candidate. The returned stats must carry an efficiency score; higher is
 * better.
 */
public interface EfficiencyAnalyzer {

    CandidateAnalysis analyze(List<StrategySeries> data, Candidate candidate);
}
