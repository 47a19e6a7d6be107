package org.nowstart.optimizer.service;

import lombok.extern.slf4j.Slf4j;
import org.nowstart.optimizer.data.dto.Candidate;
import org.springframework.stereotype.Service;

/**
 * Gives every member of a candidate the same allocation of {@code 1 / size}.
 * Members are copied; the records the candidate was built from keep their allocation.
 */
@Slf4j
@Service
public class AllocationNormalizer {

    public Candidate normalize(Candidate candidate) {
        double allocation = 1.0 / candidate.size();
        log.info("event=allocation_normalized strategies={} allocation={}", candidate.size(), allocation);
        return candidate.map(strategy -> strategy.withAllocation(allocation));
    }
}
