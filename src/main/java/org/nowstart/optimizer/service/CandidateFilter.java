package org.nowstart.optimizer.service;

import org.nowstart.optimizer.data.dto.Candidate;

@FunctionalInterface
public interface CandidateFilter {

    CandidateFilter ACCEPT_ALL = candidate -> true;

    boolean accept(Candidate candidate);
}
