package org.nowstart.optimizer.data.exception;

import java.util.List;
import lombok.Getter;

@Getter
public class CandidateEvaluationException extends OptimizationException {

    public static final String CODE = "candidate_evaluation_error";

    private final List<String> strategyIds;

    public CandidateEvaluationException(List<String> strategyIds, Throwable cause) {
        super(CODE, describe(cause), cause);
        this.strategyIds = strategyIds == null ? List.of() : List.copyOf(strategyIds);
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "Candidate evaluation failed";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

}
