package com.alphaguard.exception;

import com.alphaguard.domain.enums.HypothesisStatus;
import java.util.Map;

public class IllegalTransitionException extends BaseException {

    public IllegalTransitionException(String hypothesisId, HypothesisStatus from, HypothesisStatus to) {
        super(
                ErrorCode.ILLEGAL_TRANSITION,
                String.format("Hypothesis '%s' cannot move from %s to %s", hypothesisId, from, to),
                Map.of("hypothesisId", hypothesisId, "from", from.name(), "to", to.name()));
    }

    public IllegalTransitionException(String hypothesisId, String reason) {
        super(
                ErrorCode.ILLEGAL_TRANSITION,
                String.format("Hypothesis '%s': %s", hypothesisId, reason),
                Map.of("hypothesisId", hypothesisId));
    }
}
