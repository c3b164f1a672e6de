package org.healthdata.reporting.join;

import org.healthdata.reporting.common.ErrorCode;
import org.healthdata.reporting.common.ReportingException;

import lombok.Getter;

@Getter
public class JoinLimitExceededException extends ReportingException {
    private final String joinKey;
    private final long pairCount;
    private final int maxPairsPerKey;

    public JoinLimitExceededException(String joinKey, long pairCount, int maxPairsPerKey) {
        super(ErrorCode.JOIN_PAIR_LIMIT_EXCEEDED, "Join key '" + joinKey + "' would produce " + pairCount
            + " matched pairs, more than the limit of " + maxPairsPerKey);
        this.joinKey = joinKey;
        this.pairCount = pairCount;
        this.maxPairsPerKey = maxPairsPerKey;
    }
}
