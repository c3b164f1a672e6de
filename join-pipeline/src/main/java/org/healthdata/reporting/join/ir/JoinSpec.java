package org.healthdata.reporting.join.ir;

import org.healthdata.reporting.common.ErrorCode;
import org.healthdata.reporting.join.JoinConfigurationException;

import lombok.Builder;

/**
 * A single two-sided join. {@code limit} caps the records fetched per side; null means the pipeline default.
 */
@Builder
public record JoinSpec(
    JoinSource left,
    JoinSource right,
    String leftField,
    String rightField,
    JoinType joinType,
    Integer limit
) {
    /**
     * @throws JoinConfigurationException for the first problem found
     */
    public void validate() {
        JoinSource.validate(left, ErrorCode.INVALID_LEFT_SOURCE, "Left");
        JoinSource.validate(right, ErrorCode.INVALID_RIGHT_SOURCE, "Right");
        if (leftField == null || leftField.isBlank() || rightField == null || rightField.isBlank()) {
            throw new JoinConfigurationException(ErrorCode.INVALID_JOIN_FIELD,
                "Both leftField and rightField are required");
        }
        if (joinType == null) {
            throw new JoinConfigurationException(ErrorCode.INVALID_JOIN_TYPE, "joinType is required");
        }
        if (limit != null && limit < 1) {
            throw new JoinConfigurationException(ErrorCode.INVALID_SIZE, "limit must be positive: " + limit);
        }
    }
}
