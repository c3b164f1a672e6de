package org.healthdata.reporting.join.ir;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import org.healthdata.reporting.common.ErrorCode;
import org.healthdata.reporting.join.JoinConfigurationException;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JoinType {
    INNER("inner"),
    LEFT("left"),
    RIGHT("right"),
    FULL("full");

    private final String wireName;

    JoinType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * @throws JoinConfigurationException with {@link ErrorCode#INVALID_JOIN_TYPE} for anything but the four wire names
     */
    public static JoinType fromString(String value) {
        return Arrays.stream(values())
            .filter(type -> value != null && type.wireName.equals(value.trim().toLowerCase(Locale.ROOT)))
            .findFirst()
            .orElseThrow(() -> new JoinConfigurationException(ErrorCode.INVALID_JOIN_TYPE,
                "joinType must be one of: " + Arrays.stream(values()).map(JoinType::getWireName)
                    .collect(Collectors.joining(", ")) + " (got " + value + ")"));
    }
}
