package org.healthdata.reporting.join.ir;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchKind {
    MATCHED("matched"),
    LEFT_ONLY("left_only"),
    RIGHT_ONLY("right_only");

    private final String wireName;

    MatchKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
