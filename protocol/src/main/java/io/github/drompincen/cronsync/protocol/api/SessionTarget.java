package io.github.drompincen.cronsync.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionTarget {
    MAIN("main"),
    ISOLATED("isolated");

    private final String wireName;

    SessionTarget(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static SessionTarget fromWire(String value) {
        for (SessionTarget target : values()) {
            if (target.wireName.equalsIgnoreCase(value)) return target;
        }
        throw new IllegalArgumentException("Unknown session target: " + value);
    }
}
