package io.github.drompincen.cronsync.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How precisely the gateway honors a job's due time relative to its own wake cycle.
 */
public enum WakeMode {
    NEXT_HEARTBEAT("next-heartbeat"),
    NOW("now");

    private final String wireName;

    WakeMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static WakeMode fromWire(String value) {
        for (WakeMode mode : values()) {
            if (mode.wireName.equalsIgnoreCase(value)) return mode;
        }
        throw new IllegalArgumentException("Unknown wake mode: " + value);
    }
}
