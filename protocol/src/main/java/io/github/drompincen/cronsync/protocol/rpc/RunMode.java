package io.github.drompincen.cronsync.protocol.rpc;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RunMode {
    FORCE("force"),
    DUE("due");

    private final String wireName;

    RunMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static RunMode of(boolean force) {
        return force ? FORCE : DUE;
    }
}
