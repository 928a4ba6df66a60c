package com.omnimcp.gateway.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Transport {
    HTTP("http"),
    WEBSOCKET("websocket");

    private final String value;

    Transport(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
