package com.omnimcp.gateway.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * JSON-RPC methods answered by the gateway itself without contacting a backend.
 */
public enum ProtocolMethod {

    INITIALIZE("initialize"),
    NOTIFICATIONS_INITIALIZED("notifications/initialized"),
    TOOLS_LIST("tools/list"),
    RESOURCES_LIST("resources/list"),
    PROMPTS_LIST("prompts/list"),
    PING("ping");

    private final String wireName;

    ProtocolMethod(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<ProtocolMethod> fromWireName(String method) {
        return Arrays.stream(values())
            .filter(m -> m.wireName.equals(method))
            .findFirst();
    }
}
