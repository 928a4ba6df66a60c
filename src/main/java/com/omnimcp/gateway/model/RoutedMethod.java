package com.omnimcp.gateway.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Methods whose routing key is taken from a params field rather than the
 * method name itself.
 */
public enum RoutedMethod {

    TOOLS_CALL("tools/call", "name"),
    RESOURCES_READ("resources/read", "uri"),
    PROMPTS_GET("prompts/get", "name");

    private final String wireName;
    private final String keyField;

    RoutedMethod(String wireName, String keyField) {
        this.wireName = wireName;
        this.keyField = keyField;
    }

    public String getWireName() {
        return wireName;
    }

    public String getKeyField() {
        return keyField;
    }

    public static Optional<RoutedMethod> fromWireName(String method) {
        return Arrays.stream(values())
            .filter(m -> m.wireName.equals(method))
            .findFirst();
    }
}
