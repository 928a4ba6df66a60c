package com.omnimcp.gateway.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only mapping of backend id to the capability names it serves.
 * Iteration order is configuration order.
 */
public final class CapabilityMap {

    private final Map<String, Set<String>> capabilitiesByBackend;

    private CapabilityMap(Map<String, Set<String>> capabilitiesByBackend) {
        this.capabilitiesByBackend = capabilitiesByBackend;
    }

    public static CapabilityMap of(List<BackendDescriptor> backends) {
        Map<String, Set<String>> map = new LinkedHashMap<>();
        for (BackendDescriptor backend : backends) {
            map.put(backend.getId(), Collections.unmodifiableSet(backend.getCapabilities()));
        }
        return new CapabilityMap(Collections.unmodifiableMap(map));
    }

    /**
     * Linear scan for the backend declaring the capability.
     */
    public Optional<String> findOwner(String capability) {
        if (capability == null) {
            return Optional.empty();
        }
        for (Map.Entry<String, Set<String>> entry : capabilitiesByBackend.entrySet()) {
            if (entry.getValue().contains(capability)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    /**
     * Distinct capability names across all backends, sorted.
     */
    public List<String> allCapabilities() {
        Set<String> all = new TreeSet<>();
        capabilitiesByBackend.values().forEach(all::addAll);
        return List.copyOf(all);
    }

    public Set<String> backendIds() {
        return capabilitiesByBackend.keySet();
    }

    public Map<String, Set<String>> asMap() {
        return capabilitiesByBackend;
    }
}
