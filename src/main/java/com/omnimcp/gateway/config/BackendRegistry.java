package com.omnimcp.gateway.config;

import com.omnimcp.gateway.model.BackendDescriptor;
import com.omnimcp.gateway.model.CapabilityMap;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of configured backends and their capability map.
 */
public final class BackendRegistry {

    private final List<BackendDescriptor> backends;
    private final CapabilityMap capabilityMap;

    public BackendRegistry(List<BackendDescriptor> backends) {
        rejectDuplicateCapabilities(backends);
        this.backends = List.copyOf(backends);
        this.capabilityMap = CapabilityMap.of(this.backends);
    }

    public List<BackendDescriptor> getBackends() {
        return backends;
    }

    public CapabilityMap getCapabilityMap() {
        return capabilityMap;
    }

    public Optional<BackendDescriptor> find(String backendId) {
        return backends.stream().filter(b -> b.getId().equals(backendId)).findFirst();
    }

    private static void rejectDuplicateCapabilities(List<BackendDescriptor> backends) {
        Map<String, String> owners = new HashMap<>();
        for (BackendDescriptor backend : backends) {
            for (String capability : backend.getCapabilities()) {
                String previous = owners.putIfAbsent(capability, backend.getId());
                if (previous != null) {
                    throw new IllegalStateException(String.format(
                        "Capability '%s' is declared by both '%s' and '%s'",
                        capability, previous, backend.getId()));
                }
            }
        }
    }
}
