package com.omnimcp.gateway.model;

import com.omnimcp.gateway.support.TestBackends;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CapabilityMapTest {

    private final CapabilityMap capabilityMap =
        CapabilityMap.of(List.of(TestBackends.LINEAR, TestBackends.PERPLEXITY, TestBackends.DEVTOOLS));

    @Test
    void findsOwningBackend() {
        assertThat(capabilityMap.findOwner("linear_search_issues")).contains("linear");
        assertThat(capabilityMap.findOwner("perplexity://models")).contains("perplexity");
        assertThat(capabilityMap.findOwner("console_logs")).contains("devtools");
    }

    @Test
    void unknownOrNullCapabilityHasNoOwner() {
        assertThat(capabilityMap.findOwner("nope")).isEmpty();
        assertThat(capabilityMap.findOwner(null)).isEmpty();
    }

    @Test
    void allCapabilitiesAreSortedAndDistinct() {
        List<String> all = capabilityMap.allCapabilities();

        assertThat(all).hasSize(9).isSorted().doesNotHaveDuplicates();
        assertThat(all).contains("chrome://session", "triage_workflow");
    }

    @Test
    void keepsConfigurationOrder() {
        assertThat(capabilityMap.backendIds()).containsExactly("linear", "perplexity", "devtools");
    }
}
