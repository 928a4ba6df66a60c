package com.omnimcp.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Health snapshot of one backend as reported by {@code GET /health}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackendHealthStatus {

    /** One base URL per backend. */
    private int instances;

    /** 1 when the last probe succeeded, otherwise 0. */
    private int healthy;

    private List<String> capabilities;

    /** ISO-8601 timestamp of the last completed probe. */
    private String lastCheck;
}
