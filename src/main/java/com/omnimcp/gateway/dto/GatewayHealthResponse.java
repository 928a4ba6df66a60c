package com.omnimcp.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayHealthResponse {

    private String status;
    private String timestamp;
    private Map<String, BackendHealthStatus> servers;
}
