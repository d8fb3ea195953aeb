package com.bko.controltower.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthResponse(
        String status,
        String service,
        @JsonProperty("vision_url") String visionUrl,
        @JsonProperty("supplier_url") String supplierUrl
) {
}
