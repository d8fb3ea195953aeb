package com.bko.controltower.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SupplierMatch(
        String part,
        String supplier,
        @JsonProperty("match_confidence") String confidence
) {
}
