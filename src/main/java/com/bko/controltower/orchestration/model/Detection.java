package com.bko.controltower.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param box2d {@code [ymin, xmin, ymax, xmax]} normalized to 0-1000
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Detection(
        @JsonProperty("box_2d") List<Integer> box2d,
        String label
) {
    public Detection {
        box2d = box2d == null ? List.of() : List.copyOf(box2d);
    }
}
