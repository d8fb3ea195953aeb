package com.bko.controltower.a2a;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A skill advertised in an agent descriptor. Descriptive only.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentSkill(
        String id,
        String name,
        String description,
        Set<String> tags,
        List<String> examples
) {
    public AgentSkill {
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        examples = examples == null ? List.of() : List.copyOf(examples);
    }
}
