package com.bko.controltower.orchestration.service;

import com.bko.controltower.orchestration.model.ThinkingStep;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the reasoning summary shown next to each agent in the UI.
 */
@Component
public class ThinkingStepExtractor {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Clock clock;

    public ThinkingStepExtractor() {
        this(Clock.systemDefaultZone());
    }

    ThinkingStepExtractor(Clock clock) {
        this.clock = clock;
    }

    public List<ThinkingStep> visionSteps(String analysisText) {
        List<ThinkingStep> steps = new ArrayList<>();
        if (analysisText.contains("def ") || analysisText.contains("import ")) {
            steps.add(step(1, "Analyzing image requirements and planning approach"));
            steps.add(step(2, "Writing Python code with OpenCV for box detection"));
            steps.add(step(3, "Executing code in sandbox environment"));
        }
        String lower = analysisText.toLowerCase(Locale.ROOT);
        if (lower.contains("result") || lower.contains("boxes")) {
            steps.add(step(steps.size() + 1, "Processing execution results and formatting output"));
        }
        return steps;
    }

    public List<ThinkingStep> supplierSteps() {
        return List.of(
                step(1, "Generating embedding vector from query text"),
                step(2, "Executing ScaNN vector search over inventory"),
                step(3, "Ranking results by similarity score"));
    }

    private ThinkingStep step(int number, String thought) {
        return new ThinkingStep(number, thought, LocalTime.now(clock).format(TIME));
    }
}
