package com.bko.controltower.orchestration.service;

import com.bko.controltower.config.ControlTowerProperties;
import com.bko.controltower.orchestration.model.Detection;
import com.bko.controltower.orchestration.model.VisionAnalysis;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VisionResultInterpreterTest {

    private final ControlTowerProperties properties = new ControlTowerProperties();
    private final VisionResultInterpreter interpreter =
            new VisionResultInterpreter(new JsonProcessingService(new ObjectMapper()), properties);

    @Test
    void searchQueryPrefersSearchTermsLine() {
        String text = "Counted 4 boxes.\nsearch terms:   blue plastic crate  \nDone.";
        assertEquals("blue plastic crate", interpreter.searchQuery(text));
    }

    @Test
    void searchQueryFallsBackToPrefixOfAnalysis() {
        properties.setSearchQueryMaxLength(10);
        assertEquals("The shelf", interpreter.searchQuery("The shelf holds twelve brown boxes."));
    }

    @Test
    void searchQueryDefaultsWhenAnalysisIsBlank() {
        assertEquals("warehouse inventory part", interpreter.searchQuery("   "));
    }

    @Test
    void prefersDetectionReply() {
        VisionAnalysis analysis = interpreter.interpret("Code output: 2",
                "```json\n[{\"box_2d\":[0,0,10,10],\"label\":\"a\"},{\"box_2d\":[5,5,20,20],\"label\":\"b\"}]\n```");

        assertEquals(List.of("a", "b"), analysis.detections().stream().map(Detection::label).toList());
        assertEquals("Code output: 2", analysis.codeOutput());
    }

    @Test
    void fallsBackToTaggedBlockInAnalysis() {
        String text = "Found 1 box.\n[BOUNDING_BOXES][{\"box_2d\":[1,2,3,4],\"label\":\"box\"}][/BOUNDING_BOXES]";

        VisionAnalysis analysis = interpreter.interpret(text, "sorry, no detections today");

        assertEquals(1, analysis.detections().size());
        assertEquals(List.of(1, 2, 3, 4), analysis.detections().get(0).box2d());
    }

    @Test
    void dropsMalformedBoxesAndSurvivesBadJson() {
        VisionAnalysis analysis = interpreter.interpret("Nothing to see",
                "[{\"box_2d\":[1,2],\"label\":\"short\"},{\"label\":\"none\"}]");
        assertTrue(analysis.detections().isEmpty());

        VisionAnalysis broken = interpreter.interpret("Nothing to see", "[{not json");
        assertTrue(broken.detections().isEmpty());
        assertNull(broken.codeOutput());
    }
}
