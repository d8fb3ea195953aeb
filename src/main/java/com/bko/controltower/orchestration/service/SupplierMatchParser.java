package com.bko.controltower.orchestration.service;

import com.bko.controltower.orchestration.model.SupplierMatch;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class SupplierMatchParser {

    private static final String LABEL = "supplier";
    private static final String UNKNOWN = "Unknown";
    private static final String NO_CONFIDENCE = "N/A";

    private final JsonProcessingService jsonProcessingService;

    public SupplierMatchParser(JsonProcessingService jsonProcessingService) {
        this.jsonProcessingService = jsonProcessingService;
    }

    /**
     * @throws ResponseParseException if the text is not a match object with a part or a supplier
     */
    public SupplierMatch parse(String text) {
        SupplierMatch match = jsonProcessingService.parseJsonObject(LABEL, text, SupplierMatch.class);
        if (match == null || (!StringUtils.hasText(match.part()) && !StringUtils.hasText(match.supplier()))) {
            throw new ResponseParseException("Supplier response names neither a part nor a supplier.");
        }
        return new SupplierMatch(
                StringUtils.hasText(match.part()) ? match.part() : UNKNOWN,
                StringUtils.hasText(match.supplier()) ? match.supplier() : UNKNOWN,
                StringUtils.hasText(match.confidence()) ? match.confidence() : NO_CONFIDENCE);
    }
}
