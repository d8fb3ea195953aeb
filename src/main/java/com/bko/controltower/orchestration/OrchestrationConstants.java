package com.bko.controltower.orchestration;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
        // Private constructor to prevent instantiation
    }

    // Agent keys used in event payloads
    public static final String AGENT_VISION = "vision";
    public static final String AGENT_SUPPLIER = "supplier";
    public static final String AGENT_MEMORY = "memory";

    // Vision prompts
    public static final String ANALYSIS_QUERY = "Write code to count the exact number of boxes on this shelf.";
    public static final String DETECTION_QUERY = """
            Detect every distinct object on this shelf. Return only a JSON array where each entry has \
            box_2d as [ymin, xmin, ymax, xmax] normalized to 0-1000 and a short unique label.""";

    // Supplier search
    public static final String DEFAULT_SEARCH_QUERY = "warehouse inventory part";
    public static final String SEARCH_TERMS_PREFIX = "Search terms:";
    public static final String BOUNDING_BOXES_START = "[BOUNDING_BOXES]";
    public static final String BOUNDING_BOXES_END = "[/BOUNDING_BOXES]";
    public static final String CODE_OUTPUT_MARKER = "Code output:";

    // Order ids are "#9000" to "#9999"
    public static final int ORDER_ID_MIN = 9000;
    public static final int ORDER_ID_MAX = 9999;

    // Observer messages
    public static final String UPLOAD_COMPLETE_MESSAGE = "Image uploaded successfully";
    public static final String VISION_DISCOVERY_MESSAGE = "Discovering Vision Agent via A2A protocol...";
    public static final String SUPPLIER_DISCOVERY_MESSAGE = "Discovering Supplier Agent via A2A protocol...";
    public static final String VISION_START_MESSAGE = "Vision Agent analyzing image...";
    public static final String VISION_START_DETAILS = "Analysis and object detection running in parallel";
    public static final String VISION_COMPLETE_MESSAGE = "Vision analysis complete";
    public static final String MEMORY_START_MESSAGE = "Querying supplier inventory with vector search...";
    public static final String MEMORY_RAW_MESSAGE = "Supplier response received";
    public static final String NO_SUPPLIER_MESSAGE = "No matching supplier found";
}
