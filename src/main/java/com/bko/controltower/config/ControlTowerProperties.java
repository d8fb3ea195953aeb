package com.bko.controltower.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "controltower")
public class ControlTowerProperties {

    private AgentEndpoint vision = new AgentEndpoint("http://localhost:8081");
    private AgentEndpoint supplier = new AgentEndpoint("http://localhost:8082");
    private String agentCardPath = "/.well-known/agent-card.json";
    private String legacyAgentCardPath = "/.well-known/agent.json";
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration discoveryTimeout = Duration.ofSeconds(30);
    private Duration callTimeout = Duration.ofSeconds(120);
    private Duration phasePause = Duration.ofMillis(500);
    private int searchQueryMaxLength = 200;
    private ImageTransport imageTransport = ImageTransport.INLINE_JSON;
    private PayloadConfig payload = new PayloadConfig();
    private ProgressConfig progress = new ProgressConfig();
    private ObserverConfig observer = new ObserverConfig();

    public enum ImageTransport {
        INLINE_JSON, FILE_PART
    }

    public static class AgentEndpoint {
        private String url;

        public AgentEndpoint() {}

        public AgentEndpoint(String url) {
            this.url = url;
        }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
    }

    public static class PayloadConfig {
        private int maxBytes = 500 * 1024;
        private int maxDimension = 1024;
        private int minDimension = 256;
        private int initialQuality = 85;
        private int minQuality = 60;
        private int qualityStep = 10;
        private double shrinkFactor = 0.8;

        public int getMaxBytes() { return maxBytes; }
        public void setMaxBytes(int maxBytes) { this.maxBytes = maxBytes; }
        public int getMaxDimension() { return maxDimension; }
        public void setMaxDimension(int maxDimension) { this.maxDimension = maxDimension; }
        public int getMinDimension() { return minDimension; }
        public void setMinDimension(int minDimension) { this.minDimension = minDimension; }
        public int getInitialQuality() { return initialQuality; }
        public void setInitialQuality(int initialQuality) { this.initialQuality = initialQuality; }
        public int getMinQuality() { return minQuality; }
        public void setMinQuality(int minQuality) { this.minQuality = minQuality; }
        public int getQualityStep() { return qualityStep; }
        public void setQualityStep(int qualityStep) { this.qualityStep = qualityStep; }
        public double getShrinkFactor() { return shrinkFactor; }
        public void setShrinkFactor(double shrinkFactor) { this.shrinkFactor = shrinkFactor; }
    }

    public static class ProgressConfig {
        private Duration interval = Duration.ofSeconds(8);
        private List<String> steps = new ArrayList<>(List.of(
                "Generating Python code to count objects",
                "Executing code in sandbox",
                "Verifying count against detections"));

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public List<String> getSteps() {
            return steps;
        }

        public void setSteps(List<String> steps) {
            if (steps == null) {
                return;
            }
            this.steps = new ArrayList<>(steps);
        }
    }

    public static class ObserverConfig {
        private Duration sendTimeLimit = Duration.ofSeconds(5);
        private int bufferSizeLimit = 512 * 1024;

        public Duration getSendTimeLimit() { return sendTimeLimit; }
        public void setSendTimeLimit(Duration sendTimeLimit) { this.sendTimeLimit = sendTimeLimit; }
        public int getBufferSizeLimit() { return bufferSizeLimit; }
        public void setBufferSizeLimit(int bufferSizeLimit) { this.bufferSizeLimit = bufferSizeLimit; }
    }

    public AgentEndpoint getVision() {
        return vision;
    }

    public void setVision(AgentEndpoint vision) {
        this.vision = vision != null ? vision : new AgentEndpoint();
    }

    public AgentEndpoint getSupplier() {
        return supplier;
    }

    public void setSupplier(AgentEndpoint supplier) {
        this.supplier = supplier != null ? supplier : new AgentEndpoint();
    }

    public String getAgentCardPath() {
        return agentCardPath;
    }

    public void setAgentCardPath(String agentCardPath) {
        this.agentCardPath = agentCardPath;
    }

    public String getLegacyAgentCardPath() {
        return legacyAgentCardPath;
    }

    public void setLegacyAgentCardPath(String legacyAgentCardPath) {
        this.legacyAgentCardPath = legacyAgentCardPath;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getDiscoveryTimeout() {
        return discoveryTimeout;
    }

    public void setDiscoveryTimeout(Duration discoveryTimeout) {
        this.discoveryTimeout = discoveryTimeout;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    public Duration getPhasePause() {
        return phasePause;
    }

    public void setPhasePause(Duration phasePause) {
        this.phasePause = phasePause;
    }

    public int getSearchQueryMaxLength() {
        return searchQueryMaxLength;
    }

    public void setSearchQueryMaxLength(int searchQueryMaxLength) {
        this.searchQueryMaxLength = searchQueryMaxLength;
    }

    public ImageTransport getImageTransport() {
        return imageTransport;
    }

    public void setImageTransport(ImageTransport imageTransport) {
        if (imageTransport == null) {
            return;
        }
        this.imageTransport = imageTransport;
    }

    public PayloadConfig getPayload() {
        return payload;
    }

    public void setPayload(PayloadConfig payload) {
        this.payload = payload != null ? payload : new PayloadConfig();
    }

    public ProgressConfig getProgress() {
        return progress;
    }

    public void setProgress(ProgressConfig progress) {
        this.progress = progress != null ? progress : new ProgressConfig();
    }

    public ObserverConfig getObserver() {
        return observer;
    }

    public void setObserver(ObserverConfig observer) {
        this.observer = observer != null ? observer : new ObserverConfig();
    }
}
