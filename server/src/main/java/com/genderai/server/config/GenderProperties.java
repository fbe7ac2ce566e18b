package com.genderai.server.config;

import com.genderai.server.ai.ImageDecoder;
import com.genderai.server.ai.classification.GenderClassifier;
import com.genderai.server.ai.detection.DetectionSettings;
import com.genderai.server.ai.detection.SuppressionStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings under the {@code gender.*} prefix.
 */
@ConfigurationProperties(prefix = "gender")
public class GenderProperties {

    private final Artifacts artifacts = new Artifacts();
    private final Model model = new Model();
    private final Detection detection = new Detection();
    private final Classifier classifier = new Classifier();
    private final Inference inference = new Inference();
    private final Upload upload = new Upload();
    private final Cors cors = new Cors();

    public Artifacts getArtifacts() {
        return artifacts;
    }

    public Model getModel() {
        return model;
    }

    public Detection getDetection() {
        return detection;
    }

    public Classifier getClassifier() {
        return classifier;
    }

    public Inference getInference() {
        return inference;
    }

    public Upload getUpload() {
        return upload;
    }

    public Cors getCors() {
        return cors;
    }

    public static class Artifacts {
        /** {@code s3} or {@code local}. */
        private String store = "s3";
        private String bucket;
        private String prefix = "models/gender-classification-final/";
        private String region;
        /** Local cache directory; resolved by CacheDirResolver when empty. */
        private String cacheDir;

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getCacheDir() {
            return cacheDir;
        }

        public void setCacheDir(String cacheDir) {
            this.cacheDir = cacheDir;
        }
    }

    public static class Model {
        private boolean eagerLoad = true;
        private Duration loadTimeout = Duration.ofMinutes(5);
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(60);
        /** 0 leaves the ONNX Runtime default. */
        private int intraOpThreads = 0;

        public boolean isEagerLoad() {
            return eagerLoad;
        }

        public void setEagerLoad(boolean eagerLoad) {
            this.eagerLoad = eagerLoad;
        }

        public Duration getLoadTimeout() {
            return loadTimeout;
        }

        public void setLoadTimeout(Duration loadTimeout) {
            this.loadTimeout = loadTimeout;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public int getIntraOpThreads() {
            return intraOpThreads;
        }

        public void setIntraOpThreads(int intraOpThreads) {
            this.intraOpThreads = intraOpThreads;
        }
    }

    public static class Detection {
        private double scoreThreshold = DetectionSettings.DEFAULT_SCORE_THRESHOLD;
        private double minRelativeArea = DetectionSettings.DEFAULT_MIN_RELATIVE_AREA;
        private double minRelativeHeight = DetectionSettings.DEFAULT_MIN_RELATIVE_HEIGHT;
        private SuppressionStrategy suppression = SuppressionStrategy.NONE;
        private double nmsIouThreshold = DetectionSettings.DEFAULT_NMS_IOU_THRESHOLD;

        public double getScoreThreshold() {
            return scoreThreshold;
        }

        public void setScoreThreshold(double scoreThreshold) {
            this.scoreThreshold = scoreThreshold;
        }

        public double getMinRelativeArea() {
            return minRelativeArea;
        }

        public void setMinRelativeArea(double minRelativeArea) {
            this.minRelativeArea = minRelativeArea;
        }

        public double getMinRelativeHeight() {
            return minRelativeHeight;
        }

        public void setMinRelativeHeight(double minRelativeHeight) {
            this.minRelativeHeight = minRelativeHeight;
        }

        public SuppressionStrategy getSuppression() {
            return suppression;
        }

        public void setSuppression(SuppressionStrategy suppression) {
            this.suppression = suppression;
        }

        public double getNmsIouThreshold() {
            return nmsIouThreshold;
        }

        public void setNmsIouThreshold(double nmsIouThreshold) {
            this.nmsIouThreshold = nmsIouThreshold;
        }

        public DetectionSettings toSettings() {
            return new DetectionSettings(scoreThreshold, minRelativeArea, minRelativeHeight, suppression,
                    nmsIouThreshold);
        }
    }

    public static class Classifier {
        private double lowConfidenceThreshold = GenderClassifier.DEFAULT_LOW_CONFIDENCE_THRESHOLD;

        public double getLowConfidenceThreshold() {
            return lowConfidenceThreshold;
        }

        public void setLowConfidenceThreshold(double lowConfidenceThreshold) {
            this.lowConfidenceThreshold = lowConfidenceThreshold;
        }
    }

    public static class Inference {
        /** 0 means one worker per available processor. */
        private int poolSize = 0;
        private int queueDepth = 16;
        private Duration requestTimeout = Duration.ofSeconds(30);

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getQueueDepth() {
            return queueDepth;
        }

        public void setQueueDepth(int queueDepth) {
            this.queueDepth = queueDepth;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public int effectivePoolSize() {
            return poolSize > 0 ? poolSize : Runtime.getRuntime().availableProcessors();
        }
    }

    public static class Upload {
        private long maxBytes = 10L * 1024 * 1024;
        private int maxBatchSize = 10;
        private long maxPixels = ImageDecoder.DEFAULT_MAX_PIXELS;

        public long getMaxBytes() {
            return maxBytes;
        }

        public void setMaxBytes(long maxBytes) {
            this.maxBytes = maxBytes;
        }

        public long getMaxPixels() {
            return maxPixels;
        }

        public void setMaxPixels(long maxPixels) {
            this.maxPixels = maxPixels;
        }

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }
    }

    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }
    }
}
