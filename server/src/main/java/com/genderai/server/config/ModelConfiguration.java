package com.genderai.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genderai.server.ai.classification.GenderClassifier;
import com.genderai.server.ai.detection.PersonDetectorGate;
import com.genderai.server.artifact.ArtifactStore;
import com.genderai.server.artifact.LocalDirectoryArtifactStore;
import com.genderai.server.artifact.S3ArtifactStore;
import com.genderai.server.inference.InferencePool;
import com.genderai.server.model.LoaderSettings;
import com.genderai.server.model.ModelFactory;
import com.genderai.server.model.ModelLoader;
import com.genderai.server.model.OnnxModelFactory;
import com.genderai.server.util.CacheDirResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;

@Configuration
@EnableConfigurationProperties(GenderProperties.class)
public class ModelConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(ModelConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ArtifactStore artifactStore(GenderProperties properties) {
        String store = properties.getArtifacts().getStore();
        String kind = store == null ? "s3" : store.trim().toLowerCase(Locale.ROOT);
        switch (kind) {
            case "local":
                logger.info("Using local directory artifact store rooted at {}", properties.getArtifacts().getBucket());
                return new LocalDirectoryArtifactStore();
            case "s3":
                return new S3ArtifactStore(properties.getArtifacts().getRegion());
            default:
                logger.warn("Unknown artifact store '{}', defaulting to 's3'", store);
                return new S3ArtifactStore(properties.getArtifacts().getRegion());
        }
    }

    @Bean
    public ModelFactory modelFactory(ObjectMapper objectMapper, GenderProperties properties) {
        return new OnnxModelFactory(objectMapper, properties.getModel().getIntraOpThreads());
    }

    @Bean(destroyMethod = "close")
    public ModelLoader modelLoader(ArtifactStore artifactStore, ModelFactory modelFactory,
            GenderProperties properties, Clock clock) {
        GenderProperties.Artifacts artifacts = properties.getArtifacts();
        GenderProperties.Model model = properties.getModel();
        if (artifacts.getBucket() == null || artifacts.getBucket().isBlank()) {
            logger.warn("gender.artifacts.bucket is not set; model loading will fail until it is configured");
        }
        Path cacheDir = CacheDirResolver.resolveCacheDirectory(artifacts.getCacheDir());
        LoaderSettings settings = new LoaderSettings(artifacts.getBucket(), artifacts.getPrefix(), cacheDir,
                model.getInitialBackoff(), model.getMaxBackoff(), model.getLoadTimeout());
        return new ModelLoader(artifactStore, modelFactory, settings, clock);
    }

    @Bean(destroyMethod = "close")
    public InferencePool inferencePool(GenderProperties properties) {
        GenderProperties.Inference inference = properties.getInference();
        return new InferencePool(inference.effectivePoolSize(), inference.getQueueDepth());
    }

    @Bean
    public PersonDetectorGate personDetectorGate(GenderProperties properties) {
        PersonDetectorGate gate = new PersonDetectorGate(properties.getDetection().toSettings());
        logger.info("Person gate: threshold={}, minArea={}, minHeight={}, suppression={}",
                gate.getSettings().getScoreThreshold(), gate.getSettings().getMinRelativeArea(),
                gate.getSettings().getMinRelativeHeight(), gate.getSettings().getSuppression());
        return gate;
    }

    @Bean
    public GenderClassifier genderClassifier(GenderProperties properties) {
        return new GenderClassifier(properties.getClassifier().getLowConfidenceThreshold());
    }
}
