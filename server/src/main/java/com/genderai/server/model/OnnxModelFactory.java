package com.genderai.server.model;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genderai.server.ai.ImagePreprocessor;
import com.genderai.server.ai.classification.GenderModel;
import com.genderai.server.ai.classification.LabelMap;
import com.genderai.server.ai.classification.OnnxGenderModel;
import com.genderai.server.ai.detection.OnnxPersonDetector;
import com.genderai.server.ai.detection.PersonDetector;
import com.genderai.server.artifact.RequiredArtifacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

public class OnnxModelFactory implements ModelFactory {

    private static final Logger logger = LoggerFactory.getLogger(OnnxModelFactory.class);

    private final ObjectMapper mapper;
    private final int intraOpThreads;

    public OnnxModelFactory(ObjectMapper mapper, int intraOpThreads) {
        this.mapper = mapper;
        this.intraOpThreads = intraOpThreads;
    }

    @Override
    public ImagePreprocessor createPreprocessor(Path artifactDir) throws IOException {
        ModelConfigs.PreprocessorConfig config = mapper.readValue(
                artifactDir.resolve(RequiredArtifacts.PREPROCESSOR_CONFIG).toFile(),
                ModelConfigs.PreprocessorConfig.class);
        ImagePreprocessor preprocessor = new ImagePreprocessor(config);
        logger.info("Preprocessor ready: {}", preprocessor.describeSize());
        return preprocessor;
    }

    @Override
    public GenderModel createClassifier(Path artifactDir) throws IOException {
        ModelConfigs.ClassifierConfig config = mapper.readValue(
                artifactDir.resolve(RequiredArtifacts.CLASSIFIER_CONFIG).toFile(),
                ModelConfigs.ClassifierConfig.class);
        LabelMap labels = LabelMap.fromId2Label(config.id2label);

        OrtSession session = openSession(artifactDir.resolve(RequiredArtifacts.CLASSIFIER_WEIGHTS));
        try {
            return new OnnxGenderModel(OrtEnvironment.getEnvironment(), session, labels,
                    config.inputName, config.outputName);
        } catch (RuntimeException e) {
            closeQuietly(session);
            throw e;
        }
    }

    @Override
    public PersonDetector createDetector(Path artifactDir) throws IOException {
        ModelConfigs.DetectorConfig config = mapper.readValue(
                artifactDir.resolve(RequiredArtifacts.DETECTOR_CONFIG).toFile(),
                ModelConfigs.DetectorConfig.class);

        OrtSession session = openSession(artifactDir.resolve(RequiredArtifacts.DETECTOR_WEIGHTS));
        try {
            return new OnnxPersonDetector(OrtEnvironment.getEnvironment(), session, config);
        } catch (RuntimeException e) {
            closeQuietly(session);
            throw e;
        }
    }

    private OrtSession openSession(Path weights) throws IOException {
        try {
            OrtEnvironment env = OrtEnvironment.getEnvironment();
            OrtSession.SessionOptions options = new OrtSession.SessionOptions();
            if (intraOpThreads > 0) {
                options.setIntraOpNumThreads(intraOpThreads);
            }
            OrtSession session = env.createSession(weights.toString(), options);
            logger.info("Opened ONNX session for {} (inputs={}, outputs={})", weights.getFileName(),
                    session.getInputNames(), session.getOutputNames());
            return session;
        } catch (OrtException e) {
            throw new IOException("Cannot open ONNX model " + weights, e);
        }
    }

    private static void closeQuietly(OrtSession session) {
        try {
            session.close();
        } catch (OrtException e) {
            logger.warn("Failed to close ONNX session", e);
        }
    }
}
