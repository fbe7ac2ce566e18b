package com.genderai.server.model;

import com.genderai.server.ai.ImagePreprocessor;
import com.genderai.server.ai.classification.GenderModel;
import com.genderai.server.ai.detection.PersonDetector;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Deserializes cached artifacts into runnable models. Any exception thrown here
 * is treated as a corrupt artifact.
 */
public interface ModelFactory {

    ImagePreprocessor createPreprocessor(Path artifactDir) throws IOException;

    GenderModel createClassifier(Path artifactDir) throws IOException;

    PersonDetector createDetector(Path artifactDir) throws IOException;
}
