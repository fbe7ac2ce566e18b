package com.genderai.server.ai.detection;

import com.genderai.server.ai.DecodedImage;

import java.util.List;

public interface PersonDetector extends AutoCloseable {
    /**
     * Runs one forward pass and returns every hit whose best class is a person,
     * unfiltered by score or size.
     */
    List<Detection> detect(DecodedImage image);

    @Override
    default void close() {
    }
}
