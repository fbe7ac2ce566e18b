package com.genderai.server.ai.detection;

public enum SuppressionStrategy {
    /** Keep every detection that passed the score and size filters. */
    NONE,
    /** Greedy non-maximum suppression by IoU, highest score first. */
    GREEDY_IOU
}
