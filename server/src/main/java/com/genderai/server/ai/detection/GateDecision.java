package com.genderai.server.ai.detection;

public enum GateDecision {
    ACCEPT,
    NO_PERSON,
    MULTIPLE_PEOPLE
}
