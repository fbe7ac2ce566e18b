package com.genderai.server.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.genderai.server.service.PredictionOutcome;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire shape of one prediction. Rejections and failures keep the same shape
 * with {@code error} set, a null prediction and zero confidence.
 */
public class PredictionResponse {

    @JsonProperty("filename")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String filename;

    @JsonProperty("prediction")
    public String prediction;

    @JsonProperty("confidence")
    public double confidence;

    @JsonProperty("person_count")
    public int personCount;

    @JsonProperty("probabilities")
    public Map<String, Double> probabilities;

    @JsonProperty("low_confidence")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Boolean lowConfidence;

    @JsonProperty("error")
    public String error;

    public static PredictionResponse from(PredictionOutcome outcome) {
        PredictionResponse r = new PredictionResponse();
        switch (outcome.getKind()) {
            case SUCCESS:
                PredictionOutcome.Success s = (PredictionOutcome.Success) outcome;
                r.prediction = s.getLabel();
                r.confidence = s.getConfidence();
                r.personCount = s.getPersonCount();
                r.probabilities = new LinkedHashMap<>();
                r.probabilities.put("male", s.getMale());
                r.probabilities.put("female", s.getFemale());
                r.lowConfidence = s.isLowConfidence();
                break;
            case REJECTED:
                PredictionOutcome.Rejected rej = (PredictionOutcome.Rejected) outcome;
                r.personCount = rej.getPersonCount();
                r.error = rej.getMessage();
                break;
            case FAILURE:
                r.error = ((PredictionOutcome.Failure) outcome).getMessage();
                break;
            default:
                throw new IllegalStateException("Unknown outcome " + outcome);
        }
        return r;
    }

    public static PredictionResponse error(String filename, String message) {
        PredictionResponse r = new PredictionResponse();
        r.filename = filename;
        r.error = message;
        return r;
    }

    public PredictionResponse withFilename(String filename) {
        this.filename = filename;
        return this;
    }
}
