package com.genderai.server.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class BatchPredictionResponse {
    @JsonProperty("results")
    public List<PredictionResponse> results;

    public BatchPredictionResponse(List<PredictionResponse> results) {
        this.results = results;
    }
}
