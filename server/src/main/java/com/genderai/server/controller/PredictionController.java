package com.genderai.server.controller;

import com.genderai.server.service.PredictionOrchestrator;
import com.genderai.server.service.PredictionOutcome;
import com.genderai.server.util.RetryHints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@RestController
public class PredictionController {

    private static final Logger logger = LoggerFactory.getLogger(PredictionController.class);

    private final PredictionOrchestrator orchestrator;
    private final UploadValidator validator;
    private final Clock clock;

    public PredictionController(PredictionOrchestrator orchestrator, UploadValidator validator, Clock clock) {
        this.orchestrator = orchestrator;
        this.validator = validator;
        this.clock = clock;
    }

    @PostMapping(value = "/predict", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<PredictionResponse> predict(@RequestParam("file") MultipartFile file) throws IOException {
        validator.validate(file);
        logger.info("Received prediction request: {} ({} bytes)", file.getOriginalFilename(), file.getSize());

        PredictionOutcome outcome = orchestrator.predict(file.getBytes());
        logger.info("Prediction outcome for {}: {}", file.getOriginalFilename(), outcome);

        ResponseEntity.BodyBuilder response = ResponseEntity.ok();
        Long retryAfter = retryAfterSeconds(outcome);
        if (retryAfter != null) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
        }
        return response.body(PredictionResponse.from(outcome));
    }

    @PostMapping(value = "/predict-batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<BatchPredictionResponse> predictBatch(@RequestParam("files") List<MultipartFile> files)
            throws IOException {
        validator.validateBatch(files);
        logger.info("Received batch prediction request with {} files", files.size());

        // non-image entries become per-item errors; the rest go through the orchestrator together
        List<byte[]> accepted = new ArrayList<>();
        String[] problems = new String[files.size()];
        for (int i = 0; i < files.size(); i++) {
            problems[i] = validator.problemWith(files.get(i));
            if (problems[i] == null) {
                accepted.add(files.get(i).getBytes());
            }
        }

        List<PredictionOutcome> outcomes = orchestrator.predictBatch(accepted);

        List<PredictionResponse> results = new ArrayList<>(files.size());
        int next = 0;
        for (int i = 0; i < files.size(); i++) {
            String name = files.get(i).getOriginalFilename();
            if (problems[i] != null) {
                results.add(PredictionResponse.error(name, problems[i]));
            } else {
                results.add(PredictionResponse.from(outcomes.get(next++)).withFilename(name));
            }
        }
        return ResponseEntity.ok(new BatchPredictionResponse(results));
    }

    private Long retryAfterSeconds(PredictionOutcome outcome) {
        if (outcome.getKind() != PredictionOutcome.Kind.FAILURE) {
            return null;
        }
        Instant retryAfter = ((PredictionOutcome.Failure) outcome).getRetryAfter();
        if (retryAfter == null) {
            return null;
        }
        return RetryHints.secondsUntil(clock.instant(), retryAfter);
    }
}
