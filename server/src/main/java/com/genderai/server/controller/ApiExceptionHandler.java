package com.genderai.server.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, String>> onValidation(ValidationException e) {
        logger.info("Rejected upload: {}", e.getMessage());
        return detail(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, String>> onTooLarge(MaxUploadSizeExceededException e) {
        logger.info("Rejected oversize upload: {}", e.getMessage());
        return detail(HttpStatus.BAD_REQUEST, "File too large");
    }

    @ExceptionHandler({ MissingServletRequestPartException.class, MissingServletRequestParameterException.class,
            MultipartException.class })
    public ResponseEntity<Map<String, String>> onMalformedUpload(Exception e) {
        logger.info("Malformed upload: {}", e.getMessage());
        return detail(HttpStatus.BAD_REQUEST, "A multipart image upload is required");
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, String>> onUnreadableUpload(IOException e) {
        logger.warn("Could not read upload", e);
        return detail(HttpStatus.BAD_REQUEST, "Could not read uploaded file");
    }

    private static ResponseEntity<Map<String, String>> detail(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Collections.singletonMap("detail", message));
    }
}
