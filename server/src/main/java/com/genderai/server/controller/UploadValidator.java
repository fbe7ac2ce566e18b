package com.genderai.server.controller;

import com.genderai.server.config.GenderProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@Component
public class UploadValidator {

    static final String NOT_AN_IMAGE = "File must be an image";

    private final GenderProperties properties;

    public UploadValidator(GenderProperties properties) {
        this.properties = properties;
    }

    /**
     * @throws ValidationException when the upload cannot be an acceptable image
     */
    public void validate(MultipartFile file) {
        String problem = problemWith(file);
        if (problem != null) {
            throw new ValidationException(problem);
        }
    }

    public void validateBatch(List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            throw new ValidationException("No files uploaded");
        }
        int max = properties.getUpload().getMaxBatchSize();
        if (files.size() > max) {
            throw new ValidationException("Maximum " + max + " images per batch");
        }
    }

    /**
     * @return a user-facing reason the file is unacceptable, or null if it may
     *         be processed
     */
    public String problemWith(MultipartFile file) {
        if (file == null) {
            return "No file uploaded";
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.toLowerCase().startsWith("image/")) {
            return NOT_AN_IMAGE;
        }
        if (file.isEmpty()) {
            return "File is empty";
        }
        long max = properties.getUpload().getMaxBytes();
        if (file.getSize() > max) {
            return "File too large (max " + max + " bytes)";
        }
        return null;
    }
}
