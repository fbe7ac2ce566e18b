package com.genderai.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON shapes of the configuration files shipped next to the model weights.
 * Absent fields stay null and resolve to defaults at the point of use.
 */
public final class ModelConfigs {

    private ModelConfigs() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClassifierConfig {
        @JsonProperty("id2label")
        public Map<String, String> id2label;
        @JsonProperty("input_name")
        public String inputName;
        @JsonProperty("output_name")
        public String outputName;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PreprocessorConfig {
        @JsonProperty("do_resize")
        public Boolean doResize;
        @JsonProperty("size")
        public Map<String, Integer> size;
        @JsonProperty("do_rescale")
        public Boolean doRescale;
        @JsonProperty("rescale_factor")
        public Double rescaleFactor;
        @JsonProperty("do_normalize")
        public Boolean doNormalize;
        @JsonProperty("image_mean")
        public List<Double> imageMean;
        @JsonProperty("image_std")
        public List<Double> imageStd;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DetectorConfig {
        @JsonProperty("input_name")
        public String inputName;
        @JsonProperty("logits_output")
        public String logitsOutput;
        @JsonProperty("boxes_output")
        public String boxesOutput;
        @JsonProperty("person_class_id")
        public Integer personClassId;
        @JsonProperty("preprocessing")
        public PreprocessorConfig preprocessing;
    }
}
