package com.shieldmail.spamengine.domain.service.classifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineArtifact {

    private VectorizerSpec vectorizer;
    private ClassifierSpec classifier;

    @Getter
    @Setter
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VectorizerSpec {

        private boolean lowercase = true;

        @JsonProperty("ngram_range")
        private List<Integer> ngramRange = List.of(1, 1);

        @JsonProperty("stop_words")
        private List<String> stopWords = List.of();

        private Map<String, Integer> vocabulary;
        private double[] idf;
        private String norm = "l2";

        @JsonProperty("sublinear_tf")
        private boolean sublinearTf;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClassifierSpec {

        private String type = "MultinomialNB";
        private int[] classes = {0, 1};

        @JsonProperty("class_log_prior")
        private double[] classLogPrior;

        @JsonProperty("feature_log_prob")
        private double[][] featureLogProb;

        private double binarize = 0.0;
    }
}
