package com.shieldmail.spamengine.domain.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY, getterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelMetadata {

    @JsonProperty("model_type")
    private String modelType;

    private double accuracy;
    private double precision;
    private double recall;

    @JsonProperty("f1_score")
    private double f1Score;

    @JsonProperty("n_features")
    private Integer nFeatures;

    @JsonProperty("n_train_samples")
    private Integer nTrainSamples;

    @JsonProperty("n_test_samples")
    private Integer nTestSamples;

    private String source;

    public static ModelMetadata unknown() {
        return ModelMetadata.builder()
                .modelType("Unknown")
                .build();
    }
}
