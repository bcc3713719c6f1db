package com.shieldmail.spamengine.domain.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "model")
public class ModelProperties {

    private String artifactLocation = "classpath:models/spam_detection_model.json";
    private String metadataLocation = "classpath:models/model_metadata.json";

    private int spamClass = 1;
}
