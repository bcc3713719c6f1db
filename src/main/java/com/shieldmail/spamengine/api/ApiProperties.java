package com.shieldmail.spamengine.api;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "api")
public class ApiProperties {

    private int maxTextLength = 50_000;
    private int maxBatchSize = 100;

    private int previewLength = 100;
}
