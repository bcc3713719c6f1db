package com.shieldmail.spamengine.domain.repository;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "store")
public class StoreProperties {

    private int defaultLimit = 50;
    private int maxLimit = 500;
    private int recentCount = 10;
}
