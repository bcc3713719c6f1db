package com.shieldmail.spamengine.domain.service.classifier;

public interface ClassifierPipeline {

    int[] classes();

    double[] predictProba(String text);

    int featureCount();
}
