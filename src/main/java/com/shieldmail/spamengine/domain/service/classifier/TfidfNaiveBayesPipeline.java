package com.shieldmail.spamengine.domain.service.classifier;

import java.util.Map;

public final class TfidfNaiveBayesPipeline implements ClassifierPipeline {

    private final TfidfVectorizer vectorizer;
    private final NaiveBayesClassifier classifier;

    TfidfNaiveBayesPipeline(TfidfVectorizer vectorizer, NaiveBayesClassifier classifier) {
        if (vectorizer.featureCount() != classifier.featureCount()) {
            throw new IllegalStateException("feature count mismatch: vectorizer="
                    + vectorizer.featureCount() + ", classifier=" + classifier.featureCount());
        }
        this.vectorizer = vectorizer;
        this.classifier = classifier;
    }

    public static TfidfNaiveBayesPipeline fromArtifact(PipelineArtifact artifact) {
        if (artifact == null || artifact.getVectorizer() == null || artifact.getClassifier() == null) {
            throw new IllegalStateException("artifact must define both vectorizer and classifier");
        }
        return new TfidfNaiveBayesPipeline(
                TfidfVectorizer.fromSpec(artifact.getVectorizer()),
                NaiveBayesClassifier.fromSpec(artifact.getClassifier()));
    }

    @Override
    public int[] classes() {
        return classifier.classes();
    }

    @Override
    public double[] predictProba(String text) {
        Map<Integer, Double> features = vectorizer.transform(text);
        return classifier.predictProba(features);
    }

    @Override
    public int featureCount() {
        return vectorizer.featureCount();
    }

    public NaiveBayesClassifier.Variant variant() {
        return classifier.variant();
    }
}
