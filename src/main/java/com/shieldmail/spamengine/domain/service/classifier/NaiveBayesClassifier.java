package com.shieldmail.spamengine.domain.service.classifier;

import java.util.Map;

public final class NaiveBayesClassifier {

    public enum Variant {
        MULTINOMIAL,
        BERNOULLI;

        static Variant of(String type) {
            if (type == null) {
                throw new IllegalStateException("classifier type is required");
            }
            return switch (type) {
                case "MultinomialNB" -> MULTINOMIAL;
                case "BernoulliNB" -> BERNOULLI;
                default -> throw new IllegalStateException("unsupported classifier type: " + type);
            };
        }
    }

    private final Variant variant;
    private final int[] classes;
    private final double[] classLogPrior;
    private final double[][] featureLogProb;
    private final double binarize;

    private final double[][] negLogProb;
    private final double[] negLogProbSum;

    NaiveBayesClassifier(Variant variant,
                         int[] classes,
                         double[] classLogPrior,
                         double[][] featureLogProb,
                         double binarize) {
        if (classes.length < 2) {
            throw new IllegalStateException("at least two classes are required");
        }
        if (classLogPrior.length != classes.length || featureLogProb.length != classes.length) {
            throw new IllegalStateException("class dimension mismatch: classes=" + classes.length
                    + ", priors=" + classLogPrior.length + ", featureLogProb=" + featureLogProb.length);
        }
        int features = featureLogProb[0].length;
        for (double[] row : featureLogProb) {
            if (row.length != features) {
                throw new IllegalStateException("ragged feature_log_prob matrix");
            }
        }

        this.variant = variant;
        this.classes = classes.clone();
        this.classLogPrior = classLogPrior.clone();
        this.featureLogProb = new double[classes.length][];
        for (int c = 0; c < classes.length; c++) {
            this.featureLogProb[c] = featureLogProb[c].clone();
        }
        this.binarize = binarize;

        if (variant == Variant.BERNOULLI) {
            negLogProb = new double[classes.length][features];
            negLogProbSum = new double[classes.length];
            for (int c = 0; c < classes.length; c++) {
                for (int j = 0; j < features; j++) {
                    negLogProb[c][j] = Math.log(1.0 - Math.exp(featureLogProb[c][j]));
                    negLogProbSum[c] += negLogProb[c][j];
                }
            }
        } else {
            negLogProb = null;
            negLogProbSum = null;
        }
    }

    static NaiveBayesClassifier fromSpec(PipelineArtifact.ClassifierSpec spec) {
        if (spec.getClassLogPrior() == null || spec.getFeatureLogProb() == null || spec.getClasses() == null) {
            throw new IllegalStateException("classifier requires classes, class_log_prior and feature_log_prob");
        }
        return new NaiveBayesClassifier(
                Variant.of(spec.getType()),
                spec.getClasses(),
                spec.getClassLogPrior(),
                spec.getFeatureLogProb(),
                spec.getBinarize());
    }

    public Variant variant() {
        return variant;
    }

    public int[] classes() {
        return classes.clone();
    }

    public int featureCount() {
        return featureLogProb[0].length;
    }

    double[] jointLogLikelihood(Map<Integer, Double> x) {
        double[] jll = new double[classes.length];
        for (int c = 0; c < classes.length; c++) {
            double sum = classLogPrior[c];
            if (variant == Variant.MULTINOMIAL) {
                for (Map.Entry<Integer, Double> e : x.entrySet()) {
                    sum += e.getValue() * featureLogProb[c][e.getKey()];
                }
            } else {
                sum += negLogProbSum[c];
                for (Map.Entry<Integer, Double> e : x.entrySet()) {
                    if (e.getValue() > binarize) {
                        int j = e.getKey();
                        sum += featureLogProb[c][j] - negLogProb[c][j];
                    }
                }
            }
            jll[c] = sum;
        }
        return jll;
    }

    public double[] predictProba(Map<Integer, Double> x) {
        double[] jll = jointLogLikelihood(x);
        double max = Double.NEGATIVE_INFINITY;
        for (double v : jll) {
            max = Math.max(max, v);
        }
        double total = 0.0;
        for (double v : jll) {
            total += Math.exp(v - max);
        }
        double logNorm = max + Math.log(total);

        double[] proba = new double[jll.length];
        for (int c = 0; c < jll.length; c++) {
            proba[c] = Math.exp(jll[c] - logNorm);
        }
        return proba;
    }
}
