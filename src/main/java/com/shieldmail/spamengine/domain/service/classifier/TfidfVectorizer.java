package com.shieldmail.spamengine.domain.service.classifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TfidfVectorizer {

    private static final Pattern TOKEN_PATTERN =
            Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private final boolean lowercase;
    private final int minN;
    private final int maxN;
    private final Set<String> stopWords;
    private final Map<String, Integer> vocabulary;
    private final double[] idf;
    private final boolean l2Normalize;
    private final boolean sublinearTf;

    TfidfVectorizer(boolean lowercase,
                    int minN,
                    int maxN,
                    Set<String> stopWords,
                    Map<String, Integer> vocabulary,
                    double[] idf,
                    boolean l2Normalize,
                    boolean sublinearTf) {
        if (minN < 1 || maxN < minN) {
            throw new IllegalStateException("invalid ngram range: [" + minN + ", " + maxN + "]");
        }
        for (Integer column : vocabulary.values()) {
            if (column == null || column < 0 || column >= idf.length) {
                throw new IllegalStateException("vocabulary column out of range: " + column);
            }
        }
        this.lowercase = lowercase;
        this.minN = minN;
        this.maxN = maxN;
        this.stopWords = Collections.unmodifiableSet(new HashSet<>(stopWords));
        this.vocabulary = Map.copyOf(vocabulary);
        this.idf = idf.clone();
        this.l2Normalize = l2Normalize;
        this.sublinearTf = sublinearTf;
    }

    static TfidfVectorizer fromSpec(PipelineArtifact.VectorizerSpec spec) {
        if (spec.getVocabulary() == null || spec.getIdf() == null) {
            throw new IllegalStateException("vectorizer requires vocabulary and idf");
        }
        List<Integer> range = spec.getNgramRange();
        if (range == null || range.size() != 2) {
            throw new IllegalStateException("ngram_range must have two entries");
        }
        String norm = spec.getNorm() == null ? "none" : spec.getNorm().toLowerCase(Locale.ROOT);
        if (!norm.equals("l2") && !norm.equals("none")) {
            throw new IllegalStateException("unsupported norm: " + spec.getNorm());
        }
        return new TfidfVectorizer(
                spec.isLowercase(),
                range.get(0),
                range.get(1),
                spec.getStopWords() == null ? Set.of() : new HashSet<>(spec.getStopWords()),
                spec.getVocabulary(),
                spec.getIdf(),
                norm.equals("l2"),
                spec.isSublinearTf());
    }

    public int featureCount() {
        return idf.length;
    }

    List<String> analyze(String text) {
        String doc = lowercase ? text.toLowerCase(Locale.ROOT) : text;
        List<String> words = new ArrayList<>();
        Matcher m = TOKEN_PATTERN.matcher(doc);
        while (m.find()) {
            String w = m.group();
            if (!stopWords.contains(w)) {
                words.add(w);
            }
        }

        List<String> terms = new ArrayList<>();
        for (int n = minN; n <= Math.min(maxN, words.size()); n++) {
            for (int i = 0; i + n <= words.size(); i++) {
                terms.add(n == 1 ? words.get(i) : String.join(" ", words.subList(i, i + n)));
            }
        }
        return terms;
    }

    public Map<Integer, Double> transform(String text) {
        Map<Integer, Integer> counts = new HashMap<>();
        for (String term : analyze(text)) {
            Integer column = vocabulary.get(term);
            if (column != null) {
                counts.merge(column, 1, Integer::sum);
            }
        }

        Map<Integer, Double> vector = new TreeMap<>();
        double sumSquares = 0.0;
        for (Map.Entry<Integer, Integer> e : counts.entrySet()) {
            double tf = sublinearTf ? 1.0 + Math.log(e.getValue()) : e.getValue();
            double value = tf * idf[e.getKey()];
            vector.put(e.getKey(), value);
            sumSquares += value * value;
        }

        if (l2Normalize && sumSquares > 0.0) {
            double norm = Math.sqrt(sumSquares);
            vector.replaceAll((column, value) -> value / norm);
        }
        return vector;
    }
}
