package com.krishnamouli.kairos.intelligence.semantic;

import com.krishnamouli.kairos.config.RelevanceConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TF-IDF text vectorizer with unigram and bigram tokens.
 * Fit once on a corpus, then transform any number of texts against the
 * corpus statistics.
 */
public class TFIDFVectorizer {
    private static final Logger logger = LoggerFactory.getLogger(TFIDFVectorizer.class);

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WORD = Pattern.compile("[a-z0-9]+");

    private final IdfWeighting weighting;
    // Replaced wholesale by fit(); readers always see one consistent snapshot
    private volatile CorpusStatistics statistics;

    public TFIDFVectorizer() {
        this(IdfWeighting.STANDARD);
    }

    public TFIDFVectorizer(IdfWeighting weighting) {
        this.weighting = Objects.requireNonNull(weighting, "weighting");
        this.statistics = CorpusStatistics.EMPTY;
    }

    /**
     * Normalizes text into tokens: diacritics stripped, lowercased, alphanumeric
     * runs as unigrams, then one bigram per adjacent pair.
     */
    public List<String> tokenize(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            return List.of();
        }

        String stripped = COMBINING_MARKS.matcher(Normalizer.normalize(text, Normalizer.Form.NFD))
                .replaceAll("");
        Matcher matcher = WORD.matcher(stripped.toLowerCase(Locale.ROOT));

        List<String> words = new ArrayList<>();
        while (matcher.find()) {
            words.add(matcher.group());
        }

        List<String> tokens = new ArrayList<>(words.size() * 2);
        tokens.addAll(words);
        for (int i = 0; i + 1 < words.size(); i++) {
            tokens.add(words.get(i) + RelevanceConfiguration.BIGRAM_SEPARATOR + words.get(i + 1));
        }
        return tokens;
    }

    /**
     * Computes document frequencies over the corpus, replacing any earlier fit.
     */
    public TFIDFVectorizer fit(List<String> corpus) {
        Objects.requireNonNull(corpus, "corpus");

        Map<String, Integer> documentFrequencies = new HashMap<>();
        for (String document : corpus) {
            // Count each term once per document
            for (String term : new HashSet<>(tokenize(document))) {
                documentFrequencies.merge(term, 1, Integer::sum);
            }
        }

        Map<String, Double> idfScores = new HashMap<>(documentFrequencies.size());
        for (Map.Entry<String, Integer> entry : documentFrequencies.entrySet()) {
            idfScores.put(entry.getKey(), weighting.idf(corpus.size(), entry.getValue()));
        }

        statistics = new CorpusStatistics(corpus.size(), idfScores);
        logger.debug("Fitted vectorizer: documents={}, vocabulary={}, weighting={}",
                corpus.size(), idfScores.size(), weighting);
        return this;
    }

    public SparseVector transform(String text) {
        List<String> tokens = tokenize(text);
        if (tokens.isEmpty()) {
            return SparseVector.empty();
        }

        CorpusStatistics stats = statistics;
        Map<String, Integer> termCounts = countTerms(tokens);

        Map<String, Double> vector = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : termCounts.entrySet()) {
            double tf = (double) entry.getValue() / tokens.size();
            double idf = stats.idf(entry.getKey());
            vector.put(entry.getKey(), tf * idf);
        }
        // SparseVector drops the zero and negative weights
        return SparseVector.of(vector);
    }

    public List<SparseVector> fitTransform(List<String> corpus) {
        fit(corpus);
        List<SparseVector> vectors = new ArrayList<>(corpus.size());
        for (String document : corpus) {
            vectors.add(transform(document));
        }
        return vectors;
    }

    /**
     * Inverse document frequency of a token; 0 for tokens never seen during fit.
     */
    public double idf(String token) {
        return statistics.idf(token);
    }

    public int documentCount() {
        return statistics.documentCount;
    }

    public int vocabularySize() {
        return statistics.idfScores.size();
    }

    public IdfWeighting getWeighting() {
        return weighting;
    }

    private Map<String, Integer> countTerms(List<String> tokens) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        return counts;
    }

    private static final class CorpusStatistics {
        static final CorpusStatistics EMPTY = new CorpusStatistics(0, Map.of());

        final int documentCount;
        final Map<String, Double> idfScores;

        CorpusStatistics(int documentCount, Map<String, Double> idfScores) {
            this.documentCount = documentCount;
            this.idfScores = idfScores;
        }

        double idf(String token) {
            return idfScores.getOrDefault(token, 0.0);
        }
    }
}
