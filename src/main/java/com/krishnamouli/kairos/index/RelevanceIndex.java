package com.krishnamouli.kairos.index;

import com.krishnamouli.kairos.config.KairosConfig;
import com.krishnamouli.kairos.config.RelevanceConfiguration;
import com.krishnamouli.kairos.intelligence.semantic.CosineSimilarity;
import com.krishnamouli.kairos.intelligence.semantic.SparseVector;
import com.krishnamouli.kairos.intelligence.semantic.TFIDFVectorizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Immutable TF-IDF index over named documents.
 *
 * <p>Built once from a corpus, then searched any number of times, concurrently
 * if needed. A changed corpus means building a new index and swapping the
 * reference (see {@link RelevanceIndexHolder}); entries are never edited in place.
 */
public final class RelevanceIndex {
    private static final Logger logger = LoggerFactory.getLogger(RelevanceIndex.class);

    private final TFIDFVectorizer vectorizer;
    private final Map<String, SparseVector> vectors;
    private final double neutralBoost;
    private final int candidateMultiplier;

    private RelevanceIndex(TFIDFVectorizer vectorizer, Map<String, SparseVector> vectors, KairosConfig config) {
        this.vectorizer = vectorizer;
        this.vectors = vectors;
        this.neutralBoost = config.getNeutralBoost();
        this.candidateMultiplier = config.getBoostCandidateMultiplier();
    }

    public static RelevanceIndex empty() {
        return build(Map.of());
    }

    public static RelevanceIndex build(Map<String, String> namedDocuments) {
        return build(namedDocuments, KairosConfig.defaults());
    }

    /**
     * Fits a fresh vectorizer on every document text and stores one vector per
     * name, keeping the map's iteration order as the tie-break order.
     */
    public static RelevanceIndex build(Map<String, String> namedDocuments, KairosConfig config) {
        Objects.requireNonNull(namedDocuments, "namedDocuments");
        config.validate();

        List<String> names = new ArrayList<>(namedDocuments.keySet());
        List<String> texts = new ArrayList<>(names.size());
        for (String name : names) {
            texts.add(namedDocuments.get(name));
        }

        TFIDFVectorizer vectorizer = new TFIDFVectorizer(config.getIdfWeighting());
        List<SparseVector> fitted = vectorizer.fitTransform(texts);

        Map<String, SparseVector> vectors = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            vectors.put(names.get(i), fitted.get(i));
        }

        logger.info("Relevance index built: documents={}, vocabulary={}",
                vectors.size(), vectorizer.vocabularySize());
        return new RelevanceIndex(vectorizer, Collections.unmodifiableMap(vectors), config);
    }

    public static RelevanceIndex buildFromKeywords(Map<String, ? extends Collection<String>> keywordMap) {
        return buildFromKeywords(keywordMap, KairosConfig.defaults());
    }

    /**
     * Indexes each name as its own words followed by its keywords, so
     * {@code canvas-2d-reference} also matches "canvas", "2d" and "reference".
     */
    public static RelevanceIndex buildFromKeywords(Map<String, ? extends Collection<String>> keywordMap,
                                                   KairosConfig config) {
        Objects.requireNonNull(keywordMap, "keywordMap");
        Map<String, String> documents = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Collection<String>> entry : keywordMap.entrySet()) {
            String expandedName = entry.getKey().replace('-', ' ').replace('_', ' ');
            documents.put(entry.getKey(), expandedName + " " + String.join(" ", entry.getValue()));
        }
        return build(documents, config);
    }

    /**
     * Ranks documents by cosine similarity to the query, best first.
     * Zero scores are dropped; equal scores keep build order.
     *
     * @return at most {@code topK} results; empty for a blank query, an empty
     *         index or a non-positive topK
     */
    public List<ScoredName> search(String query, int topK) {
        if (query == null || query.isBlank() || vectors.isEmpty() || topK <= 0) {
            return List.of();
        }

        SparseVector queryVector = vectorizer.transform(query);
        if (queryVector.isEmpty()) {
            return List.of();
        }

        List<ScoredName> scores = new ArrayList<>();
        for (Map.Entry<String, SparseVector> entry : vectors.entrySet()) {
            double similarity = CosineSimilarity.similarity(queryVector, entry.getValue());
            if (similarity > 0.0) {
                scores.add(new ScoredName(entry.getKey(), similarity));
            }
        }

        // List.sort is stable, so ties stay in build order
        scores.sort(Comparator.comparingDouble((ScoredName s) -> s.score).reversed());
        return List.copyOf(scores.size() > topK ? scores.subList(0, topK) : scores);
    }

    /**
     * Re-ranks a wider candidate pool by multiplying each similarity with the
     * Bayesian mean success rate of that document. Documents without
     * observations get the neutral boost.
     */
    public List<ScoredName> searchWithBoost(String query, int topK, Map<String, SubjectStats> statsByName) {
        if (topK <= 0) {
            return List.of();
        }
        int poolSize = (int) Math.min(Integer.MAX_VALUE, (long) topK * candidateMultiplier);
        List<ScoredName> candidates = search(query, poolSize);
        if (candidates.isEmpty()) {
            return candidates;
        }

        Map<String, SubjectStats> stats = statsByName != null ? statsByName : Map.of();
        List<ScoredName> boosted = new ArrayList<>(candidates.size());
        for (ScoredName candidate : candidates) {
            SubjectStats stat = stats.get(candidate.name);
            double boost = stat != null && stat.hasObservations()
                    ? stat.toEstimator().mean()
                    : neutralBoost;
            boosted.add(new ScoredName(candidate.name, candidate.score * boost));
            logger.trace("Boost {}: similarity={}, stats={}, boost={}",
                    candidate.name, candidate.score, stat, boost);
        }

        boosted.sort(Comparator.comparingDouble((ScoredName s) -> s.score).reversed());
        List<ScoredName> top = List.copyOf(boosted.size() > topK ? boosted.subList(0, topK) : boosted);
        logger.debug("Boosted search for '{}': {} candidates -> {}", truncate(query), candidates.size(), top);
        return top;
    }

    public int size() {
        return vectors.size();
    }

    public boolean isEmpty() {
        return vectors.isEmpty();
    }

    public Set<String> names() {
        return vectors.keySet();
    }

    public Optional<SparseVector> vectorOf(String name) {
        return Optional.ofNullable(vectors.get(name));
    }

    private static String truncate(String str) {
        // Truncate long strings for readable logging
        int max = RelevanceConfiguration.STRING_TRUNCATE_LENGTH;
        return str.length() > max ? str.substring(0, max - 3) + "..." : str;
    }
}
