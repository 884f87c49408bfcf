package com.krishnamouli.kairos.index;

import com.krishnamouli.kairos.config.KairosConfig;
import com.krishnamouli.kairos.core.InvalidInputException;
import com.krishnamouli.kairos.intelligence.semantic.IdfWeighting;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RelevanceIndexTest {

    private RelevanceIndex skills;

    @BeforeEach
    void setUp() {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        keywords.put("canvas-2d-reference", List.of("canvas", "2d", "draw", "fillRect", "ctx", "render"));
        keywords.put("physics-simulation", List.of("physics", "collision", "gravity", "velocity", "rigid", "body"));
        keywords.put("web-audio-api", List.of("audio", "sound", "music", "oscillator", "gain", "synth"));
        keywords.put("game-loop-patterns", List.of("game", "loop", "frame", "tick", "update", "fixed", "timestep"));
        skills = RelevanceIndex.buildFromKeywords(keywords);
    }

    private static List<String> names(List<ScoredName> results) {
        return results.stream().map(r -> r.name).collect(Collectors.toList());
    }

    @Test
    void testTwoDocumentCorpus() {
        Map<String, String> documents = new LinkedHashMap<>();
        documents.put("canvas-2d", "canvas draw fillRect");
        documents.put("physics", "collision gravity velocity");
        RelevanceIndex index = RelevanceIndex.build(documents);

        List<ScoredName> results = index.search("draw 2d graphics", 5);
        assertFalse(results.isEmpty());
        assertEquals("canvas-2d", results.get(0).name);
        assertFalse(names(results).contains("physics"));
    }

    @Test
    void testCanvasQuery() {
        List<ScoredName> results = skills.search("I need to draw on a canvas with 2d graphics", 3);
        assertFalse(results.isEmpty());
        assertEquals("canvas-2d-reference", results.get(0).name);
    }

    @Test
    void testPhysicsQuery() {
        List<ScoredName> results = skills.search("handle collision detection and gravity for objects", 3);
        assertTrue(names(results).contains("physics-simulation"));
    }

    @Test
    void testNameWordsAreIndexed() {
        List<ScoredName> results = skills.search("patterns", 3);
        assertEquals(List.of("game-loop-patterns"), names(results));
    }

    @Test
    void testScoresInRangeAndDescending() {
        List<ScoredName> results = skills.search("render a game frame with sound and canvas", 4);
        assertFalse(results.isEmpty());
        for (int i = 0; i < results.size(); i++) {
            double score = results.get(i).score;
            assertTrue(score > 0.0 && score <= 1.0, "Score out of range: " + score);
            if (i > 0) {
                assertTrue(results.get(i - 1).score >= score);
            }
        }
    }

    @Test
    void testUnrelatedQueryReturnsNothing() {
        assertTrue(skills.search("kubernetes docker deployment", 5).isEmpty());
    }

    @Test
    void testBlankQuery() {
        assertTrue(skills.search("", 5).isEmpty());
        assertTrue(skills.search("   ", 5).isEmpty());
        assertTrue(skills.search(null, 5).isEmpty());
        assertTrue(skills.search("?!", 5).isEmpty());
    }

    @Test
    void testNonPositiveTopK() {
        assertTrue(skills.search("canvas", 0).isEmpty());
        assertTrue(skills.search("canvas", -1).isEmpty());
        assertTrue(skills.searchWithBoost("canvas", 0, Map.of()).isEmpty());
    }

    @Test
    void testEmptyIndex() {
        RelevanceIndex index = RelevanceIndex.empty();
        assertTrue(index.isEmpty());
        assertEquals(0, index.size());
        assertTrue(index.search("anything", 5).isEmpty());
        assertTrue(index.searchWithBoost("anything", 5, Map.of()).isEmpty());
    }

    @Test
    void testTopKTruncation() {
        Map<String, String> documents = new LinkedHashMap<>();
        for (int i = 0; i < 10; i++) {
            documents.put("doc-" + i, "shared term number" + i);
        }
        documents.put("other", "nothing in common");
        RelevanceIndex index = RelevanceIndex.build(documents);

        assertEquals(3, index.search("shared", 3).size());
        assertEquals(10, index.search("shared", 50).size());
    }

    @Test
    void testTiesKeepBuildOrder() {
        Map<String, String> documents = new LinkedHashMap<>();
        documents.put("first", "alpha beta");
        documents.put("second", "alpha gamma");
        documents.put("third", "delta epsilon");

        List<ScoredName> results = RelevanceIndex.build(documents).search("alpha", 5);
        assertEquals(List.of("first", "second"), names(results));
        assertEquals(results.get(0).score, results.get(1).score);

        Map<String, String> reversed = new LinkedHashMap<>();
        reversed.put("second", "alpha gamma");
        reversed.put("first", "alpha beta");
        reversed.put("third", "delta epsilon");
        assertEquals(List.of("second", "first"), names(RelevanceIndex.build(reversed).search("alpha", 5)));
    }

    @Test
    void testStandardWeightingOnTwoDocuments() {
        KairosConfig config = KairosConfig.defaults();
        config.setIdfWeighting(IdfWeighting.STANDARD);

        Map<String, String> documents = new LinkedHashMap<>();
        documents.put("canvas-2d", "canvas draw fillRect");
        documents.put("physics", "collision gravity velocity");

        // ln(2 / 2) = 0 for every token, so nothing can match
        assertTrue(RelevanceIndex.build(documents, config).search("draw", 5).isEmpty());
    }

    @Test
    void testAccessors() {
        assertEquals(4, skills.size());
        assertEquals(List.of("canvas-2d-reference", "physics-simulation", "web-audio-api", "game-loop-patterns"),
                List.copyOf(skills.names()));
        assertTrue(skills.vectorOf("web-audio-api").isPresent());
        assertTrue(skills.vectorOf("web-audio-api").get().contains("oscillator"));
        assertFalse(skills.vectorOf("missing").isPresent());
        assertThrows(UnsupportedOperationException.class, () -> skills.names().remove("web-audio-api"));
    }

    // Boosted search fixtures: "batched" shares most tokens with "plain" but matches
    // the query exactly, giving similarities of 1.0 and about 0.61.
    private RelevanceIndex rendererIndex() {
        Map<String, String> documents = new LinkedHashMap<>();
        documents.put("batched", "render sprite texture shader batch");
        documents.put("plain", "render sprite texture shader");
        documents.put("audio", "audio mixer");
        return RelevanceIndex.build(documents);
    }

    private static final String RENDER_QUERY = "render sprite texture shader batch";

    @Test
    void testBoostPromotesProvenDocument() {
        RelevanceIndex index = rendererIndex();
        List<ScoredName> plain = index.search(RENDER_QUERY, 5);
        assertEquals(List.of("batched", "plain"), names(plain));

        Map<String, SubjectStats> stats = Map.of("plain", new SubjectStats(1000, 1000));
        List<ScoredName> boosted = index.searchWithBoost(RENDER_QUERY, 5, stats);

        assertEquals(List.of("plain", "batched"), names(boosted));
        // No observations for "batched": neutral boost of 0.5
        assertEquals(plain.get(0).score * 0.5, boosted.get(1).score, 1e-12);
        assertEquals(plain.get(1).score * (1001.0 / 1002.0), boosted.get(0).score, 1e-12);
    }

    @Test
    void testBoostDrawsFromWiderPool() {
        Map<String, SubjectStats> stats = Map.of("plain", new SubjectStats(1000, 1000));
        List<ScoredName> boosted = rendererIndex().searchWithBoost(RENDER_QUERY, 1, stats);
        assertEquals(List.of("plain"), names(boosted));
    }

    @Test
    void testBoostWithoutStatsKeepsOrder() {
        RelevanceIndex index = rendererIndex();
        List<String> plain = names(index.search(RENDER_QUERY, 5));

        assertEquals(plain, names(index.searchWithBoost(RENDER_QUERY, 5, null)));
        assertEquals(plain, names(index.searchWithBoost(RENDER_QUERY, 5, Map.of())));
        Map<String, SubjectStats> unobserved = Map.of("plain", new SubjectStats(0, 0));
        assertEquals(plain, names(index.searchWithBoost(RENDER_QUERY, 5, unobserved)));
    }

    @Test
    void testBoostNeverPromotesZeroSimilarity() {
        Map<String, SubjectStats> stats = Map.of(
                "audio", new SubjectStats(1000, 1000),
                "plain", new SubjectStats(0, 1000));
        List<ScoredName> boosted = rendererIndex().searchWithBoost(RENDER_QUERY, 5, stats);

        assertFalse(names(boosted).contains("audio"));
        for (ScoredName result : boosted) {
            assertTrue(result.score > 0.0);
        }
    }

    @Test
    void testZeroNeutralBoostRejected() {
        KairosConfig config = KairosConfig.defaults();
        config.setNeutralBoost(0.0);

        Map<String, String> documents = new LinkedHashMap<>();
        documents.put("batched", "render sprite texture shader batch");
        documents.put("audio", "audio mixer");
        assertThrows(InvalidInputException.class, () -> RelevanceIndex.build(documents, config));
    }

    @Test
    void testResultsAreImmutable() {
        RelevanceIndex index = rendererIndex();
        List<ScoredName> all = index.search(RENDER_QUERY, 10);
        List<ScoredName> truncated = index.search(RENDER_QUERY, 1);
        List<ScoredName> boosted = index.searchWithBoost(RENDER_QUERY, 10, Map.of());

        assertEquals(2, all.size());
        assertThrows(UnsupportedOperationException.class, () -> all.add(new ScoredName("extra", 1.0)));
        assertThrows(UnsupportedOperationException.class, () -> truncated.remove(0));
        assertThrows(UnsupportedOperationException.class, () -> boosted.clear());
    }

    @Test
    void testConfiguredNeutralBoost() {
        KairosConfig config = KairosConfig.defaults();
        config.setNeutralBoost(0.2);

        Map<String, String> documents = new LinkedHashMap<>();
        documents.put("batched", "render sprite texture shader batch");
        documents.put("audio", "audio mixer");
        RelevanceIndex index = RelevanceIndex.build(documents, config);

        double similarity = index.search("render sprite", 1).get(0).score;
        double boosted = index.searchWithBoost("render sprite", 1, Map.of()).get(0).score;
        assertEquals(similarity * 0.2, boosted, 1e-12);
    }
}
