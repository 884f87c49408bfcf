package com.krishnamouli.kairos.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named document and its relevance score for one query.
 */
public class ScoredName {
    public final String name;
    public final double score;

    @JsonCreator
    public ScoredName(@JsonProperty("name") String name, @JsonProperty("score") double score) {
        this.name = name;
        this.score = score;
    }

    @Override
    public String toString() {
        return String.format("%s=%.4f", name, score);
    }
}
