package com.reviewmerge.domain.consolidation.model;

import java.util.List;

/**
 * Sources disagreeing about recommendations that share a topic.
 *
 * @param topic           lowercase first three words of the recommendations' descriptions
 * @param kind            what the sources disagree on
 * @param sources         distinct sources involved, in input order
 * @param recommendations the raw recommendations sharing the topic
 */
public record Conflict(
        String topic,
        ConflictKind kind,
        List<String> sources,
        List<Recommendation> recommendations
) {}
