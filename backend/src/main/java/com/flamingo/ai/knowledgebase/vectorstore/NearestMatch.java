package com.flamingo.ai.knowledgebase.vectorstore;

import java.util.Map;

/**
 * A stored chunk returned by a nearest-neighbour query.
 *
 * @param distance cosine distance in [0, 2]; smaller means more similar
 */
public record NearestMatch(
    String id, String content, Map<String, Object> metadata, double distance) {}
