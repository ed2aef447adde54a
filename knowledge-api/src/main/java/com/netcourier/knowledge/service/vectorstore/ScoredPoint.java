package com.netcourier.knowledge.service.vectorstore;

import java.util.Map;

public record ScoredPoint(String id, double score, Map<String, Object> payload) {
}
