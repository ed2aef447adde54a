package com.netcourier.knowledge.service.vectorstore;

import java.util.Map;

public record PointRecord(String id, Map<String, Object> payload) {
}
