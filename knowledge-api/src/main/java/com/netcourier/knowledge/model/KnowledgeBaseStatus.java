package com.netcourier.knowledge.model;

public record KnowledgeBaseStatus(boolean exists,
                                  long pointsCount,
                                  String status) {
}
