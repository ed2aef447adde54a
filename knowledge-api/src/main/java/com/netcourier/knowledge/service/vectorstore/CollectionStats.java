package com.netcourier.knowledge.service.vectorstore;

public record CollectionStats(long pointsCount, String status) {

    public static final String NOT_CREATED = "not_created";

    public static CollectionStats notCreated() {
        return new CollectionStats(0, NOT_CREATED);
    }
}
