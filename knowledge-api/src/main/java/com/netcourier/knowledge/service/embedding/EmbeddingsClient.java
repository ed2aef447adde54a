package com.netcourier.knowledge.service.embedding;

import java.util.List;

public interface EmbeddingsClient {

    float[] embed(String text);

    /**
     * Embeds {@code texts} in provider-sized batches. The i-th vector belongs to the i-th text.
     */
    List<float[]> embedAll(List<String> texts);
}
