package com.team.issueintel.service.embedding;

import reactor.core.publisher.Mono;

/**
 * Converts text into a fixed-length vector.
 */
public interface EmbeddingProvider {

    /**
     * @return the embedding, or an error signal when the provider cannot produce one
     */
    Mono<double[]> embed(String text);
}
