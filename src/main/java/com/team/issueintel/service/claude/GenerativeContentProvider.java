package com.team.issueintel.service.claude;

import reactor.core.publisher.Mono;

/**
 * Produces free-form content (expected to contain a JSON document) for a prompt.
 */
public interface GenerativeContentProvider {

    Mono<String> complete(String prompt);
}
