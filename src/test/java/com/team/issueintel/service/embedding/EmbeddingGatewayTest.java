package com.team.issueintel.service.embedding;

import com.team.issueintel.config.EmbeddingApiConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingGateway")
class EmbeddingGatewayTest {

    @Mock
    private EmbeddingProvider embeddingProvider;

    private EmbeddingApiConfig config;
    private EmbeddingGateway gateway;

    @BeforeEach
    void setUp() {
        config = new EmbeddingApiConfig();
        gateway = new EmbeddingGateway(embeddingProvider, config);
    }

    @Test
    @DisplayName("cleaned text is sent and the vector returned")
    void tryEmbed_success() {
        given(embeddingProvider.embed("App down now")).willReturn(Mono.just(new double[]{0.1, 0.2}));

        assertThat(gateway.tryEmbed("App down!!  now")).hasValueSatisfying(
                vector -> assertThat(vector).containsExactly(0.1, 0.2));
    }

    @Test
    @DisplayName("provider errors degrade to empty")
    void tryEmbed_error() {
        given(embeddingProvider.embed(anyString())).willReturn(Mono.error(new IllegalStateException("503")));

        assertThat(gateway.tryEmbed("App down")).isEmpty();
    }

    @Test
    @DisplayName("a provider that never answers times out to empty")
    void tryEmbed_timeout() {
        config.setTimeoutSeconds(1);
        given(embeddingProvider.embed(anyString())).willReturn(Mono.never());

        assertThat(gateway.tryEmbed("App down")).isEmpty();
    }

    @Test
    @DisplayName("empty vectors and blank text are treated as unavailable")
    void tryEmbed_emptyInputs() {
        given(embeddingProvider.embed(anyString())).willReturn(Mono.just(new double[0]));

        assertThat(gateway.tryEmbed("App down")).isEmpty();
        assertThat(gateway.tryEmbed("  ?! ")).isEmpty();
        verify(embeddingProvider, never()).embed("");
    }
}
