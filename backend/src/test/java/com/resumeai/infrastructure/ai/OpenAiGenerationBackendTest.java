package com.resumeai.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.resumeai.domain.rewrite.exception.RewriteErrorCode;
import com.resumeai.domain.rewrite.model.GenerationRequest;
import com.resumeai.domain.rewrite.model.GenerationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OpenAiGenerationBackendTest {

    private static final GenerationRequest REQUEST = new GenerationRequest("system", "user", 0.3);

    @Mock
    private OpenAIClient openAIClient;

    private OpenAiGenerationBackend backend;

    @BeforeEach
    void setUp() {
        backend = spy(new OpenAiGenerationBackend(openAIClient));
        ReflectionTestUtils.setField(backend, "apiKey", "sk-test");
        ReflectionTestUtils.setField(backend, "model", "primary-model");
        ReflectionTestUtils.setField(backend, "fallbackModel", "fallback-model");
        ReflectionTestUtils.setField(backend, "maxTokens", 250);
    }

    @Test
    @DisplayName("Blank API key means unavailable")
    void availability() {
        assertThat(backend.isAvailable()).isTrue();

        ReflectionTestUtils.setField(backend, "apiKey", " ");
        assertThat(backend.isAvailable()).isFalse();
    }

    @Test
    @DisplayName("Rate-limited primary falls back once to the second model")
    void fallback_on_rate_limit() {
        GenerationResult fallback = new GenerationResult("{}", "fallback-model", 10, 5);
        doThrow(new AiGenerationException(RewriteErrorCode.RATE_LIMIT, "limited"))
                .when(backend).callWithModel(eq("primary-model"), any());
        doReturn(fallback).when(backend).callWithModel(eq("fallback-model"), any());

        assertThat(backend.generate(REQUEST)).isSameAs(fallback);
    }

    @Test
    @DisplayName("Timeouts are not retried on the fallback model")
    void no_fallback_on_timeout() {
        doThrow(new AiGenerationException(RewriteErrorCode.TIMEOUT, "slow"))
                .when(backend).callWithModel(eq("primary-model"), any());

        assertThatThrownBy(() -> backend.generate(REQUEST))
                .isInstanceOf(AiGenerationException.class)
                .extracting(e -> ((AiGenerationException) e).getCode())
                .isEqualTo(RewriteErrorCode.TIMEOUT);
        verify(backend, never()).callWithModel(eq("fallback-model"), any());
    }

    @Test
    void no_fallback_without_second_model() {
        ReflectionTestUtils.setField(backend, "fallbackModel", "");
        doThrow(new AiGenerationException(RewriteErrorCode.LLM_ERROR, "down"))
                .when(backend).callWithModel(eq("primary-model"), any());

        assertThatThrownBy(() -> backend.generate(REQUEST)).isInstanceOf(AiGenerationException.class);
        verify(backend, times(1)).callWithModel(any(), any());
    }

    @Test
    @DisplayName("Client failures map onto the error taxonomy")
    void classify() {
        assertThat(OpenAiGenerationBackend.classify(new SocketTimeoutException("read timed out")))
                .isEqualTo(RewriteErrorCode.TIMEOUT);
        assertThat(OpenAiGenerationBackend.classify(new RuntimeException(new TimeoutException())))
                .isEqualTo(RewriteErrorCode.TIMEOUT);
        assertThat(OpenAiGenerationBackend.classify(new IllegalStateException("bad response")))
                .isEqualTo(RewriteErrorCode.LLM_ERROR);
    }
}
