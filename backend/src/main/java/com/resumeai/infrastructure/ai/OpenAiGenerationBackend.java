package com.resumeai.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.resumeai.domain.rewrite.exception.RewriteErrorCode;
import com.resumeai.domain.rewrite.model.GenerationRequest;
import com.resumeai.domain.rewrite.model.GenerationResult;
import com.resumeai.domain.rewrite.service.GenerationBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.InterruptedIOException;
import java.util.concurrent.TimeoutException;

/**
 * Chat-completion wrapper behind {@link GenerationBackend}. Retry policy lives in the rewrite pipeline;
 * this class only falls back once to a second model when the primary is rate limited or failing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiGenerationBackend implements GenerationBackend {

    private final OpenAIClient openAIClient;

    @Value("${openai.api-key:}")
    private String apiKey;

    @Value("${openai.model}")
    private String model;

    @Value("${openai.fallback-model:}")
    private String fallbackModel;

    @Value("${openai.max-tokens}")
    private int maxTokens;

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        try {
            return callWithModel(model, request);
        } catch (AiGenerationException e) {
            boolean canFallback = e.getCode() != RewriteErrorCode.TIMEOUT
                    && fallbackModel != null && !fallbackModel.isBlank() && !fallbackModel.equals(model);
            if (!canFallback) {
                throw e;
            }
            log.warn("Primary model {} failed with {}, retrying once on {}", model, e.getCode(), fallbackModel);
            return callWithModel(fallbackModel, request);
        }
    }

    /**
     * One chat-completion call with JSON response format and token usage logging.
     */
    GenerationResult callWithModel(String modelName, GenerationRequest request) {
        try {
            ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                    .model(modelName)
                    .temperature(request.temperature())
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(request.system())
                    .addUserMessage(request.user())
                    .responseFormat(ResponseFormatJsonObject.builder().build())
                    .build();

            ChatCompletion completion = openAIClient.chat().completions().create(params);

            long promptTokens = 0;
            long completionTokens = 0;
            if (completion.usage().isPresent()) {
                var usage = completion.usage().get();
                promptTokens = usage.promptTokens();
                completionTokens = usage.completionTokens();
                log.info("Token usage [{}] - prompt: {}, completion: {}, total: {}",
                        modelName, promptTokens, completionTokens, usage.totalTokens());
            }

            String content = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .orElseThrow(() -> new AiGenerationException(RewriteErrorCode.LLM_ERROR,
                            "Generation response has no content"));

            return new GenerationResult(content.trim(), modelName, promptTokens, completionTokens);
        } catch (AiGenerationException e) {
            throw e;
        } catch (Exception e) {
            RewriteErrorCode code = classify(e);
            log.error("OpenAI API call failed [{}] - {}", modelName, code, e);
            throw new AiGenerationException(code, "Generation service call failed: " + code.title(), e);
        }
    }

    /**
     * Map a client failure to the engine's error taxonomy.
     */
    static RewriteErrorCode classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof OpenAIServiceException serviceException) {
                int status = serviceException.statusCode();
                if (status == 429) {
                    return RewriteErrorCode.RATE_LIMIT;
                }
                if (status == 408 || status == 504) {
                    return RewriteErrorCode.TIMEOUT;
                }
            }
            if (t instanceof InterruptedIOException || t instanceof TimeoutException) {
                return RewriteErrorCode.TIMEOUT;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return RewriteErrorCode.LLM_ERROR;
    }
}
