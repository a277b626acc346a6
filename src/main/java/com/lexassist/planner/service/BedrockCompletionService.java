package com.lexassist.planner.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.util.concurrent.RateLimiter;
import com.lexassist.planner.model.ResponseFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * {@link CompletionService} backed by an Anthropic model on Amazon Bedrock. Owns rate
 * limiting and throttling backoff so the planner never retries on its own.
 */
@Service
public class BedrockCompletionService implements CompletionService {

    private static final Logger logger = LoggerFactory.getLogger(BedrockCompletionService.class);

    static final String JSON_ONLY_INSTRUCTION =
            "\n\nReturn exactly one JSON object. No markdown, no code fences, no commentary.";

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter completionRateLimiter;
    private final String modelId;
    private final int maxTokens;
    private final double temperature;
    private final int maxAttempts;

    /**
     * @param bedrockClient   runtime client with SDK-level retries disabled
     * @param objectMapper    JSON mapper for request and response bodies
     * @param completionRateLimiter permits per completion call
     * @param modelId         Bedrock model id used for every completion
     * @param maxTokens       maximum tokens in a reply
     * @param temperature     sampling temperature
     * @param maxAttempts     attempts before a throttled call surfaces as {@link ThrottledException}
     */
    public BedrockCompletionService(BedrockRuntimeClient bedrockClient,
                                    ObjectMapper objectMapper,
                                    @Qualifier("completionRateLimiter") RateLimiter completionRateLimiter,
                                    @Value("${aws.bedrock.modelId}") String modelId,
                                    @Value("${app.bedrock.maxTokens:500}") int maxTokens,
                                    @Value("${app.bedrock.temperature:0.3}") double temperature,
                                    @Value("${app.bedrock.maxAttempts:4}") int maxAttempts) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.completionRateLimiter = completionRateLimiter;
        this.modelId = modelId;
        this.maxTokens = Math.max(64, maxTokens);
        this.temperature = temperature;
        this.maxAttempts = Math.max(1, maxAttempts);
        logger.info("BedrockCompletionService initialized with model ID: {}", modelId);
    }

    @Override
    public String complete(String prompt, ResponseFormat responseFormat) {
        String content = responseFormat == ResponseFormat.JSON_OBJECT ? prompt + JSON_ONLY_INSTRUCTION : prompt;
        try {
            InvokeModelRequest request = InvokeModelRequest.builder()
                    .modelId(modelId)
                    .contentType("application/json")
                    .accept("application/json")
                    .body(SdkBytes.fromUtf8String(buildPayload(content)))
                    .build();

            completionRateLimiter.acquire();
            InvokeModelResponse response = invokeWithRetry(request);
            return extractText(response.body().asUtf8String());
        } catch (ThrottledException te) {
            throw te;
        } catch (BedrockRuntimeException e) {
            String message = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            logger.error("Bedrock API error during completion for model {}: {}", modelId, message, e);
            throw new IllegalStateException("Bedrock API error during completion", e);
        } catch (Exception e) {
            throw new IllegalStateException("Unexpected error during completion: " + e.getMessage(), e);
        }
    }

    String buildPayload(String content) throws IOException {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("anthropic_version", "bedrock-2023-05-31");
        payload.put("max_tokens", maxTokens);
        payload.put("temperature", temperature);
        List<ObjectNode> messages = new ArrayList<>();
        ObjectNode userMessage = objectMapper.createObjectNode();
        userMessage.put("role", "user");
        userMessage.put("content", content);
        messages.add(userMessage);
        payload.set("messages", objectMapper.valueToTree(messages));
        return objectMapper.writeValueAsString(payload);
    }

    String extractText(String responseBody) throws IOException {
        JsonNode responseJson = objectMapper.readTree(responseBody);
        JsonNode contentBlock = responseJson.path("content");
        if (!contentBlock.isArray() || contentBlock.size() == 0) {
            throw new IllegalStateException("Bedrock response missing content block");
        }
        String textContent = contentBlock.get(0).path("text").asText("").trim();

        // Models sometimes wrap JSON in ```json fences despite the instruction
        if (textContent.startsWith("```json")) {
            textContent = textContent.substring(7).trim();
            if (textContent.endsWith("```")) {
                textContent = textContent.substring(0, textContent.length() - 3).trim();
            }
        } else if (textContent.startsWith("```") && textContent.endsWith("```") && textContent.length() >= 6) {
            textContent = textContent.substring(3, textContent.length() - 3).trim();
        }
        return textContent;
    }

    /**
     * Invokes Bedrock with exponential backoff on throttling, surfacing persistent throttling
     * as {@link ThrottledException}.
     */
    private InvokeModelResponse invokeWithRetry(InvokeModelRequest request) {
        final long baseBackoffMs = 800L;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return bedrockClient.invokeModel(request);
            } catch (BedrockRuntimeException e) {
                if (!isThrottling(e)) {
                    throw e;
                }
                if (attempt == maxAttempts) {
                    logger.warn("Bedrock throttled after {} attempts; surfacing throttling.", maxAttempts);
                    throw new ThrottledException("Bedrock throttling after retries", e);
                }

                long jitter = ThreadLocalRandom.current().nextLong(50, 200);
                long sleepMs = (long) Math.min(10_000, baseBackoffMs * Math.pow(2, attempt - 1) + jitter);
                logger.warn("Bedrock throttled (attempt {}/{}). Backing off for {} ms.", attempt, maxAttempts, sleepMs);
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted during backoff", ie);
                }
            }
        }
        throw new IllegalStateException("Unreachable");
    }

    static boolean isThrottling(BedrockRuntimeException e) {
        String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
        return e.statusCode() == 429
                || "ThrottlingException".equalsIgnoreCase(code)
                || "TooManyRequestsException".equalsIgnoreCase(code)
                || "ProvisionedThroughputExceededException".equalsIgnoreCase(code);
    }
}
