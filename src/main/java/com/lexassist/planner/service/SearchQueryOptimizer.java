package com.lexassist.planner.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexassist.planner.model.QueryIntent;
import com.lexassist.planner.model.ReasoningBudget;
import com.lexassist.planner.model.ResponseFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Compresses a verbose question into a keyword query for full-text backends. Falls back to
 * the question verbatim on any failure.
 */
@Service
public class SearchQueryOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(SearchQueryOptimizer.class);

    private static final String QUOTE_CHARS = "\"'`«»“”„";

    private final CompletionService completionService;
    private final ModelJsonExtractor jsonExtractor;
    private final Executor executor;
    private final String promptTemplate;

    public SearchQueryOptimizer(CompletionService completionService,
                                ObjectMapper objectMapper,
                                @Qualifier("queryPlannerExecutor") Executor executor) {
        this.completionService = completionService;
        this.jsonExtractor = new ModelJsonExtractor(objectMapper);
        this.executor = executor;
        this.promptTemplate = loadPromptTemplate();
    }

    public CompletableFuture<String> optimize(String userQuery, QueryIntent intent, ReasoningBudget budget) {
        if (budget == null || budget == ReasoningBudget.QUICK) {
            return CompletableFuture.completedFuture(userQuery);
        }
        return CompletableFuture.supplyAsync(() -> optimizeBlocking(userQuery, intent), executor);
    }

    String optimizeBlocking(String userQuery, QueryIntent intent) {
        try {
            String reply = completionService.complete(buildPrompt(userQuery, intent), ResponseFormat.JSON_OBJECT);
            String candidate = reply;
            if (jsonExtractor.containsObject(reply)) {
                JsonNode root = jsonExtractor.readObject(reply);
                JsonNode field = root.path("search_query");
                candidate = field.isTextual() ? field.asText() : null;
            }
            String optimized = trimQuotes(candidate);
            if (!StringUtils.hasText(optimized)) {
                logger.warn("Search query optimization returned an empty result; using the original query");
                return userQuery;
            }
            logger.debug("Optimized search query: '{}' -> '{}'", userQuery, optimized);
            return optimized;
        } catch (Exception ex) {
            logger.warn("Search query optimization failed, using the original query: {}", ex.getMessage());
            return userQuery;
        }
    }

    String buildPrompt(String userQuery, QueryIntent intent) {
        String intentName = intent != null ? intent.intent() : IntentSanitizer.DEFAULT_INTENT;
        return promptTemplate
                .replace("{intent}", intentName)
                .replace("{user_query}", userQuery == null ? "" : userQuery);
    }

    static String trimQuotes(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        int start = 0;
        int end = trimmed.length();
        while (start < end && QUOTE_CHARS.indexOf(trimmed.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && QUOTE_CHARS.indexOf(trimmed.charAt(end - 1)) >= 0) {
            end--;
        }
        return trimmed.substring(start, end).trim();
    }

    private String loadPromptTemplate() {
        try {
            ClassPathResource resource = new ClassPathResource("prompts/search_query_prompt.txt");
            byte[] bytes = resource.getInputStream().readAllBytes();
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("Failed to load search query prompt template: {}", e.getMessage());
            return "Rewrite the legal question as a full-text search query: drop question and filler words, "
                    + "keep legal terms and article numbers, at most 15 keywords. "
                    + "Return {\"search_query\": \"...\"}.\n\n"
                    + "Intent: {intent}\nQuestion: {user_query}";
        }
    }
}
