package com.lexassist.planner.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a JSON object out of model replies that may wrap it in commentary or a code fence.
 */
final class ModelJsonExtractor {

    private static final Pattern FENCED_OBJECT = Pattern.compile("```(?:json)?\\s*(\\{[\\s\\S]*})\\s*```");
    private static final Pattern BARE_OBJECT = Pattern.compile("\\{[\\s\\S]*}");

    private final ObjectMapper objectMapper;

    ModelJsonExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Tries the fenced block first, then the outermost braces, then the raw text.
     *
     * @throws JsonProcessingException when none of the candidates is valid JSON
     */
    JsonNode readObject(String reply) throws JsonProcessingException {
        if (reply == null) {
            throw new IllegalArgumentException("Model reply is null");
        }
        String candidate = reply.trim();
        Matcher fenced = FENCED_OBJECT.matcher(candidate);
        if (fenced.find()) {
            candidate = fenced.group(1);
        }
        Matcher bare = BARE_OBJECT.matcher(candidate);
        if (bare.find()) {
            candidate = bare.group();
        }
        JsonNode root = objectMapper.readTree(candidate);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Model reply is not a JSON object");
        }
        return root;
    }

    boolean containsObject(String reply) {
        return reply != null && BARE_OBJECT.matcher(reply).find();
    }
}
