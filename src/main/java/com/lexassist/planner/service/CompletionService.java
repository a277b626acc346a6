package com.lexassist.planner.service;

import com.lexassist.planner.model.ResponseFormat;

/**
 * The only outbound dependency of the planner. Implementations own retries, key rotation,
 * timeouts and cost accounting; callers treat any runtime exception as a failed call.
 */
public interface CompletionService {

    /**
     * @param prompt         full prompt text
     * @param responseFormat hint about the expected reply shape
     * @return the model's text reply
     */
    String complete(String prompt, ResponseFormat responseFormat);
}
