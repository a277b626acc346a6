package com.lexassist.planner.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexassist.planner.model.MoneyTerms;
import com.lexassist.planner.model.QueryIntent;
import com.lexassist.planner.model.RawIntent;
import com.lexassist.planner.model.RawSlots;
import com.lexassist.planner.model.ReasoningBudget;
import com.lexassist.planner.model.ResponseFormat;
import com.lexassist.planner.model.SectionType;
import com.lexassist.planner.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Classifies a question through the completion service. Any failure of the call or of the
 * reply parsing falls back to {@link HeuristicClassifier#classifyQuick(String)}; there is no
 * retry here.
 */
@Service
public class ModelAssistedClassifier {

    private static final Logger logger = LoggerFactory.getLogger(ModelAssistedClassifier.class);

    public static final double MODEL_CONFIDENCE = 0.7;

    private final CompletionService completionService;
    private final HeuristicClassifier heuristicClassifier;
    private final IntentSanitizer sanitizer;
    private final ModelJsonExtractor jsonExtractor;
    private final Executor executor;
    private final String promptTemplate;

    public ModelAssistedClassifier(CompletionService completionService,
                                   HeuristicClassifier heuristicClassifier,
                                   IntentSanitizer sanitizer,
                                   ObjectMapper objectMapper,
                                   @Qualifier("queryPlannerExecutor") Executor executor) {
        this.completionService = completionService;
        this.heuristicClassifier = heuristicClassifier;
        this.sanitizer = sanitizer;
        this.jsonExtractor = new ModelJsonExtractor(objectMapper);
        this.executor = executor;
        this.promptTemplate = loadPromptTemplate();
    }

    /**
     * @throws IllegalArgumentException when called with the {@code quick} budget
     */
    public CompletableFuture<QueryIntent> classifyDeep(String query, ReasoningBudget budget) {
        if (budget == null || budget == ReasoningBudget.QUICK) {
            throw new IllegalArgumentException("Model-assisted classification requires the standard or deep budget, got " + budget);
        }
        return CompletableFuture.supplyAsync(() -> classify(query, budget), executor);
    }

    QueryIntent classify(String query, ReasoningBudget budget) {
        String prompt = buildPrompt(query);
        try {
            String reply = completionService.complete(prompt, ResponseFormat.JSON_OBJECT);
            JsonNode root = jsonExtractor.readObject(reply);
            QueryIntent intent = sanitizer.sanitize(toRawIntent(root, budget), budget);
            logger.debug("Model classification: intent={}, confidence={}, domains={}",
                    intent.intent(), intent.confidence(), intent.domains());
            return intent;
        } catch (Exception ex) {
            logger.warn("Model-assisted classification failed, falling back to heuristics: {}", ex.getMessage());
            return heuristicClassifier.classifyQuick(query);
        }
    }

    String buildPrompt(String query) {
        return promptTemplate.replace("{user_query}", query == null ? "" : query);
    }

    RawIntent toRawIntent(JsonNode root, ReasoningBudget budget) {
        List<String> domains = readArray(root.path("domains"));
        List<String> sections = readArray(root.path("sections"));
        Double confidence = readNumber(root.path("confidence"));
        String intent = textOrNull(root.path("intent"));

        return RawIntent.builder()
                .intent(intent != null ? intent : IntentSanitizer.DEFAULT_INTENT)
                .confidence(confidence != null ? confidence : MODEL_CONFIDENCE)
                .domains(domains.isEmpty() ? List.of(IntentSanitizer.DEFAULT_DOMAIN) : domains)
                .requiredEntities(readArray(root.path("required_entities")))
                .sections(sections.isEmpty() ? SectionType.DEFAULT_SECTIONS.stream().map(Enum::name).toList() : sections)
                .timeRange(readTimeRange(root.path("time_range")))
                .reasoningBudget(budget.getValue())
                .slots(readSlots(root.path("slots")))
                .build();
    }

    private RawSlots readSlots(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return RawSlots.builder()
                .procedureCode(textOrNull(node.path("procedure_code")))
                .courtLevel(textOrNull(node.path("court_level")))
                .caseCategory(textOrNull(node.path("case_category")))
                .lawArticle(textOrNull(node.path("law_article")))
                .sectionFocus(node.has("section_focus") ? readArray(node.path("section_focus")) : null)
                .moneyTerms(readMoneyTerms(node.path("money_terms")))
                .desiredOutput(textOrNull(node.path("desired_output")))
                .build();
    }

    private MoneyTerms readMoneyTerms(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return new MoneyTerms(
                flagOrNull(node.path("penalty")),
                flagOrNull(node.path("inflation")),
                flagOrNull(node.path("three_percent")),
                flagOrNull(node.path("legal_fees"))
        );
    }

    private TimeRange readTimeRange(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String from = textOrNull(node.path("from"));
        String to = textOrNull(node.path("to"));
        if (from == null && to == null) {
            return null;
        }
        return new TimeRange(from, to);
    }

    private List<String> readArray(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> {
                if (item != null && item.isValueNode()) {
                    String text = item.asText().trim();
                    if (!text.isEmpty()) {
                        values.add(text);
                    }
                }
            });
        } else if (node.isTextual()) {
            String text = node.asText().trim();
            if (!text.isEmpty()) {
                values.add(text);
            }
        }
        return List.copyOf(values);
    }

    private Double readNumber(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException ex) {
                logger.debug("Ignoring non-numeric confidence '{}'", node.asText());
            }
        }
        return null;
    }

    private Boolean flagOrNull(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? Boolean.TRUE : null;
        }
        if (node.isTextual() && "true".equalsIgnoreCase(node.asText().trim())) {
            return Boolean.TRUE;
        }
        return null;
    }

    private String textOrNull(JsonNode node) {
        if (node != null && (node.isTextual() || node.isNumber())) {
            String text = node.asText().trim();
            if (!text.isEmpty()) {
                return text;
            }
        }
        return null;
    }

    private String loadPromptTemplate() {
        try {
            ClassPathResource resource = new ClassPathResource("prompts/intent_classification_prompt.txt");
            byte[] bytes = resource.getInputStream().readAllBytes();
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("Failed to load intent classification prompt template: {}", e.getMessage());
            return "Classify the legal question and return one JSON object with keys: "
                    + "intent, confidence, domains (court|npa|echr|parliament|registry), required_entities, "
                    + "sections (FACTS|CLAIMS|LAW_REFERENCES|COURT_REASONING|DECISION|AMOUNTS), time_range {from,to}, "
                    + "reasoning_budget (quick|standard|deep), slots {procedure_code, court_level "
                    + "(first_instance|appeal|cassation|SC|GrandChamber), case_category, law_article, section_focus, "
                    + "money_terms {penalty,inflation,three_percent,legal_fees}, desired_output}.\n\n"
                    + "Question:\n{user_query}";
        }
    }
}
