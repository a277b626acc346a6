package com.lexassist.planner.service;

import com.lexassist.planner.model.QueryIntent;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps an intent to the ordered list of domain endpoints to query. The static table wins;
 * intents it does not know are routed by their own domains.
 */
@Component
public class DomainRouter {

    public static final String COURT = "court";
    public static final String NPA = "npa";
    public static final String ECHR = "echr";
    public static final String PARLIAMENT = "parliament";
    public static final String REGISTRY = "registry";

    private static final Set<String> KNOWN_ENDPOINTS = Set.of(COURT, NPA, ECHR, PARLIAMENT, REGISTRY);

    private static final Map<String, List<String>> INTENT_ENDPOINTS = buildIntentTable();

    public List<String> selectEndpoints(QueryIntent intent) {
        Optional<List<String>> mapped = endpointsFor(intent.intent());
        if (mapped.isPresent()) {
            return mapped.get();
        }

        LinkedHashSet<String> endpoints = new LinkedHashSet<>();
        for (String domain : intent.domains()) {
            if (domain == null) {
                continue;
            }
            String normalized = domain.trim().toLowerCase(Locale.ROOT);
            if (KNOWN_ENDPOINTS.contains(normalized)) {
                endpoints.add(normalized);
            }
        }
        return endpoints.isEmpty() ? List.of(COURT) : List.copyOf(endpoints);
    }

    public Optional<List<String>> endpointsFor(String intentName) {
        if (intentName == null) {
            return Optional.empty();
        }
        List<String> mapped = INTENT_ENDPOINTS.get(intentName);
        return mapped == null || mapped.isEmpty() ? Optional.empty() : Optional.of(mapped);
    }

    private static Map<String, List<String>> buildIntentTable() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("consumer_penalty_delay", List.of(COURT, NPA));
        table.put("tax_dispute", List.of(COURT, NPA));
        table.put("labor_dispute", List.of(COURT, ECHR));
        table.put("property_dispute", List.of(COURT));
        table.put("general_search", List.of(COURT, NPA, ECHR));

        table.put("supreme_court_position", List.of(COURT));
        table.put("procedural_deadlines", List.of(COURT, NPA));
        table.put("admissibility_and_formal_requirements", List.of(COURT, NPA));
        table.put("jurisdiction_and_competence", List.of(COURT, NPA));
        table.put("evidence_and_standards", List.of(COURT, NPA));
        table.put("interim_measures", List.of(COURT, NPA));
        table.put("amounts_and_costs", List.of(COURT, NPA));
        table.put("two_sided_practice", List.of(COURT));

        table.put("parliament_search", List.of(PARLIAMENT, NPA));
        table.put("registry_search", List.of(REGISTRY));
        return Map.copyOf(table);
    }
}
