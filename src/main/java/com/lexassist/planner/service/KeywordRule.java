package com.lexassist.planner.service;

import com.lexassist.planner.model.SectionType;

import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * One entry of the heuristic priority list: when {@code matcher} accepts the lower-cased
 * query, the query is classified as {@code intent}.
 *
 * @param sections empty means "keep the default sections"
 */
public record KeywordRule(String intent,
                          Predicate<String> matcher,
                          List<String> domains,
                          List<SectionType> sections) {

    public KeywordRule {
        domains = List.copyOf(domains);
        sections = List.copyOf(sections);
    }

    public boolean matches(String lowerQuery) {
        return matcher.test(lowerQuery);
    }

    static Predicate<String> anyOf(String... markers) {
        List<String> values = Arrays.asList(markers);
        return query -> SlotNormalizer.containsAny(query, values);
    }

    static Predicate<String> allOf(String... markers) {
        List<String> values = Arrays.asList(markers);
        return query -> values.stream().allMatch(query::contains);
    }

    /**
     * Matches a standalone token, for short abbreviations that occur inside longer words.
     */
    static Predicate<String> word(String token) {
        Pattern pattern = Pattern.compile("(?<!\\p{L})" + Pattern.quote(token) + "(?!\\p{L})");
        return query -> pattern.matcher(query).find();
    }
}
