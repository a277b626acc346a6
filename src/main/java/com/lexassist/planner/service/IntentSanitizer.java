package com.lexassist.planner.service;

import com.lexassist.planner.model.CourtLevel;
import com.lexassist.planner.model.IntentSlots;
import com.lexassist.planner.model.MoneyTerms;
import com.lexassist.planner.model.QueryIntent;
import com.lexassist.planner.model.RawIntent;
import com.lexassist.planner.model.RawSlots;
import com.lexassist.planner.model.ReasoningBudget;
import com.lexassist.planner.model.SectionType;
import com.lexassist.planner.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Single point where classifier output is coerced into a well-formed {@link QueryIntent}.
 * Invalid values are dropped or replaced by defaults, never rejected.
 */
@Component
public class IntentSanitizer {

    private static final Logger logger = LoggerFactory.getLogger(IntentSanitizer.class);

    public static final String DEFAULT_INTENT = "general_search";
    public static final String DEFAULT_DOMAIN = "court";
    public static final double DEFAULT_CONFIDENCE = 0.7;

    public QueryIntent sanitize(QueryIntent intent) {
        if (intent == null) {
            return sanitize((RawIntent) null);
        }
        return sanitize(intent.toRaw(), intent.reasoningBudget());
    }

    public QueryIntent sanitize(RawIntent raw) {
        return sanitize(raw, ReasoningBudget.STANDARD);
    }

    /**
     * @param raw            classifier output, possibly null or partially filled
     * @param fallbackBudget used when the raw budget is missing or not a known tier
     */
    public QueryIntent sanitize(RawIntent raw, ReasoningBudget fallbackBudget) {
        RawIntent source = raw != null ? raw : new RawIntent();

        List<SectionType> sections = SlotNormalizer.normalizeSections(source.getSections());
        if (sections.isEmpty()) {
            if (source.getSections() != null && !source.getSections().isEmpty()) {
                logger.debug("No recognized section in {}; using defaults", source.getSections());
            }
            sections = SectionType.DEFAULT_SECTIONS;
        }

        return new QueryIntent(
                StringUtils.hasText(source.getIntent()) ? source.getIntent().trim() : DEFAULT_INTENT,
                sanitizeConfidence(source.getConfidence()),
                sanitizeDomains(source.getDomains()),
                sanitizeEntities(source.getRequiredEntities()),
                sections,
                sanitizeTimeRange(source.getTimeRange()),
                sanitizeBudget(source.getReasoningBudget(), fallbackBudget),
                sanitizeSlots(source.getSlots())
        );
    }

    IntentSlots sanitizeSlots(RawSlots raw) {
        if (raw == null) {
            return null;
        }
        List<SectionType> focus = SlotNormalizer.normalizeSections(raw.getSectionFocus());
        CourtLevel courtLevel = SlotNormalizer.normalizeCourtLevel(raw.getCourtLevel()).orElse(null);
        if (courtLevel == null && StringUtils.hasText(raw.getCourtLevel())) {
            logger.debug("Dropping unrecognized court level '{}'", raw.getCourtLevel());
        }
        MoneyTerms moneyTerms = raw.getMoneyTerms() != null ? raw.getMoneyTerms().assertedOnly() : null;

        IntentSlots slots = new IntentSlots(
                SlotNormalizer.normalizeText(raw.getProcedureCode()),
                courtLevel,
                SlotNormalizer.normalizeText(raw.getCaseCategory()),
                SlotNormalizer.normalizeText(raw.getLawArticle()),
                focus.isEmpty() ? null : focus,
                moneyTerms == null || moneyTerms.isEmpty() ? null : moneyTerms,
                SlotNormalizer.normalizeText(raw.getDesiredOutput())
        );
        return slots.isEmpty() ? null : slots;
    }

    /**
     * Both bounds are required; a one-sided or blank window is dropped.
     */
    TimeRange sanitizeTimeRange(TimeRange range) {
        if (range == null) {
            return null;
        }
        if (!StringUtils.hasText(range.from()) || !StringUtils.hasText(range.to())) {
            logger.debug("Dropping incomplete time range {}", range);
            return null;
        }
        return new TimeRange(range.from().trim(), range.to().trim());
    }

    private double sanitizeConfidence(Double confidence) {
        if (confidence == null || confidence.isNaN()) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private List<String> sanitizeDomains(List<String> domains) {
        LinkedHashSet<String> result = new LinkedHashSet<>();
        if (domains != null) {
            for (String domain : domains) {
                if (StringUtils.hasText(domain)) {
                    result.add(domain.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        if (result.isEmpty()) {
            return List.of(DEFAULT_DOMAIN);
        }
        return List.copyOf(new ArrayList<>(result));
    }

    private List<String> sanitizeEntities(List<String> entities) {
        if (entities == null) {
            return List.of();
        }
        return entities.stream()
                .filter(StringUtils::hasText)
                .map(String::trim)
                .toList();
    }

    private ReasoningBudget sanitizeBudget(String value, ReasoningBudget fallback) {
        if (StringUtils.hasText(value)) {
            try {
                return ReasoningBudget.fromValue(value);
            } catch (IllegalArgumentException ex) {
                logger.debug("Model returned unknown reasoning budget '{}', keeping {}", value, fallback);
            }
        }
        return fallback != null ? fallback : ReasoningBudget.STANDARD;
    }
}
