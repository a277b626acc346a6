package com.lexassist.planner.service;

import com.lexassist.planner.model.CourtLevel;
import com.lexassist.planner.model.SectionType;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Canonicalizes free-form slot strings into the closed vocabularies, or drops them.
 */
public final class SlotNormalizer {

    private static final List<String> GRAND_CHAMBER_MARKERS = List.of(
            "grandchamber", "grand chamber", "велика палата", "великої палати", "великій палаті",
            "велику палату", "большая палата", "большой палаты", "вп вс");
    private static final Set<String> GRAND_CHAMBER_TOKENS = Set.of("вп", "гп");

    private static final List<String> SUPREME_COURT_MARKERS = List.of(
            "supreme", "верховн", "cassation court", "cassation chamber",
            "касаційний цивільний суд", "касаційний господарський суд",
            "касаційний адміністративний суд", "касаційний кримінальний суд",
            "касаційного цивільного суду", "касаційного господарського суду",
            "касаційного адміністративного суду", "касаційного кримінального суду");
    private static final Set<String> SUPREME_COURT_TOKENS = Set.of("sc", "вс", "кцс", "кгс", "кас вс", "ккс");

    private static final List<String> CASSATION_MARKERS = List.of("cassation", "касаці", "кассаци");
    private static final List<String> APPEAL_MARKERS = List.of("appeal", "appellate", "апеляці", "апелляци");
    private static final List<String> FIRST_INSTANCE_MARKERS = List.of(
            "first instance", "першої інстанції", "перша інстанція", "першій інстанції",
            "первой инстанции", "первая инстанция", "місцевий суд", "місцевого суду");

    private SlotNormalizer() {
    }

    /**
     * Case-insensitive exact match of the section name; {@code law references} and
     * {@code law-references} are accepted as {@code LAW_REFERENCES}.
     */
    public static Optional<SectionType> normalizeSection(String raw) {
        if (!StringUtils.hasText(raw)) {
            return Optional.empty();
        }
        String candidate = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (SectionType type : SectionType.values()) {
            if (type.name().equals(candidate)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Normalizes every element, drops the unrecognized ones and keeps first-seen order
     * without duplicates. May return an empty list.
     */
    public static List<SectionType> normalizeSections(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        LinkedHashSet<SectionType> result = new LinkedHashSet<>();
        for (String value : raw) {
            normalizeSection(value).ifPresent(result::add);
        }
        return List.copyOf(new ArrayList<>(result));
    }

    /**
     * Resolves a court-level surface form. Checked in order: Grand Chamber, Supreme Court
     * (including its cassation chambers), cassation, appeal, first instance.
     */
    public static Optional<CourtLevel> normalizeCourtLevel(String raw) {
        if (!StringUtils.hasText(raw)) {
            return Optional.empty();
        }
        Optional<CourtLevel> canonical = CourtLevel.fromValue(raw.trim());
        if (canonical.isPresent()) {
            return canonical;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT).replace('_', ' ').replaceAll("\\s+", " ");

        if (GRAND_CHAMBER_TOKENS.contains(value) || containsAny(value, GRAND_CHAMBER_MARKERS)) {
            return Optional.of(CourtLevel.GRAND_CHAMBER);
        }
        if (SUPREME_COURT_TOKENS.contains(value) || containsAny(value, SUPREME_COURT_MARKERS)) {
            return Optional.of(CourtLevel.SUPREME_COURT);
        }
        if (containsAny(value, CASSATION_MARKERS)) {
            return Optional.of(CourtLevel.CASSATION);
        }
        if (containsAny(value, APPEAL_MARKERS)) {
            return Optional.of(CourtLevel.APPEAL);
        }
        if (containsAny(value, FIRST_INSTANCE_MARKERS)) {
            return Optional.of(CourtLevel.FIRST_INSTANCE);
        }
        return Optional.empty();
    }

    /**
     * Trimmed text, or null when blank.
     */
    public static String normalizeText(String raw) {
        return StringUtils.hasText(raw) ? raw.trim() : null;
    }

    static boolean containsAny(String haystack, Collection<String> needles) {
        for (String needle : needles) {
            if (haystack.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
