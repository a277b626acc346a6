package com.lexassist.planner.service;

import com.lexassist.planner.model.CourtLevel;
import com.lexassist.planner.model.DesiredOutput;
import com.lexassist.planner.model.MoneyTerms;
import com.lexassist.planner.model.ProcedureCode;
import com.lexassist.planner.model.QueryIntent;
import com.lexassist.planner.model.RawIntent;
import com.lexassist.planner.model.RawSlots;
import com.lexassist.planner.model.ReasoningBudget;
import com.lexassist.planner.model.SectionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

import static com.lexassist.planner.model.SectionType.AMOUNTS;
import static com.lexassist.planner.model.SectionType.COURT_REASONING;
import static com.lexassist.planner.model.SectionType.DECISION;
import static com.lexassist.planner.model.SectionType.FACTS;
import static com.lexassist.planner.model.SectionType.LAW_REFERENCES;
import static com.lexassist.planner.service.KeywordRule.allOf;
import static com.lexassist.planner.service.KeywordRule.anyOf;
import static com.lexassist.planner.service.KeywordRule.word;

/**
 * Deterministic keyword classifier. Never fails and never leaves the process, which makes it
 * both the {@code quick} path and the fallback of the model-assisted path.
 */
@Service
public class HeuristicClassifier {

    private static final Logger logger = LoggerFactory.getLogger(HeuristicClassifier.class);

    public static final double HEURISTIC_CONFIDENCE = 0.6;

    private static final Predicate<String> LEGAL_FEES = allOf("судов", "витрат");

    /**
     * First match wins; the order is part of the contract.
     */
    static final List<KeywordRule> RULES = List.of(
            new KeywordRule("supreme_court_position",
                    anyOf("позиці", "позиция", "правов", "правовой")
                            .or(word("вс").and(anyOf("виснов")))
                            .or(allOf("верховн", "суд")),
                    List.of("court"), List.of(COURT_REASONING)),
            new KeywordRule("procedural_deadlines",
                    anyOf("строк", "поновлен", "пропуск"),
                    List.of("court", "npa"), List.of(COURT_REASONING, DECISION, LAW_REFERENCES)),
            new KeywordRule("admissibility_and_formal_requirements",
                    anyOf("без рух", "повернен", "без розгляд", "закритт"),
                    List.of("court", "npa"), List.of(COURT_REASONING, DECISION, LAW_REFERENCES)),
            new KeywordRule("jurisdiction_and_competence",
                    anyOf("підсудн", "юрисдикц", "підвідомч"),
                    List.of("court", "npa"), List.of(COURT_REASONING, LAW_REFERENCES)),
            new KeywordRule("evidence_and_standards",
                    anyOf("доказ", "належн", "допустим", "тягар доказ", "експертиз", "електронн"),
                    List.of("court", "npa"), List.of(FACTS, COURT_REASONING)),
            new KeywordRule("interim_measures",
                    anyOf("забезпечен").and(anyOf("позов", "доказ")),
                    List.of("court", "npa"), List.of(COURT_REASONING, LAW_REFERENCES)),
            new KeywordRule("amounts_and_costs",
                    anyOf("пеня", "інфляц", "3%").or(LEGAL_FEES),
                    List.of("court", "npa"), List.of(AMOUNTS, COURT_REASONING)),
            new KeywordRule("two_sided_practice",
                    anyOf("за/проти", "дві ліні", "две лини", "неоднорід"),
                    List.of("court"), List.of(COURT_REASONING, DECISION)),
            new KeywordRule("parliament_search",
                    anyOf("депутат", "верховна рада", "верховної ради", "верховній раді", "законопроект",
                            "законопроєкт", "фракці", "пленарн", "голосуван"),
                    List.of("parliament", "npa"), List.of(LAW_REFERENCES)),
            new KeywordRule("registry_search",
                    anyOf("єдрпоу", "едрпоу", "бенефіціар", "бенефициар", "засновник", "реєстр юридичних")
                            .or(word("фоп")),
                    List.of("registry"), List.of(FACTS)),
            new KeywordRule("consumer_penalty_delay",
                    anyOf("споживач", "затримка", "доставка"),
                    List.of("court", "npa"), List.of()),
            new KeywordRule("tax_dispute",
                    anyOf("податк", "налог"),
                    List.of("court", "npa"), List.of()),
            new KeywordRule("labor_dispute",
                    anyOf("прац", "трудов"),
                    List.of("court", "echr"), List.of())
    );

    /**
     * Highest tier first.
     */
    private static final Map<CourtLevel, Predicate<String>> COURT_LEVEL_MARKERS = orderedCourtLevels();

    private final IntentSanitizer sanitizer;

    public HeuristicClassifier(IntentSanitizer sanitizer) {
        this.sanitizer = sanitizer;
    }

    public List<KeywordRule> rules() {
        return RULES;
    }

    public QueryIntent classifyQuick(String query) {
        String lowerQuery = query == null ? "" : query.toLowerCase(Locale.ROOT);

        RawIntent.RawIntentBuilder builder = RawIntent.builder()
                .intent(IntentSanitizer.DEFAULT_INTENT)
                .confidence(HEURISTIC_CONFIDENCE)
                .domains(List.of(IntentSanitizer.DEFAULT_DOMAIN))
                .requiredEntities(List.of())
                .sections(names(SectionType.DEFAULT_SECTIONS))
                .reasoningBudget(ReasoningBudget.QUICK.getValue())
                .slots(extractSlots(lowerQuery));

        for (KeywordRule rule : RULES) {
            if (rule.matches(lowerQuery)) {
                builder.intent(rule.intent()).domains(rule.domains());
                if (!rule.sections().isEmpty()) {
                    builder.sections(names(rule.sections()));
                }
                break;
            }
        }

        QueryIntent intent = sanitizer.sanitize(builder.build(), ReasoningBudget.QUICK);
        logger.debug("Heuristic classification: intent={}, domains={}, slots={}",
                intent.intent(), intent.domains(), intent.slots());
        return intent;
    }

    RawSlots extractSlots(String lowerQuery) {
        RawSlots slots = new RawSlots();

        for (ProcedureCode code : List.of(ProcedureCode.CIVIL, ProcedureCode.COMMERCIAL,
                ProcedureCode.ADMINISTRATIVE, ProcedureCode.CRIMINAL)) {
            if (word(code.getLabel().toLowerCase(Locale.ROOT)).test(lowerQuery)) {
                slots.setProcedureCode(code.getLabel());
            }
        }

        if (anyOf("теза", "тезу", "тези").test(lowerQuery)) {
            slots.setDesiredOutput(DesiredOutput.THESIS.getLabel());
        }
        if (anyOf("чеклист", "чек-лист").test(lowerQuery)) {
            slots.setDesiredOutput(DesiredOutput.CHECKLIST.getLabel());
        }
        if (lowerQuery.contains("таблиц")) {
            slots.setDesiredOutput(DesiredOutput.TABLE.getLabel());
        }
        if (lowerQuery.contains("порівня")) {
            slots.setDesiredOutput(DesiredOutput.COMPARISON.getLabel());
        }
        if (lowerQuery.contains("підбірк")) {
            slots.setDesiredOutput(DesiredOutput.COLLECTION.getLabel());
        }

        MoneyTerms money = MoneyTerms.NONE;
        if (anyOf("пеня", "штраф").test(lowerQuery)) {
            money = money.withPenalty();
        }
        if (lowerQuery.contains("інфляц")) {
            money = money.withInflation();
        }
        if (anyOf("3%", "три відсотк", "три проц").test(lowerQuery)) {
            money = money.withThreePercent();
        }
        if (LEGAL_FEES.test(lowerQuery)) {
            money = money.withLegalFees();
        }
        if (!money.isEmpty()) {
            slots.setMoneyTerms(money);
        }

        for (Map.Entry<CourtLevel, Predicate<String>> entry : COURT_LEVEL_MARKERS.entrySet()) {
            if (entry.getValue().test(lowerQuery)) {
                slots.setCourtLevel(entry.getKey().getValue());
                break;
            }
        }
        return slots;
    }

    private static List<String> names(List<SectionType> sections) {
        return sections.stream().map(Enum::name).toList();
    }

    private static Map<CourtLevel, Predicate<String>> orderedCourtLevels() {
        Map<CourtLevel, Predicate<String>> markers = new LinkedHashMap<>();
        markers.put(CourtLevel.GRAND_CHAMBER, anyOf("велика палата", "великої палати", "великій палаті",
                "велику палату", "большой палаты", "большая палата", "вп вс"));
        markers.put(CourtLevel.SUPREME_COURT, allOf("верховн", "суд")
                .or(word("вс")).or(word("кцс")).or(word("кгс")).or(word("ккс"))
                .or(anyOf("кас вс", "касаційного цивільного суду", "касаційного господарського суду",
                        "касаційного адміністративного суду", "касаційного кримінального суду")));
        markers.put(CourtLevel.CASSATION, anyOf("касаці", "кассаци"));
        markers.put(CourtLevel.APPEAL, anyOf("апеляці", "апелляци"));
        markers.put(CourtLevel.FIRST_INSTANCE, anyOf("першої інстанції", "перша інстанція", "першій інстанції",
                "первой инстанции", "первая инстанция", "місцевого суду", "місцевий суд"));
        return Collections.unmodifiableMap(markers);
    }
}
