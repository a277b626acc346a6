package com.lexassist.planner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Monetary claims mentioned in a question. A flag is non-null only when asserted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MoneyTerms(
        Boolean penalty,
        Boolean inflation,
        @JsonProperty("three_percent") Boolean threePercent,
        @JsonProperty("legal_fees") Boolean legalFees
) {
    public static final MoneyTerms NONE = new MoneyTerms(null, null, null, null);

    public boolean isEmpty() {
        return !Boolean.TRUE.equals(penalty)
                && !Boolean.TRUE.equals(inflation)
                && !Boolean.TRUE.equals(threePercent)
                && !Boolean.TRUE.equals(legalFees);
    }

    public MoneyTerms withPenalty() {
        return new MoneyTerms(true, inflation, threePercent, legalFees);
    }

    public MoneyTerms withInflation() {
        return new MoneyTerms(penalty, true, threePercent, legalFees);
    }

    public MoneyTerms withThreePercent() {
        return new MoneyTerms(penalty, inflation, true, legalFees);
    }

    public MoneyTerms withLegalFees() {
        return new MoneyTerms(penalty, inflation, threePercent, true);
    }

    /**
     * Drops flags that are not asserted, so {@code false} and absent compare equal.
     */
    public MoneyTerms assertedOnly() {
        return new MoneyTerms(
                Boolean.TRUE.equals(penalty) ? Boolean.TRUE : null,
                Boolean.TRUE.equals(inflation) ? Boolean.TRUE : null,
                Boolean.TRUE.equals(threePercent) ? Boolean.TRUE : null,
                Boolean.TRUE.equals(legalFees) ? Boolean.TRUE : null
        );
    }
}
