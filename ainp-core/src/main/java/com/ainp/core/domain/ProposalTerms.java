package com.ainp.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terms offered in one negotiation round.
 * Typed core fields are nullable (absent terms are not compared);
 * {@code customTerms} carries open-ended metadata such as reserved credits or rejection reasons.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProposalTerms(
        @JsonProperty("price") Double price,
        @JsonProperty("delivery_time") Double deliveryTime,
        @JsonProperty("quality_sla") Double qualitySla,
        @JsonProperty("incentive_split") IncentiveSplit incentiveSplit,
        @JsonProperty("custom_terms") Map<String, Object> customTerms
) {

    public static final String RESERVED_CREDITS = "reserved_credits";
    public static final String SETTLED_CREDITS = "settled_credits";
    public static final String REJECTED = "rejected";
    public static final String REASON = "reason";

    public ProposalTerms {
        customTerms = customTerms == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(customTerms));
    }

    public static ProposalTerms of(Double price, Double deliveryTime, Double qualitySla) {
        return new ProposalTerms(price, deliveryTime, qualitySla, null, null);
    }

    public static ProposalTerms rejection(String reason) {
        Map<String, Object> terms = new LinkedHashMap<>();
        terms.put(REJECTED, true);
        if (reason != null) {
            terms.put(REASON, reason);
        }
        return new ProposalTerms(null, null, null, null, terms);
    }

    /**
     * Copy with one custom term added or replaced.
     */
    public ProposalTerms withCustomTerm(String key, Object value) {
        Map<String, Object> terms = new LinkedHashMap<>(customTerms);
        terms.put(key, value);
        return new ProposalTerms(price, deliveryTime, qualitySla, incentiveSplit, terms);
    }

    public ProposalTerms withoutCustomTerm(String key) {
        Map<String, Object> terms = new LinkedHashMap<>(customTerms);
        terms.remove(key);
        return new ProposalTerms(price, deliveryTime, qualitySla, incentiveSplit, terms);
    }

    /**
     * Reads a numeric custom term written either as a number or as a decimal string.
     * Returns 0 when the term is absent or unparseable.
     */
    public long customTermAsLong(String key) {
        Object value = customTerms.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return 0L;
            }
        }
        return 0L;
    }

    @JsonIgnore
    public long reservedCredits() {
        return customTermAsLong(RESERVED_CREDITS);
    }
}
