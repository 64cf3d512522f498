package com.ainp.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Agreed fractional allocation of settled credits.
 * A valid split has four non-negative fractions summing to 1.0 within {@link #TOLERANCE}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncentiveSplit(double agent, double broker, double validator, double pool) {

    public static final double TOLERANCE = 0.001;

    /**
     * 70% agent, 10% broker, 10% validator, 10% pool.
     */
    public static final IncentiveSplit DEFAULT = new IncentiveSplit(0.70, 0.10, 0.10, 0.10);

    public double total() {
        return agent + broker + validator + pool;
    }

    public boolean sumsToOne() {
        return Math.abs(total() - 1.0) <= TOLERANCE;
    }

    @JsonIgnore
    public boolean isValid() {
        return agent >= 0 && broker >= 0 && validator >= 0 && pool >= 0 && sumsToOne();
    }

    /**
     * Mean absolute difference of the four fractions.
     */
    public double meanAbsoluteDifference(IncentiveSplit other) {
        return (Math.abs(agent - other.agent)
                + Math.abs(broker - other.broker)
                + Math.abs(validator - other.validator)
                + Math.abs(pool - other.pool)) / 4.0;
    }
}
