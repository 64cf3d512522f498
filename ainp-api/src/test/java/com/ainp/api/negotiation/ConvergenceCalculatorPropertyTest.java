package com.ainp.api.negotiation;

import com.ainp.core.domain.IncentiveSplit;
import com.ainp.core.domain.NegotiationRound;
import com.ainp.core.domain.ProposalTerms;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.util.List;

/**
 * Property-based tests for proposal similarity.
 */
class ConvergenceCalculatorPropertyTest {

    private final ConvergenceCalculator calculator = new ConvergenceCalculator();

    @Property(tries = 200)
    void similarity_isWithinUnitRange(
            @ForAll("proposal") ProposalTerms a,
            @ForAll("proposal") ProposalTerms b) {

        double score = calculator.similarity(a, b);
        assert score >= 0.0 && score <= 1.0 : "Similarity out of range: " + score;
    }

    @Property(tries = 200)
    void similarity_isSymmetric(
            @ForAll("proposal") ProposalTerms a,
            @ForAll("proposal") ProposalTerms b) {

        assert Math.abs(calculator.similarity(a, b) - calculator.similarity(b, a)) < 1e-12;
    }

    @Property(tries = 100)
    void identicalProposals_scoreOne(@ForAll("proposal") ProposalTerms a) {
        Assume.that(a.qualitySla() != null
                || (a.price() != null && a.price() > 0)
                || (a.deliveryTime() != null && a.deliveryTime() > 0));

        assert calculator.similarity(a, a) == 1.0 : "Identical proposals should converge fully: " + a;
    }

    @Property(tries = 100)
    void relativeSimilarity_decreasesWithGap(
            @ForAll @DoubleRange(min = 1.0, max = 10_000.0) double base,
            @ForAll @DoubleRange(min = 0.0, max = 0.5) double smallGap,
            @ForAll @DoubleRange(min = 0.5, max = 1.0) double largeGap) {

        double near = ConvergenceCalculator.relativeSimilarity(base, base * (1 - smallGap));
        double far = ConvergenceCalculator.relativeSimilarity(base, base * (1 - largeGap));
        assert near >= far : "Closer prices must not score lower: " + near + " < " + far;
    }

    @Example
    void priceOnly_isRelativeToLargerValue() {
        double score = calculator.similarity(ProposalTerms.of(100.0, null, null), ProposalTerms.of(80.0, null, null));
        assert Math.abs(score - 0.8) < 1e-9;
    }

    @Example
    void zeroOnBothSides_isSkipped() {
        ProposalTerms a = ProposalTerms.of(0.0, 0.0, 0.5);
        ProposalTerms b = ProposalTerms.of(0.0, 0.0, 1.0);

        assert Math.abs(calculator.similarity(a, b) - 0.5) < 1e-9 : "Only quality should be compared";
        assert calculator.similarity(ProposalTerms.of(0.0, null, null), ProposalTerms.of(0.0, null, null)) == 0.0;
    }

    @Example
    void zeroAgainstPositive_isFullyApart() {
        double score = calculator.similarity(ProposalTerms.of(0.0, null, null), ProposalTerms.of(50.0, null, null));
        assert score == 0.0;
    }

    @Example
    void noSharedFields_scoreZero() {
        ProposalTerms priceOnly = ProposalTerms.of(100.0, null, null);
        ProposalTerms slaOnly = ProposalTerms.of(null, null, 0.9);

        assert calculator.similarity(priceOnly, slaOnly) == 0.0;
        assert calculator.similarity(priceOnly, null) == 0.0;
    }

    @Example
    void splitDistance_contributesAsOneField() {
        ProposalTerms a = new ProposalTerms(null, null, null, IncentiveSplit.DEFAULT, null);
        ProposalTerms b = new ProposalTerms(null, null, null, new IncentiveSplit(0.6, 0.2, 0.1, 0.1), null);

        // mean absolute difference (0.1 + 0.1) / 4
        assert Math.abs(calculator.similarity(a, b) - 0.95) < 1e-9;
    }

    @Example
    void sessionScore_comparesLastTwoRounds() {
        List<NegotiationRound> rounds = List.of(
                new NegotiationRound(1, "did:ainp:a", ProposalTerms.of(10.0, null, null), 0L, null),
                new NegotiationRound(2, "did:ainp:b", ProposalTerms.of(100.0, null, null), 1L, 0.1),
                new NegotiationRound(3, "did:ainp:a", ProposalTerms.of(90.0, null, null), 2L, 0.9));

        assert Math.abs(calculator.sessionScore(rounds) - 0.9) < 1e-9;
        assert calculator.sessionScore(rounds.subList(0, 1)) == 0.0;
    }

    @Provide
    Arbitrary<ProposalTerms> proposal() {
        Arbitrary<Double> price = Arbitraries.doubles().between(0.0, 100_000.0).injectNull(0.2);
        Arbitrary<Double> delivery = Arbitraries.doubles().between(0.0, 720.0).injectNull(0.2);
        Arbitrary<Double> sla = Arbitraries.doubles().between(0.0, 1.0).injectNull(0.2);
        return Combinators.combine(price, delivery, sla).as(ProposalTerms::of);
    }
}
