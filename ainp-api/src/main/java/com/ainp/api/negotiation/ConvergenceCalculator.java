package com.ainp.api.negotiation;

import com.ainp.core.domain.IncentiveSplit;
import com.ainp.core.domain.NegotiationRound;
import com.ainp.core.domain.ProposalTerms;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Similarity of two proposals in [0, 1].
 *
 * Each field present in both proposals contributes one similarity; the score is their mean,
 * or 0 when the proposals share no comparable field. A price or delivery time that is zero
 * on both sides has no relative difference and is not compared.
 */
@Component
public class ConvergenceCalculator {

    public double similarity(ProposalTerms a, ProposalTerms b) {
        if (a == null || b == null) {
            return 0.0;
        }

        double sum = 0.0;
        int count = 0;

        if (comparable(a.price(), b.price())) {
            sum += relativeSimilarity(a.price(), b.price());
            count++;
        }
        if (comparable(a.deliveryTime(), b.deliveryTime())) {
            sum += relativeSimilarity(a.deliveryTime(), b.deliveryTime());
            count++;
        }
        if (a.qualitySla() != null && b.qualitySla() != null) {
            sum += clamp(1.0 - Math.abs(a.qualitySla() - b.qualitySla()));
            count++;
        }
        IncentiveSplit splitA = a.incentiveSplit();
        IncentiveSplit splitB = b.incentiveSplit();
        if (splitA != null && splitB != null) {
            sum += clamp(1.0 - splitA.meanAbsoluteDifference(splitB));
            count++;
        }

        return count == 0 ? 0.0 : sum / count;
    }

    /**
     * Similarity of the last two rounds; 0 with fewer than two.
     */
    public double sessionScore(List<NegotiationRound> rounds) {
        if (rounds.size() < 2) {
            return 0.0;
        }
        return similarity(
                rounds.get(rounds.size() - 2).proposal(),
                rounds.get(rounds.size() - 1).proposal());
    }

    private static boolean comparable(Double a, Double b) {
        return a != null && b != null && Math.max(a, b) > 0.0;
    }

    /**
     * 1 - |a - b| / max(a, b). Callers guarantee max(a, b) > 0.
     */
    static double relativeSimilarity(double a, double b) {
        return clamp(1.0 - Math.abs(a - b) / Math.max(a, b));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
