package com.example.podpairing.pairing;

import com.example.podpairing.model.Participant;
import com.example.podpairing.model.SelectorVariant;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Weighted random pick of the candidates least often seated with a table's members.
 *
 * Each draw scores every remaining candidate by summed pair counts, turns the score into a weight
 * of 2^-score (all 1 on a tie), multiplies in the undersized-table fairness boost and samples.
 * Weights are computed relative to the lowest score of the draw, which keeps the ratios and avoids
 * underflow on long histories.
 */
public final class MinimalRepeatSelector {

    private static final int MAX_FAIRNESS_DOUBLINGS = 5;   // caps the multiplier at 32
    private static final double BASIC_FAIRNESS_BOOST = 3.0;

    private final PairingHistory history;
    private final SelectorVariant variant;
    private final RandomSource random;

    public MinimalRepeatSelector(PairingHistory history, SelectorVariant variant, RandomSource random) {
        this.history = Objects.requireNonNull(history, "history");
        this.variant = (variant == null) ? SelectorVariant.PROGRESSIVE : variant;
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Picks up to {@code count} distinct candidates. The input lists are not modified.
     *
     * @param candidates pool to draw from
     * @param committed  participants already seated at the target table
     * @param count      seats to fill
     * @return the drawn participants in draw order; shorter than {@code count} when the pool runs dry
     */
    public List<Participant> select(List<Participant> candidates, Collection<Participant> committed, int count) {
        List<Participant> working = new ArrayList<>(new LinkedHashSet<>(candidates));
        if (committed != null) working.removeAll(committed);

        List<Participant> seated = (committed == null) ? new ArrayList<>() : new ArrayList<>(committed);
        List<Participant> chosen = new ArrayList<>();

        while (chosen.size() < count && !working.isEmpty()) {
            double[] weights = weights(working, seated);
            Participant pick = working.remove(draw(weights));
            chosen.add(pick);
            seated.add(pick);
        }
        return chosen;
    }

    /** Single-seat convenience used by the fill loop. */
    public Participant selectOne(List<Participant> candidates, Collection<Participant> committed) {
        List<Participant> one = select(candidates, committed, 1);
        return one.isEmpty() ? null : one.get(0);
    }

    // ---- scoring ---------------------------------------------------------------

    int score(Participant candidate, List<Participant> working, List<Participant> seated) {
        int score = 0;
        for (Participant m : seated) {
            score += history.pairCount(candidate.getId(), m.getId());
        }
        if (variant == SelectorVariant.PROGRESSIVE) {
            for (Participant other : working) {
                if (other != candidate) score += history.pairCount(candidate.getId(), other.getId());
            }
        }
        return score;
    }

    double fairness(Participant candidate) {
        if (variant == SelectorVariant.BASIC) {
            return history.wasUndersizedLastRound(candidate.getId()) ? BASIC_FAIRNESS_BOOST : 1.0;
        }
        int doublings = Math.min(history.undersizedCount(candidate.getId()), MAX_FAIRNESS_DOUBLINGS);
        return 1 << doublings;
    }

    double[] weights(List<Participant> working, List<Participant> seated) {
        int n = working.size();
        int[] scores = new int[n];
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int i = 0; i < n; i++) {
            scores[i] = score(working.get(i), working, seated);
            min = Math.min(min, scores[i]);
            max = Math.max(max, scores[i]);
        }

        double[] weights = new double[n];
        for (int i = 0; i < n; i++) {
            double base = (max == min) ? 1.0 : Math.pow(2.0, -(scores[i] - min));
            weights[i] = base * fairness(working.get(i));
        }
        return weights;
    }

    int draw(double[] weights) {
        double total = 0;
        for (double w : weights) total += w;

        double target = random.nextDouble() * total;
        double cumulative = 0;
        for (int i = 0; i < weights.length; i++) {
            cumulative += weights[i];
            if (target < cumulative) return i;
        }
        return weights.length - 1;
    }
}
