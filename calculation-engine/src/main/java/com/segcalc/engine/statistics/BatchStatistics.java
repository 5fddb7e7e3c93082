package com.segcalc.engine.statistics;

import com.segcalc.common.config.RunConfig;
import com.segcalc.common.model.CalculationResult;
import com.segcalc.common.model.ObservationComparison;
import com.segcalc.common.model.Regime;
import com.segcalc.common.model.ResultStatus;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;

/**
 * Batch aggregation, exact binomial significance and seeded bootstrap intervals.
 *
 * <p>Deterministic for a given input and seed. No logging. No side-effects.
 */
public final class BatchStatistics {

    public static final double CI_LEVEL = 0.95;

    private BatchStatistics() {}

    public static BatchSummary summarize(List<CalculationResult> results, RunConfig config) {
        int ok = 0;
        int degenerate = 0;
        int failed = 0;
        int sszWins = 0;
        int grWins = 0;
        int ties = 0;
        List<Double> residualsSsz = new ArrayList<>();
        List<Double> residualsGr = new ArrayList<>();
        Map<Regime, int[]> perRegime = new EnumMap<>(Regime.class);   // {count, observed, sszWins}

        for (CalculationResult result : results) {
            switch (result.status()) {
                case OK -> ok++;
                case DEGENERATE_GEOMETRY -> degenerate++;
                case FAILED -> failed++;
            }

            int[] slot = result.regime() == null
                ? null
                : perRegime.computeIfAbsent(result.regime(), r -> new int[3]);
            if (slot != null) {
                slot[0]++;
            }

            // degenerate rows keep their comparison but stay out of the tallies
            ObservationComparison comparison = result.comparison();
            if (comparison == null || result.status() != ResultStatus.OK) {
                continue;
            }
            if (slot != null) {
                slot[1]++;
            }
            switch (comparison.winner()) {
                case SSZ -> {
                    sszWins++;
                    if (slot != null) {
                        slot[2]++;
                    }
                }
                case GR -> grWins++;
                case TIE -> ties++;
            }
            if (Double.isFinite(comparison.residualSsz())) {
                residualsSsz.add(comparison.residualSsz());
            }
            if (Double.isFinite(comparison.residualGr())) {
                residualsGr.add(comparison.residualGr());
            }
        }

        int observed = sszWins + grWins + ties;
        Map<Regime, RegimeStats> regimes = new EnumMap<>(Regime.class);
        perRegime.forEach((regime, c) -> regimes.put(regime,
            new RegimeStats(c[0], c[1], c[2], c[1] == 0 ? Double.NaN : (double) c[2] / c[1])));

        double[] ssz = toArray(residualsSsz);
        double[] gr = toArray(residualsGr);

        return new BatchSummary(
            config.runId(),
            results.size(),
            ok,
            degenerate,
            failed,
            observed,
            sszWins,
            grWins,
            ties,
            observed == 0 ? Double.NaN : (double) sszWins / observed,
            binomialTwoSidedPValue(sszWins, sszWins + grWins, 0.5),
            mean(ssz),
            sampleStd(ssz),
            meanAbs(ssz),
            mean(gr),
            sampleStd(gr),
            meanAbs(gr),
            regimes,
            bootstrapMedianCi(abs(ssz), config.bootstrapRounds(), config.bootstrapSeed()));
    }

    // ── significance ──────────────────────────────────────────────────────

    /**
     * Exact two-sided binomial test: the probability of an outcome no more likely
     * than {@code k} successes in {@code n} trials. Summed in log space.
     *
     * @return NaN when {@code n == 0}
     */
    public static double binomialTwoSidedPValue(int k, int n, double p) {
        if (n == 0) {
            return Double.NaN;
        }
        if (k < 0 || k > n) {
            throw new IllegalArgumentException("k must lie in [0, n], got k=" + k + " n=" + n);
        }
        if (!(p > 0.0 && p < 1.0)) {
            throw new IllegalArgumentException("p must lie in (0, 1), got " + p);
        }

        double[] logFactorial = new double[n + 1];
        for (int i = 1; i <= n; i++) {
            logFactorial[i] = logFactorial[i - 1] + Math.log(i);
        }
        double logP = Math.log(p);
        double logQ = Math.log1p(-p);
        double logPk = logPmf(k, n, logFactorial, logP, logQ);

        // relative slack so outcomes equal to k up to rounding are counted
        double threshold = logPk + 1e-7 * Math.max(1.0, Math.abs(logPk));
        double logSum = Double.NEGATIVE_INFINITY;
        for (int i = 0; i <= n; i++) {
            double li = logPmf(i, n, logFactorial, logP, logQ);
            if (li <= threshold) {
                logSum = logSum == Double.NEGATIVE_INFINITY
                    ? li
                    : Math.max(logSum, li) + Math.log1p(Math.exp(-Math.abs(logSum - li)));
            }
        }
        return Math.max(0.0, Math.min(1.0, Math.exp(logSum)));
    }

    private static double logPmf(int k, int n, double[] logFactorial, double logP, double logQ) {
        return logFactorial[n] - logFactorial[k] - logFactorial[n - k] + k * logP + (n - k) * logQ;
    }

    // ── bootstrap ─────────────────────────────────────────────────────────

    /**
     * Percentile bootstrap of the median at {@link #CI_LEVEL}. NaN entries are ignored.
     *
     * @return null when there is no finite data or {@code rounds ≤ 0}
     */
    public static ConfidenceInterval bootstrapMedianCi(double[] data, int rounds, long seed) {
        double[] finite = Arrays.stream(data).filter(Double::isFinite).toArray();
        if (finite.length == 0 || rounds <= 0) {
            return null;
        }
        SplittableRandom random = new SplittableRandom(seed);
        int n = finite.length;
        double[] sample = new double[n];
        double[] medians = new double[rounds];
        for (int b = 0; b < rounds; b++) {
            for (int i = 0; i < n; i++) {
                sample[i] = finite[random.nextInt(n)];
            }
            Arrays.sort(sample);
            medians[b] = quantile(sample, 0.5);
        }
        Arrays.sort(medians);
        double alpha = (1.0 - CI_LEVEL) / 2.0;
        double[] sorted = finite.clone();
        Arrays.sort(sorted);
        return new ConfidenceInterval(
            quantile(sorted, 0.5),
            quantile(medians, alpha),
            quantile(medians, 1.0 - alpha),
            CI_LEVEL,
            rounds,
            seed);
    }

    /** Linear-interpolation quantile of an ascending array. */
    public static double quantile(double[] sorted, double q) {
        if (sorted.length == 0) {
            return Double.NaN;
        }
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    // ── moments ───────────────────────────────────────────────────────────

    public static double mean(double[] values) {
        return values.length == 0 ? Double.NaN : Arrays.stream(values).average().orElse(Double.NaN);
    }

    /** Sample standard deviation (n − 1); 0 for a single value, NaN for none. */
    public static double sampleStd(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        if (values.length == 1) {
            return 0.0;
        }
        double m = mean(values);
        double sumSq = 0.0;
        for (double v : values) {
            sumSq += (v - m) * (v - m);
        }
        return Math.sqrt(sumSq / (values.length - 1));
    }

    public static double meanAbs(double[] values) {
        return mean(abs(values));
    }

    private static double[] abs(double[] values) {
        return Arrays.stream(values).map(Math::abs).toArray();
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
