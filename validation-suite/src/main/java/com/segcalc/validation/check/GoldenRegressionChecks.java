package com.segcalc.validation.check;

import com.segcalc.common.model.CalculationResult;
import com.segcalc.common.model.ResultStatus;
import com.segcalc.common.model.Winner;
import com.segcalc.validation.golden.GoldenDataset;
import com.segcalc.validation.golden.GoldenRecord;
import com.segcalc.validation.model.ValidationCategory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Diffs recomputed redshifts and winners against the golden catalogue.
 * Any change of the aggregate winner distribution is a hard regression.
 *
 * <p>Provenance of {@code golden/reference_catalogue.csv}: masses and radii are
 * catalogue-style values, but the {@code z_obs} column is synthetic and the
 * reference redshifts and winners were produced by this engine with the
 * canonical parameters. These checks therefore detect drift of the engine
 * against a frozen baseline; they are not an independent comparison with
 * measured redshifts.
 */
@Component
@Order(6)
public class GoldenRegressionChecks implements ValidationCheckGroup {

    static final double REDSHIFT_TOLERANCE = 1e-9;

    private final int expectedRows;
    private final int expectedSszWins;
    private final int expectedGrWins;
    private final int expectedTies;

    public GoldenRegressionChecks(
            @Value("${segcalc.validation.expected-rows:47}") int expectedRows,
            @Value("${segcalc.validation.expected-ssz-wins:46}") int expectedSszWins,
            @Value("${segcalc.validation.expected-gr-wins:1}") int expectedGrWins,
            @Value("${segcalc.validation.expected-ties:0}") int expectedTies) {
        this.expectedRows = expectedRows;
        this.expectedSszWins = expectedSszWins;
        this.expectedGrWins = expectedGrWins;
        this.expectedTies = expectedTies;
    }

    @Override
    public ValidationCategory category() {
        return ValidationCategory.GOLDEN_REGRESSION;
    }

    @Override
    public void run(ValidationContext context, CheckRecorder recorder) {
        GoldenDataset golden = context.golden();
        List<CalculationResult> results = context.goldenResults();

        recorder.equal("golden.row_count", expectedRows, golden::size);

        for (int i = 0; i < golden.size(); i++) {
            GoldenRecord row = golden.rows().get(i);
            CalculationResult result = i < results.size() ? results.get(i) : null;
            String id = "golden." + row.getName().toLowerCase(Locale.ROOT);

            recorder.relative(id + ".z_grsr", row.getGrSrReference(), REDSHIFT_TOLERANCE,
                () -> requireResult(result, row).zGrSr());
            recorder.relative(id + ".z_ssz", row.getSszReference(), REDSHIFT_TOLERANCE,
                () -> requireResult(result, row).zSszTotal());
            recorder.equal(id + ".winner", row.referenceWinner(),
                () -> requireResult(result, row).winner());
        }

        Map<Winner, Integer> expected = new EnumMap<>(Winner.class);
        expected.put(Winner.SSZ, expectedSszWins);
        expected.put(Winner.GR, expectedGrWins);
        expected.put(Winner.TIE, expectedTies);
        recorder.equal("golden.winner_distribution", expected, () -> winnerDistribution(results));
    }

    /** SSZ / GR / TIE counts over OK results that carry an observation, as in the batch summary. */
    public static Map<Winner, Integer> winnerDistribution(List<CalculationResult> results) {
        Map<Winner, Integer> counts = new EnumMap<>(Winner.class);
        for (Winner winner : Winner.values()) {
            counts.put(winner, 0);
        }
        for (CalculationResult result : results) {
            if (result.status() == ResultStatus.OK && result.winner() != null) {
                counts.merge(result.winner(), 1, Integer::sum);
            }
        }
        return counts;
    }

    private static CalculationResult requireResult(CalculationResult result, GoldenRecord row) {
        if (result == null || !row.getName().equals(result.name())) {
            throw new IllegalStateException("no engine result aligned with golden row " + row.getName());
        }
        return result;
    }
}
