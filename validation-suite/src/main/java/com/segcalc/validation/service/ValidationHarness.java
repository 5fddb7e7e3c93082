package com.segcalc.validation.service;

import com.segcalc.common.config.RunConfig;
import com.segcalc.common.model.CalculationResult;
import com.segcalc.common.model.CelestialObject;
import com.segcalc.common.model.Winner;
import com.segcalc.engine.service.ObjectCalculationService;
import com.segcalc.validation.check.CheckRecorder;
import com.segcalc.validation.check.GoldenRegressionChecks;
import com.segcalc.validation.check.ValidationCheckGroup;
import com.segcalc.validation.check.ValidationContext;
import com.segcalc.validation.golden.GoldenDataset;
import com.segcalc.validation.golden.GoldenDatasetException;
import com.segcalc.validation.golden.GoldenDatasetLoader;
import com.segcalc.validation.golden.GoldenRecord;
import com.segcalc.validation.model.ValidationOutcome;
import com.segcalc.validation.model.ValidationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs every {@link ValidationCheckGroup} and aggregates the outcomes.
 *
 * <p>The golden dataset is loaded and recomputed before any check runs; a
 * {@link GoldenDatasetException} aborts the run. Failing checks never do.
 */
@Service
public class ValidationHarness {

    private static final Logger log = LoggerFactory.getLogger(ValidationHarness.class);

    private final List<ValidationCheckGroup> groups;
    private final GoldenDatasetLoader goldenLoader;
    private final ObjectCalculationService calculator;
    private final RunConfig runConfig;

    public ValidationHarness(List<ValidationCheckGroup> groups, GoldenDatasetLoader goldenLoader,
                             ObjectCalculationService calculator, RunConfig runConfig) {
        this.groups = groups;
        this.goldenLoader = goldenLoader;
        this.calculator = calculator;
        this.runConfig = runConfig;
    }

    public ValidationSummary run() {
        return run(runConfig);
    }

    public ValidationSummary run(RunConfig config) {
        log.info("[Validation] Start. groups={} {}", groups.size(), config.summaryShort());

        GoldenDataset golden = goldenLoader.load();
        List<CalculationResult> goldenResults = calculator.calculateAll(toObjects(golden), config);
        ValidationContext context = new ValidationContext(config, calculator, golden, goldenResults);

        List<ValidationOutcome> outcomes = new ArrayList<>();
        for (ValidationCheckGroup group : groups) {
            CheckRecorder recorder = new CheckRecorder(group.category());
            try {
                group.run(context, recorder);
            } catch (RuntimeException e) {
                // a group that throws outside a check still reports what it recorded
                recorder.verify(group.category().label() + ".group_error", "no error", "exact", () -> {
                    throw e;
                });
            }
            List<ValidationOutcome> recorded = recorder.outcomes();
            long passed = recorded.stream().filter(ValidationOutcome::passed).count();
            log.info("[Validation] Category complete. category={} passed={}/{}",
                group.category().label(), passed, recorded.size());
            outcomes.addAll(recorded);
        }

        Map<Winner, Integer> distribution = GoldenRegressionChecks.winnerDistribution(goldenResults);
        ValidationSummary summary = ValidationSummary.of(config.runId(), outcomes, distribution);
        log.info("[Validation] Complete. runId={} total={} passed={} failed={} goldenWinners={}",
            summary.runId(), summary.total(), summary.passed(), summary.failed(), distribution);
        return summary;
    }

    private static List<CelestialObject> toObjects(GoldenDataset golden) {
        List<CelestialObject> objects = new ArrayList<>(golden.size());
        for (GoldenRecord row : golden.rows()) {
            try {
                objects.add(row.toCelestialObject());
            } catch (RuntimeException e) {
                throw new GoldenDatasetException(golden.source(),
                    "row " + row.getName() + " is not a valid object: " + e.getMessage(), e);
            }
        }
        return objects;
    }
}
