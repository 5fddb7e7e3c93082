package com.segcalc.validation.check;

import com.segcalc.common.config.RunConfig;
import com.segcalc.engine.service.ObjectCalculationService;
import com.segcalc.validation.model.ValidationCategory;
import com.segcalc.validation.model.ValidationOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentalChecksTest {

    private static List<ValidationOutcome> run() {
        RunConfig config = RunConfig.canonical();
        ValidationContext context = new ValidationContext(
            config, new ObjectCalculationService(config), null, List.of());
        CheckRecorder recorder = new CheckRecorder(ValidationCategory.EXPERIMENTAL);
        new ExperimentalChecks().run(context, recorder);
        return recorder.outcomes();
    }

    @Test
    @DisplayName("solar-system PPN tests are recorded and pass")
    void solarSystemTests() {
        List<ValidationOutcome> ppn = run().stream()
            .filter(o -> o.testId().startsWith("exp.ppn."))
            .toList();

        assertEquals(List.of(
                "exp.ppn.solar_deflection_arcsec",
                "exp.ppn.mercury_perihelion_arcsec_per_century",
                "exp.ppn.shapiro_grazing_sun_us",
                "exp.ppn.cassini_gamma"),
            ppn.stream().map(ValidationOutcome::testId).toList());
        assertTrue(ppn.stream().allMatch(ValidationOutcome::passed),
            () -> ppn.stream().filter(o -> !o.passed()).map(ValidationOutcome::toString).toList().toString());
    }

    @Test
    @DisplayName("every experimental check passes with the canonical configuration")
    void allPass() {
        List<ValidationOutcome> outcomes = run();
        assertFalse(outcomes.isEmpty());
        assertTrue(outcomes.stream().allMatch(o -> o.category() == ValidationCategory.EXPERIMENTAL));
        assertEquals(List.of(), outcomes.stream().filter(o -> !o.passed()).map(ValidationOutcome::testId).toList());
    }
}
