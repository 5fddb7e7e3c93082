package com.segcalc.validation.check;

import com.segcalc.common.config.RunConfig;
import com.segcalc.common.model.CalculationResult;
import com.segcalc.engine.service.ObjectCalculationService;
import com.segcalc.validation.golden.GoldenDataset;

import java.util.List;

/**
 * Everything a check group may read. Checks reach the engine only through
 * {@code calculator} and the public physics functions.
 *
 * @param goldenResults engine results for {@code golden}, row for row
 */
public record ValidationContext(
    RunConfig config,
    ObjectCalculationService calculator,
    GoldenDataset golden,
    List<CalculationResult> goldenResults
) {}
