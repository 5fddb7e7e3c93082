package com.segcalc.engine.service;

import com.segcalc.common.config.RunConfig;
import com.segcalc.common.model.CalculationResult;
import com.segcalc.common.model.CelestialObject;
import com.segcalc.common.model.ResultStatus;
import com.segcalc.engine.calculator.ObjectCalculator;
import com.segcalc.engine.statistics.BatchStatistics;
import com.segcalc.engine.statistics.BatchSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * Object orchestrator: one result per input, in input order, never dropping a row.
 *
 * <p>Every method takes the {@link RunConfig} explicitly; the injected one is only
 * the default used by the single-argument overloads.
 */
@Service
public class ObjectCalculationService {

    private static final Logger log = LoggerFactory.getLogger(ObjectCalculationService.class);
    private final RunConfig defaultConfig;

    public ObjectCalculationService(RunConfig defaultConfig) {
        this.defaultConfig = defaultConfig;
    }

    public RunConfig defaultConfig() {
        return defaultConfig;
    }

    public CalculationResult calculate(CelestialObject object) {
        return calculate(object, defaultConfig);
    }

    public CalculationResult calculate(CelestialObject object, RunConfig config) {
        CalculationResult result = ObjectCalculator.calculate(object, config);
        if (result.status() == ResultStatus.DEGENERATE_GEOMETRY) {
            log.warn("[Orchestrator] Degenerate geometry. object={} reason={} runId={}",
                object.name(), result.diagnostic(), config.runId());
        } else {
            log.debug("[Orchestrator] object={} regime={} z_ssz={} z_grsr={} winner={}",
                object.name(), result.regime().label(), result.zSszTotal(), result.zGrSr(), result.winner());
        }
        return result;
    }

    /** Sequential batch. */
    public List<CalculationResult> calculateAll(List<CelestialObject> objects, RunConfig config) {
        long started = System.nanoTime();
        log.info("[Orchestrator] Batch start. objects={} runId={}", objects.size(), config.runId());
        List<CalculationResult> results = new ArrayList<>(objects.size());
        for (CelestialObject object : objects) {
            results.add(calculateGuarded(object, config));
        }
        logBatchComplete(results, config, started);
        return results;
    }

    /**
     * Parallel batch on bounded-elastic workers. {@code flatMapSequential} keeps
     * the output order equal to the input order.
     */
    public Mono<List<CalculationResult>> calculateAllParallel(List<CelestialObject> objects, RunConfig config) {
        long started = System.nanoTime();
        log.info("[Orchestrator] Parallel batch start. objects={} runId={}", objects.size(), config.runId());
        return Flux.fromIterable(objects)
            .flatMapSequential(object -> Mono.fromCallable(() -> calculate(object, config))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.error("[Orchestrator] Object failed. object={} runId={}", object.name(), config.runId(), e);
                    return Mono.just(CalculationResult.failed(object, config.runId(), failureMessage(e)));
                }))
            .collectList()
            .doOnSuccess(results -> logBatchComplete(results, config, started));
    }

    public BatchSummary summarize(List<CalculationResult> results, RunConfig config) {
        BatchSummary summary = BatchStatistics.summarize(results, config);
        log.info("[Orchestrator] Summary. runId={} total={} observed={} ssz={} gr={} tie={} winRate={} p={}",
            summary.runId(), summary.total(), summary.observed(), summary.sszWins(), summary.grWins(),
            summary.ties(), summary.sszWinRate(), summary.binomialPValue());
        return summary;
    }

    private CalculationResult calculateGuarded(CelestialObject object, RunConfig config) {
        try {
            return calculate(object, config);
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Object failed. object={} runId={}", object.name(), config.runId(), e);
            return CalculationResult.failed(object, config.runId(), failureMessage(e));
        }
    }

    private static String failureMessage(Throwable e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private static void logBatchComplete(List<CalculationResult> results, RunConfig config, long started) {
        long failed = results.stream().filter(r -> r.status() == ResultStatus.FAILED).count();
        long degenerate = results.stream().filter(r -> r.status() == ResultStatus.DEGENERATE_GEOMETRY).count();
        log.info("[Orchestrator] Batch complete. runId={} objects={} failed={} degenerate={} elapsedMs={}",
            config.runId(), results.size(), failed, degenerate, (System.nanoTime() - started) / 1_000_000);
    }
}
