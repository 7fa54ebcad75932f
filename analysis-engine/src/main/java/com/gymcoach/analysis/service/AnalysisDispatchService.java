package com.gymcoach.analysis.service;

import com.gymcoach.analysis.dto.AdaptationRequest;
import com.gymcoach.analysis.dto.AnalysisReport;
import com.gymcoach.analysis.dto.AnalysisRequest;
import com.gymcoach.analysis.logger.AnalysisFlowLogger;
import com.gymcoach.analysis.trace.TraceContextUtil;
import com.gymcoach.common.adaptation.AdaptationSelector;
import com.gymcoach.common.adaptation.AdaptationStrategy;
import com.gymcoach.common.anomaly.AnomalyDetector;
import com.gymcoach.common.anomaly.AnomalyReport;
import com.gymcoach.common.exception.AnalysisException;
import com.gymcoach.common.history.TrainingHistory;
import com.gymcoach.common.model.GoalDirection;
import com.gymcoach.common.model.UserProfile;
import com.gymcoach.common.model.WorkoutPlan;
import com.gymcoach.common.monitor.ProgressMonitor;
import com.gymcoach.common.monitor.ProgressReport;
import com.gymcoach.common.plateau.PlateauDetector;
import com.gymcoach.common.plateau.PlateauReport;
import com.gymcoach.common.result.ErrorKind;
import com.gymcoach.common.result.Result;
import com.gymcoach.common.risk.RiskAssessment;
import com.gymcoach.common.risk.RiskAssessor;
import com.gymcoach.common.trend.TrendAnalyzer;
import com.gymcoach.common.trend.TrendReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.Callable;

/**
 * Runs the analytics core for one user.
 *
 * <p>Trend, anomaly, plateau and risk run in parallel on {@code boundedElastic} and join in
 * the adaptation selector. An exception thrown by one analyzer becomes a
 * {@link Result.Failed} for that component only; the rest of the report is unaffected.
 * The one hard failure is a missing profile where one is required.
 */
@Service
public class AnalysisDispatchService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisDispatchService.class);

    private final TrendAnalyzer trendAnalyzer;
    private final AnomalyDetector anomalyDetector;
    private final PlateauDetector plateauDetector;
    private final RiskAssessor riskAssessor;
    private final AdaptationSelector adaptationSelector;
    private final ProgressMonitor progressMonitor;
    private final AnalysisFlowLogger flowLogger;
    private final Clock clock;

    public AnalysisDispatchService(TrendAnalyzer trendAnalyzer,
                                   AnomalyDetector anomalyDetector,
                                   PlateauDetector plateauDetector,
                                   RiskAssessor riskAssessor,
                                   AdaptationSelector adaptationSelector,
                                   ProgressMonitor progressMonitor,
                                   AnalysisFlowLogger flowLogger,
                                   Clock clock) {
        this.trendAnalyzer = trendAnalyzer;
        this.anomalyDetector = anomalyDetector;
        this.plateauDetector = plateauDetector;
        this.riskAssessor = riskAssessor;
        this.adaptationSelector = adaptationSelector;
        this.progressMonitor = progressMonitor;
        this.flowLogger = flowLogger;
        this.clock = clock;
    }

    /** Full report: all four analyzers concurrently, then the adaptation selector. */
    public Mono<AnalysisReport> analyze(AnalysisRequest request) {
        if (request.profile() == null) {
            return Mono.error(new AnalysisException("AnalysisDispatchService", "user profile is required"));
        }
        String userId = request.effectiveUserId();
        String traceId = TraceContextUtil.ensureTraceId(request.traceId());
        flowLogger.logWithTraceId(AnalysisFlowLogger.REQUEST_RECEIVED, userId, traceId);
        return analyze(userId, traceId, request.history(), request.profile(),
                       request.plan(), request.effectiveGoal());
    }

    public Mono<AnalysisReport> analyze(String userId, String traceId, TrainingHistory history,
                                        UserProfile profile, WorkoutPlan plan, GoalDirection goal) {
        log.info("Dispatching analyzers for userId={} sessions={} skippedRecords={}",
                 userId, history.sessions().size(), history.skippedRecords());

        Mono<AnalysisReport> report = Mono.zip(
                run("TrendAnalyzer", userId, () -> trendAnalyzer.analyze(history, goal)),
                run("AnomalyDetector", userId, () -> anomalyDetector.detect(history)),
                run("PlateauDetector", userId, () -> plateauDetector.detect(history)),
                run("RiskAssessor", userId, () -> riskAssessor.assess(profile, history, plan)))
            .doOnEach(flowLogger.stage(AnalysisFlowLogger.ANALYZERS_COMPLETED, userId))
            .map(results -> new AnalysisReport(
                userId, traceId,
                results.getT1(), results.getT2(), results.getT3(), results.getT4(),
                selectSafely(results.getT1(), results.getT3(), results.getT4(), profile, userId)))
            .doOnNext(flowLogger::logReport);

        return TraceContextUtil.withTraceId(report, traceId);
    }

    public Mono<Result<TrendReport>> trends(AnalysisRequest request) {
        return run("TrendAnalyzer", request.effectiveUserId(),
                   () -> trendAnalyzer.analyze(request.history(), request.effectiveGoal()));
    }

    public Mono<Result<AnomalyReport>> anomalies(AnalysisRequest request) {
        return run("AnomalyDetector", request.effectiveUserId(),
                   () -> anomalyDetector.detect(request.history()));
    }

    public Mono<Result<PlateauReport>> plateaus(AnalysisRequest request) {
        return run("PlateauDetector", request.effectiveUserId(),
                   () -> plateauDetector.detect(request.history()));
    }

    public Mono<Result<RiskAssessment>> risk(AnalysisRequest request) {
        if (request.profile() == null) {
            return Mono.error(new AnalysisException("RiskAssessor", "user profile is required"));
        }
        return run("RiskAssessor", request.effectiveUserId(),
                   () -> riskAssessor.assess(request.profile(), request.history(), request.plan()));
    }

    /** Strategy from previously computed reports; absent reports count as insufficient data. */
    public Mono<AdaptationStrategy> adaptation(AdaptationRequest request) {
        if (request.profile() == null) {
            return Mono.error(new AnalysisException("AdaptationSelector", "user profile is required"));
        }
        return Mono.fromCallable(() -> adaptationSelector.select(
                Result.ofNullable(request.trends(), "trend report not supplied"),
                Result.ofNullable(request.plateaus(), "plateau report not supplied"),
                Result.ofNullable(request.risk(), "risk assessment not supplied"),
                request.profile()))
            .subscribeOn(Schedulers.boundedElastic());
    }

    /** Progress monitoring as of {@code request.asOf()}, or the service clock when omitted. */
    public Mono<Result<ProgressReport>> progress(AnalysisRequest request) {
        if (request.profile() == null) {
            return Mono.error(new AnalysisException("ProgressMonitor", "user profile is required"));
        }
        LocalDateTime asOf = request.asOf() != null ? request.asOf() : LocalDateTime.now(clock);
        return run("ProgressMonitor", request.effectiveUserId(),
                   () -> progressMonitor.monitor(request.profile(), request.history(),
                                                 request.effectiveGoal(), asOf));
    }

    private <T> Mono<Result<T>> run(String component, String userId, Callable<Result<T>> analyzer) {
        return Mono.fromCallable(analyzer)
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(result -> log.info("Component={} complete for userId={} status={}",
                component, userId, AnalysisFlowLogger.status(result)))
            .onErrorResume(e -> {
                log.error("Component={} failed for userId={}", component, userId, e);
                return Mono.just(Result.<T>failed(component, ErrorKind.COMPUTATION_FAILURE,
                    String.valueOf(e.getMessage())));
            });
    }

    private Result<AdaptationStrategy> selectSafely(Result<TrendReport> trends,
                                                    Result<PlateauReport> plateaus,
                                                    Result<RiskAssessment> risk,
                                                    UserProfile profile,
                                                    String userId) {
        try {
            return Result.ok(adaptationSelector.select(trends, plateaus, risk, profile));
        } catch (RuntimeException e) {
            log.error("Component=AdaptationSelector failed for userId={}", userId, e);
            return Result.failed("AdaptationSelector", ErrorKind.COMPUTATION_FAILURE,
                                 String.valueOf(e.getMessage()));
        }
    }
}
