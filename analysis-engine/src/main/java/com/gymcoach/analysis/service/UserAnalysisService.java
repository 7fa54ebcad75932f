package com.gymcoach.analysis.service;

import com.gymcoach.analysis.client.TrainingHistoryClient;
import com.gymcoach.analysis.config.AnalyticsProperties;
import com.gymcoach.analysis.dto.AnalysisReport;
import com.gymcoach.analysis.logger.AnalysisFlowLogger;
import com.gymcoach.analysis.trace.TraceContextUtil;
import com.gymcoach.common.history.TrainingHistory;
import com.gymcoach.common.model.GoalDirection;
import com.gymcoach.common.model.UserProfile;
import com.gymcoach.common.result.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Fetches history from history-service and runs the full report, for one user or many.
 */
@Service
public class UserAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(UserAnalysisService.class);

    private final TrainingHistoryClient historyClient;
    private final AnalysisDispatchService dispatchService;
    private final AnalysisFlowLogger flowLogger;
    private final AnalyticsProperties.Batch batch;

    public UserAnalysisService(TrainingHistoryClient historyClient,
                               AnalysisDispatchService dispatchService,
                               AnalysisFlowLogger flowLogger,
                               AnalyticsProperties properties) {
        this.historyClient = historyClient;
        this.dispatchService = dispatchService;
        this.flowLogger = flowLogger;
        this.batch = properties.getBatch();
    }

    /**
     * Fetches the last {@code windowDays} of history and analyses it.
     *
     * <p>Missing workout, measurement or nutrition lists only narrow the analysis. A missing
     * profile yields a report in which every component failed with
     * {@link ErrorKind#UPSTREAM_UNAVAILABLE}.
     */
    public Mono<AnalysisReport> analyzeUser(String userId, Integer windowDays) {
        int window = effectiveWindow(windowDays);
        String traceId = TraceContextUtil.ensureTraceId(null);
        flowLogger.logWithTraceId(AnalysisFlowLogger.REQUEST_RECEIVED, userId, traceId);

        Mono<AnalysisReport> report = Mono.zip(
                historyClient.fetchWorkouts(userId, window),
                historyClient.fetchMeasurements(userId, window),
                historyClient.fetchNutrition(userId, window),
                historyClient.fetchProfile(userId).map(Optional::of).defaultIfEmpty(Optional.empty()))
            .doOnEach(flowLogger.stage(AnalysisFlowLogger.HISTORY_FETCHED, userId))
            .flatMap(fetched -> {
                Optional<UserProfile> profile = fetched.getT4();
                if (profile.isEmpty()) {
                    log.warn("No profile available for userId={}, report marked upstream_unavailable", userId);
                    return Mono.just(AnalysisReport.failed(userId, traceId, ErrorKind.UPSTREAM_UNAVAILABLE,
                        "user profile unavailable from history-service"));
                }
                TrainingHistory history = TrainingHistory.of(fetched.getT1(), fetched.getT2(), fetched.getT3());
                return dispatchService.analyze(userId, traceId, history, profile.get(), null,
                                               GoalDirection.fromGoals(profile.get().goals()));
            });

        return TraceContextUtil.withTraceId(report, traceId);
    }

    /**
     * Analyses every user with at most {@code analytics.batch.concurrency} in flight.
     * Reports arrive in completion order. A user that exceeds
     * {@code analytics.batch.user-timeout} is logged and left out of the stream.
     */
    public Flux<AnalysisReport> analyzeBatch(List<String> userIds, Integer windowDays) {
        List<String> ids = userIds == null ? List.of() : userIds;
        log.info("Batch analysis started. users={} concurrency={} userTimeout={}",
                 ids.size(), batch.getConcurrency(), batch.getUserTimeout());

        return Flux.fromIterable(ids)
            .flatMap(userId -> withTimeout(userId, analyzeUser(userId, windowDays)),
                     Math.max(1, batch.getConcurrency()));
    }

    private Mono<AnalysisReport> withTimeout(String userId, Mono<AnalysisReport> report) {
        Duration timeout = batch.getUserTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) return report;
        return report
            .timeout(timeout)
            .onErrorResume(TimeoutException.class, e -> {
                log.warn("Analysis for userId={} exceeded {} and was dropped from the batch", userId, timeout);
                return Mono.empty();
            });
    }

    private int effectiveWindow(Integer windowDays) {
        return windowDays == null || windowDays <= 0 ? batch.getWindowDays() : windowDays;
    }
}
