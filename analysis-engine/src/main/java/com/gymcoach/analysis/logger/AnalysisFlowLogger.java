package com.gymcoach.analysis.logger;

import com.gymcoach.analysis.dto.AnalysisReport;
import com.gymcoach.analysis.trace.TraceContextUtil;
import com.gymcoach.common.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Stage logging for one user's analysis run.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}: request accepted by the controller or batch loop</li>
 *   <li>{@link #HISTORY_FETCHED}: history-service returned workouts, measurements, nutrition and profile</li>
 *   <li>{@link #ANALYZERS_COMPLETED}: trend, anomaly, plateau and risk have all joined</li>
 *   <li>{@link #ADAPTATION_SELECTED}: the strategy has been chosen</li>
 * </ol>
 *
 * <p>Pure side-effects. Never changes what flows through the pipeline.
 */
@Component
public class AnalysisFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AnalysisFlowLogger.class);

    public static final String REQUEST_RECEIVED    = "REQUEST_RECEIVED";
    public static final String HISTORY_FETCHED     = "HISTORY_FETCHED";
    public static final String ANALYZERS_COMPLETED = "ANALYZERS_COMPLETED";
    public static final String ADAPTATION_SELECTED = "ADAPTATION_SELECTED";

    /**
     * {@code doOnEach} consumer that logs {@code stageName} on every {@code onNext}, reading
     * the traceId from the Reactor Context carried by the signal.
     */
    public <T> Consumer<Signal<T>> stage(String stageName, String userId) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, userId, () ->
                log.info("[AnalysisFlow] stage={} userId={} traceId={}", stageName, userId, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String userId, String traceId) {
        TraceContextUtil.withMdc(traceId, userId, () ->
            log.info("[AnalysisFlow] stage={} userId={} traceId={}", stageName, userId, traceId)
        );
    }

    /** One-line summary of a finished report: status per component plus the chosen action. */
    public void logReport(AnalysisReport report) {
        TraceContextUtil.withMdc(report.traceId(), report.userId(), () ->
            log.info("[AnalysisFlow] stage={} userId={} trends={} anomalies={} plateaus={} risk={} action={} traceId={}",
                     ADAPTATION_SELECTED,
                     report.userId(),
                     status(report.trends()), status(report.anomalies()),
                     status(report.plateaus()), status(report.risk()),
                     report.adaptation().toOptional().map(s -> s.primaryAction().name()).orElse("N/A"),
                     report.traceId())
        );
    }

    public static String status(Result<?> result) {
        if (result instanceof Result.Ok) return "ok";
        if (result instanceof Result.InsufficientData) return "insufficient_data";
        return "failed";
    }
}
