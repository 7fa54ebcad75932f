package com.gymcoach.analysis.service;

import com.gymcoach.analysis.dto.AdaptationRequest;
import com.gymcoach.analysis.dto.AnalysisRequest;
import com.gymcoach.analysis.logger.AnalysisFlowLogger;
import com.gymcoach.common.adaptation.AdaptationAction;
import com.gymcoach.common.adaptation.AdaptationSelector;
import com.gymcoach.common.anomaly.AnomalyDetector;
import com.gymcoach.common.config.AnalyticsThresholds;
import com.gymcoach.common.exception.AnalysisException;
import com.gymcoach.common.model.ExperienceLevel;
import com.gymcoach.common.model.UserProfile;
import com.gymcoach.common.monitor.ProgressMonitor;
import com.gymcoach.common.plateau.PlateauDetector;
import com.gymcoach.common.result.ErrorKind;
import com.gymcoach.common.result.Result;
import com.gymcoach.common.risk.RiskAssessor;
import com.gymcoach.common.trend.TrendAnalyzer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static com.gymcoach.analysis.AnalysisFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnalysisDispatchServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 9, 0);

    private final AnalyticsThresholds thresholds = AnalyticsThresholds.defaults();
    private final TrendAnalyzer trendAnalyzer = new TrendAnalyzer(thresholds);
    private final PlateauDetector plateauDetector = new PlateauDetector(thresholds);
    private final RiskAssessor riskAssessor = new RiskAssessor(thresholds);
    private final Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

    private AnalysisDispatchService service;

    @BeforeEach
    void setUp() {
        service = serviceWith(new AnomalyDetector(thresholds));
    }

    private AnalysisDispatchService serviceWith(AnomalyDetector anomalyDetector) {
        return new AnalysisDispatchService(
            trendAnalyzer, anomalyDetector, plateauDetector, riskAssessor,
            new AdaptationSelector(thresholds),
            new ProgressMonitor(thresholds, trendAnalyzer, plateauDetector, riskAssessor),
            new AnalysisFlowLogger(), clock);
    }

    @Nested
    @DisplayName("full report")
    class FullReport {

        @Test
        @DisplayName("all components succeed and the breakthrough history earns progressive overload")
        void breakthroughHistory() {
            StepVerifier.create(service.analyze(request("u-1")))
                .assertNext(report -> {
                    assertThat(report.userId()).isEqualTo("u-1");
                    assertThat(report.traceId()).isNotBlank();
                    assertThat(report.trends().isOk()).isTrue();
                    assertThat(report.anomalies().isOk()).isTrue();
                    assertThat(report.plateaus().isOk()).isTrue();
                    assertThat(report.risk().isOk()).isTrue();
                    assertThat(report.adaptation().toOptional())
                        .get()
                        .extracting(s -> s.primaryAction())
                        .isEqualTo(AdaptationAction.PROGRESSIVE_OVERLOAD);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("keeps a caller-supplied traceId")
        void keepsTraceId() {
            AnalysisRequest base = request("u-1");
            AnalysisRequest traced = new AnalysisRequest(base.userId(), base.sessions(), List.of(), List.of(),
                base.profile(), null, null, null, "trace-42");

            StepVerifier.create(service.analyze(traced))
                .assertNext(report -> assertThat(report.traceId()).isEqualTo("trace-42"))
                .verifyComplete();
        }

        @Test
        @DisplayName("a throwing analyzer becomes Failed for that component only")
        void analyzerFailureIsIsolated() {
            AnomalyDetector broken = mock(AnomalyDetector.class);
            when(broken.detect(any())).thenThrow(new IllegalStateException("boom"));

            StepVerifier.create(serviceWith(broken).analyze(request("u-1")))
                .assertNext(report -> {
                    assertThat(report.anomalies()).isInstanceOf(Result.Failed.class);
                    Result.Failed<?> failed = (Result.Failed<?>) report.anomalies();
                    assertThat(failed.error().component()).isEqualTo("AnomalyDetector");
                    assertThat(failed.error().kind()).isEqualTo(ErrorKind.COMPUTATION_FAILURE);
                    assertThat(failed.error().message()).isEqualTo("boom");
                    assertThat(report.trends().isOk()).isTrue();
                    assertThat(report.adaptation().isOk()).isTrue();
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("empty history is insufficient everywhere but still yields a strategy")
        void emptyHistory() {
            AnalysisRequest empty = AnalysisRequest.of("u-2", List.of(), profile("u-2"));

            StepVerifier.create(service.analyze(empty))
                .assertNext(report -> {
                    assertThat(report.trends()).isInstanceOf(Result.InsufficientData.class);
                    assertThat(report.anomalies()).isInstanceOf(Result.InsufficientData.class);
                    assertThat(report.plateaus()).isInstanceOf(Result.InsufficientData.class);
                    assertThat(report.adaptation().isOk()).isTrue();
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("missing profile is a contract violation")
        void missingProfile() {
            AnalysisRequest noProfile = AnalysisRequest.of("u-3", breakthroughBench(), null);

            StepVerifier.create(service.analyze(noProfile))
                .expectError(AnalysisException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("single operations")
    class SingleOperations {

        @Test
        @DisplayName("trends run without a profile")
        void trendsWithoutProfile() {
            StepVerifier.create(service.trends(AnalysisRequest.of("u-1", breakthroughBench(), null)))
                .assertNext(result -> assertThat(result.isOk()).isTrue())
                .verifyComplete();
        }

        @Test
        @DisplayName("risk without a profile errors")
        void riskWithoutProfile() {
            StepVerifier.create(service.risk(AnalysisRequest.of("u-1", breakthroughBench(), null)))
                .expectError(AnalysisException.class)
                .verify();
        }

        @Test
        @DisplayName("adaptation with no reports still selects a strategy")
        void adaptationWithoutReports() {
            UserProfile beginner = new UserProfile("u-1", ExperienceLevel.BEGINNER, null, null, null, null);

            StepVerifier.create(service.adaptation(new AdaptationRequest(null, null, null, beginner)))
                .assertNext(strategy -> assertThat(strategy.primaryAction()).isNotNull())
                .verifyComplete();
        }

        @Test
        @DisplayName("progress defaults asOf to the service clock")
        void progressUsesClock() {
            StepVerifier.create(service.progress(request("u-1")))
                .assertNext(result -> {
                    assertThat(result.isOk()).isTrue();
                    // last session 2024-02-19, clock at 2024-03-01
                    assertThat(result.toOptional().get().daysSinceLastWorkout()).isEqualTo(11L);
                })
                .verifyComplete();
        }
    }
}
