package com.gymcoach.analysis.service;

import com.gymcoach.analysis.client.TrainingHistoryClient;
import com.gymcoach.analysis.config.AnalyticsProperties;
import com.gymcoach.analysis.dto.AnalysisReport;
import com.gymcoach.analysis.logger.AnalysisFlowLogger;
import com.gymcoach.common.adaptation.AdaptationSelector;
import com.gymcoach.common.anomaly.AnomalyDetector;
import com.gymcoach.common.config.AnalyticsThresholds;
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
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static com.gymcoach.analysis.AnalysisFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UserAnalysisServiceTest {

    private final TrainingHistoryClient client = mock(TrainingHistoryClient.class);
    private final AnalyticsProperties properties = new AnalyticsProperties();
    private UserAnalysisService service;

    @BeforeEach
    void setUp() {
        AnalyticsThresholds thresholds = properties.toThresholds();
        TrendAnalyzer trends = new TrendAnalyzer(thresholds);
        PlateauDetector plateaus = new PlateauDetector(thresholds);
        RiskAssessor risk = new RiskAssessor(thresholds);
        AnalysisDispatchService dispatch = new AnalysisDispatchService(
            trends, new AnomalyDetector(thresholds), plateaus, risk,
            new AdaptationSelector(thresholds), new ProgressMonitor(thresholds, trends, plateaus, risk),
            new AnalysisFlowLogger(), Clock.systemUTC());
        service = new UserAnalysisService(client, dispatch, new AnalysisFlowLogger(), properties);

        when(client.fetchWorkouts(anyString(), anyInt())).thenReturn(Mono.just(breakthroughBench()));
        when(client.fetchMeasurements(anyString(), anyInt())).thenReturn(Mono.just(List.of()));
        when(client.fetchNutrition(anyString(), anyInt())).thenReturn(Mono.just(List.of()));
        when(client.fetchProfile(anyString())).thenAnswer(inv -> Mono.just(profile(inv.getArgument(0))));
    }

    @Nested
    @DisplayName("single user")
    class SingleUser {

        @Test
        @DisplayName("fetched history flows into a full report")
        void fetchesAndAnalyses() {
            StepVerifier.create(service.analyzeUser("u-1", 14))
                .assertNext(report -> {
                    assertThat(report.userId()).isEqualTo("u-1");
                    assertThat(report.trends().isOk()).isTrue();
                    assertThat(report.adaptation().isOk()).isTrue();
                })
                .verifyComplete();

            verify(client).fetchWorkouts("u-1", 14);
        }

        @Test
        @DisplayName("window falls back to the configured default")
        void defaultWindow() {
            StepVerifier.create(service.analyzeUser("u-1", null))
                .expectNextCount(1)
                .verifyComplete();

            verify(client).fetchMeasurements(eq("u-1"), eq(30));
        }

        @Test
        @DisplayName("missing profile fails every component as upstream unavailable")
        void missingProfile() {
            when(client.fetchProfile("ghost")).thenReturn(Mono.empty());

            StepVerifier.create(service.analyzeUser("ghost", 30))
                .assertNext(report -> {
                    assertThat(List.of(report.trends(), report.anomalies(), report.plateaus(),
                                       report.risk(), report.adaptation()))
                        .allSatisfy(result -> {
                            assertThat(result).isInstanceOf(Result.Failed.class);
                            assertThat(((Result.Failed<?>) result).error().kind())
                                .isEqualTo(ErrorKind.UPSTREAM_UNAVAILABLE);
                        });
                })
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("batch")
    class Batch {

        @Test
        @DisplayName("emits one report per user")
        void reportPerUser() {
            StepVerifier.create(service.analyzeBatch(List.of("a", "b", "c"), 30)
                    .map(AnalysisReport::userId)
                    .collectList())
                .assertNext(ids -> assertThat(ids).containsExactlyInAnyOrder("a", "b", "c"))
                .verifyComplete();
        }

        @Test
        @DisplayName("a user exceeding the timeout is dropped, the rest still arrive")
        void slowUserDropped() {
            properties.getBatch().setUserTimeout(Duration.ofMillis(200));
            when(client.fetchWorkouts(eq("slow"), anyInt())).thenReturn(Mono.never());

            StepVerifier.create(service.analyzeBatch(List.of("a", "slow", "b"), 30)
                    .map(AnalysisReport::userId)
                    .collectList())
                .assertNext(ids -> assertThat(ids).containsExactlyInAnyOrder("a", "b"))
                .verifyComplete();
        }

        @Test
        @DisplayName("null user list completes empty")
        void nullUsers() {
            StepVerifier.create(service.analyzeBatch(null, null))
                .verifyComplete();
        }
    }
}
