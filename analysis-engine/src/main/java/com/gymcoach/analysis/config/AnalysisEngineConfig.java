package com.gymcoach.analysis.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gymcoach.common.adaptation.AdaptationSelector;
import com.gymcoach.common.anomaly.AnomalyDetector;
import com.gymcoach.common.config.AnalyticsThresholds;
import com.gymcoach.common.monitor.ProgressMonitor;
import com.gymcoach.common.plateau.PlateauDetector;
import com.gymcoach.common.risk.RiskAssessor;
import com.gymcoach.common.trend.TrendAnalyzer;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.ProblemDetail;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.converter.json.ProblemDetailJacksonMixin;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalysisEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngineConfig.class);

    @Value("${services.history.base-url}")
    private String historyUrl;

    @Value("${services.history.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${services.history.read-timeout-seconds:10}")
    private int readTimeoutSeconds;

    @Bean
    public WebClient historyWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(historyUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(serverErrorFilter())
            .filter(loggingFilter())
            .build();
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // problem responses flatten their extra properties into the top-level object
        mapper.addMixIn(ProblemDetail.class, ProblemDetailJacksonMixin.class);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AnalyticsThresholds analyticsThresholds(AnalyticsProperties properties) {
        AnalyticsThresholds thresholds = properties.toThresholds();
        log.info("Analytics thresholds loaded. riskWeightSum={} normalizeWeights={} batchConcurrency={}",
                 thresholds.risk().weights().sum(), thresholds.risk().normalizeWeights(),
                 properties.getBatch().getConcurrency());
        return thresholds;
    }

    @Bean
    public TrendAnalyzer trendAnalyzer(AnalyticsThresholds thresholds) {
        return new TrendAnalyzer(thresholds);
    }

    @Bean
    public AnomalyDetector anomalyDetector(AnalyticsThresholds thresholds) {
        return new AnomalyDetector(thresholds);
    }

    @Bean
    public PlateauDetector plateauDetector(AnalyticsThresholds thresholds) {
        return new PlateauDetector(thresholds);
    }

    @Bean
    public RiskAssessor riskAssessor(AnalyticsThresholds thresholds) {
        return new RiskAssessor(thresholds);
    }

    @Bean
    public AdaptationSelector adaptationSelector(AnalyticsThresholds thresholds) {
        return new AdaptationSelector(thresholds);
    }

    @Bean
    public ProgressMonitor progressMonitor(AnalyticsThresholds thresholds,
                                           TrendAnalyzer trendAnalyzer,
                                           PlateauDetector plateauDetector,
                                           RiskAssessor riskAssessor) {
        return new ProgressMonitor(thresholds, trendAnalyzer, plateauDetector, riskAssessor);
    }

    private ExchangeFilterFunction serverErrorFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new IllegalStateException(
                    "History service error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
