package com.gymcoach.analysis.client;

import com.gymcoach.common.model.BodyMeasurement;
import com.gymcoach.common.model.NutritionDay;
import com.gymcoach.common.model.UserProfile;
import com.gymcoach.common.model.WorkoutSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Reads one user's training history from history-service.
 *
 * <p>List endpoints absorb every error with an empty-list fallback so a single missing
 * channel only narrows the analysis. The profile is the exception: it completes empty on
 * failure and the caller decides what a missing profile means.
 */
@Component
public class TrainingHistoryClient {

    private static final Logger log = LoggerFactory.getLogger(TrainingHistoryClient.class);

    private static final ParameterizedTypeReference<List<WorkoutSession>> SESSIONS =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<BodyMeasurement>> MEASUREMENTS =
        new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<NutritionDay>> NUTRITION =
        new ParameterizedTypeReference<>() {};

    private final WebClient historyWebClient;

    public TrainingHistoryClient(@Qualifier("historyWebClient") WebClient historyWebClient) {
        this.historyWebClient = historyWebClient;
    }

    public Mono<List<WorkoutSession>> fetchWorkouts(String userId, int windowDays) {
        return fetchList(userId, "workouts", windowDays, SESSIONS);
    }

    public Mono<List<BodyMeasurement>> fetchMeasurements(String userId, int windowDays) {
        return fetchList(userId, "measurements", windowDays, MEASUREMENTS);
    }

    public Mono<List<NutritionDay>> fetchNutrition(String userId, int windowDays) {
        return fetchList(userId, "nutrition", windowDays, NUTRITION);
    }

    /**
     * @return the profile, or an empty Mono when history-service is unreachable or has
     *         no profile for {@code userId}
     */
    public Mono<UserProfile> fetchProfile(String userId) {
        return historyWebClient.get()
            .uri("/api/v1/users/{userId}/profile", userId)
            .retrieve()
            .bodyToMono(UserProfile.class)
            .onErrorResume(e -> {
                log.warn("Profile fetch failed for userId={}. reason={}", userId, e.getMessage());
                return Mono.empty();
            });
    }

    private <T> Mono<List<T>> fetchList(String userId, String resource, int windowDays,
                                        ParameterizedTypeReference<List<T>> type) {
        return historyWebClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v1/users/{userId}/" + resource)
                .queryParam("windowDays", windowDays)
                .build(userId))
            .retrieve()
            .bodyToMono(type)
            .defaultIfEmpty(List.of())
            .onErrorResume(e -> {
                log.warn("History fetch failed for userId={} resource={}, using empty list. reason={}",
                         userId, resource, e.getMessage());
                return Mono.just(List.<T>of());
            });
    }
}
