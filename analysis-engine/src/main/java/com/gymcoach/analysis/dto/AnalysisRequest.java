package com.gymcoach.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gymcoach.common.history.TrainingHistory;
import com.gymcoach.common.model.BodyMeasurement;
import com.gymcoach.common.model.GoalDirection;
import com.gymcoach.common.model.NutritionDay;
import com.gymcoach.common.model.UserProfile;
import com.gymcoach.common.model.WorkoutPlan;
import com.gymcoach.common.model.WorkoutSession;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One user's history slice as posted to the analysis endpoints.
 *
 * <p>Everything except {@code sessions} is optional. {@code goalDirection} falls back to
 * the profile goals, {@code asOf} to the service clock.
 */
public record AnalysisRequest(
    @JsonProperty("userId")        String                userId,
    @JsonProperty("sessions")      List<WorkoutSession>  sessions,
    @JsonProperty("measurements")  List<BodyMeasurement> measurements,
    @JsonProperty("nutrition")     List<NutritionDay>    nutrition,
    @JsonProperty("profile")       UserProfile           profile,
    @JsonProperty("plan")          WorkoutPlan           plan,
    @JsonProperty("goalDirection") GoalDirection         goalDirection,
    @JsonProperty("asOf")          LocalDateTime         asOf,
    @JsonProperty("traceId")       String                traceId
) {
    public static AnalysisRequest of(String userId, List<WorkoutSession> sessions, UserProfile profile) {
        return new AnalysisRequest(userId, sessions, List.of(), List.of(), profile, null, null, null, null);
    }

    public TrainingHistory history() {
        return TrainingHistory.of(sessions, measurements, nutrition);
    }

    public GoalDirection effectiveGoal() {
        if (goalDirection != null) return goalDirection;
        return GoalDirection.fromGoals(profile == null ? null : profile.goals());
    }

    /** userId from the request, falling back to the profile's. */
    public String effectiveUserId() {
        if (userId != null) return userId;
        return profile == null ? null : profile.userId();
    }
}
