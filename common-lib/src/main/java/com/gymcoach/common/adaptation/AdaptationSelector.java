package com.gymcoach.common.adaptation;

import com.gymcoach.common.config.AnalyticsThresholds;
import com.gymcoach.common.exception.AnalysisException;
import com.gymcoach.common.model.UserProfile;
import com.gymcoach.common.plateau.PlateauRecord;
import com.gymcoach.common.plateau.PlateauReport;
import com.gymcoach.common.result.Result;
import com.gymcoach.common.risk.RiskAssessment;
import com.gymcoach.common.trend.TrendDirection;
import com.gymcoach.common.trend.TrendReport;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Maps analyzer outputs to one {@link AdaptationStrategy}.
 *
 * <p>Ordered rule list, first match wins:
 * <ol>
 *   <li>plateau detected → {@code break_plateau}</li>
 *   <li>overall strength declining → {@code reduce_load}</li>
 *   <li>strength improving and consistency ≥ 0.7 → {@code progressive_overload}</li>
 *   <li>high fatigue → {@code recovery_focus}</li>
 *   <li>consistency &lt; 0.4 → {@code simplify}</li>
 *   <li>otherwise → {@code maintain}</li>
 * </ol>
 *
 * <p>Inputs may be partial. A missing, failed or insufficient input simply cannot trigger
 * the rules that read it; in particular the consistency rules are skipped when consistency
 * could not be measured. Only the profile is mandatory.
 */
public final class AdaptationSelector {

    private static final String COMPONENT = "AdaptationSelector";

    private final AnalyticsThresholds.Adaptation thresholds;

    public AdaptationSelector(AnalyticsThresholds thresholds) {
        this.thresholds = thresholds.adaptation();
    }

    public AdaptationStrategy select(Result<TrendReport> trends,
                                     Result<PlateauReport> plateaus,
                                     Result<RiskAssessment> risk,
                                     UserProfile profile) {
        if (profile == null) throw new AnalysisException(COMPONENT, "user profile is required");

        Optional<TrendReport> trendReport = valueOf(trends);
        Optional<PlateauReport> plateauReport = valueOf(plateaus);
        Optional<RiskAssessment> riskAssessment = valueOf(risk);

        TrendDirection strength = trendReport
            .map(t -> t.overallStrength().direction())
            .orElse(TrendDirection.INSUFFICIENT_DATA);
        Double consistency = trendReport.map(TrendReport::consistencyScore).orElse(null);
        boolean highFatigue = riskAssessment
            .map(r -> r.fatigue() != null && r.fatigue().highFatigue())
            .orElse(false);

        // 1. plateau
        if (plateauReport.map(PlateauReport::plateausDetected).orElse(false)) {
            String exercises = plateauReport.get().plateaus().stream()
                .map(PlateauRecord::exercise).collect(Collectors.joining(", "));
            return strategy(AdaptationAction.BREAK_PLATEAU, List.of("change_exercises", "adjust_intensity"),
                thresholds.plateauIntensityDelta(), 0.0, "progress stalled on " + exercises);
        }

        // 2. declining strength
        if (strength == TrendDirection.DECLINING) {
            return strategy(AdaptationAction.REDUCE_LOAD, List.of("deload_week"),
                thresholds.declineIntensityDelta(), thresholds.declineVolumeDelta(),
                "overall strength is declining");
        }

        // 3. improving and consistent
        if (strength == TrendDirection.IMPROVING
                && consistency != null && consistency >= thresholds.overloadMinConsistency()) {
            return strategy(AdaptationAction.PROGRESSIVE_OVERLOAD, List.of("increase_intensity"),
                thresholds.overloadIntensityDelta(), thresholds.overloadVolumeDelta(),
                "strength is improving with consistent attendance");
        }

        // 4. fatigue
        if (highFatigue) {
            return strategy(AdaptationAction.RECOVERY_FOCUS, List.of("reduce_volume", "increase_rest"),
                0.0, thresholds.recoveryVolumeDelta(), "signs of accumulated fatigue");
        }

        // 5. inconsistent
        if (consistency != null && consistency < thresholds.simplifyMaxConsistency()) {
            return strategy(AdaptationAction.SIMPLIFY, List.of("reduce_complexity", "focus_fundamentals"),
                0.0, thresholds.simplifyVolumeDelta(), "training schedule is inconsistent");
        }

        return strategy(AdaptationAction.MAINTAIN, List.of(), 0.0, 0.0, "no adaptation signal");
    }

    private static AdaptationStrategy strategy(AdaptationAction action, List<String> secondary,
                                               double intensityDelta, double volumeDelta, String rationale) {
        return new AdaptationStrategy(action, secondary, intensityDelta, volumeDelta,
            PeriodizationPhase.forAction(action), rationale);
    }

    private static <T> Optional<T> valueOf(Result<T> result) {
        return result == null ? Optional.empty() : result.toOptional();
    }
}
