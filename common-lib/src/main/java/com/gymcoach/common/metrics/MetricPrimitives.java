package com.gymcoach.common.metrics;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Optional;

/**
 * Pure numeric helpers shared by every analyzer.
 *
 * <p>Formulas:
 * <pre>
 *   estimated 1RM = weight × (1 + reps / 30)          (Epley)
 *   intensity %   = weight / estimated 1RM × 100
 *   volume        = weight × reps × sets
 *   consistency   = max(0, 1 − stddev(gaps) / max(mean(gaps), 1))
 * </pre>
 *
 * <p>Every division by a value that may be zero is guarded and falls back to a
 * neutral default. No Spring. No I/O. Pure functions.
 */
public final class MetricPrimitives {

    /** Largest magnitude any percentage output is allowed to take. */
    public static final double PERCENT_LIMIT = 1000.0;

    /** {@code yyyy-MM-dd} with optional time, offset and bracketed zone region. */
    private static final DateTimeFormatter ISO_FLEXIBLE = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .optionalStart()
                .appendLiteral('[').parseCaseSensitive().appendZoneRegionId().appendLiteral(']')
            .optionalEnd()
        .optionalEnd()
        .toFormatter();

    private MetricPrimitives() { /* utility class */ }

    // ── Per-record metrics ─────────────────────────────────────────

    public static double estimatedOneRepMax(double weight, int reps) {
        return weight * (1 + reps / 30.0);
    }

    /**
     * Working weight as a percentage of its estimated 1RM. Returns 0 when the
     * estimate is not positive (zero weight).
     */
    public static double intensityPercent(double weight, int reps) {
        double oneRepMax = estimatedOneRepMax(weight, reps);
        if (oneRepMax <= 0) return 0.0;
        return weight / oneRepMax * 100;
    }

    public static double volume(double weight, int reps, int sets) {
        return weight * reps * sets;
    }

    // ── Time ───────────────────────────────────────────────────────

    /**
     * Parses an ISO-8601 date or timestamp. Accepts {@code 2024-03-01},
     * {@code 2024-03-01T07:30:00}, and offset/zoned forms such as
     * {@code 2024-03-01T07:30:00Z}. Offset forms are normalized to UTC.
     *
     * @return the parsed instant as a UTC local date-time, or empty if unparsable
     */
    public static Optional<LocalDateTime> parseDate(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            TemporalAccessor parsed = ISO_FLEXIBLE.parseBest(raw.trim(),
                ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return Optional.of(zoned.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
            }
            if (parsed instanceof LocalDateTime local) return Optional.of(local);
            return Optional.of(((LocalDate) parsed).atStartOfDay());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /** Whole days from {@code from} to {@code to}; negative when {@code to} is earlier. */
    public static long daysBetween(LocalDateTime from, LocalDateTime to) {
        return Duration.between(from, to).toDays();
    }

    /** String form of {@link #daysBetween(LocalDateTime, LocalDateTime)}; empty if either date is unparsable. */
    public static Optional<Long> daysBetween(String from, String to) {
        Optional<LocalDateTime> a = parseDate(from);
        Optional<LocalDateTime> b = parseDate(to);
        if (a.isEmpty() || b.isEmpty()) return Optional.empty();
        return Optional.of(daysBetween(a.get(), b.get()));
    }

    // ── Consistency ────────────────────────────────────────────────

    /**
     * Normalized inverse variability of day-gaps between sessions.
     * Uniform gaps score 1.0; empty input scores 0.
     */
    public static double consistencyScore(List<? extends Number> gapsDays) {
        if (gapsDays == null || gapsDays.isEmpty()) return 0.0;
        List<Double> gaps = gapsDays.stream().map(Number::doubleValue).toList();
        double mean = mean(gaps);
        double std = sampleStdDev(gaps);
        return clampScore(Math.max(0.0, 1 - std / Math.max(mean, 1)));
    }

    // ── Statistics ─────────────────────────────────────────────────

    public static double mean(List<Double> values) {
        if (values == null || values.isEmpty()) return 0.0;
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.size();
    }

    /** Sample (n − 1) standard deviation; 0 for fewer than two values. */
    public static double sampleStdDev(List<Double> values) {
        if (values == null || values.size() < 2) return 0.0;
        double mean = mean(values);
        double sumSq = 0;
        for (double v : values) sumSq += (v - mean) * (v - mean);
        return Math.sqrt(sumSq / (values.size() - 1));
    }

    /** Percent change from {@code base} to {@code current}; 0 when {@code base} is not positive. */
    public static double percentChange(double base, double current) {
        if (base <= 0) return 0.0;
        return clampPercent((current - base) / base * 100);
    }

    // ── Clamping ───────────────────────────────────────────────────

    /** Non-finite values collapse to 0; finite values are bounded to ±{@value #PERCENT_LIMIT}. */
    public static double clampPercent(double value) {
        if (!Double.isFinite(value)) return 0.0;
        return Math.max(-PERCENT_LIMIT, Math.min(PERCENT_LIMIT, value));
    }

    /** Non-finite values collapse to 0; finite values are bounded to [0, 1]. */
    public static double clampScore(double value) {
        if (!Double.isFinite(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static boolean isValidAmount(double value) {
        return Double.isFinite(value) && value >= 0;
    }

    /** Rounds to two decimals for presentation fields; never used inside comparisons. */
    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
