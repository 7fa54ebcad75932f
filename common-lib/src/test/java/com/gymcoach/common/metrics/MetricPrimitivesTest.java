package com.gymcoach.common.metrics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MetricPrimitivesTest {

    // ── per-record metrics ────────────────────────────────────────────────

    @Nested
    @DisplayName("1RM, intensity and volume")
    class RecordMetrics {

        @Test
        @DisplayName("Epley estimate: 100 kg × 10 reps ≈ 133.3 kg")
        void epley() {
            assertEquals(133.333, MetricPrimitives.estimatedOneRepMax(100, 10), 0.001);
        }

        @Test
        @DisplayName("1RM is non-decreasing in both weight and reps")
        void monotonic() {
            for (int w = 1; w <= 200; w += 7) {
                for (int r = 1; r <= 20; r++) {
                    double base = MetricPrimitives.estimatedOneRepMax(w, r);
                    assertTrue(MetricPrimitives.estimatedOneRepMax(w + 1, r) >= base);
                    assertTrue(MetricPrimitives.estimatedOneRepMax(w, r + 1) >= base);
                }
            }
        }

        @Test
        @DisplayName("intensity of a zero-weight set is 0, not NaN")
        void zeroWeightIntensity() {
            assertEquals(0.0, MetricPrimitives.intensityPercent(0, 10));
        }

        @Test
        @DisplayName("a single rep is 100/(31/30) ≈ 96.8% intensity")
        void singleRepIntensity() {
            assertEquals(96.774, MetricPrimitives.intensityPercent(120, 1), 0.001);
        }

        @Test
        void volume() {
            assertEquals(2400.0, MetricPrimitives.volume(100, 8, 3));
        }
    }

    // ── consistencyScore() ────────────────────────────────────────────────

    @Nested
    @DisplayName("consistencyScore()")
    class Consistency {

        @Test
        @DisplayName("uniform gaps score 1.0")
        void uniformGaps() {
            assertEquals(1.0, MetricPrimitives.consistencyScore(List.of(3, 3, 3, 3, 3, 3, 3, 3, 3)), 1e-9);
        }

        @Test
        @DisplayName("irregular gaps [1,1,1,30] score materially lower")
        void irregularGaps() {
            assertTrue(MetricPrimitives.consistencyScore(List.of(1, 1, 1, 30)) < 0.5);
        }

        @Test
        @DisplayName("empty input scores 0")
        void empty() {
            assertEquals(0.0, MetricPrimitives.consistencyScore(List.of()));
            assertEquals(0.0, MetricPrimitives.consistencyScore(null));
        }

        @Test
        @DisplayName("a single gap has no spread and scores 1.0")
        void singleGap() {
            assertEquals(1.0, MetricPrimitives.consistencyScore(List.of(4)), 1e-9);
        }

        @Test
        @DisplayName("same-day sessions (all gaps 0) use a mean floor of 1")
        void zeroGaps() {
            assertEquals(1.0, MetricPrimitives.consistencyScore(List.of(0, 0, 0)), 1e-9);
        }
    }

    // ── parseDate() / daysBetween() ───────────────────────────────────────

    @Nested
    @DisplayName("parseDate()")
    class ParseDate {

        @Test
        void plainDate() {
            assertEquals(Optional.of(LocalDateTime.of(2024, 3, 1, 0, 0)), MetricPrimitives.parseDate("2024-03-01"));
        }

        @Test
        void localDateTime() {
            assertEquals(Optional.of(LocalDateTime.of(2024, 3, 1, 7, 30)), MetricPrimitives.parseDate("2024-03-01T07:30:00"));
        }

        @Test
        @DisplayName("offset timestamps are normalized to UTC")
        void offsetDateTime() {
            LocalDateTime expected = LocalDateTime.of(2024, 3, 1, 7, 30);
            assertEquals(Optional.of(expected), MetricPrimitives.parseDate("2024-03-01T07:30:00Z"));
            assertEquals(Optional.of(expected), MetricPrimitives.parseDate("2024-03-01T09:30:00+02:00"));
        }

        @Test
        @DisplayName("unparsable input → empty, never an exception")
        void garbage() {
            assertTrue(MetricPrimitives.parseDate("yesterday").isEmpty());
            assertTrue(MetricPrimitives.parseDate("2024-13-45").isEmpty());
            assertTrue(MetricPrimitives.parseDate("").isEmpty());
            assertTrue(MetricPrimitives.parseDate(null).isEmpty());
        }

        @Test
        void daysBetweenStrings() {
            assertEquals(Optional.of(14L), MetricPrimitives.daysBetween("2024-03-01", "2024-03-15"));
            assertTrue(MetricPrimitives.daysBetween("2024-03-01", "bad").isEmpty());
        }
    }

    // ── clamping ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("clamping")
    class Clamping {

        @Test
        void nonFiniteCollapsesToZero() {
            assertEquals(0.0, MetricPrimitives.clampPercent(Double.NaN));
            assertEquals(0.0, MetricPrimitives.clampPercent(Double.POSITIVE_INFINITY));
            assertEquals(0.0, MetricPrimitives.clampScore(Double.NaN));
        }

        @Test
        void bounds() {
            assertEquals(1000.0, MetricPrimitives.clampPercent(5000));
            assertEquals(-1000.0, MetricPrimitives.clampPercent(-5000));
            assertEquals(1.0, MetricPrimitives.clampScore(1.4));
            assertEquals(0.0, MetricPrimitives.clampScore(-0.2));
        }

        @Test
        @DisplayName("percentChange from a zero base is 0")
        void percentChangeGuard() {
            assertEquals(0.0, MetricPrimitives.percentChange(0, 50));
            assertEquals(50.0, MetricPrimitives.percentChange(100, 150), 1e-9);
        }
    }
}
