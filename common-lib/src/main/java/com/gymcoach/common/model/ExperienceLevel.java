package com.gymcoach.common.model;

public enum ExperienceLevel {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED
}
