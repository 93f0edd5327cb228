package com.dependency.flow.maestro.model;

public enum UpdateFrequency {
    EVERY_BUILD,
    EVERY_DAY,
    EVERY_WEEK,
    NONE
}
