package com.tasklane.core.model;

public enum Effort {
    TRIVIAL,
    SMALL,
    MEDIUM,
    LARGE,
    EPIC
}
