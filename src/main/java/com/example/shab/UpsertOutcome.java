package com.example.shab;

public enum UpsertOutcome {
    INSERTED,
    SKIPPED_DUPLICATE
}
