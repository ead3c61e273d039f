package com.example.slides.orchestrator;

public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
