package de.medicore.triage.engine;

public enum ModelState {
    UNINITIALIZED,
    READY,
    DEGRADED
}
