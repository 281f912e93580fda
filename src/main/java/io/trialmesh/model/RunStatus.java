package io.trialmesh.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum RunStatus {
    PENDING,
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    ABORTED;

    public static final Set<RunStatus> ACTIVE = EnumSet.of(PENDING, QUEUED, RUNNING);
    public static final Set<RunStatus> TERMINAL = EnumSet.of(SUCCEEDED, FAILED, ABORTED);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public static RunStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Run status must not be blank");
        }
        try {
            return RunStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown run status: " + raw, e);
        }
    }
}
