package io.trialmesh.dispatch;

public enum JobState {
    PENDING,
    RUNNING,
    DONE,
    UNKNOWN;

    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }
}
