package io.trialmesh.workflow;

/**
 * A step ready to execute. Steps with the same {@code parallelGroup} share a sequence number
 * and may run concurrently.
 */
public record RenderedStep(String name, int seq, String command, int parallelGroup) {
}
