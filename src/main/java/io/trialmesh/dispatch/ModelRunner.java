package io.trialmesh.dispatch;

import io.trialmesh.workflow.RenderedStep;

/**
 * Executes one rendered workflow step of the external model.
 */
public interface ModelRunner {
    ModelResult run(RunContext context, RenderedStep step, long timeoutMs) throws Exception;
}
