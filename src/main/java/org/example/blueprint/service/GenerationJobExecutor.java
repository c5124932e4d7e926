package org.example.blueprint.service;

import org.example.blueprint.model.BatchConfigSnapshot;

import java.util.concurrent.Future;

/**
 * Executes one generation job against the external API.
 *
 * <p>The external call must start as soon as {@code execute} returns: the caller takes its rate
 * limit permit right before submitting and starts the attempt timeout at submission. Cancelling the
 * returned future with {@code mayInterruptIfRunning} must interrupt the call.
 */
public interface GenerationJobExecutor {

    /**
     * @param input  the job's seed text
     * @param config the batch's run parameters
     * @return a future completing with an opaque result location (persisted, never interpreted),
     *         or failing with the error to classify
     */
    Future<String> execute(String input, BatchConfigSnapshot config);
}
