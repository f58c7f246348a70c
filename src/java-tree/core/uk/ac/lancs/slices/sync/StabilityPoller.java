/*
 * Copyright 2026, Regents of the University of Lancaster
 * All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are
 * met:
 * 
 *  * Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 
 *  * Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the
 *    distribution.
 * 
 *  * Neither the name of the University of Lancaster nor the names of
 *    its contributors may be used to endorse or promote products derived
 *    from this software without specific prior written permission.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
 * "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
 * LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
 * A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
 * OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
 * SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
 * LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package uk.ac.lancs.slices.sync;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

import uk.ac.lancs.slices.Reconciler;
import uk.ac.lancs.slices.Slice;
import uk.ac.lancs.slices.SliceState;
import uk.ac.lancs.slices.orchestrator.Orchestrator;
import uk.ac.lancs.slices.orchestrator.RejectedException;
import uk.ac.lancs.slices.orchestrator.TopologySnapshot;
import uk.ac.lancs.slices.orchestrator.TransportException;
import uk.ac.lancs.slices.util.Backoff;
import uk.ac.lancs.slices.util.Pacer;

/**
 * Polls the orchestrator until a slice becomes stable or fails, merging
 * each snapshot as it arrives.
 * 
 * <p>
 * Transport failures are tolerated up to a limit of consecutive
 * failures. The count resets on each successful poll. Only one poll
 * loop may run per slice at a time.
 */
public final class StabilityPoller {
    private static final Logger logger =
        Logger.getLogger("uk.ac.lancs.slices.sync");

    private final Orchestrator orchestrator;

    private final Reconciler reconciler;

    private final Pacer pacer;

    private final int transportRetries;

    private final Backoff retryBackoff;

    private final Set<Slice> active =
        Collections.newSetFromMap(new IdentityHashMap<>());

    /**
     * Create a poller.
     * 
     * @param orchestrator the orchestrator to query
     * 
     * @param reconciler the reconciler to merge snapshots with
     * 
     * @param pacer the source of time and delays
     * 
     * @param transportRetries the number of consecutive transport
     * failures tolerated
     * 
     * @param retryBackoff the delays before retrying after transport
     * failures
     */
    public StabilityPoller(Orchestrator orchestrator, Reconciler reconciler,
                           Pacer pacer, int transportRetries,
                           Backoff retryBackoff) {
        this.orchestrator = orchestrator;
        this.reconciler = reconciler;
        this.pacer = pacer;
        this.transportRetries = transportRetries;
        this.retryBackoff = retryBackoff;
    }

    /**
     * Wait for a slice to settle, polling at a fixed interval.
     * 
     * @param slice the submitted slice
     * 
     * @param intervalMillis the delay between polls
     * 
     * @param timeoutMillis the maximum time to wait
     * 
     * @return how the wait ended
     * 
     * @throws PollingFailedException if too many consecutive polls
     * failed to reach the orchestrator
     * 
     * @throws RejectedException if the orchestrator refused a query
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted
     */
    public PollOutcome await(Slice slice, long intervalMillis,
                             long timeoutMillis)
        throws PollingFailedException,
            RejectedException,
            InterruptedException {
        return await(slice, Backoff.fixed(intervalMillis), timeoutMillis,
                     () -> false);
    }

    /**
     * Wait for a slice to settle. The slice is polled immediately,
     * and then after each delay given by the interval schedule, until
     * its aggregate state is {@link SliceState#STABLE} or
     * {@link SliceState#FAILED}, or the deadline passes. A final poll
     * is made at the deadline. Cancellation is checked before each
     * poll. The slice retains the state of the last successful merge
     * however the wait ends.
     * 
     * @param slice the submitted slice
     * 
     * @param interval the delays between polls
     * 
     * @param timeoutMillis the maximum time to wait
     * 
     * @param cancelled tested before each poll to see whether the
     * caller has given up
     * 
     * @return how the wait ended
     * 
     * @throws PollingFailedException if too many consecutive polls
     * failed to reach the orchestrator
     * 
     * @throws RejectedException if the orchestrator refused a query
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted
     * 
     * @throws IllegalStateException if the slice has not been
     * submitted, or is already being waited on
     */
    public PollOutcome await(Slice slice, Backoff interval,
                             long timeoutMillis, BooleanSupplier cancelled)
        throws PollingFailedException,
            RejectedException,
            InterruptedException {
        final String sliceId = slice.getSliceId()
            .orElseThrow(() -> new IllegalStateException(slice
                + " not submitted"));
        synchronized (active) {
            if (!active.add(slice))
                throw new IllegalStateException(slice
                    + " already being polled");
        }
        try {
            final long deadline = pacer.now() + timeoutMillis;
            int failures = 0;
            int polls = 0;
            while (true) {
                if (cancelled.getAsBoolean()) {
                    logger.info(() -> "stopped waiting for " + slice);
                    return PollOutcome.CANCELLED;
                }

                TopologySnapshot snapshot;
                try {
                    snapshot = orchestrator.query(sliceId);
                    failures = 0;
                } catch (TransportException ex) {
                    failures++;
                    if (failures > transportRetries)
                        throw new PollingFailedException("cannot poll "
                            + slice + " after " + failures + " attempts",
                                                         failures, ex);
                    logger.warning("poll " + failures + " of " + slice
                        + " failed: " + ex.getMessage());
                    long remaining = deadline - pacer.now();
                    if (remaining <= 0) return PollOutcome.TIMED_OUT;
                    pacer.sleep(Math.min(retryBackoff.delay(failures),
                                         remaining));
                    continue;
                }

                polls++;
                SliceState state = reconciler.merge(slice, snapshot);
                switch (state) {
                case STABLE:
                    logger.info(slice + " stable after " + polls + " poll(s)");
                    return PollOutcome.STABLE;
                case FAILED:
                    logger.warning(slice + " failed: "
                        + slice.getErrorMessages());
                    return PollOutcome.FAILED;
                default:
                    break;
                }

                long remaining = deadline - pacer.now();
                if (remaining <= 0) {
                    logger.warning("timed out waiting for " + slice);
                    return PollOutcome.TIMED_OUT;
                }
                pacer.sleep(Math.min(interval.delay(polls), remaining));
            }
        } finally {
            synchronized (active) {
                active.remove(slice);
            }
        }
    }
}
