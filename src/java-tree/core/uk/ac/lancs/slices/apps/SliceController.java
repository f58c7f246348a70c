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

package uk.ac.lancs.slices.apps;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

import uk.ac.lancs.slices.InvalidStateException;
import uk.ac.lancs.slices.NetworkService;
import uk.ac.lancs.slices.Node;
import uk.ac.lancs.slices.ReservationState;
import uk.ac.lancs.slices.Reconciler;
import uk.ac.lancs.slices.Slice;
import uk.ac.lancs.slices.SliceState;
import uk.ac.lancs.slices.TopologyException;
import uk.ac.lancs.slices.boot.ConfigurationReport;
import uk.ac.lancs.slices.boot.PostBootConfigurator;
import uk.ac.lancs.slices.orchestrator.Orchestrator;
import uk.ac.lancs.slices.orchestrator.RejectedException;
import uk.ac.lancs.slices.orchestrator.TopologySnapshot;
import uk.ac.lancs.slices.orchestrator.TransportException;
import uk.ac.lancs.slices.ssh.RemoteChannel;
import uk.ac.lancs.slices.sync.PollOutcome;
import uk.ac.lancs.slices.sync.PollingFailedException;
import uk.ac.lancs.slices.sync.StabilityPoller;
import uk.ac.lancs.slices.util.Backoff;
import uk.ac.lancs.slices.util.Pacer;

/**
 * Drives slices through their lifecycle: submission, waiting for
 * stability and for SSH access, configuration, renewal and deletion.
 * 
 * @author simpsons
 */
public final class SliceController {
    private static final Logger logger =
        Logger.getLogger("uk.ac.lancs.slices.apps");

    /**
     * The lease granted to a slice submitted without a lease end
     */
    public static final Duration DEFAULT_LEASE = Duration.ofHours(24);

    private final Orchestrator orchestrator;

    private final Reconciler reconciler;

    private final StabilityPoller poller;

    private final RemoteChannel channel;

    private final PostBootConfigurator configurator;

    private final Pacer pacer;

    private final Backoff pollInterval;

    private final long pollTimeoutMillis;

    /**
     * Create a controller from its collaborators.
     * 
     * @param orchestrator the orchestrator managing slices
     * 
     * @param reconciler the sole writer of reported state
     * 
     * @param poller the means to wait for slices to settle
     * 
     * @param channel the channel to slice nodes
     * 
     * @param configurator the means to configure slice nodes
     * 
     * @param pacer the source of time and delays
     * 
     * @param pollInterval the schedule of polls when waiting
     * 
     * @param pollTimeoutMillis the default time allowed to wait
     */
    public SliceController(Orchestrator orchestrator, Reconciler reconciler,
                           StabilityPoller poller, RemoteChannel channel,
                           PostBootConfigurator configurator, Pacer pacer,
                           Backoff pollInterval, long pollTimeoutMillis) {
        this.orchestrator = orchestrator;
        this.reconciler = reconciler;
        this.poller = poller;
        this.channel = channel;
        this.configurator = configurator;
        this.pacer = pacer;
        this.pollInterval = pollInterval;
        this.pollTimeoutMillis = pollTimeoutMillis;
    }

    /**
     * Create a controller for a testbed.
     * 
     * @param context the testbed settings
     * 
     * @param reconciler the sole writer of reported state
     * 
     * @return the new controller
     */
    public static SliceController create(TestbedContext context,
                                         Reconciler reconciler) {
        Pacer pacer = Pacer.SYSTEM;
        Orchestrator orch = context.newOrchestrator();
        RemoteChannel channel = context.newRemoteChannel(pacer);
        return new SliceController(orch, reconciler,
                                   context.newPoller(orch, reconciler, pacer),
                                   channel,
                                   context.newConfigurator(channel, reconciler,
                                                           context
                                                               .newExecutor()),
                                   pacer, context.pollInterval(),
                                   context.pollTimeoutMillis());
    }

    /**
     * Submit a slice. The slice is validated, given a lease of
     * {@link #DEFAULT_LEASE} if it has none, and sent to the
     * orchestrator with its public key and any extra keys. The
     * orchestrator's initial report is then merged.
     * 
     * @param slice the slice to submit
     * 
     * @param extraKeys additional public keys to install on nodes
     * 
     * @return the slice's state after merging the initial report
     * 
     * @throws TopologyException if the slice is invalid, or has
     * already been submitted
     * 
     * @throws IOException if the public key could not be read
     * 
     * @throws TransportException if the orchestrator could not be
     * reached
     * 
     * @throws RejectedException if the orchestrator refused the slice
     */
    public SliceState submit(Slice slice, Collection<String> extraKeys)
        throws TopologyException,
            IOException,
            TransportException,
            RejectedException {
        if (slice.getState() != SliceState.UNSUBMITTED)
            throw new InvalidStateException(slice + " already submitted");
        slice.validate();
        if (!slice.getLeaseEnd().isPresent())
            slice.setLeaseEnd(Instant.ofEpochMilli(pacer.now())
                .plus(DEFAULT_LEASE));
        Set<String> keys = new LinkedHashSet<>();
        keys.add(slice.getKeys().readPublicKey());
        keys.addAll(extraKeys);
        TopologySnapshot initial =
            orchestrator.submit(slice, new ArrayList<>(keys));
        SliceState state = reconciler.accept(slice, initial);
        logger.info(() -> slice + " submitted: " + state);
        return state;
    }

    /**
     * Query a slice once, and merge the result.
     * 
     * @param slice the slice to refresh
     * 
     * @return the slice's aggregate state
     * 
     * @throws TransportException if the orchestrator could not be
     * reached
     * 
     * @throws RejectedException if the orchestrator refused the query
     * 
     * @throws IllegalStateException if the slice has not been
     * submitted, or has been deleted
     */
    public SliceState refresh(Slice slice)
        throws TransportException,
            RejectedException {
        String id = sliceId(slice);
        if (slice.getState() == SliceState.DELETED)
            throw new IllegalStateException(slice + " deleted");
        return reconciler.merge(slice, orchestrator.query(id));
    }

    /**
     * Wait for a slice to settle, using the default schedule and
     * timeout.
     * 
     * @param slice the submitted slice
     * 
     * @return how the wait ended
     * 
     * @throws PollingFailedException if the orchestrator was
     * persistently unreachable
     * 
     * @throws RejectedException if the orchestrator refused a query
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted
     */
    public PollOutcome waitStable(Slice slice)
        throws PollingFailedException,
            RejectedException,
            InterruptedException {
        return waitStable(slice, pollTimeoutMillis, () -> false);
    }

    /**
     * Wait for a slice to settle.
     * 
     * @param slice the submitted slice
     * 
     * @param timeoutMillis the time allowed
     * 
     * @param cancelled tested before each poll to see whether to give
     * up
     * 
     * @return how the wait ended
     * 
     * @throws PollingFailedException if the orchestrator was
     * persistently unreachable
     * 
     * @throws RejectedException if the orchestrator refused a query
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted
     */
    public PollOutcome waitStable(Slice slice, long timeoutMillis,
                                  BooleanSupplier cancelled)
        throws PollingFailedException,
            RejectedException,
            InterruptedException {
        PollOutcome outcome =
            poller.await(slice, pollInterval, timeoutMillis, cancelled);
        if (outcome == PollOutcome.FAILED)
            logger.warning(() -> slice + " failed: "
                + slice.getErrorMessages());
        else
            logger.info(() -> slice + " wait ended: " + outcome);
        return outcome;
    }

    /**
     * Wait until every node of a stable slice accepts SSH connections.
     * Nodes are probed in turn, and those that answer are not probed
     * again.
     * 
     * @param slice the slice
     * 
     * @param timeoutMillis the time allowed
     * 
     * @return {@code true} if all nodes answered in time
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted
     */
    public boolean waitSSH(Slice slice, long timeoutMillis)
        throws InterruptedException {
        final long deadline = pacer.now() + timeoutMillis;
        List<Node> pending = new ArrayList<>(slice.getNodes());
        int round = 0;
        while (true) {
            for (Iterator<Node> iter = pending.iterator(); iter.hasNext();)
                if (channel.testSSH(iter.next())) iter.remove();
            if (pending.isEmpty()) return true;
            long remaining = deadline - pacer.now();
            if (remaining <= 0) {
                logger.warning(() -> "no SSH to " + pending);
                return false;
            }
            pacer.sleep(Math.min(remaining, pollInterval.delay(++round)));
        }
    }

    /**
     * Configure every node of a slice.
     * 
     * @param slice the slice
     * 
     * @return the outcome for each node
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted
     */
    public ConfigurationReport configure(Slice slice)
        throws InterruptedException {
        return configurator.configure(slice);
    }

    /**
     * Extend a slice's lease.
     * 
     * @param slice the slice
     * 
     * @param leaseEnd the new lease end
     * 
     * @throws TransportException if the orchestrator could not be
     * reached
     * 
     * @throws RejectedException if the orchestrator refused the renewal
     */
    public void renew(Slice slice, Instant leaseEnd)
        throws TransportException,
            RejectedException {
        orchestrator.renew(sliceId(slice), leaseEnd);
        reconciler.recordLeaseEnd(slice, leaseEnd);
        logger.info(() -> slice + " renewed until " + leaseEnd);
    }

    /**
     * Delete a slice. Deleting a deleted slice has no effect.
     * 
     * @param slice the slice
     * 
     * @throws TransportException if the orchestrator could not be
     * reached
     * 
     * @throws RejectedException if the orchestrator refused the
     * deletion
     */
    public void delete(Slice slice)
        throws TransportException,
            RejectedException {
        if (slice.getState() == SliceState.DELETED) return;
        orchestrator.delete(sliceId(slice));
        reconciler.markDeleted(slice);
    }

    /**
     * Determine whether a slice is ready for use. It must be stable,
     * every node must be active with a management address, and every
     * layer-3 service must have a subnet and gateway.
     * 
     * @param slice the slice
     * 
     * @return {@code true} if the slice is ready
     */
    public static boolean isReady(Slice slice) {
        return slice.read(() -> {
            if (slice.getState() != SliceState.STABLE) return false;
            for (Node node : slice.getNodes()) {
                ReservationState rs = node.getReservationState();
                if (!rs.isActive() || !node.getManagementAddress().isPresent())
                    return false;
            }
            for (NetworkService svc : slice.getNetworkServices())
                if (svc.getType().isLayer3() &&
                    (!svc.getSubnet().isPresent() ||
                        !svc.getGateway().isPresent()))
                    return false;
            return true;
        });
    }

    private static String sliceId(Slice slice) {
        return slice.getSliceId()
            .orElseThrow(() -> new IllegalStateException(slice
                + " not submitted"));
    }
}
