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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import uk.ac.lancs.slices.Interface;
import uk.ac.lancs.slices.Node;
import uk.ac.lancs.slices.Reconciler;
import uk.ac.lancs.slices.ReservationState;
import uk.ac.lancs.slices.ServiceType;
import uk.ac.lancs.slices.Slice;
import uk.ac.lancs.slices.SliceFixtures;
import uk.ac.lancs.slices.SliceState;
import uk.ac.lancs.slices.orchestrator.InterfaceSliver;
import uk.ac.lancs.slices.orchestrator.Orchestrator;
import uk.ac.lancs.slices.orchestrator.RejectedException;
import uk.ac.lancs.slices.orchestrator.ScriptedOrchestrator;
import uk.ac.lancs.slices.orchestrator.TopologySnapshot;
import uk.ac.lancs.slices.orchestrator.TransportException;
import uk.ac.lancs.slices.util.Backoff;
import uk.ac.lancs.slices.util.ManualPacer;

class StabilityPollerTest {
    private final Reconciler reconciler = new Reconciler();

    private final ManualPacer pacer = new ManualPacer(1000000);

    private final ScriptedOrchestrator orchestrator =
        new ScriptedOrchestrator();

    private Slice slice;

    private Interface if1;

    private Interface if2;

    @BeforeEach
    void setUp() throws Exception {
        slice = new Slice("ptp", null, SliceFixtures.keys());
        Node n1 = slice.addNode("n1", "STAR");
        Node n2 = slice.addNode("n2", "UTAH");
        if1 = n1.addComponent("NIC_ConnectX_5", "nic1").getInterfaces()
            .get(0);
        if2 = n2.addComponent("NIC_ConnectX_5", "nic1").getInterfaces()
            .get(0);
        slice.addNetworkService("link", ServiceType.L2PTP,
                                Arrays.asList(if1, if2));
        reconciler.accept(slice, SliceFixtures
            .uniform(slice, "s-9", ReservationState.TICKETED));
    }

    private StabilityPoller poller(int retries) {
        return new StabilityPoller(orchestrator, reconciler, pacer, retries,
                                   Backoff.fixed(500));
    }

    /**
     * Report everything active except the given interfaces, which are
     * ticketed and have no MAC yet.
     */
    private TopologySnapshot activeExcept(Interface... pending) {
        TopologySnapshot.Builder builder =
            SliceFixtures.report(slice, "s-9", ReservationState.ACTIVE);
        for (Interface iface : pending)
            builder.add(new InterfaceSliver(iface.getName(), null,
                                            ReservationState.TICKETED, null,
                                            null, null));
        return builder.build();
    }

    @Test
    void becomesStableAfterThirdPoll() throws Exception {
        orchestrator.then(activeExcept(if1, if2)).then(activeExcept(if2))
            .then(activeExcept());

        PollOutcome outcome = poller(3).await(slice, 20000, 1800000);

        assertThat(outcome).isEqualTo(PollOutcome.STABLE);
        assertThat(orchestrator.queries).isEqualTo(3);
        assertThat(pacer.sleeps()).containsExactly(20000L, 20000L);
        assertThat(slice.getState()).isEqualTo(SliceState.STABLE);
        assertThat(if1.getMac()).hasValueSatisfying(m -> assertThat(m)
            .isNotEmpty());
        assertThat(if2.getMac()).hasValueSatisfying(m -> assertThat(m)
            .isNotEmpty());
    }

    @Test
    void recoversFromTransportFailuresWithinBudget() throws Exception {
        orchestrator.thenFail(3).then(activeExcept());

        assertThat(poller(3).await(slice, 20000, 1800000))
            .isEqualTo(PollOutcome.STABLE);
        assertThat(orchestrator.queries).isEqualTo(4);
        assertThat(pacer.sleeps()).containsExactly(500L, 500L, 500L);
    }

    @Test
    void failureCountResetsAfterSuccess() throws Exception {
        orchestrator.thenFail(2).then(activeExcept(if1)).thenFail(2)
            .then(activeExcept());

        assertThat(poller(2).await(slice, 1000, 1800000))
            .isEqualTo(PollOutcome.STABLE);
    }

    @Test
    void reportsPollingFailureWhenBudgetExceeded() {
        orchestrator.thenFail(4).then(activeExcept());

        assertThatThrownBy(() -> poller(3).await(slice, 20000, 1800000))
            .isInstanceOfSatisfying(PollingFailedException.class, ex -> {
                assertThat(ex.getFailures()).isEqualTo(4);
                assertThat(ex.getCause())
                    .isInstanceOf(TransportException.class);
            });
        assertThat(orchestrator.queries).isEqualTo(4);
        assertThat(slice.getState()).isEqualTo(SliceState.PENDING);
    }

    @Test
    void timesOutKeepingLastState() throws Exception {
        orchestrator.then(activeExcept(if1));

        PollOutcome outcome = poller(3).await(slice, 1000, 3500);

        assertThat(outcome).isEqualTo(PollOutcome.TIMED_OUT);
        assertThat(orchestrator.queries).isEqualTo(5);
        assertThat(pacer.sleeps()).containsExactly(1000L, 1000L, 1000L,
                                                   500L);
        assertThat(slice.getState()).isEqualTo(SliceState.PENDING);
        assertThat(slice.getNode("n1").getReservationState())
            .isEqualTo(ReservationState.ACTIVE);
    }

    @Test
    void stopsOnFailure() throws Exception {
        TopologySnapshot.Builder builder =
            SliceFixtures.report(slice, "s-9", ReservationState.ACTIVE);
        builder.add(new InterfaceSliver(if2.getName(), null,
                                        ReservationState.FAILED,
                                        "insufficient resources", null,
                                        null));
        orchestrator.then(activeExcept(if1)).then(builder.build());

        assertThat(poller(3).await(slice, 1000, 60000))
            .isEqualTo(PollOutcome.FAILED);
        assertThat(orchestrator.queries).isEqualTo(2);
        assertThat(slice.getErrorMessages())
            .containsValue("insufficient resources");
    }

    @Test
    void honoursCancellation() throws Exception {
        orchestrator.then(activeExcept(if1));
        AtomicInteger checks = new AtomicInteger();

        PollOutcome outcome = poller(3)
            .await(slice, Backoff.fixed(1000), 60000,
                   () -> checks.incrementAndGet() > 2);

        assertThat(outcome).isEqualTo(PollOutcome.CANCELLED);
        assertThat(orchestrator.queries).isEqualTo(2);
    }

    @Test
    void growsIntervalWithBackoff() throws Exception {
        orchestrator.then(activeExcept(if1)).then(activeExcept(if1))
            .then(activeExcept(if1)).then(activeExcept());

        poller(3).await(slice, new Backoff(1000, 2.0, 3000), 60000,
                        () -> false);

        assertThat(pacer.sleeps()).containsExactly(1000L, 2000L, 3000L);
    }

    @Test
    void propagatesRejection() {
        orchestrator.thenReject(404, "no such slice");

        assertThatThrownBy(() -> poller(3).await(slice, 1000, 60000))
            .isInstanceOfSatisfying(RejectedException.class,
                                    ex -> assertThat(ex.getStatus())
                                        .isEqualTo(404));
    }

    @Test
    void refusesUnsubmittedSlice() throws Exception {
        Slice fresh = SliceFixtures.bridgedPair("fresh");
        assertThatThrownBy(() -> poller(3).await(fresh, 1000, 60000))
            .isInstanceOf(IllegalStateException.class);
        assertThat(orchestrator.queries).isZero();
    }

    @Test
    void refusesConcurrentWaitOnSameSlice() throws Exception {
        AtomicReference<StabilityPoller> self = new AtomicReference<>();
        AtomicReference<Throwable> nested = new AtomicReference<>();
        TopologySnapshot done = activeExcept();
        Orchestrator reentrant = new Orchestrator() {
            @Override
            public TopologySnapshot submit(Slice s, Collection<String> keys) {
                throw new UnsupportedOperationException();
            }

            @Override
            public TopologySnapshot query(String sliceId) {
                try {
                    self.get().await(slice, 1000, 1000);
                } catch (Throwable t) {
                    nested.set(t);
                }
                return done;
            }

            @Override
            public void delete(String sliceId) {}

            @Override
            public void renew(String sliceId, Instant leaseEnd) {}
        };
        StabilityPoller poller = new StabilityPoller(reentrant, reconciler,
                                                     pacer, 3,
                                                     Backoff.fixed(500));
        self.set(poller);

        assertThat(poller.await(slice, 1000, 60000))
            .isEqualTo(PollOutcome.STABLE);
        assertThat(nested.get()).isInstanceOf(IllegalStateException.class);

        /* Released afterwards */
        assertThat(poller.await(slice, 1000, 60000))
            .isEqualTo(PollOutcome.STABLE);
    }
}
