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

package uk.ac.lancs.slices;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import uk.ac.lancs.slices.orchestrator.ComponentSliver;
import uk.ac.lancs.slices.orchestrator.InterfaceSliver;
import uk.ac.lancs.slices.orchestrator.NodeSliver;
import uk.ac.lancs.slices.orchestrator.ServiceSliver;
import uk.ac.lancs.slices.orchestrator.TopologySnapshot;

/**
 * Applies orchestrator snapshots and configuration results to slices.
 * This is the only writer of reported state. Each operation holds the
 * slice's lock for its whole duration, so concurrent merges into the
 * same slice are serialized, and readers never observe a snapshot
 * partially applied.
 * 
 * <p>
 * Merging is by entity name, and overwrites reported fields. Merging
 * the same snapshot twice therefore leaves the slice as it was after
 * the first merge. Entities absent from a snapshot are left untouched,
 * and entities in a snapshot but not in the slice are ignored.
 */
public final class Reconciler {
    private static final Logger logger =
        Logger.getLogger("uk.ac.lancs.slices");

    /**
     * Record that the orchestrator has accepted a slice, and merge the
     * initial snapshot.
     * 
     * @param slice the submitted slice
     * 
     * @param initial the snapshot returned on submission
     * 
     * @return the slice's aggregate state after the merge
     * 
     * @throws InvalidStateException if the slice has already been
     * submitted
     */
    public SliceState accept(Slice slice, TopologySnapshot initial)
        throws InvalidStateException {
        synchronized (slice.lock) {
            slice.checkUnsubmitted();
            slice.setSliceId(initial.sliceId());
            slice.setState(SliceState.SUBMITTED);
            logger.info(() -> slice + " accepted as " + initial.sliceId());
            return apply(slice, initial);
        }
    }

    /**
     * Merge a snapshot into a slice, and update the slice's aggregate
     * state.
     * 
     * @param slice the slice to update
     * 
     * @param snapshot the snapshot to merge
     * 
     * @return the slice's aggregate state after the merge
     * 
     * @throws IllegalStateException if the slice has not been submitted
     * or has been deleted
     * 
     * @throws IllegalArgumentException if the snapshot is of a
     * different slice
     */
    public SliceState merge(Slice slice, TopologySnapshot snapshot) {
        synchronized (slice.lock) {
            SliceState current = slice.getState();
            if (current == SliceState.UNSUBMITTED ||
                current == SliceState.DELETED)
                throw new IllegalStateException(slice + " is "
                    + current.name().toLowerCase());
            return apply(slice, snapshot);
        }
    }

    private SliceState apply(Slice slice, TopologySnapshot snapshot) {
        assert Thread.holdsLock(slice.lock);
        String expected = slice.getSliceId().orElse(null);
        if (!snapshot.sliceId().equals(expected))
            throw new IllegalArgumentException("snapshot of "
                + snapshot.sliceId() + " applied to " + expected);

        int reported = 0;
        slice.setLease(snapshot.leaseStart(), snapshot.leaseEnd());
        for (Node node : slice.getNodes()) {
            NodeSliver ns = snapshot.nodes().get(node.getName());
            if (ns != null) {
                node.setReservation(ns.reservationId, ns.state,
                                    ns.errorMessage);
                node.setManagementAddress(ns.managementAddress);
                node.setPlacedHost(ns.host);
                reported++;
            }
            for (Component comp : node.components()) {
                ComponentSliver cs = snapshot.components().get(comp.getName());
                if (cs != null) {
                    comp.setReservation(cs.reservationId, cs.state,
                                        cs.errorMessage);
                    comp.setPciAddress(cs.pciAddress);
                    reported++;
                }
                for (Interface iface : comp.getInterfaces()) {
                    InterfaceSliver is =
                        snapshot.interfaces().get(iface.getName());
                    if (is == null) continue;
                    iface.setReservation(is.reservationId, is.state,
                                         is.errorMessage);
                    if (is.mac != null) iface.setMac(is.mac);
                    iface.setReportedVlan(is.vlan);
                    reported++;
                }
            }
        }
        for (NetworkService svc : slice.getNetworkServices()) {
            ServiceSliver ss = snapshot.services().get(svc.getName());
            if (ss == null) continue;
            svc.setReservation(ss.reservationId, ss.state, ss.errorMessage);
            svc.setAssignment(ss.subnet, ss.gateway);
            reported++;
        }

        SliceState before = slice.getState();
        SliceState after = aggregate(slice);
        slice.setState(after);
        final int count = reported;
        logger.fine(() -> "merged " + count + " report(s) into " + slice
            + ": " + after.name().toLowerCase());
        if (before != after)
            logger.info(() -> slice + " now " + after.name().toLowerCase());
        return after;
    }

    /**
     * Compute the aggregate state of a slice's entities. The slice is
     * {@link SliceState#FAILED} if any entity has failed, even if it is
     * excluded from stability checks. Otherwise, it is
     * {@link SliceState#STABLE} if every entity not excluded is
     * {@linkplain ReservationState#isActive() active}, and
     * {@link SliceState#PENDING} if not.
     * 
     * @param slice the slice to examine
     * 
     * @return the aggregate state
     */
    public static SliceState aggregate(Slice slice) {
        return slice.read(() -> {
            boolean pending = false;
            for (SliceEntity entity : slice.getEntities()) {
                ReservationState rs = entity.getReservationState();
                if (rs == ReservationState.FAILED) return SliceState.FAILED;
                if (!rs.isActive() && !slice.isExcludedFromStability(entity))
                    pending = true;
            }
            return pending ? SliceState.PENDING : SliceState.STABLE;
        });
    }

    /**
     * Record that a slice has been deleted. Further merges are
     * rejected.
     * 
     * @param slice the deleted slice
     */
    public void markDeleted(Slice slice) {
        synchronized (slice.lock) {
            slice.setState(SliceState.DELETED);
        }
        logger.info(() -> slice + " deleted");
    }

    /**
     * Record a new lease end after renewal.
     * 
     * @param slice the renewed slice
     * 
     * @param leaseEnd the new lease end
     */
    public void recordLeaseEnd(Slice slice, Instant leaseEnd) {
        synchronized (slice.lock) {
            slice.setLease(null, leaseEnd);
        }
    }

    /**
     * Record the outcome of configuring an interface.
     * 
     * @param iface the configured interface
     * 
     * @param deviceName the OS device the interface was matched to
     * 
     * @param addresses the addresses configured on the device
     */
    public void recordConfiguration(Interface iface, String deviceName,
                                    List<CidrAddress> addresses) {
        synchronized (iface.slice.lock) {
            iface.setDeviceName(deviceName);
            iface.setAssignedAddresses(addresses);
        }
    }

    /**
     * Record that a node's post-boot tasks have run.
     * 
     * @param node the node
     */
    public void markInstantiated(Node node) {
        synchronized (node.slice.lock) {
            node.setInstantiated(true);
        }
    }

    /**
     * Restore saved state into a slice rebuilt from its saved request.
     * 
     * @param slice the rebuilt slice, not yet submitted
     * 
     * @param state the saved lifecycle state
     * 
     * @param snapshot the saved reports, or {@code null} if the slice
     * was never submitted
     * 
     * @param instantiated the names of nodes whose post-boot tasks
     * have run
     * 
     * @param devices the saved device name of each interface, by
     * interface name
     * 
     * @param addresses the saved addresses of each interface, by
     * interface name
     * 
     * @throws InvalidStateException if the slice has already been
     * submitted
     */
    public void restore(Slice slice, SliceState state,
                        TopologySnapshot snapshot,
                        Collection<String> instantiated,
                        Map<String, String> devices,
                        Map<String, List<CidrAddress>> addresses)
        throws InvalidStateException {
        synchronized (slice.lock) {
            slice.checkUnsubmitted();
            if (snapshot != null) {
                slice.setSliceId(snapshot.sliceId());
                slice.setState(SliceState.SUBMITTED);
                apply(slice, snapshot);
            }
            slice.setState(state);
            for (Node node : slice.getNodes())
                node.setInstantiated(instantiated.contains(node.getName()));
            for (Interface iface : slice.getInterfaces()) {
                iface.setDeviceName(devices.get(iface.getName()));
                List<CidrAddress> addrs = addresses.get(iface.getName());
                if (addrs != null) iface.setAssignedAddresses(addrs);
            }
        }
    }
}
