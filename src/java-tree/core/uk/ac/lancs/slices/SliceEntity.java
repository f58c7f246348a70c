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

import java.util.Optional;

/**
 * An element of a slice that the orchestrator reserves separately, and
 * reports on with its own reservation state.
 * 
 * <p>
 * Reservation fields are written only by a {@link Reconciler} while
 * holding the slice's lock, and are read under the same lock.
 */
public abstract class SliceEntity {
    final Slice slice;

    private final String name;

    private String reservationId;

    private ReservationState state = ReservationState.UNSUBMITTED;

    private String errorMessage;

    SliceEntity(Slice slice, String name) {
        this.slice = slice;
        this.name = name;
    }

    /**
     * Get the slice containing this entity.
     * 
     * @return the containing slice
     */
    public final Slice getSlice() {
        return slice;
    }

    /**
     * Get the entity's name, unique among entities of its kind in the
     * slice.
     * 
     * @return the entity's name
     */
    public String getName() {
        return name;
    }

    /**
     * Get the orchestrator's identifier for this entity's reservation.
     * 
     * @return the reservation identifier, if assigned
     */
    public Optional<String> getReservationId() {
        synchronized (slice.lock) {
            return Optional.ofNullable(reservationId);
        }
    }

    /**
     * Get the reservation state last reported for this entity.
     * 
     * @return the reservation state
     */
    public ReservationState getReservationState() {
        synchronized (slice.lock) {
            return state;
        }
    }

    /**
     * Get the error last reported for this entity.
     * 
     * @return the error message, if any
     */
    public Optional<String> getErrorMessage() {
        synchronized (slice.lock) {
            return Optional.ofNullable(errorMessage);
        }
    }

    void setReservation(String reservationId, ReservationState state,
                        String errorMessage) {
        assert Thread.holdsLock(slice.lock);
        if (reservationId != null) this.reservationId = reservationId;
        this.state = state;
        this.errorMessage = errorMessage;
    }

    /**
     * Get a short description of the kind of entity, e.g.,
     * <samp>node</samp>.
     * 
     * @return the entity kind
     */
    public abstract String kind();

    @Override
    public String toString() {
        return kind() + " " + name;
    }
}
