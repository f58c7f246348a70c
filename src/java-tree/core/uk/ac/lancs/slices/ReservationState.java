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

/**
 * Describes the progress of an entity's reservation at the
 * orchestrator. The initial state is {@link #UNSUBMITTED}.
 * 
 * @resume A reservation state, as reported by the orchestrator
 */
public enum ReservationState {
    /**
     * The entity has not been reported by the orchestrator. This is the
     * initial state.
     */
    UNSUBMITTED("Unsubmitted") {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },

    /**
     * Resources have been promised to the entity, but not yet
     * allocated.
     */
    TICKETED("Ticketed") {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },

    /**
     * Resources are being allocated and configured.
     */
    PROVISIONING("Provisioning") {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },

    /**
     * The entity is usable.
     */
    ACTIVE("Active") {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },

    /**
     * The entity is usable, and a modification is pending.
     */
    ACTIVE_TICKETED("ActiveTicketed") {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },

    /**
     * The entity's resources are being released.
     */
    CLOSING("Closing") {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },

    /**
     * The entity's resources have been released.
     */
    CLOSED("Closed") {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },

    /**
     * The entity could not be provisioned.
     */
    FAILED("Failed") {
        @Override
        public boolean isTerminal() {
            return true;
        }
    };

    private final String label;

    ReservationState(String label) {
        this.label = label;
    }

    /**
     * Determine whether this state will not change without further
     * action by the user. The following states are terminal:
     * 
     * <ul>
     * 
     * <li>{@link #ACTIVE}
     * 
     * <li>{@link #ACTIVE_TICKETED}
     * 
     * <li>{@link #CLOSED}
     * 
     * <li>{@link #FAILED}
     * 
     * </ul>
     * 
     * @return {@code true} iff this is a terminal state
     */
    public abstract boolean isTerminal();

    /**
     * Determine whether an entity in this state is usable.
     * 
     * @return {@code true} iff this is {@link #ACTIVE} or
     * {@link #ACTIVE_TICKETED}
     */
    public boolean isActive() {
        return this == ACTIVE || this == ACTIVE_TICKETED;
    }

    /**
     * Get the label used for this state on the wire and in persisted
     * state.
     * 
     * @return the state's label
     */
    public String label() {
        return label;
    }

    /**
     * Parse a state label. Some legacy labels are also recognized:
     * <samp>Nascent</samp> and <samp>Redeeming</samp> map to
     * {@link #PROVISIONING}, and <samp>CloseWait</samp> maps to
     * {@link #CLOSING}.
     * 
     * @param label the label to parse
     * 
     * @return the matching state
     * 
     * @throws IllegalArgumentException if the label is not recognized
     */
    public static ReservationState fromLabel(String label) {
        for (ReservationState s : values())
            if (s.label.equals(label)) return s;
        switch (label) {
        case "Nascent":
        case "Redeeming":
            return PROVISIONING;
        case "CloseWait":
            return CLOSING;
        default:
            throw new IllegalArgumentException("unknown reservation state: "
                + label);
        }
    }
}
