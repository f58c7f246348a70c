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

package uk.ac.lancs.slices.orchestrator;

import uk.ac.lancs.slices.ReservationState;

/**
 * Reports the reservation of an interface.
 */
public final class InterfaceSliver extends Sliver {
    /**
     * The MAC address, or {@code null}
     */
    public final String mac;

    /**
     * The VLAN assigned to the interface, or {@code null}
     */
    public final Integer vlan;

    /**
     * Create an interface report.
     * 
     * @param name the interface's name
     * 
     * @param reservationId the reservation identifier, or {@code null}
     * 
     * @param state the reservation state
     * 
     * @param errorMessage the reported error, or {@code null}
     * 
     * @param mac the MAC address, or {@code null}
     * 
     * @param vlan the assigned VLAN, or {@code null}
     */
    public InterfaceSliver(String name, String reservationId,
                           ReservationState state, String errorMessage,
                           String mac, Integer vlan) {
        super(name, reservationId, state, errorMessage);
        this.mac = mac;
        this.vlan = vlan;
    }
}
