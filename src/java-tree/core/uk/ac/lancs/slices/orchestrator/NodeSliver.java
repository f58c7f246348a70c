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

import java.net.InetAddress;

import uk.ac.lancs.slices.ReservationState;

/**
 * Reports the reservation of a node.
 */
public final class NodeSliver extends Sliver {
    /**
     * The management address, or {@code null} if not yet assigned
     */
    public final InetAddress managementAddress;

    /**
     * The physical host the node was placed on, or {@code null}
     */
    public final String host;

    /**
     * Create a node report.
     * 
     * @param name the node's name
     * 
     * @param reservationId the reservation identifier, or {@code null}
     * 
     * @param state the reservation state
     * 
     * @param errorMessage the reported error, or {@code null}
     * 
     * @param managementAddress the management address, or
     * {@code null}
     * 
     * @param host the physical host, or {@code null}
     */
    public NodeSliver(String name, String reservationId,
                      ReservationState state, String errorMessage,
                      InetAddress managementAddress, String host) {
        super(name, reservationId, state, errorMessage);
        this.managementAddress = managementAddress;
        this.host = host;
    }
}
