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
 * A static route to be installed on a node. The destination is either
 * a subnet in CIDR notation or the name of a network service whose
 * subnet is used. The next hop is either an address or the name of a
 * network service whose gateway is used.
 */
public final class Route {
    private final String destination;

    private final String nextHop;

    /**
     * Create a route.
     * 
     * @param destination the destination subnet or service name
     * 
     * @param nextHop the gateway address or service name
     */
    public Route(String destination, String nextHop) {
        this.destination = destination;
        this.nextHop = nextHop;
    }

    /**
     * Get the destination.
     * 
     * @return the destination subnet or service name
     */
    public String getDestination() {
        return destination;
    }

    /**
     * Get the next hop.
     * 
     * @return the gateway address or service name
     */
    public String getNextHop() {
        return nextHop;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Route)) return false;
        Route other = (Route) obj;
        return destination.equals(other.destination) &&
            nextHop.equals(other.nextHop);
    }

    @Override
    public int hashCode() {
        return destination.hashCode() * 31 + nextHop.hashCode();
    }

    @Override
    public String toString() {
        return destination + " via " + nextHop;
    }
}
