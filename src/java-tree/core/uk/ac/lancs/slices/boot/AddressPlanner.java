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

package uk.ac.lancs.slices.boot;

import java.math.BigInteger;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import uk.ac.lancs.slices.AddressMode;
import uk.ac.lancs.slices.CidrAddress;
import uk.ac.lancs.slices.Interface;
import uk.ac.lancs.slices.NetworkService;
import uk.ac.lancs.slices.Slice;
import uk.ac.lancs.slices.Subnet;

/**
 * Decides which addresses each interface of a slice should carry.
 * 
 * <p>
 * Interfaces in {@link AddressMode#MANUAL} mode get their own address.
 * Interfaces in {@link AddressMode#AUTO} mode attached to a service
 * with a known subnet get the address they were given before, if it is
 * still in the subnet, or else the lowest free host address. The
 * network address, the IPv4 broadcast address, the gateway and all
 * manual addresses are never allocated. Members are considered in
 * service order, so the plan is the same each time for the same slice.
 */
final class AddressPlanner {
    private AddressPlanner() {}

    static Map<Interface, List<CidrAddress>> plan(Slice slice) {
        return slice.read(() -> planLocked(slice));
    }

    private static Map<Interface, List<CidrAddress>>
        planLocked(Slice slice) {
        Map<Interface, List<CidrAddress>> result = new LinkedHashMap<>();
        for (NetworkService svc : slice.getNetworkServices()) {
            Optional<Subnet> subnet = svc.getSubnet();
            List<Interface> members = svc.getInterfaces();
            Set<InetAddress> taken = new HashSet<>();
            svc.getGateway().ifPresent(taken::add);
            for (Interface iface : members)
                iface.getManualAddress()
                    .ifPresent(a -> taken.add(a.getAddress()));

            /* Keep earlier allocations stable. */
            Map<Interface, CidrAddress> kept = new LinkedHashMap<>();
            if (subnet.isPresent()) {
                for (Interface iface : members) {
                    if (iface.getMode() != AddressMode.AUTO) continue;
                    for (CidrAddress prev : iface.getAssignedAddresses()) {
                        if (prev.getSubnet().equals(subnet.get()) &&
                            taken.add(prev.getAddress())) {
                            kept.put(iface, prev);
                            break;
                        }
                    }
                }
            }

            BigInteger next = BigInteger.ONE;
            for (Interface iface : members) {
                switch (iface.getMode()) {
                case NONE:
                    result.put(iface, Collections.emptyList());
                    break;

                case MANUAL:
                    result.put(iface, Collections
                        .singletonList(iface.getManualAddress().get()));
                    break;

                case AUTO:
                    if (!subnet.isPresent()) {
                        result.put(iface, Collections.emptyList());
                        break;
                    }
                    CidrAddress addr = kept.get(iface);
                    if (addr == null) {
                        next = nextFree(subnet.get(), next, taken);
                        InetAddress host = subnet.get().host(next);
                        taken.add(host);
                        addr = subnet.get().withHost(host);
                    }
                    result.put(iface, Collections.singletonList(addr));
                    break;
                }
            }
        }
        return result;
    }

    private static BigInteger nextFree(Subnet subnet, BigInteger from,
                                       Set<InetAddress> taken) {
        BigInteger limit = subnet.size();
        if (!subnet.isIPv6()) limit = limit.subtract(BigInteger.ONE);
        for (BigInteger i = from; i.compareTo(limit) < 0;
             i = i.add(BigInteger.ONE))
            if (!taken.contains(subnet.host(i))) return i;
        throw new IllegalStateException("subnet " + subnet + " exhausted");
    }

    /**
     * Get the addresses to be removed from a device.
     * 
     * @param present the addresses on the device
     * 
     * @param desired the addresses the device should carry
     * 
     * @return the addresses present but not desired
     */
    static List<CidrAddress> stray(List<CidrAddress> present,
                                   List<CidrAddress> desired) {
        List<CidrAddress> result = new ArrayList<>(present);
        result.removeAll(desired);
        return result;
    }
}
