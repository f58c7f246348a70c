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

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Identifies the kind of a network service, and the constraints on its
 * member interfaces.
 */
public enum ServiceType {
    /**
     * A layer-2 bridge between interfaces at a single site
     */
    L2BRIDGE("L2Bridge", false, false) {
        @Override
        public void checkMembers(List<Interface> members)
            throws InvalidTopologyException {
            requireAtLeast(members, 2);
            requireMaxSites(members, 1);
        }
    },

    /**
     * A layer-2 point-to-point circuit between two sites, optionally
     * following an explicit route
     */
    L2PTP("L2PTP", false, false) {
        @Override
        public void checkMembers(List<Interface> members)
            throws InvalidTopologyException {
            requireExactly(members, 2);
            if (sites(members).size() != 2)
                throw new InvalidTopologyException(label()
                    + " members must be at distinct sites");
            for (Interface iface : members)
                if (iface.getComponent().getModel() == ComponentModel.NIC_BASIC)
                    throw new InvalidTopologyException(label()
                        + " cannot use " + ComponentModel.NIC_BASIC.label()
                        + " interface " + iface.getName());
        }
    },

    /**
     * A layer-2 site-to-site network joining interfaces at up to two
     * sites
     */
    L2STS("L2STS", false, false) {
        @Override
        public void checkMembers(List<Interface> members)
            throws InvalidTopologyException {
            requireAtLeast(members, 2);
            requireMaxSites(members, 2);
        }
    },

    /**
     * A layer-3 VPN across any number of sites
     */
    L3VPN("L3VPN", true, false) {
        @Override
        public void checkMembers(List<Interface> members)
            throws InvalidTopologyException {
            requireAtLeast(members, 1);
        }
    },

    /**
     * A routed IPv4 network local to one site, with addresses assigned
     * by the orchestrator
     */
    FABNET_V4("FABNetv4", true, false) {
        @Override
        public void checkMembers(List<Interface> members)
            throws InvalidTopologyException {
            requireAtLeast(members, 1);
            requireMaxSites(members, 1);
        }
    },

    /**
     * A routed IPv6 network local to one site
     */
    FABNET_V6("FABNetv6", true, true) {
        @Override
        public void checkMembers(List<Interface> members)
            throws InvalidTopologyException {
            requireAtLeast(members, 1);
            requireMaxSites(members, 1);
        }
    },

    /**
     * A routed IPv4 network with external reachability
     */
    FABNET_V4_EXT("FABNetv4Ext", true, false) {
        @Override
        public void checkMembers(List<Interface> members)
            throws InvalidTopologyException {
            requireAtLeast(members, 1);
            requireMaxSites(members, 1);
        }
    },

    /**
     * A routed IPv6 network with external reachability
     */
    FABNET_V6_EXT("FABNetv6Ext", true, true) {
        @Override
        public void checkMembers(List<Interface> members)
            throws InvalidTopologyException {
            requireAtLeast(members, 1);
            requireMaxSites(members, 1);
        }
    },

    /**
     * Mirrors traffic onto a single interface
     */
    PORT_MIRROR("PortMirror", false, false) {
        @Override
        public void checkMembers(List<Interface> members)
            throws InvalidTopologyException {
            requireExactly(members, 1);
        }
    },

    /**
     * Connects interfaces to an external facility
     */
    FACILITY_PORT("FacilityPort", false, false) {
        @Override
        public void checkMembers(List<Interface> members)
            throws InvalidTopologyException {
            requireAtLeast(members, 1);
        }
    };

    private final String label;

    private final boolean layer3;

    private final boolean ipv6;

    ServiceType(String label, boolean layer3, boolean ipv6) {
        this.label = label;
        this.layer3 = layer3;
        this.ipv6 = ipv6;
    }

    /**
     * Check that a set of interfaces may be members of a service of
     * this type.
     * 
     * @param members the proposed members
     * 
     * @throws InvalidTopologyException if the members violate this
     * type's constraints
     */
    public abstract void checkMembers(List<Interface> members)
        throws InvalidTopologyException;

    /**
     * Get the label used for this type on the wire.
     * 
     * @return the type's label
     */
    public String label() {
        return label;
    }

    /**
     * Determine whether the orchestrator routes this service at layer
     * 3, and assigns its subnet and gateway.
     * 
     * @return {@code true} if this is a layer-3 service
     */
    public boolean isLayer3() {
        return layer3;
    }

    /**
     * Determine whether this service carries IPv6.
     * 
     * @return {@code true} if the service's assigned subnet is IPv6
     */
    public boolean isIPv6() {
        return ipv6;
    }

    /**
     * Parse a type label.
     * 
     * @param label the label to parse
     * 
     * @return the matching type
     * 
     * @throws IllegalArgumentException if the label is not recognized
     */
    public static ServiceType fromLabel(String label) {
        for (ServiceType t : values())
            if (t.label.equals(label)) return t;
        throw new IllegalArgumentException("unknown service type: "
            + label);
    }

    /**
     * Choose a layer-2 service type for a set of interfaces. Interfaces
     * at one site yield {@link #L2BRIDGE}. Two interfaces at two sites
     * yield {@link #L2PTP}, unless one of them is a
     * {@link ComponentModel#NIC_BASIC} port, in which case
     * {@link #L2STS} is chosen. More interfaces at two sites yield
     * {@link #L2STS}.
     * 
     * @param members the proposed members
     * 
     * @return the chosen type
     * 
     * @throws InvalidTopologyException if the interfaces span more
     * than two sites
     */
    public static ServiceType chooseLayer2(List<Interface> members)
        throws InvalidTopologyException {
        Set<String> sites = sites(members);
        if (sites.size() <= 1) return L2BRIDGE;
        if (sites.size() > 2)
            throw new InvalidTopologyException("layer-2 network cannot span "
                + sites.size() + " sites " + sites);
        if (members.size() == 2) {
            for (Interface iface : members)
                if (iface.getComponent().getModel() == ComponentModel.NIC_BASIC)
                    return L2STS;
            return L2PTP;
        }
        return L2STS;
    }

    static Set<String> sites(Collection<Interface> members) {
        Set<String> result = new HashSet<>();
        for (Interface iface : members)
            result.add(iface.getNode().getSite());
        return result;
    }

    private static void requireAtLeast(List<Interface> members, int min)
        throws InvalidTopologyException {
        if (members.size() < min)
            throw new InvalidTopologyException("at least " + min
                + " member(s) required; got " + members.size());
    }

    private static void requireExactly(List<Interface> members, int count)
        throws InvalidTopologyException {
        if (members.size() != count)
            throw new InvalidTopologyException("exactly " + count
                + " member(s) required; got " + members.size());
    }

    private static void requireMaxSites(List<Interface> members, int max)
        throws InvalidTopologyException {
        Set<String> sites = sites(members);
        if (sites.size() > max)
            throw new InvalidTopologyException("members span " + sites.size()
                + " sites " + sites + "; at most " + max + " allowed");
    }
}
