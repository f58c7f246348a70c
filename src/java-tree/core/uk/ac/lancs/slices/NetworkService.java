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

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A network joining a set of interfaces. The service type constrains
 * the number of members and the sites they may be at.
 */
public final class NetworkService extends SliceEntity {
    private final ServiceType type;

    private final List<Interface> members;

    private Subnet subnet;

    private InetAddress gateway;

    private List<String> hops = Collections.emptyList();

    NetworkService(Slice slice, String name, ServiceType type,
                   List<Interface> members) {
        super(slice, name);
        this.type = type;
        this.members = new ArrayList<>(members);
    }

    /**
     * Get the service type.
     * 
     * @return the service type
     */
    public ServiceType getType() {
        return type;
    }

    /**
     * Get the member interfaces.
     * 
     * @return a copy of the members
     */
    public List<Interface> getInterfaces() {
        synchronized (slice.lock) {
            return new ArrayList<>(members);
        }
    }

    /**
     * Get the service's subnet. For layer-3 services, this is assigned
     * by the orchestrator. For layer-2 services, it is optionally
     * chosen by the user, and used to allocate addresses to members.
     * 
     * @return the subnet, if known
     */
    public Optional<Subnet> getSubnet() {
        synchronized (slice.lock) {
            return Optional.ofNullable(subnet);
        }
    }

    /**
     * Get the service's gateway address.
     * 
     * @return the gateway, if known
     */
    public Optional<InetAddress> getGateway() {
        synchronized (slice.lock) {
            return Optional.ofNullable(gateway);
        }
    }

    /**
     * Choose the subnet from which members of a layer-2 service are
     * addressed.
     * 
     * @param subnet the subnet
     * 
     * @param gateway an address within the subnet that members must not
     * use, or {@code null}
     * 
     * @throws InvalidSpecException if this is a layer-3 service, or
     * the gateway is outside the subnet
     */
    public void setSubnet(Subnet subnet, InetAddress gateway)
        throws InvalidSpecException {
        if (type.isLayer3())
            throw new InvalidSpecException("subnet of " + type.label()
                + " service " + getName() + " is assigned by orchestrator");
        if (gateway != null && !subnet.contains(gateway))
            throw new InvalidSpecException("gateway "
                + gateway.getHostAddress() + " not in " + subnet);
        synchronized (slice.lock) {
            this.subnet = subnet;
            this.gateway = gateway;
        }
    }

    /**
     * Get the explicit route of the service.
     * 
     * @return an immutable list of hop names, empty if no explicit
     * route was requested
     */
    public List<String> getHops() {
        synchronized (slice.lock) {
            return hops;
        }
    }

    /**
     * Route the service through a sequence of hops.
     * 
     * @param hops the sites or switches to traverse, in order
     * 
     * @throws InvalidSpecException if this is not a point-to-point
     * service
     * 
     * @throws InvalidStateException if the slice has been submitted
     */
    public void setHops(List<String> hops)
        throws InvalidSpecException,
            InvalidStateException {
        if (type != ServiceType.L2PTP)
            throw new InvalidSpecException("explicit route requires "
                + ServiceType.L2PTP.label() + "; " + getName() + " is "
                + type.label());
        synchronized (slice.lock) {
            slice.checkUnsubmitted();
            this.hops = Collections.unmodifiableList(new ArrayList<>(hops));
        }
    }

    void setAssignment(Subnet subnet, InetAddress gateway) {
        assert Thread.holdsLock(slice.lock);
        if (subnet != null) this.subnet = subnet;
        if (gateway != null) this.gateway = gateway;
    }

    void removeMember(Interface iface) {
        assert Thread.holdsLock(slice.lock);
        members.remove(iface);
    }

    List<Interface> members() {
        assert Thread.holdsLock(slice.lock);
        return Collections.unmodifiableList(members);
    }

    @Override
    public String kind() {
        return "network service";
    }
}
