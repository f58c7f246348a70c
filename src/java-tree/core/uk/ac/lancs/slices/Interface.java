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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A network port of a component. An interface belongs to at most one
 * network service.
 */
public final class Interface extends SliceEntity {
    private final Component component;

    private final int port;

    private Integer vlan;

    private AddressMode mode = AddressMode.AUTO;

    private CidrAddress manualAddress;

    private Integer bandwidth;

    private NetworkService service;

    private String mac;

    private String deviceName;

    private List<CidrAddress> assignedAddresses = Collections.emptyList();

    Interface(Component component, int port) {
        super(component.slice, component.getName() + "-p" + port);
        this.component = component;
        this.port = port;
    }

    /**
     * Get the component providing this interface.
     * 
     * @return the owning component
     */
    public Component getComponent() {
        return component;
    }

    /**
     * Get the node hosting this interface.
     * 
     * @return the node of the owning component
     */
    public Node getNode() {
        return component.getNode();
    }

    /**
     * Get the port number of this interface on its component.
     * 
     * @return the port number, starting from 1
     */
    public int getPort() {
        return port;
    }

    /**
     * Get the VLAN tag to apply to traffic on this interface.
     * 
     * @return the VLAN tag, if any
     */
    public Optional<Integer> getVlan() {
        synchronized (slice.lock) {
            return Optional.ofNullable(vlan);
        }
    }

    /**
     * Tag traffic on this interface with a VLAN.
     * 
     * @param vlan the VLAN tag
     * 
     * @throws InvalidSpecException if the tag is not in the range 1 to
     * 4094
     * 
     * @throws InvalidStateException if the slice has been submitted
     */
    public void setVlan(int vlan)
        throws InvalidSpecException,
            InvalidStateException {
        if (vlan < 1 || vlan > 4094)
            throw new InvalidSpecException("VLAN out of range: " + vlan);
        synchronized (slice.lock) {
            slice.checkUnsubmitted();
            this.vlan = vlan;
        }
    }

    /**
     * Get the interface's addressing mode.
     * 
     * @return the addressing mode
     */
    public AddressMode getMode() {
        synchronized (slice.lock) {
            return mode;
        }
    }

    /**
     * Get the address requested by the user.
     * 
     * @return the address, if the mode is {@link AddressMode#MANUAL}
     */
    public Optional<CidrAddress> getManualAddress() {
        synchronized (slice.lock) {
            return Optional.ofNullable(manualAddress);
        }
    }

    /**
     * Set the addressing mode. Addressing is applied during post-boot
     * configuration, so it may be changed after submission.
     * 
     * @param mode the new mode, other than {@link AddressMode#MANUAL}
     * 
     * @throws InvalidSpecException if the mode is
     * {@link AddressMode#MANUAL}, which requires an address
     */
    public void setMode(AddressMode mode) throws InvalidSpecException {
        if (mode == AddressMode.MANUAL)
            throw new InvalidSpecException("manual addressing of " + getName()
                + " requires an address");
        synchronized (slice.lock) {
            this.mode = mode;
            this.manualAddress = null;
        }
    }

    /**
     * Set a manual address, and switch to {@link AddressMode#MANUAL}.
     * 
     * @param address the address to configure
     * 
     * @throws NullPointerException if the address is {@code null}
     */
    public void setManualAddress(CidrAddress address) {
        Objects.requireNonNull(address, "address");
        synchronized (slice.lock) {
            this.mode = AddressMode.MANUAL;
            this.manualAddress = address;
        }
    }

    /**
     * Get the bandwidth requested for this interface.
     * 
     * @return the bandwidth in Gb/s, if requested
     */
    public Optional<Integer> getBandwidth() {
        synchronized (slice.lock) {
            return Optional.ofNullable(bandwidth);
        }
    }

    /**
     * Request bandwidth for this interface.
     * 
     * @param bandwidth the bandwidth in Gb/s
     * 
     * @throws InvalidSpecException if the bandwidth is not positive
     * 
     * @throws InvalidStateException if the slice has been submitted
     */
    public void setBandwidth(int bandwidth)
        throws InvalidSpecException,
            InvalidStateException {
        if (bandwidth <= 0)
            throw new InvalidSpecException("bandwidth must be positive: "
                + bandwidth);
        synchronized (slice.lock) {
            slice.checkUnsubmitted();
            this.bandwidth = bandwidth;
        }
    }

    /**
     * Get the network service this interface belongs to.
     * 
     * @return the service, if attached
     */
    public Optional<NetworkService> getNetworkService() {
        synchronized (slice.lock) {
            return Optional.ofNullable(service);
        }
    }

    void setNetworkService(NetworkService service) {
        assert Thread.holdsLock(slice.lock);
        this.service = service;
    }

    /**
     * Get the MAC address reported for this interface.
     * 
     * @return the MAC address in lower case, if known
     */
    public Optional<String> getMac() {
        synchronized (slice.lock) {
            return Optional.ofNullable(mac);
        }
    }

    /**
     * Get the OS device name last matched to this interface.
     * 
     * @return the device name, if known
     */
    public Optional<String> getDeviceName() {
        synchronized (slice.lock) {
            return Optional.ofNullable(deviceName);
        }
    }

    /**
     * Get the addresses configured on this interface by the last
     * post-boot configuration.
     * 
     * @return an immutable list of addresses
     */
    public List<CidrAddress> getAssignedAddresses() {
        synchronized (slice.lock) {
            return assignedAddresses;
        }
    }

    void setReportedVlan(Integer vlan) {
        assert Thread.holdsLock(slice.lock);
        if (vlan != null) this.vlan = vlan;
    }

    void setMac(String mac) {
        assert Thread.holdsLock(slice.lock);
        this.mac = mac == null ? null : mac.toLowerCase();
    }

    void setDeviceName(String deviceName) {
        assert Thread.holdsLock(slice.lock);
        this.deviceName = deviceName;
    }

    void setAssignedAddresses(List<CidrAddress> addresses) {
        assert Thread.holdsLock(slice.lock);
        this.assignedAddresses =
            Collections.unmodifiableList(new ArrayList<>(addresses));
    }

    @Override
    public String kind() {
        return "interface";
    }
}
