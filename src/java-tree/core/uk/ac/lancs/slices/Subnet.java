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

import java.math.BigInteger;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;

/**
 * An IP subnet, identified by its network address and prefix length.
 * Host bits of the address are cleared on construction.
 */
public final class Subnet {
    private final InetAddress network;

    private final int prefixLength;

    /**
     * Create a subnet containing an address.
     * 
     * @param address any address within the subnet
     * 
     * @param prefixLength the number of network bits
     * 
     * @throws IllegalArgumentException if the prefix length is out of
     * range for the address family
     */
    public Subnet(InetAddress address, int prefixLength) {
        byte[] bytes = address.getAddress();
        if (prefixLength < 0 || prefixLength > bytes.length * 8)
            throw new IllegalArgumentException("bad prefix length "
                + prefixLength);
        for (int i = 0; i < bytes.length; i++) {
            int keep = Math.max(0, Math.min(8, prefixLength - i * 8));
            bytes[i] &= (byte) (0xff << (8 - keep));
        }
        this.network = toAddress(bytes);
        this.prefixLength = prefixLength;
    }

    private static InetAddress toAddress(byte[] bytes) {
        try {
            return InetAddress.getByAddress(bytes);
        } catch (UnknownHostException ex) {
            throw new IllegalArgumentException("bad address length "
                + bytes.length, ex);
        }
    }

    /**
     * Parse a subnet in CIDR notation, e.g., <samp>10.0.0.0/24</samp>.
     * 
     * @param text the text to parse
     * 
     * @return the parsed subnet
     * 
     * @throws IllegalArgumentException if the text is malformed
     */
    public static Subnet parse(String text) {
        return CidrAddress.parse(text.trim()).getSubnet();
    }

    /**
     * Get the network address.
     * 
     * @return the network address, with all host bits clear
     */
    public InetAddress getNetwork() {
        return network;
    }

    /**
     * Get the prefix length.
     * 
     * @return the number of network bits
     */
    public int getPrefixLength() {
        return prefixLength;
    }

    /**
     * Determine whether this is an IPv6 subnet.
     * 
     * @return {@code true} if the subnet is IPv6
     */
    public boolean isIPv6() {
        return network.getAddress().length == 16;
    }

    /**
     * Determine whether an address belongs to this subnet.
     * 
     * @param address the address to test
     * 
     * @return {@code true} if the address is in this subnet
     */
    public boolean contains(InetAddress address) {
        if (address.getAddress().length != network.getAddress().length)
            return false;
        return new Subnet(address, prefixLength).network.equals(network);
    }

    /**
     * Get the number of addresses in this subnet, including the
     * network address.
     * 
     * @return the subnet size
     */
    public BigInteger size() {
        int bits = network.getAddress().length * 8 - prefixLength;
        return BigInteger.ONE.shiftLeft(bits);
    }

    /**
     * Get an address within this subnet by its offset from the network
     * address.
     * 
     * @param index the offset
     * 
     * @return the address at that offset
     * 
     * @throws IndexOutOfBoundsException if the offset lies outside the
     * subnet
     */
    public InetAddress host(BigInteger index) {
        if (index.signum() < 0 || index.compareTo(size()) >= 0)
            throw new IndexOutOfBoundsException("host " + index
                + " not in " + this);
        byte[] net = network.getAddress();
        BigInteger value = new BigInteger(1, net).add(index);
        byte[] raw = value.toByteArray();
        byte[] bytes = new byte[net.length];
        int n = Math.min(raw.length, bytes.length);
        System.arraycopy(raw, raw.length - n, bytes, bytes.length - n, n);
        return toAddress(bytes);
    }

    /**
     * Get an address within this subnet by its offset from the network
     * address.
     * 
     * @param index the offset
     * 
     * @return the address at that offset
     * 
     * @throws IndexOutOfBoundsException if the offset lies outside the
     * subnet
     */
    public InetAddress host(long index) {
        return host(BigInteger.valueOf(index));
    }

    /**
     * Get an interface address within this subnet.
     * 
     * @param address the host address
     * 
     * @return the address with this subnet's prefix length
     * 
     * @throws IllegalArgumentException if the address is not in this
     * subnet
     */
    public CidrAddress withHost(InetAddress address) {
        if (!contains(address))
            throw new IllegalArgumentException(address.getHostAddress()
                + " not in " + this);
        return new CidrAddress(address, prefixLength);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Subnet)) return false;
        Subnet other = (Subnet) obj;
        return prefixLength == other.prefixLength &&
            Arrays.equals(network.getAddress(), other.network.getAddress());
    }

    @Override
    public int hashCode() {
        return network.hashCode() * 31 + prefixLength;
    }

    /**
     * Get the CIDR notation for this subnet.
     * 
     * @return the network address and prefix length separated by a
     * slash
     */
    @Override
    public String toString() {
        return network.getHostAddress() + "/" + prefixLength;
    }
}
