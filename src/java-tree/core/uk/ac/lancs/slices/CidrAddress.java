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
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * An IP address with a prefix length, as configured on an interface.
 */
public final class CidrAddress {
    private final InetAddress address;

    private final int prefixLength;

    /**
     * Create an address with a prefix length.
     * 
     * @param address the interface address
     * 
     * @param prefixLength the number of network bits
     * 
     * @throws IllegalArgumentException if the prefix length is out of
     * range for the address family
     */
    public CidrAddress(InetAddress address, int prefixLength) {
        int max = address.getAddress().length * 8;
        if (prefixLength < 0 || prefixLength > max)
            throw new IllegalArgumentException("bad prefix length "
                + prefixLength + " for " + address.getHostAddress());
        this.address = address;
        this.prefixLength = prefixLength;
    }

    /**
     * Get the address.
     * 
     * @return the address
     */
    public InetAddress getAddress() {
        return address;
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
     * Get the subnet that this address belongs to.
     * 
     * @return the enclosing subnet
     */
    public Subnet getSubnet() {
        return new Subnet(address, prefixLength);
    }

    /**
     * Determine whether this is an IPv6 address.
     * 
     * @return {@code true} if the address is IPv6
     */
    public boolean isIPv6() {
        return address.getAddress().length == 16;
    }

    /**
     * Parse an address with prefix, e.g., <samp>10.0.0.2/24</samp>.
     * 
     * @param text the text to parse
     * 
     * @return the parsed address
     * 
     * @throws IllegalArgumentException if the text is malformed
     */
    public static CidrAddress parse(String text) {
        int slash = text.indexOf('/');
        if (slash < 0)
            throw new IllegalArgumentException("no prefix length: " + text);
        InetAddress addr = parseAddress(text.substring(0, slash));
        try {
            return new CidrAddress(addr, Integer
                .parseInt(text.substring(slash + 1)));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("bad prefix length: " + text,
                                               ex);
        }
    }

    private static final Pattern IPV4_LITERAL =
        Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");

    private static final Pattern IPV6_LITERAL =
        Pattern.compile("[0-9a-fA-F:.]*:[0-9a-fA-F:.]*");

    /**
     * Parse an IP address literal, without consulting DNS.
     * 
     * @param text the literal
     * 
     * @return the parsed address
     * 
     * @throws IllegalArgumentException if the text is not an IPv4 or
     * IPv6 literal
     */
    public static InetAddress parseAddress(String text) {
        text = text.trim();
        if (text.startsWith("[") && text.endsWith("]"))
            text = text.substring(1, text.length() - 1);
        if (!IPV4_LITERAL.matcher(text).matches() &&
            !IPV6_LITERAL.matcher(text).matches())
            throw new IllegalArgumentException("not an IP address: " + text);
        try {
            return InetAddress.getByName(text);
        } catch (UnknownHostException ex) {
            throw new IllegalArgumentException("not an IP address: " + text,
                                               ex);
        }
    }

    /**
     * Determine whether a string is an IP address literal.
     * 
     * @param text the string to test
     * 
     * @return {@code true} if the string parses as an address
     */
    public static boolean isAddress(String text) {
        try {
            parseAddress(text);
            return true;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CidrAddress)) return false;
        CidrAddress other = (CidrAddress) obj;
        return prefixLength == other.prefixLength &&
            address.equals(other.address);
    }

    @Override
    public int hashCode() {
        return address.hashCode() * 31 + prefixLength;
    }

    /**
     * Get the string form of this address.
     * 
     * @return the address and prefix length separated by a slash
     */
    @Override
    public String toString() {
        return address.getHostAddress() + "/" + prefixLength;
    }
}
