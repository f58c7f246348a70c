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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import javax.json.JsonException;

import org.junit.jupiter.api.Test;

import uk.ac.lancs.slices.CidrAddress;
import uk.ac.lancs.slices.Subnet;

class HostStateTest {
    static final String ADDRS = "[{\"ifindex\":1,\"ifname\":\"lo\","
        + "\"flags\":[\"LOOPBACK\",\"UP\",\"LOWER_UP\"],"
        + "\"address\":\"00:00:00:00:00:00\",\"addr_info\":[{\"family\":"
        + "\"inet\",\"local\":\"127.0.0.1\",\"prefixlen\":8,"
        + "\"scope\":\"host\"}]},"
        + "{\"ifindex\":2,\"ifname\":\"ens3\",\"flags\":[\"BROADCAST\","
        + "\"MULTICAST\",\"UP\",\"LOWER_UP\"],\"address\":"
        + "\"fa:16:3e:00:00:01\",\"addr_info\":[{\"family\":\"inet\","
        + "\"local\":\"10.0.0.1\",\"prefixlen\":24,\"scope\":\"global\"},"
        + "{\"family\":\"inet6\",\"local\":\"fe80::1\",\"prefixlen\":64,"
        + "\"scope\":\"link\"}]},"
        + "{\"ifindex\":3,\"ifname\":\"ens7\",\"flags\":[\"BROADCAST\","
        + "\"MULTICAST\"],\"address\":\"02:00:00:00:00:0A\","
        + "\"addr_info\":[{\"family\":\"inet6\",\"local\":\"2001:db8::7\","
        + "\"prefixlen\":64,\"scope\":\"global\"}]},"
        + "{\"ifindex\":4,\"ifname\":\"ens7.100\",\"link\":\"ens7\","
        + "\"flags\":[\"BROADCAST\",\"MULTICAST\",\"UP\"],"
        + "\"address\":\"02:00:00:00:00:0a\",\"addr_info\":[]}]";

    static final String ROUTES = "[{\"dst\":\"default\",\"gateway\":"
        + "\"10.0.0.254\",\"dev\":\"ens3\",\"protocol\":\"dhcp\"},"
        + "{\"dst\":\"10.0.0.0/24\",\"dev\":\"ens3\",\"scope\":\"link\"},"
        + "{\"dst\":\"192.168.5.3\",\"gateway\":\"10.0.0.9\","
        + "\"dev\":\"ens3\"},"
        + "{\"type\":\"broadcast\",\"dev\":\"ens3\"}]";

    @Test
    void readsDevicesAndGlobalAddresses() {
        HostState host = new HostState();
        host.parseLinks(ADDRS);

        HostState.Link lo = host.link("lo");
        assertThat(lo.up).isTrue();
        assertThat(lo.addresses).isEmpty();

        HostState.Link ens3 = host.link("ens3");
        assertThat(ens3.up).isTrue();
        assertThat(ens3.parent).isNull();
        assertThat(ens3.addresses)
            .containsExactly(CidrAddress.parse("10.0.0.1/24"));

        HostState.Link ens7 = host.link("ens7");
        assertThat(ens7.up).isFalse();
        assertThat(ens7.mac).isEqualTo("02:00:00:00:00:0a");
        assertThat(ens7.addresses)
            .containsExactly(CidrAddress.parse("2001:db8::7/64"));

        assertThat(host.link("ens7.100").parent).isEqualTo("ens7");
        assertThat(host.link("ens8")).isNull();
    }

    @Test
    void matchesPhysicalDeviceByMac() {
        HostState host = new HostState();
        host.parseLinks(ADDRS);
        assertThat(host.findPhysical("02:00:00:00:00:0A").name)
            .isEqualTo("ens7");
        assertThat(host.findPhysical("02:00:00:00:00:0b")).isNull();
    }

    @Test
    void readsRoutes() {
        HostState host = new HostState();
        host.parseRoutes(ROUTES);
        assertThat(host.defaultDevice()).isEqualTo("ens3");
        assertThat(host.hasRoute(Subnet.parse("10.0.0.0/24"))).isTrue();
        assertThat(host.hasRoute(Subnet.parse("192.168.5.3/32"))).isTrue();
        assertThat(host.hasRoute(Subnet.parse("192.168.5.0/24"))).isFalse();

        host.add(new HostState.RouteEntry(Subnet.parse("192.168.5.0/24"),
                                          "10.0.0.9", null));
        assertThat(host.hasRoute(Subnet.parse("192.168.5.0/24"))).isTrue();
    }

    @Test
    void treatsEmptyOutputAsNoEntries() {
        HostState host = new HostState();
        host.parseLinks("  \n");
        host.parseRoutes("");
        assertThat(host.defaultDevice()).isNull();
    }

    @Test
    void rejectsMalformedOutput() {
        HostState host = new HostState();
        assertThatThrownBy(() -> host.parseLinks("Object \"-j\" is unknown"))
            .isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> host.parseLinks("[{\"ifname\":\"ens7\","
            + "\"addr_info\":[{\"family\":\"inet\",\"local\":\"10.1.2.3\","
            + "\"scope\":\"global\"}]}]"))
                .isInstanceOf(NullPointerException.class);
    }
}
