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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import uk.ac.lancs.slices.AddressMode;
import uk.ac.lancs.slices.CidrAddress;
import uk.ac.lancs.slices.Interface;
import uk.ac.lancs.slices.NetworkService;
import uk.ac.lancs.slices.Reconciler;
import uk.ac.lancs.slices.Slice;
import uk.ac.lancs.slices.SliceFixtures;
import uk.ac.lancs.slices.Subnet;

class AddressPlannerTest {
    private Slice slice;

    private NetworkService net;

    private Interface i1;

    private Interface i2;

    @BeforeEach
    void setUp() throws Exception {
        slice = SliceFixtures.bridgedPair("exp");
        net = slice.getNetworkService("net1");
        i1 = slice.getNode("n1").getInterfaces().get(0);
        i2 = slice.getNode("n2").getInterfaces().get(0);
    }

    private static List<CidrAddress> addrs(String... text) {
        CidrAddress[] result = new CidrAddress[text.length];
        for (int i = 0; i < text.length; i++)
            result[i] = CidrAddress.parse(text[i]);
        return Arrays.asList(result);
    }

    @Test
    void allocatesLowestFreeHosts() {
        Map<Interface, List<CidrAddress>> plan = AddressPlanner.plan(slice);
        assertThat(plan.get(i1)).isEqualTo(addrs("192.168.10.1/24"));
        assertThat(plan.get(i2)).isEqualTo(addrs("192.168.10.2/24"));
    }

    @Test
    void skipsGateway() throws Exception {
        net.setSubnet(Subnet.parse("192.168.10.0/24"),
                      CidrAddress.parseAddress("192.168.10.1"));
        Map<Interface, List<CidrAddress>> plan = AddressPlanner.plan(slice);
        assertThat(plan.get(i1)).isEqualTo(addrs("192.168.10.2/24"));
        assertThat(plan.get(i2)).isEqualTo(addrs("192.168.10.3/24"));
    }

    @Test
    void skipsManualAddresses() {
        i2.setManualAddress(CidrAddress.parse("192.168.10.1/24"));
        Map<Interface, List<CidrAddress>> plan = AddressPlanner.plan(slice);
        assertThat(plan.get(i1)).isEqualTo(addrs("192.168.10.2/24"));
        assertThat(plan.get(i2)).isEqualTo(addrs("192.168.10.1/24"));
    }

    @Test
    void keepsEarlierAllocations() {
        new Reconciler().recordConfiguration(i2, "ens7",
                                             addrs("192.168.10.9/24"));
        Map<Interface, List<CidrAddress>> plan = AddressPlanner.plan(slice);
        assertThat(plan.get(i1)).isEqualTo(addrs("192.168.10.1/24"));
        assertThat(plan.get(i2)).isEqualTo(addrs("192.168.10.9/24"));
        assertThat(AddressPlanner.plan(slice)).isEqualTo(plan);
    }

    @Test
    void dropsAllocationsOutsideSubnet() {
        new Reconciler().recordConfiguration(i1, "ens7",
                                             addrs("10.9.9.9/24"));
        assertThat(AddressPlanner.plan(slice).get(i1))
            .isEqualTo(addrs("192.168.10.1/24"));
    }

    @Test
    void leavesUnaddressedInterfacesEmpty() throws Exception {
        i1.setMode(AddressMode.NONE);
        Map<Interface, List<CidrAddress>> plan = AddressPlanner.plan(slice);
        assertThat(plan.get(i1)).isEmpty();
        assertThat(plan.get(i2)).isEqualTo(addrs("192.168.10.1/24"));
    }

    @Test
    void failsWhenSubnetExhausted() throws Exception {
        net.setSubnet(Subnet.parse("192.168.10.0/30"),
                      CidrAddress.parseAddress("192.168.10.1"));
        assertThatThrownBy(() -> AddressPlanner.plan(slice))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("exhausted");
    }

    @Test
    void findsStrayAddresses() {
        assertThat(AddressPlanner.stray(addrs("10.1.1.1/24", "10.2.2.2/24"),
                                        addrs("10.1.1.1/24")))
            .isEqualTo(addrs("10.2.2.2/24"));
        assertThat(AddressPlanner.stray(Collections.emptyList(),
                                        addrs("10.1.1.1/24")))
            .isEmpty();
    }
}
