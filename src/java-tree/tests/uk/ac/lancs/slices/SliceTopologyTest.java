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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import uk.ac.lancs.slices.orchestrator.TopologySnapshot;

class SliceTopologyTest {
    private Slice slice;

    @BeforeEach
    void setUp() {
        slice = new Slice("exp", "proj", SliceFixtures.keys());
    }

    @Test
    void rejectsDuplicateNodeNames() throws Exception {
        slice.addNode("n1", "STAR");
        assertThatThrownBy(() -> slice.addNode("n1", "UTAH"))
            .isInstanceOf(DuplicateNameException.class)
            .hasMessageContaining("n1");
        assertThat(slice.getNodes()).hasSize(1);
    }

    @Test
    void requiresExactlyOneOfCapacityAndInstanceType() throws Exception {
        assertThatThrownBy(() -> slice
            .addNode("n1", "STAR", Slice.DEFAULT_IMAGE, Capacity.DEFAULT,
                     "fabric.c2.m8.d10"))
                .isInstanceOf(InvalidSpecException.class);
        assertThatThrownBy(() -> slice
            .addNode("n1", "STAR", Slice.DEFAULT_IMAGE, null, null))
                .isInstanceOf(InvalidSpecException.class);
        Node node = slice.addNode("n1", "STAR", "default_ubuntu_22", null,
                                  "fabric.c2.m8.d10");
        assertThat(node.getCapacity()).isEmpty();
        assertThat(node.getInstanceType()).contains("fabric.c2.m8.d10");
        assertThat(node.getUsername()).isEqualTo("ubuntu");
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> Capacity.of(0, 8, 10))
            .isInstanceOf(InvalidSpecException.class);
        assertThatThrownBy(() -> Capacity.of(2, 8, -1))
            .isInstanceOf(InvalidSpecException.class);
    }

    @Test
    void rejectsMalformedNames() {
        assertThatThrownBy(() -> slice.addNode("bad name", "STAR"))
            .isInstanceOf(InvalidSpecException.class);
        assertThatThrownBy(() -> slice.addNode("", "STAR"))
            .isInstanceOf(InvalidSpecException.class);
    }

    @Test
    void rejectsUnknownModel() throws Exception {
        Node node = slice.addNode("n1", "STAR");
        assertThatThrownBy(() -> node.addComponent("NIC_Imaginary"))
            .isInstanceOfSatisfying(UnsupportedModelException.class,
                                    ex -> assertThat(ex.getSite())
                                        .isNull());
    }

    @Test
    void rejectsModelUnavailableAtSite() throws Exception {
        Node node = slice.addNode("n1", "HAWI");
        assertThatThrownBy(() -> node.addComponent("GPU_A30", "gpu1"))
            .isInstanceOfSatisfying(UnsupportedModelException.class,
                                    ex -> {
                                        assertThat(ex.getModel())
                                            .isEqualTo("GPU_A30");
                                        assertThat(ex.getSite())
                                            .isEqualTo("HAWI");
                                    });
        assertThat(node.getComponents()).isEmpty();
    }

    @Test
    void namesComponentsAndInterfaces() throws Exception {
        Node node = slice.addNode("n1", "STAR");
        Component c1 = node.addComponent("NIC_ConnectX_6");
        Component c2 = node.addComponent("NIC_ConnectX_6");
        Component gpu = node.addComponent("GPU_RTX6000", "gpu");
        assertThat(c1.getName()).isEqualTo("n1-nic_connectx_61");
        assertThat(c2.getLocalName()).isEqualTo("nic_connectx_62");
        assertThat(c1.getInterfaces()).extracting(Interface::getName)
            .containsExactly("n1-nic_connectx_61-p1",
                             "n1-nic_connectx_61-p2");
        assertThat(gpu.getInterfaces()).isEmpty();
        assertThat(slice.getInterface("n1-nic_connectx_62-p2"))
            .isSameAs(c2.getInterfaces().get(1));
        assertThatThrownBy(() -> node.addComponent("GPU_RTX6000", "gpu"))
            .isInstanceOf(DuplicateNameException.class);
    }

    @Test
    void pointToPointNeedsTwoInterfaces() throws Exception {
        Node n1 = slice.addNode("n1", "STAR");
        slice.addNode("n2", "UTAH");
        Interface iface1 =
            n1.addComponent("NIC_ConnectX_5").getInterfaces().get(0);
        assertThatThrownBy(() -> slice
            .addNetworkService("ptp", ServiceType.L2PTP,
                               Collections.singletonList(iface1)))
                .isInstanceOf(InvalidTopologyException.class);
        assertThat(slice.getNetworkServices()).isEmpty();
        assertThat(iface1.getNetworkService()).isEmpty();
    }

    @Test
    void pointToPointNeedsDistinctSitesAndDedicatedNics() throws Exception {
        Node n1 = slice.addNode("n1", "STAR");
        Node n2 = slice.addNode("n2", "STAR");
        Node n3 = slice.addNode("n3", "UTAH");
        Interface a = n1.addComponent("NIC_ConnectX_5").getInterfaces().get(0);
        Interface b = n2.addComponent("NIC_ConnectX_5").getInterfaces().get(0);
        Interface basic = n3.addComponent("NIC_Basic").getInterfaces().get(0);
        assertThatThrownBy(() -> slice
            .addNetworkService("ptp", ServiceType.L2PTP, Arrays.asList(a, b)))
                .isInstanceOf(InvalidTopologyException.class);
        assertThatThrownBy(() -> slice
            .addNetworkService("ptp", ServiceType.L2PTP,
                               Arrays.asList(a, basic)))
                .isInstanceOf(InvalidTopologyException.class);
    }

    @Test
    void choosesLayer2TypeFromSites() throws Exception {
        Node n1 = slice.addNode("n1", "STAR");
        Node n2 = slice.addNode("n2", "STAR");
        Node n3 = slice.addNode("n3", "UTAH");
        Node n4 = slice.addNode("n4", "TACC");
        Interface a = n1.addComponent("NIC_ConnectX_6").getInterfaces().get(0);
        Interface b = n2.addComponent("NIC_ConnectX_6").getInterfaces().get(0);
        Interface c = n3.addComponent("NIC_ConnectX_6").getInterfaces().get(0);
        Interface d = n4.addComponent("NIC_ConnectX_6").getInterfaces().get(0);
        Interface basic = n3.addComponent("NIC_Basic").getInterfaces().get(0);

        assertThat(ServiceType.chooseLayer2(Arrays.asList(a, b)))
            .isEqualTo(ServiceType.L2BRIDGE);
        assertThat(ServiceType.chooseLayer2(Arrays.asList(a, c)))
            .isEqualTo(ServiceType.L2PTP);
        assertThat(ServiceType.chooseLayer2(Arrays.asList(a, basic)))
            .isEqualTo(ServiceType.L2STS);
        assertThat(ServiceType.chooseLayer2(Arrays.asList(a, b, c)))
            .isEqualTo(ServiceType.L2STS);
        assertThatThrownBy(() -> ServiceType
            .chooseLayer2(Arrays.asList(a, c, d)))
                .isInstanceOf(InvalidTopologyException.class);

        NetworkService svc = slice.addL2Network("wan", Arrays.asList(a, c));
        assertThat(svc.getType()).isEqualTo(ServiceType.L2PTP);
    }

    @Test
    void layer3RequiresLayer3Type() throws Exception {
        Node n1 = slice.addNode("n1", "STAR");
        Interface a = n1.addComponent("NIC_Basic").getInterfaces().get(0);
        assertThatThrownBy(() -> slice
            .addL3Network("v4", ServiceType.L2BRIDGE,
                          Collections.singletonList(a)))
                .isInstanceOf(InvalidSpecException.class);
        NetworkService svc = slice.addL3Network("v4", ServiceType.FABNET_V4,
                                                Collections.singletonList(a));
        assertThatThrownBy(() -> svc
            .setSubnet(Subnet.parse("10.1.0.0/24"), null))
                .isInstanceOf(InvalidSpecException.class);
    }

    @Test
    void interfaceJoinsAtMostOneService() throws Exception {
        Node n1 = slice.addNode("n1", "STAR");
        Node n2 = slice.addNode("n2", "STAR");
        Node n3 = slice.addNode("n3", "STAR");
        Interface a = n1.addComponent("NIC_Basic").getInterfaces().get(0);
        Interface b = n2.addComponent("NIC_Basic").getInterfaces().get(0);
        Interface c = n3.addComponent("NIC_Basic").getInterfaces().get(0);
        slice.addNetworkService("net1", ServiceType.L2BRIDGE,
                                Arrays.asList(a, b));
        assertThatThrownBy(() -> slice
            .addNetworkService("net2", ServiceType.L2BRIDGE,
                               Arrays.asList(b, c)))
                .isInstanceOf(InvalidTopologyException.class)
                .hasMessageContaining("already attached");
        assertThatThrownBy(() -> slice
            .addNetworkService("net1", ServiceType.L2BRIDGE,
                               Arrays.asList(c, c)))
                .isInstanceOf(DuplicateNameException.class);
        assertNoSharedInterfaces();
    }

    @Test
    void removingNodeDetachesItsInterfaces() throws Exception {
        slice = SliceFixtures.bridgedPair("exp");
        NetworkService net = slice.getNetworkService("net1");
        slice.removeNode(slice.getNode("n1"));

        assertThat(slice.getNode("n1")).isNull();
        assertThat(net.getInterfaces()).extracting(Interface::getName)
            .containsExactly("n2-nic1-p1");
        assertThat(slice.getInterface("n1-nic1-p1")).isNull();
        assertThatThrownBy(() -> slice.validate())
            .isInstanceOf(InvalidTopologyException.class)
            .hasMessageContaining("net1");
        assertNoSharedInterfaces();
    }

    @Test
    void emptySliceIsInvalid() {
        assertThatThrownBy(() -> slice.validate())
            .isInstanceOf(InvalidTopologyException.class);
    }

    @Test
    void validatesVlanAndManualAddressing() throws Exception {
        Node n1 = slice.addNode("n1", "STAR");
        Interface a = n1.addComponent("NIC_Basic").getInterfaces().get(0);
        assertThatThrownBy(() -> a.setVlan(0))
            .isInstanceOf(InvalidSpecException.class);
        assertThatThrownBy(() -> a.setVlan(4095))
            .isInstanceOf(InvalidSpecException.class);
        assertThatThrownBy(() -> a.setMode(AddressMode.MANUAL))
            .isInstanceOf(InvalidSpecException.class);
        assertThatThrownBy(() -> a.setManualAddress(null))
            .isInstanceOf(NullPointerException.class);
        assertThat(a.getMode()).isEqualTo(AddressMode.AUTO);
        a.setVlan(100);
        a.setManualAddress(CidrAddress.parse("192.168.1.5/24"));
        assertThat(a.getVlan()).contains(100);
        assertThat(a.getMode()).isEqualTo(AddressMode.MANUAL);
        assertThat(a.getManualAddress().get().getSubnet())
            .isEqualTo(Subnet.parse("192.168.1.0/24"));
    }

    @Test
    void submittedSliceRejectsStructuralChanges() throws Exception {
        slice = SliceFixtures.bridgedPair("exp");
        Reconciler reconciler = new Reconciler();
        TopologySnapshot initial = SliceFixtures
            .uniform(slice, "s-1", ReservationState.TICKETED);
        reconciler.accept(slice, initial);

        assertThatThrownBy(() -> slice.addNode("n3", "STAR"))
            .isInstanceOf(InvalidStateException.class);
        Node n1 = slice.getNode("n1");
        assertThatThrownBy(() -> n1.addComponent("NIC_Basic"))
            .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> slice.removeNode(n1))
            .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> reconciler.accept(slice, initial))
            .isInstanceOf(InvalidStateException.class);

        /* Terminal nodes may be dropped. */
        reconciler.merge(slice, SliceFixtures
            .uniform(slice, "s-1", ReservationState.CLOSED));
        slice.removeNode(n1);
        assertThat(slice.getNodes()).extracting(Node::getName)
            .containsExactly("n2");
    }

    @Test
    void derivesUsernameFromImage() {
        assertThat(Node.defaultUsername("default_rocky_9")).isEqualTo("rocky");
        assertThat(Node.defaultUsername("default_ubuntu_20"))
            .isEqualTo("ubuntu");
        assertThat(Node.defaultUsername("default_centos9_stream"))
            .isEqualTo("cloud-user");
        assertThat(Node.defaultUsername("custom")).isEqualTo("root");
    }

    private void assertNoSharedInterfaces() {
        Set<Interface> seen = new HashSet<>();
        for (NetworkService svc : slice.getNetworkServices()) {
            List<Interface> members = svc.getInterfaces();
            for (Interface iface : members) {
                assertThat(seen.add(iface)).as(iface.getName()).isTrue();
                assertThat(iface.getNetworkService()).contains(svc);
            }
        }
    }
}
