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

import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import uk.ac.lancs.slices.AddressMode;
import uk.ac.lancs.slices.CidrAddress;
import uk.ac.lancs.slices.Interface;
import uk.ac.lancs.slices.Node;
import uk.ac.lancs.slices.Reconciler;
import uk.ac.lancs.slices.ReservationState;
import uk.ac.lancs.slices.Slice;
import uk.ac.lancs.slices.SliceFixtures;
import uk.ac.lancs.slices.Subnet;
import uk.ac.lancs.slices.ssh.BastionRelay;
import uk.ac.lancs.slices.ssh.CommandResult;
import uk.ac.lancs.slices.ssh.FakeTransport;
import uk.ac.lancs.slices.ssh.RemoteChannel;
import uk.ac.lancs.slices.ssh.RemoteExecutionException;
import uk.ac.lancs.slices.util.Backoff;
import uk.ac.lancs.slices.util.ManualPacer;

class PostBootConfiguratorTest {
    private final FakeTransport transport = new FakeTransport();

    private final Reconciler reconciler = new Reconciler();

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    private PostBootConfigurator configurator;

    private SimulatedHost host1;

    private SimulatedHost host2;

    private Slice slice;

    private Node n1;

    private Interface i1;

    private Interface i2;

    @BeforeEach
    void setUp() throws Exception {
        RemoteChannel channel =
            new RemoteChannel(transport,
                              new BastionRelay("bastion.example.org", 22,
                                               "alice",
                                               Paths.get("/tmp/bastion_key")),
                              1, Backoff.fixed(0), 1000, new ManualPacer(0));
        configurator = new PostBootConfigurator(channel, reconciler, executor,
                                                5000, true);

        host1 = new SimulatedHost("10.0.0.1");
        host1.device("ens7", "02:00:00:00:00:01", false).addresses
            .add(CidrAddress.parse("172.16.0.5/24"));
        host2 = new SimulatedHost("10.0.0.2");
        host2.device("ens7", "02:00:00:00:00:02", false);
        transport.host("10.0.0.1", host1).host("10.0.0.2", host2);

        slice = SliceFixtures.bridgedPair("exp");
        n1 = slice.getNode("n1");
        i1 = n1.getInterfaces().get(0);
        i2 = slice.getNode("n2").getInterfaces().get(0);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void activate() throws Exception {
        reconciler.accept(slice, SliceFixtures
            .uniform(slice, "s-1", ReservationState.ACTIVE));
    }

    private long sudoCount() {
        return transport.log.stream().filter(s -> s.contains(": sudo "))
            .count();
    }

    @Test
    void configuresAddressesAndHostnames() throws Exception {
        activate();
        ConfigurationReport report = configurator.configure(slice);

        assertThat(report.isSuccess()).as(report.toString()).isTrue();
        assertThat(report.configured()).containsExactly("n1", "n2");
        assertThat(host1.hostname).isEqualTo("n1");
        assertThat(host2.hostname).isEqualTo("n2");

        SimulatedHost.Dev ens7 = host1.devices.get("ens7");
        assertThat(ens7.up).isTrue();
        assertThat(ens7.managed).isFalse();
        assertThat(ens7.addresses)
            .containsExactly(CidrAddress.parse("192.168.10.1/24"));
        assertThat(host2.devices.get("ens7").addresses)
            .containsExactly(CidrAddress.parse("192.168.10.2/24"));

        assertThat(i1.getDeviceName()).hasValue("ens7");
        assertThat(i1.getAssignedAddresses())
            .containsExactly(CidrAddress.parse("192.168.10.1/24"));
        assertThat(i2.getAssignedAddresses())
            .containsExactly(CidrAddress.parse("192.168.10.2/24"));
    }

    @Test
    void secondRunChangesNothing() throws Exception {
        n1.addRoute("10.50.0.0/16", "192.168.10.254");
        n1.addPostBootExecute("touch /tmp/ready");
        activate();

        assertThat(configurator.configure(slice).isSuccess()).isTrue();
        assertThat(sudoCount()).isPositive();
        assertThat(host1.routes).contains("10.50.0.0/16");
        assertThat(host1.executed).containsExactly("touch /tmp/ready");
        assertThat(n1.isInstantiated()).isTrue();

        transport.log.clear();
        ConfigurationReport again = configurator.configure(slice);

        assertThat(again.isSuccess()).isTrue();
        assertThat(sudoCount()).isZero();
        assertThat(host1.executed).containsExactly("touch /tmp/ready");
        assertThat(i1.getAssignedAddresses())
            .containsExactly(CidrAddress.parse("192.168.10.1/24"));
    }

    @Test
    void secondRunKeepsAddressesAddedByPostBootTasks() throws Exception {
        i1.setMode(AddressMode.NONE);
        n1.addPostBootExecute("sudo ip addr add 10.9.9.9/24 dev ens7");
        slice.getNode("n2")
            .addPostBootExecute("sudo ip addr add 10.8.8.8/24 dev ens7");
        activate();

        assertThat(configurator.configure(slice).isSuccess()).isTrue();
        assertThat(host1.devices.get("ens7").addresses)
            .contains(CidrAddress.parse("10.9.9.9/24"));
        assertThat(host2.devices.get("ens7").addresses)
            .containsExactly(CidrAddress.parse("192.168.10.2/24"),
                             CidrAddress.parse("10.8.8.8/24"));

        transport.log.clear();
        ConfigurationReport again = configurator.configure(slice);

        assertThat(again.isSuccess()).as(again.toString()).isTrue();
        assertThat(sudoCount()).isZero();
        assertThat(host1.devices.get("ens7").addresses)
            .contains(CidrAddress.parse("10.9.9.9/24"));
        assertThat(host2.devices.get("ens7").addresses)
            .containsExactly(CidrAddress.parse("192.168.10.2/24"),
                             CidrAddress.parse("10.8.8.8/24"));
    }

    @Test
    void putsAddressesOnVlanDevice() throws Exception {
        i1.setVlan(100);
        activate();

        assertThat(configurator.configure(slice).isSuccess()).isTrue();

        assertThat(transport.commandsFor("10.0.0.1")).contains(
            "sudo ip link add link ens7 name ens7.100 type vlan id 100");
        SimulatedHost.Dev vlan = host1.devices.get("ens7.100");
        assertThat(vlan.up).isTrue();
        assertThat(vlan.addresses)
            .containsExactly(CidrAddress.parse("192.168.10.1/24"));
        assertThat(host1.devices.get("ens7").addresses).isEmpty();
        assertThat(host1.devices.get("ens7").up).isTrue();
        assertThat(i1.getDeviceName()).hasValue("ens7.100");
    }

    @Test
    void keepsStrayAddressesWhenNotFlushing() throws Exception {
        RemoteChannel channel =
            new RemoteChannel(transport,
                              new BastionRelay("bastion.example.org", 22,
                                               "alice",
                                               Paths.get("/tmp/bastion_key")),
                              1, Backoff.fixed(0), 1000, new ManualPacer(0));
        PostBootConfigurator keeping =
            new PostBootConfigurator(channel, reconciler, executor, 5000,
                                     false);
        activate();

        assertThat(keeping.configure(slice).isSuccess()).isTrue();
        assertThat(host1.devices.get("ens7").addresses)
            .containsExactly(CidrAddress.parse("172.16.0.5/24"),
                             CidrAddress.parse("192.168.10.1/24"));
    }

    @Test
    void isolatesFailingNode() throws Exception {
        host2.devices.remove("ens7");
        activate();

        ConfigurationReport report = configurator.configure(slice);

        assertThat(report.isSuccess()).isFalse();
        assertThat(report.configured()).containsExactly("n1");
        assertThat(report.failures()).containsOnlyKeys("n2");
        assertThat(report.failures().get("n2"))
            .isInstanceOf(ConfigurationStepException.class)
            .hasMessageContaining("02:00:00:00:00:02");
        assertThat(host1.devices.get("ens7").addresses)
            .containsExactly(CidrAddress.parse("192.168.10.1/24"));
    }

    @Test
    void reportsUnreadableAddressList() throws Exception {
        transport.host("10.0.0.2", cmd -> {
            if (cmd.equals("ip -j addr list"))
                return CommandResult.of(0, "[{\"ifname\":\"ens7\","
                    + "\"addr_info\":[{\"family\":\"inet\","
                    + "\"local\":\"10.1.2.3\",\"scope\":\"global\"}]}]",
                                        "");
            return host2.run(cmd);
        });
        activate();

        ConfigurationReport report = configurator.configure(slice);

        assertThat(report.configured()).containsExactly("n1");
        assertThat(report.failures().get("n2"))
            .isInstanceOf(ConfigurationStepException.class)
            .hasMessageContaining("read network state");
    }

    @Test
    void reportsUnreachableNode() throws Exception {
        transport.failConnects("10.0.0.2", 1);
        activate();

        ConfigurationReport report =
            configurator.configure(slice, Collections.singletonList(slice
                .getNode("n2")));

        assertThat(report.configured()).isEmpty();
        assertThat(report.failures().get("n2"))
            .isInstanceOf(RemoteExecutionException.class);
    }

    @Test
    void retriesPostBootTasksAfterFailure() throws Exception {
        n1.addPostBootExecute("./setup.sh");
        host1.failing.add("./setup.sh");
        activate();

        ConfigurationReport report = configurator.configure(slice);
        assertThat(report.failures()).containsOnlyKeys("n1");
        assertThat(n1.isInstantiated()).isFalse();

        host1.failing.clear();
        assertThat(configurator.configure(slice).isSuccess()).isTrue();
        assertThat(host1.executed).containsExactly("./setup.sh",
                                                   "./setup.sh");
        assertThat(n1.isInstantiated()).isTrue();
    }

    @Test
    void failsEveryNodeWhenSubnetExhausted() throws Exception {
        slice.getNetworkService("net1")
            .setSubnet(Subnet.parse("192.168.10.0/30"),
                       CidrAddress.parseAddress("192.168.10.1"));
        activate();

        ConfigurationReport report = configurator.configure(slice);
        assertThat(report.failures()).containsOnlyKeys("n1", "n2");
        assertThat(transport.opens).hasValue(0);
    }

    @Test
    void uploadsFilesOnce() throws Exception {
        n1.addPostBootUpload(Paths.get("/tmp/app.conf"), "app.conf");
        n1.addPostBootUploadDirectory(Paths.get("/tmp/tools"), "tools");
        activate();

        configurator.configure(slice);
        configurator.configure(slice);

        List<String> cmds = transport.commandsFor("10.0.0.1");
        assertThat(cmds.stream().filter(s -> s.startsWith("upload ")))
            .containsExactly("upload /tmp/app.conf app.conf",
                             "upload /tmp/tools tools -r");
    }
}
