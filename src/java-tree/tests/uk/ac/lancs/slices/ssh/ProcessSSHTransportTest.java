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

package uk.ac.lancs.slices.ssh;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.InetAddress;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

class ProcessSSHTransportTest {
    private final ProcessSSHTransport transport =
        new ProcessSSHTransport("/usr/bin/ssh", "/usr/bin/scp");

    private final BastionRelay bastion =
        new BastionRelay("bastion.example.org", 2222, "alice",
                         Paths.get("/keys/bastion"));

    private final Path socket = Paths.get("/tmp/ctl/sock");

    private SSHTarget target(String address) throws Exception {
        return new SSHTarget("n1", InetAddress.getByName(address), "ubuntu",
                             Paths.get("/keys/slice"), bastion);
    }

    @Test
    void quotesForShell() {
        assertThat(ProcessSSHTransport.shellQuote("plain")).isEqualTo("'plain'");
        assertThat(ProcessSSHTransport.shellQuote("it's"))
            .isEqualTo("'it'\\''s'");
        assertThat(ProcessSSHTransport.shellQuote("")).isEqualTo("''");
    }

    @Test
    void relaysThroughBastion() {
        String proxy = transport.proxyCommand(bastion, 30);
        assertThat(proxy).startsWith("/usr/bin/ssh -i '/keys/bastion'")
            .contains("-o ConnectTimeout=30").contains("-l 'alice'")
            .contains("-p 2222").endsWith("-W %h:%p 'bastion.example.org'");
    }

    @Test
    void masterHoldsConnectionWithoutCommand() throws Exception {
        List<String> cmd = transport.masterCommand(target("10.0.0.1"), socket, 30);
        assertThat(cmd).startsWith("/usr/bin/ssh", "-M", "-N")
            .contains("ControlPath=/tmp/ctl/sock", "/keys/slice",
                      "BatchMode=yes", "IdentitiesOnly=yes")
            .endsWith("-l", "ubuntu", "10.0.0.1");
        assertThat(cmd).anyMatch(s -> s.startsWith("ProxyCommand=/usr/bin/ssh"));
    }

    @Test
    void checksMasterThroughControlSocket() throws Exception {
        assertThat(transport.controlCommand(target("10.0.0.1"), socket, "exit"))
            .containsExactly("/usr/bin/ssh", "-S", "/tmp/ctl/sock", "-O",
                             "exit", "-l", "ubuntu", "10.0.0.1");
    }

    @Test
    void wrapsCommandInRemoteTimeout() throws Exception {
        List<String> cmd = transport.execCommand(target("10.0.0.1"), socket,
                                                 30, "ip -j addr list", 2500);
        assertThat(cmd).contains("ControlMaster=no");
        assertThat(cmd.get(cmd.size() - 2)).isEqualTo("--");
        assertThat(cmd.get(cmd.size() - 1))
            .isEqualTo("timeout --foreground -k 10 3 bash -c 'ip -j addr list'");
    }

    @Test
    void runsCommandBareWithoutTimeout() throws Exception {
        List<String> cmd = transport.execCommand(target("10.0.0.1"), socket,
                                                 30, "uptime", 0);
        assertThat(cmd).endsWith("10.0.0.1", "--", "uptime");
    }

    @Test
    void copiesRecursivelyOnRequest() throws Exception {
        List<String> plain = transport.copyCommand(target("10.0.0.1"), socket,
                                                   30, false, "/tmp/a",
                                                   "ubuntu@10.0.0.1:a");
        assertThat(plain).startsWith("/usr/bin/scp", "-q", "-o")
            .doesNotContain("-r").endsWith("/tmp/a", "ubuntu@10.0.0.1:a");

        List<String> tree = transport.copyCommand(target("10.0.0.1"), socket,
                                                  30, true, "/tmp/d",
                                                  "ubuntu@10.0.0.1:d");
        assertThat(tree).startsWith("/usr/bin/scp", "-q", "-r");
    }

    @Test
    void stripsScopeFromIPv6Host() throws Exception {
        SSHTarget t = target("2001:db8::5");
        assertThat(t.host()).isEqualTo("2001:db8:0:0:0:0:0:5");
        assertThat(transport.masterCommand(t, socket, 10))
            .endsWith("2001:db8:0:0:0:0:0:5");
        assertThat(ProcessSSHTransport.remoteSpec(t, "results"))
            .isEqualTo("ubuntu@[2001:db8:0:0:0:0:0:5]:results");
        assertThat(ProcessSSHTransport.remoteSpec(target("10.0.0.1"), "a"))
            .isEqualTo("ubuntu@10.0.0.1:a");
    }

    @Test
    void waitsForClientThatFinishes() throws Exception {
        Process proc = new ProcessBuilder("true").start();
        assertThat(ProcessSSHTransport.awaitExit(proc, 10000)).isTrue();
        assertThat(proc.exitValue()).isZero();
    }

    @Test
    void killsClientThatOverruns() throws Exception {
        Process proc = new ProcessBuilder("sleep", "30").start();
        try {
            assertThat(ProcessSSHTransport.awaitExit(proc, 200)).isFalse();
            assertThat(proc.isAlive()).isFalse();
        } finally {
            proc.destroyForcibly();
        }
    }

    @Test
    void killsClientWhenInterrupted() throws Exception {
        Process proc = new ProcessBuilder("sleep", "30").start();
        try {
            Thread.currentThread().interrupt();
            assertThatThrownBy(() -> ProcessSSHTransport.awaitExit(proc, 0))
                .isInstanceOf(InterruptedException.class);
            assertThat(proc.waitFor(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            Thread.interrupted();
            proc.destroyForcibly();
        }
    }
}
