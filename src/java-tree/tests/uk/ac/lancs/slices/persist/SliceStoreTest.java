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

package uk.ac.lancs.slices.persist;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Collections;
import java.util.stream.Stream;

import javax.json.JsonObject;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import uk.ac.lancs.slices.AddressMode;
import uk.ac.lancs.slices.CidrAddress;
import uk.ac.lancs.slices.Interface;
import uk.ac.lancs.slices.Node;
import uk.ac.lancs.slices.PostBootTask;
import uk.ac.lancs.slices.Reconciler;
import uk.ac.lancs.slices.ReservationState;
import uk.ac.lancs.slices.Slice;
import uk.ac.lancs.slices.SliceFixtures;
import uk.ac.lancs.slices.SliceState;
import uk.ac.lancs.slices.SliceKeys;

class SliceStoreTest {
    @TempDir
    Path dir;

    private final Reconciler reconciler = new Reconciler();

    private final SliceStore store = new SliceStore(reconciler);

    private Slice slice;

    private Node n1;

    private Interface i1;

    private Interface i2;

    @BeforeEach
    void setUp() throws Exception {
        slice = SliceFixtures.bridgedPair("exp");
        n1 = slice.getNode("n1");
        i1 = n1.getInterfaces().get(0);
        i2 = slice.getNode("n2").getInterfaces().get(0);
    }

    private void decorate() throws Exception {
        n1.setUsername("ubuntu");
        n1.addPostBootExecute("sudo dnf -y install iperf3");
        n1.addPostBootUpload(Paths.get("/tmp/app.conf"), "app.conf");
        n1.addPostBootUploadDirectory(Paths.get("/tmp/tools"), "tools");
        n1.addRoute("10.50.0.0/16", "192.168.10.254");
        i1.setVlan(100);
        i1.setBandwidth(10);
        i2.setManualAddress(CidrAddress.parse("192.168.10.20/24"));
        slice.setLeaseEnd(Instant.parse("2026-05-01T00:00:00Z"));
        slice.excludeFromStability(slice.getNode("n2"));
    }

    @Test
    void restoresUnsubmittedRequest() throws Exception {
        decorate();
        Path file = dir.resolve("exp.json");
        store.save(slice, file);

        Slice copy = store.load(file);

        assertThat(store.encode(copy)).isEqualTo(store.encode(slice));
        assertThat(copy.getState()).isEqualTo(SliceState.UNSUBMITTED);
        assertThat(copy.getSliceId()).isEmpty();
        assertThat(copy.getLeaseEnd())
            .hasValue(Instant.parse("2026-05-01T00:00:00Z"));
        assertThat(copy.getKeys().getPrivateKey())
            .isEqualTo(Paths.get("/tmp/slice_key"));

        Node m1 = copy.getNode("n1");
        assertThat(m1.getUsername()).isEqualTo("ubuntu");
        assertThat(m1.getPostBootTasks()).hasSize(3);
        assertThat(m1.getPostBootTasks().get(2).getKind())
            .isEqualTo(PostBootTask.Kind.UPLOAD_DIRECTORY);
        assertThat(m1.getRoutes()).hasSize(1);

        Interface j1 = m1.getInterfaces().get(0);
        assertThat(j1.getVlan()).hasValue(100);
        assertThat(j1.getBandwidth()).hasValue(10);
        Interface j2 = copy.getNode("n2").getInterfaces().get(0);
        assertThat(j2.getMode()).isEqualTo(AddressMode.MANUAL);
        assertThat(j2.getManualAddress())
            .hasValue(CidrAddress.parse("192.168.10.20/24"));
        assertThat(j2.getNetworkService().get().getName()).isEqualTo("net1");
        assertThat(copy.isExcludedFromStability(copy.getNode("n2"))).isTrue();
        assertThat(copy.isExcludedFromStability(m1)).isFalse();
    }

    @Test
    void restoresReportedState() throws Exception {
        reconciler.accept(slice, SliceFixtures
            .uniform(slice, "s-1", ReservationState.ACTIVE));
        reconciler.recordConfiguration(i1, "ens7", Collections
            .singletonList(CidrAddress.parse("192.168.10.1/24")));
        reconciler.markInstantiated(n1);
        Path file = dir.resolve("state/exp.json");
        store.save(slice, file);

        Slice copy = store.load(file);

        assertThat(store.encode(copy)).isEqualTo(store.encode(slice));
        assertThat(copy.getSliceId()).hasValue("s-1");
        assertThat(copy.getState()).isEqualTo(slice.getState());
        Node m1 = copy.getNode("n1");
        assertThat(m1.getReservationState())
            .isEqualTo(ReservationState.ACTIVE);
        assertThat(m1.getManagementAddress())
            .hasValue(CidrAddress.parseAddress("10.0.0.1"));
        assertThat(m1.isInstantiated()).isTrue();
        assertThat(copy.getNode("n2").isInstantiated()).isFalse();
        Interface j1 = m1.getInterfaces().get(0);
        assertThat(j1.getMac()).hasValue("02:00:00:00:00:01");
        assertThat(j1.getDeviceName()).hasValue("ens7");
        assertThat(j1.getAssignedAddresses())
            .containsExactly(CidrAddress.parse("192.168.10.1/24"));
    }

    @Test
    void replacesFileWithoutLeavingTemporaries() throws Exception {
        Path file = dir.resolve("exp.json");
        store.save(slice, file);
        n1.addPostBootExecute("true");
        store.save(slice, file);

        try (Stream<Path> entries = Files.list(dir)) {
            assertThat(entries).containsExactly(file);
        }
        assertThat(store.load(file).getNode("n1").getPostBootTasks())
            .hasSize(1);
    }

    @Test
    void omitsMissingKeys() throws Exception {
        Slice bare = new Slice("bare", null, null);
        bare.addNode("n1", "STAR");
        JsonObject doc = store.encode(bare);
        assertThat(doc.getJsonObject("slice")).doesNotContainKeys(
            "private_key", "public_key");

        Slice copy = store.decode(doc);
        SliceKeys keys = copy.getKeys();
        assertThat(keys.getPrivateKey()).isNull();
        assertThat(copy.getProjectId()).isEmpty();
    }

    @Test
    void rejectsCorruptFile() throws Exception {
        Path file = dir.resolve("bad.json");
        Files.write(file, "{\"slice\": [".getBytes(StandardCharsets.UTF_8));
        assertThatThrownBy(() -> store.load(file))
            .isInstanceOf(IOException.class);

        Files.write(file, "{\"nodes\": {}}".getBytes(StandardCharsets.UTF_8));
        assertThatThrownBy(() -> store.load(file))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("malformed");

        assertThatThrownBy(() -> store.load(dir.resolve("absent.json")))
            .isInstanceOf(IOException.class);
    }
}
