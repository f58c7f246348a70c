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

package uk.ac.lancs.slices.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.StringReader;
import java.nio.file.Paths;
import java.time.Instant;

import javax.json.Json;
import javax.json.JsonObject;
import javax.json.JsonReader;

import org.junit.jupiter.api.Test;

import uk.ac.lancs.slices.Interface;
import uk.ac.lancs.slices.Node;
import uk.ac.lancs.slices.ReservationState;
import uk.ac.lancs.slices.Slice;
import uk.ac.lancs.slices.SliceFixtures;

class TopologyJsonTest {
    private static JsonObject parse(String text) {
        try (JsonReader reader = Json.createReader(new StringReader(text))) {
            return reader.readObject();
        }
    }

    @Test
    void encodesRequestedTopology() throws Exception {
        Slice slice = SliceFixtures.bridgedPair("exp");
        Node n1 = slice.getNode("n1");
        n1.addPostBootExecute("echo hi");
        n1.addPostBootUpload(Paths.get("/tmp/a.sh"), "a.sh");
        n1.addRoute("10.20.0.0/16", "net1");
        Interface iface = slice.getInterface("n1-nic1-p1");
        iface.setVlan(200);

        JsonObject doc = TopologyJson.encode(slice);

        JsonObject head = doc.getJsonObject("slice");
        assertThat(head.getString("name")).isEqualTo("exp");
        assertThat(head.getString("state")).isEqualTo("UNSUBMITTED");
        assertThat(head.containsKey("slice_id")).isFalse();
        JsonObject node = doc.getJsonObject("nodes").getJsonObject("n1");
        assertThat(node.getString("site")).isEqualTo("STAR");
        assertThat(node.getJsonObject("capacity").getInt("cores"))
            .isEqualTo(2);
        assertThat(node.getString("username")).isEqualTo("rocky");
        assertThat(node.getJsonArray("post_boot_tasks")).hasSize(2);
        assertThat(node.getJsonArray("post_boot_tasks").getJsonObject(1)
            .getString("kind")).isEqualTo("UPLOAD_FILE");
        assertThat(node.getJsonArray("routes").getJsonObject(0)
            .getString("next_hop")).isEqualTo("net1");
        JsonObject ifObj = node.getJsonObject("components")
            .getJsonObject("nic1").getJsonObject("interfaces")
            .getJsonObject("n1-nic1-p1");
        assertThat(ifObj.getInt("vlan")).isEqualTo(200);
        assertThat(ifObj.getString("mode")).isEqualTo("AUTO");
        assertThat(ifObj.getString("state")).isEqualTo("Unsubmitted");
        JsonObject svc =
            doc.getJsonObject("network_services").getJsonObject("net1");
        assertThat(svc.getString("subnet")).isEqualTo("192.168.10.0/24");
        assertThat(svc.getJsonArray("interfaces").getString(1))
            .isEqualTo("n2-nic1-p1");
    }

    @Test
    void omitsEntitiesWithoutState() {
        TopologySnapshot snap = TopologyJson.decodeSnapshot(parse(
            "{\"slice\":{\"slice_id\":\"s\"},\"nodes\":{"
                + "\"n1\":{\"site\":\"STAR\",\"components\":{\"c\":{"
                + "\"interfaces\":{\"n1-c-p1\":{\"state\":\"Nascent\"}}}}},"
                + "\"n2\":{\"state\":\"CloseWait\"}}}"));

        assertThat(snap.nodes()).containsOnlyKeys("n2");
        assertThat(snap.nodes().get("n2").state)
            .isEqualTo(ReservationState.CLOSING);
        assertThat(snap.components()).isEmpty();
        assertThat(snap.interfaces().get("n1-c-p1").state)
            .isEqualTo(ReservationState.PROVISIONING);
        assertThat(snap.services()).isEmpty();
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThatThrownBy(() -> TopologyJson.decodeSnapshot(parse("{}")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TopologyJson
            .decodeSnapshot(parse("{\"slice\":{\"name\":\"x\"}}")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TopologyJson.decodeSnapshot(parse(
            "{\"slice\":{\"slice_id\":\"s\"},\"nodes\":{\"n\":"
                + "{\"state\":\"Exploded\"}}}")))
                    .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TopologyJson.decodeSnapshot(parse(
            "{\"slice\":{\"slice_id\":\"s\"},\"nodes\":[]}")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TopologyJson.decodeSnapshot(parse(
            "{\"slice\":{\"slice_id\":\"s\",\"lease_end\":\"soon\"}}")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonIntegralVlan() {
        String head = "{\"slice\":{\"slice_id\":\"s\"},\"nodes\":{"
            + "\"n1\":{\"components\":{\"c\":{\"interfaces\":{"
            + "\"n1-c-p1\":{\"state\":\"Active\",\"vlan\":";
        String tail = "}}}}}}}";
        assertThatThrownBy(() -> TopologyJson
            .decodeSnapshot(parse(head + "100.5" + tail)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasCauseInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> TopologyJson
            .decodeSnapshot(parse(head + "4294967296" + tail)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(TopologyJson.decodeSnapshot(parse(head + "100" + tail))
            .interfaces().get("n1-c-p1").vlan).isEqualTo(100);
    }

    @Test
    void handlesBothTimeFormats() {
        Instant t = Instant.parse("2026-02-03T04:05:06Z");
        assertThat(TopologyJson.formatTime(t))
            .isEqualTo("2026-02-03 04:05:06 +0000");
        assertThat(TopologyJson.parseTime("2026-02-03 06:05:06 +0200"))
            .isEqualTo(t);
        assertThat(TopologyJson.parseTime("2026-02-03T04:05:06Z"))
            .isEqualTo(t);
    }
}
