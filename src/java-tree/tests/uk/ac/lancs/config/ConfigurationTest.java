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

package uk.ac.lancs.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationTest {
    private final Configuration config = ConfigurationContext
        .of("base = /srv/fabric\n" + "token.file = ${base}/id_token.json\n"
            + "ssh.bastion.host = bastion.example.org\n"
            + "ssh.bastion.port = 2222\n" + "poll.interval = 2.5\n"
            + "keys = a, b  c\n" + "odd = ${no.such.thing}/x\n");

    @Test
    void expandsReferencesToOtherProperties() {
        assertThat(config.get("token.file"))
            .isEqualTo("${base}/id_token.json");
        assertThat(config.getExpanded("token.file"))
            .isEqualTo("/srv/fabric/id_token.json");
        assertThat(config.getPath("token.file", null))
            .isEqualTo(Paths.get("/srv/fabric/id_token.json"));
        assertThat(config.getExpanded("missing", "${base}/x"))
            .isEqualTo("/srv/fabric/x");
        assertThat(config.getExpanded("missing")).isNull();
    }

    @Test
    void leavesUndefinedReferences() {
        assertThat(config.getExpanded("odd")).isEqualTo("${no.such.thing}/x");
    }

    @Test
    void presentsSubviews() {
        Configuration bastion = config.subview("ssh.bastion");
        assertThat(bastion.get("host")).isEqualTo("bastion.example.org");
        assertThat(bastion.getInt("port", 22)).isEqualTo(2222);
        assertThat(bastion.keys()).containsExactlyInAnyOrder("host", "port");
        assertThat(config.subview("ssh").subview("bastion").get("host"))
            .isEqualTo("bastion.example.org");
        assertThat(bastion.getExpanded("missing", "${base}"))
            .isEqualTo("/srv/fabric");
        assertThat(config.subview("")).isSameAs(config);
    }

    @Test
    void convertsValues() {
        assertThat(config.getSeconds("poll.interval", 0)).isEqualTo(2500);
        assertThat(config.getSeconds("poll.timeout", 1800000))
            .isEqualTo(1800000);
        assertThat(config.getList("keys")).containsExactly("a", "b", "c");
        assertThat(config.getList("missing")).isEmpty();
        assertThatThrownBy(() -> config.getInt("base", 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("base");
        assertThatThrownBy(() -> config.getSeconds("base", 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void copiesToProperties() {
        assertThat(config.subview("ssh").toProperties())
            .containsEntry("bastion.port", "2222").hasSize(2);
    }

    @Test
    void cachesLoadedFiles(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("slices.properties");
        Files.write(file, "threads = 8\n".getBytes(StandardCharsets.UTF_8));
        ConfigurationContext ctxt = new ConfigurationContext();

        Configuration first = ctxt.get(file);
        assertThat(first.getInt("threads", 1)).isEqualTo(8);
        assertThat(ctxt.get(dir.resolve("./slices.properties")))
            .isSameAs(first);
        assertThatThrownBy(() -> ctxt.get(dir.resolve("absent.properties")))
            .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> ctxt
            .getResource(getClass().getClassLoader(), "no/such.properties"))
                .isInstanceOf(IOException.class);
    }
}
