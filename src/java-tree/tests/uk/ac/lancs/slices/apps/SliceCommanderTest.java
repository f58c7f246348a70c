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

package uk.ac.lancs.slices.apps;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import uk.ac.lancs.slices.Reconciler;
import uk.ac.lancs.slices.SliceFixtures;
import uk.ac.lancs.slices.persist.SliceStore;

class SliceCommanderTest {
    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private PrintStream oldOut;

    private PrintStream oldErr;

    private Path sliceFile;

    @BeforeEach
    void setUp() throws Exception {
        oldOut = System.out;
        oldErr = System.err;
        System.setOut(new PrintStream(out, true, "UTF-8"));
        System.setErr(new PrintStream(err, true, "UTF-8"));
        sliceFile = dir.resolve("exp.json");
        new SliceStore(new Reconciler())
            .save(SliceFixtures.bridgedPair("exp"), sliceFile);
    }

    @AfterEach
    void tearDown() {
        System.setOut(oldOut);
        System.setErr(oldErr);
    }

    private String out() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    void printsSavedSlice() throws Exception {
        new SliceCommander()
            .process(new String[] { "-f", sliceFile.toString(), "status" });

        assertThat(out()).contains("Loaded exp (UNSUBMITTED)")
            .contains("Slice exp [-] UNSUBMITTED")
            .contains("node n1 at STAR").contains("n2-nic1-p1")
            .contains("192.168.10.0/24");
    }

    @Test
    void needsSliceFile() throws Exception {
        SliceCommander cmdr = new SliceCommander();
        assertThat(cmdr.process(Arrays.asList("status").iterator()))
            .isFalse();
        assertThat(err()).contains("No slice loaded");
    }

    @Test
    void reportsMissingArgument() throws Exception {
        new SliceCommander().process(new String[] { "-f" });
        assertThat(err()).contains("Usage: -f <slice-file>");
    }

    @Test
    void stopsAtUnknownCommand() throws Exception {
        new SliceCommander().process(new String[] { "launch", "status" });
        assertThat(err()).contains("Unknown command: launch")
            .doesNotContain("No slice loaded");
    }
}
