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

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import javax.json.Json;
import javax.json.JsonException;
import javax.json.JsonObject;
import javax.json.JsonReader;
import javax.json.JsonReaderFactory;

/**
 * Reads a bearer token from a JSON token file, as written by the
 * testbed's credential manager. The file holds an object with an
 * <samp>id_token</samp> field.
 */
public final class TokenFileCredentialSource implements CredentialSource {
    private static final JsonReaderFactory readerFactory =
        Json.createReaderFactory(Collections.emptyMap());

    private final Path tokenFile;

    /**
     * Read tokens from a file.
     * 
     * @param tokenFile the token file
     */
    public TokenFileCredentialSource(Path tokenFile) {
        this.tokenFile = tokenFile;
    }

    @Override
    public String bearerToken() throws IOException {
        try (Reader in = Files.newBufferedReader(tokenFile,
                                                 StandardCharsets.UTF_8);
             JsonReader reader = readerFactory.createReader(in)) {
            JsonObject root = reader.readObject();
            String token = TopologyJson.string(root, "id_token");
            if (token == null || token.isEmpty())
                throw new IOException("no id_token in " + tokenFile);
            return token;
        } catch (JsonException | ClassCastException ex) {
            throw new IOException("malformed token file " + tokenFile, ex);
        }
    }
}
