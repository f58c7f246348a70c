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
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collection;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.json.Json;
import javax.json.JsonArray;
import javax.json.JsonArrayBuilder;
import javax.json.JsonObject;
import javax.json.JsonStructure;

import org.apache.http.client.HttpClient;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.HttpClients;

import uk.ac.lancs.rest.RESTClient;
import uk.ac.lancs.rest.RESTResponse;
import uk.ac.lancs.slices.Slice;

/**
 * Accesses an orchestrator through its JSON REST API.
 * 
 * <p>
 * Responses with 4xx codes are reported as {@link RejectedException}.
 * Connection failures, 5xx codes and malformed responses are reported
 * as {@link TransportException}.
 */
public class RESTOrchestrator extends RESTClient implements Orchestrator {
    private static final Logger logger =
        Logger.getLogger("uk.ac.lancs.slices.orchestrator");

    /**
     * Create an orchestrator client.
     * 
     * @param service the root URI (ending in a slash) of the REST API
     * 
     * @param httpProvider a source of HTTP clients
     * 
     * @param credentials a source of bearer tokens
     */
    public RESTOrchestrator(URI service,
                            Supplier<? extends HttpClient> httpProvider,
                            CredentialSource credentials) {
        super(service, httpProvider, () -> {
            try {
                return "Bearer " + credentials.bearerToken();
            } catch (IOException ex) {
                throw new CredentialFailure(ex);
            }
        });
    }

    /**
     * Create an orchestrator client with its own HTTP client.
     * 
     * @param service the root URI (ending in a slash) of the REST API
     * 
     * @param credentials a source of bearer tokens
     * 
     * @param timeoutMillis the connection and read timeout
     * 
     * @return the new client
     */
    public static RESTOrchestrator create(URI service,
                                          CredentialSource credentials,
                                          int timeoutMillis) {
        RequestConfig config = RequestConfig.custom()
            .setConnectTimeout(timeoutMillis)
            .setConnectionRequestTimeout(timeoutMillis)
            .setSocketTimeout(timeoutMillis).build();
        HttpClient client =
            HttpClients.custom().setDefaultRequestConfig(config).build();
        return new RESTOrchestrator(service, () -> client, credentials);
    }

    private static class CredentialFailure extends IOException {
        private static final long serialVersionUID = 1L;

        CredentialFailure(IOException cause) {
            super(cause.getMessage(), cause);
        }
    }

    private static String encode(String text) {
        return URLEncoder.encode(text, StandardCharsets.UTF_8);
    }

    @Override
    public TopologySnapshot submit(Slice slice, Collection<String> sshKeys)
        throws TransportException,
            RejectedException {
        StringBuilder sub = new StringBuilder("slices/create?name=")
            .append(encode(slice.getName()));
        if (slice.getLeaseEnd().isPresent())
            sub.append("&lease_end_time=").append(encode(TopologyJson
                .formatTime(slice.getLeaseEnd().get())));
        JsonArrayBuilder keys = Json.createArrayBuilder();
        for (String key : sshKeys)
            keys.add(key);
        JsonObject body = Json.createObjectBuilder()
            .add("graph_model", TopologyJson.encode(slice))
            .add("ssh_keys", keys).build();
        RESTResponse<JsonStructure> rsp = call("submit " + slice.getName(),
                                               () -> postResource(sub
                                                   .toString(), body));
        TopologySnapshot result = snapshot(rsp, "submit " + slice.getName());
        logger.info(() -> "submitted " + slice.getName() + " as "
            + result.sliceId());
        return result;
    }

    @Override
    public TopologySnapshot query(String sliceId)
        throws TransportException,
            RejectedException {
        String what = "query " + sliceId;
        RESTResponse<JsonStructure> rsp = call(what, () -> getResource("slices/"
            + encode(sliceId) + "?graph_format=JSON"));
        return snapshot(rsp, what);
    }

    @Override
    public void delete(String sliceId)
        throws TransportException,
            RejectedException {
        call("delete " + sliceId,
             () -> deleteResource("slices/delete/" + encode(sliceId)));
    }

    @Override
    public void renew(String sliceId, Instant leaseEnd)
        throws TransportException,
            RejectedException {
        call("renew " + sliceId,
             () -> postResource("slices/renew/" + encode(sliceId) + "?lease_end_time="
                 + encode(TopologyJson.formatTime(leaseEnd)), null));
    }

    private interface Request {
        RESTResponse<JsonStructure> perform() throws IOException;
    }

    private RESTResponse<JsonStructure> call(String what, Request request)
        throws TransportException,
            RejectedException {
        final RESTResponse<JsonStructure> rsp;
        try {
            rsp = request.perform();
        } catch (CredentialFailure ex) {
            throw new RejectedException(0, what + ": no credential: "
                + ex.getMessage());
        } catch (IOException ex) {
            logger.log(Level.FINE, what + " failed", ex);
            throw new TransportException(what + ": " + ex.getMessage(), ex);
        }
        if (rsp.isSuccess()) return rsp;
        String detail = errorDetail(rsp.message);
        if (rsp.isClientError())
            throw new RejectedException(rsp.code, what + ": " + rsp.code
                + (detail == null ? "" : " " + detail));
        throw new TransportException(what + ": " + rsp.code
            + (detail == null ? "" : " " + detail));
    }

    private static TopologySnapshot snapshot(RESTResponse<JsonStructure> rsp,
                                             String what)
        throws TransportException {
        if (!(rsp.message instanceof JsonObject))
            throw new TransportException(what + ": response not an object");
        try {
            return TopologyJson.decodeSnapshot((JsonObject) rsp.message);
        } catch (IllegalArgumentException ex) {
            throw new TransportException(what + ": " + ex.getMessage(), ex);
        }
    }

    private static String errorDetail(JsonStructure body) {
        if (!(body instanceof JsonObject)) return null;
        JsonObject obj = (JsonObject) body;
        try {
            JsonArray errors = obj.getJsonArray("errors");
            if (errors != null && !errors.isEmpty()) {
                JsonObject first = errors.getJsonObject(0);
                String msg = TopologyJson.string(first, "message");
                String details = TopologyJson.string(first, "details");
                if (details != null) return msg + ": " + details;
                return msg;
            }
            return TopologyJson.string(obj, "message");
        } catch (ClassCastException ex) {
            return null;
        }
    }
}
