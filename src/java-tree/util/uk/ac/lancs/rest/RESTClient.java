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

package uk.ac.lancs.rest;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.function.Supplier;

import javax.json.Json;
import javax.json.JsonException;
import javax.json.JsonReader;
import javax.json.JsonReaderFactory;
import javax.json.JsonStructure;
import javax.json.JsonWriter;
import javax.json.JsonWriterFactory;

import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.HttpClient;
import org.apache.http.client.entity.EntityBuilder;
import org.apache.http.client.methods.HttpDelete;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ContentType;
import org.apache.http.util.EntityUtils;

/**
 * Performs basic JSON REST operations to a specified service.
 */
public class RESTClient {
    /**
     * The root service URI
     */
    protected final URI service;

    /**
     * A source of authorization for each request
     */
    protected final RESTAuthorization authz;

    /**
     * A source of HTTP clients
     */
    protected final Supplier<? extends HttpClient> httpProvider;

    private static final JsonReaderFactory readerFactory =
        Json.createReaderFactory(Collections.emptyMap());

    private static final JsonWriterFactory writerFactory =
        Json.createWriterFactory(Collections.emptyMap());

    /**
     * Create a REST client for a given service, using the supplied HTTP
     * clients and authorization.
     * 
     * @param service the root URI (ending in a slash) of the REST API
     * 
     * @param httpProvider a source of HTTP clients
     * 
     * @param authz a source of authorization strings to send with each
     * request, or {@code null} if not required
     */
    protected RESTClient(URI service,
                         Supplier<? extends HttpClient> httpProvider,
                         RESTAuthorization authz) {
        this.service = service;
        this.authz = authz;
        this.httpProvider = httpProvider;
    }

    private RESTResponse<JsonStructure> request(HttpUriRequest request)
        throws IOException {
        if (authz != null) {
            String value = authz.authorization();
            if (value != null) request.setHeader("Authorization", value);
        }
        request.setHeader("Accept", "application/json");
        HttpClient client = httpProvider.get();
        HttpResponse rsp = client.execute(request);
        final int code = rsp.getStatusLine().getStatusCode();
        final JsonStructure result;
        HttpEntity ent = rsp.getEntity();
        byte[] body = ent == null ? new byte[0] : EntityUtils.toByteArray(ent);
        if (body.length == 0) {
            result = null;
        } else {
            JsonStructure parsed;
            try (JsonReader reader = readerFactory
                .createReader(new ByteArrayInputStream(body),
                              StandardCharsets.UTF_8)) {
                parsed = reader.read();
            } catch (JsonException ex) {
                /* Error pages are often not JSON. Only complain if we
                 * were expecting content. */
                if (code >= 200 && code < 300)
                    throw new IOException("malformed response from "
                        + request.getURI(), ex);
                parsed = null;
            }
            result = parsed;
        }
        return new RESTResponse<>(code, result);
    }

    /**
     * Perform a GET request on the service.
     * 
     * @param sub the resource within the service
     * 
     * @return the JSON response and code
     * 
     * @throws IOException if an I/O error occurred
     */
    protected RESTResponse<JsonStructure> getResource(String sub)
        throws IOException {
        return request(new HttpGet(service.resolve(sub)));
    }

    /**
     * Perform a DELETE request on the service.
     * 
     * @param sub the resource within the service
     * 
     * @return the JSON response and code
     * 
     * @throws IOException if an I/O error occurred
     */
    protected RESTResponse<JsonStructure> deleteResource(String sub)
        throws IOException {
        return request(new HttpDelete(service.resolve(sub)));
    }

    /**
     * Perform a POST request on the service.
     * 
     * @param sub the resource within the service
     * 
     * @param body the request body, or {@code null} for none
     * 
     * @return the JSON response and code
     * 
     * @throws IOException if an I/O error occurred
     */
    protected RESTResponse<JsonStructure> postResource(String sub,
                                                       JsonStructure body)
        throws IOException {
        HttpPost request = new HttpPost(service.resolve(sub));
        if (body != null) request.setEntity(entityOf(body));
        return request(request);
    }

    private static HttpEntity entityOf(JsonStructure body) {
        StringWriter out = new StringWriter();
        try (JsonWriter writer = writerFactory.createWriter(out)) {
            writer.write(body);
        }
        return EntityBuilder.create()
            .setContentType(ContentType.APPLICATION_JSON)
            .setText(out.toString()).build();
    }
}
