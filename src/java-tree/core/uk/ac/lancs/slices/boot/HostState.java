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

import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.json.Json;
import javax.json.JsonArray;
import javax.json.JsonObject;
import javax.json.JsonReader;
import javax.json.JsonReaderFactory;
import javax.json.JsonString;
import javax.json.JsonValue;

import uk.ac.lancs.slices.CidrAddress;
import uk.ac.lancs.slices.Subnet;

/**
 * Models the network configuration of a node, as reported by
 * <samp>ip -j addr list</samp> and <samp>ip -j route list</samp>. The
 * model is updated as changes are made, so that later steps see the
 * effects of earlier ones without querying the node again.
 */
final class HostState {
    private static final JsonReaderFactory readerFactory =
        Json.createReaderFactory(Collections.emptyMap());

    /**
     * A network device
     */
    static final class Link {
        final String name;

        final String mac;

        /**
         * The device that this one is stacked on, such as the parent
         * of a VLAN device, or {@code null}
         */
        final String parent;

        boolean up;

        /**
         * Global-scope addresses on the device
         */
        final List<CidrAddress> addresses = new ArrayList<>();

        Link(String name, String mac, String parent, boolean up) {
            this.name = name;
            this.mac = mac == null ? null : mac.toLowerCase();
            this.parent = parent;
            this.up = up;
        }
    }

    /**
     * A routing table entry
     */
    static final class RouteEntry {
        /**
         * The destination, or {@code null} for the default route
         */
        final Subnet destination;

        final String gateway;

        final String device;

        RouteEntry(Subnet destination, String gateway, String device) {
            this.destination = destination;
            this.gateway = gateway;
            this.device = device;
        }
    }

    private final Map<String, Link> links = new LinkedHashMap<>();

    private final List<RouteEntry> routes = new ArrayList<>();

    private static JsonArray parseArray(String json) {
        String text = json.trim();
        if (text.isEmpty()) return JsonValue.EMPTY_JSON_ARRAY;
        try (JsonReader reader =
            readerFactory.createReader(new StringReader(text))) {
            return reader.readArray();
        }
    }

    private static String string(JsonObject obj, String key) {
        JsonValue value = obj.get(key);
        if (!(value instanceof JsonString)) return null;
        return ((JsonString) value).getString();
    }

    /**
     * Add devices from the output of <samp>ip -j addr list</samp>.
     * 
     * @param json the command's output
     * 
     * @throws javax.json.JsonException if the output is malformed
     * 
     * @throws NullPointerException if an address has no prefix length
     */
    void parseLinks(String json) {
        for (JsonValue v : parseArray(json)) {
            JsonObject obj = (JsonObject) v;
            String name = string(obj, "ifname");
            if (name == null) continue;
            boolean up = false;
            JsonArray flags = obj.getJsonArray("flags");
            if (flags != null) for (JsonValue f : flags)
                if (f instanceof JsonString &&
                    "UP".equals(((JsonString) f).getString()))
                    up = true;
            Link link = new Link(name, string(obj, "address"),
                                 string(obj, "link"), up);
            JsonArray infos = obj.getJsonArray("addr_info");
            if (infos != null) for (JsonValue iv : infos) {
                JsonObject info = (JsonObject) iv;
                String family = string(info, "family");
                String local = string(info, "local");
                if (local == null || !"global".equals(string(info, "scope")))
                    continue;
                if (!"inet".equals(family) && !"inet6".equals(family))
                    continue;
                link.addresses.add(new CidrAddress(CidrAddress
                    .parseAddress(local), info.getInt("prefixlen")));
            }
            links.put(name, link);
        }
    }

    /**
     * Add routes from the output of <samp>ip -j route list</samp> or
     * <samp>ip -j -6 route list</samp>.
     * 
     * @param json the command's output
     * 
     * @throws javax.json.JsonException if the output is malformed
     */
    void parseRoutes(String json) {
        for (JsonValue v : parseArray(json)) {
            JsonObject obj = (JsonObject) v;
            String dst = string(obj, "dst");
            if (dst == null) continue;
            Subnet dest = null;
            if (!"default".equals(dst)) {
                if (dst.indexOf('/') < 0) {
                    boolean v6 = dst.indexOf(':') >= 0;
                    dst = dst + (v6 ? "/128" : "/32");
                }
                try {
                    dest = Subnet.parse(dst);
                } catch (IllegalArgumentException ex) {
                    /* Multicast, broadcast and other special entries */
                    continue;
                }
            }
            routes.add(new RouteEntry(dest, string(obj, "gateway"),
                                      string(obj, "dev")));
        }
    }

    /**
     * Get the device carrying the default route.
     * 
     * @return the device name, or {@code null} if there is no default
     * route
     */
    String defaultDevice() {
        for (RouteEntry r : routes)
            if (r.destination == null && r.device != null) return r.device;
        return null;
    }

    /**
     * Get a device by name.
     * 
     * @param name the device name
     * 
     * @return the device, or {@code null} if not found
     */
    Link link(String name) {
        return links.get(name);
    }

    /**
     * Find a physical device by MAC address. Stacked devices such as
     * VLANs share their parent's address, and are not considered.
     * 
     * @param mac the MAC address, in any case
     * 
     * @return the device, or {@code null} if not found
     */
    Link findPhysical(String mac) {
        String key = mac.toLowerCase();
        for (Link link : links.values())
            if (link.parent == null && key.equals(link.mac)) return link;
        return null;
    }

    /**
     * Record a new device.
     * 
     * @param link the device
     */
    void add(Link link) {
        links.put(link.name, link);
    }

    /**
     * Determine whether a route to a destination exists.
     * 
     * @param destination the destination subnet
     * 
     * @return {@code true} if there is an entry for exactly that
     * subnet
     */
    boolean hasRoute(Subnet destination) {
        for (RouteEntry r : routes)
            if (destination.equals(r.destination)) return true;
        return false;
    }

    /**
     * Record a new route.
     * 
     * @param route the route
     */
    void add(RouteEntry route) {
        routes.add(route);
    }
}
