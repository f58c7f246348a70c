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

import java.net.InetAddress;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

import javax.json.Json;
import javax.json.JsonArrayBuilder;
import javax.json.JsonException;
import javax.json.JsonNumber;
import javax.json.JsonObject;
import javax.json.JsonObjectBuilder;
import javax.json.JsonString;
import javax.json.JsonValue;

import uk.ac.lancs.slices.CidrAddress;
import uk.ac.lancs.slices.Capacity;
import uk.ac.lancs.slices.Component;
import uk.ac.lancs.slices.Interface;
import uk.ac.lancs.slices.NetworkService;
import uk.ac.lancs.slices.Node;
import uk.ac.lancs.slices.PostBootTask;
import uk.ac.lancs.slices.ReservationState;
import uk.ac.lancs.slices.Route;
import uk.ac.lancs.slices.Slice;
import uk.ac.lancs.slices.SliceEntity;
import uk.ac.lancs.slices.Subnet;

/**
 * Converts slices and snapshots to and from JSON. The same document
 * shape is used for requests, for orchestrator responses, and for
 * persisted slice state:
 * 
 * <pre>
 * {
 *   "slice": { "name": ..., "slice_id": ..., "lease_end": ... },
 *   "nodes": {
 *     "node1": {
 *       "site": ..., "state": "Active", "management_ip": ...,
 *       "components": {
 *         "nic1": {
 *           "model": "NIC_Basic", "state": ...,
 *           "interfaces": { "node1-nic1-p1": { "mac": ... } }
 *         }
 *       }
 *     }
 *   },
 *   "network_services": {
 *     "net1": { "type": "L2Bridge", "interfaces": [ ... ], ... }
 *   }
 * }
 * </pre>
 * 
 * <p>
 * Request fields and report fields of an entity share one object.
 * Absent report fields leave the corresponding entity unreported.
 */
public final class TopologyJson {
    private TopologyJson() {}

    private static final DateTimeFormatter LEGACY_TIME =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z");

    /**
     * Encode a slice's requested topology and current state.
     * 
     * @param slice the slice to encode
     * 
     * @return the JSON document
     */
    public static JsonObject encode(Slice slice) {
        return slice.read(() -> encodeLocked(slice));
    }

    private static JsonObject encodeLocked(Slice slice) {
        JsonObjectBuilder head = Json.createObjectBuilder();
        head.add("name", slice.getName());
        addOpt(head, "slice_id", slice.getSliceId());
        head.add("state", slice.getState().name());
        addOpt(head, "project_id", slice.getProjectId());
        addOpt(head, "lease_start", slice.getLeaseStart().map(Instant::toString));
        addOpt(head, "lease_end", slice.getLeaseEnd().map(Instant::toString));

        JsonObjectBuilder nodes = Json.createObjectBuilder();
        for (Node node : slice.getNodes())
            nodes.add(node.getName(), encode(node));

        JsonObjectBuilder services = Json.createObjectBuilder();
        for (NetworkService svc : slice.getNetworkServices())
            services.add(svc.getName(), encode(svc));

        return Json.createObjectBuilder().add("slice", head)
            .add("nodes", nodes).add("network_services", services).build();
    }

    private static JsonObjectBuilder encode(Node node) {
        JsonObjectBuilder result = Json.createObjectBuilder();
        result.add("site", node.getSite());
        result.add("image", node.getImage());
        Optional<Capacity> cap = node.getCapacity();
        if (cap.isPresent())
            result.add("capacity", Json.createObjectBuilder()
                .add("cores", cap.get().cores).add("ram", cap.get().ramGb)
                .add("disk", cap.get().diskGb));
        addOpt(result, "instance_type", node.getInstanceType());
        addOpt(result, "host", node.getHost());
        result.add("username", node.getUsername());

        JsonArrayBuilder tasks = Json.createArrayBuilder();
        for (PostBootTask task : node.getPostBootTasks()) {
            JsonObjectBuilder t = Json.createObjectBuilder();
            t.add("kind", task.getKind().name());
            if (task.getCommand() != null) t.add("command", task.getCommand());
            if (task.getLocal() != null)
                t.add("local", task.getLocal().toString());
            if (task.getRemote() != null) t.add("remote", task.getRemote());
            tasks.add(t);
        }
        result.add("post_boot_tasks", tasks);

        JsonArrayBuilder routes = Json.createArrayBuilder();
        for (Route route : node.getRoutes())
            routes.add(Json.createObjectBuilder()
                .add("destination", route.getDestination())
                .add("next_hop", route.getNextHop()));
        result.add("routes", routes);
        result.add("instantiated", node.isInstantiated());

        addReservation(result, node);
        addOpt(result, "management_ip",
               node.getManagementAddress().map(InetAddress::getHostAddress));
        addOpt(result, "placed_host", node.getPlacedHost());

        JsonObjectBuilder comps = Json.createObjectBuilder();
        for (Component comp : node.getComponents())
            comps.add(comp.getLocalName(), encode(comp));
        result.add("components", comps);
        return result;
    }

    private static JsonObjectBuilder encode(Component comp) {
        JsonObjectBuilder result = Json.createObjectBuilder();
        result.add("model", comp.getModel().label());
        addReservation(result, comp);
        addOpt(result, "pci_address", comp.getPciAddress());
        JsonObjectBuilder ifaces = Json.createObjectBuilder();
        for (Interface iface : comp.getInterfaces())
            ifaces.add(iface.getName(), encode(iface));
        result.add("interfaces", ifaces);
        return result;
    }

    private static JsonObjectBuilder encode(Interface iface) {
        JsonObjectBuilder result = Json.createObjectBuilder();
        Optional<Integer> vlan = iface.getVlan();
        if (vlan.isPresent()) result.add("vlan", vlan.get());
        Optional<Integer> bw = iface.getBandwidth();
        if (bw.isPresent()) result.add("bandwidth", bw.get());
        result.add("mode", iface.getMode().name());
        addOpt(result, "manual_address",
               iface.getManualAddress().map(CidrAddress::toString));
        addReservation(result, iface);
        addOpt(result, "mac", iface.getMac());
        addOpt(result, "device", iface.getDeviceName());
        JsonArrayBuilder addrs = Json.createArrayBuilder();
        for (CidrAddress addr : iface.getAssignedAddresses())
            addrs.add(addr.toString());
        result.add("addresses", addrs);
        return result;
    }

    private static JsonObjectBuilder encode(NetworkService svc) {
        JsonObjectBuilder result = Json.createObjectBuilder();
        result.add("type", svc.getType().label());
        JsonArrayBuilder members = Json.createArrayBuilder();
        for (Interface iface : svc.getInterfaces())
            members.add(iface.getName());
        result.add("interfaces", members);
        JsonArrayBuilder hops = Json.createArrayBuilder();
        for (String hop : svc.getHops())
            hops.add(hop);
        result.add("hops", hops);
        addReservation(result, svc);
        addOpt(result, "subnet", svc.getSubnet().map(Subnet::toString));
        addOpt(result, "gateway",
               svc.getGateway().map(InetAddress::getHostAddress));
        return result;
    }

    private static void addReservation(JsonObjectBuilder builder,
                                       SliceEntity entity) {
        addOpt(builder, "reservation_id", entity.getReservationId());
        builder.add("state", entity.getReservationState().label());
        addOpt(builder, "error", entity.getErrorMessage());
    }

    private static void addOpt(JsonObjectBuilder builder, String key,
                               Optional<String> value) {
        if (value.isPresent()) builder.add(key, value.get());
    }

    /**
     * Decode the reports of a document into a snapshot. Entities with
     * no <samp>state</samp> field are omitted.
     * 
     * @param doc the JSON document
     * 
     * @return the snapshot
     * 
     * @throws IllegalArgumentException if the document is malformed,
     * or has no slice identifier
     */
    public static TopologySnapshot decodeSnapshot(JsonObject doc) {
        try {
            JsonObject head = doc.getJsonObject("slice");
            if (head == null)
                throw new IllegalArgumentException("no slice object");
            String sliceId = string(head, "slice_id");
            if (sliceId == null)
                throw new IllegalArgumentException("no slice_id");
            TopologySnapshot.Builder builder =
                TopologySnapshot.builder(sliceId)
                    .sliceState(string(head, "orchestrator_state"))
                    .lease(instant(head, "lease_start"),
                           instant(head, "lease_end"));

            for (Map.Entry<String, JsonValue> ne : object(doc, "nodes")
                .entrySet())
                decodeNode(builder, ne.getKey(), (JsonObject) ne.getValue());

            for (Map.Entry<String, JsonValue> se : object(doc,
                                                          "network_services")
                                                              .entrySet()) {
                JsonObject svc = (JsonObject) se.getValue();
                ReservationState ss = state(svc);
                if (ss == null) continue;
                String subnet = string(svc, "subnet");
                String gateway = string(svc, "gateway");
                builder.add(new ServiceSliver(se.getKey(),
                                              string(svc, "reservation_id"),
                                              ss, string(svc, "error"),
                                              subnet == null ? null :
                                                  Subnet.parse(subnet),
                                              gateway == null ? null :
                                                  CidrAddress
                                                      .parseAddress(gateway)));
            }
            return builder.build();
        } catch (ClassCastException | NullPointerException | JsonException
            | ArithmeticException | DateTimeParseException ex) {
            throw new IllegalArgumentException("malformed topology document",
                                               ex);
        }
    }

    private static void decodeNode(TopologySnapshot.Builder builder,
                                   String name, JsonObject node) {
        ReservationState ns = state(node);
        if (ns != null) {
            String addr = string(node, "management_ip");
            InetAddress mgmt =
                addr == null ? null : CidrAddress.parseAddress(addr);
            builder.add(new NodeSliver(name, string(node, "reservation_id"),
                                       ns, string(node, "error"), mgmt,
                                       string(node, "placed_host")));
        }
        for (Map.Entry<String, JsonValue> ce : object(node, "components")
            .entrySet()) {
            JsonObject comp = (JsonObject) ce.getValue();
            ReservationState cs = state(comp);
            if (cs != null)
                builder.add(new ComponentSliver(name + "-" + ce.getKey(),
                                                string(comp, "reservation_id"),
                                                cs, string(comp, "error"),
                                                string(comp, "pci_address")));
            for (Map.Entry<String, JsonValue> ie : object(comp, "interfaces")
                .entrySet()) {
                JsonObject iface = (JsonObject) ie.getValue();
                ReservationState is = state(iface);
                if (is == null) continue;
                builder.add(new InterfaceSliver(ie.getKey(),
                                                string(iface, "reservation_id"),
                                                is, string(iface, "error"),
                                                string(iface, "mac"),
                                                integer(iface, "vlan")));
            }
        }
    }

    private static ReservationState state(JsonObject obj) {
        String label = string(obj, "state");
        if (label == null) return null;
        return ReservationState.fromLabel(label);
    }

    static JsonObject object(JsonObject obj, String key) {
        JsonValue value = obj.get(key);
        if (value == null || value == JsonValue.NULL)
            return JsonValue.EMPTY_JSON_OBJECT;
        return (JsonObject) value;
    }

    /**
     * Get an optional string field.
     * 
     * @param obj the containing object
     * 
     * @param key the field name
     * 
     * @return the string value, or {@code null} if absent or null
     * 
     * @throws ClassCastException if the field is not a string
     */
    public static String string(JsonObject obj, String key) {
        JsonValue value = obj.get(key);
        if (value == null || value == JsonValue.NULL) return null;
        return ((JsonString) value).getString();
    }

    /**
     * Get an optional integer field.
     * 
     * @param obj the containing object
     * 
     * @param key the field name
     * 
     * @return the integer value, or {@code null} if absent or null
     * 
     * @throws ClassCastException if the field is not a number
     * 
     * @throws ArithmeticException if the number is not an integer in
     * range
     */
    public static Integer integer(JsonObject obj, String key) {
        JsonValue value = obj.get(key);
        if (value == null || value == JsonValue.NULL) return null;
        return ((JsonNumber) value).intValueExact();
    }

    /**
     * Get an optional time field. ISO-8601 instants are accepted, as
     * are times of the form <samp>2024-01-31 12:00:00 +0000</samp>.
     * 
     * @param obj the containing object
     * 
     * @param key the field name
     * 
     * @return the time, or {@code null} if absent or null
     * 
     * @throws DateTimeParseException if the field is malformed
     */
    public static Instant instant(JsonObject obj, String key) {
        String text = string(obj, key);
        if (text == null) return null;
        return parseTime(text);
    }

    /**
     * Parse a time. ISO-8601 instants are accepted, as are times of
     * the form <samp>2024-01-31 12:00:00 +0000</samp>.
     * 
     * @param text the text to parse
     * 
     * @return the parsed time
     * 
     * @throws DateTimeParseException if the text is malformed
     */
    public static Instant parseTime(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException ex) {
            return ZonedDateTime.parse(text, LEGACY_TIME).toInstant();
        }
    }

    /**
     * Format a time in the form expected by the orchestrator, e.g.,
     * <samp>2024-01-31 12:00:00 +0000</samp>.
     * 
     * @param time the time to format
     * 
     * @return the formatted time
     */
    public static String formatTime(Instant time) {
        return LEGACY_TIME.format(time.atZone(ZoneOffset.UTC));
    }
}
