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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import javax.json.Json;
import javax.json.JsonArray;
import javax.json.JsonArrayBuilder;
import javax.json.JsonException;
import javax.json.JsonObject;
import javax.json.JsonObjectBuilder;
import javax.json.JsonReader;
import javax.json.JsonReaderFactory;
import javax.json.JsonString;
import javax.json.JsonValue;
import javax.json.JsonWriter;
import javax.json.JsonWriterFactory;
import javax.json.stream.JsonGenerator;

import uk.ac.lancs.slices.AddressMode;
import uk.ac.lancs.slices.Capacity;
import uk.ac.lancs.slices.CidrAddress;
import uk.ac.lancs.slices.Component;
import uk.ac.lancs.slices.Interface;
import uk.ac.lancs.slices.InvalidSpecException;
import uk.ac.lancs.slices.NetworkService;
import uk.ac.lancs.slices.Node;
import uk.ac.lancs.slices.PostBootTask;
import uk.ac.lancs.slices.Reconciler;
import uk.ac.lancs.slices.Slice;
import uk.ac.lancs.slices.SliceEntity;
import uk.ac.lancs.slices.SliceKeys;
import uk.ac.lancs.slices.SliceState;
import uk.ac.lancs.slices.ServiceType;
import uk.ac.lancs.slices.Subnet;
import uk.ac.lancs.slices.TopologyException;
import uk.ac.lancs.slices.orchestrator.TopologyJson;
import uk.ac.lancs.slices.orchestrator.TopologySnapshot;

/**
 * Saves slices to JSON files, and restores them. A saved slice records
 * its requested topology, the last state reported for each entity, and
 * the configuration applied to each node, so that a restored slice can
 * be polled, configured or deleted without submitting it again.
 * 
 * <p>
 * The document has the form produced by
 * {@link TopologyJson#encode(Slice)}, with the key files and the
 * entities excluded from stability checks added to the
 * <samp>slice</samp> object.
 * 
 * @author simpsons
 */
public final class SliceStore {
    private static final Logger logger =
        Logger.getLogger("uk.ac.lancs.slices.persist");

    private static final JsonReaderFactory readerFactory =
        Json.createReaderFactory(Collections.emptyMap());

    private static final JsonWriterFactory writerFactory = Json
        .createWriterFactory(Collections
            .singletonMap(JsonGenerator.PRETTY_PRINTING, true));

    private final Reconciler reconciler;

    /**
     * Create a store.
     * 
     * @param reconciler the means to restore reported state into loaded
     * slices
     */
    public SliceStore(Reconciler reconciler) {
        this.reconciler = reconciler;
    }

    /**
     * Encode a slice for saving.
     * 
     * @param slice the slice to encode
     * 
     * @return the JSON document
     */
    public JsonObject encode(Slice slice) {
        JsonObject doc = TopologyJson.encode(slice);
        JsonArrayBuilder excluded = Json.createArrayBuilder();
        for (SliceEntity entity : slice.getEntities())
            if (slice.isExcludedFromStability(entity))
                excluded.add(entity.kind() + ":" + entity.getName());
        SliceKeys keys = slice.getKeys();
        JsonObjectBuilder head =
            Json.createObjectBuilder(doc.getJsonObject("slice"));
        if (keys != null && keys.getPrivateKey() != null)
            head.add("private_key", keys.getPrivateKey().toString());
        if (keys != null && keys.getPublicKey() != null)
            head.add("public_key", keys.getPublicKey().toString());
        head.add("excluded", excluded);
        return Json.createObjectBuilder(doc).add("slice", head).build();
    }

    /**
     * Save a slice to a file. The file is replaced atomically, so a
     * failed save leaves any previous content intact.
     * 
     * @param slice the slice to save
     * 
     * @param file the destination file
     * 
     * @throws IOException if the file could not be written
     */
    public void save(Slice slice, Path file) throws IOException {
        JsonObject doc = encode(slice);
        Path abs = file.toAbsolutePath();
        Path dir = abs.getParent();
        if (dir != null) Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, abs.getFileName() + ".", ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp);
                 JsonWriter writer = writerFactory.createWriter(out)) {
                writer.writeObject(doc);
            }
            Files.move(tmp, abs, StandardCopyOption.REPLACE_EXISTING,
                       StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        logger.fine(() -> "saved " + slice + " to " + abs);
    }

    /**
     * Load a slice from a file.
     * 
     * @param file the file to read
     * 
     * @return the restored slice
     * 
     * @throws IOException if the file could not be read, or is not a
     * JSON object
     * 
     * @throws TopologyException if the described topology is invalid
     */
    public Slice load(Path file) throws IOException, TopologyException {
        JsonObject doc;
        try (InputStream in = Files.newInputStream(file);
             JsonReader reader = readerFactory.createReader(in)) {
            doc = reader.readObject();
        } catch (JsonException ex) {
            throw new IOException("bad slice file " + file, ex);
        }
        try {
            return decode(doc);
        } catch (ClassCastException | NullPointerException
            | ArithmeticException | IllegalArgumentException
            | DateTimeException ex) {
            throw new IOException("malformed slice file " + file, ex);
        }
    }

    /**
     * Restore a slice from a document produced by
     * {@link #encode(Slice)}.
     * 
     * @param doc the document
     * 
     * @return the restored slice
     * 
     * @throws TopologyException if the described topology is invalid
     * 
     * @throws IllegalArgumentException if the document is malformed
     */
    public Slice decode(JsonObject doc) throws TopologyException {
        JsonObject head = doc.getJsonObject("slice");
        String privKey = TopologyJson.string(head, "private_key");
        String pubKey = TopologyJson.string(head, "public_key");
        SliceKeys keys =
            new SliceKeys(privKey == null ? null : Paths.get(privKey),
                          pubKey == null ? null : Paths.get(pubKey));
        Slice slice = new Slice(TopologyJson.string(head, "name"),
                                TopologyJson.string(head, "project_id"), keys);

        Collection<String> instantiated = new HashSet<>();
        Map<String, String> devices = new HashMap<>();
        Map<String, List<CidrAddress>> addresses = new HashMap<>();

        for (Map.Entry<String, JsonValue> ne : object(doc, "nodes")
            .entrySet()) {
            JsonObject nobj = (JsonObject) ne.getValue();
            Node node = decodeNode(slice, ne.getKey(), nobj);
            if (nobj.getBoolean("instantiated", false))
                instantiated.add(node.getName());
            for (Map.Entry<String, JsonValue> ce : object(nobj, "components")
                .entrySet()) {
                JsonObject cobj = (JsonObject) ce.getValue();
                Component comp = node
                    .addComponent(TopologyJson.string(cobj, "model"),
                                  ce.getKey());
                for (Map.Entry<String, JsonValue> ie : object(cobj,
                                                              "interfaces")
                                                                  .entrySet()) {
                    Interface iface = null;
                    for (Interface cand : comp.getInterfaces())
                        if (cand.getName().equals(ie.getKey())) iface = cand;
                    if (iface == null)
                        throw new IllegalArgumentException("no interface "
                            + ie.getKey() + " on " + comp.getName());
                    JsonObject iobj = (JsonObject) ie.getValue();
                    decodeInterface(iface, iobj);
                    String dev = TopologyJson.string(iobj, "device");
                    if (dev != null) devices.put(iface.getName(), dev);
                    List<CidrAddress> addrs = new ArrayList<>();
                    for (JsonValue av : array(iobj, "addresses"))
                        addrs.add(CidrAddress
                            .parse(((JsonString) av).getString()));
                    if (!addrs.isEmpty()) addresses.put(iface.getName(), addrs);
                }
            }
        }

        for (Map.Entry<String, JsonValue> se : object(doc, "network_services")
            .entrySet())
            decodeService(slice, se.getKey(), (JsonObject) se.getValue());

        for (JsonValue ev : array(head, "excluded")) {
            String key = ((JsonString) ev).getString();
            for (SliceEntity entity : slice.getEntities())
                if (key.equals(entity.kind() + ":" + entity.getName()))
                    slice.excludeFromStability(entity);
        }

        SliceState state = SliceState.UNSUBMITTED;
        String stateText = TopologyJson.string(head, "state");
        if (stateText != null) state = SliceState.parse(stateText);

        TopologySnapshot snapshot = null;
        if (TopologyJson.string(head, "slice_id") != null) {
            snapshot = TopologyJson.decodeSnapshot(doc);
        } else if (head.containsKey("lease_end")) {
            slice.setLeaseEnd(TopologyJson.instant(head, "lease_end"));
        }
        reconciler.restore(slice, state, snapshot, instantiated, devices,
                           addresses);
        return slice;
    }

    private static Node decodeNode(Slice slice, String name, JsonObject nobj)
        throws TopologyException {
        Capacity capacity = null;
        JsonObject cap = nobj.getJsonObject("capacity");
        if (cap != null)
            capacity = Capacity.of(cap.getInt("cores"), cap.getInt("ram"),
                                   cap.getInt("disk"));
        Node node = slice.addNode(name, TopologyJson.string(nobj, "site"),
                                  TopologyJson.string(nobj, "image"),
                                  capacity,
                                  TopologyJson.string(nobj, "instance_type"));
        String host = TopologyJson.string(nobj, "host");
        if (host != null) node.setHost(host);
        String user = TopologyJson.string(nobj, "username");
        if (user != null) node.setUsername(user);
        for (JsonValue tv : array(nobj, "post_boot_tasks")) {
            JsonObject t = (JsonObject) tv;
            PostBootTask.Kind kind =
                PostBootTask.Kind.valueOf(TopologyJson.string(t, "kind"));
            String local = TopologyJson.string(t, "local");
            String remote = TopologyJson.string(t, "remote");
            switch (kind) {
            case EXECUTE:
                node.addPostBootExecute(TopologyJson.string(t, "command"));
                break;
            case UPLOAD_FILE:
                node.addPostBootUpload(Paths.get(local), remote);
                break;
            case UPLOAD_DIRECTORY:
                node.addPostBootUploadDirectory(Paths.get(local), remote);
                break;
            }
        }
        for (JsonValue rv : array(nobj, "routes")) {
            JsonObject r = (JsonObject) rv;
            node.addRoute(TopologyJson.string(r, "destination"),
                          TopologyJson.string(r, "next_hop"));
        }
        return node;
    }

    private static void decodeInterface(Interface iface, JsonObject iobj)
        throws TopologyException {
        Integer vlan = TopologyJson.integer(iobj, "vlan");
        if (vlan != null) iface.setVlan(vlan);
        Integer bw = TopologyJson.integer(iobj, "bandwidth");
        if (bw != null) iface.setBandwidth(bw);
        String manual = TopologyJson.string(iobj, "manual_address");
        String mode = TopologyJson.string(iobj, "mode");
        if (manual != null) {
            iface.setManualAddress(CidrAddress.parse(manual));
        } else if (mode != null) {
            AddressMode am = AddressMode.valueOf(mode);
            if (am == AddressMode.MANUAL)
                throw new InvalidSpecException("interface " + iface.getName()
                    + " is manual with no address");
            iface.setMode(am);
        }
    }

    private static void decodeService(Slice slice, String name,
                                      JsonObject sobj)
        throws TopologyException {
        ServiceType type =
            ServiceType.fromLabel(TopologyJson.string(sobj, "type"));
        List<Interface> members = new ArrayList<>();
        for (JsonValue mv : array(sobj, "interfaces")) {
            String iname = ((JsonString) mv).getString();
            Interface iface = slice.getInterface(iname);
            if (iface == null)
                throw new IllegalArgumentException("service " + name
                    + " has unknown member " + iname);
            members.add(iface);
        }
        NetworkService svc = slice.addNetworkService(name, type, members);
        List<String> hops = new ArrayList<>();
        for (JsonValue hv : array(sobj, "hops"))
            hops.add(((JsonString) hv).getString());
        if (!hops.isEmpty()) svc.setHops(hops);
        String subnet = TopologyJson.string(sobj, "subnet");
        if (subnet != null && !type.isLayer3()) {
            String gw = TopologyJson.string(sobj, "gateway");
            svc.setSubnet(Subnet.parse(subnet),
                          gw == null ? null : CidrAddress.parseAddress(gw));
        }
    }

    private static JsonObject object(JsonObject obj, String key) {
        JsonValue value = obj.get(key);
        if (value == null || value == JsonValue.NULL)
            return JsonValue.EMPTY_JSON_OBJECT;
        return (JsonObject) value;
    }

    private static JsonArray array(JsonObject obj, String key) {
        JsonValue value = obj.get(key);
        if (value == null || value == JsonValue.NULL)
            return JsonValue.EMPTY_JSON_ARRAY;
        return (JsonArray) value;
    }
}
