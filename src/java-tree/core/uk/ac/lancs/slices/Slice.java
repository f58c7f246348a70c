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

package uk.ac.lancs.slices;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * A named collection of nodes and network services, reserved and
 * managed as a unit.
 * 
 * <p>
 * A slice is built locally, submitted to the orchestrator once, and
 * then updated from orchestrator snapshots by a {@link Reconciler}.
 * Nodes and services can only be added before submission. All state is
 * guarded by a single per-slice lock, so readers never see a snapshot
 * half-applied.
 */
public final class Slice {
    final Object lock = new Object();

    private final String name;

    private final String projectId;

    private final SliceKeys keys;

    private final Map<String, Node> nodes = new LinkedHashMap<>();

    private final Map<String, NetworkService> services =
        new LinkedHashMap<>();

    private final Set<String> excluded = new HashSet<>();

    private String sliceId;

    private SliceState state = SliceState.UNSUBMITTED;

    private Instant leaseStart;

    private Instant leaseEnd;

    /**
     * The image used when none is specified
     */
    public static final String DEFAULT_IMAGE = "default_rocky_8";

    /**
     * Create an empty slice.
     * 
     * @param name the slice's name
     * 
     * @param projectId the project to charge the slice to, or
     * {@code null} to use the credential's default
     * 
     * @param keys the key pair to install on the slice's nodes
     */
    public Slice(String name, String projectId, SliceKeys keys) {
        this.name = name;
        this.projectId = projectId;
        this.keys = keys;
    }

    /**
     * Get the slice's name.
     * 
     * @return the slice's name
     */
    public String getName() {
        return name;
    }

    /**
     * Get the project the slice belongs to.
     * 
     * @return the project identifier, if specified
     */
    public Optional<String> getProjectId() {
        return Optional.ofNullable(projectId);
    }

    /**
     * Get the key pair installed on the slice's nodes.
     * 
     * @return the slice's keys
     */
    public SliceKeys getKeys() {
        return keys;
    }

    /**
     * Get the identifier assigned by the orchestrator.
     * 
     * @return the slice identifier, once submitted
     */
    public Optional<String> getSliceId() {
        synchronized (lock) {
            return Optional.ofNullable(sliceId);
        }
    }

    /**
     * Get the slice's lifecycle state.
     * 
     * @return the current state
     */
    public SliceState getState() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Get the start of the slice's lease.
     * 
     * @return the lease start, if reported
     */
    public Optional<Instant> getLeaseStart() {
        synchronized (lock) {
            return Optional.ofNullable(leaseStart);
        }
    }

    /**
     * Get the end of the slice's lease. Before submission, this is the
     * requested end.
     * 
     * @return the lease end, if known
     */
    public Optional<Instant> getLeaseEnd() {
        synchronized (lock) {
            return Optional.ofNullable(leaseEnd);
        }
    }

    /**
     * Request a lease end time.
     * 
     * @param leaseEnd the time at which resources are released
     * 
     * @throws InvalidStateException if the slice has been submitted
     */
    public void setLeaseEnd(Instant leaseEnd) throws InvalidStateException {
        synchronized (lock) {
            checkUnsubmitted();
            this.leaseEnd = leaseEnd;
        }
    }

    /**
     * Add a node with default image and capacity.
     * 
     * @param name the node's name
     * 
     * @param site the site to place the node at
     * 
     * @return the new node
     * 
     * @throws DuplicateNameException if a node already has the name
     * 
     * @throws InvalidSpecException if the name or site is malformed
     * 
     * @throws InvalidStateException if the slice has been submitted
     */
    public Node addNode(String name, String site)
        throws DuplicateNameException,
            InvalidSpecException,
            InvalidStateException {
        return addNode(name, site, DEFAULT_IMAGE, Capacity.DEFAULT, null);
    }

    /**
     * Add a node with explicit capacity.
     * 
     * @param name the node's name
     * 
     * @param site the site to place the node at
     * 
     * @param image the boot image
     * 
     * @param capacity the compute resources to request
     * 
     * @return the new node
     * 
     * @throws DuplicateNameException if a node already has the name
     * 
     * @throws InvalidSpecException if the name or site is malformed,
     * or no capacity is given
     * 
     * @throws InvalidStateException if the slice has been submitted
     */
    public Node addNode(String name, String site, String image,
                        Capacity capacity)
        throws DuplicateNameException,
            InvalidSpecException,
            InvalidStateException {
        return addNode(name, site, image, capacity, null);
    }

    /**
     * Add a node. Exactly one of capacity and instance type must be
     * given.
     * 
     * @param name the node's name
     * 
     * @param site the site to place the node at
     * 
     * @param image the boot image
     * 
     * @param capacity the compute resources to request, or
     * {@code null} if an instance type is given
     * 
     * @param instanceType the instance type to request, or {@code null}
     * if a capacity is given
     * 
     * @return the new node
     * 
     * @throws DuplicateNameException if a node already has the name
     * 
     * @throws InvalidSpecException if the name, site or image is
     * malformed, or if both or neither of capacity and instance type
     * are given
     * 
     * @throws InvalidStateException if the slice has been submitted
     */
    public Node addNode(String name, String site, String image,
                        Capacity capacity, String instanceType)
        throws DuplicateNameException,
            InvalidSpecException,
            InvalidStateException {
        checkName(name, "node");
        if (site == null || site.trim().isEmpty())
            throw new InvalidSpecException("no site for node " + name);
        if (image == null || image.trim().isEmpty())
            throw new InvalidSpecException("no image for node " + name);
        if ((capacity == null) == (instanceType == null))
            throw new InvalidSpecException("node " + name
                + " needs exactly one of capacity and instance type");
        synchronized (lock) {
            checkUnsubmitted();
            if (nodes.containsKey(name))
                throw new DuplicateNameException(name, "node");
            Node node =
                new Node(this, name, site, image, capacity, instanceType);
            nodes.put(name, node);
            return node;
        }
    }

    /**
     * Get a node by name.
     * 
     * @param name the node's name
     * 
     * @return the node, or {@code null} if not found
     */
    public Node getNode(String name) {
        synchronized (lock) {
            return nodes.get(name);
        }
    }

    /**
     * Get all nodes.
     * 
     * @return a copy of the nodes in order of creation
     */
    public List<Node> getNodes() {
        synchronized (lock) {
            return new ArrayList<>(nodes.values());
        }
    }

    /**
     * Remove a node, with its components and interfaces. Interfaces
     * are detached from their network services.
     * 
     * @param node the node to remove
     * 
     * @throws InvalidStateException if the slice has been submitted
     * and the node's reservation is not in a terminal state
     */
    public void removeNode(Node node) throws InvalidStateException {
        synchronized (lock) {
            if (nodes.get(node.getName()) != node) return;
            if (state != SliceState.UNSUBMITTED &&
                !node.getReservationState().isTerminal())
                throw new InvalidStateException("node " + node.getName()
                    + " is " + node.getReservationState().label());
            for (Interface iface : node.getInterfaces()) {
                Optional<NetworkService> svc = iface.getNetworkService();
                if (svc.isPresent()) svc.get().removeMember(iface);
                iface.setNetworkService(null);
            }
            nodes.remove(node.getName());
        }
    }

    /**
     * Add a network service.
     * 
     * @param name the service's name
     * 
     * @param type the service type
     * 
     * @param members the interfaces to join
     * 
     * @return the new service
     * 
     * @throws DuplicateNameException if a service already has the name
     * 
     * @throws InvalidSpecException if the name is malformed
     * 
     * @throws InvalidTopologyException if the members do not meet the
     * type's constraints, or any member is already attached to a
     * service or belongs to another slice
     * 
     * @throws InvalidStateException if the slice has been submitted
     */
    public NetworkService addNetworkService(String name, ServiceType type,
                                            List<Interface> members)
        throws DuplicateNameException,
            InvalidSpecException,
            InvalidTopologyException,
            InvalidStateException {
        checkName(name, "network service");
        synchronized (lock) {
            checkUnsubmitted();
            if (services.containsKey(name))
                throw new DuplicateNameException(name, "network service");
            Set<Interface> seen = new HashSet<>();
            for (Interface iface : members) {
                if (iface.slice != this ||
                    !nodes.containsValue(iface.getNode()))
                    throw new InvalidTopologyException("interface "
                        + iface.getName() + " is not in slice " + this.name);
                if (!seen.add(iface))
                    throw new InvalidTopologyException("interface "
                        + iface.getName() + " listed twice");
                Optional<NetworkService> other = iface.getNetworkService();
                if (other.isPresent())
                    throw new InvalidTopologyException("interface "
                        + iface.getName() + " already attached to "
                        + other.get().getName());
            }
            type.checkMembers(members);
            NetworkService svc = new NetworkService(this, name, type, members);
            for (Interface iface : members)
                iface.setNetworkService(svc);
            services.put(name, svc);
            return svc;
        }
    }

    /**
     * Add a layer-2 network service, choosing the type from the sites
     * of the members.
     * 
     * @param name the service's name
     * 
     * @param members the interfaces to join
     * 
     * @return the new service
     * 
     * @throws DuplicateNameException if a service already has the name
     * 
     * @throws InvalidSpecException if the name is malformed
     * 
     * @throws InvalidTopologyException if no layer-2 type fits the
     * members
     * 
     * @throws InvalidStateException if the slice has been submitted
     * 
     * @see ServiceType#chooseLayer2(List)
     */
    public NetworkService addL2Network(String name, List<Interface> members)
        throws DuplicateNameException,
            InvalidSpecException,
            InvalidTopologyException,
            InvalidStateException {
        return addNetworkService(name, ServiceType.chooseLayer2(members),
                                 members);
    }

    /**
     * Add a layer-3 network service.
     * 
     * @param name the service's name
     * 
     * @param type the layer-3 service type
     * 
     * @param members the interfaces to join
     * 
     * @return the new service
     * 
     * @throws DuplicateNameException if a service already has the name
     * 
     * @throws InvalidSpecException if the name is malformed, or the
     * type is not a layer-3 type
     * 
     * @throws InvalidTopologyException if the members do not meet the
     * type's constraints
     * 
     * @throws InvalidStateException if the slice has been submitted
     */
    public NetworkService addL3Network(String name, ServiceType type,
                                       List<Interface> members)
        throws DuplicateNameException,
            InvalidSpecException,
            InvalidTopologyException,
            InvalidStateException {
        if (!type.isLayer3())
            throw new InvalidSpecException(type.label()
                + " is not a layer-3 service type");
        return addNetworkService(name, type, members);
    }

    /**
     * Get a network service by name.
     * 
     * @param name the service's name
     * 
     * @return the service, or {@code null} if not found
     */
    public NetworkService getNetworkService(String name) {
        synchronized (lock) {
            return services.get(name);
        }
    }

    /**
     * Get all network services.
     * 
     * @return a copy of the services in order of creation
     */
    public List<NetworkService> getNetworkServices() {
        synchronized (lock) {
            return new ArrayList<>(services.values());
        }
    }

    /**
     * Remove a network service, detaching its members.
     * 
     * @param service the service to remove
     * 
     * @throws InvalidStateException if the slice has been submitted
     * and the service's reservation is not in a terminal state
     */
    public void removeNetworkService(NetworkService service)
        throws InvalidStateException {
        synchronized (lock) {
            if (services.get(service.getName()) != service) return;
            if (state != SliceState.UNSUBMITTED &&
                !service.getReservationState().isTerminal())
                throw new InvalidStateException("network service "
                    + service.getName() + " is "
                    + service.getReservationState().label());
            for (Interface iface : service.members())
                iface.setNetworkService(null);
            services.remove(service.getName());
        }
    }

    /**
     * Get the components of all nodes.
     * 
     * @return a copy of the components
     */
    public List<Component> getComponents() {
        synchronized (lock) {
            List<Component> result = new ArrayList<>();
            for (Node node : nodes.values())
                result.addAll(node.components());
            return result;
        }
    }

    /**
     * Get the interfaces of all nodes.
     * 
     * @return a copy of the interfaces
     */
    public List<Interface> getInterfaces() {
        synchronized (lock) {
            List<Interface> result = new ArrayList<>();
            for (Node node : nodes.values())
                for (Component c : node.components())
                    result.addAll(c.getInterfaces());
            return result;
        }
    }

    /**
     * Find an interface by name.
     * 
     * @param name the interface name
     * 
     * @return the interface, or {@code null} if not found
     */
    public Interface getInterface(String name) {
        for (Interface iface : getInterfaces())
            if (iface.getName().equals(name)) return iface;
        return null;
    }

    /**
     * Get every entity of the slice. Nodes come first, then
     * components, interfaces and network services.
     * 
     * @return a copy of all entities
     */
    public List<SliceEntity> getEntities() {
        synchronized (lock) {
            List<SliceEntity> result = new ArrayList<>(nodes.values());
            result.addAll(getComponents());
            result.addAll(getInterfaces());
            result.addAll(services.values());
            return result;
        }
    }

    /**
     * Exclude an entity from stability checks. The entity still
     * causes the slice to fail if its reservation fails.
     * 
     * @param entity the entity to exclude
     */
    public void excludeFromStability(SliceEntity entity) {
        synchronized (lock) {
            excluded.add(entity.kind() + ":" + entity.getName());
        }
    }

    /**
     * Determine whether an entity is excluded from stability checks.
     * 
     * @param entity the entity to test
     * 
     * @return {@code true} if the entity is excluded
     */
    public boolean isExcludedFromStability(SliceEntity entity) {
        synchronized (lock) {
            return excluded.contains(entity.kind() + ":" + entity.getName());
        }
    }

    /**
     * Get errors reported for the slice's entities.
     * 
     * @return a map from entity description to error message, in
     * entity order
     */
    public Map<String, String> getErrorMessages() {
        synchronized (lock) {
            Map<String, String> result = new LinkedHashMap<>();
            for (SliceEntity entity : getEntities()) {
                Optional<String> msg = entity.getErrorMessage();
                if (msg.isPresent() && !msg.get().trim().isEmpty())
                    result.put(entity.toString(), msg.get());
            }
            return Collections.unmodifiableMap(result);
        }
    }

    /**
     * Check that the slice may be submitted.
     * 
     * @throws InvalidTopologyException if the slice has no nodes, or
     * some network service no longer meets the constraints of its type
     */
    public void validate() throws InvalidTopologyException {
        synchronized (lock) {
            if (nodes.isEmpty())
                throw new InvalidTopologyException("slice " + name
                    + " has no nodes");
            for (NetworkService svc : services.values()) {
                try {
                    svc.getType().checkMembers(svc.members());
                } catch (InvalidTopologyException ex) {
                    throw new InvalidTopologyException("network service "
                        + svc.getName() + ": " + ex.getMessage(), ex);
                }
            }
        }
    }

    /**
     * Perform an action while holding the slice's lock. No snapshot
     * can be merged while the action runs, so it sees a consistent
     * view of all entities.
     * 
     * @param <T> the action's result type
     * 
     * @param action the action to perform
     * 
     * @return the action's result
     */
    public <T> T read(Supplier<T> action) {
        synchronized (lock) {
            return action.get();
        }
    }

    void checkUnsubmitted() throws InvalidStateException {
        assert Thread.holdsLock(lock);
        if (state != SliceState.UNSUBMITTED)
            throw new InvalidStateException("slice " + name + " is "
                + state.name().toLowerCase());
    }

    boolean containsNode(Node node) {
        assert Thread.holdsLock(lock);
        return nodes.get(node.getName()) == node;
    }

    void checkNewNames(Component component) throws DuplicateNameException {
        assert Thread.holdsLock(lock);
        for (Component c : getComponents())
            if (c.getName().equals(component.getName()))
                throw new DuplicateNameException(component.getName(),
                                                 "component");
        Set<String> used = new HashSet<>();
        for (Interface iface : getInterfaces())
            used.add(iface.getName());
        for (Interface iface : component.getInterfaces())
            if (used.contains(iface.getName()))
                throw new DuplicateNameException(iface.getName(),
                                                 "interface");
    }

    void setSliceId(String sliceId) {
        assert Thread.holdsLock(lock);
        this.sliceId = sliceId;
    }

    void setState(SliceState state) {
        assert Thread.holdsLock(lock);
        this.state = state;
    }

    void setLease(Instant start, Instant end) {
        assert Thread.holdsLock(lock);
        if (start != null) this.leaseStart = start;
        if (end != null) this.leaseEnd = end;
    }

    private static final Pattern NAME_SYNTAX =
        Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]{0,63}");

    static void checkName(String name, String kind)
        throws InvalidSpecException {
        if (name == null || !NAME_SYNTAX.matcher(name).matches())
            throw new InvalidSpecException("bad " + kind + " name: " + name);
    }

    @Override
    public String toString() {
        return "slice " + name;
    }
}
