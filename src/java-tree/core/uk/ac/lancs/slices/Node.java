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

import java.net.InetAddress;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A virtual machine at a site, with attached components.
 */
public final class Node extends SliceEntity {
    private final String site;

    private final String image;

    private final Capacity capacity;

    private final String instanceType;

    private final Map<String, Component> components = new LinkedHashMap<>();

    private final List<PostBootTask> postBootTasks = new ArrayList<>();

    private final List<Route> routes = new ArrayList<>();

    private String host;

    private String username;

    private InetAddress managementAddress;

    private String placedHost;

    private boolean instantiated;

    Node(Slice slice, String name, String site, String image,
         Capacity capacity, String instanceType) {
        super(slice, name);
        this.site = site;
        this.image = image;
        this.capacity = capacity;
        this.instanceType = instanceType;
        this.username = defaultUsername(image);
    }

    /**
     * Get the site where the node is placed.
     * 
     * @return the site name
     */
    public String getSite() {
        return site;
    }

    /**
     * Get the node's boot image.
     * 
     * @return the image name
     */
    public String getImage() {
        return image;
    }

    /**
     * Get the node's explicit capacity.
     * 
     * @return the capacity, unless an instance type was requested
     */
    public Optional<Capacity> getCapacity() {
        return Optional.ofNullable(capacity);
    }

    /**
     * Get the node's instance type.
     * 
     * @return the instance type, unless explicit capacity was requested
     */
    public Optional<String> getInstanceType() {
        return Optional.ofNullable(instanceType);
    }

    /**
     * Add a component with a generated name. The name is the lower-case
     * model label followed by the lowest positive number that makes it
     * unique within the node.
     * 
     * @param model the model label, e.g., <samp>NIC_Basic</samp>
     * 
     * @return the new component
     * 
     * @throws UnsupportedModelException if the model is unknown or is
     * unavailable at the node's site
     * 
     * @throws DuplicateNameException if one of the component's
     * interface names is already in use
     * 
     * @throws InvalidStateException if the slice has been submitted
     */
    public Component addComponent(String model)
        throws UnsupportedModelException,
            DuplicateNameException,
            InvalidStateException {
        ComponentModel cm = ComponentModel.forLabel(model);
        synchronized (slice.lock) {
            String base = cm.label().toLowerCase();
            int index = 1;
            while (components.containsKey(base + index))
                index++;
            return addComponent(cm, base + index);
        }
    }

    /**
     * Add a component.
     * 
     * @param model the model label, e.g., <samp>GPU_RTX6000</samp>
     * 
     * @param name the component's name, unique within the node
     * 
     * @return the new component
     * 
     * @throws UnsupportedModelException if the model is unknown or is
     * unavailable at the node's site
     * 
     * @throws DuplicateNameException if the name or one of the
     * component's interface names is already in use
     * 
     * @throws InvalidSpecException if the name is malformed
     * 
     * @throws InvalidStateException if the slice has been submitted
     */
    public Component addComponent(String model, String name)
        throws UnsupportedModelException,
            DuplicateNameException,
            InvalidSpecException,
            InvalidStateException {
        Slice.checkName(name, "component");
        ComponentModel cm = ComponentModel.forLabel(model);
        synchronized (slice.lock) {
            return addComponent(cm, name);
        }
    }

    private Component addComponent(ComponentModel model, String name)
        throws UnsupportedModelException,
            DuplicateNameException,
            InvalidStateException {
        assert Thread.holdsLock(slice.lock);
        slice.checkUnsubmitted();
        if (!slice.containsNode(this))
            throw new InvalidStateException("node " + getName()
                + " has been removed");
        model.checkSite(site);
        if (components.containsKey(name))
            throw new DuplicateNameException(name, "component");
        Component result = new Component(this, name, model);
        slice.checkNewNames(result);
        components.put(name, result);
        return result;
    }

    /**
     * Get a component by its name within the node.
     * 
     * @param name the component's local name
     * 
     * @return the component, or {@code null} if not found
     */
    public Component getComponent(String name) {
        synchronized (slice.lock) {
            return components.get(name);
        }
    }

    /**
     * Get the node's components.
     * 
     * @return a copy of the components in order of creation
     */
    public List<Component> getComponents() {
        synchronized (slice.lock) {
            return new ArrayList<>(components.values());
        }
    }

    /**
     * Get all interfaces of the node's components.
     * 
     * @return a copy of the interfaces
     */
    public List<Interface> getInterfaces() {
        synchronized (slice.lock) {
            List<Interface> result = new ArrayList<>();
            for (Component c : components.values())
                result.addAll(c.getInterfaces());
            return result;
        }
    }

    /**
     * Find an interface by name.
     * 
     * @param name the interface name
     * 
     * @return the interface, or {@code null} if not found on this node
     */
    public Interface getInterface(String name) {
        for (Interface iface : getInterfaces())
            if (iface.getName().equals(name)) return iface;
        return null;
    }

    /**
     * Get the physical host requested for this node.
     * 
     * @return the host name, if requested
     */
    public Optional<String> getHost() {
        synchronized (slice.lock) {
            return Optional.ofNullable(host);
        }
    }

    /**
     * Request placement on a particular physical host.
     * 
     * @param host the host name
     * 
     * @throws InvalidStateException if the slice has been submitted
     */
    public void setHost(String host) throws InvalidStateException {
        synchronized (slice.lock) {
            slice.checkUnsubmitted();
            this.host = host;
        }
    }

    /**
     * Get the user name for SSH access.
     * 
     * @return the user name
     */
    public String getUsername() {
        synchronized (slice.lock) {
            return username;
        }
    }

    /**
     * Override the user name for SSH access.
     * 
     * @param username the user name
     */
    public void setUsername(String username) {
        synchronized (slice.lock) {
            this.username = username;
        }
    }

    /**
     * Append a command to run once after the node's networking is
     * first configured.
     * 
     * @param command the shell command
     */
    public void addPostBootExecute(String command) {
        addPostBootTask(PostBootTask.execute(command));
    }

    /**
     * Append a file upload to the node's post-boot tasks.
     * 
     * @param local the local file
     * 
     * @param remote the destination path on the node
     */
    public void addPostBootUpload(Path local, String remote) {
        addPostBootTask(PostBootTask.uploadFile(local, remote));
    }

    /**
     * Append a directory upload to the node's post-boot tasks.
     * 
     * @param local the local directory
     * 
     * @param remote the destination directory on the node
     */
    public void addPostBootUploadDirectory(Path local, String remote) {
        addPostBootTask(PostBootTask.uploadDirectory(local, remote));
    }

    /**
     * Append a task to the node's post-boot tasks.
     * 
     * @param task the task to append
     */
    public void addPostBootTask(PostBootTask task) {
        synchronized (slice.lock) {
            postBootTasks.add(task);
        }
    }

    /**
     * Get the node's post-boot tasks.
     * 
     * @return a copy of the tasks in order of execution
     */
    public List<PostBootTask> getPostBootTasks() {
        synchronized (slice.lock) {
            return new ArrayList<>(postBootTasks);
        }
    }

    /**
     * Add a static route to install during configuration.
     * 
     * @param destination the destination subnet, or the name of a
     * network service
     * 
     * @param nextHop the gateway address, or the name of a network
     * service
     */
    public void addRoute(String destination, String nextHop) {
        synchronized (slice.lock) {
            Route route = new Route(destination, nextHop);
            if (!routes.contains(route)) routes.add(route);
        }
    }

    /**
     * Get the node's static routes.
     * 
     * @return a copy of the routes
     */
    public List<Route> getRoutes() {
        synchronized (slice.lock) {
            return new ArrayList<>(routes);
        }
    }

    /**
     * Get the node's management address.
     * 
     * @return the management address, once the node has been
     * provisioned
     */
    public Optional<InetAddress> getManagementAddress() {
        synchronized (slice.lock) {
            return Optional.ofNullable(managementAddress);
        }
    }

    /**
     * Get the physical host the node was placed on.
     * 
     * @return the host name, if reported
     */
    public Optional<String> getPlacedHost() {
        synchronized (slice.lock) {
            return Optional.ofNullable(placedHost);
        }
    }

    /**
     * Determine whether the node's post-boot tasks have been run.
     * 
     * @return {@code true} if the node has been configured with its
     * post-boot tasks
     */
    public boolean isInstantiated() {
        synchronized (slice.lock) {
            return instantiated;
        }
    }

    void setManagementAddress(InetAddress managementAddress) {
        assert Thread.holdsLock(slice.lock);
        if (managementAddress != null)
            this.managementAddress = managementAddress;
    }

    void setPlacedHost(String placedHost) {
        assert Thread.holdsLock(slice.lock);
        if (placedHost != null) this.placedHost = placedHost;
    }

    void setInstantiated(boolean instantiated) {
        assert Thread.holdsLock(slice.lock);
        this.instantiated = instantiated;
    }

    Collection<Component> components() {
        assert Thread.holdsLock(slice.lock);
        return Collections.unmodifiableCollection(components.values());
    }

    /**
     * Choose a default SSH user name for a boot image.
     * 
     * @param image the image name
     * 
     * @return the conventional user name for the image's distribution
     */
    public static String defaultUsername(String image) {
        if ("default_centos9_stream".equals(image)) return "cloud-user";
        String[] distros = { "centos", "ubuntu", "rocky", "fedora", "cirros",
            "debian", "freebsd", "openbsd" };
        for (String distro : distros)
            if (image.contains(distro)) return distro;
        return "root";
    }

    @Override
    public String kind() {
        return "node";
    }
}
