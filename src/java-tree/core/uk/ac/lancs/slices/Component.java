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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A device attached to a node, such as a NIC, GPU or NVMe drive. Its
 * network ports are exposed as {@link Interface}s, created along with
 * the component.
 */
public final class Component extends SliceEntity {
    private final Node node;

    private final String localName;

    private final ComponentModel model;

    private final List<Interface> interfaces;

    private String pciAddress;

    Component(Node node, String localName, ComponentModel model) {
        super(node.slice, node.getName() + "-" + localName);
        this.node = node;
        this.localName = localName;
        this.model = model;
        List<Interface> ifaces = new ArrayList<>(model.ports());
        for (int port = 1; port <= model.ports(); port++)
            ifaces.add(new Interface(this, port));
        this.interfaces = Collections.unmodifiableList(ifaces);
    }

    /**
     * Get the node this component is attached to.
     * 
     * @return the owning node
     */
    public Node getNode() {
        return node;
    }

    /**
     * Get the component's name within its node. {@link #getName()}
     * yields the name qualified by the node's name.
     * 
     * @return the local name
     */
    public String getLocalName() {
        return localName;
    }

    /**
     * Get the component's model.
     * 
     * @return the model
     */
    public ComponentModel getModel() {
        return model;
    }

    /**
     * Get the component's network ports.
     * 
     * @return an immutable list of interfaces in port order
     */
    public List<Interface> getInterfaces() {
        return interfaces;
    }

    /**
     * Get the PCI address reported for the component.
     * 
     * @return the PCI address, if known
     */
    public Optional<String> getPciAddress() {
        synchronized (slice.lock) {
            return Optional.ofNullable(pciAddress);
        }
    }

    void setPciAddress(String pciAddress) {
        assert Thread.holdsLock(slice.lock);
        this.pciAddress = pciAddress;
    }

    @Override
    public String kind() {
        return "component";
    }
}
