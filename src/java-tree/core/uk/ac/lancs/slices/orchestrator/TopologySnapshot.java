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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records the orchestrator's view of a slice at one moment. Entities
 * are keyed by name. An entity absent from a snapshot has not yet been
 * reported.
 */
public final class TopologySnapshot {
    private final String sliceId;

    private final String sliceState;

    private final Instant leaseStart;

    private final Instant leaseEnd;

    private final Map<String, NodeSliver> nodes;

    private final Map<String, ComponentSliver> components;

    private final Map<String, InterfaceSliver> interfaces;

    private final Map<String, ServiceSliver> services;

    private TopologySnapshot(Builder builder) {
        this.sliceId = builder.sliceId;
        this.sliceState = builder.sliceState;
        this.leaseStart = builder.leaseStart;
        this.leaseEnd = builder.leaseEnd;
        this.nodes = freeze(builder.nodes);
        this.components = freeze(builder.components);
        this.interfaces = freeze(builder.interfaces);
        this.services = freeze(builder.services);
    }

    private static <V> Map<String, V> freeze(Map<String, V> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    /**
     * Get the slice identifier.
     * 
     * @return the slice identifier
     */
    public String sliceId() {
        return sliceId;
    }

    /**
     * Get the orchestrator's label for the slice's overall state.
     * 
     * @return the slice state label, or {@code null} if not reported
     */
    public String sliceState() {
        return sliceState;
    }

    /**
     * Get the start of the lease.
     * 
     * @return the lease start, or {@code null} if not reported
     */
    public Instant leaseStart() {
        return leaseStart;
    }

    /**
     * Get the end of the lease.
     * 
     * @return the lease end, or {@code null} if not reported
     */
    public Instant leaseEnd() {
        return leaseEnd;
    }

    /**
     * Get node reports.
     * 
     * @return an immutable map from node name to report
     */
    public Map<String, NodeSliver> nodes() {
        return nodes;
    }

    /**
     * Get component reports.
     * 
     * @return an immutable map from qualified component name to report
     */
    public Map<String, ComponentSliver> components() {
        return components;
    }

    /**
     * Get interface reports.
     * 
     * @return an immutable map from interface name to report
     */
    public Map<String, InterfaceSliver> interfaces() {
        return interfaces;
    }

    /**
     * Get network service reports.
     * 
     * @return an immutable map from service name to report
     */
    public Map<String, ServiceSliver> services() {
        return services;
    }

    /**
     * Start building a snapshot.
     * 
     * @param sliceId the slice identifier
     * 
     * @return a fresh builder
     */
    public static Builder builder(String sliceId) {
        return new Builder(sliceId);
    }

    /**
     * Accumulates entity reports for a snapshot.
     */
    public static final class Builder {
        private final String sliceId;

        private String sliceState;

        private Instant leaseStart;

        private Instant leaseEnd;

        private final Map<String, NodeSliver> nodes = new LinkedHashMap<>();

        private final Map<String, ComponentSliver> components =
            new LinkedHashMap<>();

        private final Map<String, InterfaceSliver> interfaces =
            new LinkedHashMap<>();

        private final Map<String, ServiceSliver> services =
            new LinkedHashMap<>();

        private Builder(String sliceId) {
            if (sliceId == null) throw new NullPointerException("sliceId");
            this.sliceId = sliceId;
        }

        /**
         * Set the overall slice state label.
         * 
         * @param sliceState the state label
         * 
         * @return this builder
         */
        public Builder sliceState(String sliceState) {
            this.sliceState = sliceState;
            return this;
        }

        /**
         * Set the lease period.
         * 
         * @param start the lease start, or {@code null}
         * 
         * @param end the lease end, or {@code null}
         * 
         * @return this builder
         */
        public Builder lease(Instant start, Instant end) {
            this.leaseStart = start;
            this.leaseEnd = end;
            return this;
        }

        /**
         * Add a node report.
         * 
         * @param sliver the report
         * 
         * @return this builder
         */
        public Builder add(NodeSliver sliver) {
            nodes.put(sliver.name, sliver);
            return this;
        }

        /**
         * Add a component report.
         * 
         * @param sliver the report
         * 
         * @return this builder
         */
        public Builder add(ComponentSliver sliver) {
            components.put(sliver.name, sliver);
            return this;
        }

        /**
         * Add an interface report.
         * 
         * @param sliver the report
         * 
         * @return this builder
         */
        public Builder add(InterfaceSliver sliver) {
            interfaces.put(sliver.name, sliver);
            return this;
        }

        /**
         * Add a network service report.
         * 
         * @param sliver the report
         * 
         * @return this builder
         */
        public Builder add(ServiceSliver sliver) {
            services.put(sliver.name, sliver);
            return this;
        }

        /**
         * Create the snapshot.
         * 
         * @return the completed snapshot
         */
        public TopologySnapshot build() {
            return new TopologySnapshot(this);
        }
    }
}
