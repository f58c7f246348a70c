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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Summarizes configuring a set of nodes. Each node either appears in
 * the set of configured nodes, or is mapped to the error that stopped
 * its configuration.
 */
public final class ConfigurationReport {
    private final Set<String> configured;

    private final Map<String, Exception> failures;

    ConfigurationReport(Collection<String> configured,
                        Map<String, Exception> failures) {
        this.configured = Collections
            .unmodifiableSet(new LinkedHashSet<>(configured));
        this.failures =
            Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    /**
     * Get the nodes that were fully configured.
     * 
     * @return an immutable set of node names
     */
    public Set<String> configured() {
        return configured;
    }

    /**
     * Get the nodes that could not be configured.
     * 
     * @return an immutable map from node name to cause
     */
    public Map<String, Exception> failures() {
        return failures;
    }

    /**
     * Determine whether every node was configured.
     * 
     * @return {@code true} if there were no failures
     */
    public boolean isSuccess() {
        return failures.isEmpty();
    }

    @Override
    public String toString() {
        return "configured=" + configured + " failed=" + failures.keySet();
    }
}
