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
import java.util.Collection;

import uk.ac.lancs.slices.Slice;

/**
 * Submits slices to a testbed's orchestrator and reports on them.
 * Implementations perform no retries themselves. A
 * {@link TransportException} may be retried by the caller, while a
 * {@link RejectedException} must not be.
 */
public interface Orchestrator {
    /**
     * Submit a slice's topology for provisioning.
     * 
     * @param slice the slice to submit
     * 
     * @param sshKeys public keys to install on the slice's nodes, in
     * OpenSSH format
     * 
     * @return the initial snapshot, carrying the new slice identifier
     * 
     * @throws TransportException if the orchestrator could not be
     * reached
     * 
     * @throws RejectedException if the orchestrator refused the
     * request
     */
    TopologySnapshot submit(Slice slice, Collection<String> sshKeys)
        throws TransportException,
            RejectedException;

    /**
     * Get the current state of a slice.
     * 
     * @param sliceId the slice identifier
     * 
     * @return the current snapshot
     * 
     * @throws TransportException if the orchestrator could not be
     * reached, or its response was malformed
     * 
     * @throws RejectedException if the orchestrator refused the
     * request, e.g., because the slice does not exist
     */
    TopologySnapshot query(String sliceId)
        throws TransportException,
            RejectedException;

    /**
     * Release a slice's resources.
     * 
     * @param sliceId the slice identifier
     * 
     * @throws TransportException if the orchestrator could not be
     * reached
     * 
     * @throws RejectedException if the orchestrator refused the
     * request
     */
    void delete(String sliceId) throws TransportException, RejectedException;

    /**
     * Extend a slice's lease.
     * 
     * @param sliceId the slice identifier
     * 
     * @param leaseEnd the new end of the lease
     * 
     * @throws TransportException if the orchestrator could not be
     * reached
     * 
     * @throws RejectedException if the orchestrator refused the
     * request, e.g., because the end is too far in the future
     */
    void renew(String sliceId, Instant leaseEnd)
        throws TransportException,
            RejectedException;
}
