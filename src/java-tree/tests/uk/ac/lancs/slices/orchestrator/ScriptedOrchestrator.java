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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

import uk.ac.lancs.slices.Slice;

/**
 * Answers queries from a script of snapshots and failures. Once the
 * script is exhausted, the last snapshot is repeated. All calls are
 * recorded.
 */
public final class ScriptedOrchestrator implements Orchestrator {
    private final Deque<Object> script = new ArrayDeque<>();

    private TopologySnapshot last;

    private Function<Slice, TopologySnapshot> onSubmit;

    public final List<String> calls = new ArrayList<>();

    public final List<Collection<String>> submittedKeys = new ArrayList<>();

    public int queries;

    public synchronized ScriptedOrchestrator then(TopologySnapshot snapshot) {
        script.add(snapshot);
        return this;
    }

    public synchronized ScriptedOrchestrator thenFail(int times) {
        for (int i = 0; i < times; i++)
            script.add(new TransportException("connection refused"));
        return this;
    }

    public synchronized ScriptedOrchestrator
        thenReject(int status, String message) {
        script.add(new RejectedException(status, message));
        return this;
    }

    public synchronized ScriptedOrchestrator
        onSubmit(Function<Slice, TopologySnapshot> action) {
        this.onSubmit = action;
        return this;
    }

    @Override
    public synchronized TopologySnapshot submit(Slice slice,
                                                Collection<String> sshKeys)
        throws TransportException,
            RejectedException {
        calls.add("submit " + slice.getName());
        submittedKeys.add(new ArrayList<>(sshKeys));
        if (onSubmit == null)
            throw new RejectedException(400, "no submission expected");
        return onSubmit.apply(slice);
    }

    @Override
    public synchronized TopologySnapshot query(String sliceId)
        throws TransportException,
            RejectedException {
        calls.add("query " + sliceId);
        queries++;
        Object next = script.poll();
        if (next == null) {
            if (last == null) throw new TransportException("nothing scripted");
            return last;
        }
        if (next instanceof TransportException)
            throw (TransportException) next;
        if (next instanceof RejectedException) throw (RejectedException) next;
        last = (TopologySnapshot) next;
        return last;
    }

    @Override
    public synchronized void delete(String sliceId)
        throws TransportException,
            RejectedException {
        calls.add("delete " + sliceId);
    }

    @Override
    public synchronized void renew(String sliceId, Instant leaseEnd)
        throws TransportException,
            RejectedException {
        calls.add("renew " + sliceId + " " + leaseEnd);
    }
}
