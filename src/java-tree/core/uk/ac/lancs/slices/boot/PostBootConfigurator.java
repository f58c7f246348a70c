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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

import uk.ac.lancs.slices.CidrAddress;
import uk.ac.lancs.slices.Interface;
import uk.ac.lancs.slices.Node;
import uk.ac.lancs.slices.Reconciler;
import uk.ac.lancs.slices.Slice;
import uk.ac.lancs.slices.ssh.RemoteChannel;

/**
 * Brings the nodes of a stable slice to their intended network
 * configuration, and runs their post-boot tasks once. Nodes are
 * configured in parallel, and a failure on one node does not affect
 * the others. Configuration can be repeated safely; a node already
 * configured receives no changes.
 * 
 * @author simpsons
 */
public final class PostBootConfigurator {
    private static final Logger logger =
        Logger.getLogger("uk.ac.lancs.slices.boot");

    private final RemoteChannel channel;

    private final Reconciler reconciler;

    private final ExecutorService executor;

    private final long commandTimeoutMillis;

    private final boolean flushStrayAddresses;

    /**
     * Create a configurator.
     * 
     * @param channel the means to run commands on nodes
     * 
     * @param reconciler the recorder of applied configuration
     * 
     * @param executor the pool on which nodes are configured
     * 
     * @param commandTimeoutMillis the time limit for each command
     * 
     * @param flushStrayAddresses whether to remove addresses from data
     * plane devices that are not planned for them. Addresses are only
     * removed before a node's post-boot tasks have run, and never from
     * interfaces with {@link uk.ac.lancs.slices.AddressMode#NONE}.
     */
    public PostBootConfigurator(RemoteChannel channel, Reconciler reconciler,
                                ExecutorService executor,
                                long commandTimeoutMillis,
                                boolean flushStrayAddresses) {
        this.channel = channel;
        this.reconciler = reconciler;
        this.executor = executor;
        this.commandTimeoutMillis = commandTimeoutMillis;
        this.flushStrayAddresses = flushStrayAddresses;
    }

    /**
     * Configure all nodes of a slice.
     * 
     * @param slice the slice
     * 
     * @return the outcome for each node
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted while waiting for nodes to be configured
     */
    public ConfigurationReport configure(Slice slice)
        throws InterruptedException {
        return configure(slice, slice.getNodes());
    }

    /**
     * Configure selected nodes of a slice.
     * 
     * @param slice the slice
     * 
     * @param nodes the nodes to configure
     * 
     * @return the outcome for each node
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted while waiting for nodes to be configured
     */
    public ConfigurationReport configure(Slice slice,
                                         Collection<? extends Node> nodes)
        throws InterruptedException {
        Map<String, Exception> failures = new LinkedHashMap<>();
        Map<Interface, List<CidrAddress>> plan;
        try {
            plan = AddressPlanner.plan(slice);
        } catch (IllegalStateException ex) {
            for (Node node : nodes)
                failures.put(node.getName(), ex);
            return new ConfigurationReport(new ArrayList<>(), failures);
        }

        Map<String, Future<Void>> tasks = new LinkedHashMap<>();
        for (Node node : nodes) {
            NodeConfiguration job =
                new NodeConfiguration(node, channel, reconciler, plan,
                                      commandTimeoutMillis,
                                      flushStrayAddresses);
            Callable<Void> task = () -> {
                job.run();
                return null;
            };
            tasks.put(node.getName(), executor.submit(task));
        }

        List<String> configured = new ArrayList<>();
        try {
            for (Map.Entry<String, Future<Void>> entry : tasks.entrySet()) {
                String name = entry.getKey();
                try {
                    entry.getValue().get();
                    configured.add(name);
                    logger.info(() -> "configured " + name);
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause();
                    Exception err = cause instanceof Exception ?
                        (Exception) cause : ex;
                    failures.put(name, err);
                    logger.log(Level.WARNING,
                               "failed to configure " + name + ": "
                                   + err.getMessage(),
                               err);
                }
            }
        } catch (InterruptedException ex) {
            for (Future<Void> f : tasks.values())
                f.cancel(true);
            throw ex;
        }
        return new ConfigurationReport(configured, failures);
    }
}
