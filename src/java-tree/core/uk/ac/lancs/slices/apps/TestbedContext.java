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

package uk.ac.lancs.slices.apps;

import java.net.URI;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import uk.ac.lancs.config.Configuration;
import uk.ac.lancs.config.ConfigurationContext;
import uk.ac.lancs.slices.Reconciler;
import uk.ac.lancs.slices.SliceKeys;
import uk.ac.lancs.slices.boot.PostBootConfigurator;
import uk.ac.lancs.slices.orchestrator.Orchestrator;
import uk.ac.lancs.slices.orchestrator.RESTOrchestrator;
import uk.ac.lancs.slices.orchestrator.TokenFileCredentialSource;
import uk.ac.lancs.slices.ssh.BastionRelay;
import uk.ac.lancs.slices.ssh.ProcessSSHTransport;
import uk.ac.lancs.slices.ssh.RemoteChannel;
import uk.ac.lancs.slices.sync.StabilityPoller;
import uk.ac.lancs.slices.util.Backoff;
import uk.ac.lancs.slices.util.Pacer;

/**
 * Holds the settings needed to reach a testbed, and builds the
 * components that use them. Settings come from a configuration,
 * overlaid by environment variables:
 * 
 * <table summary="Settings and the environment variables overriding
 * them">
 * <thead>
 * <tr>
 * <th>Key</th>
 * <th>Variable</th>
 * <th>Default</th>
 * </tr>
 * </thead> <tbody>
 * <tr>
 * <td><samp>orchestrator.host</samp></td>
 * <td><samp>FABRIC_ORCHESTRATOR_HOST</samp></td>
 * <td><samp>orchestrator.fabric-testbed.net</samp></td>
 * </tr>
 * <tr>
 * <td><samp>project.id</samp></td>
 * <td><samp>FABRIC_PROJECT_ID</samp></td>
 * <td>none</td>
 * </tr>
 * <tr>
 * <td><samp>token.file</samp></td>
 * <td><samp>FABRIC_TOKEN_LOCATION</samp></td>
 * <td><samp>${config.dir}/id_token.json</samp></td>
 * </tr>
 * <tr>
 * <td><samp>bastion.host</samp></td>
 * <td><samp>FABRIC_BASTION_HOST</samp></td>
 * <td><samp>bastion.fabric-testbed.net</samp></td>
 * </tr>
 * <tr>
 * <td><samp>bastion.username</samp></td>
 * <td><samp>FABRIC_BASTION_USERNAME</samp></td>
 * <td><samp>${user.name}</samp></td>
 * </tr>
 * <tr>
 * <td><samp>bastion.key</samp></td>
 * <td><samp>FABRIC_BASTION_KEY_LOCATION</samp></td>
 * <td><samp>${config.dir}/fabric_bastion_key</samp></td>
 * </tr>
 * <tr>
 * <td><samp>slice.public-key</samp></td>
 * <td><samp>FABRIC_SLICE_PUBLIC_KEY_FILE</samp></td>
 * <td><samp>${config.dir}/slice_key.pub</samp></td>
 * </tr>
 * <tr>
 * <td><samp>slice.private-key</samp></td>
 * <td><samp>FABRIC_SLICE_PRIVATE_KEY_FILE</samp></td>
 * <td><samp>${config.dir}/slice_key</samp></td>
 * </tr>
 * </tbody>
 * </table>
 * 
 * <p>
 * <samp>config.dir</samp> defaults to
 * <samp>${user.home}/work/fabric_config</samp>. Durations are in
 * seconds: <samp>poll.interval</samp> (20),
 * <samp>poll.timeout</samp> (1800), <samp>ssh.backoff</samp> (10),
 * <samp>ssh.connect-timeout</samp> (30),
 * <samp>ssh.command-timeout</samp> (600) and
 * <samp>orchestrator.timeout</samp> (60). Other settings are
 * <samp>poll.backoff.factor</samp> (1),
 * <samp>poll.backoff.max</samp>, <samp>poll.retries</samp> (3),
 * <samp>ssh.attempts</samp> (3), <samp>threads</samp> (32) and
 * <samp>configure.flush-stray</samp> (true).
 * 
 * @author simpsons
 */
public final class TestbedContext {
    private static final Logger logger =
        Logger.getLogger("uk.ac.lancs.slices.apps");

    private static final Map<String, String> ENVIRONMENT_KEYS;

    static {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("FABRIC_ORCHESTRATOR_HOST", "orchestrator.host");
        map.put("FABRIC_PROJECT_ID", "project.id");
        map.put("FABRIC_TOKEN_LOCATION", "token.file");
        map.put("FABRIC_BASTION_HOST", "bastion.host");
        map.put("FABRIC_BASTION_USERNAME", "bastion.username");
        map.put("FABRIC_BASTION_KEY_LOCATION", "bastion.key");
        map.put("FABRIC_SLICE_PUBLIC_KEY_FILE", "slice.public-key");
        map.put("FABRIC_SLICE_PRIVATE_KEY_FILE", "slice.private-key");
        ENVIRONMENT_KEYS = Collections.unmodifiableMap(map);
    }

    private final String orchestratorHost;

    private final int orchestratorTimeoutMillis;

    private final String projectId;

    private final Path tokenFile;

    private final BastionRelay bastion;

    private final SliceKeys sliceKeys;

    private final long pollIntervalMillis;

    private final Backoff pollInterval;

    private final long pollTimeoutMillis;

    private final int pollRetries;

    private final int sshAttempts;

    private final long sshBackoffMillis;

    private final long sshConnectTimeoutMillis;

    private final long commandTimeoutMillis;

    private final String sshProgram;

    private final String scpProgram;

    private final int threads;

    private final boolean flushStray;

    /**
     * Create a context from configuration and the process environment.
     * 
     * @param config the configuration
     * 
     * @return the new context
     */
    public static TestbedContext fromEnvironment(Configuration config) {
        return new TestbedContext(config, System.getenv());
    }

    /**
     * Create a context.
     * 
     * @param config the configuration
     * 
     * @param environment variables overriding configuration settings
     * 
     * @throws IllegalArgumentException if a setting is malformed
     */
    public TestbedContext(Configuration config,
                          Map<String, String> environment) {
        Properties props = config.toProperties();
        for (Map.Entry<String, String> entry : ENVIRONMENT_KEYS.entrySet()) {
            String value = environment.get(entry.getKey());
            if (value != null && !value.isEmpty())
                props.setProperty(entry.getValue(), value);
        }
        if (!props.containsKey("config.dir"))
            props.setProperty("config.dir",
                              "${user.home}/work/fabric_config");
        Configuration conf = ConfigurationContext.of(props);
        /* Let other values refer to the expanded directory. */
        props.setProperty("config.dir", conf.getExpanded("config.dir"));
        conf = ConfigurationContext.of(props);

        orchestratorHost =
            conf.get("orchestrator.host", "orchestrator.fabric-testbed.net");
        orchestratorTimeoutMillis =
            (int) conf.getSeconds("orchestrator.timeout", 60000);
        projectId = conf.get("project.id");
        tokenFile = conf.getPath("token.file", "${config.dir}/id_token.json");

        Configuration bconf = conf.subview("bastion");
        bastion = new BastionRelay(bconf.get("host",
                                             "bastion.fabric-testbed.net"),
                                   bconf.getInt("port", 22),
                                   bconf.getExpanded("username",
                                                     "${user.name}"),
                                   bconf.getPath("key",
                                                 "${config.dir}/fabric_bastion_key"));
        sliceKeys = new SliceKeys(conf
            .getPath("slice.private-key", "${config.dir}/slice_key"),
                                  conf.getPath("slice.public-key",
                                               "${config.dir}/slice_key.pub"));

        Configuration pconf = conf.subview("poll");
        pollIntervalMillis = pconf.getSeconds("interval", 20000);
        double factor =
            Double.parseDouble(pconf.get("backoff.factor", "1").trim());
        long max = pconf.getSeconds("backoff.max", pollIntervalMillis);
        pollInterval = factor == 1.0 ? Backoff.fixed(pollIntervalMillis) :
            new Backoff(pollIntervalMillis, factor, max);
        pollTimeoutMillis = pconf.getSeconds("timeout", 1800000);
        pollRetries = pconf.getInt("retries", 3);

        Configuration sconf = conf.subview("ssh");
        sshAttempts = sconf.getInt("attempts", 3);
        sshBackoffMillis = sconf.getSeconds("backoff", 10000);
        sshConnectTimeoutMillis = sconf.getSeconds("connect-timeout", 30000);
        commandTimeoutMillis = sconf.getSeconds("command-timeout", 600000);
        sshProgram = sconf.get("program", "ssh");
        scpProgram = conf.get("scp.program", "scp");

        threads = conf.getInt("threads", 32);
        flushStray = Boolean
            .parseBoolean(conf.get("configure.flush-stray", "true").trim());
        if (threads < 1)
            throw new IllegalArgumentException("threads < 1: " + threads);
        logger.config(() -> "orchestrator " + orchestratorHost
            + "; bastion " + bastion);
    }

    /**
     * Get the orchestrator's base URI.
     * 
     * @return the REST endpoint of the orchestrator
     */
    public URI orchestratorURI() {
        return URI.create("https://" + orchestratorHost + "/");
    }

    /**
     * Get the project new slices are charged to.
     * 
     * @return the project identifier, if configured
     */
    public Optional<String> projectId() {
        return Optional.ofNullable(projectId);
    }

    /**
     * Get the file holding the identity token.
     * 
     * @return the token file
     */
    public Path tokenFile() {
        return tokenFile;
    }

    /**
     * Get the bastion through which nodes are reached.
     * 
     * @return the bastion's details
     */
    public BastionRelay bastion() {
        return bastion;
    }

    /**
     * Get the key pair installed on new slices.
     * 
     * @return the slice key pair
     */
    public SliceKeys sliceKeys() {
        return sliceKeys;
    }

    /**
     * Get the schedule of polls while waiting for a slice.
     * 
     * @return the poll schedule
     */
    public Backoff pollInterval() {
        return pollInterval;
    }

    /**
     * Get the time allowed for a slice to settle.
     * 
     * @return the timeout in milliseconds
     */
    public long pollTimeoutMillis() {
        return pollTimeoutMillis;
    }

    /**
     * Get the time limit for each remote command.
     * 
     * @return the timeout in milliseconds
     */
    public long commandTimeoutMillis() {
        return commandTimeoutMillis;
    }

    /**
     * Get the number of nodes handled concurrently.
     * 
     * @return the worker pool size
     */
    public int threads() {
        return threads;
    }

    /**
     * Determine whether unplanned addresses are removed from data-plane
     * devices.
     * 
     * @return {@code true} if stray addresses are removed
     */
    public boolean flushStrayAddresses() {
        return flushStray;
    }

    int sshAttempts() {
        return sshAttempts;
    }

    long sshBackoffMillis() {
        return sshBackoffMillis;
    }

    int pollRetries() {
        return pollRetries;
    }

    /**
     * Create a client of the orchestrator.
     * 
     * @return a new client authenticated with the token file
     */
    public Orchestrator newOrchestrator() {
        return RESTOrchestrator
            .create(orchestratorURI(), new TokenFileCredentialSource(tokenFile),
                    orchestratorTimeoutMillis);
    }

    /**
     * Create a channel to slice nodes through the bastion.
     * 
     * @param pacer the source of delays between connection attempts
     * 
     * @return the new channel
     */
    public RemoteChannel newRemoteChannel(Pacer pacer) {
        return new RemoteChannel(new ProcessSSHTransport(sshProgram,
                                                         scpProgram),
                                 bastion, sshAttempts,
                                 new Backoff(sshBackoffMillis, 2.0,
                                             sshBackoffMillis * 8),
                                 sshConnectTimeoutMillis, pacer);
    }

    /**
     * Create a poller.
     * 
     * @param orchestrator the orchestrator to poll
     * 
     * @param reconciler the reconciler to merge snapshots with
     * 
     * @param pacer the source of time and delays
     * 
     * @return the new poller
     */
    public StabilityPoller newPoller(Orchestrator orchestrator,
                                     Reconciler reconciler, Pacer pacer) {
        return new StabilityPoller(orchestrator, reconciler, pacer,
                                   pollRetries, pollInterval);
    }

    /**
     * Create a pool of worker threads. The threads are daemons, and
     * log uncaught exceptions.
     * 
     * @return the new pool
     */
    public ExecutorService newExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "slice-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((th, ex) -> logger
                .log(Level.WARNING, "uncaught in " + th.getName(), ex));
            return t;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    /**
     * Create a configurator.
     * 
     * @param channel the channel to nodes
     * 
     * @param reconciler the recorder of applied configuration
     * 
     * @param executor the pool on which nodes are configured
     * 
     * @return the new configurator
     */
    public PostBootConfigurator newConfigurator(RemoteChannel channel,
                                                Reconciler reconciler,
                                                ExecutorService executor) {
        return new PostBootConfigurator(channel, reconciler, executor,
                                        commandTimeoutMillis, flushStray);
    }
}
