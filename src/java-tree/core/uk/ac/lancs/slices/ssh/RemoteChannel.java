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

package uk.ac.lancs.slices.ssh;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import uk.ac.lancs.slices.Node;
import uk.ac.lancs.slices.util.Backoff;
import uk.ac.lancs.slices.util.Pacer;

/**
 * Runs commands on nodes and transfers files to and from them. Each
 * operation opens its own session through the bastion, and closes it
 * before returning, whatever the outcome. Connection failures are
 * retried with increasing delays. A command that exits with a non-zero
 * status is reported in its result, and not retried.
 */
public final class RemoteChannel {
    private static final Logger logger =
        Logger.getLogger("uk.ac.lancs.slices.ssh");

    private final SSHTransport transport;

    private final BastionRelay bastion;

    private final int attempts;

    private final Backoff backoff;

    private final long connectTimeoutMillis;

    private final Pacer pacer;

    /**
     * Create a channel.
     * 
     * @param transport the means of connecting to nodes
     * 
     * @param bastion the jump host in front of the nodes
     * 
     * @param attempts the maximum number of connection attempts per
     * operation
     * 
     * @param backoff the delays between connection attempts
     * 
     * @param connectTimeoutMillis the time allowed for each connection
     * attempt
     * 
     * @param pacer the source of delays
     */
    public RemoteChannel(SSHTransport transport, BastionRelay bastion,
                         int attempts, Backoff backoff,
                         long connectTimeoutMillis, Pacer pacer) {
        if (attempts < 1)
            throw new IllegalArgumentException("attempts < 1: " + attempts);
        this.transport = transport;
        this.bastion = bastion;
        this.attempts = attempts;
        this.backoff = backoff;
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.pacer = pacer;
    }

    /**
     * Identify how to reach a node.
     * 
     * @param node the node
     * 
     * @return the connection target
     * 
     * @throws NodeNotReadyException if the node has no management
     * address, or is not active
     */
    public SSHTarget target(Node node) throws NodeNotReadyException {
        Optional<InetAddress> addr = node.getManagementAddress();
        if (!addr.isPresent())
            throw new NodeNotReadyException("node " + node.getName()
                + " has no management address");
        if (!node.getReservationState().isActive())
            throw new NodeNotReadyException("node " + node.getName() + " is "
                + node.getReservationState().label());
        return new SSHTarget(node.getName(), addr.get(), node.getUsername(),
                             node.getSlice().getKeys().getPrivateKey(),
                             bastion);
    }

    @FunctionalInterface
    private interface SessionAction<T, E extends Exception> {
        T run(RemoteSession session)
            throws SSHConnectException,
                InterruptedException,
                E;
    }

    private <T, E extends Exception> T
        withSession(Node node, String what, SessionAction<T, E> action)
            throws NodeNotReadyException,
                SSHConnectException,
                InterruptedException,
                E {
        SSHTarget target = target(node);
        SSHConnectException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try (RemoteSession session =
                transport.open(target, connectTimeoutMillis)) {
                return action.run(session);
            } catch (SSHConnectException ex) {
                last = ex;
                if (attempt < attempts) {
                    long delay = backoff.delay(attempt);
                    logger.warning(what + " on " + node.getName()
                        + " failed (attempt " + attempt + " of " + attempts
                        + "); retrying in " + delay + "ms: " + ex.getMessage());
                    pacer.sleep(delay);
                }
            }
        }
        logger.log(Level.WARNING, what + " on " + node.getName()
            + " failed after " + attempts + " attempt(s)", last);
        throw last;
    }

    /**
     * Run a command on a node.
     * 
     * @param node the node
     * 
     * @param command the shell command
     * 
     * @param timeoutMillis the time limit, or 0 for none
     * 
     * @return the command's outcome, including any non-zero exit
     * status
     * 
     * @throws NodeNotReadyException if the node has no management
     * address, or is not active
     * 
     * @throws SSHConnectException if no connection could be made
     * within the permitted attempts
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted
     */
    public CommandResult execute(Node node, String command,
                                 long timeoutMillis)
        throws NodeNotReadyException,
            SSHConnectException,
            InterruptedException {
        SessionAction<CommandResult, RuntimeException> action =
            s -> s.execute(command, timeoutMillis);
        return withSession(node, "execute", action);
    }

    /**
     * Copy a local file to a node.
     * 
     * @param node the node
     * 
     * @param local the local file
     * 
     * @param remote the destination path on the node
     * 
     * @param timeoutMillis the time limit, or 0 for none
     * 
     * @throws NodeNotReadyException if the node has no management
     * address, or is not active
     * 
     * @throws SSHConnectException if no connection could be made
     * within the permitted attempts
     * 
     * @throws TransferTimeoutException if the transfer overran its
     * time limit
     * 
     * @throws IOException if the transfer failed
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted
     */
    public void upload(Node node, Path local, String remote,
                       long timeoutMillis)
        throws NodeNotReadyException,
            SSHConnectException,
            IOException,
            InterruptedException {
        transfer(node, "upload",
                 s -> s.upload(local, remote, false, timeoutMillis));
    }

    /**
     * Copy a local directory tree to a node.
     * 
     * @param node the node
     * 
     * @param local the local directory
     * 
     * @param remote the destination directory on the node
     * 
     * @param timeoutMillis the time limit, or 0 for none
     * 
     * @throws NodeNotReadyException if the node has no management
     * address, or is not active
     * 
     * @throws SSHConnectException if no connection could be made
     * within the permitted attempts
     * 
     * @throws TransferTimeoutException if the transfer overran its
     * time limit
     * 
     * @throws IOException if the transfer failed
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted
     */
    public void uploadDirectory(Node node, Path local, String remote,
                                long timeoutMillis)
        throws NodeNotReadyException,
            SSHConnectException,
            IOException,
            InterruptedException {
        transfer(node, "upload",
                 s -> s.upload(local, remote, true, timeoutMillis));
    }

    /**
     * Copy a file from a node.
     * 
     * @param node the node
     * 
     * @param remote the source path on the node
     * 
     * @param local the local destination
     * 
     * @param timeoutMillis the time limit, or 0 for none
     * 
     * @throws NodeNotReadyException if the node has no management
     * address, or is not active
     * 
     * @throws SSHConnectException if no connection could be made
     * within the permitted attempts
     * 
     * @throws TransferTimeoutException if the transfer overran its
     * time limit
     * 
     * @throws IOException if the transfer failed
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted
     */
    public void download(Node node, String remote, Path local,
                         long timeoutMillis)
        throws NodeNotReadyException,
            SSHConnectException,
            IOException,
            InterruptedException {
        transfer(node, "download",
                 s -> s.download(remote, local, false, timeoutMillis));
    }

    /**
     * Copy a directory tree from a node.
     * 
     * @param node the node
     * 
     * @param remote the source directory on the node
     * 
     * @param local the local destination
     * 
     * @param timeoutMillis the time limit, or 0 for none
     * 
     * @throws NodeNotReadyException if the node has no management
     * address, or is not active
     * 
     * @throws SSHConnectException if no connection could be made
     * within the permitted attempts
     * 
     * @throws TransferTimeoutException if the transfer overran its
     * time limit
     * 
     * @throws IOException if the transfer failed
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted
     */
    public void downloadDirectory(Node node, String remote, Path local,
                                  long timeoutMillis)
        throws NodeNotReadyException,
            SSHConnectException,
            IOException,
            InterruptedException {
        transfer(node, "download",
                 s -> s.download(remote, local, true, timeoutMillis));
    }

    @FunctionalInterface
    private interface Transfer {
        void run(RemoteSession session)
            throws SSHConnectException,
                IOException,
                InterruptedException;
    }

    private void transfer(Node node, String what, Transfer transfer)
        throws NodeNotReadyException,
            SSHConnectException,
            IOException,
            InterruptedException {
        this.<Void, IOException> withSession(node, what, s -> {
            transfer.run(s);
            return null;
        });
    }

    /**
     * Check whether a node accepts SSH connections and runs commands.
     * A single connection attempt is made.
     * 
     * @param node the node
     * 
     * @return {@code true} if a trivial command succeeded
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted
     */
    public boolean testSSH(Node node) throws InterruptedException {
        final SSHTarget target;
        try {
            target = target(node);
        } catch (NodeNotReadyException ex) {
            logger.fine(ex.getMessage());
            return false;
        }
        try (RemoteSession session =
            transport.open(target, connectTimeoutMillis)) {
            return session.execute("echo ok", connectTimeoutMillis)
                .succeeded();
        } catch (SSHConnectException ex) {
            logger.fine(() -> "SSH to " + node.getName() + " not ready: "
                + ex.getMessage());
            return false;
        }
    }
}
