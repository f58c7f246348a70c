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
import java.nio.file.Path;

/**
 * An open connection to a node. Sessions must be closed after use.
 */
public interface RemoteSession extends AutoCloseable {
    /**
     * Run a command.
     * 
     * @param command the shell command
     * 
     * @param timeoutMillis the time limit, or 0 for none
     * 
     * @return the command's outcome
     * 
     * @throws SSHConnectException if the connection failed
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted
     */
    CommandResult execute(String command, long timeoutMillis)
        throws SSHConnectException,
            InterruptedException;

    /**
     * Copy a local file or directory to the node.
     * 
     * @param local the local source
     * 
     * @param remote the remote destination
     * 
     * @param recursive whether to copy a directory tree
     * 
     * @param timeoutMillis the time limit, or 0 for none
     * 
     * @throws SSHConnectException if the connection failed
     * 
     * @throws TransferTimeoutException if the transfer overran its
     * time limit
     * 
     * @throws IOException if the transfer failed
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted
     */
    void upload(Path local, String remote, boolean recursive,
                long timeoutMillis)
        throws SSHConnectException,
            IOException,
            InterruptedException;

    /**
     * Copy a remote file or directory from the node.
     * 
     * @param remote the remote source
     * 
     * @param local the local destination
     * 
     * @param recursive whether to copy a directory tree
     * 
     * @param timeoutMillis the time limit, or 0 for none
     * 
     * @throws SSHConnectException if the connection failed
     * 
     * @throws TransferTimeoutException if the transfer overran its
     * time limit
     * 
     * @throws IOException if the transfer failed
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted
     */
    void download(String remote, Path local, boolean recursive,
                  long timeoutMillis)
        throws SSHConnectException,
            IOException,
            InterruptedException;

    /**
     * Release the connection.
     */
    @Override
    void close();
}
