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

import java.nio.file.Path;

/**
 * Identifies the jump host through which nodes' management addresses
 * are reached.
 */
public final class BastionRelay {
    /**
     * The bastion's host name
     */
    public final String host;

    /**
     * The bastion's SSH port
     */
    public final int port;

    /**
     * The user name on the bastion
     */
    public final String username;

    /**
     * The private key for the bastion
     */
    public final Path privateKey;

    /**
     * Identify a bastion host.
     * 
     * @param host the bastion's host name
     * 
     * @param port the bastion's SSH port
     * 
     * @param username the user name on the bastion
     * 
     * @param privateKey the private key for the bastion
     */
    public BastionRelay(String host, int port, String username,
                        Path privateKey) {
        this.host = host;
        this.port = port;
        this.username = username;
        this.privateKey = privateKey;
    }

    @Override
    public String toString() {
        return username + "@" + host + ":" + port;
    }
}
