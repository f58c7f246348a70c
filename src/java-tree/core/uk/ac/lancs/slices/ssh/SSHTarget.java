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

import java.net.InetAddress;
import java.nio.file.Path;

/**
 * Identifies a node to connect to, and how to get there.
 */
public final class SSHTarget {
    /**
     * The node's name, for diagnostics
     */
    public final String name;

    /**
     * The node's management address
     */
    public final InetAddress address;

    /**
     * The user name on the node
     */
    public final String username;

    /**
     * The private key for the node
     */
    public final Path privateKey;

    /**
     * The jump host in front of the node
     */
    public final BastionRelay bastion;

    /**
     * Identify a node.
     * 
     * @param name the node's name
     * 
     * @param address the node's management address
     * 
     * @param username the user name on the node
     * 
     * @param privateKey the private key for the node
     * 
     * @param bastion the jump host in front of the node
     */
    public SSHTarget(String name, InetAddress address, String username,
                     Path privateKey, BastionRelay bastion) {
        this.name = name;
        this.address = address;
        this.username = username;
        this.privateKey = privateKey;
        this.bastion = bastion;
    }

    /**
     * Get the management address in textual form, without any scope.
     * 
     * @return the host address
     */
    public String host() {
        String text = address.getHostAddress();
        int pct = text.indexOf('%');
        return pct < 0 ? text : text.substring(0, pct);
    }

    @Override
    public String toString() {
        return name + " (" + username + "@" + host() + " via " + bastion.host
            + ")";
    }
}
