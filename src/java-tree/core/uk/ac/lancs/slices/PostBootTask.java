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

package uk.ac.lancs.slices;

import java.nio.file.Path;

/**
 * A user-supplied step run on a node once, after its networking has
 * been configured for the first time.
 */
public final class PostBootTask {
    /**
     * Distinguishes kinds of post-boot task.
     */
    public enum Kind {
        /**
         * Run a shell command.
         */
        EXECUTE,

        /**
         * Copy a local file to the node.
         */
        UPLOAD_FILE,

        /**
         * Copy a local directory tree to the node.
         */
        UPLOAD_DIRECTORY;
    }

    private final Kind kind;

    private final String command;

    private final Path local;

    private final String remote;

    private PostBootTask(Kind kind, String command, Path local,
                         String remote) {
        this.kind = kind;
        this.command = command;
        this.local = local;
        this.remote = remote;
    }

    /**
     * Create a task to run a command.
     * 
     * @param command the shell command
     * 
     * @return the new task
     */
    public static PostBootTask execute(String command) {
        return new PostBootTask(Kind.EXECUTE, command, null, null);
    }

    /**
     * Create a task to upload a file.
     * 
     * @param local the local file
     * 
     * @param remote the destination path on the node
     * 
     * @return the new task
     */
    public static PostBootTask uploadFile(Path local, String remote) {
        return new PostBootTask(Kind.UPLOAD_FILE, null, local, remote);
    }

    /**
     * Create a task to upload a directory tree.
     * 
     * @param local the local directory
     * 
     * @param remote the destination directory on the node
     * 
     * @return the new task
     */
    public static PostBootTask uploadDirectory(Path local, String remote) {
        return new PostBootTask(Kind.UPLOAD_DIRECTORY, null, local, remote);
    }

    /**
     * Get the kind of task.
     * 
     * @return the task kind
     */
    public Kind getKind() {
        return kind;
    }

    /**
     * Get the command to run.
     * 
     * @return the command, or {@code null} if this is an upload
     */
    public String getCommand() {
        return command;
    }

    /**
     * Get the local source of an upload.
     * 
     * @return the local path, or {@code null} if this is a command
     */
    public Path getLocal() {
        return local;
    }

    /**
     * Get the remote destination of an upload.
     * 
     * @return the remote path, or {@code null} if this is a command
     */
    public String getRemote() {
        return remote;
    }

    @Override
    public String toString() {
        switch (kind) {
        case EXECUTE:
            return "execute " + command;
        default:
            return kind.name().toLowerCase() + " " + local + " -> " + remote;
        }
    }
}
