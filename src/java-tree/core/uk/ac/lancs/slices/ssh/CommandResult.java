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

/**
 * Holds the outcome of a command run on a node.
 */
public final class CommandResult {
    /**
     * The command's exit status
     */
    public final int exitCode;

    /**
     * The command's standard output
     */
    public final String stdout;

    /**
     * The command's standard error output
     */
    public final String stderr;

    /**
     * Whether the command was killed for exceeding its time limit
     */
    public final boolean timedOut;

    /**
     * Record a command's outcome.
     * 
     * @param exitCode the exit status
     * 
     * @param stdout the standard output
     * 
     * @param stderr the standard error output
     * 
     * @param timedOut whether the command exceeded its time limit
     */
    public CommandResult(int exitCode, String stdout, String stderr,
                         boolean timedOut) {
        this.exitCode = exitCode;
        this.stdout = stdout;
        this.stderr = stderr;
        this.timedOut = timedOut;
    }

    /**
     * Record the outcome of a command that completed in time.
     * 
     * @param exitCode the exit status
     * 
     * @param stdout the standard output
     * 
     * @param stderr the standard error output
     * 
     * @return the outcome
     */
    public static CommandResult of(int exitCode, String stdout,
                                   String stderr) {
        return new CommandResult(exitCode, stdout, stderr, false);
    }

    /**
     * Determine whether the command succeeded.
     * 
     * @return {@code true} if the command exited with status 0 in time
     */
    public boolean succeeded() {
        return exitCode == 0 && !timedOut;
    }

    @Override
    public String toString() {
        if (timedOut) return "timed out";
        String err = stderr.trim();
        if (err.isEmpty()) return "exit " + exitCode;
        return "exit " + exitCode + ": " + err;
    }
}
