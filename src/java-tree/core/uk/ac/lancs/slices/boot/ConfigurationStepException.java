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

import uk.ac.lancs.slices.ssh.CommandResult;

/**
 * Indicates that a step of configuring a node failed. Steps completed
 * before it are not undone, and are skipped when configuration is
 * repeated.
 */
public class ConfigurationStepException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String step;

    private final transient CommandResult result;

    /**
     * Create an exception for a command that failed.
     * 
     * @param step the failed step
     * 
     * @param result the command's outcome
     */
    public ConfigurationStepException(String step, CommandResult result) {
        super(step + ": " + result);
        this.step = step;
        this.result = result;
    }

    /**
     * Create an exception for a step that could not be attempted.
     * 
     * @param step the failed step
     * 
     * @param message the detail message
     */
    public ConfigurationStepException(String step, String message) {
        super(step + ": " + message);
        this.step = step;
        this.result = null;
    }

    /**
     * Get the failed step.
     * 
     * @return the step description
     */
    public String getStep() {
        return step;
    }

    /**
     * Get the outcome of the failed command.
     * 
     * @return the command's outcome, or {@code null} if no command
     * was run
     */
    public CommandResult getResult() {
        return result;
    }
}
