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

package uk.ac.lancs.slices.util;

/**
 * Computes delays between successive attempts. The first delay is the
 * initial delay, and each subsequent delay is multiplied by a factor,
 * up to a maximum.
 */
public final class Backoff {
    private final long initialMillis;

    private final double factor;

    private final long maxMillis;

    /**
     * Create a delay schedule.
     * 
     * @param initialMillis the first delay
     * 
     * @param factor the multiplier applied after each attempt, at least
     * 1
     * 
     * @param maxMillis the largest delay
     * 
     * @throws IllegalArgumentException if a delay is negative or the
     * factor is less than 1
     */
    public Backoff(long initialMillis, double factor, long maxMillis) {
        if (initialMillis < 0 || maxMillis < 0)
            throw new IllegalArgumentException("negative delay");
        if (factor < 1.0)
            throw new IllegalArgumentException("factor < 1: " + factor);
        this.initialMillis = initialMillis;
        this.factor = factor;
        this.maxMillis = Math.max(initialMillis, maxMillis);
    }

    /**
     * Create a schedule of constant delays.
     * 
     * @param millis the delay
     * 
     * @return the schedule
     */
    public static Backoff fixed(long millis) {
        return new Backoff(millis, 1.0, millis);
    }

    /**
     * Get the delay before an attempt.
     * 
     * @param attempt the number of attempts already made, at least 1
     * 
     * @return the delay in milliseconds
     */
    public long delay(int attempt) {
        double d = initialMillis;
        for (int i = 1; i < attempt && d < maxMillis; i++)
            d *= factor;
        return Math.min(maxMillis, Math.round(d));
    }

    @Override
    public String toString() {
        if (factor == 1.0) return initialMillis + "ms";
        return initialMillis + "ms*" + factor + "<=" + maxMillis + "ms";
    }
}
