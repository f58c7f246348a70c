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

/**
 * Specifies the compute resources requested for a node.
 */
public final class Capacity {
    /**
     * The number of cores
     */
    public final int cores;

    /**
     * The amount of memory in gigabytes
     */
    public final int ramGb;

    /**
     * The amount of disk in gigabytes
     */
    public final int diskGb;

    private Capacity(int cores, int ramGb, int diskGb) {
        this.cores = cores;
        this.ramGb = ramGb;
        this.diskGb = diskGb;
    }

    /**
     * Specify a capacity.
     * 
     * @param cores the number of cores
     * 
     * @param ramGb the amount of memory in gigabytes
     * 
     * @param diskGb the amount of disk in gigabytes
     * 
     * @return the requested capacity
     * 
     * @throws InvalidSpecException if any amount is not positive
     */
    public static Capacity of(int cores, int ramGb, int diskGb)
        throws InvalidSpecException {
        if (cores <= 0 || ramGb <= 0 || diskGb <= 0)
            throw new InvalidSpecException("capacity must be positive: cores="
                + cores + " ram=" + ramGb + " disk=" + diskGb);
        return new Capacity(cores, ramGb, diskGb);
    }

    /**
     * The capacity of a node when neither capacity nor instance type is
     * specified
     */
    public static final Capacity DEFAULT = new Capacity(2, 8, 10);

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Capacity)) return false;
        Capacity other = (Capacity) obj;
        return cores == other.cores && ramGb == other.ramGb &&
            diskGb == other.diskGb;
    }

    @Override
    public int hashCode() {
        return (cores * 31 + ramGb) * 31 + diskGb;
    }

    @Override
    public String toString() {
        return cores + " cores, " + ramGb + "G RAM, " + diskGb + "G disk";
    }
}
