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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Lists the component models that may be attached to nodes, with the
 * number of network ports each provides and the sites where each is
 * known to be unavailable.
 */
public enum ComponentModel {
    /**
     * A virtual function of a shared ConnectX-6 NIC
     */
    NIC_BASIC("NIC_Basic", "SharedNIC", 1),

    /**
     * A dedicated ConnectX-5 NIC
     */
    NIC_CONNECTX_5("NIC_ConnectX_5", "SmartNIC", 2),

    /**
     * A dedicated ConnectX-6 NIC
     */
    NIC_CONNECTX_6("NIC_ConnectX_6", "SmartNIC", 2),

    /**
     * A dedicated 100G ConnectX-7 NIC
     */
    NIC_CONNECTX_7_100("NIC_ConnectX_7_100", "SmartNIC", 2),

    /**
     * A dedicated 400G ConnectX-7 NIC
     */
    NIC_CONNECTX_7_400("NIC_ConnectX_7_400", "SmartNIC", 2, "HAWI", "CERN",
                       "AMST", "BRIST"),

    /**
     * A BlueField-2 DPU
     */
    NIC_BLUEFIELD2_CONNECTX_6("NIC_BlueField_2_ConnectX_6", "SmartNIC", 2,
                              "HAWI", "CERN", "AMST", "BRIST", "TOKY"),

    /**
     * An NVMe drive
     */
    NVME_P4510("NVME_P4510", "NVME", 0),

    GPU_TESLA_T4("GPU_TeslaT4", "GPU", 0),

    GPU_RTX6000("GPU_RTX6000", "GPU", 0),

    GPU_A30("GPU_A30", "GPU", 0, "HAWI", "TOKY"),

    GPU_A40("GPU_A40", "GPU", 0, "HAWI", "TOKY"),

    /**
     * A Xilinx Alveo U280 FPGA
     */
    FPGA_XILINX_U280("FPGA_Xilinx_U280", "FPGA", 2, "HAWI", "TOKY",
                     "CERN"),

    /**
     * A Xilinx SN1022 FPGA NIC
     */
    FPGA_XILINX_SN1022("FPGA_Xilinx_SN1022", "FPGA", 2, "HAWI", "TOKY",
                       "CERN", "AMST", "BRIST");

    private final String label;

    private final String type;

    private final int ports;

    private final Set<String> excludedSites;

    ComponentModel(String label, String type, int ports,
                   String... excludedSites) {
        this.label = label;
        this.type = type;
        this.ports = ports;
        this.excludedSites = Collections
            .unmodifiableSet(new HashSet<>(Arrays.asList(excludedSites)));
    }

    /**
     * Get the model's label, as used in requests.
     * 
     * @return the model's label
     */
    public String label() {
        return label;
    }

    /**
     * Get the model's resource type, e.g., <samp>GPU</samp>.
     * 
     * @return the resource type
     */
    public String type() {
        return type;
    }

    /**
     * Get the number of network ports that components of this model
     * provide.
     * 
     * @return the number of ports
     */
    public int ports() {
        return ports;
    }

    /**
     * Check that this model can be placed at a site.
     * 
     * @param site the site name
     * 
     * @throws UnsupportedModelException if the model is unavailable at
     * the site
     */
    public void checkSite(String site) throws UnsupportedModelException {
        if (excludedSites.contains(site))
            throw new UnsupportedModelException(label, site);
    }

    /**
     * Find a model by its label.
     * 
     * @param label the model's label
     * 
     * @return the matching model
     * 
     * @throws UnsupportedModelException if no model has the label
     */
    public static ComponentModel forLabel(String label)
        throws UnsupportedModelException {
        for (ComponentModel m : values())
            if (m.label.equals(label)) return m;
        throw new UnsupportedModelException(label, null);
    }
}
