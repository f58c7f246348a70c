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

package uk.ac.lancs.slices.apps;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

import uk.ac.lancs.config.Configuration;
import uk.ac.lancs.config.ConfigurationContext;
import uk.ac.lancs.slices.Component;
import uk.ac.lancs.slices.Interface;
import uk.ac.lancs.slices.NetworkService;
import uk.ac.lancs.slices.Node;
import uk.ac.lancs.slices.Reconciler;
import uk.ac.lancs.slices.Slice;
import uk.ac.lancs.slices.TopologyException;
import uk.ac.lancs.slices.boot.ConfigurationReport;
import uk.ac.lancs.slices.orchestrator.OrchestratorException;
import uk.ac.lancs.slices.persist.SliceStore;
import uk.ac.lancs.slices.sync.PollOutcome;
import uk.ac.lancs.slices.sync.PollingFailedException;

/**
 * Loads a saved slice, and applies lifecycle commands to it from the
 * command line. The slice file is saved again after each command that
 * changes the slice.
 * 
 * @author simpsons
 */
public final class SliceCommander {
    private final ConfigurationContext configCtxt =
        new ConfigurationContext();

    private final Reconciler reconciler = new Reconciler();

    private final SliceStore store = new SliceStore(reconciler);

    private Configuration config = ConfigurationContext.EMPTY;

    private SliceController controller;

    private TestbedContext context;

    private Slice slice;

    private Path sliceFile;

    private String usage;

    private SliceController controller() {
        if (controller == null) {
            context = TestbedContext.fromEnvironment(config);
            controller = SliceController.create(context, reconciler);
        }
        return controller;
    }

    private boolean needSlice() {
        if (slice != null) return true;
        System.err.printf("No slice loaded; use -f <file>%n");
        return false;
    }

    private void save() throws IOException {
        store.save(slice, sliceFile);
    }

    boolean process(Iterator<? extends String> iter)
        throws IOException,
            TopologyException,
            OrchestratorException,
            PollingFailedException,
            InterruptedException {
        usage = null;
        final String arg = iter.next();

        if ("-c".equals(arg)) {
            usage = arg + " <config-file>";
            config = configCtxt.get(Paths.get(iter.next()));
            controller = null;
            return true;
        }

        if ("-f".equals(arg)) {
            usage = arg + " <slice-file>";
            sliceFile = Paths.get(iter.next());
            slice = store.load(sliceFile);
            System.out.printf("Loaded %s (%s)%n", slice.getName(),
                              slice.getState());
            return true;
        }

        if ("status".equals(arg)) {
            if (!needSlice()) return false;
            printStatus();
            return true;
        }

        if ("submit".equals(arg)) {
            if (!needSlice()) return false;
            System.out.printf("Submitted: %s%n", controller()
                .submit(slice, Collections.emptyList()));
            save();
            return true;
        }

        if ("refresh".equals(arg)) {
            if (!needSlice()) return false;
            System.out.printf("State: %s%n", controller().refresh(slice));
            save();
            return true;
        }

        if ("wait".equals(arg)) {
            if (!needSlice()) return false;
            PollOutcome outcome = controller().waitStable(slice);
            save();
            System.out.printf("Wait ended: %s%n", outcome);
            for (Map.Entry<String, String> entry : slice.getErrorMessages()
                .entrySet())
                System.out.printf("  %s: %s%n", entry.getKey(),
                                  entry.getValue());
            return outcome == PollOutcome.STABLE;
        }

        if ("ssh".equals(arg)) {
            if (!needSlice()) return false;
            boolean ok = controller()
                .waitSSH(slice, context.pollTimeoutMillis());
            System.out.printf("SSH %s%n", ok ? "ready" : "not ready");
            return ok;
        }

        if ("configure".equals(arg)) {
            if (!needSlice()) return false;
            ConfigurationReport report = controller().configure(slice);
            save();
            for (String name : report.configured())
                System.out.printf("  %s: configured%n", name);
            for (Map.Entry<String, Exception> entry : report.failures()
                .entrySet())
                System.out.printf("  %s: %s%n", entry.getKey(),
                                  entry.getValue().getMessage());
            return report.isSuccess();
        }

        if ("renew".equals(arg)) {
            usage = arg + " <days>";
            int days = Integer.parseInt(iter.next());
            if (!needSlice()) return false;
            Instant end = Instant.now().plus(Duration.ofDays(days));
            controller().renew(slice, end);
            save();
            System.out.printf("Lease ends %s%n", end);
            return true;
        }

        if ("delete".equals(arg)) {
            if (!needSlice()) return false;
            controller().delete(slice);
            save();
            System.out.printf("Deleted %s%n", slice.getName());
            return true;
        }

        System.err.printf("Unknown command: %s%n", arg);
        return false;
    }

    private void printStatus() {
        System.out.printf("Slice %s [%s] %s%n", slice.getName(),
                          slice.getSliceId().orElse("-"), slice.getState());
        slice.getLeaseEnd()
            .ifPresent(t -> System.out.printf("  lease ends %s%n", t));
        for (Node node : slice.getNodes()) {
            System.out.printf("  node %s at %s: %s%s%n", node.getName(),
                              node.getSite(),
                              node.getReservationState().label(),
                              node.getManagementAddress()
                                  .map(a -> " " + a.getHostAddress())
                                  .orElse(""));
            for (Component comp : node.getComponents()) {
                System.out.printf("    %s %s: %s%n", comp.getLocalName(),
                                  comp.getModel().label(),
                                  comp.getReservationState().label());
                for (Interface iface : comp.getInterfaces())
                    System.out.printf("      %s %s %s%n", iface.getName(),
                                      iface.getDeviceName().orElse("-"),
                                      iface.getAssignedAddresses());
            }
        }
        for (NetworkService svc : slice.getNetworkServices())
            System.out.printf("  %s %s: %s %s%n", svc.getType().label(),
                              svc.getName(),
                              svc.getReservationState().label(),
                              svc.getSubnet().map(Object::toString)
                                  .orElse(""));
    }

    void process(String[] args)
        throws IOException,
            TopologyException,
            OrchestratorException,
            PollingFailedException,
            InterruptedException {
        try {
            for (Iterator<String> iter = Arrays.asList(args).iterator(); iter
                .hasNext();) {
                if (!process(iter)) break;
            }
        } catch (NoSuchElementException ex) {
            System.err.printf("Usage: %s%n", usage);
        }
    }

    /**
     * Apply commands to a saved slice.
     * 
     * @param args The following switches are recognized:
     * 
     * <dl>
     * 
     * <dt><samp>-c <var>file</var></samp>
     * 
     * <dd>Read testbed settings from a properties file.
     * 
     * <dt><samp>-f <var>file</var></samp>
     * 
     * <dd>Load the slice saved in the file. Later commands apply to it,
     * and save it back.
     * 
     * <dt><samp>status</samp>
     * 
     * <dd>Print the slice's last known state.
     * 
     * <dt><samp>submit</samp>
     * 
     * <dd>Submit an unsubmitted slice.
     * 
     * <dt><samp>refresh</samp>
     * 
     * <dd>Query the slice once.
     * 
     * <dt><samp>wait</samp>
     * 
     * <dd>Wait for the slice to become stable or fail.
     * 
     * <dt><samp>ssh</samp>
     * 
     * <dd>Wait for all nodes to accept SSH connections.
     * 
     * <dt><samp>configure</samp>
     * 
     * <dd>Configure node networking, and run post-boot tasks.
     * 
     * <dt><samp>renew <var>days</var></samp>
     * 
     * <dd>Extend the lease to the given number of days from now.
     * 
     * <dt><samp>delete</samp>
     * 
     * <dd>Delete the slice.
     * 
     * </dl>
     * 
     * @throws Exception if something went wrong
     */
    public static void main(String[] args) throws Exception {
        SliceCommander me = new SliceCommander();
        me.process(args);
    }
}
