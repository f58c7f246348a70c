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

import java.io.IOException;
import java.net.InetAddress;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import javax.json.JsonException;

import uk.ac.lancs.slices.AddressMode;
import uk.ac.lancs.slices.CidrAddress;
import uk.ac.lancs.slices.Interface;
import uk.ac.lancs.slices.NetworkService;
import uk.ac.lancs.slices.Node;
import uk.ac.lancs.slices.PostBootTask;
import uk.ac.lancs.slices.Reconciler;
import uk.ac.lancs.slices.Route;
import uk.ac.lancs.slices.Slice;
import uk.ac.lancs.slices.Subnet;
import uk.ac.lancs.slices.ssh.CommandResult;
import uk.ac.lancs.slices.ssh.RemoteChannel;
import uk.ac.lancs.slices.ssh.RemoteExecutionException;

/**
 * Configures one node's networking. Every change is preceded by a check
 * of the node's current state, and made only if needed, so running the
 * configuration again on a configured node makes no changes. Changes
 * are made with <samp>sudo</samp>; checks are not.
 */
final class NodeConfiguration {
    private static final Logger logger =
        Logger.getLogger("uk.ac.lancs.slices.boot");

    private final Node node;

    private final RemoteChannel channel;

    private final Reconciler reconciler;

    private final Map<Interface, List<CidrAddress>> plan;

    private final long timeoutMillis;

    private final boolean flushStray;

    private HostState host;

    NodeConfiguration(Node node, RemoteChannel channel,
                      Reconciler reconciler,
                      Map<Interface, List<CidrAddress>> plan,
                      long timeoutMillis, boolean flushStray) {
        this.node = node;
        this.channel = channel;
        this.reconciler = reconciler;
        this.plan = plan;
        this.timeoutMillis = timeoutMillis;
        this.flushStray = flushStray;
    }

    private CommandResult query(String step, String command)
        throws RemoteExecutionException,
            ConfigurationStepException,
            InterruptedException {
        CommandResult result = channel.execute(node, command, timeoutMillis);
        if (!result.succeeded())
            throw new ConfigurationStepException(step, result);
        return result;
    }

    private void change(String step, String command)
        throws RemoteExecutionException,
            ConfigurationStepException,
            InterruptedException {
        logger.fine(() -> node.getName() + ": " + step);
        CommandResult result =
            channel.execute(node, "sudo " + command, timeoutMillis);
        if (!result.succeeded())
            throw new ConfigurationStepException(step, result);
    }

    private static String family(boolean ipv6) {
        return ipv6 ? "-6 " : "";
    }

    /**
     * Run the configuration.
     * 
     * @throws RemoteExecutionException if the node could not be
     * reached
     * 
     * @throws ConfigurationStepException if a step failed
     * 
     * @throws IOException if a post-boot upload failed
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted
     */
    void run()
        throws RemoteExecutionException,
            ConfigurationStepException,
            IOException,
            InterruptedException {
        configureHostname();
        loadHostState();
        configureManagement();
        for (Interface iface : node.getInterfaces())
            if (iface.getNetworkService().isPresent())
                configureInterface(iface);
        configureRoutes();
        runPostBootTasks();
    }

    private void configureHostname()
        throws RemoteExecutionException,
            ConfigurationStepException,
            InterruptedException {
        String wanted = node.getName().replace('_', '-');
        String current = query("get hostname", "hostname").stdout.trim();
        if (!current.equals(wanted))
            change("set hostname", "hostnamectl set-hostname " + wanted);
    }

    private void loadHostState()
        throws RemoteExecutionException,
            ConfigurationStepException,
            InterruptedException {
        host = new HostState();
        try {
            host.parseLinks(query("list addresses", "ip -j addr list").stdout);
            host.parseRoutes(query("list routes", "ip -j route list").stdout);
            for (Route r : node.getRoutes()) {
                if (resolveDestination(r).isIPv6()) {
                    host.parseRoutes(query("list routes",
                                           "ip -j -6 route list").stdout);
                    break;
                }
            }
        } catch (JsonException | ClassCastException | NullPointerException
            | IllegalArgumentException ex) {
            throw new ConfigurationStepException("read network state",
                                                 "unparseable output: "
                                                     + ex.getMessage());
        }
    }

    private void configureManagement()
        throws RemoteExecutionException,
            ConfigurationStepException,
            InterruptedException {
        String mgmt = host.defaultDevice();
        if (mgmt == null) return;
        HostState.Link link = host.link(mgmt);
        if (link != null && !link.up) {
            change("bring up " + mgmt, "ip link set dev " + mgmt + " up");
            link.up = true;
        }
    }

    private void configureInterface(Interface iface)
        throws RemoteExecutionException,
            ConfigurationStepException,
            InterruptedException {
        String step = "configure " + iface.getName();
        Optional<String> mac = iface.getMac();
        if (!mac.isPresent())
            throw new ConfigurationStepException(step, "no MAC reported");
        HostState.Link phys = host.findPhysical(mac.get());
        if (phys == null)
            throw new ConfigurationStepException(step, "no device with MAC "
                + mac.get());

        CommandResult nm = channel.execute(node, "nmcli -g GENERAL.STATE"
            + " device show " + phys.name, timeoutMillis);
        if (nm.succeeded() && !nm.stdout.contains("unmanaged"))
            change("unmanage " + phys.name,
                   "nmcli device set " + phys.name + " managed no");

        List<CidrAddress> desired =
            plan.getOrDefault(iface, Collections.emptyList());
        /* Once post-boot tasks have run, any address they added must
         * survive. */
        boolean flush = flushStray && !node.isInstantiated();
        Optional<Integer> vlan = iface.getVlan();
        HostState.Link target = phys;
        if (vlan.isPresent()) {
            /* Addresses go on the VLAN device, not its parent. */
            if (flush) flush(phys, Collections.emptyList());
            ensureUp(phys);
            String vname = phys.name + "." + vlan.get();
            target = host.link(vname);
            if (target == null) {
                change("add VLAN " + vname, "ip link add link " + phys.name
                    + " name " + vname + " type vlan id " + vlan.get());
                target = new HostState.Link(vname, phys.mac, phys.name, false);
                host.add(target);
            }
        }
        if (flush && iface.getMode() != AddressMode.NONE)
            flush(target, desired);
        for (CidrAddress addr : desired) {
            if (target.addresses.contains(addr)) continue;
            change("add " + addr + " to " + target.name,
                   "ip " + family(addr.isIPv6()) + "addr add " + addr
                       + " dev " + target.name);
            target.addresses.add(addr);
        }
        ensureUp(target);
        reconciler.recordConfiguration(iface, target.name, desired);
    }

    private void ensureUp(HostState.Link link)
        throws RemoteExecutionException,
            ConfigurationStepException,
            InterruptedException {
        if (link.up) return;
        change("bring up " + link.name, "ip link set dev " + link.name + " up");
        link.up = true;
    }

    private void flush(HostState.Link link, List<CidrAddress> desired)
        throws RemoteExecutionException,
            ConfigurationStepException,
            InterruptedException {
        for (CidrAddress addr : AddressPlanner.stray(link.addresses,
                                                     desired)) {
            change("remove " + addr + " from " + link.name,
                   "ip " + family(addr.isIPv6()) + "addr del " + addr
                       + " dev " + link.name);
            link.addresses.remove(addr);
        }
    }

    private Subnet resolveDestination(Route route)
        throws ConfigurationStepException {
        String dest = route.getDestination();
        if (dest.indexOf('/') >= 0) {
            try {
                return Subnet.parse(dest);
            } catch (IllegalArgumentException ex) {
                throw new ConfigurationStepException("route " + route,
                                                     ex.getMessage());
            }
        }
        NetworkService svc = node.getSlice().getNetworkService(dest);
        if (svc == null)
            throw new ConfigurationStepException("route " + route,
                                                 "no such subnet or service");
        Optional<Subnet> subnet = svc.getSubnet();
        if (!subnet.isPresent())
            throw new ConfigurationStepException("route " + route,
                                                 "service " + dest
                                                     + " has no subnet");
        return subnet.get();
    }

    private InetAddress resolveNextHop(Route route)
        throws ConfigurationStepException {
        String hop = route.getNextHop();
        if (CidrAddress.isAddress(hop)) return CidrAddress.parseAddress(hop);
        Slice slice = node.getSlice();
        NetworkService svc = slice.getNetworkService(hop);
        if (svc == null)
            throw new ConfigurationStepException("route " + route,
                                                 "no such gateway or service");
        Optional<InetAddress> gw = svc.getGateway();
        if (!gw.isPresent())
            throw new ConfigurationStepException("route " + route,
                                                 "service " + hop
                                                     + " has no gateway");
        return gw.get();
    }

    private void configureRoutes()
        throws RemoteExecutionException,
            ConfigurationStepException,
            InterruptedException {
        for (Route route : node.getRoutes()) {
            Subnet dest = resolveDestination(route);
            InetAddress via = resolveNextHop(route);
            if (host.hasRoute(dest)) continue;
            change("add route " + route,
                   "ip " + family(dest.isIPv6()) + "route add " + dest
                       + " via " + via.getHostAddress());
            host.add(new HostState.RouteEntry(dest, via.getHostAddress(),
                                              null));
        }
    }

    private void runPostBootTasks()
        throws RemoteExecutionException,
            ConfigurationStepException,
            IOException,
            InterruptedException {
        if (node.isInstantiated()) return;
        for (PostBootTask task : node.getPostBootTasks()) {
            logger.fine(() -> node.getName() + ": " + task);
            switch (task.getKind()) {
            case EXECUTE:
                CommandResult result =
                    channel.execute(node, task.getCommand(), timeoutMillis);
                if (!result.succeeded())
                    throw new ConfigurationStepException(task.toString(),
                                                         result);
                break;

            case UPLOAD_FILE:
                channel.upload(node, task.getLocal(), task.getRemote(),
                               timeoutMillis);
                break;

            case UPLOAD_DIRECTORY:
                channel.uploadDirectory(node, task.getLocal(),
                                        task.getRemote(), timeoutMillis);
                break;
            }
        }
        reconciler.markInstantiated(node);
    }
}
