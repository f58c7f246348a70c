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

import java.io.File;
import java.io.IOException;
import java.lang.ProcessBuilder.Redirect;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Connects to nodes by running the system's <samp>ssh</samp> and
 * <samp>scp</samp> commands. Each session starts a master connection
 * with a private control socket, tunnelled through the bastion with a
 * proxy command. Commands and transfers of the session are multiplexed
 * over the master, which is shut down when the session is closed.
 */
public final class ProcessSSHTransport implements SSHTransport {
    private static final Logger logger =
        Logger.getLogger("uk.ac.lancs.slices.ssh");

    /**
     * Extra time allowed for a remote command beyond its own limit
     * before the local client is killed
     */
    private static final long GRACE_MILLIS = 15000;

    private static final File NULL_INPUT = new File("/dev/null");

    private final String ssh;

    private final String scp;

    /**
     * Create a transport using <samp>ssh</samp> and <samp>scp</samp>
     * from the search path.
     */
    public ProcessSSHTransport() {
        this("ssh", "scp");
    }

    /**
     * Create a transport using specific programs.
     * 
     * @param ssh the SSH client program
     * 
     * @param scp the secure copy program
     */
    public ProcessSSHTransport(String ssh, String scp) {
        this.ssh = ssh;
        this.scp = scp;
    }

    /**
     * Quote a string for a POSIX shell.
     * 
     * @param text the string to quote
     * 
     * @return the string in single quotes, with embedded single quotes
     * escaped
     */
    static String shellQuote(String text) {
        return "'" + text.replace("'", "'\\''") + "'";
    }

    /**
     * Build the proxy command that relays through the bastion.
     * 
     * @param bastion the bastion to relay through
     * 
     * @param connectSeconds the connection timeout
     * 
     * @return the command, for the <samp>ProxyCommand</samp> option
     */
    String proxyCommand(BastionRelay bastion, long connectSeconds) {
        return ssh + " -i "
            + shellQuote(bastion.privateKey.toAbsolutePath().toString())
            + " -o IdentitiesOnly=yes -o IdentityAgent=none"
            + " -o BatchMode=yes -o StrictHostKeyChecking=no"
            + " -o UserKnownHostsFile=/dev/null -o LogLevel=ERROR"
            + " -o ConnectTimeout=" + connectSeconds + " -l "
            + shellQuote(bastion.username) + " -p " + bastion.port
            + " -W %h:%p " + shellQuote(bastion.host);
    }

    private void addOptions(List<String> command, SSHTarget target,
                            Path socket, long connectSeconds) {
        command.add("-o");
        command.add("ControlPath=" + socket.toAbsolutePath());
        command.add("-i");
        command.add(target.privateKey.toAbsolutePath().toString());

        /* IdentitiesOnly=yes should be enough to prevent the use of
         * the agent, but IdentityAgent=none is needed too. */
        for (String opt : new String[] { "IdentitiesOnly=yes",
            "IdentityAgent=none", "BatchMode=yes",
            "PasswordAuthentication=no", "ForwardX11=no",
            "StrictHostKeyChecking=no", "UserKnownHostsFile=/dev/null",
            "LogLevel=ERROR", "ConnectTimeout=" + connectSeconds,
            "ServerAliveInterval=15",
            "ProxyCommand=" + proxyCommand(target.bastion,
                                           connectSeconds) }) {
            command.add("-o");
            command.add(opt);
        }
    }

    List<String> masterCommand(SSHTarget target, Path socket,
                               long connectSeconds) {
        List<String> command = new ArrayList<>();
        command.add(ssh);
        command.add("-M");
        command.add("-N");
        command.add("-o");
        command.add("ControlPersist=no");
        addOptions(command, target, socket, connectSeconds);
        command.add("-l");
        command.add(target.username);
        command.add(target.host());
        return command;
    }

    List<String> controlCommand(SSHTarget target, Path socket,
                                String operation) {
        List<String> command = new ArrayList<>();
        command.add(ssh);
        command.add("-S");
        command.add(socket.toAbsolutePath().toString());
        command.add("-O");
        command.add(operation);
        command.add("-l");
        command.add(target.username);
        command.add(target.host());
        return command;
    }

    List<String> execCommand(SSHTarget target, Path socket,
                             long connectSeconds, String remote,
                             long timeoutMillis) {
        List<String> command = new ArrayList<>();
        command.add(ssh);
        command.add("-o");
        command.add("ControlMaster=no");
        addOptions(command, target, socket, connectSeconds);
        command.add("-l");
        command.add(target.username);
        command.add(target.host());
        command.add("--");
        if (timeoutMillis > 0) {
            long secs = Math.max(1, (timeoutMillis + 999) / 1000);
            command.add("timeout --foreground -k 10 " + secs + " bash -c "
                + shellQuote(remote));
        } else {
            command.add(remote);
        }
        return command;
    }

    static String remoteSpec(SSHTarget target, String path) {
        String host = target.host();
        if (host.indexOf(':') >= 0) host = "[" + host + "]";
        return target.username + "@" + host + ":" + path;
    }

    List<String> copyCommand(SSHTarget target, Path socket,
                             long connectSeconds, boolean recursive,
                             String from, String to) {
        List<String> command = new ArrayList<>();
        command.add(scp);
        command.add("-q");
        if (recursive) command.add("-r");
        command.add("-o");
        command.add("ControlMaster=no");
        addOptions(command, target, socket, connectSeconds);
        command.add(from);
        command.add(to);
        return command;
    }

    /**
     * Wait for a local client process to finish. The process is killed
     * if it overruns its limit, or if the calling thread is interrupted
     * while waiting.
     * 
     * @param proc the process
     * 
     * @param timeoutMillis the time limit, or 0 for none
     * 
     * @return {@code true} if the process finished in time;
     * {@code false} if it was killed for overrunning
     * 
     * @throws InterruptedException if the calling thread was
     * interrupted
     */
    static boolean awaitExit(Process proc, long timeoutMillis)
        throws InterruptedException {
        try {
            if (timeoutMillis <= 0) {
                proc.waitFor();
                return true;
            }
            if (proc.waitFor(timeoutMillis, TimeUnit.MILLISECONDS))
                return true;
        } catch (InterruptedException ex) {
            proc.destroyForcibly();
            throw ex;
        }
        proc.destroyForcibly().waitFor();
        return false;
    }

    private static String read(Path file) throws IOException {
        if (!Files.exists(file)) return "";
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private static void deleteTree(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException ex) {
                    logger.log(Level.FINE, "could not delete " + p, ex);
                }
            });
        } catch (IOException ex) {
            logger.log(Level.FINE, "could not clean up " + dir, ex);
        }
    }

    @Override
    public RemoteSession open(SSHTarget target, long connectTimeoutMillis)
        throws SSHConnectException,
            InterruptedException {
        final long connectSeconds =
            Math.max(1, (connectTimeoutMillis + 999) / 1000);
        final Path dir;
        try {
            dir = Files.createTempDirectory("slices-ssh");
        } catch (IOException ex) {
            throw new SSHConnectException("cannot create control directory"
                + " for " + target, ex);
        }
        final Path socket = dir.resolve("ctl");
        final Path log = dir.resolve("master.log");
        Process master = null;
        boolean ready = false;
        try {
            List<String> command =
                masterCommand(target, socket, connectSeconds);
            logger.fine(() -> "connecting to " + target);
            master = new ProcessBuilder(command).redirectErrorStream(true)
                .redirectInput(Redirect.from(NULL_INPUT))
                .redirectOutput(log.toFile()).start();

            final long deadline =
                System.currentTimeMillis() + connectTimeoutMillis;
            while (true) {
                if (!master.isAlive())
                    throw new SSHConnectException("cannot connect to "
                        + target + ": " + read(log).trim());
                Process check =
                    new ProcessBuilder(controlCommand(target, socket, "check"))
                        .redirectErrorStream(true)
                        .redirectOutput(Redirect.DISCARD).start();
                if (awaitExit(check, 5000) && check.exitValue() == 0) break;
                if (System.currentTimeMillis() > deadline)
                    throw new SSHConnectException("timed out connecting to "
                        + target);
                Thread.sleep(200);
            }
            ready = true;
            return new Session(target, dir, socket, master, connectSeconds);
        } catch (IOException ex) {
            throw new SSHConnectException("cannot connect to " + target, ex);
        } finally {
            if (!ready) {
                if (master != null) master.destroyForcibly();
                deleteTree(dir);
            }
        }
    }

    private final class Session implements RemoteSession {
        private final SSHTarget target;

        private final Path dir;

        private final Path socket;

        private final Process master;

        private final long connectSeconds;

        private int serial;

        private boolean closed;

        Session(SSHTarget target, Path dir, Path socket, Process master,
                long connectSeconds) {
            this.target = target;
            this.dir = dir;
            this.socket = socket;
            this.master = master;
            this.connectSeconds = connectSeconds;
        }

        private void checkOpen() {
            if (closed) throw new IllegalStateException("session closed");
        }

        @Override
        public CommandResult execute(String command, long timeoutMillis)
            throws SSHConnectException,
                InterruptedException {
            checkOpen();
            int id = ++serial;
            Path out = dir.resolve("out." + id);
            Path err = dir.resolve("err." + id);
            List<String> argv = execCommand(target, socket, connectSeconds,
                                            command, timeoutMillis);
            logger.fine(() -> target.name + "$ " + command);
            try {
                Process proc = new ProcessBuilder(argv)
                    .redirectInput(Redirect.from(NULL_INPUT))
                    .redirectOutput(out.toFile()).redirectError(err.toFile())
                    .start();
                if (!awaitExit(proc, timeoutMillis > 0 ?
                    timeoutMillis + GRACE_MILLIS : 0))
                    return new CommandResult(-1, read(out), read(err), true);
                int rc = proc.exitValue();
                String stderr = read(err);
                if (rc == 255)
                    throw new SSHConnectException("connection to " + target
                        + " failed: " + stderr.trim());
                return new CommandResult(rc, read(out), stderr, rc == 124);
            } catch (IOException ex) {
                throw new SSHConnectException("cannot run ssh for " + target,
                                              ex);
            } finally {
                try {
                    Files.deleteIfExists(out);
                    Files.deleteIfExists(err);
                } catch (IOException ex) {
                    logger.log(Level.FINE, "could not remove output files", ex);
                }
            }
        }

        private void copy(boolean recursive, String from, String to,
                          long timeoutMillis)
            throws SSHConnectException,
                IOException,
                InterruptedException {
            checkOpen();
            if (!master.isAlive())
                throw new SSHConnectException("connection to " + target
                    + " lost");
            Path err = dir.resolve("scp." + (++serial));
            try {
                List<String> argv = copyCommand(target, socket,
                                                connectSeconds, recursive,
                                                from, to);
                Process proc = new ProcessBuilder(argv)
                    .redirectInput(Redirect.from(NULL_INPUT))
                    .redirectOutput(Redirect.DISCARD)
                    .redirectError(err.toFile()).start();
                if (!awaitExit(proc, timeoutMillis))
                    throw new TransferTimeoutException("copy " + from + " to "
                        + to + " timed out after " + timeoutMillis + "ms",
                                                       timeoutMillis);
                int rc = proc.exitValue();
                if (rc != 0)
                    throw new IOException("copy " + from + " to " + to
                        + " failed: " + read(err).trim());
            } finally {
                Files.deleteIfExists(err);
            }
        }

        @Override
        public void upload(Path local, String remote, boolean recursive,
                           long timeoutMillis)
            throws SSHConnectException,
                IOException,
                InterruptedException {
            copy(recursive, local.toAbsolutePath().toString(),
                 remoteSpec(target, remote), timeoutMillis);
        }

        @Override
        public void download(String remote, Path local, boolean recursive,
                             long timeoutMillis)
            throws SSHConnectException,
                IOException,
                InterruptedException {
            copy(recursive, remoteSpec(target, remote),
                 local.toAbsolutePath().toString(), timeoutMillis);
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            try {
                Process exit =
                    new ProcessBuilder(controlCommand(target, socket, "exit"))
                        .redirectErrorStream(true)
                        .redirectOutput(Redirect.DISCARD).start();
                awaitExit(exit, 5000);
            } catch (IOException ex) {
                logger.log(Level.FINE, "could not stop master for " + target,
                           ex);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } finally {
                master.destroy();
                deleteTree(dir);
                logger.fine(() -> "disconnected from " + target);
            }
        }
    }
}
