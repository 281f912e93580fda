package io.trialmesh.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs one command line through {@code sh -c}, merging stderr into stdout.
 *
 * <p>Output is drained while the command runs and only the last {@link #MAX_CAPTURED_BYTES}
 * bytes are kept, so chatty models never block on a full pipe.
 */
final class ShellCommand {
    private static final Logger logger = LoggerFactory.getLogger(ShellCommand.class);
    static final int MAX_OUTPUT_CHARS = 512;
    static final int MAX_CAPTURED_BYTES = 64 * 1024;
    private static final long DRAIN_GRACE_MS = 1_000L;
    private static final int CHUNK_BYTES = 8192;

    private ShellCommand() {
    }

    static Outcome run(String command, Path workDir, long timeoutMs) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(List.of("sh", "-c", command));
        pb.redirectErrorStream(true);
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        Process process = pb.start();
        process.getOutputStream().close();
        OutputTail tail = new OutputTail(process.getInputStream());
        Thread drainer = new Thread(tail, "trialmesh-shell-output-" + process.pid());
        drainer.setDaemon(true);
        drainer.start();
        try {
            boolean finished = process.waitFor(Math.max(1L, timeoutMs), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                drainer.join(DRAIN_GRACE_MS);
                return new Outcome(-1, tail.text(), true, timeoutMs);
            }
            // Background children of the shell may hold the pipe open; do not wait on them.
            drainer.join(DRAIN_GRACE_MS);
            return new Outcome(process.exitValue(), tail.text(), false, timeoutMs);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_OUTPUT_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_OUTPUT_CHARS) + "...";
    }

    /**
     * Reads a process stream to its end, keeping a bounded tail.
     */
    private static final class OutputTail implements Runnable {
        private final InputStream in;
        private final ByteArrayOutputStream captured = new ByteArrayOutputStream();

        private OutputTail(InputStream in) {
            this.in = in;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[CHUNK_BYTES];
            try (InputStream stream = in) {
                int n;
                while ((n = stream.read(chunk)) >= 0) {
                    append(chunk, n);
                }
            } catch (IOException e) {
                logger.debug("Command output closed early: {}", e.getMessage());
            }
        }

        private synchronized void append(byte[] chunk, int n) {
            captured.write(chunk, 0, n);
            if (captured.size() > 2 * MAX_CAPTURED_BYTES) {
                byte[] all = captured.toByteArray();
                captured.reset();
                captured.write(all, all.length - MAX_CAPTURED_BYTES, MAX_CAPTURED_BYTES);
            }
        }

        synchronized String text() {
            byte[] all = captured.toByteArray();
            int from = Math.max(0, all.length - MAX_CAPTURED_BYTES);
            return new String(all, from, all.length - from, StandardCharsets.UTF_8);
        }
    }

    record Outcome(int exitCode, String output, boolean timedOut, long timeoutMs) {
        boolean ok() {
            return !timedOut && exitCode == 0;
        }

        String describe() {
            if (timedOut) {
                return "timeout after " + Duration.ofMillis(timeoutMs);
            }
            return "exit=" + exitCode + " output=" + truncate(output);
        }
    }
}
