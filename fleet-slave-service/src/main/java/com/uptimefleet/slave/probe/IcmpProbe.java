package com.uptimefleet.slave.probe;

import com.uptimefleet.common.model.MonitorType;
import com.uptimefleet.common.model.ServiceConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ICMP echo probe backed by the system ping binary (one packet per attempt).
 */
@Slf4j
public class IcmpProbe implements Probe {

    static final String PERMISSION_DENIED_MESSAGE = "Permission denied for ICMP check. Configure sudo privileges.";

    private static final Pattern TIME_PATTERN = Pattern.compile("time[=<]\\s*(\\d+(?:\\.\\d+)?)");

    private final String pingCommand;

    public IcmpProbe() {
        this("ping");
    }

    public IcmpProbe(String pingCommand) {
        this.pingCommand = pingCommand;
    }

    @Override
    public MonitorType type() {
        return MonitorType.ICMP;
    }

    @Override
    public ProbeResult probe(ServiceConfig config, long timeoutMs) {
        requireType(config);

        String host = config.getHost();
        if (host == null || host.isEmpty() || host.startsWith("-") || host.chars().anyMatch(Character::isWhitespace)) {
            return ProbeResult.failure(ProbeErrorType.INVALID_TARGET, 0, "Invalid host: " + host);
        }

        long startNanos = System.nanoTime();
        Process process;
        try {
            process = new ProcessBuilder(buildCommand(host, timeoutMs)).start();
        } catch (IOException e) {
            log.error("Failed to start ping for service {}: {}", config.getId(), e.getMessage());
            return ProbeResult.failure(ProbeErrorType.UNKNOWN, 0, "Failed to run ping: " + e.getMessage());
        }

        try {
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000L;
            if (!finished) {
                process.destroyForcibly();
                return ProbeResult.failure(ProbeErrorType.TIMEOUT, timeoutMs, "Timeout");
            }

            String stdout = read(process.getInputStream());
            String stderr = read(process.getErrorStream());

            if (process.exitValue() == 0) {
                Double pingTime = parseLatency(stdout);
                return ProbeResult.success(pingTime != null ? Math.round(pingTime) : elapsedMs);
            }
            return classifyFailure(stderr, elapsedMs);

        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return ProbeResult.failure(ProbeErrorType.UNKNOWN, 0, "Check interrupted");
        } catch (IOException e) {
            return ProbeResult.failure(ProbeErrorType.UNKNOWN, 0, "Failed to read ping output: " + e.getMessage());
        }
    }

    List<String> buildCommand(String host, long timeoutMs) {
        long waitSeconds = Math.max(1, (timeoutMs + 999) / 1000);
        List<String> command = new ArrayList<>();
        command.add(pingCommand);
        command.add("-c");
        command.add("1");
        command.add("-W");
        command.add(String.valueOf(waitSeconds));
        command.add(host);
        return command;
    }

    static ProbeResult classifyFailure(String stderr, long elapsedMs) {
        String error = stderr == null ? "" : stderr.trim();
        if (error.toLowerCase().contains("permission denied") || error.toLowerCase().contains("operation not permitted")) {
            log.error("Permission denied when running ping command. Please ensure sudo privileges are configured.");
            return ProbeResult.failure(ProbeErrorType.PERMISSION_DENIED, elapsedMs, PERMISSION_DENIED_MESSAGE);
        }
        return ProbeResult.failure(ProbeErrorType.UNREACHABLE, elapsedMs,
                error.isEmpty() ? "Host unreachable" : error);
    }

    /**
     * Round-trip time reported by ping, e.g. "time=12.3 ms"
     */
    static Double parseLatency(String output) {
        if (output == null) {
            return null;
        }
        Matcher matcher = TIME_PATTERN.matcher(output);
        return matcher.find() ? Double.parseDouble(matcher.group(1)) : null;
    }

    private static String read(InputStream stream) throws IOException {
        return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    }
}
