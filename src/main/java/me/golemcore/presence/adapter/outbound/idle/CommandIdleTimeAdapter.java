package me.golemcore.presence.adapter.outbound.idle;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.presence.infrastructure.config.PresenceProperties;
import me.golemcore.presence.port.inbound.IdleSignalUnavailableException;
import me.golemcore.presence.port.inbound.IdleTimePort;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Idle command that runs a shell command (for example {@code xprintidle} on X11)
 * and parses the first line of its output as the idle time.
 *
 * <p>
 * A non-zero exit, unparsable output, or a command running past the
 * configured timeout all surface as {@link IdleSignalUnavailableException}.
 */
@Component
@Slf4j
public class CommandIdleTimeAdapter implements IdleTimePort {

    private static final int MAX_OUTPUT_LENGTH = 256;

    private final PresenceProperties.IdleCommandProperties settings;
    private final ExecutorService outputReader = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "idle-command-output");
        t.setDaemon(true);
        return t;
    });

    public CommandIdleTimeAdapter(PresenceProperties properties) {
        this.settings = properties.getIdleCommand();
    }

    @Override
    public double currentIdleSeconds() {
        String command = settings.getCommand();
        if (command == null || command.isBlank()) {
            throw new IdleSignalUnavailableException("No idle command configured");
        }
        return parseIdleSeconds(run(command), settings.getUnit());
    }

    private String run(String command) {
        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", command);
        pb.redirectErrorStream(true);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new IdleSignalUnavailableException("Failed to start idle command: " + e.getMessage(), e);
        }

        Future<String> outputFuture = outputReader.submit(() -> {
            StringBuilder output = new StringBuilder();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line = reader.readLine();
                while (line != null) {
                    if (output.length() < MAX_OUTPUT_LENGTH) {
                        output.append(line).append('\n');
                    }
                    line = reader.readLine();
                }
            }
            return output.toString();
        });

        try {
            boolean completed = process.waitFor(settings.getTimeoutMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                process.destroyForcibly();
                outputFuture.cancel(true);
                throw new IdleSignalUnavailableException(
                        "Idle command timed out after " + settings.getTimeoutMillis() + " ms");
            }
            String output = outputFuture.get(1, TimeUnit.SECONDS);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new IdleSignalUnavailableException(
                        "Idle command exited with " + exitCode + ": " + output.trim());
            }
            return output;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IdleSignalUnavailableException("Idle command interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IdleSignalUnavailableException("Failed to read idle command output: " + e.getMessage(), e);
        }
    }

    static double parseIdleSeconds(String output, PresenceProperties.IdleUnit unit) {
        String firstLine = output == null ? "" : output.strip().lines().findFirst().orElse("").trim();
        if (firstLine.isEmpty()) {
            throw new IdleSignalUnavailableException("Idle command produced no output");
        }
        double value;
        try {
            value = Double.parseDouble(firstLine);
        } catch (NumberFormatException e) {
            throw new IdleSignalUnavailableException("Unparsable idle command output: " + firstLine, e);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IdleSignalUnavailableException("Idle command returned " + firstLine);
        }
        return unit == PresenceProperties.IdleUnit.SECONDS ? value : value / 1000.0;
    }

    @PreDestroy
    public void shutdown() {
        outputReader.shutdownNow();
        log.debug("[IdleCommand] Output reader stopped");
    }
}
