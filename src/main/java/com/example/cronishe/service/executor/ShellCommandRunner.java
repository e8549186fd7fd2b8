package com.example.cronishe.service.executor;

import com.example.cronishe.config.SchedulerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.LongConsumer;

/**
 * Runs a command line through the OS shell and streams its output.
 * <p>
 * stdout and stderr are merged and delivered line by line as they arrive. The
 * child inherits the scheduler's environment and working directory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShellCommandRunner {

    private final SchedulerProperties properties;

    /**
     * Run {@code command} to completion.
     *
     * @param command command line, interpreted by the shell
     * @param onSpawn receives the pid as soon as the process exists
     * @param onLine  receives each output line, trailing whitespace removed
     * @return the process exit status
     * @throws IOException          if the process cannot be started or its output read
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public int run(String command, LongConsumer onSpawn, Consumer<String> onLine) throws IOException, InterruptedException {
        var processBuilder = new ProcessBuilder(commandLine(command));
        processBuilder.redirectErrorStream(true);

        var process = processBuilder.start();
        try {
            onSpawn.accept(process.pid());

            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    onLine.accept(line.stripTrailing());
                }
            }

            return process.waitFor();
        } catch (IOException | InterruptedException | RuntimeException e) {
            // Nobody will read the output or reap the child any more
            destroyTree(process);
            throw e;
        }
    }

    List<String> commandLine(String command) {
        var prefix = properties.getShell();
        if (prefix == null || prefix.isEmpty()) {
            prefix = isWindows() ? List.of("cmd", "/c") : List.of("sh", "-c");
        }
        var commandLine = new ArrayList<>(prefix);
        commandLine.add(command);
        return commandLine;
    }

    private static boolean isWindows() {
        return System.getProperty("os.name").toLowerCase().contains("win");
    }

    private static void destroyTree(Process process) {
        if (!process.isAlive()) {
            return;
        }
        log.warn("Destroying process {} after its supervisor failed", process.pid());
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
    }
}
