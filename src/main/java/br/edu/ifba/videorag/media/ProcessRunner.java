package br.edu.ifba.videorag.media;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs an external media tool and captures its combined output.
 */
public class ProcessRunner {

    private static final Logger logger = LoggerFactory.getLogger(ProcessRunner.class);
    private static final int MAX_OUTPUT_IN_MESSAGE = 500;

    /**
     * Runs the command to completion.
     *
     * @param taskName name reported in failures
     * @param command executable followed by its arguments
     * @return the process output (stdout and stderr interleaved)
     * @throws MediaTaskException on a non-zero exit code, an I/O failure or interruption
     */
    @NotNull
    public String run(@NotNull String taskName, @NotNull List<String> command) {
        logger.debug("Running {}: {}", taskName, String.join(" ", command));
        final ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectErrorStream(true);

        try {
            final Process process = builder.start();
            final String output;
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }
            final int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new MediaTaskException(
                    taskName + " failed with exit code " + exitCode + ": " + truncate(output), taskName);
            }
            return output;
        } catch (IOException e) {
            throw new MediaTaskException(taskName + " could not be started: " + e.getMessage(), taskName, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MediaTaskException(taskName + " was interrupted", taskName, e);
        }
    }

    private static String truncate(String output) {
        if (output.length() <= MAX_OUTPUT_IN_MESSAGE) {
            return output;
        }
        return "..." + output.substring(output.length() - MAX_OUTPUT_IN_MESSAGE);
    }
}
