package arbor.core.util;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Runs external commands to completion, sending everything they print to the logger.
 *
 * Standard output and standard error are each drained by their own daemon thread while the calling thread waits for
 * the process, so a chatty process can never block on a full pipe.
 */
public final class ProcessRunner {
    private static final Logger LOGGER = Logger.forClass(ProcessRunner.class);

    private ProcessRunner() {}

    /**
     * Same as {@link ProcessRunner#logCall(List, File)} for a command given as separate arguments.
     */
    public static int logCall(File directory, String... command) throws IOException, InterruptedException {
        return logCall(Arrays.asList(command), directory);
    }

    /**
     * Runs the given command in the given directory and waits for it to exit. Every line the process prints is logged
     * at debug level.
     *
     * @param command The command and its arguments.
     * @param directory The working directory, or null to use the current one.
     * @return the exit code of the process.
     * @throws IOException If the process cannot be started.
     * @throws InterruptedException If interrupted while waiting for the process.
     */
    public static int logCall(List<String> command, File directory) throws IOException, InterruptedException {
        ObjectChecker.assertNonNull(command);
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty.");
        }

        List<String> arguments = Collections.unmodifiableList(new ArrayList<>(command));
        LOGGER.debug("Calling: " + arguments + ((directory == null) ? "" : " in " + directory));

        Process process = new ProcessBuilder(arguments).directory(directory).start();
        Thread stdout = drain(process.getInputStream(), "stdout", arguments.get(0));
        Thread stderr = drain(process.getErrorStream(), "stderr", arguments.get(0));
        process.getOutputStream().close();

        try {
            int exitCode = process.waitFor();
            stdout.join();
            stderr.join();
            LOGGER.debug(arguments.get(0) + " exited with code " + exitCode + ".");
            return exitCode;
        } catch (InterruptedException e) {
            process.destroy();
            throw e;
        }
    }

    private static Thread drain(InputStream stream, String streamName, String program) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    LOGGER.debug("[" + program + " " + streamName + "] " + line);
                }
            } catch (IOException e) {
                LOGGER.warn("Stopped reading " + streamName + " of " + program + ": " + e.getMessage());
            }
        }, "drain-" + streamName);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }
}
