package arbor.core.fixture.common;

import arbor.core.fixture.Fixture;
import arbor.core.util.ObjectChecker;
import arbor.core.util.ProcessRunner;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A fixture whose setup runs an external command, such as a build step that tests depend on. A non-zero exit code
 * fails the setup.
 *
 * By default the fixture is lazy and build-once: the command runs the first time a test needs it, and only once no
 * matter how many tests depend on it.
 */
public final class CommandFixture extends Fixture {
    private final List<String> command;
    private final File directory;
    private int exitCode = -1;

    private CommandFixture(String name, List<String> command, File directory, boolean lazyInit, boolean buildOnce) {
        super(name, lazyInit, buildOnce);
        ObjectChecker.assertNonNull(command);
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty.");
        }
        this.command = Collections.unmodifiableList(new ArrayList<>(command));
        this.directory = directory;
    }

    /**
     * Returns a lazy, build-once fixture running the given command.
     *
     * @param name The fixture name.
     * @param command The command and its arguments.
     * @param directory The working directory, or null for the current one.
     * @return the fixture.
     */
    public static CommandFixture of(String name, List<String> command, File directory) {
        return new CommandFixture(name, command, directory, true, true);
    }

    public static CommandFixture withLifecycle(String name, List<String> command, File directory, boolean lazyInit, boolean buildOnce) {
        return new CommandFixture(name, command, directory, lazyInit, buildOnce);
    }

    @Override
    protected void doSetup() throws Exception {
        this.exitCode = ProcessRunner.logCall(this.command, this.directory);
        if (this.exitCode != 0) {
            throw new IllegalStateException("command " + this.command + " exited with code " + this.exitCode);
        }
    }

    /**
     * Returns the exit code of the last run of the command, or -1 if it has not run yet.
     *
     * @return the exit code.
     */
    public int getExitCode() {
        return this.exitCode;
    }

    public List<String> getCommand() {
        return this.command;
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { name: " + getName() + ", command: " + this.command + ", state: " + getState() + " }";
    }
}
