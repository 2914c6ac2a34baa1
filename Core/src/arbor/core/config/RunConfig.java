package arbor.core.config;

import arbor.core.util.ObjectChecker;

import java.io.File;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * The settings of a single run. A configuration is built once by whoever starts the run and handed explicitly to the
 * components that need it; nothing reads settings from global state.
 */
public final class RunConfig {
    public static final String DEFAULT_OUTPUT_DIRECTORY_NAME = "testing-results";
    public final File rootDirectory;
    public final File outputDirectory;
    public final List<String> uids;
    public final Boolean failfastOverride;
    public final int verbosity;
    public final boolean translateNames;
    public final boolean color;

    private RunConfig(File rootDirectory, File outputDirectory, List<String> uids, Boolean failfastOverride, int verbosity, boolean translateNames, boolean color) {
        this.rootDirectory = rootDirectory;
        this.outputDirectory = outputDirectory;
        this.uids = uids;
        this.failfastOverride = failfastOverride;
        this.verbosity = verbosity;
        this.translateNames = translateNames;
        this.color = color;
    }

    /**
     * Returns true iff the run is restricted to a selection of uids.
     *
     * @return whether or not only some of the tree runs.
     */
    public boolean hasSelection() {
        return !this.uids.isEmpty();
    }

    @Override
    public String toString() {
        return this.getClass().getName()
                + " { root: " + this.rootDirectory
                + ", output: " + this.outputDirectory
                + ", uids: " + this.uids
                + ", failfast override: " + this.failfastOverride
                + ", verbosity: " + this.verbosity
                + ", translate names: " + this.translateNames
                + ", color: " + this.color + " }";
    }

    public static final class Builder {
        private File rootDirectory;
        private File outputDirectory;
        private final List<String> uids = new ArrayList<>();
        private Boolean failfastOverride = null;
        private int verbosity = 0;
        private boolean translateNames = true;
        private boolean color = true;

        private Builder() {}

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder rootDirectory(File rootDirectory) {
            this.rootDirectory = rootDirectory;
            return this;
        }

        /**
         * Sets the directory the report artifacts are written to. Defaults to {@link RunConfig#DEFAULT_OUTPUT_DIRECTORY_NAME}
         * inside the root directory.
         */
        public Builder outputDirectory(File outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder uid(String uid) {
            ObjectChecker.assertNonEmpty(uid);
            this.uids.add(uid);
            return this;
        }

        public Builder uids(Collection<String> uids) {
            for (String uid : uids) {
                uid(uid);
            }
            return this;
        }

        /**
         * Forces every suite's failfast flag on or off. Passing null leaves each suite's own flag in charge.
         */
        public Builder failfastOverride(Boolean failfastOverride) {
            this.failfastOverride = failfastOverride;
            return this;
        }

        public Builder verbosity(int verbosity) {
            ObjectChecker.assertNonNegative(verbosity);
            this.verbosity = verbosity;
            return this;
        }

        public Builder translateNames(boolean translateNames) {
            this.translateNames = translateNames;
            return this;
        }

        public Builder color(boolean color) {
            this.color = color;
            return this;
        }

        public RunConfig build() {
            ObjectChecker.assertNonNull(this.rootDirectory);
            File output = (this.outputDirectory == null) ? new File(this.rootDirectory, DEFAULT_OUTPUT_DIRECTORY_NAME) : this.outputDirectory;
            return new RunConfig(this.rootDirectory, output, Collections.unmodifiableList(new ArrayList<>(this.uids)), this.failfastOverride, this.verbosity, this.translateNames, this.color);
        }
    }
}
