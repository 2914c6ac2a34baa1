package arbor.core.fixture.common;

import arbor.core.fixture.Fixture;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * A fixture providing a fresh temporary directory, which is deleted along with its contents on teardown.
 */
public final class TempDirectoryFixture extends Fixture {
    private final String prefix;
    private Path path;

    public TempDirectoryFixture(String name) {
        this(name, false, false);
    }

    public TempDirectoryFixture(String name, boolean lazyInit, boolean buildOnce) {
        super(name, lazyInit, buildOnce);
        this.prefix = "arbor-" + name.replaceAll("[^A-Za-z0-9_-]", "_") + "-";
    }

    @Override
    protected void doSetup() throws IOException {
        this.path = Files.createTempDirectory(this.prefix);
    }

    @Override
    protected void doTeardown() throws IOException {
        if (this.path != null && Files.exists(this.path)) {
            deleteRecursively(this.path);
        }
        this.path = null;
    }

    /**
     * Returns the directory, or null if the fixture is not set up.
     *
     * @return the directory.
     */
    public Path getPath() {
        return this.path;
    }

    private static void deleteRecursively(Path root) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attributes) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path directory, IOException e) throws IOException {
                if (e != null) {
                    throw e;
                }
                Files.delete(directory);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
