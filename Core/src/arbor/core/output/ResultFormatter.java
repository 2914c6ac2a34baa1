package arbor.core.output;

import arbor.core.result.TestSuiteResult;

import java.io.IOException;
import java.io.Writer;

/**
 * Renders a finished result tree into some report format.
 *
 * A formatter never modifies the results it is given, and may be invoked any number of times on the same tree.
 */
public interface ResultFormatter {

    /**
     * Writes the rendering of the result tree rooted at the given suite result to the given writer. The writer is
     * flushed but not closed.
     *
     * @param root The root of the result tree.
     * @param writer The destination.
     * @throws IOException If writing fails.
     */
    public void format(TestSuiteResult root, Writer writer) throws IOException;
}
