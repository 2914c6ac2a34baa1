package arbor.core.util;

import arbor.core.helper.AssertHelper;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.util.Collections;

public class ProcessRunnerTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testExitCodeIsReturned() throws Exception {
        Assert.assertEquals(0, ProcessRunner.logCall(null, "sh", "-c", "echo out; echo err 1>&2"));
        Assert.assertEquals(3, ProcessRunner.logCall(null, "sh", "-c", "exit 3"));
    }

    @Test
    public void testRunsInTheGivenDirectory() throws Exception {
        File directory = this.folder.newFolder("work");
        Assert.assertEquals(0, ProcessRunner.logCall(directory, "sh", "-c", "touch marker"));
        Assert.assertTrue(new File(directory, "marker").isFile());
    }

    @Test
    public void testUnknownProgram() {
        AssertHelper.assertThrows(IOException.class, () -> ProcessRunner.logCall(null, "arbor-no-such-program"));
    }

    @Test
    public void testEmptyCommand() {
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> ProcessRunner.logCall(Collections.emptyList(), null));
    }
}
