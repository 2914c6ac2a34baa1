package arbor.client.command;

import arbor.core.config.RunConfig;
import org.junit.Assert;
import org.junit.Test;
import picocli.CommandLine;

import java.io.File;
import java.util.Arrays;

public class RunCommandTest {

    @Test
    public void testDefaults() {
        RunConfig config = parse("tests").toConfig();
        Assert.assertEquals(new File("tests"), config.rootDirectory);
        Assert.assertEquals(new File("tests", RunConfig.DEFAULT_OUTPUT_DIRECTORY_NAME), config.outputDirectory);
        Assert.assertFalse(config.hasSelection());
        Assert.assertNull(config.failfastOverride);
        Assert.assertEquals(0, config.verbosity);
        Assert.assertTrue(config.color);
    }

    @Test
    public void testAllOptions() {
        RunConfig config = parse("-vv", "--no-color", "-o", "out", "--uid", "a::b", "--uid", "c", "--no-failfast", "tests").toConfig();
        Assert.assertEquals(new File("out"), config.outputDirectory);
        Assert.assertEquals(Arrays.asList("a::b", "c"), config.uids);
        Assert.assertEquals(Boolean.FALSE, config.failfastOverride);
        Assert.assertEquals(2, config.verbosity);
        Assert.assertFalse(config.color);
    }

    @Test
    public void testFailfastOn() {
        Assert.assertEquals(Boolean.TRUE, parse("--failfast", "tests").toConfig().failfastOverride);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConflictingFailfastFlags() {
        parse("--failfast", "--no-failfast", "tests").toConfig();
    }

    @Test(expected = CommandLine.MissingParameterException.class)
    public void testDirectoryIsRequired() {
        parse("--failfast");
    }

    private static RunCommand parse(String... args) {
        RunCommand command = new RunCommand();
        new CommandLine(command).parseArgs(args);
        return command;
    }
}
