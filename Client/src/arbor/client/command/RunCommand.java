package arbor.client.command;

import arbor.client.session.ClientSession;
import arbor.core.config.RunConfig;
import arbor.core.loader.TestLoader;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "run", mixinStandardHelpOptions = true, description = "Run every loaded test, or only the given uids.")
public final class RunCommand implements Callable<Integer> {

    @CommandLine.Mixin
    CommonOptions options = new CommonOptions();

    @CommandLine.Option(names = "--uid", paramLabel = "UID", description = "Only run this suite or test (repeatable).")
    List<String> uids = new ArrayList<>();

    @CommandLine.Option(names = "--failfast", description = "Force failfast on for every suite.")
    boolean failfast;

    @CommandLine.Option(names = "--no-failfast", description = "Force failfast off for every suite.")
    boolean noFailfast;

    RunConfig toConfig() {
        return this.options.toConfigBuilder()
                .uids(this.uids)
                .failfastOverride(failfastOverride())
                .build();
    }

    // Null leaves every suite's own flag in charge.
    private Boolean failfastOverride() {
        if (this.failfast && this.noFailfast) {
            throw new IllegalArgumentException("--failfast and --no-failfast cannot be used together.");
        }
        if (this.failfast) {
            return Boolean.TRUE;
        }
        return this.noFailfast ? Boolean.FALSE : null;
    }

    @Override
    public Integer call() throws Exception {
        RunConfig config = toConfig();
        ClientSession session = ClientSession.forConfig(config, System.out);
        try (TestLoader loader = session.load()) {
            return session.runAndReport(loader.getRoot(), config.uids);
        }
    }
}
