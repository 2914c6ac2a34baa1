package arbor.client.command;

import arbor.client.ExitCodes;
import arbor.client.session.ClientSession;
import arbor.core.fixture.Fixture;
import arbor.core.loader.TestLoader;
import arbor.core.suite.TestItem;
import arbor.core.type.NodeKind;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "list", mixinStandardHelpOptions = true, description = "List the loaded suites, tests and fixtures without running anything.")
public final class ListCommand implements Callable<Integer> {

    @CommandLine.Mixin
    CommonOptions options = new CommonOptions();

    @CommandLine.Option(names = "--suites", description = "List suite uids.")
    boolean suites;

    @CommandLine.Option(names = "--tests", description = "List test uids.")
    boolean tests;

    @CommandLine.Option(names = "--fixtures", description = "List fixture names.")
    boolean fixtures;

    @Override
    public Integer call() throws Exception {
        ClientSession session = ClientSession.forConfig(this.options.toConfigBuilder().build(), System.out);
        try (TestLoader loader = session.load()) {
            for (String line : listing(loader)) {
                System.out.println(line);
            }
        }
        return ExitCodes.SUCCESS;
    }

    /**
     * Returns the lines to print for the given loaded tree: suites, then tests, then fixtures, each section present only
     * if requested. Requesting nothing lists everything.
     *
     * @param loader The loader holding the tree.
     * @return the lines.
     */
    List<String> listing(TestLoader loader) {
        boolean all = !this.suites && !this.tests && !this.fixtures;
        List<String> lines = new ArrayList<>();
        Map<String, TestItem> index = loader.getRoot().indexByUid();

        if (all || this.suites) {
            lines.add("Suites:");
            addUidsOfKind(index, NodeKind.SUITE, lines);
        }
        if (all || this.tests) {
            lines.add("Tests:");
            addUidsOfKind(index, NodeKind.TEST, lines);
        }
        if (all || this.fixtures) {
            lines.add("Fixtures:");
            for (Fixture fixture : loader.getFixtures()) {
                lines.add("  " + fixture.getName());
            }
        }
        return lines;
    }

    private static void addUidsOfKind(Map<String, TestItem> index, NodeKind kind, List<String> lines) {
        for (Map.Entry<String, TestItem> entry : index.entrySet()) {
            if (entry.getValue().kind() == kind) {
                lines.add("  " + entry.getKey());
            }
        }
    }
}
