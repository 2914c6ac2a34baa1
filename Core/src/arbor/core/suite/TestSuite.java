package arbor.core.suite;

import arbor.core.exception.CycleException;
import arbor.core.exception.UnreachableException;
import arbor.core.fixture.Fixture;
import arbor.core.type.NodeKind;
import arbor.core.util.ObjectChecker;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An ordered collection of test cases and nested suites, plus the fixtures scoped to everything it contains.
 *
 * The contained nodes always form a tree: {@link TestSuite#addItems(TestItem...)} refuses to add anything that would
 * make a suite contain itself or contain the same node twice.
 *
 * {@link TestSuite#isFailfast()} makes the runner skip the remaining children once one of them fails or errors.
 * {@link TestSuite#isParallelizable()} declares that the children are independent of one another; the runner executes
 * sequentially regardless.
 */
public final class TestSuite extends TestItem {
    private final List<TestItem> items = new ArrayList<>();
    private final boolean failfast;
    private final boolean parallelizable;

    private TestSuite(String name, Collection<Fixture> fixtures, boolean failfast, boolean parallelizable) {
        super(name, fixtures);
        this.failfast = failfast;
        this.parallelizable = parallelizable;
    }

    /**
     * Appends the given items to this suite, in order.
     *
     * @param items The test cases and suites to add.
     * @return this suite.
     * @throws CycleException If any of the items would make the tree cyclic or contain a node twice. In this case none of
     * the items are added.
     */
    public TestSuite addItems(TestItem... items) {
        return addItems(Arrays.asList(items));
    }

    /**
     * Appends the given items to this suite, in order.
     *
     * @param items The test cases and suites to add.
     * @return this suite.
     * @throws CycleException If any of the items would make the tree cyclic or contain a node twice. In this case none of
     * the items are added.
     */
    public TestSuite addItems(Collection<? extends TestItem> items) {
        ObjectChecker.assertNonNull(items);
        for (TestItem item : items) {
            ObjectChecker.assertNonNull(item);
        }

        int sizeBefore = this.items.size();
        this.items.addAll(items);
        try {
            validate();
        } catch (CycleException e) {
            this.items.subList(sizeBefore, this.items.size()).clear();
            throw e;
        }
        return this;
    }

    /**
     * Verifies that this suite is the root of a proper tree.
     *
     * @throws CycleException If a suite contains itself, directly or transitively, or a node is referenced twice.
     */
    public void validate() {
        Map<TestItem, Boolean> seen = new IdentityHashMap<>();
        seen.put(this, Boolean.TRUE);
        validate(this, seen, new ArrayDeque<>(Collections.singleton(this)));
    }

    private static void validate(TestSuite suite, Map<TestItem, Boolean> seen, Deque<TestSuite> path) {
        for (TestItem item : suite.items) {
            if (path.contains(item)) {
                throw new CycleException("suite '" + item.getName() + "' contains itself (via '" + suite.getName() + "')");
            }
            if (seen.put(item, Boolean.TRUE) != null) {
                throw new CycleException("'" + item.getName() + "' is referenced more than once in the tree of '" + path.peekLast().getName() + "'");
            }
            if (item.kind() == NodeKind.SUITE) {
                path.push(item.asSuite());
                validate(item.asSuite(), seen, path);
                path.pop();
            }
        }
    }

    /**
     * Returns the direct children of this suite, in order.
     *
     * @return the children.
     */
    public List<TestItem> getItems() {
        return Collections.unmodifiableList(this.items);
    }

    public int size() {
        return this.items.size();
    }

    public boolean isFailfast() {
        return this.failfast;
    }

    public boolean isParallelizable() {
        return this.parallelizable;
    }

    /**
     * Returns every suite and test contained in this suite, at any depth. A suite always comes before its own children.
     *
     * @return the nodes in pre-order.
     */
    public List<TestItem> iterInorder() {
        List<TestItem> collected = new ArrayList<>();
        collectInorder(this, collected);
        return collected;
    }

    private static void collectInorder(TestSuite suite, List<TestItem> collected) {
        for (TestItem item : suite.items) {
            collected.add(item);
            if (item.kind() == NodeKind.SUITE) {
                collectInorder(item.asSuite(), collected);
            }
        }
    }

    /**
     * Returns every test case contained in this suite, at any depth, in execution order.
     *
     * @return the test cases.
     */
    public List<TestCase> iterLeaves() {
        List<TestCase> leaves = new ArrayList<>();
        for (TestItem item : iterInorder()) {
            if (item.kind() == NodeKind.TEST) {
                leaves.add(item.asTest());
            }
        }
        return leaves;
    }

    /**
     * Returns every fixture reachable from this suite: the fixtures owned by this suite and by every node it contains,
     * together with all the fixtures those require, each listed once in the order first encountered.
     *
     * @return the reachable fixtures.
     */
    public List<Fixture> enumerateFixtures() {
        Set<Fixture> fixtures = new LinkedHashSet<>();
        addWithRequirements(getFixtures().values(), fixtures);
        for (TestItem item : iterInorder()) {
            addWithRequirements(item.getFixtures().values(), fixtures);
        }
        return new ArrayList<>(fixtures);
    }

    private static void addWithRequirements(Collection<Fixture> owned, Set<Fixture> collected) {
        for (Fixture fixture : owned) {
            if (collected.add(fixture)) {
                addWithRequirements(fixture.getRequires(), collected);
            }
        }
    }

    /**
     * Returns every node of the tree rooted at this suite, including this suite, keyed by uid in pre-order. The uid of
     * this suite is its own name. When siblings share a name only the first of them is addressable.
     *
     * @return the nodes by uid.
     */
    public Map<String, TestItem> indexByUid() {
        Map<String, TestItem> index = new LinkedHashMap<>();
        index.put(getName(), this);
        indexChildren(this, getName(), index);
        return index;
    }

    private static void indexChildren(TestSuite suite, String uid, Map<String, TestItem> index) {
        for (TestItem item : suite.items) {
            String childUid = Uids.child(uid, item.getName());
            index.putIfAbsent(childUid, item);
            switch (item.kind()) {
                case SUITE:
                    indexChildren(item.asSuite(), childUid, index);
                    break;
                case TEST:
                    break;
                default:
                    throw new UnreachableException("unknown node kind: " + item.kind());
            }
        }
    }

    /**
     * Returns the node with the given uid in the tree rooted at this suite, or null if there is none.
     *
     * @param uid The uid.
     * @return the node or null.
     */
    public TestItem findByUid(String uid) {
        return indexByUid().get(uid);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SUITE;
    }

    @Override
    public TestSuite asSuite() {
        return this;
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { name: " + getName() + ", contains " + this.items.size() + " item(s), failfast: " + this.failfast + " }";
    }

    public static final class Builder {
        private final String name;
        private final List<Fixture> fixtures = new ArrayList<>();
        private final List<TestItem> items = new ArrayList<>();
        private boolean failfast = true;
        private boolean parallelizable = false;

        private Builder(String name) {
            this.name = name;
        }

        public static Builder newBuilder(String name) {
            return new Builder(name);
        }

        public Builder failfast(boolean failfast) {
            this.failfast = failfast;
            return this;
        }

        public Builder parallelizable(boolean parallelizable) {
            this.parallelizable = parallelizable;
            return this;
        }

        public Builder fixture(Fixture fixture) {
            ObjectChecker.assertNonNull(fixture);
            this.fixtures.add(fixture);
            return this;
        }

        public Builder fixtures(Collection<? extends Fixture> fixtures) {
            for (Fixture fixture : fixtures) {
                fixture(fixture);
            }
            return this;
        }

        public Builder item(TestItem item) {
            ObjectChecker.assertNonNull(item);
            this.items.add(item);
            return this;
        }

        public Builder items(TestItem... items) {
            for (TestItem item : items) {
                item(item);
            }
            return this;
        }

        public TestSuite build() {
            TestSuite suite = new TestSuite(this.name, this.fixtures, this.failfast, this.parallelizable);
            suite.addItems(this.items);
            return suite;
        }
    }
}
