package arbor.core.fixture;

import arbor.core.exception.FixtureUnavailableException;
import arbor.core.helper.AssertHelper;
import arbor.core.helper.RecordingFixture;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class FixtureContextTest {
    private final List<String> events = new ArrayList<>();

    @Test
    public void testShadowingLeavesParentUntouched() {
        RecordingFixture outer = new RecordingFixture("db", this.events);
        RecordingFixture inner = new RecordingFixture("db", this.events);
        FixtureContext parent = FixtureContext.empty().withFixtures(Collections.singletonMap("db", outer));
        FixtureContext child = parent.withFixtures(Collections.singletonMap("db", inner));

        Assert.assertSame(inner, child.get("db"));
        Assert.assertSame(outer, parent.get("db"));
        Assert.assertEquals(1, parent.size());
        Assert.assertEquals(1, child.size());
    }

    @Test
    public void testSiblingsDoNotSeeEachOther() {
        FixtureContext parent = FixtureContext.empty();
        FixtureContext left = parent.withFixtures(Collections.singletonMap("left", new RecordingFixture("left", this.events)));
        FixtureContext right = parent.withFixtures(Collections.singletonMap("right", new RecordingFixture("right", this.events)));

        Assert.assertTrue(left.contains("left"));
        Assert.assertFalse(left.contains("right"));
        Assert.assertFalse(right.contains("left"));
        Assert.assertEquals(0, parent.size());
    }

    @Test
    public void testGetActivatesOnlyOnce() {
        RecordingFixture lazy = new RecordingFixture("lazy", this.events, true, false);
        List<Fixture> activated = new ArrayList<>();
        FixtureContext context = FixtureContext.withActivator(fixture -> {
            activated.add(fixture);
            return fixture.setup();
        }).withFixtures(Collections.singletonMap("lazy", lazy));

        Assert.assertEquals(0, lazy.getSetups());
        context.get("lazy");
        context.get("lazy");
        Assert.assertEquals(1, lazy.getSetups());
        Assert.assertEquals(Collections.singletonList(lazy), activated);
    }

    @Test
    public void testPeekDoesNotActivate() {
        RecordingFixture lazy = new RecordingFixture("lazy", this.events, true, false);
        FixtureContext context = FixtureContext.empty().withFixtures(Collections.singletonMap("lazy", lazy));
        Assert.assertSame(lazy, context.peek("lazy"));
        Assert.assertEquals(0, lazy.getSetups());
        Assert.assertNull(context.peek("missing"));
    }

    @Test
    public void testFailedFixtureIsUnavailable() {
        RecordingFixture broken = new RecordingFixture("broken", this.events).failingSetup();
        FixtureContext context = FixtureContext.empty().withFixtures(Collections.singletonMap("broken", broken));

        FixtureUnavailableException e = AssertHelper.assertThrows(FixtureUnavailableException.class, () -> context.get("broken"));
        Assert.assertEquals("broken", e.getFixtureName());
        Assert.assertSame(broken.getFailure(), e.getCause());
    }

    @Test
    public void testUnknownAndMistypedFixtures() {
        Map<String, Fixture> fixtures = new LinkedHashMap<>();
        fixtures.put("plain", new RecordingFixture("plain", this.events));
        FixtureContext context = FixtureContext.empty().withFixtures(fixtures);

        AssertHelper.assertThrows(IllegalArgumentException.class, () -> context.get("missing"));
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> context.get("plain", FixtureSubtype.class));
        Assert.assertNotNull(context.get("plain", RecordingFixture.class));
    }

    private static final class FixtureSubtype extends Fixture {
        private FixtureSubtype() {
            super("subtype");
        }

        @Override
        protected void doSetup() {
        }
    }
}
