package arbor.core.runner;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class SelectionTest {

    @Test
    public void testEmptySelectionIncludesEverything() {
        Selection selection = Selection.of(Collections.emptyList());
        Assert.assertTrue(selection.isAll());
        Assert.assertTrue(selection.includes("anything::at::all"));
    }

    @Test
    public void testSelectionIncludesAncestorsAndDescendants() {
        Selection selection = Selection.of(Arrays.asList("root::A", "root::B::b1"));
        Assert.assertTrue(selection.includes("root"));
        Assert.assertTrue(selection.includes("root::A"));
        Assert.assertTrue(selection.includes("root::A::deep::test"));
        Assert.assertTrue(selection.includes("root::B"));
        Assert.assertTrue(selection.includes("root::B::b1"));
        Assert.assertFalse(selection.includes("root::B::b2"));
        Assert.assertFalse(selection.includes("root::AB"));
        Assert.assertFalse(selection.includes("other"));
    }
}
