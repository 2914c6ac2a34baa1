package arbor.core.runner;

import arbor.core.suite.Uids;
import arbor.core.util.ObjectChecker;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The part of a suite tree that a run visits, given as a set of uids.
 *
 * A node is visited when it is selected itself, when it is an ancestor of a selected node (so that the fixtures of the
 * enclosing scopes behave just like in a full run) or when it lies below a selected node. An empty selection visits
 * everything.
 */
public final class Selection {
    private static final Selection ALL = new Selection(Collections.emptySet());
    private final Set<String> uids;

    private Selection(Set<String> uids) {
        this.uids = uids;
    }

    public static Selection all() {
        return ALL;
    }

    /**
     * Returns a selection of the given uids, or the selection of everything if there are none.
     *
     * @param uids The selected uids.
     * @return the selection.
     */
    public static Selection of(Collection<String> uids) {
        ObjectChecker.assertNonNull(uids);
        if (uids.isEmpty()) {
            return ALL;
        }
        Set<String> copy = new LinkedHashSet<>();
        for (String uid : uids) {
            ObjectChecker.assertNonEmpty(uid);
            copy.add(uid);
        }
        return new Selection(Collections.unmodifiableSet(copy));
    }

    public boolean isAll() {
        return this.uids.isEmpty();
    }

    /**
     * Returns true iff the node with the given uid is visited by a run using this selection.
     *
     * @param uid The node uid.
     * @return whether or not the node is visited.
     */
    public boolean includes(String uid) {
        if (isAll()) {
            return true;
        }
        for (String selected : this.uids) {
            if (Uids.related(selected, uid)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> getUids() {
        return this.uids;
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { " + (isAll() ? "all" : "uids: " + this.uids) + " }";
    }
}
