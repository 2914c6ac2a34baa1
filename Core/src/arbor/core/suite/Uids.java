package arbor.core.suite;

import arbor.core.util.ObjectChecker;

/**
 * Builds and compares unique identifiers of nodes in a suite tree.
 *
 * The uid of a node is the path of names from the root suite down to the node, joined by {@link Uids#SEPARATOR}.
 */
public final class Uids {
    public static final String SEPARATOR = "::";

    private Uids() {}

    /**
     * Returns the uid of the child with the given name under the node with the given uid.
     *
     * @param parentUid The uid of the parent.
     * @param childName The name of the child.
     * @return the child uid.
     */
    public static String child(String parentUid, String childName) {
        ObjectChecker.assertNonNull(parentUid, childName);
        return parentUid.isEmpty() ? childName : parentUid + SEPARATOR + childName;
    }

    /**
     * Returns true iff the node with uid {@code ancestor} is a proper ancestor of the node with uid {@code uid}.
     *
     * @param ancestor The candidate ancestor uid.
     * @param uid The candidate descendant uid.
     * @return whether or not ancestor is an ancestor of uid.
     */
    public static boolean isAncestor(String ancestor, String uid) {
        ObjectChecker.assertNonNull(ancestor, uid);
        return uid.startsWith(ancestor + SEPARATOR);
    }

    /**
     * Returns true iff the two uids lie on a single root-to-leaf path, ie. they are equal or one is an ancestor of the
     * other.
     *
     * @param first A uid.
     * @param second Another uid.
     * @return whether or not the two uids are related.
     */
    public static boolean related(String first, String second) {
        return first.equals(second) || isAncestor(first, second) || isAncestor(second, first);
    }
}
