package uast.nodes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;

/// A read-only, index-addressed view over a node tree.
///
/// Every node reachable from the root occupies one slot, numbered in document order (the root
/// is slot `0`). Structural links are stored as slot numbers rather than references, so parent
/// and sibling navigation is O(1) and the view holds no cycles. {@link #NONE} marks an absent link.
///
/// Object members are laid out in key order, array elements in index order. A consumer such as
/// a path-query adapter can walk the tree without ever touching `Node` internals.
public final class NodeTree {

    public static final int NONE = -1;

    private final Node[] nodes;
    private final String[] keys;
    private final int[] parent;
    private final int[] firstChild;
    private final int[] lastChild;
    private final int[] leftSibling;
    private final int[] rightSibling;
    private final int[] depth;

    private NodeTree(int capacity) {
        nodes = new Node[capacity];
        keys = new String[capacity];
        parent = new int[capacity];
        firstChild = new int[capacity];
        lastChild = new int[capacity];
        leftSibling = new int[capacity];
        rightSibling = new int[capacity];
        depth = new int[capacity];
        Arrays.fill(parent, NONE);
        Arrays.fill(firstChild, NONE);
        Arrays.fill(lastChild, NONE);
        Arrays.fill(leftSibling, NONE);
        Arrays.fill(rightSibling, NONE);
    }

    /// {@return an index over `root` and all of its descendants}
    public static NodeTree of(Node root) {
        Objects.requireNonNull(root, "root must not be null");
        final var tree = new NodeTree(count(root));
        tree.layout(root, null, NONE, 0, 0);
        return tree;
    }

    private static int count(Node node) {
        int n = 1;
        if (node instanceof ArrayNode arr) {
            for (final var element : arr.elements()) n += count(element);
        } else if (node instanceof ObjectNode obj) {
            for (final var value : obj.members().values()) n += count(value);
        }
        return n;
    }

    /// Places `node` at `slot` and its subtree after it; returns the next free slot.
    private int layout(Node node, String key, int parentSlot, int level, int slot) {
        nodes[slot] = node;
        keys[slot] = key;
        parent[slot] = parentSlot;
        depth[slot] = level;
        int next = slot + 1;
        int previous = NONE;
        if (node instanceof ArrayNode arr) {
            final var elements = arr.elements();
            for (int i = 0; i < elements.size(); i++) {
                previous = link(slot, previous, next);
                next = layout(elements.get(i), Integer.toString(i), slot, level + 1, next);
            }
        } else if (node instanceof ObjectNode obj) {
            for (final var entry : new TreeMap<>(obj.members()).entrySet()) {
                previous = link(slot, previous, next);
                next = layout(entry.getValue(), entry.getKey(), slot, level + 1, next);
            }
        }
        return next;
    }

    private int link(int parentSlot, int previous, int child) {
        if (previous == NONE) {
            firstChild[parentSlot] = child;
        } else {
            rightSibling[previous] = child;
            leftSibling[child] = previous;
        }
        lastChild[parentSlot] = child;
        return child;
    }

    public int size() {
        return nodes.length;
    }

    public int root() {
        return 0;
    }

    public Node node(int slot) {
        return nodes[check(slot)];
    }

    /// {@return the member name or array position under which the slot hangs; `null` for the root}
    public String key(int slot) {
        return keys[check(slot)];
    }

    public int parent(int slot) {
        return parent[check(slot)];
    }

    public int firstChild(int slot) {
        return firstChild[check(slot)];
    }

    public int lastChild(int slot) {
        return lastChild[check(slot)];
    }

    public int leftSibling(int slot) {
        return leftSibling[check(slot)];
    }

    public int rightSibling(int slot) {
        return rightSibling[check(slot)];
    }

    public int depth(int slot) {
        return depth[check(slot)];
    }

    /// {@return the slots of the direct children of `slot`, in layout order}
    public List<Integer> children(int slot) {
        final var out = new ArrayList<Integer>();
        for (int child = firstChild(slot); child != NONE; child = rightSibling[child]) {
            out.add(child);
        }
        return out;
    }

    /// {@return the slots of all object nodes whose `@type` equals `type`, in document order}
    public List<Integer> ofType(String type) {
        Objects.requireNonNull(type, "type must not be null");
        final var out = new ArrayList<Integer>();
        for (int i = 0; i < nodes.length; i++) {
            if (nodes[i] instanceof ObjectNode && type.equals(Uast.type(nodes[i]))) {
                out.add(i);
            }
        }
        return out;
    }

    private int check(int slot) {
        if (slot < 0 || slot >= nodes.length) {
            throw new IndexOutOfBoundsException("slot " + slot + " outside [0, " + nodes.length + ")");
        }
        return slot;
    }
}
