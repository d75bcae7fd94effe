package software.amazon.event.automaton;

import java.util.ArrayList;
import java.util.List;

import static software.amazon.event.automaton.Constants.BYTE_CEILING;

/**
 * Builds a byte trie from a root state to a shared next state, one UTF-8 encoding at a time. Tables are kept unpacked
 * until {@link #build()}, so inserting many code points does not repack a table per byte.
 *
 * No UTF-8 encoding is a prefix of another, so every path ends exactly at its last byte.
 */
final class Utf8PathBuilder {

    private final Node root;
    private final ByteState next;
    private final List<Node> nodes = new ArrayList<>();

    Utf8PathBuilder(ByteState root, ByteState next) {
        this.root = new Node(root);
        this.next = next;
        nodes.add(this.root);
    }

    void addCodePoint(int codePoint) {
        byte[] buffer = new byte[4];
        int length = encode(codePoint, buffer);
        addPath(buffer, length);
    }

    void addPath(byte[] utf8bytes) {
        addPath(utf8bytes, utf8bytes.length);
    }

    private void addPath(byte[] utf8bytes, int length) {
        Node node = root;
        for (int i = 0; i < length - 1; i++) {
            int utf8byte = utf8bytes[i] & 0xFF;
            if (node.children == null) {
                node.children = new Node[BYTE_CEILING];
            }
            Node child = node.children[utf8byte];
            if (child == null) {
                child = new Node(new ByteState());
                node.children[utf8byte] = child;
                node.steps[utf8byte] = child.state;
                nodes.add(child);
            }
            node = child;
        }
        node.steps[utf8bytes[length - 1] & 0xFF] = next;
    }

    /**
     * Write the collected paths into the states' tables.
     *
     * @return The root state.
     */
    ByteState build() {
        for (Node node : nodes) {
            node.state.getMap().pack(node.steps);
        }
        return root.state;
    }

    /**
     * Encode a code point as UTF-8.
     *
     * @return The number of bytes written.
     */
    static int encode(int codePoint, byte[] buffer) {
        if (codePoint < 0x80) {
            buffer[0] = (byte) codePoint;
            return 1;
        }
        if (codePoint < 0x800) {
            buffer[0] = (byte) (0xC0 | (codePoint >> 6));
            buffer[1] = (byte) (0x80 | (codePoint & 0x3F));
            return 2;
        }
        if (codePoint < 0x10000) {
            buffer[0] = (byte) (0xE0 | (codePoint >> 12));
            buffer[1] = (byte) (0x80 | ((codePoint >> 6) & 0x3F));
            buffer[2] = (byte) (0x80 | (codePoint & 0x3F));
            return 3;
        }
        buffer[0] = (byte) (0xF0 | (codePoint >> 18));
        buffer[1] = (byte) (0x80 | ((codePoint >> 12) & 0x3F));
        buffer[2] = (byte) (0x80 | ((codePoint >> 6) & 0x3F));
        buffer[3] = (byte) (0x80 | (codePoint & 0x3F));
        return 4;
    }

    private static final class Node {
        private final ByteState state;
        private final ByteTransition[] steps;
        private Node[] children;

        Node(ByteState state) {
            this.state = state;
            this.steps = state.getMap().unpack();
        }
    }
}
