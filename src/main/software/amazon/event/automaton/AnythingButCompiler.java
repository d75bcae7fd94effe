package software.amazon.event.automaton;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static software.amazon.event.automaton.Constants.BYTE_CEILING;
import static software.amazon.event.automaton.Constants.VALUE_TERMINATOR;

/**
 * Compiles a denylist into a deterministic automaton that accepts every value except the listed ones.
 *
 * The listed values form a byte trie. Any byte that leaves the trie leads to a state that accepts whatever remains,
 * and the value terminator accepts at every trie node except the end of a listed value.
 */
final class AnythingButCompiler {

    private AnythingButCompiler() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    static ByteState compile(Set<String> excluded, ByteState accept) {
        ByteState anyRemainder = new ByteState();
        anyRemainder.putTransitionForRange(0, VALUE_TERMINATOR, anyRemainder);
        anyRemainder.putTransition(VALUE_TERMINATOR, accept);

        TrieNode root = new TrieNode();
        for (String value : excluded) {
            TrieNode node = root;
            for (byte utf8byte : value.getBytes(StandardCharsets.UTF_8)) {
                node = node.children.computeIfAbsent(utf8byte & 0xFF, b -> new TrieNode());
            }
            node.excluded = true;
        }

        List<TrieNode> nodes = new ArrayList<>();
        collect(root, nodes);
        for (TrieNode node : nodes) {
            ByteTransition[] steps = new ByteTransition[BYTE_CEILING];
            for (int i = 0; i < VALUE_TERMINATOR; i++) {
                steps[i] = anyRemainder;
            }
            for (Map.Entry<Integer, TrieNode> child : node.children.entrySet()) {
                steps[child.getKey()] = child.getValue().state;
            }
            steps[VALUE_TERMINATOR] = node.excluded ? null : accept;
            node.state.getMap().pack(steps);
        }
        return root.state;
    }

    private static void collect(TrieNode node, List<TrieNode> nodes) {
        nodes.add(node);
        for (TrieNode child : node.children.values()) {
            collect(child, nodes);
        }
    }

    private static final class TrieNode {
        private final ByteState state = new ByteState();
        private final Map<Integer, TrieNode> children = new HashMap<>();
        private boolean excluded;
    }
}
