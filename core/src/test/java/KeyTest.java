import io.github.flameyossnowy.skeletal.api.store.Key;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeyTest {

    @Test
    void path_roundTripsThroughParse() {
        Key key = Key.of(Key.of("user", 7), "note", "a/b c");
        assertEquals("user:i:7/note:n:a%2Fb+c", key.path());
        Key parsed = Key.parse(key.path());
        assertEquals(key, parsed);
        assertEquals("a/b c", parsed.name());
        assertEquals(Key.of("user", 7), parsed.parent());
    }

    @Test
    void parse_rejectsMalformedPaths() {
        assertThrows(IllegalArgumentException.class, () -> Key.parse(""));
        assertThrows(IllegalArgumentException.class, () -> Key.parse("user:7"));
        assertThrows(IllegalArgumentException.class, () -> Key.parse("user:i:seven"));
        assertThrows(IllegalArgumentException.class, () -> Key.parse("user:x:7"));
    }

    @Test
    void lineage_startsAtRoot() {
        Key root = Key.of("a", 1);
        Key child = Key.of(root, "b", 2);
        Key grandChild = Key.of(child, "c", "x");

        assertEquals(List.of(root, child, grandChild), grandChild.lineage());
        assertEquals(root, grandChild.root());
        assertTrue(root.isAncestorOf(grandChild));
        assertTrue(grandChild.isAncestorOf(grandChild));
        assertFalse(grandChild.isAncestorOf(root));
    }

    @Test
    void incompleteKey_hasNoIdOrName() {
        Key key = Key.incomplete(null, "user");
        assertFalse(key.isComplete());
        assertNull(key.idOrName());
    }

    @Test
    void ordering_groupsChildrenUnderParents() {
        Key first = Key.of("user", 1);
        Key firstChild = Key.of(first, "note", 1);
        Key second = Key.of("user", 2);
        Key named = Key.of("user", "zed");

        List<Key> keys = new ArrayList<>(List.of(named, second, firstChild, first));
        Collections.sort(keys);
        assertEquals(List.of(first, firstChild, second, named), keys);
    }
}
