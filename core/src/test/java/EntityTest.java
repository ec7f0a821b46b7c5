import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.Key;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EntityTest {

    @Test
    void put_normalizesNumbersAndCollections() {
        Entity entity = new Entity(Key.of("thing", 1))
            .put("count", 3)
            .put("ratio", BigDecimal.valueOf(1.5))
            .put("tags", Set.of("a"));

        assertEquals(3L, entity.get("count"));
        assertEquals(1.5, entity.get("ratio"));
        assertEquals(List.of("a"), entity.get("tags"));
        assertThrows(IllegalArgumentException.class, () -> entity.put("bad", new Object()));
    }

    @Test
    void resolve_flattensListsOnTheWay() {
        Entity entity = new Entity(Key.of("thing", 1))
            .put("authors", List.of(
                Map.of("dest", Map.of("name", "Ada")),
                Map.of("dest", Map.of("name", "Grace"))));

        assertEquals(List.of("Ada", "Grace"), entity.resolve("authors.dest.name"));
        assertTrue(entity.resolve("authors.rel.name").isEmpty());
        assertTrue(entity.resolve("missing").isEmpty());
    }

    @Test
    void copy_isDeep() {
        Entity original = new Entity(Key.of("thing", 1)).put("nested", Map.of("list", List.of(1, 2)));
        Entity copy = original.copy();
        copy.getMap("nested").put("list", List.of());

        assertEquals(List.of(1L, 2L), ((Map<?, ?>) original.get("nested")).get("list"));
        assertNotEquals(original, copy);
    }

    @Test
    void getList_returnsDetachedCopy() {
        Entity entity = new Entity(Key.of("thing", 1)).put("values", List.of("a"));
        entity.getList("values").add("b");
        assertEquals(List.of("a"), entity.get("values"));
    }
}
