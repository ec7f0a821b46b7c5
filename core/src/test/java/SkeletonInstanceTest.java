import io.github.flameyossnowy.skeletal.api.bones.BooleanBone;
import io.github.flameyossnowy.skeletal.api.bones.NumericBone;
import io.github.flameyossnowy.skeletal.api.bones.ReadFromClientError;
import io.github.flameyossnowy.skeletal.api.bones.ReadFromClientErrorSeverity;
import io.github.flameyossnowy.skeletal.api.bones.StringBone;
import io.github.flameyossnowy.skeletal.api.exceptions.EntityNotFoundException;
import io.github.flameyossnowy.skeletal.api.exceptions.ReadFromClientException;
import io.github.flameyossnowy.skeletal.api.pipeline.WriteOptions;
import io.github.flameyossnowy.skeletal.api.result.TransactionResult;
import io.github.flameyossnowy.skeletal.api.skeleton.DatabaseAdapter;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonDefinition;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import io.github.flameyossnowy.skeletal.api.skeleton.SystemProperties;
import io.github.flameyossnowy.skeletal.api.store.Key;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class SkeletonInstanceTest {
    private DatabaseAdapter adapter;
    private TestRuntime test;

    @BeforeEach
    void setUp() {
        adapter = mock(DatabaseAdapter.class);
        test = new TestRuntime(
            SkeletonDefinition.builder("product")
                .bone("name", StringBone.builder().required().maxLength(10).build())
                .bone("title", StringBone.builder().languages("en", "de").build())
                .bone("stock", NumericBone.builder().range(0, 1000).build())
                .bone("price", NumericBone.builder().precision(2).build())
                .bone("active", BooleanBone.builder().defaultValue(true).build())
                .adapter(adapter)
                .build()
        );
    }

    private SkeletonInstance product() {
        return test.runtime.newSkeleton("product");
    }

    @Test
    void unwrittenRecord_readsDefaults() {
        SkeletonInstance skel = product();
        assertNull(skel.key());
        assertEquals(true, skel.get("active"));
        assertEquals(Map.of("en", "", "de", ""), nullsAsEmpty(skel.get("title")));
        assertThrows(IllegalArgumentException.class, () -> skel.get("nope"));
    }

    private static Map<?, ?> nullsAsEmpty(Object value) {
        Map<Object, Object> copy = new HashMap<>();
        ((Map<?, ?>) value).forEach((k, v) -> copy.put(k, v == null ? "" : v));
        return copy;
    }

    @Test
    void fromClient_acceptsCompleteData() {
        SkeletonInstance skel = product();
        boolean complete = skel.fromClient(Map.of(
            "name", " Lamp ",
            "title", Map.of("en", "Lamp", "de", "Lampe"),
            "stock", "12",
            "price", "19,999",
            "active", "no"));

        assertTrue(complete, () -> skel.errors().toString());
        assertEquals("Lamp", skel.get("name"));
        assertEquals(12L, skel.get("stock"));
        assertEquals(20.0, skel.get("price"));
        assertEquals(false, skel.get("active"));
        assertEquals("Lampe", ((Map<?, ?>) skel.get("title")).get("de"));
    }

    @Test
    void writeFromClient_rejectsIncompleteData() {
        SkeletonInstance skel = product();

        TransactionResult<Key> result = skel.writeFromClient(Map.of("stock", "3"), false);

        assertTrue(result.isErrorOf(ReadFromClientException.class));
        ReadFromClientException error = (ReadFromClientException) result.getError().orElseThrow();
        assertTrue(error.getErrors().stream().anyMatch(e -> e.fieldPath().equals(List.of("name"))));
        assertEquals(0, test.store.count("product"));
        verify(adapter, never()).write(any(), anyBoolean(), anyList());
    }

    @Test
    void writeFromClient_writesCompleteData() {
        SkeletonInstance skel = product();

        Key key = skel.writeFromClient(Map.of("name", "Desk", "stock", "3"), false).orElseThrow();

        assertEquals(3L, test.store.get(key).get("stock"));
    }

    @Test
    void fromClient_reportsInvalidValues() {
        SkeletonInstance skel = product();
        boolean complete = skel.fromClient(Map.of("name", "A name that is too long", "stock", 5000));

        assertFalse(complete);
        List<ReadFromClientError> errors = skel.errors();
        assertTrue(errors.stream().anyMatch(e -> e.fieldPath().equals(List.of("name"))
            && e.severity() == ReadFromClientErrorSeverity.INVALID));
        assertTrue(errors.stream().anyMatch(e -> e.fieldPath().equals(List.of("stock"))));
    }

    @Test
    void fromClient_missingRequiredFieldIsIncomplete() {
        SkeletonInstance skel = product();
        assertFalse(skel.fromClient(Map.of("stock", 1)));
        assertTrue(skel.errors().stream().anyMatch(e -> e.fieldPath().equals(List.of("name"))
            && e.severity() == ReadFromClientErrorSeverity.NOT_SET));
    }

    @Test
    void fromClient_amendKeepsUnsubmittedFields() {
        Key key = product().set("name", "Lamp").set("stock", 3).write().orElseThrow();
        SkeletonInstance skel = test.runtime.read("product", key).orElseThrow();

        assertTrue(skel.fromClient(Map.of("stock", 4), true));
        skel.write().orElseThrow();

        SkeletonInstance reread = test.runtime.read("product", key).orElseThrow();
        assertEquals("Lamp", reread.get("name"));
        assertEquals(4L, reread.get("stock"));
    }

    @Test
    void emptySubmission_isIncompleteWithoutErrors() {
        SkeletonInstance skel = product();
        assertFalse(skel.fromClient(Map.of()));
        assertTrue(skel.errors().isEmpty());
    }

    @Test
    void localizedBone_requiresLanguage() {
        SkeletonInstance skel = product();
        assertThrows(IllegalArgumentException.class, () -> skel.setBoneValue("title", "Lamp", false, null));
        assertTrue(skel.setBoneValue("title", "Lamp", false, "en"));
        assertEquals("Lamp", ((Map<?, ?>) skel.get("title")).get("en"));
        assertThrows(IllegalArgumentException.class, () -> skel.setBoneValue("name", "x", false, "en"));
    }

    @Test
    void set_rejectsInvalidValue() {
        SkeletonInstance skel = product();
        assertThrows(IllegalArgumentException.class, () -> skel.set("stock", -1));
        assertThrows(IllegalArgumentException.class, () -> skel.set("stock", "many"));
    }

    @Test
    void write_notifiesAdapters() {
        SkeletonInstance skel = product().set("name", "Lamp");
        Key key = skel.write().orElseThrow();

        verify(adapter).prewrite(eq(skel), eq(true), anyList());
        verify(adapter).write(eq(skel), eq(true), anyList());
        assertTrue(test.store.get(key).getLong(SystemProperties.DELAYED_UPDATE_TAG) > 0);

        skel.delete().orElseThrow();
        verify(adapter).delete(skel);
    }

    @Test
    void failingPrewrite_abortsWrite() {
        doThrow(new IllegalStateException("rejected")).when(adapter).prewrite(any(), anyBoolean(), anyList());
        SkeletonInstance skel = product().set("name", "Lamp");

        assertThrows(IllegalStateException.class, skel::write);
        assertEquals(0, test.store.count("product"));
        verify(adapter, never()).write(any(), anyBoolean(), anyList());
    }

    @Test
    void writeUnderExplicitKey() {
        Key key = Key.of("product", "lamp");
        product().set("name", "Lamp").write(WriteOptions.defaults().withKey(key)).orElseThrow();
        assertEquals("Lamp", test.runtime.read("product", key).orElseThrow().get("name"));

        SkeletonInstance skel = product();
        assertThrows(IllegalArgumentException.class, () -> skel.write(WriteOptions.defaults().withKey(Key.of("other", 1))));
        assertThrows(IllegalArgumentException.class, () -> skel.read(Key.of("other", 1)));
    }

    @Test
    void patch_incrementsAndAssigns() {
        Key key = product().set("name", "Lamp").set("stock", 10).set("price", 2.5).write().orElseThrow();
        SkeletonInstance skel = test.runtime.read("product", key).orElseThrow();

        TransactionResult<SkeletonInstance> result = skel.patch(Map.of("+stock", 5, "-price", "0.25", "name", "Desk lamp"), 3);
        assertTrue(result.isSuccess());

        SkeletonInstance reread = test.runtime.read("product", key).orElseThrow();
        assertEquals(15L, reread.get("stock"));
        assertEquals(2.25, reread.get("price"));
        assertEquals("Desk lamp", reread.get("name"));
        assertEquals(15L, skel.get("stock"));
    }

    @Test
    void patch_rejectsNonNumericIncrement() {
        Key key = product().set("name", "Lamp").write().orElseThrow();
        SkeletonInstance skel = test.runtime.read("product", key).orElseThrow();
        assertThrows(IllegalArgumentException.class, () -> skel.patch(Map.of("+name", 1), 0));
    }

    @Test
    void patch_ofDeletedRecordFails() {
        Key key = product().set("name", "Lamp").write().orElseThrow();
        SkeletonInstance skel = test.runtime.read("product", key).orElseThrow();
        test.store.delete(key);

        assertTrue(skel.patch(Map.of("+stock", 1), 1).isErrorOf(EntityNotFoundException.class));
    }

    @Test
    void delete_ofMissingRecordFails() {
        Key key = product().set("name", "Lamp").write().orElseThrow();
        SkeletonInstance skel = test.runtime.read("product", key).orElseThrow();
        test.store.delete(key);

        assertTrue(skel.delete().isErrorOf(EntityNotFoundException.class));
        assertThrows(IllegalStateException.class, () -> product().delete());
    }
}
