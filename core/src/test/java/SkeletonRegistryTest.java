import io.github.flameyossnowy.skeletal.api.bones.RelationalBone;
import io.github.flameyossnowy.skeletal.api.bones.StringBone;
import io.github.flameyossnowy.skeletal.api.exceptions.SchemaException;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonDefinition;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonRegistry;
import io.github.flameyossnowy.skeletal.api.skeleton.SystemProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SkeletonRegistryTest {

    private static SkeletonDefinition tag() {
        return SkeletonDefinition.builder("tag")
            .bone("name", StringBone.builder().build())
            .bone("color", StringBone.builder().build())
            .bone("colorCode", StringBone.builder().build())
            .build();
    }

    @Test
    void definitions_startWithKeyBone() {
        SkeletonDefinition definition = tag();
        assertEquals(List.of("key", "name", "color", "colorCode"), List.copyOf(definition.bones().keySet()));
    }

    @Test
    void invalidNames_areRejected() {
        assertThrows(SchemaException.class, () -> SkeletonDefinition.builder("a/b"));
        assertThrows(SchemaException.class, () -> SkeletonDefinition.builder("tag").bone("a.b", StringBone.builder().build()));
        assertThrows(SchemaException.class, () -> SkeletonDefinition.builder("tag").bone("_hidden", StringBone.builder().build()));
        assertThrows(SchemaException.class, () -> SkeletonDefinition.builder("tag")
            .bone(SystemProperties.DELAYED_UPDATE_TAG, StringBone.builder().build()));
        assertThrows(SchemaException.class, () -> SkeletonDefinition.builder("tag")
            .bone("name", StringBone.builder().build())
            .bone("name", StringBone.builder().build()));
    }

    @Test
    void build_sealsRegistry() {
        SkeletonRegistry.Builder builder = SkeletonRegistry.builder().register(tag());
        assertThrows(SchemaException.class, () -> builder.register(tag()));
        SkeletonRegistry registry = builder.build();

        assertTrue(registry.contains("tag"));
        assertTrue(registry.find("post").isEmpty());
        assertThrows(SchemaException.class, () -> registry.definition("post"));
        assertThrows(SchemaException.class, builder::build);
        assertThrows(SchemaException.class, () -> builder.register(SkeletonDefinition.builder("post").build()));
    }

    @Test
    void relationalBones_bindCacheFieldPatterns() {
        RelationalBone tags = RelationalBone.builder("tag").cacheFields("color*").multiple().build();
        SkeletonRegistry.builder()
            .register(tag())
            .register(SkeletonDefinition.builder("post").bone("tags", tags).build())
            .build();

        assertEquals(List.of("key", "color", "colorCode"), tags.cacheFields());
    }

    @Test
    void relationalBones_failOnUnknownTargets() {
        SkeletonRegistry.Builder unknownKind = SkeletonRegistry.builder()
            .register(SkeletonDefinition.builder("post").bone("tags", RelationalBone.builder("tag").build()).build());
        assertThrows(SchemaException.class, unknownKind::build);

        SkeletonRegistry.Builder unknownField = SkeletonRegistry.builder()
            .register(tag())
            .register(SkeletonDefinition.builder("post")
                .bone("tags", RelationalBone.builder("tag").cacheFields("weight").build())
                .build());
        assertThrows(SchemaException.class, unknownField::build);
    }

    @Test
    void relationalBones_cannotBeShared() {
        RelationalBone shared = RelationalBone.builder("tag").build();
        SkeletonRegistry.Builder builder = SkeletonRegistry.builder()
            .register(tag())
            .register(SkeletonDefinition.builder("post").bone("tag", shared).build())
            .register(SkeletonDefinition.builder("page").bone("tag", shared).build());
        assertThrows(SchemaException.class, builder::build);
    }

    @Test
    void unboundRelationalBone_refusesUse() {
        RelationalBone bone = RelationalBone.builder("tag").build();
        assertThrows(IllegalStateException.class, bone::cacheFields);
    }
}
