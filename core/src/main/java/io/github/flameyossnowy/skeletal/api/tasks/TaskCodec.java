package io.github.flameyossnowy.skeletal.api.tasks;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.flameyossnowy.skeletal.api.exceptions.PermanentTaskException;
import io.github.flameyossnowy.skeletal.api.store.Key;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;

/**
 * JSON encoding of tasks for durable queues: {@code {"type": "UPDATE_RELATIONS", "payload": {...}}}.
 * Keys are written as their path string.
 */
public final class TaskCodec {
    private final ObjectMapper mapper;

    public TaskCodec() {
        this(new ObjectMapper());
    }

    public TaskCodec(@NotNull ObjectMapper mapper) {
        this.mapper = mapper.copy()
            .registerModule(new KeyModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public @NotNull String encode(@NotNull RelationTask task) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", task.type().name());
        root.set("payload", mapper.valueToTree(task));
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode task " + task, e);
        }
    }

    /**
     * @throws PermanentTaskException if {@code json} is not a valid task; it never will be
     */
    public @NotNull RelationTask decode(@NotNull String json) {
        try {
            JsonNode root = mapper.readTree(json);
            JsonNode type = root.get("type");
            JsonNode payload = root.get("payload");
            if (type == null || payload == null) {
                throw new PermanentTaskException("Task without type or payload: " + json);
            }
            TaskType taskType = TaskType.valueOf(type.asText());
            return mapper.treeToValue(payload, taskType.taskClass());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PermanentTaskException("Malformed task: " + json, e);
        }
    }

    static final class KeyModule extends SimpleModule {
        KeyModule() {
            super("SkeletalKeyModule");
            addSerializer(Key.class, new JsonSerializer<>() {
                @Override
                public void serialize(Key value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
                    gen.writeString(value.path());
                }
            });
            addDeserializer(Key.class, new JsonDeserializer<>() {
                @Override
                public Key deserialize(JsonParser parser, DeserializationContext context) throws IOException {
                    return Key.parse(parser.getValueAsString());
                }
            });
        }
    }
}
