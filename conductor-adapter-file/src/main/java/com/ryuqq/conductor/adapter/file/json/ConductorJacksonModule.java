package com.ryuqq.conductor.adapter.file.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.KeyDeserializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdScalarSerializer;
import com.ryuqq.conductor.core.cache.CacheKey;
import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.ScopeId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.model.TemplateId;

import java.io.IOException;
import java.util.function.Function;

/**
 * Jackson bindings for the orchestrator's value types.
 *
 * <p>Identifiers are written as plain strings, both as values and as map keys.
 * Event polymorphism comes from {@link RunEventMixin}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConductorJacksonModule extends SimpleModule {

    public ConductorJacksonModule() {
        super("ConductorJacksonModule");
        identifier(RunId.class, RunId::getValue, RunId::of);
        identifier(StageId.class, StageId::getValue, StageId::of);
        identifier(TemplateId.class, TemplateId::getValue, TemplateId::of);
        identifier(ScopeId.class, ScopeId::getValue, ScopeId::of);
        identifier(CacheKey.class, CacheKey::getValue, CacheKey::of);
        setMixInAnnotation(RunEvent.class, RunEventMixin.class);
    }

    private <T> void identifier(Class<T> type, Function<T, String> writer, Function<String, T> reader) {
        addSerializer(type, new IdentifierSerializer<>(type, writer));
        addKeySerializer(type, new IdentifierSerializer<>(type, writer, true));
        addDeserializer(type, new IdentifierDeserializer<>(type, reader));
        addKeyDeserializer(type, new IdentifierKeyDeserializer<>(reader));
    }

    private static final class IdentifierSerializer<T> extends StdScalarSerializer<T> {

        private final transient Function<T, String> writer;
        private final boolean asKey;

        private IdentifierSerializer(Class<T> type, Function<T, String> writer) {
            this(type, writer, false);
        }

        private IdentifierSerializer(Class<T> type, Function<T, String> writer, boolean asKey) {
            super(type);
            this.writer = writer;
            this.asKey = asKey;
        }

        @Override
        public void serialize(T value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (asKey) {
                gen.writeFieldName(writer.apply(value));
            } else {
                gen.writeString(writer.apply(value));
            }
        }
    }

    private static final class IdentifierDeserializer<T> extends StdScalarDeserializer<T> {

        private final Class<T> type;
        private final transient Function<String, T> reader;

        private IdentifierDeserializer(Class<T> type, Function<String, T> reader) {
            super(type);
            this.type = type;
            this.reader = reader;
        }

        @Override
        public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            String text = p.getValueAsString();
            try {
                return reader.apply(text);
            } catch (IllegalArgumentException e) {
                return type.cast(ctxt.handleWeirdStringValue(type, text, "%s", e.getMessage()));
            }
        }
    }

    private static final class IdentifierKeyDeserializer<T> extends KeyDeserializer {

        private final Function<String, T> reader;

        private IdentifierKeyDeserializer(Function<String, T> reader) {
            this.reader = reader;
        }

        @Override
        public Object deserializeKey(String key, DeserializationContext ctxt) throws IOException {
            try {
                return reader.apply(key);
            } catch (IllegalArgumentException e) {
                return ctxt.handleWeirdKey(Object.class, key, "%s", e.getMessage());
            }
        }
    }
}
