package io.github.cyfko.prereq.jpa.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.github.cyfko.prereq.core.codec.TupleCodec;
import io.github.cyfko.prereq.core.exception.PrerequisiteException;
import io.github.cyfko.prereq.core.model.Prerequisites;

import java.io.IOException;

/**
 * Jackson module binding {@link Prerequisites} to its tuple form.
 *
 * <pre>{@code
 * ObjectMapper mapper = new ObjectMapper().registerModule(new PrerequisitesModule());
 * mapper.writeValueAsString(prereqs);   // ["and",["or",{"id":"CS 1331"},{"id":"CS 1301"}],{"id":"MATH 1554"}]
 * mapper.readValue("[]", Prerequisites.class);   // Prerequisites.none()
 * }</pre>
 * <p>
 * A tuple that cannot be decoded surfaces as a {@link JsonMappingException} whose cause is the
 * underlying {@link PrerequisiteException}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PrerequisitesModule extends SimpleModule {

    public PrerequisitesModule() {
        super("PrerequisitesModule", new Version(1, 0, 0, null, "io.github.cyfko", "prereq-jpa"));
        addSerializer(Prerequisites.class, new PrerequisitesSerializer());
        addDeserializer(Prerequisites.class, new PrerequisitesDeserializer());
    }

    static class PrerequisitesSerializer extends StdSerializer<Prerequisites> {

        PrerequisitesSerializer() {
            super(Prerequisites.class);
        }

        @Override
        public void serialize(Prerequisites value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            provider.defaultSerializeValue(TupleCodec.encode(value), gen);
        }
    }

    static class PrerequisitesDeserializer extends StdDeserializer<Prerequisites> {

        PrerequisitesDeserializer() {
            super(Prerequisites.class);
        }

        @Override
        public Prerequisites deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            Object tuple = p.readValueAs(Object.class);
            try {
                return TupleCodec.decode(tuple);
            } catch (PrerequisiteException e) {
                throw JsonMappingException.from(p, "Invalid prerequisite tuple: " + e.getMessage(), e);
            }
        }
    }
}
