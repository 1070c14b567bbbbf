package io.github.cyfko.prereq.jpa.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.prereq.core.exception.PrerequisiteException;
import io.github.cyfko.prereq.core.exception.PrerequisiteFormatException;
import io.github.cyfko.prereq.core.model.Prerequisites;

/**
 * JSON text of the tuple form, shared by the storage converter and dataset exports.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PrerequisitesJson {

    private static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new PrerequisitesModule());

    private PrerequisitesJson() {}

    public static String write(Prerequisites prerequisites) {
        try {
            return MAPPER.writeValueAsString(prerequisites);
        } catch (JsonProcessingException e) {
            throw new PrerequisiteFormatException("Could not write prerequisites as JSON", e);
        }
    }

    /**
     * @param json tuple form as JSON text
     * @return the decoded prerequisites
     * @throws PrerequisiteException if the text is not JSON or not a valid tuple
     */
    public static Prerequisites read(String json) {
        try {
            return MAPPER.readValue(json, Prerequisites.class);
        } catch (JsonProcessingException e) {
            if (e.getCause() instanceof PrerequisiteException cause) {
                throw cause;
            }
            throw new PrerequisiteFormatException("Stored prerequisites are not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
