package io.github.cyfko.prereq.jpa;

import io.github.cyfko.prereq.core.exception.PrerequisiteException;
import io.github.cyfko.prereq.core.model.Prerequisites;
import io.github.cyfko.prereq.jpa.json.PrerequisitesJson;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.logging.Logger;

/**
 * Stores {@link Prerequisites} as the JSON tuple form.
 * <p>
 * {@code NULL} means "prerequisites unknown" and is kept distinct from {@code []}, which is
 * {@link Prerequisites#none()}. A stored value that no longer decodes is read back as unknown.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@Converter
public class PrerequisitesConverter implements AttributeConverter<Prerequisites, String> {

    private static final Logger log = Logger.getLogger(PrerequisitesConverter.class.getName());

    @Override
    public String convertToDatabaseColumn(Prerequisites attribute) {
        return attribute == null ? null : PrerequisitesJson.write(attribute);
    }

    @Override
    public Prerequisites convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return PrerequisitesJson.read(dbData);
        } catch (PrerequisiteException e) {
            log.warning(() -> "Stored prerequisites could not be decoded, treating them as unknown: " + e.getMessage());
            return null;
        }
    }
}
