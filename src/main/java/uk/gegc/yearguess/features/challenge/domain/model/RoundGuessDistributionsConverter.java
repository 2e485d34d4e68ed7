package uk.gegc.yearguess.features.challenge.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Stores the per-round distributions as one JSON array. A missing column reads as no rounds.
 */
@Converter
public class RoundGuessDistributionsConverter implements AttributeConverter<List<RoundGuessDistribution>, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().findAndRegisterModules();
    private static final JavaType ROUNDS_TYPE =
            OBJECT_MAPPER.getTypeFactory().constructCollectionType(List.class, RoundGuessDistribution.class);

    @Override
    public String convertToDatabaseColumn(List<RoundGuessDistribution> rounds) {
        if (rounds == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(rounds);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize round guess distributions", e);
        }
    }

    @Override
    public List<RoundGuessDistribution> convertToEntityAttribute(String dbData) {
        if (!StringUtils.hasText(dbData)) {
            return List.of();
        }
        try {
            List<RoundGuessDistribution> rounds = OBJECT_MAPPER.readValue(dbData, ROUNDS_TYPE);
            return rounds == null ? List.of() : List.copyOf(rounds);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to deserialize round guess distributions", e);
        }
    }
}
