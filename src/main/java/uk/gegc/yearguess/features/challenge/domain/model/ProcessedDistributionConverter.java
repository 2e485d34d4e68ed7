package uk.gegc.yearguess.features.challenge.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.springframework.util.StringUtils;

@Converter
public class ProcessedDistributionConverter implements AttributeConverter<ProcessedDistribution, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().findAndRegisterModules();

    @Override
    public String convertToDatabaseColumn(ProcessedDistribution attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize processed distribution", e);
        }
    }

    @Override
    public ProcessedDistribution convertToEntityAttribute(String dbData) {
        if (!StringUtils.hasText(dbData)) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(dbData, ProcessedDistribution.class);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to deserialize processed distribution", e);
        }
    }
}
