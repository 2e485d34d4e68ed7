package uk.gegc.yearguess.features.challenge.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RoundGuessDistributionsConverter Tests")
class RoundGuessDistributionsConverterTest {

    private final RoundGuessDistributionsConverter converter = new RoundGuessDistributionsConverter();

    @Test
    @DisplayName("convertToEntityAttribute: when the column is empty then reads as no rounds")
    void convertToEntityAttribute_whenEmpty_thenNoRounds() {
        assertThat(converter.convertToEntityAttribute(null)).isEmpty();
        assertThat(converter.convertToEntityAttribute("  ")).isEmpty();
    }

    @Test
    @DisplayName("convertToEntityAttribute: reads stored rounds into an unmodifiable list")
    void convertToEntityAttribute_readsRounds() {
        // Given
        String json = """
                [{"roundIndex":2,"curvePoints":[{"guessedYear":1969,"density":1.0}],
                  "totalGuesses":3,"minGuess":1969,"maxGuess":1969,"medianGuess":1969.0}]
                """;

        // When
        List<RoundGuessDistribution> rounds = converter.convertToEntityAttribute(json);

        // Then
        assertThat(rounds).hasSize(1);
        assertThat(rounds.get(0).roundIndex()).isEqualTo(2);
        assertThat(rounds.get(0).totalGuesses()).isEqualTo(3L);
        assertThatThrownBy(() -> rounds.add(rounds.get(0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("convertToEntityAttribute: when the column is not valid JSON then throws IllegalArgumentException")
    void convertToEntityAttribute_whenMalformed_thenThrows() {
        assertThatThrownBy(() -> converter.convertToEntityAttribute("{not json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("round guess distributions");
    }
}
