package uk.gegc.yearguess.features.challenge.domain.model;

public record YearCurvePoint(int guessedYear, double density) {
}
