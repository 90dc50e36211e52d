package com.cruisetracker.tracker.domain.extraction;

import java.time.LocalDate;
import java.util.List;

public abstract class AbstractExtractionStrategy implements ExtractionStrategy {

    protected final CandidateValidator validator;
    protected final String defaultCurrency;

    protected AbstractExtractionStrategy(CandidateValidator validator, String defaultCurrency) {
        this.validator = validator;
        this.defaultCurrency = defaultCurrency;
    }

    @Override
    public List<String> validate(CandidateFields candidate, LocalDate referenceDate) {
        return validator.violations(candidate, referenceDate);
    }
}
