package com.cruisetracker.tracker.domain.extraction;

import java.util.List;

/**
 * Builds the fixed chain {@code structured -> dom -> regex} from a selector configuration.
 */
public class StrategyChainFactory {

    private final CandidateValidator validator;

    public StrategyChainFactory(CandidateValidator validator) {
        this.validator = validator;
    }

    public StrategyChainExtractor create(SelectorConfig config) {
        var currency = config.defaultCurrency();
        return new StrategyChainExtractor(List.of(
                new StructuredDataStrategy(config.structured(), currency, validator),
                new DomPathStrategy(config.dom(), currency, validator),
                new RegexTextStrategy(config.regex(), currency, validator)));
    }
}
