package com.cruisetracker.tracker.domain.extraction;

import java.math.BigDecimal;

public record ParsedPrice(BigDecimal amount, String currency) {
}
