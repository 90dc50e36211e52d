package com.cruisetracker.tracker.domain.notification;

import java.math.BigDecimal;
import java.time.Duration;

public record DispatchPolicy(Duration dedupWindow, BigDecimal scoreMargin) {
}
