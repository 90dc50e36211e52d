package com.cruisetracker.tracker.application.config;

import com.cruisetracker.common.retry.RetryPolicy;
import com.cruisetracker.tracker.domain.itinerary.CabinCategory;
import com.cruisetracker.tracker.domain.itinerary.TrackedItinerary;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.time.Period;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tracker")
public record TrackerProperties(
        @NotNull @Valid List<Itinerary> itineraries,
        @NotNull @Valid Fetch fetch,
        @NotNull @Valid Extraction extraction,
        @NotNull @Valid Store store,
        @NotNull @Valid Trend trend,
        @NotNull @Valid Deal deal,
        @NotNull @Valid Notification notification,
        @NotNull @Valid Run run,
        @NotNull @Valid Export export
) {

    public record Itinerary(
            @NotBlank String id,
            @NotNull URI url,
            Map<String, String> headers,
            LocalDate sailDate,
            CabinCategory cabinCategory
    ) {

        public TrackedItinerary toTracked() {
            return TrackedItinerary.builder()
                    .id(id)
                    .url(url)
                    .headers(headers)
                    .sailDate(sailDate)
                    .cabinCategory(cabinCategory)
                    .build();
        }
    }

    public record Fetch(
            @Min(1) int maxInFlight,
            @NotNull Duration minIntervalPerHost,
            @NotNull Duration connectTimeout,
            @NotNull Duration readTimeout,
            @NotBlank String userAgent,
            @NotNull @Valid Retry retry
    ) {}

    public record Extraction(@NotBlank String selectorFile, @NotNull Period sailDateHorizon) {}

    public record Store(@NotNull Duration runGranularity) {}

    public record Trend(@Min(1) int maxObservations, @NotNull Duration maxAge, @Min(2) int minSamples) {}

    public record Deal(
            @NotNull @DecimalMin("0.0") @DecimalMax(value = "1.0", inclusive = false) BigDecimal thresholdRatio,
            @NotNull @DecimalMin("0.0") BigDecimal stddevMultiplier
    ) {}

    public record Notification(
            @NotBlank String channel,
            @NotNull Duration dedupWindow,
            @NotNull @DecimalMin("0.0") BigDecimal scoreMargin,
            @NotNull Duration deliveryTimeout,
            @NotNull @Valid Retry retry
    ) {}

    public record Run(
            @Min(1) int workers,
            @NotNull Duration timeout,
            @NotNull Duration inFlightGrace,
            @DecimalMin("0.0") @DecimalMax("1.0") double structureChangeThreshold,
            @Min(1) int structureChangeMinSamples
    ) {}

    public record Export(@NotBlank String path) {}

    public record Retry(@Min(1) int maxAttempts, @NotNull Duration baseDelay, @NotNull Duration maxDelay, @DecimalMin("1.0") double multiplier) {

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, baseDelay, maxDelay, multiplier);
        }
    }
}
