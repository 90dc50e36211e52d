package com.cruisetracker.common.kafka;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class KafkaTopics {

    public static final String DEAL_ALERTS = "cruise-deal-alerts";
}
