package com.cruisetracker.tracker.domain.deal;

import java.util.Collection;
import java.util.List;

public interface DealEventRepository {

    void save(DealEvent event);

    List<DealEvent> findByIds(Collection<String> ids);
}
