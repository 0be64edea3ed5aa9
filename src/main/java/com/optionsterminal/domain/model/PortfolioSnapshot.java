package com.optionsterminal.domain.model;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Open positions and holdings, as returned by the broker. */
@Value
@Builder
public class PortfolioSnapshot {

    List<Map<String, Object>> positions;
    List<Map<String, Object>> holdings;
}
