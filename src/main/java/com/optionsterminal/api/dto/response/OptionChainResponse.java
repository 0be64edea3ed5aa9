package com.optionsterminal.api.dto.response;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Raw broker rows of one option-chain query, after they have been seeded into the cache. */
@Value
@Builder
public class OptionChainResponse {

    List<Map<String, Object>> data;
    int count;
    long cacheVersion;
}
