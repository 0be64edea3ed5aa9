package com.optionsterminal.api.dto.response;

import com.optionsterminal.oms.LegResult;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Per-leg outcome of a strategy; {@code allSucceeded} is false if any leg failed. */
@Value
@Builder
public class StrategyExecutionResponse {

    boolean allSucceeded;
    int legCount;
    int failedCount;
    List<LegResult> results;

    public static StrategyExecutionResponse of(List<LegResult> results) {
        int failed = (int) results.stream().filter(result -> !result.isSuccess()).count();
        return StrategyExecutionResponse.builder()
                .allSucceeded(failed == 0)
                .legCount(results.size())
                .failedCount(failed)
                .results(results)
                .build();
    }
}
