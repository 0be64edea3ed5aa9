package com.optionsterminal.api.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.optionsterminal.domain.enums.OptionRight;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.Data;

/**
 * Replaces the push-feed subscription set with one expiry's strikes. Rights default to
 * both calls and puts.
 */
@Data
public class SubscribeRequest {

    @JsonAlias("stock_code")
    private String stockCode = "NIFTY";

    @JsonAlias("exchange_code")
    private String exchangeCode = "NFO";

    @NotBlank(message = "expiryDate is required")
    @JsonAlias("expiry_date")
    private String expiryDate;

    @NotEmpty(message = "strikes must not be empty")
    private List<Integer> strikes;

    private List<OptionRight> rights;
}
