package com.optionsterminal.oms;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.optionsterminal.domain.enums.OptionRight;
import com.optionsterminal.domain.enums.OrderAction;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One single-instrument order within a strategy, as submitted by the client.
 *
 * <p>Request bodies may use either camelCase or the broker's snake_case field names.
 * Required fields are checked per leg at submission time (see {@link #missingRequiredFields()})
 * so that one bad leg fails alone instead of rejecting the whole strategy.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OrderLeg {

    static final String DEFAULT_EXCHANGE = "NFO";
    static final String DEFAULT_PRODUCT = "options";
    static final String DEFAULT_ORDER_TYPE = "market";

    @JsonAlias("stock_code")
    private String stockCode;

    @JsonAlias("exchange_code")
    private String exchangeCode;

    private String product;

    private OrderAction action;

    @JsonAlias("order_type")
    private String orderType;

    private Integer quantity;

    private BigDecimal price;

    private BigDecimal stoploss;

    @JsonAlias("expiry_date")
    private String expiryDate;

    @JsonAlias("strike_price")
    private BigDecimal strikePrice;

    private OptionRight right;

    @JsonAlias("user_remark")
    private String userRemark;

    /** Why the leg's JSON could not be bound; null for a leg that bound cleanly. */
    @JsonIgnore
    private String unreadableReason;

    /** Placeholder for a leg whose JSON could not be bound; it fails alone at submission. */
    public static OrderLeg unreadable(String reason) {
        return OrderLeg.builder().unreadableReason(reason).build();
    }

    @JsonIgnore
    public boolean isUnreadable() {
        return unreadableReason != null;
    }

    /** Names of required fields that are absent or invalid; empty when the leg is submittable. */
    public List<String> missingRequiredFields() {
        List<String> missing = new ArrayList<>();
        if (stockCode == null || stockCode.isBlank()) {
            missing.add("stockCode");
        }
        if (action == null) {
            missing.add("action");
        }
        if (quantity == null || quantity <= 0) {
            missing.add("quantity");
        }
        if (expiryDate == null || expiryDate.isBlank()) {
            missing.add("expiryDate");
        }
        if (strikePrice == null || strikePrice.signum() <= 0) {
            missing.add("strikePrice");
        }
        if (right == null) {
            missing.add("right");
        }
        return missing;
    }

    /** Copy with broker defaults filled in for optional fields. */
    public OrderLeg withDefaults(String defaultRemark) {
        return toBuilder()
                .exchangeCode(isBlank(exchangeCode) ? DEFAULT_EXCHANGE : exchangeCode)
                .product(isBlank(product) ? DEFAULT_PRODUCT : product)
                .orderType(isBlank(orderType) ? DEFAULT_ORDER_TYPE : orderType.toLowerCase())
                .price(price == null ? BigDecimal.ZERO : price)
                .stoploss(stoploss == null ? BigDecimal.ZERO : stoploss)
                .userRemark(isBlank(userRemark) ? defaultRemark : userRemark)
                .build();
    }

    /** The closing counterpart of this leg: same contract, opposite action. */
    public OrderLeg squareOff(String remark) {
        return toBuilder()
                .action(action == null ? OrderAction.SELL : action.opposite())
                .userRemark(remark)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
