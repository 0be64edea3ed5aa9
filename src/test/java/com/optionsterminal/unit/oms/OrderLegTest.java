package com.optionsterminal.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.optionsterminal.api.dto.request.StrategyExecuteRequest;
import com.optionsterminal.domain.enums.OptionRight;
import com.optionsterminal.domain.enums.OrderAction;
import com.optionsterminal.oms.OrderLeg;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OrderLegTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("binds the broker's snake_case field names")
    void bindsSnakeCase() throws Exception {
        String json = """
                {"stock_code":"NIFTY","exchange_code":"NFO","action":"buy","order_type":"limit",
                 "quantity":50,"price":"101.5","expiry_date":"28-Oct-2025","strike_price":"21500",
                 "right":"Call","user_remark":"hedge"}
                """;

        OrderLeg leg = objectMapper.readValue(json, OrderLeg.class);

        assertThat(leg.getStockCode()).isEqualTo("NIFTY");
        assertThat(leg.getAction()).isEqualTo(OrderAction.BUY);
        assertThat(leg.getRight()).isEqualTo(OptionRight.CALL);
        assertThat(leg.getStrikePrice()).isEqualByComparingTo("21500");
        assertThat(leg.getPrice()).isEqualByComparingTo("101.5");
        assertThat(leg.missingRequiredFields()).isEmpty();
    }

    @Test
    @DisplayName("reports every missing required field")
    void reportsMissingFields() {
        OrderLeg leg = OrderLeg.builder().stockCode("NIFTY").quantity(0).build();

        assertThat(leg.missingRequiredFields())
                .containsExactly("action", "quantity", "expiryDate", "strikePrice", "right");
    }

    @Test
    @DisplayName("fills exchange, product, order type, prices and remark defaults")
    void appliesDefaults() {
        OrderLeg leg = OrderLeg.builder()
                .stockCode("NIFTY")
                .action(OrderAction.SELL)
                .quantity(50)
                .orderType("LIMIT")
                .build();

        OrderLeg prepared = leg.withDefaults("OptionsTerminal");

        assertThat(prepared.getExchangeCode()).isEqualTo("NFO");
        assertThat(prepared.getProduct()).isEqualTo("options");
        assertThat(prepared.getOrderType()).isEqualTo("limit");
        assertThat(prepared.getPrice()).isEqualTo(BigDecimal.ZERO);
        assertThat(prepared.getStoploss()).isEqualTo(BigDecimal.ZERO);
        assertThat(prepared.getUserRemark()).isEqualTo("OptionsTerminal");
        assertThat(leg.getExchangeCode()).isNull();
    }

    @Test
    @DisplayName("square-off inverts the action and sets the remark")
    void squareOffInvertsAction() {
        OrderLeg buy = OrderLeg.builder().stockCode("NIFTY").action(OrderAction.BUY).userRemark("entry").build();

        OrderLeg exit = buy.squareOff("SquareOff_OptionsTerminal");

        assertThat(exit.getAction()).isEqualTo(OrderAction.SELL);
        assertThat(exit.getUserRemark()).isEqualTo("SquareOff_OptionsTerminal");
        assertThat(OrderLeg.builder().build().squareOff("x").getAction()).isEqualTo(OrderAction.SELL);
        assertThat(exit.squareOff("again").getAction()).isEqualTo(OrderAction.BUY);
    }

    @Test
    @DisplayName("strategy legs that cannot be bound become unreadable placeholders instead of failing the body")
    void unbindableLegsBecomePlaceholders() throws Exception {
        String json = """
                {"legs": [
                  {"stock_code":"NIFTY","action":"buy","quantity":50,"expiry_date":"28-Oct-2025",
                   "strike_price":21500,"right":"Call"},
                  {"stock_code":"NIFTY","action":"buy","quantity":"fifty","expiry_date":"28-Oct-2025",
                   "strike_price":21500,"right":"Call"},
                  {"stock_code":"NIFTY","action":"sell","quantity":50,"expiry_date":"28-Oct-2025",
                   "strike_price":21500,"right":"Straddle"},
                  "NIFTY 21500 CE",
                  null
                ]}
                """;

        StrategyExecuteRequest request = objectMapper.readValue(json, StrategyExecuteRequest.class);

        assertThat(request.getLegs()).hasSize(5);
        assertThat(request.getLegs().get(0).isUnreadable()).isFalse();
        assertThat(request.getLegs().get(1).getUnreadableReason()).startsWith("Invalid value for quantity");
        assertThat(request.getLegs().get(2).getUnreadableReason())
                .isEqualTo("Invalid value for right: Unknown option right: Straddle");
        assertThat(request.getLegs().get(3).getUnreadableReason()).isEqualTo("Order leg must be a JSON object");
        assertThat(request.getLegs().get(4).getUnreadableReason()).isEqualTo("Order leg is null");
    }
}
