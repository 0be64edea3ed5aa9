package com.optionsterminal.broker;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The broker's response envelope: {@code {Status, Success, Error}}.
 *
 * <p>{@code Success} is either an object or a list of objects depending on the call;
 * {@link #successRows()} and {@link #successObject()} normalise both shapes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BrokerResponse {

    public static final int STATUS_OK = 200;

    @JsonProperty("Status")
    private Integer status;

    @JsonProperty("Success")
    private Object success;

    @JsonProperty("Error")
    private String error;

    public static BrokerResponse ok(Object success) {
        return new BrokerResponse(STATUS_OK, success, null);
    }

    public static BrokerResponse error(int status, String error) {
        return new BrokerResponse(status, null, error);
    }

    @JsonIgnore
    public boolean isOk() {
        return status != null && status == STATUS_OK;
    }

    /** The success payload as a list of rows; a single object becomes a one-element list. */
    @JsonIgnore
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> successRows() {
        if (success instanceof List<?> list) {
            return list.stream()
                    .filter(Map.class::isInstance)
                    .map(row -> (Map<String, Object>) row)
                    .toList();
        }
        if (success instanceof Map<?, ?> map) {
            return List.of((Map<String, Object>) map);
        }
        return List.of();
    }

    /** The success payload as a single object; a list yields its first element. */
    @JsonIgnore
    @SuppressWarnings("unchecked")
    public Map<String, Object> successObject() {
        if (success instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        List<Map<String, Object>> rows = successRows();
        return rows.isEmpty() ? Map.of() : rows.get(0);
    }

    @JsonIgnore
    public Optional<String> orderId() {
        Object orderId = successObject().get("order_id");
        return orderId == null ? Optional.empty() : Optional.of(orderId.toString());
    }

    /** Error text, falling back to a generic message when the broker gave none. */
    @JsonIgnore
    public String errorText() {
        if (error != null && !error.isBlank()) {
            return error;
        }
        return "Broker returned status " + status;
    }
}
