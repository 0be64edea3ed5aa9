package com.optionsterminal.api.dto.response;

import com.optionsterminal.session.SubscriptionResult;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SubscribeResponse {

    int unsubscribed;
    int subscribed;
    int totalSubscriptions;
    List<String> errors;

    public static SubscribeResponse of(int unsubscribed, SubscriptionResult result) {
        return SubscribeResponse.builder()
                .unsubscribed(unsubscribed)
                .subscribed(result.getSubscribed())
                .totalSubscriptions(result.getTotalSubscriptions())
                .errors(result.getErrors())
                .build();
    }
}
