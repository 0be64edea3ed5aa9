package com.optionsterminal.session;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Outcome of one option-chain subscribe request. */
@Value
@Builder
public class SubscriptionResult {

    /** Subscribe calls actually issued and accepted by this request. */
    int subscribed;

    /** Size of the session's subscription set afterwards. */
    int totalSubscriptions;

    /** One entry per tuple whose subscribe call failed, prefixed with its wire key. */
    List<String> errors;
}
