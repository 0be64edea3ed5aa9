package com.optionsterminal.oms;

import com.optionsterminal.broker.BrokerResponse;

/** Places one leg with the broker, blocking until the broker has answered. */
@FunctionalInterface
public interface LegSubmitter {

    BrokerResponse submit(OrderLeg leg);
}
