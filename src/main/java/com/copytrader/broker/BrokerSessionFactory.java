package com.copytrader.broker;

/** Creates the session for an account. One implementation is active per deployment. */
public interface BrokerSessionFactory {

    BrokerSession create(String accountId);
}
