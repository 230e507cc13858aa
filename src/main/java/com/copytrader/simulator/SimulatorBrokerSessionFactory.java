package com.copytrader.simulator;

import com.copytrader.broker.BrokerSessionFactory;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Hands out one {@link SimulatorBrokerSession} per account and keeps it across reconnects,
 * so simulated positions and capacity survive an engine stop or scheduled restart.
 */
@Component
public class SimulatorBrokerSessionFactory implements BrokerSessionFactory {

    private final Map<String, SimulatorBrokerSession> sessions = new ConcurrentHashMap<>();

    @Override
    public SimulatorBrokerSession create(String accountId) {
        return sessions.computeIfAbsent(accountId, SimulatorBrokerSession::new);
    }

    public Optional<SimulatorBrokerSession> find(String accountId) {
        return Optional.ofNullable(sessions.get(accountId));
    }
}
