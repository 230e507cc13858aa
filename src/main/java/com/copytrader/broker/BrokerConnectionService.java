package com.copytrader.broker;

import com.copytrader.domain.model.Follower;
import com.copytrader.exception.BrokerException;
import com.copytrader.exception.FollowerUnreachableException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Owns the broker sessions: one for the master account and one per enabled follower.
 *
 * <p>A master session that fails to connect aborts {@link #connectAll}; a follower that fails
 * to connect is kept with a dead session so that dispatch routes its actions into the action
 * queue until the session comes back.
 */
@Service
public class BrokerConnectionService {

    private static final Logger log = LoggerFactory.getLogger(BrokerConnectionService.class);

    public static final String MASTER_KEY = "master";

    private final BrokerSessionFactory brokerSessionFactory;
    private final String masterAccountId;

    private final AtomicReference<BrokerSession> masterSession = new AtomicReference<>();
    private final Map<String, BrokerSession> followerSessions = new ConcurrentHashMap<>();

    public BrokerConnectionService(
            BrokerSessionFactory brokerSessionFactory,
            @Value("${copytrader.master.account-id}") String masterAccountId) {
        this.brokerSessionFactory = brokerSessionFactory;
        this.masterAccountId = masterAccountId;
    }

    /**
     * Opens the master session and one session per follower.
     *
     * @throws BrokerException if the master session cannot be opened
     */
    public void connectAll(Collection<Follower> followers) {
        BrokerSession master = brokerSessionFactory.create(masterAccountId);
        try {
            master.connect();
        } catch (RuntimeException e) {
            throw new BrokerException("Master session failed to connect: " + masterAccountId, e);
        }
        masterSession.set(master);
        log.info("Master session connected: account={}", masterAccountId);

        for (Follower follower : followers) {
            BrokerSession session = brokerSessionFactory.create(follower.getAccountId());
            followerSessions.put(follower.getId(), session);
            try {
                session.connect();
                log.info("Follower session connected: follower={}, account={}", follower.getId(), follower.getAccountId());
            } catch (RuntimeException e) {
                log.warn(
                        "Follower session failed to connect, actions will be queued: follower={}, error={}",
                        follower.getId(),
                        e.getMessage());
            }
        }
    }

    public void disconnectAll() {
        BrokerSession master = masterSession.getAndSet(null);
        if (master != null) {
            closeQuietly(MASTER_KEY, master);
        }
        followerSessions.forEach(this::closeQuietly);
        followerSessions.clear();
        log.info("All broker sessions disconnected");
    }

    public Optional<BrokerSession> getMasterSession() {
        return Optional.ofNullable(masterSession.get());
    }

    public boolean isMasterConnected() {
        BrokerSession master = masterSession.get();
        return master != null && master.isConnected();
    }

    public Optional<BrokerSession> getFollowerSession(String followerId) {
        return Optional.ofNullable(followerSessions.get(followerId));
    }

    public boolean isFollowerConnected(String followerId) {
        BrokerSession session = followerSessions.get(followerId);
        return session != null && session.isConnected();
    }

    /**
     * Returns the live session for a follower.
     *
     * @throws FollowerUnreachableException if there is no session or it is down
     */
    public BrokerSession requireFollowerSession(String followerId) {
        BrokerSession session = followerSessions.get(followerId);
        if (session == null || !session.isConnected()) {
            throw new FollowerUnreachableException(followerId);
        }
        return session;
    }

    public List<String> getFollowerIds() {
        return List.copyOf(followerSessions.keySet());
    }

    /** Connectivity per account: "master" first, then follower ids. */
    public Map<String, Boolean> getConnectionStatus() {
        Map<String, Boolean> status = new LinkedHashMap<>();
        status.put(MASTER_KEY, isMasterConnected());
        followerSessions.keySet().stream().sorted().forEach(id -> status.put(id, isFollowerConnected(id)));
        return status;
    }

    private void closeQuietly(String key, BrokerSession session) {
        try {
            session.clearSubscriptions();
            session.disconnect();
        } catch (RuntimeException e) {
            log.warn("Error closing broker session {}: {}", key, e.getMessage());
        }
    }
}
