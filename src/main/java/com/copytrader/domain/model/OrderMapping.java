package com.copytrader.domain.model;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Getter;

/**
 * Master order identifier to per-follower order links.
 *
 * <p>Links are independent map entries, so status readers never lock; writers for one master
 * order are serialized by the engine's event ordering.
 */
@Getter
public class OrderMapping {

    private final String masterOrderId;
    private final String symbol;
    private final Map<String, FollowerOrderLink> links = new ConcurrentHashMap<>();

    public OrderMapping(String masterOrderId, String symbol) {
        this.masterOrderId = masterOrderId;
        this.symbol = symbol;
    }

    public Optional<FollowerOrderLink> link(String followerId) {
        return Optional.ofNullable(links.get(followerId));
    }

    public void put(FollowerOrderLink link) {
        links.put(link.getFollowerId(), link);
    }

    public Collection<FollowerOrderLink> allLinks() {
        return links.values();
    }
}
