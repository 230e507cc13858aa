package com.copytrader.engine;

import com.copytrader.domain.enums.BlacklistReason;
import com.copytrader.domain.model.BlacklistEntry;
import com.copytrader.mapper.BlacklistMapper;
import com.copytrader.repository.jpa.BlacklistJpaRepository;
import jakarta.annotation.PostConstruct;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-(follower, symbol) exclusion set.
 *
 * <p>Lookups hit an in-memory map and never block; mutations are synchronized, written to H2
 * first and then to memory. Symbols are stored upper-case. The reason is kept for display
 * and has no effect on {@link #isBlacklisted}.
 */
@Service
public class BlacklistRegistry {

    private static final Logger log = LoggerFactory.getLogger(BlacklistRegistry.class);

    private record Key(String followerId, String symbol) {}

    private final BlacklistJpaRepository blacklistJpaRepository;
    private final BlacklistMapper blacklistMapper;
    private final Map<Key, BlacklistEntry> entries = new ConcurrentHashMap<>();

    public BlacklistRegistry(BlacklistJpaRepository blacklistJpaRepository, BlacklistMapper blacklistMapper) {
        this.blacklistJpaRepository = blacklistJpaRepository;
        this.blacklistMapper = blacklistMapper;
    }

    @PostConstruct
    public void load() {
        entries.clear();
        blacklistMapper
                .toDomainList(blacklistJpaRepository.findAll())
                .forEach(entry -> entries.put(key(entry.getFollowerId(), entry.getSymbol()), entry));
        log.info("Loaded {} blacklist entries", entries.size());
    }

    public boolean isBlacklisted(String followerId, String symbol) {
        return entries.containsKey(key(followerId, symbol));
    }

    /** Returns false if the pair was already blacklisted. */
    public synchronized boolean add(String followerId, String symbol, BlacklistReason reason) {
        Key key = key(followerId, symbol);
        if (entries.containsKey(key)) {
            return false;
        }
        BlacklistEntry entry = BlacklistEntry.builder()
                .followerId(followerId)
                .symbol(key.symbol())
                .reason(reason)
                .createdAt(Instant.now())
                .build();
        blacklistJpaRepository.save(blacklistMapper.toEntity(entry));
        entries.put(key, entry);
        log.info("Blacklisted: follower={}, symbol={}, reason={}", followerId, key.symbol(), reason);
        return true;
    }

    /** Returns false if the pair was not blacklisted. */
    public synchronized boolean remove(String followerId, String symbol) {
        Key key = key(followerId, symbol);
        if (!entries.containsKey(key)) {
            return false;
        }
        blacklistJpaRepository.deleteByFollowerIdAndSymbol(followerId, key.symbol());
        entries.remove(key);
        log.info("Removed from blacklist: follower={}, symbol={}", followerId, key.symbol());
        return true;
    }

    public List<BlacklistEntry> list(String followerId) {
        return entries.values().stream()
                .filter(entry -> entry.getFollowerId().equals(followerId))
                .sorted(Comparator.comparing(BlacklistEntry::getSymbol))
                .toList();
    }

    public List<BlacklistEntry> listAll() {
        return entries.values().stream()
                .sorted(Comparator.comparing(BlacklistEntry::getFollowerId).thenComparing(BlacklistEntry::getSymbol))
                .toList();
    }

    private static Key key(String followerId, String symbol) {
        return new Key(followerId, normalize(symbol));
    }

    static String normalize(String symbol) {
        return symbol == null ? null : symbol.trim().toUpperCase(Locale.ROOT);
    }
}
