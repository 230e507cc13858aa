package com.copytrader.engine;

import com.copytrader.domain.enums.MultiplierSource;
import com.copytrader.domain.model.Follower;
import com.copytrader.domain.model.SymbolMultiplier;
import com.copytrader.entity.SymbolMultiplierEntity;
import com.copytrader.exception.BusinessException;
import com.copytrader.exception.ErrorCode;
import com.copytrader.mapper.SymbolMultiplierMapper;
import com.copytrader.repository.jpa.SymbolMultiplierJpaRepository;
import com.copytrader.service.FollowerService;
import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves the quantity multiplier for a (follower, symbol).
 *
 * <p>Resolution order:
 * <ol>
 *   <li>symbol-level user override, if present</li>
 *   <li>the follower's base multiplier otherwise</li>
 * </ol>
 * Overrides change only through {@link #setOverride} and {@link #clearOverride}, called from
 * reconciliation apply or the multiplier endpoints. Nothing here infers a multiplier from
 * positions or fills.
 */
@Service
public class MultiplierResolver {

    private static final Logger log = LoggerFactory.getLogger(MultiplierResolver.class);

    private final SymbolMultiplierJpaRepository symbolMultiplierJpaRepository;
    private final SymbolMultiplierMapper symbolMultiplierMapper;
    private final FollowerService followerService;
    private final Map<String, SymbolMultiplier> overrides = new ConcurrentHashMap<>();

    public MultiplierResolver(
            SymbolMultiplierJpaRepository symbolMultiplierJpaRepository,
            SymbolMultiplierMapper symbolMultiplierMapper,
            FollowerService followerService) {
        this.symbolMultiplierJpaRepository = symbolMultiplierJpaRepository;
        this.symbolMultiplierMapper = symbolMultiplierMapper;
        this.followerService = followerService;
    }

    @PostConstruct
    public void load() {
        overrides.clear();
        symbolMultiplierMapper
                .toDomainList(symbolMultiplierJpaRepository.findAll())
                .forEach(o -> overrides.put(key(o.getFollowerId(), o.getSymbol()), o));
        log.info("Loaded {} multiplier overrides", overrides.size());
    }

    public BigDecimal effective(String followerId, String symbol) {
        return resolve(followerId, symbol).getMultiplier();
    }

    /** Effective multiplier together with its source. */
    public SymbolMultiplier resolve(String followerId, String symbol) {
        SymbolMultiplier override = overrides.get(key(followerId, symbol));
        if (override != null) {
            return override;
        }
        return SymbolMultiplier.builder()
                .followerId(followerId)
                .symbol(normalize(symbol))
                .multiplier(baseMultiplier(followerId))
                .source(MultiplierSource.BASE)
                .build();
    }

    /** Master quantity scaled by the effective multiplier for the pair. */
    public long scaledQuantity(String followerId, String symbol, long masterQuantity) {
        return scale(masterQuantity, effective(followerId, symbol));
    }

    /**
     * {@code round(masterQuantity * multiplier)} with ties to the even share count, and never
     * below one share for a non-zero master quantity.
     */
    public static long scale(long masterQuantity, BigDecimal multiplier) {
        if (masterQuantity == 0) {
            return 0;
        }
        long scaled = BigDecimal.valueOf(Math.abs(masterQuantity))
                .multiply(multiplier)
                .setScale(0, RoundingMode.HALF_EVEN)
                .longValueExact();
        return Math.max(scaled, 1);
    }

    public synchronized SymbolMultiplier setOverride(String followerId, String symbol, BigDecimal value) {
        if (value == null || value.compareTo(BigDecimal.ZERO) <= 0) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Multiplier must be positive");
        }
        String normalized = normalize(symbol);
        SymbolMultiplier override = SymbolMultiplier.builder()
                .followerId(followerId)
                .symbol(normalized)
                .multiplier(value)
                .source(MultiplierSource.USER_OVERRIDE)
                .build();
        SymbolMultiplierEntity entity = symbolMultiplierMapper.toEntity(override);
        symbolMultiplierJpaRepository
                .findByFollowerIdAndSymbol(followerId, normalized)
                .ifPresent(existing -> entity.setId(existing.getId()));
        symbolMultiplierJpaRepository.save(entity);
        overrides.put(key(followerId, normalized), override);
        log.info("Multiplier override set: follower={}, symbol={}, multiplier={}", followerId, normalized, value);
        return override;
    }

    /** Returns false if there was no override to clear. */
    public synchronized boolean clearOverride(String followerId, String symbol) {
        String normalized = normalize(symbol);
        if (overrides.remove(key(followerId, normalized)) == null) {
            return false;
        }
        symbolMultiplierJpaRepository.deleteByFollowerIdAndSymbol(followerId, normalized);
        log.info("Multiplier override cleared: follower={}, symbol={}", followerId, normalized);
        return true;
    }

    public List<SymbolMultiplier> overrides(String followerId) {
        return overrides.values().stream()
                .filter(o -> o.getFollowerId().equals(followerId))
                .sorted(Comparator.comparing(SymbolMultiplier::getSymbol))
                .toList();
    }

    private BigDecimal baseMultiplier(String followerId) {
        return followerService
                .find(followerId)
                .map(Follower::getBaseMultiplier)
                .orElse(BigDecimal.ONE);
    }

    private static String key(String followerId, String symbol) {
        return followerId + ":" + normalize(symbol);
    }

    private static String normalize(String symbol) {
        return symbol == null ? null : symbol.trim().toUpperCase(Locale.ROOT);
    }
}
