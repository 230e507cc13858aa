package com.copytrader.service;

import com.copytrader.domain.model.Follower;
import com.copytrader.entity.FollowerEntity;
import com.copytrader.exception.BusinessException;
import com.copytrader.exception.ErrorCode;
import com.copytrader.exception.ResourceNotFoundException;
import com.copytrader.mapper.FollowerMapper;
import com.copytrader.repository.jpa.FollowerJpaRepository;
import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Follower registry: H2 is the source of truth, with an in-memory copy that the engine reads
 * on every dispatch. Mutations write through to H2 first, then update the copy.
 */
@Service
public class FollowerService {

    private static final Logger log = LoggerFactory.getLogger(FollowerService.class);

    private final FollowerJpaRepository followerJpaRepository;
    private final FollowerMapper followerMapper;
    private final Map<String, Follower> followers = new ConcurrentHashMap<>();

    public FollowerService(FollowerJpaRepository followerJpaRepository, FollowerMapper followerMapper) {
        this.followerJpaRepository = followerJpaRepository;
        this.followerMapper = followerMapper;
    }

    @PostConstruct
    public void reload() {
        List<FollowerEntity> entities = followerJpaRepository.findAll();
        followers.clear();
        followerMapper.toDomainList(entities).forEach(f -> followers.put(f.getId(), f));
        log.info("Loaded {} followers", followers.size());
    }

    public List<Follower> findAll() {
        return followers.values().stream()
                .sorted(Comparator.comparing(Follower::getId))
                .toList();
    }

    public List<Follower> findEnabled() {
        return findAll().stream().filter(Follower::isEnabled).toList();
    }

    public Optional<Follower> find(String followerId) {
        return Optional.ofNullable(followers.get(followerId));
    }

    public Follower require(String followerId) {
        return find(followerId).orElseThrow(() -> new ResourceNotFoundException("Follower", followerId));
    }

    public Follower register(Follower follower) {
        validate(follower);
        if (follower.getId() == null) {
            follower.setId(UUID.randomUUID().toString());
        }
        if (followers.containsKey(follower.getId())) {
            throw BusinessException.conflict("Follower already exists: " + follower.getId());
        }
        followerJpaRepository.save(followerMapper.toEntity(follower));
        followers.put(follower.getId(), follower);
        log.info(
                "Follower registered: id={}, account={}, baseMultiplier={}",
                follower.getId(),
                follower.getAccountId(),
                follower.getBaseMultiplier());
        return follower;
    }

    /** Replaces the stored follower's editable fields. The account binding cannot change. */
    public Follower update(String followerId, Follower changes) {
        Follower existing = require(followerId);
        Follower updated = Follower.builder()
                .id(followerId)
                .accountId(existing.getAccountId())
                .name(changes.getName() != null ? changes.getName() : existing.getName())
                .baseMultiplier(
                        changes.getBaseMultiplier() != null
                                ? changes.getBaseMultiplier()
                                : existing.getBaseMultiplier())
                .enabled(changes.isEnabled())
                .maxLocatePrice(changes.getMaxLocatePrice())
                .locateTimeoutSeconds(changes.getLocateTimeoutSeconds())
                .build();
        validate(updated);
        followerJpaRepository.save(followerMapper.toEntity(updated));
        followers.put(followerId, updated);
        log.info(
                "Follower updated: id={}, enabled={}, baseMultiplier={}",
                followerId,
                updated.isEnabled(),
                updated.getBaseMultiplier());
        return updated;
    }

    private void validate(Follower follower) {
        if (follower.getBaseMultiplier() == null || follower.getBaseMultiplier().compareTo(BigDecimal.ZERO) <= 0) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Base multiplier must be positive");
        }
        if (follower.getAccountId() == null || follower.getAccountId().isBlank()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Account id is required");
        }
    }
}
