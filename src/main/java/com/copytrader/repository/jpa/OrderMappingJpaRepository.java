package com.copytrader.repository.jpa;

import com.copytrader.domain.enums.MappingStatus;
import com.copytrader.entity.OrderMappingEntity;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the order_mappings table.
 * Live rows (PENDING, ACTIVE, SKIPPED) are reloaded on connect so cancels and replaces that
 * arrive after a restart still find their follower orders.
 */
@Repository
public interface OrderMappingJpaRepository extends JpaRepository<OrderMappingEntity, Long> {

    Optional<OrderMappingEntity> findByMasterOrderIdAndFollowerId(String masterOrderId, String followerId);

    List<OrderMappingEntity> findByMasterOrderId(String masterOrderId);

    List<OrderMappingEntity> findByStatusIn(Collection<MappingStatus> statuses);
}
