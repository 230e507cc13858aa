package com.copytrader.mapper;

import com.copytrader.api.dto.request.FollowerRequest;
import com.copytrader.api.dto.request.MasterEventRequest;
import com.copytrader.api.dto.request.ReconciliationApplyRequest;
import com.copytrader.domain.model.Follower;
import com.copytrader.domain.model.MasterOrderEvent;
import com.copytrader.domain.model.ReconciliationDecision;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/** MapStruct mapper from REST request DTOs to domain models. */
@Mapper
public interface RequestMapper {

    Follower toFollower(FollowerRequest request);

    ReconciliationDecision toDecision(ReconciliationApplyRequest.Decision decision);

    List<ReconciliationDecision> toDecisions(List<ReconciliationApplyRequest.Decision> decisions);

    @Mapping(target = "receivedAt", ignore = true)
    MasterOrderEvent toMasterEvent(MasterEventRequest request);
}
