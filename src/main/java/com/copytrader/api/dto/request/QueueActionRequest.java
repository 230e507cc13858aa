package com.copytrader.api.dto.request;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Selects queued actions by id; a missing or empty list selects the whole queue. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueActionRequest {

    private List<String> actionIds;
}
