package com.mltrading.api.dto.response;

import com.mltrading.domain.enums.AlertOutcome;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SendAlertResponse {

    String alertId;
    AlertOutcome outcome;
    boolean delivered;
}
