package com.company.correlation.domain;

import com.company.correlation.domain.enums.SkipReason;
import lombok.Value;

@Value
public class SkippedEntity {
    String entityId;
    SkipReason reason;
    String detail;
}
