package com.company.correlation.domain;

import lombok.Value;

@Value
public class SeverityCutPoints {
    double critical;
    double major;
    double minor;

    public static SeverityCutPoints defaults() {
        return new SeverityCutPoints(50.0, 25.0, 10.0);
    }
}
