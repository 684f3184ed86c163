package com.company.anomaly.notification;

import lombok.Value;

import java.util.List;

@Value
public class DispatchResult {
    DispatchStatus status;
    List<String> deliveredChannels;
    List<String> failedChannels;

    public static DispatchResult of(DispatchStatus status) {
        return new DispatchResult(status, List.of(), List.of());
    }

    public boolean isDispatched() {
        return status == DispatchStatus.DISPATCHED;
    }
}
