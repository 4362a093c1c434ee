package com.example.appruntime.model;

/**
 * 一次事件分发的汇总。
 */
public record DispatchSummary(String eventType, int attempted, int succeeded) {

    public int failed() {
        return attempted - succeeded;
    }
}
