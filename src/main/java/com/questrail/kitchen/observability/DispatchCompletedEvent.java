package com.questrail.kitchen.observability;

import com.questrail.kitchen.dispatch.DispatchReport;

import java.time.Instant;

public record DispatchCompletedEvent(Instant timestamp, DispatchReport report)
{
}
