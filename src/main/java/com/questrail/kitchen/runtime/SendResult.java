package com.questrail.kitchen.runtime;

import com.questrail.kitchen.api.RoutingManifest;
import com.questrail.kitchen.dispatch.DispatchReport;

import java.util.Objects;

/**
 * Manifest and delivery report of one send action.
 */
public record SendResult(RoutingManifest manifest, DispatchReport report)
{
    public SendResult {
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(report, "report");
    }

    public DispatchReport.Status status() {
        return report.status();
    }
}
