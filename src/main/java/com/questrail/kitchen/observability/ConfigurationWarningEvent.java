package com.questrail.kitchen.observability;

import com.questrail.kitchen.registry.ConfigurationWarning;

import java.time.Instant;

/**
 * A problem found in a station registry snapshot. Reported once per registry version.
 */
public record ConfigurationWarningEvent(Instant timestamp, long registryVersion, ConfigurationWarning warning)
{
}
