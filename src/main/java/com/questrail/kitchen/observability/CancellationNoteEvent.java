package com.questrail.kitchen.observability;

import com.questrail.kitchen.dispatch.CancellationNote;

import java.time.Instant;

public record CancellationNoteEvent(Instant timestamp, CancellationNote note)
{
}
