package com.questrail.kitchen.dispatch;

import java.util.Objects;

public record PrintJobId(String value)
{
    public PrintJobId {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return value;
    }
}
