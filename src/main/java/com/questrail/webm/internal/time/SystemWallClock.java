package com.questrail.webm.internal.time;

import java.time.Instant;

/**
 * {@link WallClock} backed by {@link Instant#now()}.
 */
public final class SystemWallClock implements WallClock
{
    public static final SystemWallClock INSTANCE = new SystemWallClock();

    private SystemWallClock() {}

    @Override
    public Instant now()
    {
        return Instant.now();
    }
}
