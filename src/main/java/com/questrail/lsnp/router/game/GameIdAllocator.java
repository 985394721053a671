package com.questrail.lsnp.router.game;

/**
 * Hands out game ids {@code g0}..{@code g255}, wrapping back to {@code g0}.
 */
public final class GameIdAllocator
{
    public static final int ID_SPACE = 256;

    private int next;

    public synchronized String next()
    {
        String id = "g" + next;
        next = (next + 1) % ID_SPACE;
        return id;
    }
}
