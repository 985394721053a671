package com.questrail.lsnp.router.state;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded memory of recently seen {@code MESSAGE_ID}s, least recently seen
 * evicted first.
 */
public final class RecentMessageIds
{
    public static final int DEFAULT_CAPACITY = 1000;

    private final Map<String, Boolean> seen;

    public RecentMessageIds(int capacity)
    {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.seen = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * Records {@code messageId}.
     *
     * @return {@code true} if it was not remembered yet
     */
    public synchronized boolean markSeen(String messageId)
    {
        Objects.requireNonNull(messageId, "messageId");
        return seen.put(messageId, Boolean.TRUE) == null;
    }

    public synchronized int size()
    {
        return seen.size();
    }
}
