package com.questrail.lsnp.router.state;

import com.questrail.lsnp.model.DmEntry;
import com.questrail.lsnp.model.UserId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Direct message threads of the local user, one per counterpart, in arrival
 * order.
 *
 * <p>The local user is one side of every thread, so keying by the other side
 * is the same as keying by the unordered pair.</p>
 */
public final class DirectMessageStore
{
    private final Map<UserId, List<DmEntry>> threads = new HashMap<>();

    public synchronized void append(UserId counterpart, DmEntry entry)
    {
        Objects.requireNonNull(counterpart, "counterpart");
        Objects.requireNonNull(entry, "entry");
        threads.computeIfAbsent(counterpart, k -> new ArrayList<>()).add(entry);
    }

    public synchronized List<DmEntry> thread(UserId counterpart)
    {
        List<DmEntry> entries = threads.get(counterpart);
        return entries == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(entries));
    }
}
