package com.questrail.lsnp.runtime;

import com.questrail.lsnp.api.LsnpEvent;
import com.questrail.lsnp.api.LsnpEventListener;
import com.questrail.lsnp.internal.time.WallClock;
import com.questrail.lsnp.observability.LsnpErrorEvent;
import com.questrail.lsnp.observability.LsnpObservabilitySink;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers each event to every registered listener. A listener that throws is
 * reported to the observability sink and the remaining listeners still run.
 */
final class ListenerFanOut implements Consumer<LsnpEvent>
{
    private final List<LsnpEventListener> listeners = new CopyOnWriteArrayList<>();
    private final LsnpObservabilitySink observabilitySink;
    private final WallClock wallClock;

    ListenerFanOut(LsnpObservabilitySink observabilitySink, WallClock wallClock)
    {
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    void add(LsnpEventListener listener)
    {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    void remove(LsnpEventListener listener)
    {
        listeners.remove(listener);
    }

    @Override
    public void accept(LsnpEvent event)
    {
        for (LsnpEventListener l : listeners) {
            try {
                l.onEvent(event);
            } catch (RuntimeException e) {
                observabilitySink.onError(new LsnpErrorEvent(
                        wallClock.now(), "Event listener failed on " + event.getClass().getSimpleName(), e));
            }
        }
    }
}
