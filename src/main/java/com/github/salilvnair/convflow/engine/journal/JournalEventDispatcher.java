package com.github.salilvnair.convflow.engine.journal;

import com.github.salilvnair.convflow.engine.context.TurnContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

@RequiredArgsConstructor
@Slf4j
public class JournalEventDispatcher {

    private final List<JournalListener> listeners;

    private final AtomicLong failedNotifications = new AtomicLong();

    public void dispatch(TurnContext ctx) {
        if (listeners == null || listeners.isEmpty() || ctx == null) {
            return;
        }
        for (JournalEvent event : ctx.getJournalEvents()) {
            notifySync(ctx, event);
        }
    }

    public long failedNotificationCount() {
        return failedNotifications.get();
    }

    private void notifySync(TurnContext ctx, JournalEvent event) {
        for (JournalListener listener : listeners) {
            try {
                listener.onEvent(ctx, event);
            } catch (Exception e) {
                failedNotifications.incrementAndGet();
                log.warn(
                        "Journal listener failed listener={} type={} msg={}",
                        listener.getClass().getSimpleName(),
                        event.type(),
                        e.getMessage()
                );
            }
        }
    }
}
