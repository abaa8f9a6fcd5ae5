package com.github.salilvnair.convflow.engine.journal;

import com.github.salilvnair.convflow.engine.context.TurnContext;

public interface JournalListener {

    void onEvent(TurnContext ctx, JournalEvent event);
}
