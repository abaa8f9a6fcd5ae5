package com.github.salilvnair.convflow.engine.journal;

import com.github.salilvnair.convflow.engine.context.TurnContext;
import com.github.salilvnair.convflow.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingJournalListener implements JournalListener {

    @Override
    public void onEvent(TurnContext ctx, JournalEvent event) {
        if (!log.isInfoEnabled()) {
            return;
        }
        log.info("journal dialog={} type={} payload={}",
                ctx.getDialog().get("user_id"), event.type(), JsonUtil.toJson(event.payload()));
    }
}
