package com.github.salilvnair.convflow.engine.flow;

import com.github.salilvnair.convflow.engine.context.TurnContext;
import com.github.salilvnair.convflow.engine.exception.DialogFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowException;
import com.github.salilvnair.convflow.engine.hook.DialogTurnHook;
import com.github.salilvnair.convflow.engine.journal.JournalEventDispatcher;
import com.github.salilvnair.convflow.engine.journal.JournalListener;
import com.github.salilvnair.convflow.engine.flow.tree.DialogTree;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * The flow of the conversation: one call of {@link #turn(TurnContext)} per incoming message
 * or RPC request.
 */
@Slf4j
public class DialogFlow {

    public static final String ROOT_COMPONENT = "ROOT";

    @Getter
    private final DialogTree dialogTree;
    private final FlowComponent rootComponent;
    private final List<DialogTurnHook> turnHooks;
    private final JournalEventDispatcher journalEventDispatcher;

    public DialogFlow(DialogTree dialogTree) {
        this(dialogTree, List.of(), List.of());
    }

    public DialogFlow(DialogTree dialogTree, List<DialogTurnHook> turnHooks, List<JournalListener> journalListeners) {
        this.dialogTree = dialogTree;
        this.rootComponent = new FlowComponent(ROOT_COMPONENT, dialogTree);
        this.turnHooks = turnHooks == null ? List.of() : List.copyOf(turnHooks);
        this.journalEventDispatcher = new JournalEventDispatcher(journalListeners == null ? List.of() : List.copyOf(journalListeners));
    }

    /**
     * Perform one turn of the dialog.
     * <p>
     * A failure raised during the turn is recorded on the context as a {@link DialogFlowException}
     * and ends the conversation. When the turn is done, state of all components is cleared along with slots.
     */
    public DialogTurnResult turn(TurnContext ctx) {
        for (DialogTurnHook hook : turnHooks) {
            runHookSafely(() -> {
                if (hook.supports(ctx)) {
                    hook.beforeTurn(ctx);
                }
            }, hook, "beforeTurn");
        }

        FlowResult result;
        try {
            result = turnRootComponent(ctx);
        } catch (DialogFlowException e) {
            log.warn(
                    "Dialog turn failed dialog={} code={} msg={}",
                    ctx.getDialog(),
                    e.getErrorCode(),
                    e.getMessage()
            );
            ctx.setError(e);
            for (DialogTurnHook hook : turnHooks) {
                runHookSafely(() -> {
                    if (hook.supports(ctx)) {
                        hook.onTurnError(ctx, e);
                    }
                }, hook, "onTurnError");
            }
            result = FlowResult.DONE;
        }

        if (result == FlowResult.DONE) {
            ctx.clearStateVariables();
        }

        boolean listening = result == FlowResult.LISTEN;
        for (DialogTurnHook hook : turnHooks) {
            runHookSafely(() -> {
                if (hook.supports(ctx)) {
                    hook.afterTurn(ctx, listening);
                }
            }, hook, "afterTurn");
        }

        journalEventDispatcher.dispatch(ctx);
        return new DialogTurnResult(result, ctx.getError());
    }

    /**
     * Failures of custom evaluators that are not {@link DialogFlowException}s end the turn as internal errors.
     */
    private FlowResult turnRootComponent(TurnContext ctx) {
        try {
            return rootComponent.turn(ctx);
        } catch (DialogFlowException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected failure in dialog turn dialog={}", ctx.getDialog(), e);
            throw new DialogFlowException(DialogFlowErrorCode.INTERNAL_ERROR, e.getMessage(), e);
        }
    }

    public long failedJournalNotificationCount() {
        return journalEventDispatcher.failedNotificationCount();
    }

    private void runHookSafely(Runnable hookCall, DialogTurnHook hook, String phase) {
        try {
            hookCall.run();
        } catch (Exception ex) {
            log.warn(
                    "DialogTurnHook {} failed during {}: {}",
                    hook.getClass().getSimpleName(),
                    phase,
                    ex.getMessage()
            );
        }
    }
}
