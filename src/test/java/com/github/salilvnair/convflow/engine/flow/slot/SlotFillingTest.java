package com.github.salilvnair.convflow.engine.flow.slot;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.convflow.engine.context.DialogState;
import com.github.salilvnair.convflow.engine.context.EntitiesResult;
import com.github.salilvnair.convflow.engine.context.IntentsResult;
import com.github.salilvnair.convflow.engine.context.RecognizedEntity;
import com.github.salilvnair.convflow.engine.context.RecognizedIntent;
import com.github.salilvnair.convflow.engine.context.TurnContext;
import com.github.salilvnair.convflow.engine.expression.Expression;
import com.github.salilvnair.convflow.engine.flow.DigressionResult;
import com.github.salilvnair.convflow.engine.flow.FlowResult;
import com.github.salilvnair.convflow.util.JsonUtil;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.github.salilvnair.convflow.support.DialogFixtures.expression;
import static com.github.salilvnair.convflow.support.DialogFixtures.journalTypes;
import static com.github.salilvnair.convflow.support.DialogFixtures.json;
import static com.github.salilvnair.convflow.support.DialogFixtures.message;
import static com.github.salilvnair.convflow.support.DialogFixtures.scenario;
import static com.github.salilvnair.convflow.support.DialogFixtures.text;
import static com.github.salilvnair.convflow.support.DialogFixtures.texts;
import static com.github.salilvnair.convflow.support.TestConstants.CITY_PARIS;
import static com.github.salilvnair.convflow.support.TestConstants.ENTITY_CITY;
import static com.github.salilvnair.convflow.support.TestConstants.INTENT_GREETING;
import static com.github.salilvnair.convflow.support.TestConstants.SLOT1;
import static com.github.salilvnair.convflow.support.TestConstants.SLOT_CITY;
import static com.github.salilvnair.convflow.support.TestConstants.SLOT_DATE;
import static com.github.salilvnair.convflow.support.TestConstants.USER_TEXT_HELLO;
import static com.github.salilvnair.convflow.support.TestConstants.USER_TEXT_WHATEVER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlotFillingTest {

    private static final String CITY_PROMPT = "Which city?";
    private static final String DATE_PROMPT = "Which date?";

    @Test
    void promptsForTheFirstEmptySlot() {
        SlotFilling flow = new SlotFilling(List.of(
                Slot.builder().name(SLOT1).checkFor(Expression.constant(false)).prompt(text("prompt triggered")).build()
        ), List.of());
        ObjectNode state = JsonUtil.object();
        TurnContext ctx = message(USER_TEXT_HELLO);

        FlowResult result = flow.turn(ctx, state, null);

        assertEquals(FlowResult.LISTEN, result);
        assertEquals(List.of("prompt triggered"), texts(ctx));
        assertEquals(json("{\"slot_in_focus\": \"slot1\"}"), state);
        assertTrue(ctx.getState().getSlots().isEmpty());
    }

    @Test
    void digressesWhenFocusedSlotIsNotFilledAndNoHandlerMatches() {
        SlotFilling flow = new SlotFilling(List.of(
                Slot.builder().name(SLOT1).checkFor(Expression.constant(false)).prompt(text("prompt triggered")).build()
        ), List.of());
        ObjectNode state = json("{\"slot_in_focus\": \"slot1\"}");
        TurnContext ctx = message(USER_TEXT_HELLO);

        FlowResult result = flow.turn(ctx, state, null);

        assertEquals(FlowResult.DIGRESS, result);
        assertEquals(List.of(), texts(ctx));
        assertEquals(json("{\"slot_in_focus\": \"slot1\"}"), state);
    }

    @Test
    void storesEntityValueAndPromptsForTheNextSlot() {
        SlotFilling flow = new SlotFilling(List.of(citySlot().build(), dateSlot().build()), List.of());
        ObjectNode state = JsonUtil.object();
        TurnContext ctx = message(USER_TEXT_HELLO, IntentsResult.empty(), paris(), DialogState.empty());

        FlowResult result = flow.turn(ctx, state, null);

        assertEquals(FlowResult.LISTEN, result);
        assertEquals(CITY_PARIS, ctx.getSlot(SLOT_CITY));
        assertEquals(List.of(DATE_PROMPT), texts(ctx));
        assertEquals(json("{\"slot_in_focus\": \"date\"}"), state);
        assertEquals(List.of("assign", "slot_filling", "prompt"), journalTypes(ctx));
    }

    @Test
    void allSlotsFilledIsDone() {
        SlotFilling flow = new SlotFilling(List.of(citySlot().build()), List.of());
        ObjectNode state = json("{\"slot_in_focus\": \"city\"}");
        TurnContext ctx = message(USER_TEXT_HELLO, IntentsResult.empty(), paris(), DialogState.empty());

        assertEquals(FlowResult.DONE, flow.turn(ctx, state, null));
        assertEquals(json("{\"slot_in_focus\": null}"), state);
    }

    @Test
    void slotWithoutPromptIsOptional() {
        SlotFilling flow = new SlotFilling(List.of(
                Slot.builder().name(SLOT1).checkFor(Expression.constant(false)).build()
        ), List.of());
        TurnContext ctx = message(USER_TEXT_HELLO);

        assertEquals(FlowResult.DONE, flow.turn(ctx, JsonUtil.object(), null));
        assertEquals(List.of(), texts(ctx));
    }

    @Test
    void valueExpressionOverridesCheckForResult() {
        SlotFilling flow = new SlotFilling(List.of(
                Slot.builder().name(SLOT1).checkFor(Expression.constant(true)).value(expression("'fixed'")).build()
        ), List.of());
        TurnContext ctx = message(USER_TEXT_HELLO);

        flow.turn(ctx, JsonUtil.object(), null);

        assertEquals("fixed", ctx.getSlot(SLOT1));
    }

    @Test
    void recognizedIntentIsStoredAsTrue() {
        SlotFilling flow = new SlotFilling(List.of(
                Slot.builder().name(SLOT1).checkFor(expression("intents.greeting")).build()
        ), List.of());
        IntentsResult intents = IntentsResult.resolve(List.of(new RecognizedIntent(INTENT_GREETING, 0.9d)));
        TurnContext ctx = message(USER_TEXT_HELLO, intents, EntitiesResult.empty(), DialogState.empty());

        flow.turn(ctx, JsonUtil.object(), null);

        assertEquals(Boolean.TRUE, ctx.getSlot(SLOT1));
    }

    @Test
    void checkForSeesWhetherTheSlotIsInFocus() {
        SlotFilling flow = new SlotFilling(List.of(
                Slot.builder().name(SLOT1).checkFor(expression("slot_in_focus and message.text == 'hello'")).build()
        ), List.of());

        TurnContext unfocused = message(USER_TEXT_HELLO);
        flow.turn(unfocused, JsonUtil.object(), null);
        assertNull(unfocused.getSlot(SLOT1));

        TurnContext focused = message(USER_TEXT_HELLO);
        flow.turn(focused, json("{\"slot_in_focus\": \"slot1\"}"), null);
        assertEquals(Boolean.TRUE, focused.getSlot(SLOT1));
    }

    @Test
    void slotConditionSeesSlotsFilledEarlierInTheTurn() {
        SlotFilling flow = new SlotFilling(List.of(
                citySlot().build(),
                dateSlot().checkFor(expression("'tomorrow'")).condition(expression("slots.city != null")).build()
        ), List.of());
        TurnContext ctx = message(USER_TEXT_HELLO, IntentsResult.empty(), paris(), DialogState.empty());

        assertEquals(FlowResult.DONE, flow.turn(ctx, JsonUtil.object(), null));
        assertEquals("tomorrow", ctx.getSlot(SLOT_DATE));
    }

    @Test
    void slotConditionIsCheckedAgainBeforePrompting() {
        SlotFilling flow = new SlotFilling(List.of(
                citySlot().build(),
                dateSlot().condition(expression("slots.city != null")).build()
        ), List.of());
        ObjectNode state = JsonUtil.object();

        TurnContext first = message(USER_TEXT_HELLO, IntentsResult.empty(), noEntities(), DialogState.empty());
        assertEquals(FlowResult.LISTEN, flow.turn(first, state, null));
        assertEquals(List.of(CITY_PROMPT), texts(first));

        TurnContext second = message(USER_TEXT_HELLO, IntentsResult.empty(), paris(), DialogState.empty());
        assertEquals(FlowResult.LISTEN, flow.turn(second, state, null));
        assertEquals(List.of(DATE_PROMPT), texts(second));
        assertEquals(json("{\"slot_in_focus\": \"date\"}"), state);
    }

    @Test
    void disabledSlotIsNeitherFilledNorPrompted() {
        SlotFilling flow = new SlotFilling(List.of(
                citySlot().condition(Expression.constant(false)).build()
        ), List.of());
        TurnContext ctx = message(USER_TEXT_HELLO, IntentsResult.empty(), paris(), DialogState.empty());

        assertEquals(FlowResult.DONE, flow.turn(ctx, JsonUtil.object(), null));
        assertNull(ctx.getSlot(SLOT_CITY));
        assertEquals(List.of(), texts(ctx));
    }

    @Test
    void foundScenarioSeesPreviousAndCurrentValues() {
        SlotFilling flow = new SlotFilling(List.of(
                citySlot().found(text("[[${previous_value}]] -> [[${current_value}]]")).build()
        ), List.of());
        Map<String, Object> slots = new HashMap<>();
        slots.put(SLOT_CITY, "London");
        TurnContext ctx = message(USER_TEXT_HELLO, IntentsResult.empty(), paris(), new DialogState(null, slots, null));

        assertEquals(FlowResult.DONE, flow.turn(ctx, JsonUtil.object(), null));
        assertEquals(List.of("London -> Paris"), texts(ctx));
    }

    @Test
    void foundPromptAgainClearsTheSlotAndPrompts() {
        SlotFilling flow = new SlotFilling(List.of(
                citySlot().found(scenario("[\"We do not serve Paris.\", {\"prompt_again\": {}}]")).build()
        ), List.of());
        ObjectNode state = JsonUtil.object();
        TurnContext ctx = message(USER_TEXT_HELLO, IntentsResult.empty(), paris(), DialogState.empty());

        assertEquals(FlowResult.LISTEN, flow.turn(ctx, state, null));
        assertNull(ctx.getSlot(SLOT_CITY));
        assertEquals(List.of("We do not serve Paris.", CITY_PROMPT), texts(ctx));
        assertTrue(journalTypes(ctx).contains("delete"));
        assertEquals(json("{\"slot_in_focus\": \"city\"}"), state);
    }

    @Test
    void foundListenAgainClearsTheSlotWithoutPrompt() {
        SlotFilling flow = new SlotFilling(List.of(
                citySlot().found(scenario("[\"Say it again.\", {\"listen_again\": {}}]")).build()
        ), List.of());
        ObjectNode state = JsonUtil.object();
        TurnContext ctx = message(USER_TEXT_HELLO, IntentsResult.empty(), paris(), DialogState.empty());

        assertEquals(FlowResult.LISTEN, flow.turn(ctx, state, null));
        assertNull(ctx.getSlot(SLOT_CITY));
        assertEquals(List.of("Say it again."), texts(ctx));
        assertEquals(json("{\"slot_in_focus\": \"city\"}"), state);
    }

    @Test
    void foundResponseSkipsRemainingSlots() {
        SlotFilling flow = new SlotFilling(List.of(
                citySlot().found(scenario("[{\"response\": {}}]")).build(),
                dateSlot().build()
        ), List.of());
        ObjectNode state = JsonUtil.object();
        TurnContext ctx = message(USER_TEXT_HELLO, IntentsResult.empty(), paris(), DialogState.empty());

        assertEquals(FlowResult.DONE, flow.turn(ctx, state, null));
        assertEquals(List.of(), texts(ctx));
        assertEquals(json("{\"slot_in_focus\": null}"), state);
    }

    @Test
    void foundMoveOnContinues() {
        SlotFilling flow = new SlotFilling(List.of(
                citySlot().found(scenario("[\"Paris it is.\", {\"move_on\": {}}, \"unreachable\"]")).build(),
                dateSlot().build()
        ), List.of());
        TurnContext ctx = message(USER_TEXT_HELLO, IntentsResult.empty(), paris(), DialogState.empty());

        assertEquals(FlowResult.LISTEN, flow.turn(ctx, JsonUtil.object(), null));
        assertEquals(List.of("Paris it is.", DATE_PROMPT), texts(ctx));
    }

    @Test
    void handlerRespondsAndFocusedSlotIsPromptedAgain() {
        SlotFilling flow = new SlotFilling(
                List.of(citySlot().build()),
                List.of(new SlotHandler(expression("message.text == 'hello'"), text("Hi! I need a city.")))
        );
        ObjectNode state = json("{\"slot_in_focus\": \"city\"}");
        TurnContext ctx = message(USER_TEXT_HELLO, IntentsResult.empty(), noEntities(), DialogState.empty());

        assertEquals(FlowResult.LISTEN, flow.turn(ctx, state, null));
        assertEquals(List.of("Hi! I need a city.", CITY_PROMPT), texts(ctx));
        assertTrue(journalTypes(ctx).contains("slot_handler"));
    }

    @Test
    void handlerResponseCommandFinishesSlotFilling() {
        SlotFilling flow = new SlotFilling(
                List.of(citySlot().build()),
                List.of(
                        new SlotHandler(Expression.constant(false), text("never")),
                        new SlotHandler(Expression.constant(true), scenario("[\"Skipping.\", {\"response\": {}}]"))
                )
        );
        ObjectNode state = json("{\"slot_in_focus\": \"city\"}");
        TurnContext ctx = message(USER_TEXT_HELLO, IntentsResult.empty(), noEntities(), DialogState.empty());

        assertEquals(FlowResult.DONE, flow.turn(ctx, state, null));
        assertEquals(List.of("Skipping."), texts(ctx));
        assertEquals(json("{\"slot_in_focus\": null}"), state);
    }

    @Test
    void notFoundWithoutControlCommandSkipsThePrompt() {
        SlotFilling flow = new SlotFilling(List.of(citySlot().notFound(text("Sorry, which city?")).build()), List.of());
        ObjectNode state = json("{\"slot_in_focus\": \"city\"}");
        TurnContext ctx = message(USER_TEXT_WHATEVER, IntentsResult.empty(), noEntities(), DialogState.empty());

        assertEquals(FlowResult.LISTEN, flow.turn(ctx, state, DigressionResult.NOT_FOUND));
        assertEquals(List.of("Sorry, which city?"), texts(ctx));
        assertEquals(json("{\"slot_in_focus\": \"city\"}"), state);
    }

    @Test
    void notFoundPromptAgainPrompts() {
        SlotFilling flow = new SlotFilling(List.of(
                citySlot().notFound(scenario("[\"Sorry.\", {\"prompt_again\": {}}]")).build()
        ), List.of());
        TurnContext ctx = message(USER_TEXT_WHATEVER, IntentsResult.empty(), noEntities(), DialogState.empty());

        assertEquals(FlowResult.LISTEN, flow.turn(ctx, json("{\"slot_in_focus\": \"city\"}"), DigressionResult.NOT_FOUND));
        assertEquals(List.of("Sorry.", CITY_PROMPT), texts(ctx));
    }

    @Test
    void notFoundResponseFinishesSlotFilling() {
        SlotFilling flow = new SlotFilling(List.of(
                citySlot().notFound(scenario("[{\"response\": {}}]")).build()
        ), List.of());
        ObjectNode state = json("{\"slot_in_focus\": \"city\"}");
        TurnContext ctx = message(USER_TEXT_WHATEVER, IntentsResult.empty(), noEntities(), DialogState.empty());

        assertEquals(FlowResult.DONE, flow.turn(ctx, state, DigressionResult.NOT_FOUND));
        assertEquals(json("{\"slot_in_focus\": null}"), state);
    }

    @Test
    void returningFromSuccessfulDigressionPromptsAgain() {
        SlotFilling flow = new SlotFilling(
                List.of(citySlot().notFound(text("never")).build()),
                List.of(new SlotHandler(Expression.constant(true), text("never")))
        );
        TurnContext ctx = message(USER_TEXT_WHATEVER, IntentsResult.empty(), noEntities(), DialogState.empty());

        assertEquals(FlowResult.LISTEN, flow.turn(ctx, json("{\"slot_in_focus\": \"city\"}"), DigressionResult.FOUND));
        assertEquals(List.of(CITY_PROMPT), texts(ctx));
    }

    @Test
    void promptResponseCommandFinishesSlotFilling() {
        SlotFilling flow = new SlotFilling(List.of(
                Slot.builder().name(SLOT1).checkFor(Expression.constant(false))
                        .prompt(scenario("[\"No need to ask.\", {\"response\": {}}]")).build()
        ), List.of());
        ObjectNode state = JsonUtil.object();
        TurnContext ctx = message(USER_TEXT_HELLO);

        assertEquals(FlowResult.DONE, flow.turn(ctx, state, null));
        assertEquals(List.of("No need to ask."), texts(ctx));
        assertFalse(state.path("slot_in_focus").isTextual());
    }

    private static Slot.SlotBuilder citySlot() {
        return Slot.builder()
                .name(SLOT_CITY)
                .checkFor(expression("entities.city"))
                .prompt(text(CITY_PROMPT));
    }

    private static Slot.SlotBuilder dateSlot() {
        return Slot.builder()
                .name(SLOT_DATE)
                .checkFor(Expression.constant(false))
                .prompt(text(DATE_PROMPT));
    }

    private static EntitiesResult paris() {
        return EntitiesResult.resolve(
                List.of(new RecognizedEntity(ENTITY_CITY, CITY_PARIS, "paris", 0, 5)),
                Map.of(ENTITY_CITY, Set.of(CITY_PARIS))
        );
    }

    private static EntitiesResult noEntities() {
        return EntitiesResult.resolve(List.of(), Map.of(ENTITY_CITY, Set.of(CITY_PARIS)));
    }
}
