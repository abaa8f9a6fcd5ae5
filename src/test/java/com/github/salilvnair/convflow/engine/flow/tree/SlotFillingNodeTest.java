package com.github.salilvnair.convflow.engine.flow.tree;

import com.github.salilvnair.convflow.engine.context.DialogState;
import com.github.salilvnair.convflow.engine.context.EntitiesResult;
import com.github.salilvnair.convflow.engine.context.IntentsResult;
import com.github.salilvnair.convflow.engine.context.RecognizedEntity;
import com.github.salilvnair.convflow.engine.context.TurnContext;
import com.github.salilvnair.convflow.engine.flow.DialogFlow;
import com.github.salilvnair.convflow.engine.flow.DialogTurnResult;
import com.github.salilvnair.convflow.engine.flow.FlowResult;
import com.github.salilvnair.convflow.engine.journal.JournalEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.github.salilvnair.convflow.support.DialogFixtures.json;
import static com.github.salilvnair.convflow.support.DialogFixtures.message;
import static com.github.salilvnair.convflow.support.DialogFixtures.texts;
import static com.github.salilvnair.convflow.support.DialogFixtures.tree;
import static com.github.salilvnair.convflow.support.TestConstants.CITY_PARIS;
import static com.github.salilvnair.convflow.support.TestConstants.ENTITY_CITY;
import static com.github.salilvnair.convflow.support.TestConstants.LABEL_RESERVATION;
import static com.github.salilvnair.convflow.support.TestConstants.USER_TEXT_WEATHER;
import static com.github.salilvnair.convflow.support.TestConstants.USER_TEXT_WHATEVER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlotFillingNodeTest {

    private static final String USER_TEXT_BOOK = "book a table";

    private static final String RESERVATION_DIALOG = """
            {"dialog": [
              {"label": "reservation", "condition": "message.text == 'book a table'",
               "slot_filling": [
                 {"name": "city", "check_for": "entities.city", "prompt": "Which city?"}
               ],
               "response": "Booked for {{ slots.city }}"},
              {"condition": "message.text == 'what is the weather'", "response": "sunny"}
            ]}
            """;

    private static final String NOT_FOUND_DIALOG = """
            {"dialog": [
              {"label": "reservation", "condition": "message.text == 'book a table'",
               "slot_filling": [
                 {"name": "city", "check_for": "entities.city", "prompt": "Which city?",
                  "not_found": ["I did not get it", {"prompt_again": {}}]}
               ],
               "response": "Booked for {{ slots.city }}"}
            ]}
            """;

    private DialogFlow dialogFlow;
    private DialogState state;

    @BeforeEach
    void setUp() {
        dialogFlow = new DialogFlow(tree(RESERVATION_DIALOG));
        state = DialogState.empty();
    }

    @Test
    void slotFillingListensUntilTheSlotIsFilled() {
        TurnContext first = turnContext(USER_TEXT_BOOK, EntitiesResult.resolve(List.of(), cities()));
        DialogTurnResult firstResult = dialogFlow.turn(first);

        assertEquals(FlowResult.LISTEN, firstResult.result());
        assertEquals(List.of("Which city?"), texts(first));
        assertEquals(json("{\"slot_in_focus\": \"city\"}"), state.getComponent(LABEL_RESERVATION));
        assertEquals(
                json("{\"node_stack\": [[\"reservation\", \"slot_filling\"]]}"),
                state.getComponent(DialogFlow.ROOT_COMPONENT)
        );

        TurnContext second = turnContext(CITY_PARIS, paris());
        DialogTurnResult secondResult = dialogFlow.turn(second);

        assertEquals(FlowResult.DONE, secondResult.result());
        assertEquals(List.of("Booked for Paris"), texts(second));
        assertTrue(state.getComponents().isEmpty());
        assertTrue(state.getSlots().isEmpty());
    }

    @Test
    void digressionFromSlotFillingReturnsWithThePrompt() {
        dialogFlow.turn(turnContext(USER_TEXT_BOOK, EntitiesResult.resolve(List.of(), cities())));

        TurnContext digressed = turnContext(USER_TEXT_WEATHER, EntitiesResult.resolve(List.of(), cities()));
        DialogTurnResult result = dialogFlow.turn(digressed);

        assertEquals(FlowResult.LISTEN, result.result());
        assertEquals(List.of("sunny", "Which city?"), texts(digressed));
        assertFalse(state.getComponents().path(LABEL_RESERVATION).isMissingNode());

        TurnContext filled = turnContext(CITY_PARIS, paris());
        assertEquals(FlowResult.DONE, dialogFlow.turn(filled).result());
        assertEquals(List.of("Booked for Paris"), texts(filled));
    }

    @Test
    void slotFilledByTheTriggeringMessageRespondsAtOnce() {
        TurnContext ctx = turnContext(USER_TEXT_BOOK, paris());

        assertEquals(FlowResult.DONE, dialogFlow.turn(ctx).result());
        assertEquals(List.of("Booked for Paris"), texts(ctx));
    }

    @Test
    void unmatchedDigressionReturnsToSlotFillingWithNotFound() {
        dialogFlow = new DialogFlow(tree(NOT_FOUND_DIALOG));
        dialogFlow.turn(turnContext(USER_TEXT_BOOK, EntitiesResult.resolve(List.of(), cities())));

        TurnContext unmatched = turnContext(USER_TEXT_WHATEVER, EntitiesResult.resolve(List.of(), cities()));
        DialogTurnResult result = dialogFlow.turn(unmatched);

        assertEquals(FlowResult.LISTEN, result.result());
        assertEquals(List.of("I did not get it", "Which city?"), texts(unmatched));
        assertEquals(
                json("{\"node_stack\": [[\"reservation\", \"slot_filling\"]]}"),
                state.getComponent(DialogFlow.ROOT_COMPONENT)
        );
        assertEquals(json("{\"slot_in_focus\": \"city\"}"), state.getComponent(LABEL_RESERVATION));
        assertTrue(unmatched.getJournalEvents().stream().anyMatch(event -> event.is(JournalEventType.NOT_FOUND)));
    }

    private TurnContext turnContext(String text, EntitiesResult entities) {
        return message(text, IntentsResult.empty(), entities, state);
    }

    private static Map<String, Set<String>> cities() {
        return Map.of(ENTITY_CITY, Set.of(CITY_PARIS));
    }

    private static EntitiesResult paris() {
        return EntitiesResult.resolve(List.of(new RecognizedEntity(ENTITY_CITY, CITY_PARIS, "paris", 0, 5)), cities());
    }
}
