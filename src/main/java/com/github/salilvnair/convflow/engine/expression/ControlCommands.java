package com.github.salilvnair.convflow.engine.expression;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.DialogFlowException;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Control command vocabularies and their recognition in scenario output.
 */
@UtilityClass
public class ControlCommands {

    // node response
    public static final String JUMP_TO = "jump_to";
    public static final String LISTEN = "listen";
    public static final String END = "end";
    public static final String FOLLOWUP = "followup";

    // slot filling
    public static final String MOVE_ON = "move_on";
    public static final String PROMPT_AGAIN = "prompt_again";
    public static final String LISTEN_AGAIN = "listen_again";
    public static final String RESPONSE = "response";

    public static final Set<String> NODE_RESPONSE = Set.of(JUMP_TO, LISTEN, END, FOLLOWUP);
    public static final Set<String> SLOT_FOUND = Set.of(MOVE_ON, PROMPT_AGAIN, LISTEN_AGAIN, RESPONSE);
    public static final Set<String> SLOT_NOT_FOUND = Set.of(PROMPT_AGAIN, LISTEN_AGAIN, RESPONSE);
    public static final Set<String> SLOT_PROMPT = Set.of(LISTEN_AGAIN, RESPONSE);
    public static final Set<String> SLOT_HANDLER = Set.of(MOVE_ON, RESPONSE);

    /**
     * The control command carried by the given command object, if any.
     *
     * @throws DialogFlowException the object carries more than one control command
     */
    public static Optional<String> find(ObjectNode command, Set<String> vocabulary) {
        List<String> found = new ArrayList<>();
        Iterator<String> names = command.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (vocabulary.contains(name)) {
                found.add(name);
            }
        }
        if (found.size() > 1) {
            throw new DialogFlowException(
                    DialogFlowErrorCode.AMBIGUOUS_CONTROL_COMMAND,
                    "Command " + command + " contains more than one control command: " + found
            );
        }
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }
}
