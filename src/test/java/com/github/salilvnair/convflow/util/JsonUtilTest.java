package com.github.salilvnair.convflow.util;

import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.github.salilvnair.convflow.support.DialogFixtures.json;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class JsonUtilTest {

    @Test
    void commandIsASingleKeyObject() {
        ObjectNode command = JsonUtil.command("jump_to", Map.of("node", "target"));

        assertEquals(json("{\"jump_to\": {\"node\": \"target\"}}"), command);
    }

    @Test
    void toPlainConvertsContainersAndScalars() {
        assertEquals(Map.of("a", List.of(1, "b", true)), JsonUtil.toPlain(json("{\"a\": [1, \"b\", true]}")));
        assertNull(JsonUtil.toPlain(NullNode.getInstance()));
        assertNull(JsonUtil.toPlain(null));
    }

    @Test
    void toJsonKeepsInsertionOrder() {
        ObjectNode node = JsonUtil.object();
        node.put("b", 1);
        node.putArray("a").add("x");

        assertEquals("{\"b\":1,\"a\":[\"x\"]}", JsonUtil.toJson(node));
    }
}
