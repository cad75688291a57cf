package com.example.Lily.history;

import com.example.Lily.model.CommitReason;
import com.example.Lily.model.Message;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryConversationHistoryTest {

    @Test
    void shouldKeepAppendOrder() {
        InMemoryConversationHistory history = new InMemoryConversationHistory();

        history.append(Message.user("one"));
        history.appendAll(List.of(Message.agent("two", CommitReason.ACCEPTED), Message.user("three")));

        assertEquals(List.of("one", "two", "three"), history.snapshot().stream().map(Message::content).toList());
    }

    @Test
    void shouldHandOutStableSnapshots() {
        InMemoryConversationHistory history = new InMemoryConversationHistory();
        history.append(Message.user("one"));

        List<Message> before = history.snapshot();
        history.append(Message.user("two"));

        assertEquals(1, before.size());
        assertThrows(UnsupportedOperationException.class, () -> before.add(Message.user("x")));
    }

    @Test
    void shouldClearOnResetAndStayClearOnSecondReset() {
        InMemoryConversationHistory history = new InMemoryConversationHistory();
        history.append(Message.user("one"));

        history.reset();
        history.reset();

        assertTrue(history.snapshot().isEmpty());
    }
}
