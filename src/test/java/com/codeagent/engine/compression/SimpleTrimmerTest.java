package com.codeagent.engine.compression;

import com.codeagent.engine.model.ContentBlock;
import com.codeagent.engine.model.Message;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SimpleTrimmerTest {

    @Test
    void trim_longHistory_keepsSystemAndMostRecent() {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system("sys"));
        for (int i = 0; i < 199; i++) {
            messages.add(Message.user("m" + i));
        }

        List<Message> trimmed = SimpleTrimmer.trim(messages, 50);

        assertThat(trimmed).hasSizeLessThanOrEqualTo(50);
        assertThat(trimmed.get(0).getRole()).isEqualTo(Message.Role.system);
        assertThat(trimmed.get(trimmed.size() - 1).textContent()).contains("m198");
    }

    @Test
    void trim_shortHistory_returnsCopy() {
        List<Message> messages = List.of(Message.system("sys"), Message.user("hi"));

        List<Message> trimmed = SimpleTrimmer.trim(messages, 50);

        assertThat(trimmed).isEqualTo(messages).isNotSameAs(messages);
    }

    @Test
    void trim_dropsLeadingOrphanedToolResults() {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system("sys"));
        for (int i = 0; i < 10; i++) {
            messages.add(Message.assistant(List.of(ContentBlock.toolUse("t" + i, "bash", Map.of()))));
            messages.add(Message.toolResult("t" + i, false, "out" + i));
        }

        // 21 messages; the last 3 start with a tool result
        List<Message> trimmed = SimpleTrimmer.trim(messages, 4);

        assertThat(trimmed.get(0).getRole()).isEqualTo(Message.Role.system);
        assertThat(trimmed.get(1).getRole()).isEqualTo(Message.Role.assistant);
        assertThat(trimmed).hasSize(3);
    }

    @Test
    void trim_withoutSystemMessage_keepsTail() {
        List<Message> messages = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            messages.add(Message.user("m" + i));
        }

        List<Message> trimmed = SimpleTrimmer.trim(messages, SimpleTrimmer.DEFAULT_MAX_MESSAGES);

        assertThat(trimmed).hasSizeLessThanOrEqualTo(SimpleTrimmer.DEFAULT_MAX_MESSAGES);
        assertThat(trimmed.get(trimmed.size() - 1).textContent()).contains("m99");
    }
}
