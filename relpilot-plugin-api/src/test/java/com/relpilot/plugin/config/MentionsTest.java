package com.relpilot.plugin.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MentionsTest {

    @Test
    void buildMentionText_plain() {
        assertEquals("@alice @bob", Mentions.buildMentionText(List.of("alice", "@bob"), MentionFormat.PLAIN));
    }

    @Test
    void buildMentionText_slack() {
        assertEquals("<@U123> <@here> <!channel>",
                Mentions.buildMentionText(List.of("U123", "@here", "<!channel>"), MentionFormat.SLACK));
    }

    @Test
    void buildMentionText_discord() {
        assertEquals("<@123> <@&456> <#789> @everyone @here",
                Mentions.buildMentionText(List.of("123", "<@&456>", "<#789>", "@everyone", "@here"), MentionFormat.DISCORD));
    }

    @Test
    void buildMentionText_emptyInputGivesEmptyText() {
        assertEquals("", Mentions.buildMentionText(List.of(), MentionFormat.SLACK));
        assertEquals("", Mentions.buildMentionText(null, MentionFormat.SLACK));
    }
}
