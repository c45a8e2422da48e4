package com.relpilot.plugin.config;

import java.util.List;

public final class Mentions {

    private Mentions() {
    }

    /**
     * Formats user mentions for a messaging platform, space separated. Entries already in the
     * platform's syntax are kept as-is.
     *
     * @return formatted text, or "" when there are no mentions
     */
    public static String buildMentionText(List<String> mentions, MentionFormat format) {
        if (mentions == null || mentions.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(mentions.size() * 20);
        for (int i = 0; i < mentions.size(); i++) {
            if (i > 0) sb.append(' ');
            String m = mentions.get(i);
            switch (format != null ? format : MentionFormat.PLAIN) {
                case SLACK -> {
                    if (m.startsWith("<")) {
                        sb.append(m);
                    } else if (m.startsWith("@")) {
                        sb.append('<').append(m).append('>');
                    } else {
                        sb.append("<@").append(m).append('>');
                    }
                }
                case DISCORD -> {
                    if (m.startsWith("<@") || m.startsWith("<#") || "@everyone".equals(m) || "@here".equals(m)) {
                        sb.append(m);
                    } else {
                        sb.append("<@").append(m).append('>');
                    }
                }
                default -> {
                    if (!m.startsWith("@")) sb.append('@');
                    sb.append(m);
                }
            }
        }
        return sb.toString();
    }
}
