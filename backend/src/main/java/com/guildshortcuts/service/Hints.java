package com.guildshortcuts.service;

import java.util.List;

/**
 * Formats "known names" hints for not-found replies.
 */
public final class Hints {

    public static final int MAX_LISTED = 10;

    private Hints() {
    }

    public static String knownItems(String label, List<String> items) {
        if (items.isEmpty()) {
            return "This server has no " + label + ".";
        }
        StringBuilder sb = new StringBuilder("Existing ").append(label).append(": ");
        sb.append(String.join(", ", items.subList(0, Math.min(MAX_LISTED, items.size()))));
        if (items.size() > MAX_LISTED) {
            sb.append(" (+").append(items.size() - MAX_LISTED).append(" more)");
        }
        return sb.toString();
    }
}
