package com.chatcoach.domain.reply.model;

import java.time.Instant;
import java.util.regex.Pattern;

/**
 * One line of the conversation. Timestamp is optional.
 */
public record DialogEntry(String speaker, String text, Instant timestamp) {

    private static final Pattern IMAGE_URL = Pattern.compile(
            "^https?://\\S+\\.(png|jpe?g|gif|webp|bmp)(\\?\\S*)?$", Pattern.CASE_INSENSITIVE);

    public DialogEntry(String speaker, String text) {
        this(speaker, text, null);
    }

    /**
     * Entries whose whole text is an image URL are treated as image messages.
     */
    public boolean isImage() {
        return text != null && IMAGE_URL.matcher(text.strip()).matches();
    }

    public DialogEntry withText(String newText) {
        return new DialogEntry(speaker, newText, timestamp);
    }
}
