package com.chatcoach.domain.reply.model;

import java.util.List;

/**
 * Dialogs recognised in a chat screenshot, in on-screen order.
 */
public record ImageAnalysis(
        List<RecognizedDialog> dialogs,
        String scenario
) implements StagePayload {

    public record RecognizedDialog(String speaker, String text, boolean fromUser) {}

    public ImageAnalysis {
        dialogs = List.copyOf(dialogs);
    }

    public List<DialogEntry> toDialogEntries() {
        return dialogs.stream()
                .map(d -> new DialogEntry(d.speaker(), d.text()))
                .toList();
    }

    @Override
    public StageKind kind() {
        return StageKind.IMAGE_RESULT;
    }
}
