package com.chicu.botjobs.host;

public record CommandResult(String replyText) {

    public static CommandResult empty() {
        return new CommandResult(null);
    }

    public boolean hasReply() {
        return replyText != null && !replyText.isBlank();
    }
}
