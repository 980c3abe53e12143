package uk.gegc.aimeter.features.ai.domain.model;

public record ChatMessage(ChatRole role, String content) {

    public static ChatMessage user(String content) {
        return new ChatMessage(ChatRole.USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ChatRole.ASSISTANT, content);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(ChatRole.SYSTEM, content);
    }

    public int length() {
        return content == null ? 0 : content.length();
    }
}
