package uk.gegc.aimeter.features.ai.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.aimeter.features.ai.domain.exception.InvalidConversationException;
import uk.gegc.aimeter.features.ai.domain.exception.MessageTooLongException;
import uk.gegc.aimeter.features.ai.domain.model.ChatMessage;
import uk.gegc.aimeter.features.ai.domain.model.ChatRole;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Normalises caller-supplied history before admission: drops system messages, enforces the
 * per-message limit and trims the oldest messages to the history budget.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationPolicy {

    private final ConversationProperties properties;

    public List<ChatMessage> prepare(List<ChatMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            throw new InvalidConversationException("At least one message is required");
        }

        List<ChatMessage> filtered = messages.stream()
                .filter(message -> message.role() != ChatRole.SYSTEM)
                .toList();
        if (filtered.size() != messages.size()) {
            log.debug("Dropped {} caller-supplied system messages", messages.size() - filtered.size());
        }
        if (filtered.isEmpty()) {
            throw new InvalidConversationException("Conversation has no user or assistant messages");
        }

        for (ChatMessage message : filtered) {
            if (message.length() > properties.getMaxMessageChars()) {
                throw new MessageTooLongException(message.length(), properties.getMaxMessageChars());
            }
        }

        return trimHistory(filtered);
    }

    /**
     * Keeps the newest messages that fit the history budget. The latest message is always kept.
     */
    List<ChatMessage> trimHistory(List<ChatMessage> messages) {
        Deque<ChatMessage> kept = new ArrayDeque<>();
        int total = 0;
        for (int i = messages.size() - 1; i >= 0; i--) {
            ChatMessage message = messages.get(i);
            if (!kept.isEmpty() && total + message.length() > properties.getMaxHistoryChars()) {
                break;
            }
            kept.addFirst(message);
            total += message.length();
        }
        if (kept.size() < messages.size()) {
            log.debug("Trimmed conversation history from {} to {} messages", messages.size(), kept.size());
        }
        return List.copyOf(kept);
    }
}
