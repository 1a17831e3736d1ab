package com.taskforge.core.react;

import com.taskforge.core.model.TranscriptEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Shrinks prior conversation history before it is sent to the model.
 * <p>
 * Only user and assistant messages are kept. Above {@code maxMessages}, the first
 * message and the last {@code recentKeep} survive, and the remaining budget is filled
 * with the shortest middle messages, restored to their original order.
 */
public final class TranscriptTrimmer {

    private TranscriptTrimmer() {}

    public static List<TranscriptEntry> trim(List<TranscriptEntry> history, int maxMessages, int recentKeep) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        List<TranscriptEntry> conversational = history.stream()
                .filter(e -> e.role() == TranscriptEntry.Role.USER || e.role() == TranscriptEntry.Role.ASSISTANT)
                .toList();
        if (conversational.size() <= maxMessages) {
            return conversational;
        }
        int size = conversational.size();
        List<TranscriptEntry> middle = conversational.subList(1, size - recentKeep);
        int middleBudget = Math.max(0, maxMessages - 1 - recentKeep);
        List<Integer> keptMiddle = IntStream.range(0, middle.size()).boxed()
                .sorted(Comparator.comparingInt((Integer i) -> middle.get(i).content().length()))
                .limit(middleBudget)
                .sorted()
                .toList();

        List<TranscriptEntry> trimmed = new ArrayList<>(maxMessages);
        trimmed.add(conversational.get(0));
        for (int i : keptMiddle) {
            trimmed.add(middle.get(i));
        }
        trimmed.addAll(conversational.subList(size - recentKeep, size));
        return trimmed;
    }
}
