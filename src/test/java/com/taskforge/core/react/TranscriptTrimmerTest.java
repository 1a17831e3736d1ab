package com.taskforge.core.react;

import com.taskforge.core.model.TranscriptEntry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TranscriptTrimmerTest {

    @Test
    void emptyAndNullHistory() {
        assertEquals(List.of(), TranscriptTrimmer.trim(null, 20, 5));
        assertEquals(List.of(), TranscriptTrimmer.trim(List.of(), 20, 5));
    }

    @Test
    void dropsObservationsEvenUnderTheLimit() {
        List<TranscriptEntry> history = List.of(
                TranscriptEntry.user("q"),
                TranscriptEntry.observation("read_file", "data"),
                TranscriptEntry.assistant("a"));

        assertEquals(List.of(history.get(0), history.get(2)), TranscriptTrimmer.trim(history, 20, 5));
    }

    @Test
    void keepsFirstRecentAndShortestMiddleInOrder() {
        List<TranscriptEntry> history = new ArrayList<>();
        history.add(TranscriptEntry.user("first"));
        history.add(TranscriptEntry.assistant("a much longer middle message"));
        history.add(TranscriptEntry.user("short"));
        history.add(TranscriptEntry.assistant("another long middle message"));
        history.add(TranscriptEntry.user("mid"));
        history.add(TranscriptEntry.assistant("recent one"));
        history.add(TranscriptEntry.user("recent two"));

        List<TranscriptEntry> trimmed = TranscriptTrimmer.trim(history, 5, 2);

        assertEquals(List.of("first", "short", "mid", "recent one", "recent two"),
                trimmed.stream().map(TranscriptEntry::content).toList());
    }

    @Test
    void zeroMiddleBudget() {
        List<TranscriptEntry> history = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            history.add(TranscriptEntry.user("m" + i));
        }

        List<TranscriptEntry> trimmed = TranscriptTrimmer.trim(history, 3, 2);

        assertEquals(List.of("m0", "m8", "m9"), trimmed.stream().map(TranscriptEntry::content).toList());
    }
}
