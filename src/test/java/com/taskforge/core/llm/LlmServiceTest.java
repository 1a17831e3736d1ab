package com.taskforge.core.llm;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LlmServiceTest {

    @Test
    void stripsJsonFence() {
        assertEquals("{\"a\":1}", LlmService.stripCodeFence("```json\n{\"a\":1}\n```"));
    }

    @Test
    void stripsBareFence() {
        assertEquals("[1, 2]", LlmService.stripCodeFence("  ```\n[1, 2]\n```  "));
    }

    @Test
    void leavesPlainJsonAlone() {
        assertEquals("{\"a\":1}", LlmService.stripCodeFence("{\"a\":1}"));
    }
}
