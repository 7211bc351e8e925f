package com.casepilot.core.replay;

import com.casepilot.core.executor.BoundedCallExecutor;
import com.casepilot.testsupport.ScriptedLLMClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParaphraseGeneratorTest {

    private static final String MESSAGE = "My $15,000 wire from 4 days ago has not arrived.";

    private final BoundedCallExecutor executor = new BoundedCallExecutor(2);

    @AfterEach
    void tearDown() {
        executor.destroy();
    }

    @Test
    void testSameSeedGivesSameVariants() {
        ScriptedLLMClient llm = new ScriptedLLMClient().onRolePrompt(ParaphraseGeneratorTest::firstLine);
        ParaphraseGenerator generator = new ParaphraseGenerator(llm, executor, Duration.ofSeconds(2));

        List<String> first = generator.generate(MESSAGE, 5, 42L);
        List<String> second = generator.generate(MESSAGE, 5, 42L);

        assertEquals(5, first.size());
        assertEquals(first, second);
        assertTrue(llm.getRoleTemperatures().stream().allMatch(t -> t == 0.0));
    }

    @Test
    void testUnseededRunUsesParaphraserTemperature() {
        ScriptedLLMClient llm = new ScriptedLLMClient().onRolePrompt(ParaphraseGeneratorTest::firstLine);

        new ParaphraseGenerator(llm, executor, Duration.ofSeconds(2)).generate(MESSAGE, 2, null);

        assertEquals(List.of(0.7, 0.7), llm.getRoleTemperatures());
    }

    @Test
    void testPromptKeepsOriginalMessage() {
        ScriptedLLMClient llm = new ScriptedLLMClient().onRolePrompt(p -> "Reworded.");

        new ParaphraseGenerator(llm, executor, Duration.ofSeconds(2)).generate(MESSAGE, 1, 7L);

        assertTrue(llm.getRolePrompts().get(0).contains("<<<\n" + MESSAGE + "\n>>>"));
    }

    @Test
    void testFailedCallsFallBackToTemplates() {
        ScriptedLLMClient llm = new ScriptedLLMClient().onRolePrompt(p -> {
            throw new IllegalStateException("rate limited");
        });

        List<String> variants = new ParaphraseGenerator(llm, executor, Duration.ofSeconds(2))
                .generate(MESSAGE, 5, 3L);

        assertEquals(5, variants.size());
        assertEquals(5, new HashSet<>(variants).size(), "each slot gets a different template");
        assertTrue(variants.stream().allMatch(v -> v.contains(MESSAGE)));
    }

    @Test
    void testBlankReplyFallsBackAndQuotesAreStripped() {
        ScriptedLLMClient llm = new ScriptedLLMClient().onRolePrompt(p ->
                p.contains("frustrated") || p.contains("terse") ? "   " : "\"Where is my wire?\"");

        List<String> variants = new ParaphraseGenerator(llm, executor, Duration.ofSeconds(2))
                .generate(MESSAGE, 8, 11L);

        for (String variant : variants) {
            assertFalse(variant.isBlank());
            assertTrue(variant.equals("Where is my wire?") || variant.contains(MESSAGE));
        }
    }

    @Test
    void testRejectsNonPositiveCount() {
        ParaphraseGenerator generator = new ParaphraseGenerator(new ScriptedLLMClient(), executor, Duration.ofSeconds(1));
        assertThrows(IllegalArgumentException.class, () -> generator.generate(MESSAGE, 0, null));
    }

    @Test
    void testClean() {
        assertEquals("hello", ParaphraseGenerator.clean("  \"hello\" "));
        assertEquals("", ParaphraseGenerator.clean(null));
        assertEquals("\"", ParaphraseGenerator.clean("\""));
    }

    private static String firstLine(String prompt) {
        return prompt.lines().findFirst().orElse("");
    }
}
