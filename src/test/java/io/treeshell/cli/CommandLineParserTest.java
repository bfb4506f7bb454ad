package io.treeshell.cli;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandLineParserTest {
    @Test
    void parseTokensShouldSplitByWhitespace() {
        List<String> tokens = CommandLineParser.parseTokens("  jump   0.0.2.1.1   {\"message\": \"hi\"} ");
        assertEquals(List.of("jump", "0.0.2.1.1", "{\"message\":", "\"hi\"}"), tokens);
        assertTrue(CommandLineParser.parseTokens("   ").isEmpty());
    }

    @Test
    void rawTailShouldKeepInnerSpacing() {
        String line = "jump  system.echo.1.1   {\"message\": \"two  spaces\"}";
        assertEquals("{\"message\": \"two  spaces\"}", CommandLineParser.rawTail(line, 2));
        assertEquals("", CommandLineParser.rawTail("jump system.echo", 2));
        assertEquals("a -> b", CommandLineParser.rawTail("chain a -> b", 1));
    }

    @Test
    void isWriteCommandShouldRecognizeMutations() {
        assertTrue(CommandLineParser.isWriteCommand("approve"));
        assertTrue(CommandLineParser.isWriteCommand("SHORTCUT"));
        assertTrue(CommandLineParser.isWriteCommand("reload"));
        assertFalse(CommandLineParser.isWriteCommand("nav"));
        assertFalse(CommandLineParser.isWriteCommand(""));
    }
}
