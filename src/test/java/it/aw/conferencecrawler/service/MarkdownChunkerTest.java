package it.aw.conferencecrawler.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownChunkerTest {

    private static String noWhitespace(String s) {
        return s.replaceAll("\\s", "");
    }

    private static int count(String s, String needle) {
        int n = 0;
        for (int i = s.indexOf(needle); i >= 0; i = s.indexOf(needle, i + needle.length())) n++;
        return n;
    }

    @Test
    @DisplayName("Empty or null input yields no chunks")
    void emptyInput() {
        assertTrue(MarkdownChunker.chunk("", 100).isEmpty());
        assertTrue(MarkdownChunker.chunk(null, 100).isEmpty());
        assertTrue(MarkdownChunker.chunk("   \n\n  ", 100).isEmpty());
    }

    @Test
    @DisplayName("Input shorter than max size yields exactly one trimmed chunk")
    void shortInput() {
        List<String> chunks = MarkdownChunker.chunk("  # CHI 2025\n\nHonolulu, Hawaii.  \n", 5000);
        assertEquals(List.of("# CHI 2025\n\nHonolulu, Hawaii."), chunks);
    }

    @Test
    @DisplayName("Concatenated chunks reproduce the text modulo boundary whitespace")
    void coversWholeText() {
        StringBuilder sb = new StringBuilder();
        for (int p = 0; p < 40; p++) {
            sb.append("## Track ").append(p).append("\n\n");
            for (int s = 0; s < 5; s++) {
                sb.append("Sentence ").append(s).append(" of paragraph ").append(p).append(" about HCI. ");
            }
            if (p % 7 == 3) {
                sb.append("\n\n```python\nfor i in range(10):\n\n    print(i)\n```\n");
            }
            sb.append("\n\n");
        }
        String text = sb.toString();

        for (int size : new int[]{40, 120, 333, 1000, 20_000}) {
            List<String> chunks = MarkdownChunker.chunk(text, size);
            assertEquals(noWhitespace(text), noWhitespace(String.join("", chunks)), "size=" + size);
            for (String c : chunks) {
                assertFalse(c.isBlank(), "no empty chunk for size=" + size);
                assertEquals(c, c.strip());
            }
        }
    }

    @Test
    @DisplayName("A fenced code block larger than max size is never split")
    void codeBlockKeptWhole() {
        String block = "```java\n" + "int x = 1;\n".repeat(40) + "```";
        String text = "Intro paragraph.\n\n" + block + "\n\nAfter the code. More prose follows here.";

        List<String> chunks = MarkdownChunker.chunk(text, 100);

        assertTrue(chunks.stream().anyMatch(c -> c.contains(block)), "block must be in a single chunk");
        for (String c : chunks) {
            assertEquals(0, count(c, "```") % 2, "unbalanced fence in chunk: " + c);
        }
        assertTrue(chunks.get(0).length() > 100, "chunk extended beyond max size");
    }

    @Test
    @DisplayName("Prefers the last paragraph break in the window")
    void paragraphBreak() {
        String text = "a".repeat(60) + "\n\n" + "b".repeat(60);
        assertEquals(List.of("a".repeat(60), "b".repeat(60)), MarkdownChunker.chunk(text, 100));
    }

    @Test
    @DisplayName("Falls back to the last sentence break, keeping the period")
    void sentenceBreak() {
        String text = "a".repeat(49) + ". " + "b".repeat(100);
        List<String> chunks = MarkdownChunker.chunk(text, 80);

        assertEquals("a".repeat(49) + ".", chunks.get(0));
        assertEquals(3, chunks.size());
        assertEquals("b".repeat(79), chunks.get(1));
    }

    @Test
    @DisplayName("Cuts at exactly max size when no break exists")
    void hardCut() {
        List<String> chunks = MarkdownChunker.chunk("x".repeat(250), 100);
        assertEquals(3, chunks.size());
        assertEquals(100, chunks.get(0).length());
        assertEquals(100, chunks.get(1).length());
        assertEquals(50, chunks.get(2).length());
    }

    @Test
    @DisplayName("A paragraph break early in the window still wins over a hard cut")
    void earlyParagraphBreakUsed() {
        String text = "a".repeat(10) + "\n\n" + "b".repeat(200);
        List<String> chunks = MarkdownChunker.chunk(text, 100);

        assertEquals("a".repeat(10), chunks.get(0));
        assertEquals("b".repeat(98), chunks.get(1));
        assertEquals(List.of("a".repeat(10), "b".repeat(98), "b".repeat(100), "bb"), chunks);
    }

    @Test
    @DisplayName("A sentence break early in the window still wins over a hard cut")
    void earlySentenceBreakUsed() {
        String text = "Hi. " + "b".repeat(200);
        List<String> chunks = MarkdownChunker.chunk(text, 100);

        assertEquals("Hi.", chunks.get(0));
        assertEquals("b".repeat(99), chunks.get(1));
    }

    @Test
    @DisplayName("Blank lines inside a code block are not used as paragraph breaks")
    void paragraphBreakInsideCodeIgnored() {
        String text = "p".repeat(40) + "\n\n"
                + "```\n" + "x".repeat(10) + "\n\n" + "y".repeat(10) + "\n```"
                + "z".repeat(100);
        List<String> chunks = MarkdownChunker.chunk(text, 100);

        assertEquals("p".repeat(40), chunks.get(0));
        assertTrue(chunks.get(1).startsWith("```"));
        assertEquals(2, count(chunks.get(1), "```"));
    }

    @Test
    @DisplayName("Unclosed fence extends to the end of the text")
    void unclosedFence() {
        String text = "Intro.\n\n```\n" + "code line\n".repeat(30);
        List<String> chunks = MarkdownChunker.chunk(text, 50);
        assertEquals(1, chunks.size());
    }

    @Test
    void rejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> MarkdownChunker.chunk("abc", 0));
    }
}
