package it.aw.conferencecrawler.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Divide il markdown di una pagina in frammenti ordinati di dimensione limitata.
 * <p>
 * Priorità dei punti di taglio per ogni finestra di {@code maxSize} caratteri:
 * <ol>
 *   <li>mai dentro un blocco di codice delimitato da <code>```</code>: se la finestra
 *       termina dentro un blocco iniziato nella finestra, il chunk si estende fino
 *       alla fence di chiusura, anche oltre {@code maxSize}</li>
 *   <li>ultima riga vuota (fine paragrafo) nella finestra</li>
 *   <li>ultimo punto seguito da whitespace (fine frase)</li>
 *   <li>taglio netto a {@code maxSize}</li>
 * </ol>
 * Le righe vuote e i punti dentro un blocco di codice non valgono come punto di taglio.
 * Ogni carattere del testo finisce in esattamente un chunk; ai bordi viene rimosso
 * solo il whitespace e i chunk vuoti vengono scartati.
 */
public class MarkdownChunker {

    public static final int DEFAULT_CHUNK_SIZE = 5000;

    private static final String FENCE = "```";
    private static final String PARAGRAPH_BREAK = "\n\n";

    /** Blocco di codice: da inizio fence di apertura a fine fence di chiusura (esclusivo). */
    record CodeBlock(int start, int end) {
        boolean contains(int offset) {
            return offset > start && offset < end;
        }
    }

    private MarkdownChunker() {}

    /**
     * @param text    testo della pagina (null o vuoto producono una lista vuota)
     * @param maxSize dimensione massima di una finestra, in caratteri
     * @return chunk non vuoti, nell'ordine del testo
     */
    public static List<String> chunk(String text, int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize deve essere > 0 (ricevuto: " + maxSize + ")");
        }
        List<String> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }

        List<CodeBlock> blocks = findCodeBlocks(text);
        int length = text.length();
        int start = 0;
        while (start < length) {
            int end = start + maxSize;
            if (end >= length) {
                addIfNotBlank(chunks, text.substring(start));
                break;
            }

            CodeBlock open = blockAround(end, start, blocks);
            if (open != null) {
                end = open.end();
            } else {
                int paragraph = lastParagraphBreak(text, start, end, blocks);
                if (paragraph > 0) {
                    end = paragraph;
                } else {
                    int sentence = lastSentenceBreak(text, start, end, blocks);
                    if (sentence > 0) end = sentence;
                }
            }

            addIfNotBlank(chunks, text.substring(start, end));
            start = end;
        }
        return chunks;
    }

    /** Accoppia le fence in ordine; una fence non chiusa arriva fino a fine testo. */
    static List<CodeBlock> findCodeBlocks(String text) {
        List<CodeBlock> blocks = new ArrayList<>();
        int from = 0;
        while (true) {
            int open = text.indexOf(FENCE, from);
            if (open < 0) break;
            int close = text.indexOf(FENCE, open + FENCE.length());
            if (close < 0) {
                blocks.add(new CodeBlock(open, text.length()));
                break;
            }
            blocks.add(new CodeBlock(open, close + FENCE.length()));
            from = close + FENCE.length();
        }
        return blocks;
    }

    /** Blocco iniziato nella finestra che contiene l'offset di fine finestra, se esiste. */
    private static CodeBlock blockAround(int end, int windowStart, List<CodeBlock> blocks) {
        for (CodeBlock b : blocks) {
            if (b.start() >= windowStart && b.contains(end)) return b;
            if (b.start() >= end) break;
        }
        return null;
    }

    private static boolean insideBlock(int offset, List<CodeBlock> blocks) {
        for (CodeBlock b : blocks) {
            if (b.contains(offset)) return true;
            if (b.start() >= offset) break;
        }
        return false;
    }

    /** Offset della riga vuota più a destra nella finestra (mai l'inizio), oppure -1. */
    private static int lastParagraphBreak(String text, int start, int end, List<CodeBlock> blocks) {
        int idx = text.lastIndexOf(PARAGRAPH_BREAK, end - PARAGRAPH_BREAK.length());
        while (idx > start) {
            if (!insideBlock(idx, blocks)) return idx;
            idx = text.lastIndexOf(PARAGRAPH_BREAK, idx - 1);
        }
        return -1;
    }

    /** Offset subito dopo l'ultimo punto seguito da whitespace nella finestra, oppure -1. */
    private static int lastSentenceBreak(String text, int start, int end, List<CodeBlock> blocks) {
        for (int i = end - 2; i >= start; i--) {
            if (text.charAt(i) == '.' && Character.isWhitespace(text.charAt(i + 1))
                    && !insideBlock(i + 1, blocks)) {
                return i + 1;
            }
        }
        return -1;
    }

    private static void addIfNotBlank(List<String> chunks, String raw) {
        String trimmed = raw.strip();
        if (!trimmed.isEmpty()) chunks.add(trimmed);
    }
}
