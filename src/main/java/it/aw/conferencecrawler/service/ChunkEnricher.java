package it.aw.conferencecrawler.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import it.aw.conferencecrawler.model.ChunkEnrichment;
import it.aw.conferencecrawler.model.TitleSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Arricchisce un chunk con titolo, summary ed embedding delegando ai modelli LangChain4j.
 * <p>
 * Nessun metodo propaga eccezioni: un errore del modello di chat produce
 * {@link TitleSummary#fallback()}, un errore del modello di embedding produce
 * un vettore di zeri della dimensione configurata. Il servizio è stateless e
 * può essere usato in parallelo su chunk diversi.
 */
@Service
public class ChunkEnricher {

    private static final Logger log = LoggerFactory.getLogger(ChunkEnricher.class);

    static final int SUMMARY_INPUT_LENGTH = 1000;

    static final String SYSTEM_PROMPT = """
            You extract titles and summaries from fragments of academic conference web pages.
            Return a JSON object with exactly two keys: "title" and "summary".
            - title: if the fragment looks like the start of a page, use the page title; \
            otherwise derive a short descriptive title. If the fragment is only code, \
            the title must name what the code is about.
            - summary: 2-3 sentences covering the main points (conference name, dates, \
            location, topics) present in the fragment.
            Return only the JSON object.""";

    private final ChatLanguageModel chatModel;
    private final EmbeddingModel embeddingModel;
    private final ObjectMapper objectMapper;
    private final int dimension;

    public ChunkEnricher(ChatLanguageModel chatModel,
                         EmbeddingModel embeddingModel,
                         ObjectMapper objectMapper,
                         @Value("${inference.embedding.dimension:1536}") int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("inference.embedding.dimension deve essere > 0");
        }
        this.chatModel = chatModel;
        this.embeddingModel = embeddingModel;
        this.objectMapper = objectMapper;
        this.dimension = dimension;
    }

    /** Titolo, summary ed embedding di un chunk; mai un'eccezione. */
    public ChunkEnrichment enrich(String content, String url) {
        TitleSummary ts = titleAndSummary(content, url);
        float[] embedding = embed(content);
        return new ChunkEnrichment(ts.title(), ts.summary(), embedding);
    }

    /**
     * Estrae titolo e summary dai primi {@value #SUMMARY_INPUT_LENGTH} caratteri del chunk.
     */
    public TitleSummary titleAndSummary(String content, String url) {
        String head = content.length() > SUMMARY_INPUT_LENGTH
                ? content.substring(0, SUMMARY_INPUT_LENGTH) + "..."
                : content;
        List<ChatMessage> messages = List.of(
                SystemMessage.from(SYSTEM_PROMPT),
                UserMessage.from("URL: " + url + "\n\nContent:\n" + head));
        try {
            Response<AiMessage> response = chatModel.generate(messages);
            return parseTitleSummary(response.content().text());
        } catch (Exception e) {
            log.warn("Titolo/summary non disponibili per {}: {}", url, e.getMessage());
            return TitleSummary.fallback();
        }
    }

    /**
     * Embedding dell'intero testo. Un vettore di dimensione diversa da quella
     * configurata viene trattato come errore.
     */
    public float[] embed(String text) {
        try {
            Embedding embedding = embeddingModel.embed(text).content();
            float[] vector = embedding.vector();
            if (vector.length != dimension) {
                throw new IllegalStateException("dimensione embedding " + vector.length
                        + ", attesa " + dimension);
            }
            return vector;
        } catch (Exception e) {
            log.warn("Embedding non disponibile, uso vettore nullo: {}", e.getMessage());
            return zeroVector();
        }
    }

    public float[] zeroVector() {
        return new float[dimension];
    }

    public int dimension() {
        return dimension;
    }

    private TitleSummary parseTitleSummary(String raw) throws Exception {
        JsonNode node = objectMapper.readTree(stripCodeFence(raw));
        JsonNode title = node.get("title");
        JsonNode summary = node.get("summary");
        if (title == null || summary == null || title.asText().isBlank() || summary.asText().isBlank()) {
            throw new IllegalArgumentException("risposta senza title/summary: " + raw);
        }
        return new TitleSummary(title.asText().strip(), summary.asText().strip());
    }

    /** Alcuni modelli racchiudono il JSON in un blocco ```json ... ```. */
    static String stripCodeFence(String raw) {
        String s = raw == null ? "" : raw.strip();
        if (s.startsWith("```")) {
            int firstNewline = s.indexOf('\n');
            int lastFence = s.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                s = s.substring(firstNewline + 1, lastFence).strip();
            }
        }
        return s;
    }
}
