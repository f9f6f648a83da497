package it.aw.conferencecrawler.config;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configura i bean LangChain4j.
 *
 * ChatLanguageModel: OpenAI (default gpt-4o-mini), usato per titolo e summary dei chunk.
 * EmbeddingModel:    OpenAI text-embedding-3-small (1536 dimensioni) oppure, con
 *                    inference.embedding.provider=local, AllMiniLM-L6-v2 quantizzato
 *                    in locale senza API key (384 dimensioni). In quel caso va
 *                    impostato anche inference.embedding.dimension=384.
 */
@Configuration
public class LangChain4jConfig {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jConfig.class);

    @Value("${openai.api-key:}")
    private String apiKey;

    @Value("${openai.timeout-seconds:60}")
    private long timeoutSeconds;

    @Bean
    public ChatLanguageModel chatModel(@Value("${openai.chat-model:gpt-4o-mini}") String modelName) {
        log.info("Inizializzazione ChatLanguageModel: OpenAI {}", modelName);
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(0.0)
                .responseFormat("json_object")
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }

    @Bean
    public EmbeddingModel embeddingModel(
            @Value("${inference.embedding.provider:openai}") String provider,
            @Value("${openai.embedding-model:text-embedding-3-small}") String modelName) {
        if ("local".equalsIgnoreCase(provider)) {
            log.info("Inizializzazione EmbeddingModel: AllMiniLmL6V2Quantized (locale)");
            return new AllMiniLmL6V2QuantizedEmbeddingModel();
        }
        log.info("Inizializzazione EmbeddingModel: OpenAI {}", modelName);
        return OpenAiEmbeddingModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }
}
