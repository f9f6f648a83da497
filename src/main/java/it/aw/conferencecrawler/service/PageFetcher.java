package it.aw.conferencecrawler.service;

import com.vladsch.flexmark.html2md.converter.FlexmarkHtmlConverter;
import it.aw.conferencecrawler.model.FetchResult;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Scarica una pagina con jsoup e ne restituisce il contenuto principale in markdown.
 * <p>
 * Una sola richiesta per URL, nessun retry. {@link #fetch(String)} non lancia mai:
 * ogni errore diventa un {@link FetchResult#failure(String)}.
 */
@Service
public class PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    private static final String BOILERPLATE = "script,style,noscript,nav,footer,header,aside,iframe,form";

    private final FlexmarkHtmlConverter converter = FlexmarkHtmlConverter.builder().build();
    private final int timeoutMs;
    private final String userAgent;

    public PageFetcher(@Value("${crawler.fetch.timeout-ms:15000}") int timeoutMs,
                       @Value("${crawler.fetch.user-agent:Mozilla/5.0 (ConferenceCrawler)}") String userAgent) {
        this.timeoutMs = timeoutMs;
        this.userAgent = userAgent;
    }

    public FetchResult fetch(String url) {
        try {
            Connection.Response response = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .timeout(timeoutMs)
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .execute();
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                return FetchResult.failure("HTTP " + response.statusCode() + " " + response.statusMessage());
            }
            String markdown = toMarkdown(response.parse());
            if (markdown.isBlank()) {
                return FetchResult.failure("pagina senza contenuto testuale");
            }
            return FetchResult.success(markdown);
        } catch (Exception e) {
            log.debug("Fetch fallito per {}", url, e);
            return FetchResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /** Rimuove il boilerplate e converte il contenuto principale in markdown. */
    String toMarkdown(Document doc) {
        doc.select(BOILERPLATE).remove();
        Element main = doc.selectFirst("main, article, #content, .content");
        if (main == null) main = doc.body();
        if (main == null) return "";
        return converter.convert(main.outerHtml()).strip();
    }
}
