package it.aw.conferencecrawler.tools;

import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import it.aw.conferencecrawler.service.RetrievalService;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Tool LangChain4j esposti all'agente che sintetizza le schede delle conferenze.
 * Delegano a {@link RetrievalService}; restituiscono sempre testo, mai eccezioni.
 */
@Component
public class ConferenceTools {

    private final RetrievalService retrieval;

    public ConferenceTools(RetrievalService retrieval) {
        this.retrieval = retrieval;
    }

    @Tool(name = "retrieve_relevant_documentation",
          value = "Retrieve the conference page chunks most relevant to the user query (RAG)")
    public String retrieveRelevantDocumentation(@P("The user's question or query") String userQuery) {
        return retrieval.searchDocumentation(userQuery);
    }

    @Tool(name = "list_conference_pages",
          value = "List the URLs of all ingested conference pages, sorted")
    public List<String> listConferencePages() {
        return retrieval.listPages();
    }

    @Tool(name = "get_page_content",
          value = "Retrieve the full content of an ingested conference page by combining its chunks in order")
    public String getPageContent(@P("The URL of the page to retrieve") String url) {
        return retrieval.getPage(url);
    }
}
