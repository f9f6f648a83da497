package it.aw.conferencecrawler.model;

/**
 * Esito del rendering di una pagina.
 * Con {@code success=true} il markdown è valorizzato e {@code error} è null;
 * altrimenti {@code error} descrive il problema e il markdown è vuoto.
 */
public record FetchResult(boolean success, String markdown, String error) {

    public static FetchResult success(String markdown) {
        return new FetchResult(true, markdown, null);
    }

    public static FetchResult failure(String error) {
        return new FetchResult(false, "", error != null ? error : "unknown error");
    }
}
