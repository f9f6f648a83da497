package it.aw.conferencecrawler.model;

/**
 * Titolo e summary estratti dal modello di chat per un chunk.
 */
public record TitleSummary(String title, String summary) {

    public static final String FALLBACK_TITLE   = "Error processing title";
    public static final String FALLBACK_SUMMARY = "Error processing summary";

    /** Valori deterministici usati quando l'estrazione fallisce. */
    public static TitleSummary fallback() {
        return new TitleSummary(FALLBACK_TITLE, FALLBACK_SUMMARY);
    }
}
