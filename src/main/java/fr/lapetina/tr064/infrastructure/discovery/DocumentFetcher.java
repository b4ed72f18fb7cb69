package fr.lapetina.tr064.infrastructure.discovery;

/**
 * Source of descriptor and action-schema documents.
 */
@FunctionalInterface
public interface DocumentFetcher {

    /**
     * Returns the text of the document at {@code location}.
     *
     * @param location a document name or path such as {@code tr64desc.xml} or {@code /deviceinfoSCPD.xml}
     * @throws fr.lapetina.tr064.domain.error.RouterException if the document cannot be fetched
     */
    String fetch(String location);
}
