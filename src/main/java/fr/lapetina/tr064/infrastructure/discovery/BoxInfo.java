package fr.lapetina.tr064.infrastructure.discovery;

import fr.lapetina.tr064.domain.error.MalformedDescriptorException;
import fr.lapetina.tr064.domain.error.ResourceUnavailableException;
import fr.lapetina.tr064.domain.error.RouterConnectionException;
import org.w3c.dom.Element;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the firmware update-check document the router's web interface publishes.
 */
public final class BoxInfo {

    public static final String LOCATION = "/jason_boxinfo.xml";

    private BoxInfo() {
    }

    /**
     * Returns the document's fields by local name in document order,
     * e.g. {@code Name -> "FRITZ!Box 7590"}, {@code Version -> "154.07.29"}.
     *
     * @param fetcher fetcher bound to the web interface, not the TR-064 port
     * @throws ResourceUnavailableException if the document is not published
     * @throws MalformedDescriptorException if the answer is not XML
     * @throws RouterConnectionException    on transport failure
     */
    public static Map<String, String> read(DocumentFetcher fetcher) {
        Element root = XmlSupport.parse(fetcher.fetch(LOCATION)).getDocumentElement();
        Map<String, String> fields = new LinkedHashMap<>();
        for (Element element : XmlSupport.childElements(root)) {
            fields.put(XmlSupport.localName(element), XmlSupport.text(element));
        }
        return Collections.unmodifiableMap(fields);
    }
}
