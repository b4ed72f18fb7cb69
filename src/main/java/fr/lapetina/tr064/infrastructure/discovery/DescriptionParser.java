package fr.lapetina.tr064.infrastructure.discovery;

import fr.lapetina.tr064.domain.error.MalformedDescriptorException;
import fr.lapetina.tr064.domain.model.Device;
import fr.lapetina.tr064.domain.model.DeviceDescription;
import fr.lapetina.tr064.domain.model.Service;
import fr.lapetina.tr064.domain.model.SystemVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static fr.lapetina.tr064.infrastructure.discovery.XmlSupport.childElements;
import static fr.lapetina.tr064.infrastructure.discovery.XmlSupport.childText;
import static fr.lapetina.tr064.infrastructure.discovery.XmlSupport.localName;
import static fr.lapetina.tr064.infrastructure.discovery.XmlSupport.text;

/**
 * Parses a device descriptor document (tr64desc.xml, igddesc.xml).
 *
 * Known elements are mapped onto the model; anything else is ignored.
 * Services come back without actions, those are loaded from their own documents.
 */
public final class DescriptionParser {

    private static final Logger log = LoggerFactory.getLogger(DescriptionParser.class);

    public DeviceDescription parse(String xml) {
        Document document = XmlSupport.parse(xml);
        Element root = document.getDocumentElement();
        if (!"root".equals(localName(root))) {
            throw new MalformedDescriptorException("Expected <root> element but found <" + localName(root) + ">");
        }

        String specVersion = null;
        SystemVersion systemVersion = SystemVersion.UNKNOWN;
        Device device = null;

        for (Element element : childElements(root)) {
            switch (localName(element)) {
                case "specVersion" -> specVersion = parseSpecVersion(element);
                case "systemVersion" -> systemVersion = parseSystemVersion(element);
                case "device" -> device = parseDevice(element);
                default -> log.debug("Ignoring descriptor element: <{}>", localName(element));
            }
        }

        if (device == null) {
            throw new MalformedDescriptorException("Descriptor has no <device> element");
        }
        return new DeviceDescription(specVersion, systemVersion, device);
    }

    private String parseSpecVersion(Element element) {
        String major = childText(element, "major");
        String minor = childText(element, "minor");
        if (major == null) {
            return null;
        }
        return minor == null ? major : major + "." + minor;
    }

    private SystemVersion parseSystemVersion(Element element) {
        return new SystemVersion(
                childText(element, "HW"),
                childText(element, "Major"),
                childText(element, "Minor"),
                childText(element, "Patch"),
                childText(element, "Buildnumber"),
                childText(element, "Display"));
    }

    private Device parseDevice(Element element) {
        Map<String, String> fields = new HashMap<>();
        List<Service> services = new ArrayList<>();
        List<Device> devices = new ArrayList<>();

        for (Element child : childElements(element)) {
            String name = localName(child);
            switch (name) {
                case "deviceType", "friendlyName", "manufacturer", "manufacturerURL",
                        "modelDescription", "modelName", "modelNumber", "modelURL",
                        "UDN", "presentationURL" -> fields.put(name, text(child));
                case "serviceList" -> {
                    for (Element service : childElements(child, "service")) {
                        services.add(parseService(service));
                    }
                }
                case "deviceList" -> {
                    for (Element subDevice : childElements(child, "device")) {
                        devices.add(parseDevice(subDevice));
                    }
                }
                default -> log.debug("Ignoring device element: <{}>", name);
            }
        }

        return new Device(
                fields.get("deviceType"),
                fields.get("friendlyName"),
                fields.get("manufacturer"),
                fields.get("manufacturerURL"),
                fields.get("modelDescription"),
                fields.get("modelName"),
                fields.get("modelNumber"),
                fields.get("modelURL"),
                fields.get("UDN"),
                fields.get("presentationURL"),
                services,
                devices);
    }

    private Service parseService(Element element) {
        String serviceId = childText(element, "serviceId");
        if (serviceId == null || serviceId.isEmpty()) {
            throw new MalformedDescriptorException("Service without <serviceId>");
        }
        return new Service(
                childText(element, "serviceType"),
                serviceId,
                childText(element, "controlURL"),
                childText(element, "eventSubURL"),
                childText(element, "SCPDURL"),
                Map.of(),
                Map.of());
    }
}
