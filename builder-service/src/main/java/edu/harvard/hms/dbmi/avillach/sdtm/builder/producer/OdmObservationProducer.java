package edu.harvard.hms.dbmi.avillach.sdtm.builder.producer;

import edu.harvard.hms.dbmi.avillach.sdtm.data.record.Observation;
import edu.harvard.hms.dbmi.avillach.sdtm.data.record.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Produces observations from a CDISC ODM clinical data export.
 *
 * Walks ODM / ClinicalData / SubjectData / StudyEventData / FormData / ItemGroupData / ItemData and emits one observation per
 * ItemData. Elements are matched on local name, so namespaced and vendor-prefixed exports parse the same way. Elements outside this
 * hierarchy are ignored.
 */
public class OdmObservationProducer {
    private static final Logger log = LoggerFactory.getLogger(OdmObservationProducer.class);

    private static final String STUDY_SUBJECT_ID = "StudySubjectID";

    /**
     * Parses the whole file into a record store.
     */
    public RecordStore read(Path odmFile) throws IOException {
        List<Observation> observations = new ArrayList<>();
        processFile(odmFile, observations::add);
        return RecordStore.of(observations);
    }

    public void processFile(Path odmFile, Consumer<Observation> consumer) throws IOException {
        log.info("Processing ODM file: {}", odmFile);
        try (InputStream in = Files.newInputStream(odmFile)) {
            Document document = newDocumentBuilder().parse(in);
            int count = process(document.getDocumentElement(), consumer);
            log.info("Extracted {} observations from {}", count, odmFile.getFileName());
        } catch (SAXException e) {
            throw new IOException("Malformed ODM document: " + odmFile, e);
        }
    }

    private int process(Element root, Consumer<Observation> consumer) {
        int count = 0;
        int skipped = 0;
        for (Element clinicalData : children(root, "ClinicalData")) {
            String studyOid = attribute(clinicalData, "StudyOID");
            for (Element subjectData : children(clinicalData, "SubjectData")) {
                String studySubjectId = studySubjectId(subjectData);
                String subjectKey = attribute(subjectData, "SubjectKey");
                if (subjectKey == null) {
                    subjectKey = studySubjectId;
                }
                for (Element eventData : children(subjectData, "StudyEventData")) {
                    String eventOid = attribute(eventData, "StudyEventOID");
                    for (Element formData : children(eventData, "FormData")) {
                        String formOid = attribute(formData, "FormOID");
                        for (Element groupData : children(formData, "ItemGroupData")) {
                            String groupOid = attribute(groupData, "ItemGroupOID");
                            String repeatKey = attribute(groupData, "ItemGroupRepeatKey");
                            for (Element itemData : children(groupData, "ItemData")) {
                                String itemOid = attribute(itemData, "ItemOID");
                                if (itemOid == null) {
                                    skipped++;
                                    continue;
                                }
                                consumer.accept(new Observation(studyOid, subjectKey, studySubjectId, eventOid, formOid, groupOid,
                                    repeatKey, itemOid, attribute(itemData, "Value")));
                                count++;
                            }
                        }
                    }
                }
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} ItemData elements without an ItemOID", skipped);
        }
        return count;
    }

    /**
     * StudySubjectID is matched case-insensitively on local name, so vendor-namespaced attributes are found too.
     */
    private static String studySubjectId(Element subjectData) {
        NamedNodeMap attributes = subjectData.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            if (STUDY_SUBJECT_ID.equalsIgnoreCase(localName(attr)) && !attr.getValue().isEmpty()) {
                return attr.getValue();
            }
        }
        return null;
    }

    private static List<Element> children(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element element && localName.equals(localName(element))) {
                result.add(element);
            }
        }
        return result;
    }

    private static String localName(Node node) {
        String name = node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    /**
     * DOM reports absent attributes as "", which is indistinguishable from an empty value; both become null.
     */
    private static String attribute(Element element, String name) {
        String value = element.getAttribute(name);
        return value.isEmpty() ? null : value;
    }

    private static DocumentBuilder newDocumentBuilder() throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IOException("XML parser unavailable", e);
        }
    }
}
