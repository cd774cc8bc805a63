package org.processverify.engine.petriNet;

import org.processverify.engine.errors.Stage;
import org.processverify.engine.errors.StructuralParseException;
import org.processverify.engine.petriNet.models.PetriNet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads PNML back into a {@link PetriNet}. Elements are matched by local name, so documents
 * with or without the PNML namespace are accepted.
 */
public class PnmlReader {
    private static final Logger log = LoggerFactory.getLogger(PnmlReader.class);

    /**
     * @throws StructuralParseException if the file is missing, is not XML, or has no {@code net} element
     */
    public static PetriNet readPnmlFile(Path pnmlFile) {
        if (!Files.isRegularFile(pnmlFile)) {
            throw new StructuralParseException("PNML file not found", pnmlFile.toString(), Stage.SUBSTITUTION);
        }
        Document doc;
        try {
            doc = newDocumentBuilder().parse(pnmlFile.toFile());
        } catch (Exception e) {
            throw new StructuralParseException("Failed to parse PNML file", pnmlFile.toString(), Stage.SUBSTITUTION, e);
        }
        return toPetriNet(doc, pnmlFile.toString());
    }

    public static PetriNet readPnml(String pnmlXml) {
        Document doc;
        try {
            doc = newDocumentBuilder().parse(new InputSource(new StringReader(pnmlXml)));
        } catch (Exception e) {
            throw new StructuralParseException("Failed to parse PNML content", "<inline>", Stage.SUBSTITUTION, e);
        }
        return toPetriNet(doc, "<inline>");
    }

    private static DocumentBuilder newDocumentBuilder() throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder();
    }

    private static PetriNet toPetriNet(Document doc, String source) {
        NodeList nets = doc.getElementsByTagNameNS("*", "net");
        if (nets.getLength() == 0) {
            throw new StructuralParseException("PNML document has no 'net' element", source, Stage.SUBSTITUTION);
        }
        Element netEl = (Element) nets.item(0);
        PetriNet.Builder builder = PetriNet.builder();

        NodeList places = netEl.getElementsByTagNameNS("*", "place");
        for (int i = 0; i < places.getLength(); i++) {
            Element placeEl = (Element) places.item(i);
            String placeId = placeEl.getAttribute("id");
            if (placeId.isEmpty()) {
                continue;
            }
            String marking = nestedText(placeEl, "initialMarking");
            if (marking != null) {
                builder.markedPlace(placeId, parseTokens(marking, placeId, source));
            } else {
                builder.place(placeId);
            }
        }

        NodeList transitions = netEl.getElementsByTagNameNS("*", "transition");
        for (int i = 0; i < transitions.getLength(); i++) {
            Element transitionEl = (Element) transitions.item(i);
            String transitionId = transitionEl.getAttribute("id");
            if (transitionId.isEmpty()) {
                continue;
            }
            String label = nestedText(transitionEl, "name");
            builder.transition(transitionId, label == null ? transitionId : label);
        }

        NodeList arcs = netEl.getElementsByTagNameNS("*", "arc");
        for (int i = 0; i < arcs.getLength(); i++) {
            Element arcEl = (Element) arcs.item(i);
            String arcSource = arcEl.getAttribute("source");
            String arcTarget = arcEl.getAttribute("target");
            if (arcSource.isEmpty() || arcTarget.isEmpty()) {
                log.warn("Ignoring arc '{}' without source or target in '{}'", arcEl.getAttribute("id"), source);
                continue;
            }
            builder.arc(arcSource, arcTarget);
        }

        PetriNet net = builder.build();
        log.debug("Read PNML '{}': {} places, {} transitions, {} arcs",
                source, net.places().size(), net.transitions().size(), net.arcs().size());
        return net;
    }

    /**
     * Text of {@code <wrapper><text>..</text></wrapper>} directly below the element, or null.
     */
    private static String nestedText(Element parent, String wrapperName) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element wrapper && wrapperName.equals(wrapper.getLocalName())) {
                NodeList texts = wrapper.getElementsByTagNameNS("*", "text");
                if (texts.getLength() > 0) {
                    return texts.item(0).getTextContent().trim();
                }
            }
        }
        return null;
    }

    private static int parseTokens(String text, String placeId, String source) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new StructuralParseException(
                    "Invalid initial marking '" + text + "' in " + source, placeId, Stage.SUBSTITUTION, e);
        }
    }
}
