package org.processverify.engine.petriNet;

import org.processverify.engine.config.models.NamingConvention;
import org.processverify.engine.config.models.PetriNetSettings;
import org.processverify.engine.errors.GraphEngineException;
import org.processverify.engine.errors.Stage;
import org.processverify.engine.petriNet.models.Arc;
import org.processverify.engine.petriNet.models.PetriNet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes a {@link PetriNet} as PNML: {@code pnml > net > page} holding places,
 * transitions and arcs. Arc ids are the arc prefix followed by the arc index.
 */
public class PnmlWriter {
    private static final Logger log = LoggerFactory.getLogger(PnmlWriter.class);

    private final PetriNetSettings settings;
    private final NamingConvention naming;

    public PnmlWriter() {
        this(new PetriNetSettings(), new NamingConvention());
    }

    public PnmlWriter(PetriNetSettings settings, NamingConvention naming) {
        this.settings = settings;
        this.naming = naming;
    }

    public Document toDocument(PetriNet net) {
        Document doc;
        try {
            doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        } catch (Exception e) {
            throw new GraphEngineException("Failed to create PNML document", settings.netId, Stage.TRANSLATION, e);
        }

        Element pnmlEl = doc.createElement("pnml");
        doc.appendChild(pnmlEl);

        Element netEl = doc.createElement("net");
        netEl.setAttribute("id", settings.netId);
        netEl.setAttribute("type", settings.netType);
        pnmlEl.appendChild(netEl);

        Element pageEl = doc.createElement("page");
        pageEl.setAttribute("id", settings.pageId);
        netEl.appendChild(pageEl);

        for (String placeId : net.places()) {
            Element placeEl = doc.createElement("place");
            placeEl.setAttribute("id", placeId);
            placeEl.appendChild(textElement(doc, "name", placeId));
            Integer tokens = net.initialMarking().get(placeId);
            if (tokens != null) {
                placeEl.appendChild(textElement(doc, "initialMarking", String.valueOf(tokens)));
            }
            pageEl.appendChild(placeEl);
        }

        for (String transitionId : net.transitions()) {
            Element transitionEl = doc.createElement("transition");
            transitionEl.setAttribute("id", transitionId);
            transitionEl.appendChild(textElement(doc, "name", net.label(transitionId)));
            pageEl.appendChild(transitionEl);
        }

        int index = 0;
        for (Arc arc : net.arcs()) {
            Element arcEl = doc.createElement("arc");
            arcEl.setAttribute("id", naming.arc(index++));
            arcEl.setAttribute("source", arc.source());
            arcEl.setAttribute("target", arc.target());
            pageEl.appendChild(arcEl);
        }

        return doc;
    }

    public String toXml(PetriNet net) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");

            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(toDocument(net)), new StreamResult(writer));
            return writer.toString();
        } catch (Exception e) {
            throw new GraphEngineException("Failed to serialize PNML", settings.netId, Stage.TRANSLATION, e);
        }
    }

    /**
     * Writes the net to a PNML file, creating parent directories as needed.
     */
    public void write(PetriNet net, Path outputFile) throws IOException {
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputFile, toXml(net), StandardCharsets.UTF_8);
        log.info("Petri net saved to '{}' ({} places, {} transitions, {} arcs)",
                outputFile, net.places().size(), net.transitions().size(), net.arcs().size());
    }

    private static Element textElement(Document doc, String name, String text) {
        Element wrapper = doc.createElement(name);
        Element textEl = doc.createElement("text");
        textEl.setTextContent(text);
        wrapper.appendChild(textEl);
        return wrapper;
    }
}
