package org.processverify.engine.petriNet;

import org.processverify.engine.config.models.NamingConvention;
import org.processverify.engine.config.models.PetriNetSettings;
import org.processverify.engine.petriNet.models.PetriNet;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import static org.junit.jupiter.api.Assertions.*;

class PnmlWriterTest {

    private static PetriNet sampleNet() {
        return PetriNet.builder()
                .markedPlace("p_start_Main", 1)
                .place("p_pre_T1")
                .place("p_post_T1")
                .transition("t_T1", "t_T1")
                .arc("p_start_Main", "p_pre_T1")
                .arc("p_pre_T1", "t_T1")
                .arc("t_T1", "p_post_T1")
                .build();
    }

    @Test
    void shouldWritePnmlStructure() {
        Document doc = new PnmlWriter().toDocument(sampleNet());

        Element root = doc.getDocumentElement();
        assertEquals("pnml", root.getTagName());

        Element net = (Element) root.getElementsByTagName("net").item(0);
        assertEquals("bpmn_converted_net", net.getAttribute("id"));
        assertEquals(PetriNetSettings.PNML_CORE_MODEL, net.getAttribute("type"));
        assertEquals("page1", ((Element) net.getElementsByTagName("page").item(0)).getAttribute("id"));

        assertEquals(3, doc.getElementsByTagName("place").getLength());
        assertEquals(1, doc.getElementsByTagName("transition").getLength());
        assertEquals(1, doc.getElementsByTagName("initialMarking").getLength());

        NodeList arcs = doc.getElementsByTagName("arc");
        assertEquals(3, arcs.getLength());
        assertEquals("arc_0", ((Element) arcs.item(0)).getAttribute("id"));
        assertEquals("arc_2", ((Element) arcs.item(2)).getAttribute("id"));
        assertEquals("t_T1", ((Element) arcs.item(2)).getAttribute("source"));
    }

    @Test
    void shouldUseConfiguredNetAttributes() {
        PetriNetSettings settings = new PetriNetSettings();
        settings.netId = "order_net";
        NamingConvention naming = new NamingConvention();
        naming.arcPrefix = "a";

        String xml = new PnmlWriter(settings, naming).toXml(sampleNet());

        assertTrue(xml.contains("id=\"order_net\""));
        assertTrue(xml.contains("id=\"a0\""));
        assertTrue(xml.startsWith("<?xml"));
    }

    @Test
    void shouldWriteEmptyNet() {
        Document doc = new PnmlWriter().toDocument(PetriNet.empty());

        assertEquals(1, doc.getElementsByTagName("page").getLength());
        assertEquals(0, doc.getElementsByTagName("place").getLength());
    }
}
