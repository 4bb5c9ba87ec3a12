package nl.tue.conformance.io;

import java.io.IOException;
import java.io.StringReader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import nl.tue.conformance.model.Arc;
import nl.tue.conformance.model.ArcType;
import nl.tue.conformance.model.PetriNet;
import nl.tue.conformance.model.PetriNetParseException;
import nl.tue.conformance.model.Place;
import nl.tue.conformance.model.Transition;

/**
 * Place/transition nets in PNML. Only the first net of a document is read;
 * its places, transitions and arcs may be nested in pages. Element names are
 * matched regardless of namespace. Graphics are ignored.
 */
public class PnmlCodec extends PetriNetCodec {

	private static final String NS = "http://www.pnml.org/version-2009/grammar/pnml";

	private static final String INHIBITOR = "inhibitor";

	@Override
	public PetriNetFormat getFormat() {
		return PetriNetFormat.PNML;
	}

	@Override
	public PetriNet read(String text) throws PetriNetParseException {
		Document doc;
		try {
			DocumentBuilder db = newFactory().newDocumentBuilder();
			doc = db.parse(new InputSource(new StringReader(text)));
		} catch (ParserConfigurationException e) {
			throw new PetriNetParseException("Cannot configure XML parser: " + e.getMessage(), e);
		} catch (SAXException e) {
			throw new PetriNetParseException("Input is not valid XML: " + e.getMessage(), e);
		} catch (IOException e) {
			throw new PetriNetParseException("Cannot read PNML: " + e.getMessage(), e);
		}

		NodeList nets = doc.getElementsByTagNameNS("*", "net");
		if (nets.getLength() == 0) {
			throw new PetriNetParseException("No <net> element found.");
		}
		Element net = (Element) nets.item(0);

		List<Place> places = new ArrayList<>();
		NodeList placeNodes = net.getElementsByTagNameNS("*", "place");
		for (int i = 0; i < placeNodes.getLength(); i++) {
			Element e = (Element) placeNodes.item(i);
			String id = e.getAttribute("id");
			String mark = childText(e, "initialMarking");
			int tokens = mark == null || stripBraces(mark).isEmpty() ? 0
					: parseCount(stripBraces(mark), "Initial marking of place " + id);
			places.add(new Place(id, childText(e, "name"), tokens));
		}

		List<Transition> transitions = new ArrayList<>();
		NodeList transitionNodes = net.getElementsByTagNameNS("*", "transition");
		for (int i = 0; i < transitionNodes.getLength(); i++) {
			Element e = (Element) transitionNodes.item(i);
			transitions.add(new Transition(e.getAttribute("id"), childText(e, "name")));
		}

		List<Arc> arcs = new ArrayList<>();
		NodeList arcNodes = net.getElementsByTagNameNS("*", "arc");
		for (int i = 0; i < arcNodes.getLength(); i++) {
			Element e = (Element) arcNodes.item(i);
			String source = e.getAttribute("source");
			String target = e.getAttribute("target");
			String inscription = childText(e, "inscription");
			int weight = inscription == null || stripBraces(inscription).isEmpty() ? Arc.DEFAULTWEIGHT
					: parseCount(stripBraces(inscription), "Inscription of arc " + source + " -> " + target);
			Element type = child(e, "type");
			ArcType arcType = type != null && INHIBITOR.equals(type.getAttribute("value")) ? ArcType.INHIBITOR
					: ArcType.STANDARD;
			arcs.add(new Arc(source, target, weight, arcType));
		}
		return new PetriNet(places, transitions, arcs);
	}

	@Override
	public void write(PetriNet net, Writer out) throws IOException {
		Document doc;
		try {
			doc = newFactory().newDocumentBuilder().newDocument();
		} catch (ParserConfigurationException e) {
			throw new IOException("Cannot configure XML writer", e);
		}
		Element pnml = doc.createElementNS(NS, "pnml");
		doc.appendChild(pnml);
		Element netElement = doc.createElementNS(NS, "net");
		netElement.setAttribute("id", "net1");
		netElement.setAttribute("type", "http://www.pnml.org/version-2009/grammar/ptnet");
		pnml.appendChild(netElement);
		Element page = doc.createElementNS(NS, "page");
		page.setAttribute("id", "page1");
		netElement.appendChild(page);

		for (Place p : net.getPlaces()) {
			Element el = doc.createElementNS(NS, "place");
			el.setAttribute("id", p.getId());
			if (p.getLabel() != null) {
				el.appendChild(textElement(doc, "name", p.getLabel()));
			}
			if (p.getTokens() != 0) {
				el.appendChild(textElement(doc, "initialMarking", Integer.toString(p.getTokens())));
			}
			page.appendChild(el);
		}
		for (Transition t : net.getTransitions()) {
			Element el = doc.createElementNS(NS, "transition");
			el.setAttribute("id", t.getId());
			if (t.getLabel() != null) {
				el.appendChild(textElement(doc, "name", t.getLabel()));
			}
			page.appendChild(el);
		}
		int a = 0;
		for (Arc arc : net.getArcs()) {
			Element el = doc.createElementNS(NS, "arc");
			el.setAttribute("id", "a" + a++);
			el.setAttribute("source", arc.getFrom());
			el.setAttribute("target", arc.getTo());
			if (arc.getWeight() != Arc.DEFAULTWEIGHT) {
				el.appendChild(textElement(doc, "inscription", Integer.toString(arc.getWeight())));
			}
			if (arc.isInhibitor()) {
				Element type = doc.createElementNS(NS, "type");
				type.setAttribute("value", INHIBITOR);
				el.appendChild(type);
			}
			page.appendChild(el);
		}

		try {
			TransformerFactory tf = TransformerFactory.newInstance();
			tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
			tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
			Transformer transformer = tf.newTransformer();
			transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
			transformer.setOutputProperty(OutputKeys.INDENT, "yes");
			transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
			transformer.transform(new DOMSource(doc), new StreamResult(out));
		} catch (TransformerException e) {
			throw new IOException("Cannot write PNML", e);
		}
	}

	private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
		DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
		dbf.setNamespaceAware(true);
		dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
		dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
		dbf.setXIncludeAware(false);
		dbf.setExpandEntityReferences(false);
		return dbf;
	}

	private static Element textElement(Document doc, String name, String value) {
		Element el = doc.createElementNS(NS, name);
		Element text = doc.createElementNS(NS, "text");
		text.setTextContent(value);
		el.appendChild(text);
		return el;
	}

	private static Element child(Element parent, String localName) {
		for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
			if (n.getNodeType() == Node.ELEMENT_NODE && localName.equals(localName(n))) {
				return (Element) n;
			}
		}
		return null;
	}

	/**
	 * Returns the untrimmed content of parent/localName/text, or null if absent.
	 */
	private static String childText(Element parent, String localName) {
		Element el = child(parent, localName);
		if (el == null) {
			return null;
		}
		Element text = child(el, "text");
		return text == null ? null : text.getTextContent();
	}

	private static String localName(Node n) {
		return n.getLocalName() == null ? n.getNodeName() : n.getLocalName();
	}

	private static String stripBraces(String s) {
		String t = s.trim();
		if (t.startsWith("{") && t.endsWith("}")) {
			t = t.substring(1, t.length() - 1).trim();
		}
		return t;
	}
}
