package nl.tue.conformance.io;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import nl.tue.conformance.model.Arc;
import nl.tue.conformance.model.ArcType;
import nl.tue.conformance.model.PetriNet;
import nl.tue.conformance.model.PetriNetParseException;
import nl.tue.conformance.model.Place;
import nl.tue.conformance.model.Transition;

/**
 * The canonical JSON form
 * 
 * <pre>
 * {"places":[{"id":"P0","label":"Start","tokens":1}],
 *  "transitions":[{"id":"T0","label":"Enqueue"}],
 *  "arcs":[{"from":"P0","to":"T0","weight":2,"arcType":"inhibitor"}]}
 * </pre>
 * 
 * Default values (no label, 0 tokens, weight 1, standard arcs) are left out
 * when writing.
 */
public class JsonCodec extends PetriNetCodec {

	private static final ObjectMapper mapper = new ObjectMapper()
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);

	@Override
	public PetriNetFormat getFormat() {
		return PetriNetFormat.JSON;
	}

	@Override
	public PetriNet read(String text) throws PetriNetParseException {
		JsonNode root;
		try {
			root = mapper.readTree(text);
		} catch (JsonProcessingException e) {
			throw new PetriNetParseException("Input is not valid JSON: " + e.getOriginalMessage(), e);
		}
		if (root == null || !root.isObject()) {
			throw new PetriNetParseException("Root must be an object.");
		}

		List<Place> places = new ArrayList<>();
		for (JsonNode p : asArray(root.get("places"), "places")) {
			String id = asString(p.get("id"), "place.id");
			String label = asOptionalString(p.get("label"), "place.label");
			places.add(new Place(id, label, asInt(p.get("tokens"), "place.tokens", 0)));
		}
		List<Transition> transitions = new ArrayList<>();
		for (JsonNode t : asArray(root.get("transitions"), "transitions")) {
			transitions.add(new Transition(asString(t.get("id"), "transition.id"),
					asOptionalString(t.get("label"), "transition.label")));
		}
		List<Arc> arcs = new ArrayList<>();
		for (JsonNode a : asArray(root.get("arcs"), "arcs")) {
			String from = asString(a.get("from"), "arc.from");
			String to = asString(a.get("to"), "arc.to");
			int weight = asInt(a.get("weight"), "arc.weight", Arc.DEFAULTWEIGHT);
			String type = asOptionalString(a.get("arcType"), "arc.arcType");
			arcs.add(new Arc(from, to, weight, arcType(type)));
		}
		return new PetriNet(places, transitions, arcs);
	}

	@Override
	public void write(PetriNet net, Writer out) throws IOException {
		mapper.writerWithDefaultPrettyPrinter().writeValue(out, toTree(net));
	}

	/**
	 * Returns the JSON tree of the net.
	 * 
	 * @param net
	 * @return
	 */
	public ObjectNode toTree(PetriNet net) {
		ObjectNode root = mapper.createObjectNode();
		ArrayNode places = root.putArray("places");
		for (Place p : net.getPlaces()) {
			ObjectNode node = places.addObject();
			node.put("id", p.getId());
			if (p.getLabel() != null) {
				node.put("label", p.getLabel());
			}
			if (p.getTokens() != 0) {
				node.put("tokens", p.getTokens());
			}
		}
		ArrayNode transitions = root.putArray("transitions");
		for (Transition t : net.getTransitions()) {
			ObjectNode node = transitions.addObject();
			node.put("id", t.getId());
			if (t.getLabel() != null) {
				node.put("label", t.getLabel());
			}
		}
		ArrayNode arcs = root.putArray("arcs");
		for (Arc a : net.getArcs()) {
			ObjectNode node = arcs.addObject();
			node.put("from", a.getFrom());
			node.put("to", a.getTo());
			if (a.getWeight() != Arc.DEFAULTWEIGHT) {
				node.put("weight", a.getWeight());
			}
			if (a.isInhibitor()) {
				node.put("arcType", "inhibitor");
			}
		}
		return root;
	}

	private static ArcType arcType(String type) throws PetriNetParseException {
		if (type == null || type.equals("standard") || type.equals("normal")) {
			return ArcType.STANDARD;
		} else if (type.equals("inhibitor")) {
			return ArcType.INHIBITOR;
		}
		throw new PetriNetParseException("Unknown arc.arcType: " + type);
	}

	private static JsonNode asArray(JsonNode value, String name) throws PetriNetParseException {
		if (value == null || !value.isArray()) {
			throw new PetriNetParseException(name + " must be an array.");
		}
		return value;
	}

	private static String asString(JsonNode value, String name) throws PetriNetParseException {
		if (value == null || !value.isTextual()) {
			throw new PetriNetParseException(name + " must be a string.");
		}
		return value.textValue();
	}

	private static String asOptionalString(JsonNode value, String name) throws PetriNetParseException {
		if (value == null || value.isNull()) {
			return null;
		}
		return asString(value, name);
	}

	private static int asInt(JsonNode value, String name, int defaultValue) throws PetriNetParseException {
		if (value == null || value.isNull()) {
			return defaultValue;
		}
		if (!value.isIntegralNumber() || !value.canConvertToInt()) {
			throw new PetriNetParseException(name + " must be an integer.");
		}
		return value.intValue();
	}
}
