package nl.tue.conformance.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.ObjectNode;

import nl.tue.conformance.ExampleNets;
import nl.tue.conformance.model.ArcType;
import nl.tue.conformance.model.PetriNet;
import nl.tue.conformance.model.PetriNetParseException;

public class JsonCodecTest {

	private static String error(String json) {
		return assertThrows(PetriNetParseException.class, () -> PetriNetParser.parse(json, PetriNetFormat.JSON))
				.getMessage();
	}

	@Test
	public void readsTheCanonicalForm() throws PetriNetParseException {
		String json = "{\"places\":[{\"id\":\"P0\",\"label\":\"Start\",\"tokens\":1},{\"id\":\"P1\"}],"
				+ "\"transitions\":[{\"id\":\"T0\",\"label\":\"Go\"},{\"id\":\"T1\",\"label\":null}],"
				+ "\"arcs\":[{\"from\":\"P0\",\"to\":\"T0\",\"weight\":2},{\"from\":\"T0\",\"to\":\"P1\",\"arcType\":\"standard\"},"
				+ "{\"from\":\"P1\",\"to\":\"T1\",\"arcType\":\"inhibitor\"}]}";

		PetriNet net = PetriNetParser.parse(json, PetriNetFormat.JSON);

		assertEquals(1, net.getPlace("P0").getTokens());
		assertEquals("Start", net.getPlace("P0").getLabel());
		assertEquals(0, net.getPlace("P1").getTokens());
		assertTrue(net.getTransition("T1").isInvisible());
		assertEquals(2, net.getArcs().get(0).getWeight());
		assertEquals(ArcType.STANDARD, net.getArcs().get(1).getType());
		assertEquals(ArcType.INHIBITOR, net.getArcs().get(2).getType());
	}

	@Test
	public void roundTripsNets() throws PetriNetParseException {
		JsonCodec codec = new JsonCodec();
		for (PetriNet net : new PetriNet[] { ExampleNets.queue(), ExampleNets.weighted(), PetriNet.empty() }) {
			assertEquals(net, codec.read(codec.toString(net)));
		}
	}

	@Test
	public void defaultsAreLeftOut() {
		ObjectNode tree = new JsonCodec().toTree(ExampleNets.weighted());

		assertFalse(tree.get("places").get(1).has("tokens"));
		assertFalse(tree.get("places").get(2).has("label"));
		assertEquals(3, tree.get("places").get(0).get("tokens").intValue());
		assertFalse(tree.get("arcs").get(1).has("weight"));
		assertEquals("inhibitor", tree.get("arcs").get(2).get("arcType").textValue());
		assertNull(tree.get("arcs").get(0).get("arcType"));
	}

	@Test
	public void reportsStructuralErrors() {
		assertEquals("Root must be an object.", error("[]"));
		assertEquals("places must be an array.", error("{\"transitions\":[],\"arcs\":[]}"));
		assertEquals("place.id must be a string.", error("{\"places\":[{\"id\":1}],\"transitions\":[],\"arcs\":[]}"));
		assertEquals("place.tokens must be an integer.",
				error("{\"places\":[{\"id\":\"p\",\"tokens\":1.5}],\"transitions\":[],\"arcs\":[]}"));
		assertEquals("Unknown arc.arcType: reset", error(
				"{\"places\":[{\"id\":\"p\"}],\"transitions\":[{\"id\":\"t\"}],\"arcs\":[{\"from\":\"p\",\"to\":\"t\",\"arcType\":\"reset\"}]}"));
		assertTrue(error("{\"places\":").startsWith("Input is not valid JSON"));
	}

	@Test
	public void reportsValidationErrors() {
		assertEquals("Duplicate place id: p",
				error("{\"places\":[{\"id\":\"p\"},{\"id\":\"p\"}],\"transitions\":[],\"arcs\":[]}"));
		assertEquals("Place p has a negative number of tokens: -2",
				error("{\"places\":[{\"id\":\"p\",\"tokens\":-2}],\"transitions\":[],\"arcs\":[]}"));
		assertEquals("Arc.from not found: x",
				error("{\"places\":[{\"id\":\"p\"}],\"transitions\":[],\"arcs\":[{\"from\":\"x\",\"to\":\"p\"}]}"));
	}

	@Test
	public void nullInputIsRejected() {
		assertThrows(PetriNetParseException.class, () -> PetriNetParser.parse(null, PetriNetFormat.JSON));
	}
}
