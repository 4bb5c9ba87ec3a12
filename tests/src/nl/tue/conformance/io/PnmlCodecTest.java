package nl.tue.conformance.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import nl.tue.conformance.ExampleNets;
import nl.tue.conformance.model.Arc;
import nl.tue.conformance.model.PetriNet;
import nl.tue.conformance.model.PetriNetParseException;
import nl.tue.conformance.model.Place;
import nl.tue.conformance.model.Transition;

public class PnmlCodecTest {

	private static String resource(String name) throws IOException {
		try (InputStream in = PnmlCodecTest.class.getResourceAsStream(name)) {
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
	}

	@Test
	public void readsPagedDocuments() throws IOException, PetriNetParseException {
		PetriNet net = PetriNetParser.parse(resource("sample.pnml"), PetriNetFormat.PNML);

		assertEquals(2, net.getPlaces().size());
		assertEquals(1, net.getTransitions().size());
		assertEquals(2, net.getArcs().size());
		assertEquals("Input Place", net.getPlace("p1").getLabel());
		assertEquals(2, net.getPlace("p1").getTokens());
		assertEquals(0, net.getPlace("p2").getTokens());
		assertEquals("Process", net.getTransition("t1").getLabel());
		assertEquals(new Arc("p1", "t1"), net.getArcs().get(0));
	}

	@Test
	public void roundTripsNets() throws PetriNetParseException {
		PnmlCodec codec = new PnmlCodec();
		for (PetriNet net : new PetriNet[] { ExampleNets.queue(), ExampleNets.weighted(), PetriNet.empty() }) {
			assertEquals(net, codec.read(codec.toString(net)));
		}
	}

	@Test
	public void labelsKeepSurroundingWhitespace() throws PetriNetParseException {
		PetriNet net = new PetriNet(Arrays.asList(new Place("p", " Start ", 1)),
				Arrays.asList(new Transition("t", "  go")), Arrays.asList(new Arc("p", "t")));
		PnmlCodec codec = new PnmlCodec();

		PetriNet read = codec.read(codec.toString(net));
		assertEquals(" Start ", read.getPlace("p").getLabel());
		assertEquals("  go", read.getTransition("t").getLabel());
		assertEquals(net, read);
	}

	@Test
	public void writesPtnetDocuments() {
		String pnml = PetriNetParser.toString(ExampleNets.weighted(), PetriNetFormat.PNML);

		assertTrue(pnml.contains("http://www.pnml.org/version-2009/grammar/ptnet"), pnml);
		assertTrue(pnml.contains("<page id=\"page1\">"), pnml);
		assertTrue(pnml.contains("<text>Take two</text>"), pnml);
		assertTrue(pnml.contains("<type value=\"inhibitor\"/>"), pnml);
		// default weights are left out
		assertEquals(2, count(pnml, "<inscription>"));
	}

	@Test
	public void writingIsDeterministic() {
		assertEquals(PetriNetParser.toString(ExampleNets.queue(), PetriNetFormat.PNML),
				PetriNetParser.toString(ExampleNets.queue(), PetriNetFormat.PNML));
	}

	@Test
	public void toleratesNamespacesAndBraces() throws PetriNetParseException {
		String pnml = "<pnml xmlns=\"http://www.pnml.org/version-2009/grammar/pnml\"><net id=\"n\">"
				+ "<place id=\"p\"><initialMarking><text> {3} </text></initialMarking></place>"
				+ "<transition id=\"t\"/>"
				+ "<arc id=\"a\" source=\"p\" target=\"t\"><inscription><text>{2}</text></inscription></arc>"
				+ "</net></pnml>";

		PetriNet net = PetriNetParser.parse(pnml, PetriNetFormat.PNML);
		assertEquals(3, net.getPlace("p").getTokens());
		assertNull(net.getPlace("p").getLabel());
		assertTrue(net.getTransition("t").isInvisible());
		assertEquals(2, net.getArcs().get(0).getWeight());
	}

	@Test
	public void rejectsMalformedInput() {
		assertThrows(PetriNetParseException.class, () -> PetriNetParser.parse("<pnml><net>", PetriNetFormat.PNML));
		assertThrows(PetriNetParseException.class, () -> PetriNetParser.parse("<pnml/>", PetriNetFormat.PNML));
		assertThrows(PetriNetParseException.class, () -> PetriNetParser.parse(
				"<pnml><net id=\"n\"><place id=\"p\"><initialMarking><text>many</text></initialMarking></place></net></pnml>",
				PetriNetFormat.PNML));
	}

	@Test
	public void rejectsDoctypes() {
		String xxe = "<?xml version=\"1.0\"?><!DOCTYPE pnml [<!ENTITY x SYSTEM \"file:///etc/passwd\">]>"
				+ "<pnml><net id=\"n\"><place id=\"&x;\"/></net></pnml>";

		assertThrows(PetriNetParseException.class, () -> PetriNetParser.parse(xxe, PetriNetFormat.PNML));
	}

	@Test
	public void validationRunsAfterParsing() {
		String pnml = "<pnml><net id=\"n\"><place id=\"p\"/><arc id=\"a\" source=\"p\" target=\"q\"/></net></pnml>";

		PetriNetParseException e = assertThrows(PetriNetParseException.class,
				() -> PetriNetParser.parse(pnml, PetriNetFormat.PNML));
		assertEquals("Arc.to not found: q", e.getMessage());
	}

	private static int count(String s, String part) {
		int n = 0;
		for (int i = s.indexOf(part); i >= 0; i = s.indexOf(part, i + 1)) {
			n++;
		}
		return n;
	}
}
