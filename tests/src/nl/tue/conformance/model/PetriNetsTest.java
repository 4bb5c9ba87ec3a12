package nl.tue.conformance.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;

import org.junit.jupiter.api.Test;

import nl.tue.conformance.ExampleNets;

public class PetriNetsTest {

	@Test
	public void freshIdsSkipUsedOnes() {
		PetriNet net = ExampleNets.queue();

		assertEquals("P4", PetriNets.freshId(net, "P"));
		assertEquals("T3", PetriNets.freshId(net, "T"));
		assertEquals("x0", PetriNets.freshId(net, "x"));
	}

	@Test
	public void addingNodesLeavesTheOriginalUntouched() {
		PetriNet net = ExampleNets.queue();

		PetriNet bigger = PetriNets.addTransition(PetriNets.addPlace(net));
		assertEquals(4, net.getPlaces().size());
		assertEquals(5, bigger.getPlaces().size());
		assertEquals(4, bigger.getTransitions().size());
		assertTrue(bigger.isPlace("P4"));
		assertTrue(bigger.isTransition("T3"));
		assertTrue(bigger.getTransition("T3").isInvisible());
	}

	@Test
	public void duplicateNodesAreRejected() {
		PetriNet net = ExampleNets.queue();

		assertThrows(IllegalArgumentException.class, () -> PetriNets.addPlace(net, new Place("T0")));
		assertThrows(IllegalArgumentException.class, () -> PetriNets.addTransition(net, new Transition("P0")));
		assertThrows(IllegalArgumentException.class, () -> PetriNets.addPlace(net, new Place("N", null, -2)));
	}

	@Test
	public void arcsMustConnectPlacesAndTransitions() {
		PetriNet net = ExampleNets.queue();

		assertThrows(IllegalArgumentException.class, () -> PetriNets.addArc(net, new Arc("P0", "P1")));
		assertThrows(IllegalArgumentException.class, () -> PetriNets.addArc(net, new Arc("T0", "T1")));
		assertThrows(IllegalArgumentException.class, () -> PetriNets.addArc(net, new Arc("P0", "X")));
		assertThrows(IllegalArgumentException.class, () -> PetriNets.addArc(net, new Arc("P0", "T1", 0)));

		PetriNet withArc = PetriNets.addArc(net, new Arc("P3", "T0", 2));
		assertEquals(net.getArcs().size() + 1, withArc.getArcs().size());
	}

	@Test
	public void removingANodeRemovesItsArcs() {
		PetriNet net = PetriNets.removeNode(ExampleNets.queue(), "T1");

		assertNull(net.getTransition("T1"));
		assertEquals(4, net.getArcs().size());
		for (Arc a : net.getArcs()) {
			assertFalse(a.getFrom().equals("T1") || a.getTo().equals("T1"));
		}
		PetriNet same = ExampleNets.queue();
		assertSame(same, PetriNets.removeNode(same, "nothing"));
	}

	@Test
	public void tokensCanBeSet() {
		PetriNet net = PetriNets.setTokens(ExampleNets.queue(), "P2", 4);

		assertEquals(4, net.getPlace("P2").getTokens());
		assertEquals("Processing", net.getPlace("P2").getLabel());
		assertThrows(IllegalArgumentException.class, () -> PetriNets.setTokens(net, "T0", 1));
		assertThrows(IllegalArgumentException.class, () -> PetriNets.setTokens(net, "P2", -1));

		PetriNet cleared = PetriNets.withTokens(net, Collections.singletonMap("P3", 2));
		assertEquals(0, cleared.getPlace("P0").getTokens());
		assertEquals(0, cleared.getPlace("P2").getTokens());
		assertEquals(2, cleared.getPlace("P3").getTokens());
	}

	@Test
	public void netsAreValues() {
		assertEquals(ExampleNets.weighted(), ExampleNets.weighted());
		assertEquals(ExampleNets.weighted().hashCode(), ExampleNets.weighted().hashCode());
		assertFalse(ExampleNets.queue().equals(ExampleNets.weighted()));
	}
}
