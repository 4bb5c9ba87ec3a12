package nl.tue.conformance.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import nl.tue.conformance.ExampleNets;

public class PetriNetValidatorTest {

	private static String invalid(final PetriNet net) {
		return assertThrows(PetriNetParseException.class, () -> PetriNetValidator.validate(net)).getMessage();
	}

	@Test
	public void validNetsPass() throws PetriNetParseException {
		PetriNet net = ExampleNets.weighted();
		assertSame(net, PetriNetValidator.validate(net));
		PetriNetValidator.validate(PetriNet.empty());
	}

	@Test
	public void duplicatePlaceIds() {
		PetriNet net = new PetriNet(Arrays.asList(new Place("p"), new Place("p")),
				Collections.<Transition>emptyList(), Collections.<Arc>emptyList());
		assertEquals("Duplicate place id: p", invalid(net));
	}

	@Test
	public void duplicateTransitionIds() {
		PetriNet net = new PetriNet(Collections.<Place>emptyList(),
				Arrays.asList(new Transition("t"), new Transition("t", "T")), Collections.<Arc>emptyList());
		assertEquals("Duplicate transition id: t", invalid(net));
	}

	@Test
	public void idsAreUniqueAcrossKinds() {
		PetriNet net = new PetriNet(Arrays.asList(new Place("x")), Arrays.asList(new Transition("x")),
				Collections.<Arc>emptyList());
		assertEquals("Id used for both a place and a transition: x", invalid(net));
	}

	@Test
	public void danglingArcs() {
		PetriNet net = new PetriNet(Arrays.asList(new Place("p")), Arrays.asList(new Transition("t")),
				Arrays.asList(new Arc("q", "t")));
		assertEquals("Arc.from not found: q", invalid(net));

		net = new PetriNet(Arrays.asList(new Place("p")), Arrays.asList(new Transition("t")),
				Arrays.asList(new Arc("t", "q")));
		assertEquals("Arc.to not found: q", invalid(net));
	}

	@Test
	public void negativeTokensAndWeights() {
		PetriNet net = new PetriNet(Arrays.asList(new Place("p", null, -1)), Collections.<Transition>emptyList(),
				Collections.<Arc>emptyList());
		assertEquals("Place p has a negative number of tokens: -1", invalid(net));

		net = new PetriNet(Arrays.asList(new Place("p")), Arrays.asList(new Transition("t")),
				Arrays.asList(new Arc("p", "t", 0)));
		assertEquals("Arc p -> t has weight 0, expected >= 1", invalid(net));
	}

	@Test
	public void emptyIds() {
		PetriNet net = new PetriNet(Arrays.asList(new Place("")), Collections.<Transition>emptyList(),
				Collections.<Arc>emptyList());
		assertEquals("Every place needs a non-empty id", invalid(net));
	}

	@Test
	public void arcsBetweenPlacesAreAllowed() throws PetriNetParseException {
		PetriNet net = new PetriNet(Arrays.asList(new Place("p"), new Place("q")),
				Collections.<Transition>emptyList(), Arrays.asList(new Arc("p", "q")));
		PetriNetValidator.validate(net);
	}
}
