package nl.tue.conformance.semantics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import nl.tue.conformance.ExampleNets;
import nl.tue.conformance.algorithms.Dijkstra;

public class PetriNetSimulatorTest {

	@Test
	public void sequentialNetHasASingleRun() {
		PetrinetSemantics semantics = new PetrinetSemantics(ExampleNets.queue());

		PetriNetSimulator.Run run = new PetriNetSimulator(semantics, 1).simulate(100);

		assertEquals(Arrays.asList("T0", "T1", "T2"), run.getFiredTransitions());
		assertEquals(Arrays.asList("Enqueue", "Begin", "Finish"), run.getTrace());
		assertTrue(semantics.isAccepting(run.getMarking()));
	}

	@Test
	public void invisibleTransitionsAreLeftOutOfTheTrace() {
		PetriNetSimulator.Run run = new PetriNetSimulator(new PetrinetSemantics(ExampleNets.withSilentStep()), 3)
				.simulate(100);

		assertEquals(Arrays.asList("A", "tau", "B"), run.getFiredTransitions());
		assertEquals(Arrays.asList("A", "B"), run.getTrace());
	}

	@Test
	public void sameSeedGivesSameRun() {
		PetrinetSemantics semantics = new PetrinetSemantics(ExampleNets.ambiguous());
		for (long seed = 0; seed < 10; seed++) {
			assertEquals(new PetriNetSimulator(semantics, seed).simulate(10).getFiredTransitions(),
					new PetriNetSimulator(semantics, seed).simulate(10).getFiredTransitions());
		}
	}

	@Test
	public void stepLimitIsRespected() {
		PetriNetSimulator.Run run = new PetriNetSimulator(new PetrinetSemantics(ExampleNets.runaway()), 5)
				.simulate(10);

		assertEquals(10, run.getFiredTransitions().size());
		assertTrue(run.getTrace().isEmpty());
		assertEquals(10, run.getMarking().get("p1"));
	}

	@Test
	public void simulatedTracesAlignPerfectly() {
		PetrinetSemantics semantics = new PetrinetSemantics(ExampleNets.ambiguous());
		for (long seed = 0; seed < 5; seed++) {
			PetriNetSimulator.Run run = new PetriNetSimulator(semantics, seed).simulate(10);
			assertEquals(0.0, new Dijkstra(semantics).run(run.getTrace(), 0).getCost());
		}
	}
}
