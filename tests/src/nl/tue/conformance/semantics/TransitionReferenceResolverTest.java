package nl.tue.conformance.semantics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import nl.tue.conformance.ExampleNets;

public class TransitionReferenceResolverTest {

	@Test
	public void idsWinOverLabels() {
		ResolveResult result = TransitionReferenceResolver.resolve(ExampleNets.withSilentStep(),
				Arrays.asList("A", "tau", "B"));

		assertEquals(Arrays.asList("A", "tau", "B"), result.getIds());
		assertTrue(result.getUnknown().isEmpty());
		assertTrue(result.getWarnings().isEmpty());
	}

	@Test
	public void uniqueLabelsResolve() {
		ResolveResult result = TransitionReferenceResolver.resolve(ExampleNets.queue(),
				Arrays.asList("Begin", "Enqueue"));

		assertEquals(Arrays.asList("T1", "T0"), result.getIds());
	}

	@Test
	public void sharedLabelsAreNeverGuessed() {
		ResolveResult result = TransitionReferenceResolver.resolve(ExampleNets.ambiguous(),
				Arrays.asList("A", "C"));

		assertEquals(Arrays.asList("c"), result.getIds());
		assertEquals(1, result.getWarnings().size());
		assertTrue(result.getWarnings().get(0).contains("a1, a2"));
	}

	@Test
	public void unknownReferencesAreCollected() {
		ResolveResult result = TransitionReferenceResolver.resolve(ExampleNets.queue(),
				Arrays.asList("Nope", "P0", "T2"));

		// places are not transitions
		assertEquals(Arrays.asList("Nope", "P0"), result.getUnknown());
		assertEquals(Arrays.asList("T2"), result.getIds());
	}

	@Test
	public void emptyInputGivesEmptyResult() {
		ResolveResult result = TransitionReferenceResolver.resolve(ExampleNets.queue(),
				Collections.<String>emptyList());

		assertTrue(result.getIds().isEmpty());
		assertTrue(result.getUnknown().isEmpty());
	}
}
