package nl.tue.conformance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import nl.tue.conformance.algorithms.ReplayAlgorithm.Debug;

public class ReplayerTest {

	/**
	 * Counts progress and collects log messages.
	 */
	private static class RecordingProgress implements Progress {
		final AtomicInteger count = new AtomicInteger();
		final List<String> messages = Collections.synchronizedList(new ArrayList<String>());
		int maximum;
		boolean cancelled;

		public void setMaximum(int maximum) {
			this.maximum = maximum;
		}

		public void inc() {
			count.incrementAndGet();
		}

		public boolean isCancelled() {
			return cancelled;
		}

		public void log(String message) {
			messages.add(message);
		}
	}

	private static List<List<String>> queueLog() {
		List<List<String>> log = new ArrayList<>();
		log.add(Arrays.asList("Enqueue", "Begin", "Finish"));
		log.add(Arrays.asList("Begin", "Finish"));
		log.add(Arrays.asList("Enqueue", "Begin", "Finish"));
		log.add(Collections.<String>emptyList());
		return log;
	}

	@Test
	public void alignsALogInParallel() throws InterruptedException, ExecutionException {
		Replayer replayer = new Replayer(new ReplayerParameters.Default(2, Debug.NONE), ExampleNets.queue());
		RecordingProgress progress = new RecordingProgress();

		ReplayResult result = replayer.computeReplayResult(progress, queueLog());

		assertEquals(3, result.getMaxModelMoveCost());
		assertEquals(3, result.getAlignments().size());
		assertEquals(4, result.numberOfCases());
		assertEquals(0, result.getUnreliableCount());
		assertEquals(5, progress.maximum);
		assertEquals(5, progress.count.get());
		assertTrue(progress.messages.isEmpty(), progress.messages.toString());

		// identical traces share one alignment
		TraceAlignment perfect = result.getAlignment(0);
		assertEquals(perfect, result.getAlignment(2));
		assertEquals(Arrays.asList(0, 2), new ArrayList<>(perfect.getTraceIndices()));
		assertEquals(1.0, perfect.getInfo(TraceAlignment.TRACEFITNESS));

		TraceAlignment skipped = result.getAlignment(1);
		assertEquals(1.0, skipped.getInfo(TraceAlignment.RAWFITNESSCOST));
		// worst case is 3 model moves plus 2 log moves
		assertEquals(0.8, skipped.getInfo(TraceAlignment.TRACEFITNESS), 1e-9);
		assertEquals(1.0, skipped.getInfo(TraceAlignment.MOVELOGFITNESS));
		assertEquals(2.0 / 3, skipped.getInfo(TraceAlignment.MOVEMODELFITNESS), 1e-9);
		assertEquals(2.0, skipped.getInfo(TraceAlignment.ORIGTRACELENGTH));

		TraceAlignment empty = result.getAlignment(3);
		assertEquals(0.0, empty.getInfo(TraceAlignment.TRACEFITNESS));
		assertEquals(3, empty.getAlignment().count(MoveType.MODEL));

		assertEquals((1 + 2.0 / 3 + 1 + 0) / 4, result.getAverageFitness(), 1e-9);
		assertNull(result.getAlignment(4));
	}

	@Test
	public void alignmentsAreSortedByFirstCase() throws InterruptedException, ExecutionException {
		Replayer replayer = new Replayer(new ReplayerParameters.Default(3, Debug.NONE), ExampleNets.ambiguous());
		List<List<String>> log = new ArrayList<>();
		for (int i = 0; i < 20; i++) {
			log.add(Arrays.asList("A", i % 2 == 0 ? "B" : "C"));
		}

		ReplayResult result = replayer.computeReplayResult(new RecordingProgress(), log);

		assertEquals(2, result.getAlignments().size());
		assertEquals(Integer.valueOf(0), result.getAlignments().get(0).getTraceIndices().first());
		assertEquals(Integer.valueOf(1), result.getAlignments().get(1).getTraceIndices().first());
		assertEquals(10, result.getAlignments().get(0).getTraceIndices().size());
		assertEquals(1.0, result.getAverageFitness());
	}

	@Test
	public void singleTracesMatchTheLogResult() throws InterruptedException, ExecutionException {
		Replayer replayer = new Replayer(ExampleNets.queue());
		List<String> trace = Arrays.asList("Enqueue", "Oops", "Finish");

		Alignment single = replayer.align(trace);
		ReplayResult result = replayer.computeReplayResult(new RecordingProgress(),
				Collections.singletonList(trace));

		assertEquals(single.getCost(), result.getAlignment(0).getAlignment().getCost());
		assertEquals(single.getMoves(), result.getAlignment(0).getAlignment().getMoves());
	}

	@Test
	public void cancelledReplayStopsSubmitting() throws InterruptedException, ExecutionException {
		Replayer replayer = new Replayer(new ReplayerParameters.Dijkstra(), ExampleNets.queue());
		RecordingProgress progress = new RecordingProgress();
		progress.cancelled = true;

		ReplayResult result = replayer.computeReplayResult(progress, queueLog());

		assertTrue(result.getAlignments().isEmpty());
		assertEquals(3, result.getMaxModelMoveCost());
		assertEquals(1.0, result.getAverageFitness());
	}

	@Test
	public void unreachableAcceptingMarkingIsLogged() throws InterruptedException, ExecutionException {
		Replayer replayer = new Replayer(new ReplayerParameters.Dijkstra(), ExampleNets.dead());
		RecordingProgress progress = new RecordingProgress();

		ReplayResult result = replayer.computeReplayResult(progress,
				Collections.singletonList(Arrays.asList("T")));

		assertEquals(0, result.getMaxModelMoveCost());
		assertEquals(1, result.getUnreliableCount());
		assertEquals(AlignmentStatus.EXHAUSTED, result.getAlignment(0).getAlignment().getStatus());
		assertEquals(0.0, result.getAlignment(0).getInfo(TraceAlignment.TRACEFITNESS));
		assertEquals(2, progress.messages.size());
		assertEquals("Alignment of trace 0 is exhausted", progress.messages.get(1));
	}

	@Test
	public void cappedAlignmentsAreUnreliable() throws InterruptedException, ExecutionException {
		Replayer replayer = new Replayer(new ReplayerParameters.Dijkstra(20, 1, Debug.NONE), ExampleNets.runaway());
		RecordingProgress progress = new RecordingProgress();

		ReplayResult result = replayer.computeReplayResult(progress,
				Collections.singletonList(Collections.<String>emptyList()));

		TraceAlignment ta = result.getAlignment(0);
		assertFalse(ta.isReliable());
		assertEquals(AlignmentStatus.CAPPED, ta.getAlignment().getStatus());
		assertEquals(1, result.getUnreliableCount());
		assertTrue(progress.messages.contains("Alignment of trace 0 is capped"), progress.messages.toString());
	}

	@Test
	public void prefixParametersSelectPrefixAlignment() {
		Replayer replayer = new Replayer(new ReplayerParameters.Prefix(), ExampleNets.queue());

		Alignment alignment = replayer.align(Arrays.asList("Enqueue", "Begin"));
		assertEquals(0.0, alignment.getCost());
		assertEquals(2, alignment.size());
	}

	@Test
	public void customCostsAreApplied() throws InterruptedException, ExecutionException {
		Map<String, Integer> costLM = new HashMap<>();
		costLM.put("Oops", 4);
		Map<String, Integer> costMM = new HashMap<>();
		costMM.put("T1", 2);
		Replayer replayer = new Replayer(new ReplayerParameters.Dijkstra(), ExampleNets.queue(), costMM, costLM,
				null);

		ReplayResult result = replayer.computeReplayResult(new RecordingProgress(),
				Collections.singletonList(Arrays.asList("Enqueue", "Oops", "Finish")));

		TraceAlignment ta = result.getAlignment(0);
		// a log move on Oops and a model move on T1
		assertEquals(6.0, ta.getAlignment().getCost());
		// empty trace costs 1 + 2 + 1, the trace itself 1 + 4 + 1
		assertEquals(4, result.getMaxModelMoveCost());
		assertEquals(1.0 - 6.0 / 10, ta.getInfo(TraceAlignment.TRACEFITNESS), 1e-9);
	}

	@Test
	public void negativeCostsAreRejected() {
		Map<String, Integer> costLM = Collections.singletonMap("Oops", -4);
		assertThrows(IllegalArgumentException.class,
				() -> new Replayer(new ReplayerParameters.Dijkstra(), ExampleNets.queue(), null, costLM, null));
	}

	@Test
	public void threadCountMustBePositive() {
		assertThrows(IllegalArgumentException.class, () -> new ReplayerParameters.Default(0, Debug.NONE));
	}

	@Test
	public void statsDebugWritesOneLinePerTrace() throws InterruptedException, ExecutionException {
		PrintStream old = Debug.getOutputStream();
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		Debug.setOutputStream(new PrintStream(bytes, true));
		try {
			Replayer replayer = new Replayer(new ReplayerParameters.Dijkstra(Debug.STATS), ExampleNets.queue());
			replayer.computeReplayResult(new RecordingProgress(), queueLog());
		} finally {
			Debug.setOutputStream(old);
		}
		String[] lines = new String(bytes.toByteArray(), StandardCharsets.UTF_8).split("\\r?\\n");

		// header, the empty trace, three distinct traces
		assertEquals(5, lines.length);
		assertTrue(lines[0].startsWith("Trace," + Utils.Statistic.EXITCODE), lines[0]);
		assertEquals(Utils.Statistic.values().length + 1, lines[0].split(",").length);
	}
}
