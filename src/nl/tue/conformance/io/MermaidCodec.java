package nl.tue.conformance.io;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import nl.tue.conformance.model.Arc;
import nl.tue.conformance.model.ArcType;
import nl.tue.conformance.model.PetriNet;
import nl.tue.conformance.model.PetriNetParseException;
import nl.tue.conformance.model.Place;
import nl.tue.conformance.model.Transition;

/**
 * A subset of Mermaid flowcharts. Circles {@code id(("text"))} are places,
 * rectangles {@code id["text"]} are transitions. A place text ending in
 * {@code (xN)} carries N tokens. Edges are written {@code a --> b}, with any
 * number of dashes, and carry a weight as {@code a -->|2| b} or
 * {@code a --|2|--> b}. {@code a --o b} is an inhibitor arc. Nodes that are
 * only mentioned in edges are places; an empty node text stands for "no label".
 * <p>
 * Ids that Mermaid cannot carry, such as ids with spaces or punctuation and
 * keywords like {@code end} or {@code style}, are written as {@code __}
 * followed by the hex digits of their UTF-8 bytes, and decoded when read.
 */
public class MermaidCodec extends PetriNetCodec {

	private static final String ID = "[\\p{L}\\p{N}_.]+";

	private static final Pattern SAFEID = Pattern.compile(ID);

	private static final String ENCODED = "__";

	private static final Pattern ENCODEDID = Pattern.compile(ENCODED + "(?:[0-9a-f]{2})+");

	// keywords, and ids that would open a statement the reader skips
	private static final Pattern RESERVED = Pattern
			.compile("end|subgraph(?:\\..*)?|class|classDef|style|linkStyle|click|direction");

	private static final Pattern HEADER = Pattern.compile("^(?:flowchart|graph)(?:\\s+(\\w+))?\\s*;?$");

	private static final Pattern IGNORED = Pattern
			.compile("^(?:%%.*|classDef\\s.*|class\\s.*|style\\s.*|linkStyle\\s.*|click\\s.*|direction\\s.*|subgraph\\b.*|end)$");

	private static final Pattern NODE = Pattern.compile("\\s*(" + ID + ")" //
			+ "(?:\\(\\(\\s*(?:\"((?:[^\"\\\\]|\\\\.)*)\"|([^)\"]*))\\s*\\)\\)" //
			+ "|\\[\\s*(?:\"((?:[^\"\\\\]|\\\\.)*)\"|([^\\]\"]*))\\s*\\])?");

	private static final Pattern EDGE = Pattern.compile("\\s*(?:" //
			+ "-{2,}\\|([^|]*)\\|-{2,}>" //
			+ "|-{2,}>\\|([^|]*)\\|" //
			+ "|-{2,}>" //
			+ "|-{2,}o\\|([^|]*)\\|" //
			+ "|-{2,}o(?=\\s))");

	private static final Pattern TOKENSUFFIX = Pattern.compile("^(.*?)\\s*\\(x(\\d+)\\)$");

	private final String direction;

	public MermaidCodec() {
		this(DotCodec.RankDir.LR);
	}

	public MermaidCodec(DotCodec.RankDir direction) {
		this.direction = direction.toString();
	}

	@Override
	public PetriNetFormat getFormat() {
		return PetriNetFormat.MERMAID;
	}

	@Override
	public void write(PetriNet net, Writer out) throws IOException {
		out.write("flowchart " + direction + "\n");
		for (Place p : net.getPlaces()) {
			String label = p.getLabel() == null ? "" : p.getLabel();
			if (p.getTokens() > 0 || TOKENSUFFIX.matcher(label).matches()) {
				label += (label.isEmpty() ? "" : " ") + "(x" + p.getTokens() + ")";
			}
			out.write(encodeId(p.getId()) + "((\"" + escape(label) + "\"))\n");
		}
		for (Transition t : net.getTransitions()) {
			String label = t.getLabel() == null ? "" : t.getLabel();
			out.write(encodeId(t.getId()) + "[\"" + escape(label) + "\"]\n");
		}
		for (Arc a : net.getArcs()) {
			String w = a.getWeight() != Arc.DEFAULTWEIGHT ? "|" + a.getWeight() + "|" : "";
			String arrow = a.isInhibitor() ? "--o" : "-->";
			out.write(encodeId(a.getFrom()) + " " + arrow + w + " " + encodeId(a.getTo()) + "\n");
		}
	}

	static String encodeId(String id) {
		if (SAFEID.matcher(id).matches() && !id.startsWith(ENCODED) && !RESERVED.matcher(id).matches()) {
			return id;
		}
		StringBuilder b = new StringBuilder(ENCODED);
		for (byte x : id.getBytes(StandardCharsets.UTF_8)) {
			b.append(Character.forDigit((x >> 4) & 0xf, 16)).append(Character.forDigit(x & 0xf, 16));
		}
		return b.toString();
	}

	/**
	 * Decodes ids written by {@link #encodeId(String)}. Anything else,
	 * including hand-written ids that merely start with {@code __}, is
	 * returned unchanged.
	 */
	static String decodeId(String id) {
		if (!ENCODEDID.matcher(id).matches()) {
			return id;
		}
		byte[] bytes = new byte[(id.length() - ENCODED.length()) / 2];
		for (int i = 0; i < bytes.length; i++) {
			int at = ENCODED.length() + 2 * i;
			bytes[i] = (byte) Integer.parseInt(id.substring(at, at + 2), 16);
		}
		String decoded = new String(bytes, StandardCharsets.UTF_8);
		return encodeId(decoded).equals(id) ? decoded : id;
	}

	private static String escape(String s) {
		return s.replace("\\", "\\\\").replace("\"", "\\\"");
	}

	private static String unescape(String s) {
		StringBuilder b = new StringBuilder(s.length());
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c == '\\' && i + 1 < s.length()) {
				c = s.charAt(++i);
			}
			b.append(c);
		}
		return b.toString();
	}

	/**
	 * A node as declared so far: its kind is unknown until a shape is seen.
	 */
	private static class Node {
		Boolean transition;
		String text;
	}

	@Override
	public PetriNet read(String text) throws PetriNetParseException {
		Map<String, Node> nodes = new LinkedHashMap<>();
		List<Arc> arcs = new ArrayList<>();
		boolean header = false;

		String[] lines = text.split("\\r?\\n");
		for (int l = 0; l < lines.length; l++) {
			for (String statement : splitStatements(lines[l])) {
				String s = statement.trim();
				if (s.isEmpty() || IGNORED.matcher(s).matches()) {
					continue;
				}
				if (!header) {
					if (!HEADER.matcher(s).matches()) {
						throw new PetriNetParseException("Expected 'flowchart' header on line " + (l + 1));
					}
					header = true;
					continue;
				}
				parseStatement(s, l + 1, nodes, arcs);
			}
		}
		if (!header) {
			throw new PetriNetParseException("Expected 'flowchart' header.");
		}

		List<Place> places = new ArrayList<>();
		List<Transition> transitions = new ArrayList<>();
		for (Map.Entry<String, Node> e : nodes.entrySet()) {
			String id = e.getKey();
			Node node = e.getValue();
			if (Boolean.TRUE.equals(node.transition)) {
				transitions.add(new Transition(id, node.text == null || node.text.isEmpty() ? null : node.text));
			} else {
				int tokens = 0;
				String label = node.text;
				if (label != null) {
					Matcher m = TOKENSUFFIX.matcher(label);
					if (m.matches()) {
						label = m.group(1);
						tokens = parseCount(m.group(2), "Tokens of place " + id);
					}
				}
				places.add(new Place(id, label == null || label.isEmpty() ? null : label, tokens));
			}
		}
		return new PetriNet(places, transitions, arcs);
	}

	private static void parseStatement(String s, int line, Map<String, Node> nodes, List<Arc> arcs)
			throws PetriNetParseException {
		Matcher node = NODE.matcher(s);
		Matcher edge = EDGE.matcher(s);
		int pos = 0;
		if (!node.region(pos, s.length()).lookingAt()) {
			throw new PetriNetParseException("Cannot parse line " + line + ": " + s);
		}
		String from = declare(node, nodes);
		pos = node.end();
		while (pos < s.length()) {
			if (!edge.region(pos, s.length()).lookingAt()) {
				throw new PetriNetParseException("Cannot parse line " + line + " at '" + s.substring(pos).trim() + "'");
			}
			String weightText = firstNonNull(edge.group(1), edge.group(2), edge.group(3));
			boolean inhibitor = edge.group(0).trim().matches("-+o.*");
			pos = edge.end();
			if (!node.region(pos, s.length()).lookingAt()) {
				throw new PetriNetParseException("Missing edge target on line " + line + ": " + s);
			}
			String to = declare(node, nodes);
			pos = node.end();

			int weight = weightText == null || weightText.trim().isEmpty() ? Arc.DEFAULTWEIGHT
					: parseCount(weightText, "Weight of arc " + from + " -> " + to);
			arcs.add(new Arc(from, to, weight, inhibitor ? ArcType.INHIBITOR : ArcType.STANDARD));
			from = to;
			while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) {
				pos++;
			}
		}
	}

	private static String declare(Matcher m, Map<String, Node> nodes) {
		String id = decodeId(m.group(1));
		Node node = nodes.get(id);
		if (node == null) {
			node = new Node();
			nodes.put(id, node);
		}
		if (m.group(2) != null || m.group(3) != null) {
			node.transition = Boolean.FALSE;
			node.text = m.group(2) != null ? unescape(m.group(2)) : m.group(3).trim();
		} else if (m.group(4) != null || m.group(5) != null) {
			node.transition = Boolean.TRUE;
			node.text = m.group(4) != null ? unescape(m.group(4)) : m.group(5).trim();
		}
		return id;
	}

	/**
	 * Splits a line on semicolons outside quoted texts.
	 */
	private static List<String> splitStatements(String line) {
		List<String> statements = new ArrayList<>();
		boolean quoted = false;
		int start = 0;
		for (int i = 0; i < line.length(); i++) {
			char c = line.charAt(i);
			if (c == '\\' && quoted) {
				i++;
			} else if (c == '"') {
				quoted = !quoted;
			} else if (c == ';' && !quoted) {
				statements.add(line.substring(start, i));
				start = i + 1;
			}
		}
		statements.add(line.substring(start));
		return statements;
	}

	private static String firstNonNull(String... values) {
		for (String v : values) {
			if (v != null) {
				return v;
			}
		}
		return null;
	}
}
