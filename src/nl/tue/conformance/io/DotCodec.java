package nl.tue.conformance.io;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashMap;
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
 * A subset of Graphviz DOT.
 *
 * Nodes with shape box, rect, rectangle or square are transitions, all other
 * nodes are places, including nodes only mentioned in edges. The last line of
 * a place label of the form {@code xN} gives its tokens. The label of an edge
 * is its weight; an edge with {@code arrowhead=odot} is an inhibitor arc. A
 * missing or empty node label stands for "no label"; such nodes are written
 * with {@code label=""} and their id as {@code xlabel}, which is not read back.
 *
 * Subgraphs are flattened, graph attributes are ignored.
 */
public class DotCodec extends PetriNetCodec {

	public static enum RankDir {
		LR, TB, RL, BT;
	}

	private static final Pattern TOKENLINE = Pattern.compile("^(?:•\\s*)?x(\\d+)$");

	private final RankDir rankdir;
	private final String title;

	public DotCodec() {
		this(RankDir.LR, null);
	}

	/**
	 *
	 * @param rankdir
	 *            layout direction of the written graph
	 * @param title
	 *            graph label, may be null
	 */
	public DotCodec(RankDir rankdir, String title) {
		this.rankdir = rankdir;
		this.title = title;
	}

	@Override
	public PetriNetFormat getFormat() {
		return PetriNetFormat.DOT;
	}

	@Override
	public void write(PetriNet net, Writer out) throws IOException {
		out.write("digraph PetriNet {\n");
		out.write("  rankdir=" + rankdir + ";\n");
		out.write("  bgcolor=\"white\";\n");
		if (title != null) {
			out.write("  labelloc=t;\n");
			out.write("  label=\"" + escape(title) + "\";\n");
		}
		out.write("  node [fontsize=12];\n");
		out.write("  edge [fontsize=10, arrowsize=0.8];\n");

		out.write("  // Places\n");
		out.write("  node [shape=circle, style=filled, fillcolor=\"#f2f7ff\", color=\"#3b82f6\"];\n");
		for (Place p : net.getPlaces()) {
			String label = p.getLabel() == null ? "" : escape(p.getLabel());
			if (p.getTokens() > 0 || TOKENLINE.matcher(label).matches()) {
				// a label that looks like a token line gets an explicit count
				label += (label.isEmpty() ? "" : "\\n") + "x" + p.getTokens();
			}
			out.write("  \"" + escape(p.getId()) + "\" [label=\"" + label + "\"" + xlabel(p.getId(), p.getLabel())
					+ "];\n");
		}

		out.write("  // Transitions\n");
		out.write("  node [shape=box, style=filled, fillcolor=\"#fff7ed\", color=\"#f97316\", height=0.3, width=0.6];\n");
		for (Transition t : net.getTransitions()) {
			String label = t.getLabel() == null ? "" : escape(t.getLabel());
			out.write("  \"" + escape(t.getId()) + "\" [label=\"" + label + "\"" + xlabel(t.getId(), t.getLabel())
					+ "];\n");
		}

		out.write("  // Arcs\n");
		for (Arc a : net.getArcs()) {
			List<String> attributes = new ArrayList<>(2);
			if (a.getWeight() != Arc.DEFAULTWEIGHT) {
				attributes.add("label=\"" + a.getWeight() + "\"");
			}
			if (a.isInhibitor()) {
				attributes.add("arrowhead=odot");
			}
			out.write("  \"" + escape(a.getFrom()) + "\" -> \"" + escape(a.getTo()) + "\"");
			if (!attributes.isEmpty()) {
				out.write(" [" + String.join(", ", attributes) + "]");
			}
			out.write(";\n");
		}
		out.write("}\n");
	}

	private static String xlabel(String id, String label) {
		return label == null ? ", xlabel=\"" + escape(id) + "\"" : "";
	}

	private static String escape(String s) {
		return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
	}

	@Override
	public PetriNet read(String text) throws PetriNetParseException {
		return new Parser(new Lexer(text).tokenize()).parse();
	}

	private static boolean isTransitionShape(String shape) {
		return shape != null && (shape.equals("box") || shape.equals("rect") || shape.equals("rectangle")
				|| shape.equals("square"));
	}

	private static class Token {
		static final int ID = 0;
		static final int PUNCT = 1;
		static final int EOF = 2;

		final int type;
		final String text;
		final int line;
		// quoted and HTML strings are never keywords
		final boolean literal;

		Token(int type, String text, int line) {
			this(type, text, line, false);
		}

		Token(int type, String text, int line, boolean literal) {
			this.type = type;
			this.text = text;
			this.line = line;
			this.literal = literal;
		}

		boolean is(String punct) {
			return type == PUNCT && text.equals(punct);
		}

		boolean isKeyword(String keyword) {
			return type == ID && !literal && text.equalsIgnoreCase(keyword);
		}

		public String toString() {
			return type == EOF ? "end of input" : "'" + text + "'";
		}
	}

	private static class Lexer {
		private final String s;
		private int pos = 0;
		private int line = 1;

		Lexer(String s) {
			this.s = s;
		}

		List<Token> tokenize() throws PetriNetParseException {
			List<Token> tokens = new ArrayList<>();
			while (true) {
				skipWhitespaceAndComments();
				if (pos >= s.length()) {
					tokens.add(new Token(Token.EOF, "", line));
					return tokens;
				}
				char c = s.charAt(pos);
				if (c == '"') {
					tokens.add(new Token(Token.ID, quoted(), line, true));
				} else if (c == '<') {
					tokens.add(new Token(Token.ID, html(), line, true));
				} else if (c == '-' && pos + 1 < s.length() && (s.charAt(pos + 1) == '>' || s.charAt(pos + 1) == '-')) {
					tokens.add(new Token(Token.PUNCT, s.substring(pos, pos + 2), line));
					pos += 2;
				} else if ("{}[];,=:".indexOf(c) >= 0) {
					tokens.add(new Token(Token.PUNCT, String.valueOf(c), line));
					pos++;
				} else if (c == '-' && pos + 1 < s.length() && Character.isDigit(s.charAt(pos + 1))) {
					int start = pos++;
					while (pos < s.length() && isIdChar(s.charAt(pos))) {
						pos++;
					}
					tokens.add(new Token(Token.ID, s.substring(start, pos), line));
				} else if (isIdChar(c)) {
					int start = pos;
					while (pos < s.length() && isIdChar(s.charAt(pos))) {
						pos++;
					}
					tokens.add(new Token(Token.ID, s.substring(start, pos), line));
				} else {
					throw new PetriNetParseException("Unexpected character '" + c + "' on line " + line);
				}
			}
		}

		private static boolean isIdChar(char c) {
			return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c > 127;
		}

		private void skipWhitespaceAndComments() {
			while (pos < s.length()) {
				char c = s.charAt(pos);
				if (c == '\n') {
					line++;
					pos++;
				} else if (Character.isWhitespace(c)) {
					pos++;
				} else if (s.startsWith("//", pos) || (c == '#' && atLineStart())) {
					while (pos < s.length() && s.charAt(pos) != '\n') {
						pos++;
					}
				} else if (s.startsWith("/*", pos)) {
					int end = s.indexOf("*/", pos + 2);
					end = end < 0 ? s.length() : end + 2;
					for (int i = pos; i < end; i++) {
						if (s.charAt(i) == '\n') {
							line++;
						}
					}
					pos = end;
				} else {
					return;
				}
			}
		}

		private boolean atLineStart() {
			for (int i = pos - 1; i >= 0 && s.charAt(i) != '\n'; i--) {
				if (!Character.isWhitespace(s.charAt(i))) {
					return false;
				}
			}
			return true;
		}

		/**
		 * Reads a quoted string. Escaped quotes and backslashes are unescaped,
		 * other escapes such as \n are kept for the label splitting.
		 */
		private String quoted() throws PetriNetParseException {
			int startLine = line;
			StringBuilder b = new StringBuilder();
			pos++;
			while (pos < s.length()) {
				char c = s.charAt(pos);
				if (c == '\\' && pos + 1 < s.length()) {
					char n = s.charAt(pos + 1);
					if (n == '"' || n == '\\') {
						b.append(n);
					} else if (n == '\n') {
						// line continuation
						line++;
					} else {
						b.append(c).append(n);
					}
					pos += 2;
				} else if (c == '"') {
					pos++;
					return b.toString();
				} else {
					if (c == '\n') {
						line++;
					}
					b.append(c);
					pos++;
				}
			}
			throw new PetriNetParseException("Unterminated string starting on line " + startLine);
		}

		private String html() throws PetriNetParseException {
			int startLine = line;
			int depth = 0;
			int start = pos;
			while (pos < s.length()) {
				char c = s.charAt(pos++);
				if (c == '<') {
					depth++;
				} else if (c == '>') {
					depth--;
					if (depth == 0) {
						return s.substring(start + 1, pos - 1);
					}
				} else if (c == '\n') {
					line++;
				}
			}
			throw new PetriNetParseException("Unterminated HTML string starting on line " + startLine);
		}
	}

	private static class Parser {
		private final List<Token> tokens;
		private int pos = 0;

		private final Map<String, Map<String, String>> nodes = new LinkedHashMap<>();
		private final List<String[]> edges = new ArrayList<>();
		private final List<Map<String, String>> edgeAttributes = new ArrayList<>();
		private Map<String, String> nodeDefaults = new HashMap<>();
		private Map<String, String> edgeDefaults = new HashMap<>();

		Parser(List<Token> tokens) {
			this.tokens = tokens;
		}

		private Token peek() {
			return tokens.get(pos);
		}

		private Token next() {
			Token t = tokens.get(pos);
			if (t.type != Token.EOF) {
				pos++;
			}
			return t;
		}

		private Token expect(String punct) throws PetriNetParseException {
			Token t = next();
			if (!t.is(punct)) {
				throw new PetriNetParseException("Expected '" + punct + "' but found " + t + " on line " + t.line);
			}
			return t;
		}

		private String expectId() throws PetriNetParseException {
			Token t = next();
			if (t.type != Token.ID) {
				throw new PetriNetParseException("Expected an identifier but found " + t + " on line " + t.line);
			}
			return t.text;
		}

		PetriNet parse() throws PetriNetParseException {
			if (peek().isKeyword("strict")) {
				next();
			}
			Token kind = next();
			if (!kind.isKeyword("digraph") && !kind.isKeyword("graph")) {
				throw new PetriNetParseException("Expected 'digraph' but found " + kind + " on line " + kind.line);
			}
			if (peek().type == Token.ID) {
				next();
			}
			expect("{");
			statements();
			expect("}");
			if (peek().type != Token.EOF) {
				throw new PetriNetParseException("Unexpected " + peek() + " after graph on line " + peek().line);
			}
			return build();
		}

		private void statements() throws PetriNetParseException {
			while (!peek().is("}") && peek().type != Token.EOF) {
				statement();
				if (peek().is(";") || peek().is(",")) {
					next();
				}
			}
		}

		private void statement() throws PetriNetParseException {
			Token t = peek();
			if (t.is("{") || t.isKeyword("subgraph")) {
				if (t.isKeyword("subgraph")) {
					next();
					if (peek().type == Token.ID) {
						next();
					}
				}
				expect("{");
				// defaults set inside a subgraph do not leak out
				Map<String, String> nd = new HashMap<>(nodeDefaults);
				Map<String, String> ed = new HashMap<>(edgeDefaults);
				statements();
				expect("}");
				nodeDefaults = nd;
				edgeDefaults = ed;
				return;
			}
			if (t.isKeyword("node") || t.isKeyword("edge") || t.isKeyword("graph")) {
				next();
				Map<String, String> attributes = attributes();
				if (t.isKeyword("node")) {
					nodeDefaults.putAll(attributes);
				} else if (t.isKeyword("edge")) {
					edgeDefaults.putAll(attributes);
				}
				return;
			}
			String id = expectId();
			if (peek().is("=")) {
				// graph attribute
				next();
				expectId();
				return;
			}
			skipPort();
			if (peek().is("->") || peek().is("--")) {
				List<String> chain = new ArrayList<>();
				chain.add(id);
				while (peek().is("->") || peek().is("--")) {
					next();
					chain.add(expectId());
					skipPort();
				}
				Map<String, String> attributes = new HashMap<>(edgeDefaults);
				attributes.putAll(attributes());
				for (int i = 0; i + 1 < chain.size(); i++) {
					mention(chain.get(i));
					mention(chain.get(i + 1));
					edges.add(new String[] { chain.get(i), chain.get(i + 1) });
					edgeAttributes.add(attributes);
				}
				return;
			}
			Map<String, String> attributes = attributes();
			Map<String, String> node = nodes.get(id);
			if (node == null) {
				node = new HashMap<>();
				nodes.put(id, node);
			}
			if (!node.containsKey("_declared")) {
				// defaults apply to the first declaration only
				node.putAll(nodeDefaults);
				node.put("_declared", "true");
			}
			node.putAll(attributes);
		}

		private void skipPort() throws PetriNetParseException {
			while (peek().is(":")) {
				next();
				expectId();
			}
		}

		private void mention(String id) {
			if (!nodes.containsKey(id)) {
				nodes.put(id, new HashMap<String, String>());
			}
		}

		private Map<String, String> attributes() throws PetriNetParseException {
			Map<String, String> attributes = new HashMap<>();
			while (peek().is("[")) {
				next();
				while (!peek().is("]")) {
					String key = expectId();
					String value = "true";
					if (peek().is("=")) {
						next();
						value = expectId();
					}
					attributes.put(key, value);
					if (peek().is(",") || peek().is(";")) {
						next();
					}
				}
				expect("]");
			}
			return attributes;
		}

		private PetriNet build() throws PetriNetParseException {
			List<Place> places = new ArrayList<>();
			List<Transition> transitions = new ArrayList<>();
			for (Map.Entry<String, Map<String, String>> e : nodes.entrySet()) {
				String id = e.getKey();
				Map<String, String> attributes = e.getValue();
				String label = attributes.get("label");
				if (isTransitionShape(attributes.get("shape"))) {
					String text = label == null ? null : String.join(" ", lines(label));
					transitions.add(new Transition(id, text == null || text.isEmpty() ? null : text));
				} else {
					int tokens = 0;
					String text = null;
					if (label != null) {
						List<String> lines = lines(label);
						if (lines.size() > 0) {
							Matcher m = TOKENLINE.matcher(lines.get(lines.size() - 1));
							if (m.matches()) {
								tokens = parseCount(m.group(1), "Tokens of place " + id);
								lines.remove(lines.size() - 1);
							}
						}
						text = String.join(" ", lines);
					}
					places.add(new Place(id, text == null || text.isEmpty() ? null : text, tokens));
				}
			}
			List<Arc> arcs = new ArrayList<>();
			for (int i = 0; i < edges.size(); i++) {
				Map<String, String> attributes = edgeAttributes.get(i);
				String label = attributes.get("label");
				int weight = label == null || label.trim().isEmpty() ? Arc.DEFAULTWEIGHT
						: parseCount(label, "Weight of arc " + edges.get(i)[0] + " -> " + edges.get(i)[1]);
				ArcType type = "odot".equals(attributes.get("arrowhead")) ? ArcType.INHIBITOR : ArcType.STANDARD;
				arcs.add(new Arc(edges.get(i)[0], edges.get(i)[1], weight, type));
			}
			return new PetriNet(places, transitions, arcs);
		}

		/**
		 * Splits a label on real newlines and the DOT escapes \n, \l and \r.
		 */
		private static List<String> lines(String label) {
			List<String> lines = new ArrayList<>();
			for (String line : label.split("\\\\[nlr]|\\r?\\n", -1)) {
				String trimmed = line.trim();
				if (!trimmed.isEmpty()) {
					lines.add(trimmed);
				}
			}
			return lines;
		}
	}
}
