package nl.tue.conformance.io;

import java.util.Locale;

/**
 * Text formats a net can be read from and written to.
 */
public enum PetriNetFormat {
	JSON("json"), //
	PNML("pnml"), //
	DOT("dot"), //
	MERMAID("mermaid");

	private final String name;

	private PetriNetFormat(String name) {
		this.name = name;
	}

	/**
	 * Looks up a format by its name or file extension, ignoring case.
	 * 
	 * @param name
	 * @return
	 * @throws IllegalArgumentException
	 *             for unknown names
	 */
	public static PetriNetFormat of(String name) {
		String n = name.trim().toLowerCase(Locale.ROOT);
		if (n.startsWith(".")) {
			n = n.substring(1);
		}
		switch (n) {
			case "json" :
				return JSON;
			case "pnml" :
			case "xml" :
				return PNML;
			case "dot" :
			case "gv" :
				return DOT;
			case "mermaid" :
			case "mmd" :
				return MERMAID;
			default :
				throw new IllegalArgumentException("Unknown format: " + name);
		}
	}

	public String toString() {
		return name;
	}
}
