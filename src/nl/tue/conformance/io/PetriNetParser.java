package nl.tue.conformance.io;

import java.io.IOException;
import java.io.Writer;

import nl.tue.conformance.model.PetriNet;
import nl.tue.conformance.model.PetriNetParseException;
import nl.tue.conformance.model.PetriNetValidator;

/**
 * Entry point for reading and writing nets in any supported format. Parsed
 * nets are always validated.
 */
public final class PetriNetParser {

	private PetriNetParser() {
	}

	public static PetriNetCodec codec(PetriNetFormat format) {
		switch (format) {
			case JSON :
				return new JsonCodec();
			case PNML :
				return new PnmlCodec();
			case DOT :
				return new DotCodec();
			case MERMAID :
				return new MermaidCodec();
			default :
				throw new IllegalArgumentException("Unsupported format: " + format);
		}
	}

	/**
	 * Parses and validates a net.
	 * 
	 * @param text
	 * @param format
	 * @return
	 * @throws PetriNetParseException
	 *             if the text is malformed or the net is structurally invalid
	 */
	public static PetriNet parse(String text, PetriNetFormat format) throws PetriNetParseException {
		return parse(text, codec(format));
	}

	public static PetriNet parse(String text, PetriNetCodec codec) throws PetriNetParseException {
		if (text == null) {
			throw new PetriNetParseException("No input.");
		}
		return PetriNetValidator.validate(codec.read(text));
	}

	public static String toString(PetriNet net, PetriNetFormat format) {
		return codec(format).toString(net);
	}

	public static void write(PetriNet net, PetriNetFormat format, Writer out) throws IOException {
		codec(format).write(net, out);
	}
}
