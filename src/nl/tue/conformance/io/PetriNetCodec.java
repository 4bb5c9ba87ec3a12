package nl.tue.conformance.io;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

import nl.tue.conformance.model.PetriNet;
import nl.tue.conformance.model.PetriNetParseException;

/**
 * Reads and writes nets in one text format. Reading only checks the syntax of
 * the format; use {@link PetriNetParser} to obtain validated nets.
 */
public abstract class PetriNetCodec {

	public abstract PetriNetFormat getFormat();

	public abstract PetriNet read(String text) throws PetriNetParseException;

	public abstract void write(PetriNet net, Writer out) throws IOException;

	/**
	 * Writes the net to a string. The output is deterministic: equal nets give
	 * equal strings.
	 * 
	 * @param net
	 * @return
	 */
	public String toString(PetriNet net) {
		StringWriter out = new StringWriter();
		try {
			write(net, out);
		} catch (IOException e) {
			// StringWriter does not throw
			throw new UncheckedIOException(e);
		}
		return out.toString();
	}

	/**
	 * Parses a non-negative integer, tolerating surrounding whitespace.
	 */
	static int parseCount(String text, String what) throws PetriNetParseException {
		String s = text.trim();
		try {
			int n = Integer.parseInt(s);
			if (n < 0) {
				throw new PetriNetParseException(what + " must not be negative: " + s);
			}
			return n;
		} catch (NumberFormatException e) {
			throw new PetriNetParseException(what + " must be an integer: " + s, e);
		}
	}
}
