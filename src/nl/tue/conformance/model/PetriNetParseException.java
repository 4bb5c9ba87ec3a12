package nl.tue.conformance.model;

/**
 * Thrown when input text cannot be parsed into a Petri net, or when the
 * resulting net is structurally invalid. Invalid input is never repaired.
 */
public class PetriNetParseException extends Exception {

	private static final long serialVersionUID = -3317409271534471126L;

	public PetriNetParseException(String message) {
		super(message);
	}

	public PetriNetParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
