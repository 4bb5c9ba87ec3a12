package nl.tue.conformance.semantics;

import java.util.Collections;
import java.util.List;

public class ResolveResult {

	private final List<String> ids;
	private final List<String> unknown;
	private final List<String> warnings;

	public ResolveResult(List<String> ids, List<String> unknown, List<String> warnings) {
		this.ids = Collections.unmodifiableList(ids);
		this.unknown = Collections.unmodifiableList(unknown);
		this.warnings = Collections.unmodifiableList(warnings);
	}

	/**
	 * The resolved transition ids, in the order of the references.
	 */
	public List<String> getIds() {
		return ids;
	}

	/**
	 * References matching neither an id nor a label.
	 */
	public List<String> getUnknown() {
		return unknown;
	}

	/**
	 * One warning per reference to a label shared by several transitions.
	 */
	public List<String> getWarnings() {
		return warnings;
	}
}
