package edu.cmu.cs.cs15745.memprof;

/** Thrown by the graph checker when the context graph is malformed. */
public class GraphConsistencyException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public GraphConsistencyException(String message) {
		super(message);
	}
}
