package edu.isi.molsynth;
/** the search budget ran out before the seed was reached. Says nothing about
    whether a path exists */

public class SearchTimeoutException extends SynthesisException {
    private final long budget;
    public SearchTimeoutException(String message, long expanded, long budget) {
	super(message, expanded);
	this.budget = budget;
    }
    // in milliseconds
    public long getBudget() { return budget; }
}
