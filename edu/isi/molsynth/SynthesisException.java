package edu.isi.molsynth;
/** for a reverse synthesis that ended without a path. Subclasses tell
    an exhausted search from an abandoned one */

public abstract class SynthesisException extends Exception {
    // how many molecules were popped before giving up
    private final long expanded;
    public SynthesisException(String message, long expanded) {
	super(message);
	this.expanded = expanded;
    }
    public long getNumExpanded() { return expanded; }
}
