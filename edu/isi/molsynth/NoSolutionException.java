package edu.isi.molsynth;
/** the frontier emptied before the seed was reached: no path exists under
    the reverse rules */

public class NoSolutionException extends SynthesisException {
    public NoSolutionException(String message, long expanded) { super(message, expanded); }
}
