package edu.isi.molsynth;

import java.util.List;

/**
 * Applies forward (or reversed) rewrite steps to molecules. Offsets must
 * come from a substring search on the molecule being rewritten; a step whose
 * fragment isn't found at its offset is an internal defect and is reported
 * as an {@link UnusualConditionException}.
 */
public class StepApplicator {

    private StepApplicator() {}

    /**
     * Replaces {@code from} at {@code offset} of {@code molecule} with {@code to}.
     * @return the rewritten molecule
     * @throws UnusualConditionException if {@code molecule} doesn't hold {@code from} at {@code offset}
     */
    public static String apply(String molecule, int offset, String from, String to) throws UnusualConditionException {
	if (offset < 0 || !molecule.startsWith(from, offset))
	    throw new UnusualConditionException("Invalid transformation: \""+from+Transformation.ARROW+to+
						"\" does not match at offset "+offset+" of molecule "+molecule);
	StringBuilder sb = new StringBuilder(molecule.length()-from.length()+to.length());
	sb.append(molecule, 0, offset);
	sb.append(to);
	sb.append(molecule, offset+from.length(), molecule.length());
	return sb.toString();
    }

    public static String apply(String molecule, Step s) throws UnusualConditionException {
	return apply(molecule, s.getOffset(), s.getFrom(), s.getTo());
    }

    /**
     * Applies {@code steps} left to right, each to the result of the one before.
     */
    public static String apply(String molecule, List<Step> steps) throws UnusualConditionException {
	boolean debug = Debug.isForced();
	String curr = molecule;
	for (Step s : steps) {
	    curr = apply(curr, s);
	    if (debug) Debug.debug(debug, s+" gives "+curr);
	}
	return curr;
    }
}
