package edu.isi.molsynth;

import gnu.trove.THashSet;

import java.util.List;
import java.util.Map;
import java.util.Set;

// one-step forward neighborhood of a molecule
public class Expander {

    private Expander() {}

    // every distinct molecule made by rewriting exactly one occurrence of some
    // source. overlapping occurrences each count
    public static Set<String> expand(String molecule, TransformationSet ts) throws UnusualConditionException {
	boolean debug = Debug.isForced();
	THashSet<String> ret = new THashSet<String>();
	for (Map.Entry<String, List<String>> e : ts.getForwardMap().entrySet()) {
	    String from = e.getKey();
	    for (int index = molecule.indexOf(from); index >= 0; index = molecule.indexOf(from, index+1)) {
		for (String to : e.getValue()) {
		    String next = StepApplicator.apply(molecule, index, from, to);
		    if (ret.add(next) && debug)
			Debug.debug(debug, from+Transformation.ARROW+to+" at "+index+" gives "+next);
		}
	    }
	}
	return ret;
    }

    public static int count(String molecule, TransformationSet ts) throws UnusualConditionException {
	return expand(molecule, ts).size();
    }
}
