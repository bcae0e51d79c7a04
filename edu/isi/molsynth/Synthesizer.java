package edu.isi.molsynth;

import gnu.trove.THashSet;

import java.util.Date;
import java.util.List;
import java.util.Vector;

import edu.stanford.nlp.util.FixedPrioritiesPriorityQueue;

/**
 * Finds a short sequence of forward steps that turns a seed molecule into a
 * target. Forward search from the seed explodes, so this works backward:
 * starting at the target, reversed rules are applied until the seed appears.
 * Candidates are popped shortest first, since in the intended rule sets a
 * reverse step never lengthens a molecule. That ordering is a heuristic; the
 * returned path is minimal on the usual inputs but not for every rule set.
 * <p>
 * One call to {@link #synthesize(String)} owns its queue and visited set. A
 * synthesizer can be reused, but not from several threads at once.
 */
public class Synthesizer {

    /** transformations start from an electron */
    public static final String ELECTRON = "e";

    /** budget before a search is abandoned, in milliseconds */
    public static final long DEFAULT_TIMEOUT = 60*1000;

    private final TransformationSet ts;
    private final String seed;
    private final long timeout;

    // counters from the last search
    private long expanded;
    private long enqueued;

    // a molecule on the agenda, with the forward step that the reverse step
    // into it undoes. back pointers lead to the target
    private static class SearchState {
	final String molecule;
	final Step step;
	final SearchState back;
	final int depth;
	SearchState(String molecule, Step step, SearchState back) {
	    this.molecule = molecule;
	    this.step = step;
	    this.back = back;
	    depth = back == null ? 0 : back.depth+1;
	}
	// walking back from here toward the target visits forward steps in order
	Vector<Step> getPath() {
	    Vector<Step> path = new Vector<Step>(depth);
	    for (SearchState s = this; s.back != null; s = s.back)
		path.add(s.step);
	    return path;
	}
	public String toString() { return molecule+" ("+depth+")"; }
    }

    public Synthesizer(TransformationSet ts) {
	this.ts = ts;
	seed = ELECTRON;
	timeout = DEFAULT_TIMEOUT;
    }

    public Synthesizer(TransformationSet ts, String seed, long timeout) throws ConfigureException {
	if (seed == null || seed.length() == 0)
	    throw new ConfigureException("Seed molecule must not be empty");
	if (timeout < 0)
	    throw new ConfigureException("Search timeout must not be negative: "+timeout);
	this.ts = ts;
	this.seed = seed;
	this.timeout = timeout;
    }

    public String getSeed() { return seed; }
    public long getTimeout() { return timeout; }
    public long getNumExpanded() { return expanded; }
    public long getNumEnqueued() { return enqueued; }

    // forward steps from seed to target, in application order
    public List<Step> synthesize(String target) throws NoSolutionException, SearchTimeoutException,
						      UnusualConditionException {
	boolean debug = Debug.isForced();
	List<Transformation> reverse = ts.getReverseTransformations();
	// max-queue, so shorter molecules get higher priority
	FixedPrioritiesPriorityQueue<SearchState> agenda = new FixedPrioritiesPriorityQueue<SearchState>();
	THashSet<String> seen = new THashSet<String>();
	expanded = 0;
	enqueued = 1;
	agenda.add(new SearchState(target, null, null), -target.length());
	seen.add(target);
	Date startTime = new Date();
	while (!agenda.isEmpty()) {
	    if (new Date().getTime() - startTime.getTime() >= timeout)
		throw new SearchTimeoutException("Search timed out after "+timeout+" ms and "+expanded+
						 " molecules; "+agenda.size()+" left on agenda", expanded, timeout);
	    SearchState curr = agenda.removeFirst();
	    if (curr.molecule.equals(seed)) {
		if (debug) Debug.debug(debug, "Reached "+seed+" after "+expanded+" expansions");
		Debug.dbtime(1, startTime, "synthesized "+target.length()+"-long molecule in "+curr.depth+" steps");
		return curr.getPath();
	    }
	    expanded++;
	    if (debug) Debug.debug(debug, "Popped "+curr);
	    for (Transformation r : reverse) {
		String key = r.getSource();
		// resume past each match rather than restarting at 0
		for (int index = curr.molecule.indexOf(key); index >= 0; index = curr.molecule.indexOf(key, index+1)) {
		    String next = StepApplicator.apply(curr.molecule, index, key, r.getReplacement());
		    if (!seen.add(next))
			continue;
		    // record the forward direction: the rule's original source becomes its replacement
		    SearchState s = new SearchState(next, new Step(index, r.getReplacement(), key), curr);
		    if (!agenda.add(s, -next.length()))
			throw new UnusualConditionException("Couldn't add "+s+" to agenda");
		    enqueued++;
		}
	    }
	}
	throw new NoSolutionException("No solution found: "+seed+" is unreachable from "+target+
				      " after "+expanded+" molecules", expanded);
    }

    // step count only
    public int countSteps(String target) throws NoSolutionException, SearchTimeoutException,
					       UnusualConditionException {
	return synthesize(target).size();
    }
}
