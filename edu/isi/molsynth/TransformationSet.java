package edu.isi.molsynth;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.util.Collections;
import java.util.Comparator;
import java.util.Date;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Vector;

// rules read from a rule/molecule listing, indexed both ways, plus the target
// molecule that ends the listing. read-only once built
public class TransformationSet {

    // all rules, in the order read
    private Vector<Transformation> rules;
    // source -> replacements, sources in first-seen order
    private LinkedHashMap<String, Vector<String>> forward;
    // read-only view of forward, lists included
    private Map<String, List<String>> forwardView;
    // reversed rules, longest key (former replacement) first
    private Vector<Transformation> reverse;
    private String target;

    // longer keys anchor decompositions better, so they go first. sort is
    // stable: equal lengths keep input order
    private static final Comparator<Transformation> LONGEST_SOURCE_FIRST = new Comparator<Transformation>() {
	public int compare(Transformation a, Transformation b) {
	    return b.getSource().length() - a.getSource().length();
	}
    };

    // read a whole rule file; the file is closed before returning
    public static TransformationSet read(String filename, String encoding) throws FileNotFoundException, IOException, DataFormatException {
	BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(filename), encoding));
	try {
	    return new TransformationSet(br);
	}
	finally {
	    br.close();
	}
    }

    // read rules until the first line that isn't one; that line is the target.
    // the reader is left positioned after the target
    public TransformationSet(BufferedReader br) throws IOException, DataFormatException {
	boolean debug = Debug.isForced();
	init();
	Date readTime = new Date();
	String line;
	while ((line = br.readLine()) != null) {
	    if (readLine(line)) {
		if (debug) Debug.debug(debug, "Target is "+target);
		break;
	    }
	}
	finish();
	Debug.dbtime(2, readTime, "read "+rules.size()+" transformations");
    }

    public TransformationSet(Iterable<String> lines) throws DataFormatException {
	init();
	Iterator<String> it = lines.iterator();
	while (it.hasNext()) {
	    if (readLine(it.next()))
		break;
	}
	finish();
    }

    private void init() {
	rules = new Vector<Transformation>();
	forward = new LinkedHashMap<String, Vector<String>>();
	target = null;
    }

    // true if line was the target
    private boolean readLine(String line) throws DataFormatException {
	boolean debug = Debug.isForced();
	if (line.length() == 0)
	    return false;
	if (!Transformation.isRuleLine(line)) {
	    target = line;
	    return true;
	}
	Transformation t = Transformation.parse(line);
	if (debug) Debug.debug(debug, "Made rule "+t);
	rules.add(t);
	Vector<String> reps = forward.get(t.getSource());
	if (reps == null)
	    forward.put(t.getSource(), reps = new Vector<String>());
	reps.add(t.getReplacement());
	return false;
    }

    private void finish() throws DataFormatException {
	if (target == null)
	    throw new DataFormatException("The molecule was not found in the input after "+rules.size()+" rules");
	reverse = new Vector<Transformation>(rules.size());
	for (Transformation t : rules)
	    reverse.add(t.reverse());
	Collections.sort(reverse, LONGEST_SOURCE_FIRST);
	LinkedHashMap<String, List<String>> view = new LinkedHashMap<String, List<String>>();
	for (Map.Entry<String, Vector<String>> e : forward.entrySet())
	    view.put(e.getKey(), Collections.unmodifiableList(e.getValue()));
	forwardView = Collections.unmodifiableMap(view);
    }

    // accessors
    public String getTarget() { return target; }
    public List<Transformation> getTransformations() { return Collections.unmodifiableList(rules); }
    public Map<String, List<String>> getForwardMap() { return forwardView; }
    // replacement => source rules, longest replacement first
    public List<Transformation> getReverseTransformations() { return Collections.unmodifiableList(reverse); }
    public int getNumRules() { return rules.size(); }
    public int getNumSources() { return forward.size(); }
    public boolean isEmpty() { return rules.isEmpty(); }

    // same rules in the same order and same target
    public boolean equals(Object o) {
	if (!(o instanceof TransformationSet))
	    return false;
	TransformationSet ts = (TransformationSet)o;
	return target.equals(ts.target) && rules.equals(ts.rules);
    }
    public int hashCode() { return 31*rules.hashCode()+target.hashCode(); }

    public String toString() {
	StringBuffer sb = new StringBuffer();
	for (Transformation t : rules)
	    sb.append(t.toString()+"\n");
	sb.append("\n"+target+"\n");
	return sb.toString();
    }
}
