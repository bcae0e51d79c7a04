package edu.isi.molsynth;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

// a single rewrite rule: one occurrence of source becomes replacement.
// immutable. reversed copies are used by the backward search
public class Transformation {

    /** separates the two sides of a rule line */
    static final public String ARROW = " => ";

    // split at the first arrow; anything after belongs to the replacement
    private static Pattern rulePat = Pattern.compile("(.*?)"+Pattern.quote(ARROW)+"(.*)");

    private final String source;
    private final String replacement;
    private final int hsh;

    public Transformation(String source, String replacement) throws DataFormatException {
	if (source == null || source.length() == 0)
	    throw new DataFormatException("Empty source in transformation to "+replacement);
	if (replacement == null || replacement.length() == 0)
	    throw new DataFormatException("Empty replacement in transformation from "+source);
	this.source = source;
	this.replacement = replacement;
	hsh = 31*source.hashCode()+replacement.hashCode();
    }

    // both sides already known to be non-empty
    private Transformation(Transformation t) {
	source = t.replacement;
	replacement = t.source;
	hsh = 31*source.hashCode()+replacement.hashCode();
    }

    // read from a rule line, e.g. "H => HO"
    public static Transformation parse(String line) throws DataFormatException {
	Matcher m = rulePat.matcher(line);
	if (!m.matches())
	    throw new DataFormatException("No '"+ARROW.trim()+"' in rule line "+line);
	try {
	    return new Transformation(m.group(1), m.group(2));
	}
	catch (DataFormatException e) {
	    throw new DataFormatException(line+", "+e.getMessage(), e);
	}
    }

    public static boolean isRuleLine(String line) {
	return line.contains(ARROW);
    }

    // accessors
    public String getSource() { return source; }
    public String getReplacement() { return replacement; }

    // replacement => source
    public Transformation reverse() {
	return new Transformation(this);
    }

    public int hashCode() { return hsh; }

    public boolean equals(Object o) {
	if (!(o instanceof Transformation))
	    return false;
	Transformation t = (Transformation)o;
	return source.equals(t.source) && replacement.equals(t.replacement);
    }

    public String toString() {
	return source+ARROW+replacement;
    }
}
