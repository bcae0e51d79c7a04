package edu.isi.molsynth;

// one forward rewrite in a synthesis path: at offset, from becomes to
public class Step {
    private final int offset;
    private final String from;
    private final String to;

    public Step(int offset, String from, String to) {
	this.offset = offset;
	this.from = from;
	this.to = to;
    }

    public int getOffset() { return offset; }
    public String getFrom() { return from; }
    public String getTo() { return to; }

    public int hashCode() {
	return 31*(31*offset+from.hashCode())+to.hashCode();
    }
    public boolean equals(Object o) {
	if (!(o instanceof Step))
	    return false;
	Step s = (Step)o;
	return offset == s.offset && from.equals(s.from) && to.equals(s.to);
    }
    public String toString() {
	return offset+": "+from+Transformation.ARROW+to;
    }
}
