package edu.isi.molsynth;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.util.Date;
// diagnostics for the search and the command line. everything goes to stderr
public class Debug {

    static String encoding = "utf-8";
    public static void setEncoding(String s) {
	encoding = s;
	initializeStream();
    }

    // turned on from the command line; classes read it into their local debug flags
    private static boolean forced = false;
    public static void setForced(boolean b) {
	forced = b;
    }
    public static boolean isForced() { return forced; }

    private static OutputStreamWriter w=null;
    private static void initializeStream() {
	try {
	    w = new OutputStreamWriter(System.err, encoding);
	}
	catch (UnsupportedEncodingException e) {
	    System.err.println("Warning: encoding "+encoding+" not supported; using default");
	    w = new OutputStreamWriter(System.err);
	}
    }

    // stuff we always print to stderr
    public static void prettyDebug(String s) {
	write(s);
    }

    // true debugging stuff. caller is looked up from the stack, so only build
    // messages when d is on
    public static void debug(boolean d, String s)  {
	if (!d)
	    return;
	StackTraceElement caller = new Throwable().getStackTrace()[1];
	write(caller.getClassName()+":"+caller.getMethodName()+" : "+s);
    }

    private static int dblevel=-1;
    public static void setDbLevel(int i) {
	dblevel = i;
    }

    // print time taken since pta, if the global level asks for it
    public static void dbtime(int needlevel, Date pta, String msg) {
	if (dblevel < needlevel)
	    return;
	long x = new Date().getTime() - pta.getTime();
	write(msg+": "+x+" ms");
    }

    private static void write(String s) {
	if (w == null)
	    initializeStream();
	try {
	    w.write(s+"\n");
	    w.flush();
	}
	catch (IOException e) {
	    System.err.println("IOException while trying to print "+s);
	}
    }
}
