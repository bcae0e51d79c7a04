package edu.isi.molsynth;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.Arrays;
import java.util.Date;
import java.util.Iterator;
import java.util.List;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.LongStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line options, etc.
public class MolSynth {
	// version number. change this when updating!
	static final String VERSION = "1.0";

	// read when no file is named
	static final String DEFAULT_INPUT = "input.txt";

	// exit statuses
	static final int EXIT_OK = 0;
	static final int EXIT_CONFIG = 1;
	static final int EXIT_NO_SOLUTION = 2;
	static final int EXIT_TIMEOUT = 3;

	// where rule/molecule lines come from
	public enum Input { FILE, ARGS, STDIN ;
	private static final String list;
	static {
		StringBuffer sb = new StringBuffer();
		for (Input x: Input.values()) {
			sb.append(x.toString().toLowerCase()+" ");
		}
		list = sb.toString();
	}
	public static Input get(String s) throws ConfigureException{
		for (Input x : Input.values()) {
			if (x.toString().equalsIgnoreCase(s))
				return x;
		}
		throw new ConfigureException("Invalid input method ("+s+"); valid values are "+list);
	}
	}

	// everything having to do with the JSAP parameters and config exceptions based on this.
	private static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		// HELP OPTION
		Switch helpsw = new Switch("help",
				'h',
				"help",
		"print this help message");
		jsap.registerParameter(helpsw);

		// OPTIONS REGARDING THE FUNDAMENTALS OF DATA INPUT

		// encoding of input files, stdin and output
		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output, if other than utf-8. Use the same "+
		"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		// how the data arguments are interpreted
		FlaggedOption inputopt = new FlaggedOption("input",
				EnumeratedStringParser.getParser("file; args; stdin"),
				"file",
				true,
				'i',
				"input",
				"where rules and the target molecule are read from: file (the one file named in the data, "+
				"or "+DEFAULT_INPUT+" if none is), args (each data argument is one line) or stdin");
		jsap.registerParameter(inputopt);

		// OPTIONS REGARDING THE SEARCH

		FlaggedOption seedopt = new FlaggedOption("seed",
				StringStringParser.getParser(),
				Synthesizer.ELECTRON,
				true,
				's',
				"seed",
		"molecule that synthesis starts from");
		jsap.registerParameter(seedopt);

		FlaggedOption timeoutopt = new FlaggedOption("timeout",
				LongStringParser.getParser(),
				""+(Synthesizer.DEFAULT_TIMEOUT/1000),
				true,
				't',
				"timeout",
				"seconds before the synthesis search is abandoned. 0 gives up at once");
		jsap.registerParameter(timeoutopt);

		// OPTIONS REGARDING THE DATA THAT IS OUTPUT

		Switch pathsw = new Switch("path",
				'p',
				"path",
		"print each forward step of the synthesis after the step count");
		jsap.registerParameter(pathsw);

		Switch debugsw = new Switch("debug",
				'd',
				"debug",
		"print search and parse tracing to stderr");
		jsap.registerParameter(debugsw);

		// print timing information to stderr. number determines level of information
		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"timedebug",
				"Print timing information to stderr at a variety of levels: 0+ for "+
		"total operation, 1+ for each processing stage, 2+ for small info");
		jsap.registerParameter(timeopt);

		// output file - if specified, whatever is written is written here. otherwise to stdout
		FlaggedOption outfileopt =
			new FlaggedOption("outfile",
					FileStringParser.getParser(),
					null,
					false,
					'o',
					"outputfile",
			"file to write results to. If absent, writing is done to stdout");
		jsap.registerParameter(outfileopt);

		UnflaggedOption dataopt = new UnflaggedOption("data",
				StringStringParser.getParser(),
				null,
				false,
				true,
				"input file when reading a file, or the rule lines followed by the target "+
		"molecule when reading args. Nothing when reading stdin.");
		jsap.registerParameter(dataopt);

		JSAPResult config = jsap.parse(argv);
		if (!config.success() || config.getBoolean("help"))
			return config;

		Input in = Input.get(config.getString("input"));
		String[] data = config.getStringArray("data");
		if (in == Input.FILE && data.length > 1)
			throw new ConfigureException("Can only read one input file; saw "+data.length);
		if (in == Input.ARGS && data.length == 0)
			throw new ConfigureException("Reading from args (-i args) but no lines were given");
		if (in == Input.STDIN && data.length > 0)
			throw new ConfigureException("Reading from stdin (-i stdin) but data arguments were also given");
		if (config.getString("seed").length() == 0)
			throw new ConfigureException("Seed molecule (-s) must not be empty");

		return config;
	}

	// read the rule listing from wherever the config says
	private static TransformationSet loadInput(Input in, String[] data, String encoding) throws IOException, DataFormatException {
		boolean debug = Debug.isForced();
		switch (in) {
		case ARGS:
			if (debug) Debug.debug(debug, "Reading "+data.length+" lines from args");
			return new TransformationSet(Arrays.asList(data));
		case STDIN:
			if (debug) Debug.debug(debug, "Reading from stdin");
			return new TransformationSet(new BufferedReader(new InputStreamReader(System.in, encoding)));
		default:
			String filename = data.length == 0 ? DEFAULT_INPUT : data[0];
			if (debug) Debug.debug(debug, "Reading from "+filename);
			return TransformationSet.read(filename, encoding);
		}
	}

	// whole run, minus the exit. results go to out unless -o says otherwise
	static int run(String argv[], Writer out) throws IOException, UnusualConditionException {
		boolean debug = false;
		Date startTime = new Date();
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		try {
			config = processParameters(jsap, argv);
		}
		catch (JSAPException e) {
			Debug.prettyDebug("MolSynth options improperly configured: "+e.getMessage());
			Debug.prettyDebug("Try 'molsynth -h' for a detailed help message");
			return EXIT_CONFIG;
		}
		catch (ConfigureException e) {
			Debug.prettyDebug("MolSynth options improperly configured: "+e.getMessage());
			Debug.prettyDebug("Try 'molsynth -h' for a detailed help message");
			return EXIT_CONFIG;
		}

		if (config.getBoolean("help")) {
			Debug.prettyDebug("Usage: molsynth ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			return EXIT_OK;
		}

		if (!config.success()) {
			for (Iterator errs = config.getErrorMessageIterator(); errs.hasNext();) {
				Debug.prettyDebug("Error: " + errs.next());
			}
			Debug.prettyDebug("Usage: molsynth ");
			Debug.prettyDebug("             "+jsap.getUsage());
			return EXIT_CONFIG;
		}

		String encoding = config.getString("encoding");
		Debug.setEncoding(encoding);
		Debug.setForced(config.getBoolean("debug"));
		debug = Debug.isForced();
		if (config.contains("time"))
			Debug.setDbLevel(config.getInt("time"));
		if (debug) Debug.debug(debug, "Debugging on");

		TransformationSet ts = null;
		Synthesizer syn = null;
		try {
			Date preLoadTime = new Date();
			ts = loadInput(Input.get(config.getString("input")), config.getStringArray("data"), encoding);
			Debug.dbtime(1, preLoadTime, "loaded "+ts.getNumRules()+" transformations");
			syn = new Synthesizer(ts, config.getString("seed"), config.getLong("timeout")*1000);
		}
		catch (ConfigureException e) {
			Debug.prettyDebug("MolSynth options improperly configured: "+e.getMessage());
			return EXIT_CONFIG;
		}
		catch (DataFormatException e) {
			Debug.prettyDebug("Bad input: "+e.getMessage());
			return EXIT_CONFIG;
		}
		catch (IOException e) {
			Debug.prettyDebug("Couldn't read input: "+e.getMessage());
			return EXIT_CONFIG;
		}

		File outfile = config.getFile("outfile");
		Writer w = out;
		if (outfile != null) {
			try {
				w = new OutputStreamWriter(new FileOutputStream(outfile), encoding);
			}
			catch (IOException e) {
				Debug.prettyDebug("Couldn't write output: "+e.getMessage());
				return EXIT_CONFIG;
			}
		}
		try {
			String target = ts.getTarget();
			Date preExpandTime = new Date();
			w.write("Next steps: "+Expander.count(target, ts)+"\n");
			w.flush();
			Debug.dbtime(1, preExpandTime, "expanded target");

			List<Step> path = null;
			try {
				path = syn.synthesize(target);
			}
			catch (NoSolutionException e) {
				Debug.prettyDebug(e.getMessage());
				return EXIT_NO_SOLUTION;
			}
			catch (SearchTimeoutException e) {
				Debug.prettyDebug(e.getMessage());
				return EXIT_TIMEOUT;
			}
			if (debug) Debug.debug(debug, "Expanded "+syn.getNumExpanded()+", enqueued "+syn.getNumEnqueued());
			// a path that doesn't rebuild the target is our bug, not the input's
			String rebuilt = StepApplicator.apply(syn.getSeed(), path);
			if (!rebuilt.equals(target))
				throw new UnusualConditionException("Path of "+path.size()+" steps builds "+rebuilt+", not "+target);
			w.write("Fewest number of steps: "+path.size()+"\n");
			if (config.getBoolean("path")) {
				for (Step s : path)
					w.write(s+"\n");
			}
			w.flush();
		}
		finally {
			if (w != out)
				w.close();
		}
		Debug.dbtime(0, startTime, "total");
		return EXIT_OK;
	}

	public static void main(String argv[]) throws Exception {
		Debug.prettyDebug("This is MolSynth, version "+VERSION);
		OutputStreamWriter w = new OutputStreamWriter(System.out, "utf-8");
		int status = run(argv, w);
		w.flush();
		System.exit(status);
	}
}
