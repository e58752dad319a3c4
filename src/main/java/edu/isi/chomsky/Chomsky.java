package edu.isi.chomsky;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.Date;
import java.util.Iterator;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line options, etc.
public class Chomsky {
	// version number. change this when updating chomsky!
	static final String VERSION = "1.0";

	// create a summary of a grammar and add it to a buffer
	private static void getRuleSetCheck(StringBuffer buffer, String name, CFGRuleSet rs) {
		buffer.append("CFG info for "+name+":\n");
		buffer.append("\t"+rs.getNumStates()+" states\n");
		buffer.append("\t"+rs.getNumRules()+" rules\n");
		buffer.append("\t"+rs.getNumTerminals()+" unique terminal symbols\n");
		if (rs.isStartNullable())
			buffer.append("\tstart symbol derives the empty string\n");
	}

	// bundled grammar for a tokenizer, used when no grammar file is named. null if none
	static String getBuiltinGrammar(String tokenizer) {
		if (Tokenizer.EXPR.equals(tokenizer))
			return "/grammars/arith.cfg";
		if (Tokenizer.WORDS.equals(tokenizer))
			return "/grammars/english.cfg";
		return null;
	}

	// bundled grammars are always utf-8
	private static CFGRuleSet readBuiltinGrammar(String resource) throws IOException, DataFormatException {
		InputStream is = Chomsky.class.getResourceAsStream(resource);
		if (is == null)
			throw new FileNotFoundException("no bundled grammar "+resource);
		BufferedReader br = new BufferedReader(new InputStreamReader(is, "utf-8"));
		try {
			return new CFGRuleSet(br);
		}
		finally {
			br.close();
		}
	}

	// everything having to do with the JSAP parameters and config exceptions based on this.
	// Sets the jsap object
	static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		// HELP OPTION
		Switch helpsw = new Switch("help",
				'h',
				"help",
				"print this help message");
		jsap.registerParameter(helpsw);

		// format of the grammar, input and output - assumed utf-8 but can be changed here
		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of grammar, input and output files, if other than utf-8. Use the same "+
				"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		// how input lines become terminals
		FlaggedOption tokopt = new FlaggedOption("tokenizer",
				EnumeratedStringParser.getParser(Tokenizer.EXPR+"; "+Tokenizer.WORDS+"; "+Tokenizer.PLAIN),
				Tokenizer.WORDS,
				true,
				'k',
				"tokenizer",
				"how to split input lines: expr (arithmetic; identifiers and numbers become 'id'), "+
				"words (lowercased words, punctuation dropped), or plain (whitespace only)");
		jsap.registerParameter(tokopt);

		// skip conversion
		Switch nocnfsw = new Switch("nocnf",
				'n',
				"nocnf",
				"the grammar is already in Chomsky Normal Form: verify it and skip conversion");
		jsap.registerParameter(nocnfsw);

		Switch csw = new Switch("check",
				'c',
				"check",
				"print the number of states, rules, and terminals of the grammar before "+
				"and after conversion");
		jsap.registerParameter(csw);

		Switch printsw = new Switch("printcnf",
				'p',
				"printcnf",
				"print the grammar used for parsing before reading any input");
		jsap.registerParameter(printsw);

		Switch quietsw = new Switch("quiet",
				'q',
				"quiet",
				"for each sentence print only the verdict and the tree");
		jsap.registerParameter(quietsw);

		// print timing information to stderr. number determines level of information
		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"time",
				"Print timing information to stderr at a variety of levels: 1+ for "+
				"loading, conversion and total parsing, 2+ for each conversion pass");
		jsap.registerParameter(timeopt);

		// output file - if specified, whatever is written is written here. otherwise to stdout
		FlaggedOption outfileopt =
			new FlaggedOption("outfile",
					FileStringParser.getParser(),
					null,
					false,
					'o',
					"outputfile",
					"file to write reports to. If absent, writing is done to stdout");
		jsap.registerParameter(outfileopt);

		UnflaggedOption grammaropt = new UnflaggedOption("grammar",
				FileStringParser.getParser(),
				null,
				false,
				false,
				"grammar file: one 'LHS -> alt | alt ...' group per line, # comments, "+
				"'e' or an empty alternative for the empty string. The first LHS is the start symbol. "+
				"If absent, the bundled arithmetic (expr) or English (words) grammar is used "+
				"and sentences are read from stdin");
		jsap.registerParameter(grammaropt);

		UnflaggedOption inputopt = new UnflaggedOption("input",
				FileStringParser.getParser(),
				null,
				false,
				false,
				"sentences to parse, one per line. If absent or '-', read from stdin");
		jsap.registerParameter(inputopt);

		JSAPResult config = jsap.parse(argv);

		if (config.getBoolean("nocnf", false) && config.getBoolean("check", false))
			throw new ConfigureException("--check compares the grammar before and after conversion; "+
					"it can't be used with --nocnf");
		if (config.contains("time") && config.getInt("time") < 0)
			throw new ConfigureException("--time level must be at least 0");
		if (config.success() && !config.getBoolean("help", false) && !config.contains("grammar") &&
				getBuiltinGrammar(config.getString("tokenizer")) == null)
			throw new ConfigureException("no grammar file given and no bundled grammar for tokenizer "+
					config.getString("tokenizer"));
		return config;
	}

	// stdin for '-' or no file at all
	private static BufferedReader openInput(File f, String encoding) throws FileNotFoundException, IOException {
		if (f == null || f.getName().equals("-"))
			return new BufferedReader(new InputStreamReader(System.in, encoding));
		return new BufferedReader(new InputStreamReader(new FileInputStream(f), encoding));
	}

	public static void main(String argv[]) {
		System.exit(run(argv));
	}

	// everything main does except exiting. returns the exit status
	static int run(String argv[]) {
		boolean debug = false;

		Date startTime = new Date();
		// parameter processor and configuration settings
		JSAP jsap = new JSAP();
		JSAPResult config = null;

		// encoding of read and written files
		String encoding = null;
		Tokenizer tokenizer = null;
		File grammarFile = null;
		String grammarName = null;
		String builtin = null;
		File inputFile = null;
		File outfile = null;

		// 1) Set up all parameters. Die on bad combinations.
		try {
			config = processParameters(jsap, argv);
			if (config.getBoolean("help", false)) {
				Debug.prettyDebug("This is Chomsky, version "+VERSION);
				Debug.prettyDebug("Usage: chomsky ");
				Debug.prettyDebug("             "+jsap.getUsage());
				Debug.prettyDebug("");
				Debug.prettyDebug(jsap.getHelp());
				return 0;
			}
			if (!config.success()) {
				for (Iterator<?> errs = config.getErrorMessageIterator(); errs.hasNext();) {
					Debug.prettyDebug("Error: " + errs.next());
				}
				Debug.prettyDebug("Usage: chomsky ");
				Debug.prettyDebug("             "+jsap.getUsage());
				return 1;
			}
			encoding = config.getString("encoding");
			Debug.setEncoding(encoding);
			if (config.contains("time"))
				Debug.setDbLevel(config.getInt("time"));
			tokenizer = Tokenizer.get(config.getString("tokenizer"));
			grammarFile = config.getFile("grammar");
			if (grammarFile != null)
				grammarName = grammarFile.getName();
			else {
				builtin = getBuiltinGrammar(tokenizer.getName());
				grammarName = builtin.substring(builtin.lastIndexOf('/')+1);
			}
			inputFile = config.getFile("input");
			outfile = config.getFile("outfile");
		}
		catch (JSAPException e) {
			System.err.println("Chomsky options improperly configured: "+e.getMessage());
			System.err.println("Try 'chomsky -h' for a detailed help message");
			return 1;
		}
		catch (ConfigureException e) {
			System.err.println("Chomsky options improperly configured: "+e.getMessage());
			System.err.println("Try 'chomsky -h' for a detailed help message");
			return 1;
		}

		// 2) Read and convert the grammar
		CFGRuleSet cnf = null;
		StringBuffer checkBuffer = new StringBuffer();
		try {
			Date readTime = new Date();
			CFGRuleSet cfg = null;
			if (grammarFile != null)
				cfg = new CFGRuleSet(grammarFile.getPath(), encoding);
			else {
				cfg = readBuiltinGrammar(builtin);
				Debug.prettyDebug("No grammar file given; using bundled "+grammarName);
			}
			Debug.dbtime(1, readTime, "read grammar from "+grammarName);
			Debug.prettyDebug("Grammar loaded (start symbol = "+cfg.getStartState()+")");
			if (config.getBoolean("nocnf")) {
				cnf = CNFConverter.asNormal(cfg);
				Debug.prettyDebug("Using grammar already in CNF");
			}
			else {
				if (config.getBoolean("check"))
					getRuleSetCheck(checkBuffer, grammarName, cfg);
				Date convTime = new Date();
				cnf = new CNFConverter().convert(cfg);
				Debug.dbtime(1, convTime, "convert to CNF");
				Debug.prettyDebug("Conversion to CNF done");
				if (config.getBoolean("check"))
					getRuleSetCheck(checkBuffer, grammarName+" in CNF", cnf);
			}
		}
		catch (FileNotFoundException e) {
			System.err.println("Couldn't read grammar: "+e.getMessage());
			return 1;
		}
		catch (IOException e) {
			System.err.println("Couldn't read grammar "+grammarName+": "+e.getMessage());
			return 1;
		}
		catch (DataFormatException e) {
			System.err.println("Bad grammar "+grammarName+": "+e.getMessage());
			return 1;
		}
		catch (ImproperConversionException e) {
			System.err.println("Bad grammar "+grammarName+": "+e.getMessage());
			return 1;
		}

		// 3) Parse the input, reporting as we go
		Writer w = null;
		try {
			CYKParser parser = new CYKParser(cnf);
			if (outfile != null)
				w = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(outfile), encoding));
			else
				w = new BufferedWriter(new OutputStreamWriter(System.out, encoding));
			if (checkBuffer.length() > 0)
				w.write(checkBuffer.toString());
			ParseSession session = new ParseSession(parser, tokenizer, w, config.getBoolean("quiet"));
			if (config.getBoolean("printcnf"))
				session.process("cnf");
			BufferedReader br = openInput(inputFile, encoding);
			if (inputFile == null || inputFile.getName().equals("-"))
				Debug.prettyDebug("Enter a sentence to parse; 'cnf' shows the grammar; 'q' quits.");
			Date parseTime = new Date();
			try {
				session.run(br);
			}
			finally {
				br.close();
			}
			Debug.dbtime(1, parseTime, "parse "+session.getNumSentences()+" sentences");
			if (debug) Debug.debug(debug, session.getNumAccepted()+" of "+session.getNumSentences()+" accepted");
		}
		catch (ImproperConversionException e) {
			System.err.println("Conversion produced a bad grammar: "+e.getMessage());
			return 1;
		}
		catch (IOException e) {
			System.err.println("Problem reading input or writing output: "+e.getMessage());
			return 1;
		}
		finally {
			if (w != null) {
				try {
					w.flush();
					if (outfile != null)
						w.close();
				}
				catch (IOException e) {
					System.err.println("Problem closing output: "+e.getMessage());
				}
			}
		}
		Debug.dbtime(0, startTime, "total operation");
		return 0;
	}
}
