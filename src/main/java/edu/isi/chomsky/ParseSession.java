package edu.isi.chomsky;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Locale;

/**
 * The read-parse-report loop. Each input line is a command or a sentence:
 * <ul>
 * <li>blank lines are skipped</li>
 * <li><tt>q</tt>, <tt>quit</tt> or <tt>exit</tt> (any case) end the session</li>
 * <li><tt>cnf</tt> prints the active grammar</li>
 * <li>anything else is normalized, tokenized, parsed and reported</li>
 * </ul>
 * Reports go to the writer given at construction.
 */
public class ParseSession {

	private final CYKParser parser;
	private final Tokenizer tokenizer;
	private final Writer out;
	private final boolean quiet;

	// counts for the closing summary
	private int numSentences = 0;
	private int numAccepted = 0;

	public ParseSession(CYKParser parser, Tokenizer tokenizer, Writer out, boolean quiet) {
		this.parser = parser;
		this.tokenizer = tokenizer;
		this.out = out;
		this.quiet = quiet;
	}

	public ParseSession(CYKParser parser, Tokenizer tokenizer, Writer out) {
		this(parser, tokenizer, out, false);
	}

	public int getNumSentences() { return numSentences; }
	public int getNumAccepted() { return numAccepted; }

	/** process lines until end of input or a quit command */
	public void run(BufferedReader br) throws IOException {
		String line;
		while ((line = br.readLine()) != null) {
			if (!process(line))
				break;
		}
		out.flush();
	}

	/**
	 * Handle one line of input.
	 * @return false if the line was a quit command
	 */
	public boolean process(String line) throws IOException {
		boolean debug = false;
		String cmd = line.trim();
		if (cmd.length() == 0)
			return true;
		String lower = cmd.toLowerCase(Locale.ROOT);
		if (lower.equals("q") || lower.equals("quit") || lower.equals("exit")) {
			if (debug) Debug.debug(debug, "Quitting on "+cmd);
			return false;
		}
		if (lower.equals("cnf")) {
			printGrammar();
			return true;
		}
		List<String> tokens = tokenizer.tokenize(Tokenizer.normalizeInput(cmd));
		List<Symbol> syms = SymbolFactory.getSymbols(tokens);
		CYKChart chart = parser.parse(syms);
		numSentences++;
		if (chart.accepts())
			numAccepted++;
		ParseTree tree = chart.accepts() ? TreeReconstructor.reconstruct(chart) : null;
		if (quiet)
			reportQuiet(chart, tree);
		else
			report(tokens, chart, tree);
		out.flush();
		return true;
	}

	private void printGrammar() throws IOException {
		out.write("Active grammar (CNF), start symbol "+parser.getGrammar().getStartState());
		if (parser.getGrammar().isStartNullable())
			out.write(", accepts the empty string");
		out.write("\n");
		out.write(parser.getGrammar().toSortedString());
		out.write("\n");
		out.flush();
	}

	private void reportQuiet(CYKChart chart, ParseTree tree) throws IOException {
		if (!chart.accepts())
			out.write("rejected\n");
		else if (tree == null)
			out.write("accepted\n");
		else
			out.write("accepted\t"+tree.toBracketedString()+"\n");
	}

	private void report(List<String> tokens, CYKChart chart, ParseTree tree) throws IOException {
		String ms = Rounding.round(chart.getRuntime(), 3);
		out.write("\nTokens: "+tokens+"\n");
		out.write("Accepted: "+(chart.accepts() ? "yes" : "no")+"   (t = "+ms+" ms)\n");
		out.write("Length: "+tokens.size()+"\n");
		out.write("\nCYK table (rows by span length)\n");
		out.write(chart.toLevelString());
		if (tree != null) {
			out.write("\nParse tree:\n");
			out.write("   "+tree.toBracketedString()+"\n");
		}
		out.write("Summary: "+(chart.accepts() ? "ACCEPTED" : "REJECTED")+
			" - "+tokens.size()+" tokens - "+Rounding.round(chart.getRuntime(), 2)+" ms\n\n");
	}
}
