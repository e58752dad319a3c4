package edu.isi.chomsky;

import gnu.trove.map.hash.TLongObjectHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The result of one CYK parse: the verdict, the time the fill took, the
 * triangular table of states per span and the backpointer of every table entry.
 * <p>
 * Cell (i, j), i &lt;= j, holds the states deriving tokens i..j inclusive,
 * sorted by name. Only {@link CYKParser} fills a chart; afterwards it is read
 * only. A chart belongs to a single parse call.
 */
public class CYKChart {

	private final CFGRuleSet grammar;
	private final List<Symbol> tokens;
	private final int n;
	private final TreeSet<Symbol>[][] table;
	// keyed by (i, j, state index); see key()
	private final TLongObjectHashMap<Backpointer> back;
	private boolean accepts;
	private double runtime;

	CYKChart(CFGRuleSet grammar, List<Symbol> tokens) {
		this.grammar = grammar;
		this.tokens = Collections.unmodifiableList(new ArrayList<Symbol>(tokens));
		n = tokens.size();
		table = new TreeSet[n][n];
		for (int i = 0; i < n; i++) {
			for (int j = i; j < n; j++)
				table[i][j] = new TreeSet<Symbol>();
		}
		back = new TLongObjectHashMap<Backpointer>();
		accepts = false;
		runtime = 0.0;
	}

	private long key(int i, int j, int state) {
		return ((long)i * n + j) * grammar.getNumStates() + state;
	}

	private void checkSpan(int i, int j) {
		if (i < 0 || j >= n || i > j)
			throw new IndexOutOfBoundsException("No span ("+i+", "+j+") over "+n+" tokens");
	}

	// first derivation wins: false, and no change, if (i, j, a) is already there
	boolean add(int i, int j, Symbol a, Backpointer bp) {
		if (!table[i][j].add(a))
			return false;
		back.put(key(i, j, grammar.s2i(a)), bp);
		return true;
	}

	// the live cell, for the parser's inner loop
	TreeSet<Symbol> cell(int i, int j) {
		return table[i][j];
	}

	void setResult(boolean accepts, double runtime) {
		this.accepts = accepts;
		this.runtime = runtime;
	}

	// accessors

	public boolean accepts() {
		return accepts;
	}

	/** milliseconds spent filling the table */
	public double getRuntime() {
		return runtime;
	}

	public List<Symbol> getTokens() {
		return tokens;
	}

	public int getLength() {
		return n;
	}

	public CFGRuleSet getGrammar() {
		return grammar;
	}

	public Set<Symbol> getCell(int i, int j) {
		checkSpan(i, j);
		return Collections.unmodifiableSet(table[i][j]);
	}

	/** the backpointer of (i, j, a), or null if a is not in cell (i, j) */
	public Backpointer getBackpointer(int i, int j, Symbol a) {
		checkSpan(i, j);
		if (!grammar.isState(a))
			return null;
		return back.get(key(i, j, grammar.s2i(a)));
	}

	public int getNumBackpointers() {
		return back.size();
	}

	// total number of (i, j, state) entries
	public int getNumEntries() {
		int count = 0;
		for (int i = 0; i < n; i++) {
			for (int j = i; j < n; j++)
				count += table[i][j].size();
		}
		return count;
	}

	private static String formatCell(Set<Symbol> cell) {
		if (cell.isEmpty())
			return "∅";
		StringBuffer sb = new StringBuffer("{");
		boolean first = true;
		for (Symbol s : cell) {
			if (!first)
				sb.append(", ");
			first = false;
			sb.append(s.toString());
		}
		return sb.append("}").toString();
	}

	/**
	 * The table by span length, one row per length L = 1..n, then the tokens:
	 * <pre>
	 * L= 1 | {Det} || {N} || {V}
	 * L= 2 | {NP} || ∅
	 * L= 3 | ∅
	 * tok  | the | cat | sleeps
	 * </pre>
	 * An empty input gives a single line.
	 */
	public String toLevelString() {
		if (n == 0)
			return "(empty string)\n";
		StringBuffer sb = new StringBuffer();
		for (int len = 1; len <= n; len++) {
			sb.append(String.format("L=%2d | ", len));
			for (int i = 0; i + len - 1 < n; i++) {
				if (i > 0)
					sb.append(" || ");
				sb.append(formatCell(table[i][i+len-1]));
			}
			sb.append("\n");
		}
		sb.append("tok  | ");
		for (int i = 0; i < n; i++) {
			if (i > 0)
				sb.append(" | ");
			sb.append(tokens.get(i).toString());
		}
		sb.append("\n");
		return sb.toString();
	}

	public String toString() {
		return "CYKChart[tokens="+tokens+",accepts="+accepts+",entries="+getNumEntries()+"]";
	}
}
