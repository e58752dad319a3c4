package edu.isi.chomsky;

import java.util.List;

/**
 * Rebuilds the derivation tree of an accepted input by following chart
 * backpointers from (0, n-1, start). Terminal entries become <tt>(A token)</tt>,
 * split entries <tt>(A left right)</tt>. Since the parser keeps one derivation
 * per (i, j, A) the tree is one of possibly many.
 */
public class TreeReconstructor {

	/**
	 * The tree, or null if the chart rejected the input. A chart whose
	 * backpointers don't line up with its cells also gives null, and a message.
	 */
	public static ParseTree reconstruct(List<Symbol> tokens, CYKChart chart, Symbol start) {
		try {
			return reconstructStrict(tokens, chart, start);
		}
		catch (UnusualConditionException e) {
			Debug.prettyDebug("Couldn't rebuild tree: "+e.getMessage());
			return null;
		}
	}

	// the chart's own tokens and start symbol
	public static ParseTree reconstruct(CYKChart chart) {
		return reconstruct(chart.getTokens(), chart, chart.getGrammar().getStartState());
	}

	/**
	 * As {@link #reconstruct}, but a missing or mismatched backpointer is an
	 * error. A rejected input still gives null.
	 */
	public static ParseTree reconstructStrict(List<Symbol> tokens, CYKChart chart, Symbol start) throws UnusualConditionException {
		if (!chart.accepts())
			return null;
		int n = tokens.size();
		if (n != chart.getLength())
			throw new UnusualConditionException("Chart covers "+chart.getLength()+" tokens, not "+n);
		if (n == 0)
			return new ParseTree(start, new ParseTree(Symbol.getEpsilon()));
		return build(tokens, chart, 0, n-1, start);
	}

	private static ParseTree build(List<Symbol> tokens, CYKChart chart, int i, int j, Symbol a) throws UnusualConditionException {
		boolean debug = false;
		Backpointer bp = chart.getBackpointer(i, j, a);
		if (bp == null)
			throw new UnusualConditionException("No backpointer for "+a+" over ("+i+", "+j+")");
		if (debug) Debug.debug(debug, "("+i+", "+j+") "+a+": "+bp);
		if (bp.isTerminal()) {
			if (i != j || bp.getToken() != tokens.get(i))
				throw new UnusualConditionException("Terminal backpointer "+bp+" doesn't match token "+i+" of span ("+i+", "+j+")");
			return new ParseTree(a, new ParseTree(bp.getToken()));
		}
		int k = bp.getSplit();
		if (k < i || k >= j)
			throw new UnusualConditionException("Split "+k+" lies outside span ("+i+", "+j+") for "+a);
		ParseTree left = build(tokens, chart, i, k, bp.getLeft());
		ParseTree right = build(tokens, chart, k+1, j, bp.getRight());
		return new ParseTree(a, left, right);
	}
}
