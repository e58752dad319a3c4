package edu.isi.chomsky;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.Vector;

/**
 * CYK recognition over a CNF grammar.
 * <p>
 * The constructor indexes the grammar by rhs (<tt>[a]</tt> or <tt>[B, C]</tt>
 * to the sorted set of states producing it) so that filling a cell never
 * rescans the rules; a parse of n tokens is O(n^3 |G|). The parser keeps no
 * per-parse state and may be shared; each {@link #parse} call gets its own chart.
 * <p>
 * No ambiguity resolution: for each (i, j, A) the first derivation found is the
 * one kept. Split points are tried in increasing order and left, right and
 * parent states in name order, so the kept derivation is the same on every run.
 */
public class CYKParser {

	private final CFGRuleSet grammar;
	private final HashMap<List<Symbol>, TreeSet<Symbol>> rhs2lhs;

	public CYKParser(CFGRuleSet cnf) throws ImproperConversionException {
		boolean debug = false;
		CFGRule bad = cnf.findAbnormalRule();
		if (bad != null)
			throw new ImproperConversionException("Grammar is not in Chomsky Normal Form: "+bad);
		grammar = cnf;
		rhs2lhs = new HashMap<List<Symbol>, TreeSet<Symbol>>();
		for (CFGRule r : cnf.getRules()) {
			if (!rhs2lhs.containsKey(r.getRHS()))
				rhs2lhs.put(r.getRHS(), new TreeSet<Symbol>());
			rhs2lhs.get(r.getRHS()).add(r.getLHS());
		}
		if (debug) Debug.debug(debug, "Indexed "+rhs2lhs.size()+" right hand sides");
	}

	public CFGRuleSet getGrammar() {
		return grammar;
	}

	private Set<Symbol> producers(List<Symbol> key) {
		Set<Symbol> ret = rhs2lhs.get(key);
		return ret == null ? Collections.<Symbol>emptySet() : ret;
	}

	// parse a sequence of terminal names
	public CYKChart parseStrings(List<String> tokens) {
		return parse(SymbolFactory.getSymbols(tokens));
	}

	public CYKChart parse(List<Symbol> tokens) {
		boolean debug = false;
		CYKChart chart = new CYKChart(grammar, tokens);
		int n = tokens.size();
		if (n == 0) {
			chart.setResult(grammar.isStartNullable(), 0.0);
			return chart;
		}
		long startTime = System.nanoTime();

		// length-one spans straight from the index
		Vector<Symbol> unary = new Vector<Symbol>(1);
		unary.add(null);
		for (int i = 0; i < n; i++) {
			unary.set(0, tokens.get(i));
			for (Symbol a : producers(unary)) {
				if (debug) Debug.debug(debug, "("+i+", "+i+"): "+a+" -> "+tokens.get(i));
				chart.add(i, i, a, Backpointer.terminal(tokens.get(i)));
			}
		}

		Vector<Symbol> binary = new Vector<Symbol>(2);
		binary.add(null);
		binary.add(null);
		for (int len = 2; len <= n; len++) {
			for (int i = 0; i + len - 1 < n; i++) {
				int j = i + len - 1;
				for (int k = i; k < j; k++) {
					TreeSet<Symbol> leftCell = chart.cell(i, k);
					TreeSet<Symbol> rightCell = chart.cell(k+1, j);
					if (leftCell.isEmpty() || rightCell.isEmpty())
						continue;
					for (Symbol b : leftCell) {
						binary.set(0, b);
						for (Symbol c : rightCell) {
							binary.set(1, c);
							for (Symbol a : producers(binary)) {
								if (chart.add(i, j, a, Backpointer.split(k, b, c)))
									if (debug) Debug.debug(debug, "("+i+", "+j+"): "+a+" -> "+b+" "+c+" at "+k);
							}
						}
					}
				}
			}
		}
		boolean accepts = chart.cell(0, n-1).contains(grammar.getStartState());
		chart.setResult(accepts, (System.nanoTime() - startTime) / 1.0e6);
		return chart;
	}
}
