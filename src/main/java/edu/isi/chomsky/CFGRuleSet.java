package edu.isi.chomsky;

import gnu.trove.map.hash.TObjectIntHashMap;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.Vector;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A context-free grammar: a start symbol and rules grouped by lhs.
 * <p>
 * Immutable once built. States (nonterminals) are the start symbol and every
 * symbol that appears as an lhs; every other rhs symbol is a terminal. The
 * <tt>startNullable</tt> flag is set by {@link CNFConverter} to remember that the
 * grammar it converted derived the empty string, which CNF itself cannot say.
 */
public class CFGRuleSet {

	private final Symbol startState;
	private final boolean startNullable;

	// insertion ordered so printing and conversion follow the grammar file
	private final LinkedHashMap<Symbol, Set<CFGRule>> rulesByLHS;
	private final ArrayList<CFGRule> rules;

	// implicitly filled, automatically defined
	private final LinkedHashSet<Symbol> states;
	private final LinkedHashSet<Symbol> terminals;

	// integer mapping to and from states, used by the parser to key its chart
	private final TObjectIntHashMap<Symbol> s2i;
	private final Symbol[] i2s;

	public CFGRuleSet(Symbol start, Collection<CFGRule> inrules, boolean nullable) {
		boolean debug = false;
		if (start == null)
			throw new NullPointerException("Start symbol may not be null");
		startState = start;
		startNullable = nullable;
		rulesByLHS = new LinkedHashMap<Symbol, Set<CFGRule>>();
		for (CFGRule r : inrules) {
			if (!rulesByLHS.containsKey(r.getLHS()))
				rulesByLHS.put(r.getLHS(), new LinkedHashSet<CFGRule>());
			rulesByLHS.get(r.getLHS()).add(r);
		}
		rules = new ArrayList<CFGRule>();
		for (Symbol lhs : rulesByLHS.keySet()) {
			rules.addAll(rulesByLHS.get(lhs));
			rulesByLHS.put(lhs, Collections.unmodifiableSet(rulesByLHS.get(lhs)));
		}

		// first add states (ie nonterminals)
		states = new LinkedHashSet<Symbol>();
		states.add(startState);
		states.addAll(rulesByLHS.keySet());
		// to find terminals, check each rule for symbols that are not in the state set
		terminals = new LinkedHashSet<Symbol>();
		for (CFGRule r : rules) {
			for (Symbol s : r.getRHS()) {
				if (!states.contains(s) && !s.isEpsilon())
					terminals.add(s);
			}
		}
		s2i = new TObjectIntHashMap<Symbol>();
		i2s = new Symbol[states.size()];
		int nextState = 0;
		for (Symbol s : states) {
			if (debug) Debug.debug(debug, "Mapping "+nextState+" to "+s);
			s2i.put(s, nextState);
			i2s[nextState++] = s;
		}
	}

	public CFGRuleSet(Symbol start, Collection<CFGRule> inrules) {
		this(start, inrules, false);
	}

	// from a production map, the form the conversion passes work in
	public CFGRuleSet(Symbol start, Map<Symbol, ? extends Collection<List<Symbol>>> productions, boolean nullable) {
		this(start, toRules(productions), nullable);
	}

	private static List<CFGRule> toRules(Map<Symbol, ? extends Collection<List<Symbol>>> productions) {
		List<CFGRule> ret = new ArrayList<CFGRule>();
		for (Map.Entry<Symbol, ? extends Collection<List<Symbol>>> ent : productions.entrySet()) {
			for (List<Symbol> rhs : ent.getValue())
				ret.add(new CFGRule(ent.getKey(), rhs));
		}
		return ret;
	}

	public CFGRuleSet(String filename, String encoding) throws FileNotFoundException, IOException, DataFormatException  {
		this(new BufferedReader(new InputStreamReader(new FileInputStream(filename), encoding)));
	}

	// read from file. the start state is the first lhs seen
	public CFGRuleSet(BufferedReader br) throws IOException, DataFormatException {
		this(readStart(br));
	}

	// private holder so the reader constructor can delegate to the main one
	private CFGRuleSet(ReadResult rr) {
		this(rr.start, rr.rules, false);
	}

	private static class ReadResult {
		Symbol start;
		List<CFGRule> rules;
	}

	// strip comments off
	private static Pattern commentStripPat = Pattern.compile("([^#]*)(#.*)?");

	// lhs, arrow, rhs alternatives
	private static Pattern sidesPat = Pattern.compile("(.*?)->(.*)");

	/** the reserved literal for the empty alternative */
	public static final String EPSILON_LITERAL = "e";

	private static ReadResult readStart(BufferedReader br) throws IOException, DataFormatException {
		boolean debug = false;
		ReadResult rr = new ReadResult();
		rr.rules = new ArrayList<CFGRule>();
		int lineno = 0;
		Date readTime = new Date();
		try {
			String line;
			while ((line = br.readLine()) != null) {
				lineno++;
				Matcher commentStripMatch = commentStripPat.matcher(line);
				// can't fail; the pattern matches everything
				commentStripMatch.matches();
				String ruleText = commentStripMatch.group(1).trim();
				if (ruleText.length() == 0) {
					if (debug) Debug.debug(debug, "Ignoring comment/whitespace: "+line);
					continue;
				}
				Matcher sidesMatch = sidesPat.matcher(ruleText);
				if (!sidesMatch.matches())
					throw new DataFormatException(lineno, "Invalid rule, missing '->': "+ruleText);
				String lhsText = sidesMatch.group(1).trim();
				if (lhsText.length() == 0)
					throw new DataFormatException(lineno, "LHS appears to be empty in "+ruleText);
				if (lhsText.split("\\s+").length > 1)
					throw new DataFormatException(lineno, "LHS must be a single symbol in "+ruleText);
				Symbol lhs = SymbolFactory.getSymbol(lhsText);
				if (rr.start == null)
					rr.start = lhs;
				// -1 keeps trailing empty alternatives, which are epsilon
				for (String alt : sidesMatch.group(2).split("\\|", -1)) {
					CFGRule r = readAlternative(lineno, lhs, alt.trim());
					if (debug) Debug.debug(debug, "Made rule "+r.toString());
					rr.rules.add(r);
				}
			}
		}
		finally {
			br.close();
		}
		if (rr.start == null)
			throw new DataFormatException("Empty grammar: no productions found");
		Debug.dbtime(2, readTime, "read "+rr.rules.size()+" rules");
		return rr;
	}

	private static CFGRule readAlternative(int lineno, Symbol lhs, String alt) throws DataFormatException {
		if (alt.length() == 0 || alt.equals(EPSILON_LITERAL) || alt.equals(Symbol.getEpsilon().toString()))
			return CFGRule.epsilon(lhs);
		Vector<Symbol> rhs = new Vector<Symbol>();
		for (String tok : alt.split("\\s+")) {
			Symbol sym = SymbolFactory.getSymbol(tok);
			if (sym.isEpsilon())
				throw new DataFormatException(lineno, "Epsilon must stand alone in alternative '"+alt+"' of "+lhs);
			rhs.add(sym);
		}
		return new CFGRule(lhs, rhs);
	}

	// accessors

	public Symbol getStartState() {
		return startState;
	}

	public boolean isStartNullable() {
		return startNullable;
	}

	public List<CFGRule> getRules() {
		return Collections.unmodifiableList(rules);
	}

	// useful in indexing rules by a common lhs. empty, never null
	public Set<CFGRule> getRulesOfType(Symbol s) {
		Set<CFGRule> ret = rulesByLHS.get(s);
		return ret == null ? Collections.<CFGRule>emptySet() : ret;
	}

	public Set<Symbol> getStates() {
		return Collections.unmodifiableSet(states);
	}

	public Set<Symbol> getTerminals() {
		return Collections.unmodifiableSet(terminals);
	}

	public boolean isState(Symbol s) {
		return states.contains(s);
	}

	public int getNumRules() { return rules.size(); }
	public int getNumStates() { return states.size(); }
	public int getNumTerminals() { return terminals.size(); }

	public int s2i(Symbol s) {
		if (!s2i.containsKey(s))
			throw new IllegalArgumentException(s+" is not a state of this grammar");
		return s2i.get(s);
	}

	public Symbol i2s(int i) {
		return i2s[i];
	}

	/** the rules as a map from lhs to rhs sequences, in insertion order. A fresh copy */
	public LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> getProductions() {
		LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> ret = new LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>>();
		for (Symbol lhs : rulesByLHS.keySet()) {
			LinkedHashSet<List<Symbol>> rhss = new LinkedHashSet<List<Symbol>>();
			for (CFGRule r : rulesByLHS.get(lhs))
				rhss.add(r.getRHS());
			ret.put(lhs, rhss);
		}
		return ret;
	}

	/**
	 * Configuration check done before conversion: there must be productions, and
	 * the start symbol must have some.
	 */
	public void validate() throws DataFormatException {
		if (rules.isEmpty())
			throw new DataFormatException("Empty grammar: no productions found");
		if (getRulesOfType(startState).isEmpty())
			throw new DataFormatException("Start symbol "+startState+" has no productions");
	}

	// is every rule A -> a or A -> B C?
	public boolean isNormal() {
		for (CFGRule r : rules) {
			if (!r.isNormal(states))
				return false;
		}
		return true;
	}

	// first offending rule, for error messages. null if normal
	public CFGRule findAbnormalRule() {
		for (CFGRule r : rules) {
			if (!r.isNormal(states))
				return r;
		}
		return null;
	}

	// for convenience output is grouped by lhs.
	// start rules are first, then all the rest
	public String toString() {
		StringBuffer sb = new StringBuffer();
		appendGroup(sb, startState, getRulesOfType(startState), false);
		for (Symbol lhs : rulesByLHS.keySet()) {
			if (lhs == startState)
				continue;
			appendGroup(sb, lhs, rulesByLHS.get(lhs), false);
		}
		return sb.toString();
	}

	/** one line per nonterminal, sorted by name, alternatives sorted */
	public String toSortedString() {
		StringBuffer sb = new StringBuffer();
		TreeMap<Symbol, Set<CFGRule>> sorted = new TreeMap<Symbol, Set<CFGRule>>(rulesByLHS);
		for (Map.Entry<Symbol, Set<CFGRule>> ent : sorted.entrySet())
			appendGroup(sb, ent.getKey(), ent.getValue(), true);
		return sb.toString();
	}

	private static void appendGroup(StringBuffer sb, Symbol lhs, Set<CFGRule> group, boolean sort) {
		if (group.isEmpty())
			return;
		Collection<String> alts = sort ? new TreeSet<String>() : new ArrayList<String>();
		for (CFGRule r : group)
			alts.add(r.rhsString());
		sb.append(lhs.toString()).append(" -> ");
		boolean first = true;
		for (String alt : alts) {
			if (!first)
				sb.append(" | ");
			first = false;
			sb.append(alt);
		}
		sb.append("\n");
	}
}
