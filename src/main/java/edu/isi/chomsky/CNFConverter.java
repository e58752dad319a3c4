package edu.isi.chomsky;

import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Vector;

/**
 * Puts a grammar into Chomsky Normal Form.
 * <p>
 * Five passes, always in this order, each reading one production map and
 * building a new one:
 * <ol>
 * <li>reachability pruning from the start symbol</li>
 * <li>epsilon removal, remembering whether the start symbol was nullable</li>
 * <li>unit rule removal through the unit closure of each state</li>
 * <li>terminal isolation: terminals inside long rules get their own state</li>
 * <li>binarization of rules longer than two</li>
 * </ol>
 * The input rule set is never touched. Fresh states are named
 * <tt>T_&lt;terminal&gt;_&lt;n&gt;</tt> and <tt>BIN_&lt;n&gt;</tt>, with <tt>n</tt>
 * counted per call to {@link #convert}; a name the grammar already uses is skipped.
 * A converter is not meant to be shared by concurrent conversions.
 */
public class CNFConverter {

	public static final String TERMINAL_PREFIX = "T_";
	public static final String BINARY_PREFIX = "BIN";

	private int freshId = 0;
	// every symbol of the grammar being converted, plus those made so far
	private Set<Symbol> used = new HashSet<Symbol>();

	/**
	 * Convert <tt>cfg</tt> to CNF. The result's start-nullable flag says whether
	 * <tt>cfg</tt> derives the empty string.
	 *
	 * @throws DataFormatException if the grammar is empty or its start symbol has no productions
	 */
	public CFGRuleSet convert(CFGRuleSet cfg) throws DataFormatException {
		boolean debug = false;
		cfg.validate();
		freshId = 0;
		used = new HashSet<Symbol>();
		used.addAll(cfg.getStates());
		used.addAll(cfg.getTerminals());

		Symbol start = cfg.getStartState();
		Date passTime = new Date();
		LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> rules = removeUnreachable(start, cfg.getProductions());
		Debug.dbtime(2, passTime, "reachability pruning");

		passTime = new Date();
		Pair<LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>>, Boolean> epsResult = removeEpsilons(start, rules);
		rules = epsResult.l();
		boolean startNullable = epsResult.r().booleanValue();
		Debug.dbtime(2, passTime, "epsilon removal");
		if (debug) Debug.debug(debug, "start nullable: "+startNullable);

		passTime = new Date();
		rules = removeUnits(rules);
		Debug.dbtime(2, passTime, "unit rule removal");

		passTime = new Date();
		rules = isolateTerminals(rules);
		Debug.dbtime(2, passTime, "terminal isolation");

		passTime = new Date();
		rules = binarize(rules);
		Debug.dbtime(2, passTime, "binarization");

		// unit removal can leave states nothing points to any more
		rules = removeUnreachable(start, rules);
		CFGRuleSet ret = new CFGRuleSet(start, rules, startNullable);
		if (debug) Debug.debug(debug, "CNF grammar:\n"+ret);
		return ret;
	}

	/**
	 * Take a grammar that is already in CNF as is. The one exception allowed is
	 * <tt>S -&gt; ε</tt> for the start symbol, provided the start symbol appears
	 * in no rhs; that rule is dropped and the result marked start-nullable.
	 *
	 * @throws ImproperConversionException naming the first rule that isn't CNF
	 */
	public static CFGRuleSet asNormal(CFGRuleSet cfg) throws DataFormatException, ImproperConversionException {
		cfg.validate();
		Symbol start = cfg.getStartState();
		boolean startInRHS = false;
		for (CFGRule r : cfg.getRules()) {
			if (r.getRHS().contains(start))
				startInRHS = true;
		}
		ArrayList<CFGRule> kept = new ArrayList<CFGRule>();
		boolean nullable = false;
		for (CFGRule r : cfg.getRules()) {
			if (r.isEpsilonRule() && r.getLHS() == start && !startInRHS)
				nullable = true;
			else
				kept.add(r);
		}
		CFGRuleSet ret = new CFGRuleSet(start, kept, nullable || cfg.isStartNullable());
		CFGRule bad = ret.findAbnormalRule();
		if (bad != null)
			throw new ImproperConversionException("Grammar is not in Chomsky Normal Form: "+bad);
		return ret;
	}

	/** reachability pruning on a whole rule set, for callers outside conversion */
	public static CFGRuleSet prune(CFGRuleSet cfg) {
		return new CFGRuleSet(cfg.getStartState(),
				removeUnreachable(cfg.getStartState(), cfg.getProductions()),
				cfg.isStartNullable());
	}

	// pass 1: keep only the states reachable from start by following rhs states
	public static LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> removeUnreachable(Symbol start,
			Map<Symbol, ? extends Set<List<Symbol>>> rules) {
		boolean debug = false;
		Set<Symbol> reach = new HashSet<Symbol>();
		LinkedList<Symbol> agenda = new LinkedList<Symbol>();
		reach.add(start);
		agenda.add(start);
		while (!agenda.isEmpty()) {
			Symbol currState = agenda.removeFirst();
			Set<List<Symbol>> rhss = rules.get(currState);
			if (rhss == null)
				continue;
			for (List<Symbol> rhs : rhss) {
				for (Symbol sym : rhs) {
					if (rules.containsKey(sym) && !reach.contains(sym)) {
						reach.add(sym);
						agenda.add(sym);
					}
				}
			}
		}
		LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> ret = new LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>>();
		for (Map.Entry<Symbol, ? extends Set<List<Symbol>>> ent : rules.entrySet()) {
			if (reach.contains(ent.getKey()))
				ret.put(ent.getKey(), new LinkedHashSet<List<Symbol>>(ent.getValue()));
			else if (debug) Debug.debug(debug, "Dropping unreachable "+ent.getKey());
		}
		return ret;
	}

	private static boolean isEpsilon(List<Symbol> rhs) {
		return rhs.size() == 1 && rhs.get(0).isEpsilon();
	}

	/**
	 * pass 2: find the nullable states by fixed point, then replace every rhs by all
	 * the versions with some subset of its nullable occurrences deleted. Epsilon rules
	 * go away; the right side of the pair says whether start was nullable.
	 */
	public static Pair<LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>>, Boolean> removeEpsilons(Symbol start,
			Map<Symbol, ? extends Set<List<Symbol>>> rules) {
		boolean debug = false;
		Set<Symbol> nullable = new HashSet<Symbol>();
		for (Map.Entry<Symbol, ? extends Set<List<Symbol>>> ent : rules.entrySet()) {
			for (List<Symbol> rhs : ent.getValue()) {
				if (isEpsilon(rhs))
					nullable.add(ent.getKey());
			}
		}
		boolean changed = true;
		while (changed) {
			changed = false;
			for (Map.Entry<Symbol, ? extends Set<List<Symbol>>> ent : rules.entrySet()) {
				if (nullable.contains(ent.getKey()))
					continue;
				for (List<Symbol> rhs : ent.getValue()) {
					if (isEpsilon(rhs))
						continue;
					boolean allNullable = true;
					for (Symbol sym : rhs) {
						if (!rules.containsKey(sym) || !nullable.contains(sym)) {
							allNullable = false;
							break;
						}
					}
					if (allNullable) {
						if (debug) Debug.debug(debug, ent.getKey()+" is nullable thanks to "+rhs);
						nullable.add(ent.getKey());
						changed = true;
						break;
					}
				}
			}
		}
		boolean startNullable = nullable.contains(start);

		LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> ret = new LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>>();
		for (Map.Entry<Symbol, ? extends Set<List<Symbol>>> ent : rules.entrySet()) {
			LinkedHashSet<List<Symbol>> newrhss = new LinkedHashSet<List<Symbol>>();
			for (List<Symbol> rhs : ent.getValue()) {
				if (isEpsilon(rhs))
					continue;
				ArrayList<Integer> pos = new ArrayList<Integer>();
				for (int i = 0; i < rhs.size(); i++) {
					if (rules.containsKey(rhs.get(i)) && nullable.contains(rhs.get(i)))
						pos.add(i);
				}
				if (pos.isEmpty()) {
					newrhss.add(rhs);
					continue;
				}
				// each bit of mask drops one nullable occurrence; mask 0 is the rule itself
				for (long mask = 0; mask < (1L << pos.size()); mask++) {
					Vector<Symbol> nrhs = new Vector<Symbol>();
					int p = 0;
					for (int i = 0; i < rhs.size(); i++) {
						if (p < pos.size() && pos.get(p) == i) {
							boolean drop = (mask & (1L << p)) != 0;
							p++;
							if (drop)
								continue;
						}
						nrhs.add(rhs.get(i));
					}
					if (nrhs.isEmpty())
						continue;
					newrhss.add(nrhs);
				}
			}
			ret.put(ent.getKey(), newrhss);
		}
		ret = removeEmptied(rules.keySet(), ret);
		return new Pair<LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>>, Boolean>(ret, Boolean.valueOf(startNullable));
	}

	/**
	 * a state of the input that ends up with no rules must not turn into a
	 * terminal: drop every rhs that mentions one, and repeat, since that can
	 * empty further states. States left empty are removed from the map.
	 */
	static LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> removeEmptied(Set<Symbol> formerStates,
			LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> rules) {
		boolean debug = false;
		boolean changed = true;
		while (changed) {
			changed = false;
			Set<Symbol> emptied = new HashSet<Symbol>();
			for (Symbol s : formerStates) {
				if (!rules.containsKey(s) || rules.get(s).isEmpty())
					emptied.add(s);
			}
			if (emptied.isEmpty())
				break;
			for (LinkedHashSet<List<Symbol>> rhss : rules.values()) {
				Iterator<List<Symbol>> it = rhss.iterator();
				while (it.hasNext()) {
					List<Symbol> rhs = it.next();
					for (Symbol sym : rhs) {
						if (emptied.contains(sym)) {
							if (debug) Debug.debug(debug, "Dropping "+rhs+" for emptied "+sym);
							it.remove();
							changed = true;
							break;
						}
					}
				}
			}
		}
		LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> ret = new LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>>();
		for (Map.Entry<Symbol, LinkedHashSet<List<Symbol>>> ent : rules.entrySet()) {
			if (!ent.getValue().isEmpty())
				ret.put(ent.getKey(), ent.getValue());
		}
		return ret;
	}

	// an rhs that is a single state
	static boolean isUnit(List<Symbol> rhs, Set<Symbol> states) {
		return rhs.size() == 1 && states.contains(rhs.get(0));
	}

	/**
	 * pass 3: each state A gets the non-unit rules of every state in its unit
	 * closure (A itself included), and no unit rules.
	 */
	public static LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> removeUnits(Map<Symbol, ? extends Set<List<Symbol>>> rules) {
		boolean debug = false;
		Set<Symbol> states = rules.keySet();
		LinkedHashMap<Symbol, LinkedHashSet<Symbol>> unitNext = new LinkedHashMap<Symbol, LinkedHashSet<Symbol>>();
		for (Map.Entry<Symbol, ? extends Set<List<Symbol>>> ent : rules.entrySet()) {
			LinkedHashSet<Symbol> next = new LinkedHashSet<Symbol>();
			for (List<Symbol> rhs : ent.getValue()) {
				if (isUnit(rhs, states))
					next.add(rhs.get(0));
			}
			unitNext.put(ent.getKey(), next);
		}

		LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> ret = new LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>>();
		for (Symbol a : states) {
			// breadth-first closure
			LinkedHashSet<Symbol> closure = new LinkedHashSet<Symbol>();
			LinkedList<Symbol> agenda = new LinkedList<Symbol>();
			agenda.add(a);
			while (!agenda.isEmpty()) {
				Symbol b = agenda.removeFirst();
				if (!closure.add(b))
					continue;
				agenda.addAll(unitNext.get(b));
			}
			if (debug) Debug.debug(debug, "Unit closure of "+a+" is "+closure);
			LinkedHashSet<List<Symbol>> newrhss = new LinkedHashSet<List<Symbol>>();
			for (Symbol b : closure) {
				for (List<Symbol> rhs : rules.get(b)) {
					if (!isUnit(rhs, states))
						newrhss.add(rhs);
				}
			}
			ret.put(a, newrhss);
		}
		// states whose closure is all units (cycles) have nothing left
		return removeEmptied(states, ret);
	}

	/**
	 * pass 4: in rules of two or more symbols, replace each terminal by a state
	 * of its own, one per distinct terminal, with a rule to the terminal. Rules of
	 * length one are left alone.
	 */
	public LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> isolateTerminals(Map<Symbol, ? extends Set<List<Symbol>>> rules) {
		Set<Symbol> states = rules.keySet();
		LinkedHashMap<Symbol, Symbol> term2state = new LinkedHashMap<Symbol, Symbol>();
		LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> ret = new LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>>();
		for (Map.Entry<Symbol, ? extends Set<List<Symbol>>> ent : rules.entrySet()) {
			LinkedHashSet<List<Symbol>> newrhss = new LinkedHashSet<List<Symbol>>();
			for (List<Symbol> rhs : ent.getValue()) {
				if (rhs.size() < 2) {
					newrhss.add(rhs);
					continue;
				}
				Vector<Symbol> rep = new Vector<Symbol>();
				for (Symbol sym : rhs) {
					if (states.contains(sym)) {
						rep.add(sym);
						continue;
					}
					if (!term2state.containsKey(sym))
						term2state.put(sym, fresh(TERMINAL_PREFIX+sym.toString()));
					rep.add(term2state.get(sym));
				}
				newrhss.add(rep);
			}
			ret.put(ent.getKey(), newrhss);
		}
		for (Map.Entry<Symbol, Symbol> ent : term2state.entrySet()) {
			LinkedHashSet<List<Symbol>> single = new LinkedHashSet<List<Symbol>>();
			Vector<Symbol> rhs = new Vector<Symbol>();
			rhs.add(ent.getKey());
			single.add(rhs);
			ret.put(ent.getValue(), single);
		}
		return ret;
	}

	/**
	 * pass 5: A -> X1 X2 ... Xn becomes A -> X1 BIN_i, BIN_i -> X2 BIN_j, ...,
	 * BIN_k -> Xn-1 Xn.
	 */
	public LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> binarize(Map<Symbol, ? extends Set<List<Symbol>>> rules) {
		LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> ret = new LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>>();
		for (Symbol lhs : rules.keySet())
			ret.put(lhs, new LinkedHashSet<List<Symbol>>());
		for (Map.Entry<Symbol, ? extends Set<List<Symbol>>> ent : rules.entrySet()) {
			for (List<Symbol> rhs : ent.getValue()) {
				if (rhs.size() <= 2) {
					ret.get(ent.getKey()).add(rhs);
					continue;
				}
				Symbol prev = fresh(BINARY_PREFIX);
				ret.get(ent.getKey()).add(pairOf(rhs.get(0), prev));
				int i = 1;
				while (rhs.size() - i > 2) {
					Symbol next = fresh(BINARY_PREFIX);
					addRule(ret, prev, pairOf(rhs.get(i), next));
					prev = next;
					i++;
				}
				addRule(ret, prev, pairOf(rhs.get(i), rhs.get(i+1)));
			}
		}
		return ret;
	}

	private static void addRule(LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> rules, Symbol lhs, List<Symbol> rhs) {
		if (!rules.containsKey(lhs))
			rules.put(lhs, new LinkedHashSet<List<Symbol>>());
		rules.get(lhs).add(rhs);
	}

	private static List<Symbol> pairOf(Symbol a, Symbol b) {
		Vector<Symbol> v = new Vector<Symbol>(2);
		v.add(a);
		v.add(b);
		return v;
	}

	// a state name unused so far
	Symbol fresh(String prefix) {
		boolean debug = false;
		Symbol sym;
		do {
			freshId++;
			sym = SymbolFactory.getSymbol(prefix+"_"+freshId);
		} while (used.contains(sym));
		used.add(sym);
		if (debug) Debug.debug(debug, "fresh state "+sym);
		return sym;
	}
}
