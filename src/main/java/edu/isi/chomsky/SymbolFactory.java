package edu.isi.chomsky;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

// manages the map of strings -> symbols
public class SymbolFactory {
	static private HashMap<String, Symbol> str2Sym;
	static {
		str2Sym = new HashMap<String, Symbol>();
	}

	// synchronized so that tokenizers on several threads can share the table
	static public synchronized Symbol getSymbol(String str) {
		boolean debug = false;
		if (str == null)
			throw new NullPointerException("Symbol name may not be null");
		Symbol sym = str2Sym.get(str);
		if (sym == null) {
			if (debug) Debug.debug(debug, "creating new symbol from "+str);
			sym = new Symbol(str);
			// the first Symbol ever built interns epsilon from Symbol's own static
			// block, so look again before storing
			if (str2Sym.containsKey(str))
				return str2Sym.get(str);
			str2Sym.put(str, sym);
		}
		return sym;
	}

	// convenience for token lists
	static public List<Symbol> getSymbols(List<String> strs) {
		List<Symbol> ret = new ArrayList<Symbol>(strs.size());
		for (String s : strs)
			ret.add(getSymbol(s));
		return ret;
	}
	static public List<Symbol> getSymbols(String... strs) {
		List<Symbol> ret = new ArrayList<Symbol>(strs.length);
		for (String s : strs)
			ret.add(getSymbol(s));
		return ret;
	}
}
