package edu.isi.chomsky;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.util.Arrays;
import java.util.List;

// grammars for tests, from text or from src/test/resources/grammars
final class GrammarFixtures {

	private GrammarFixtures() {}

	static CFGRuleSet fromText(String text) throws IOException, DataFormatException {
		return new CFGRuleSet(new BufferedReader(new StringReader(text)));
	}

	static CFGRuleSet fromResource(String name) throws IOException, DataFormatException {
		InputStream is = GrammarFixtures.class.getResourceAsStream("/grammars/"+name);
		if (is == null)
			throw new IOException("No test grammar "+name);
		return new CFGRuleSet(new BufferedReader(new InputStreamReader(is, "utf-8")));
	}

	static CFGRuleSet cnf(String text) throws IOException, DataFormatException {
		return new CNFConverter().convert(fromText(text));
	}

	static CYKParser parser(String text) throws IOException, DataFormatException, ImproperConversionException {
		return new CYKParser(cnf(text));
	}

	// space separated token list; the empty string is no tokens
	static List<Symbol> toks(String s) {
		if (s.trim().length() == 0)
			return SymbolFactory.getSymbols(new String[0]);
		return SymbolFactory.getSymbols(Arrays.asList(s.trim().split("\\s+")));
	}

	static Symbol sym(String s) {
		return SymbolFactory.getSymbol(s);
	}
}
