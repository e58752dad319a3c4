package edu.isi.chomsky;

import static edu.isi.chomsky.GrammarFixtures.cnf;
import static edu.isi.chomsky.GrammarFixtures.fromResource;
import static edu.isi.chomsky.GrammarFixtures.fromText;
import static edu.isi.chomsky.GrammarFixtures.sym;
import static edu.isi.chomsky.GrammarFixtures.toks;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;

import org.junit.jupiter.api.Test;

class CNFConverterTest {

	private static void assertWellFormed(CFGRuleSet g) {
		for (CFGRule r : g.getRules()) {
			assertTrue(r.isNormal(g.getStates()), "not CNF: "+r);
			assertFalse(r.isEpsilonRule(), "epsilon rule left: "+r);
		}
	}

	private static boolean accepts(CFGRuleSet cnf, String tokens) throws ImproperConversionException {
		return new CYKParser(cnf).parse(toks(tokens)).accepts();
	}

	@Test
	void sampleGrammarsComeOutWellFormed() throws Exception {
		String[] names = {"arith.cfg", "simple-en.cfg", "anbn.cfg", "balanced-cnf.cfg"};
		for (String name : names)
			assertWellFormed(new CNFConverter().convert(fromResource(name)));
	}

	@Test
	void arithmeticLanguageIsKept() throws Exception {
		CFGRuleSet g = new CNFConverter().convert(fromResource("arith.cfg"));
		assertTrue(accepts(g, "id"));
		assertTrue(accepts(g, "id + id * id"));
		assertTrue(accepts(g, "( id + id ) * id"));
		assertTrue(accepts(g, "( ( id ) )"));
		assertFalse(accepts(g, "id + *"));
		assertFalse(accepts(g, "( id"));
		assertFalse(accepts(g, "id id"));
		assertFalse(accepts(g, ""));
	}

	@Test
	void nullableStartIsRemembered() throws Exception {
		CFGRuleSet g = new CNFConverter().convert(fromResource("anbn.cfg"));
		assertTrue(g.isStartNullable());
		assertTrue(accepts(g, ""));
		assertTrue(accepts(g, "a b"));
		assertTrue(accepts(g, "a a a b b b"));
		assertFalse(accepts(g, "a a b"));
		assertFalse(accepts(g, "b a"));
	}

	@Test
	void nonNullableStartStaysSo() throws Exception {
		CFGRuleSet g = cnf("S -> a S | a\n");
		assertFalse(g.isStartNullable());
		assertFalse(accepts(g, ""));
		assertTrue(accepts(g, "a a a"));
	}

	@Test
	void nullableThroughChainOfStates() throws Exception {
		CFGRuleSet g = cnf("S -> A B\nA -> a | e\nB -> A A\n");
		assertTrue(g.isStartNullable());
		assertTrue(accepts(g, "a"));
		assertTrue(accepts(g, "a a a"));
		assertFalse(accepts(g, "a a a a"));
	}

	@Test
	void stateLeftWithoutRulesIsNotATerminal() throws Exception {
		CFGRuleSet g = cnf("S -> a A\nA -> e\n");
		assertTrue(accepts(g, "a"));
		assertFalse(accepts(g, "a A"));
		assertFalse(g.getTerminals().contains(sym("A")));
		assertFalse(g.isState(sym("A")));
	}

	@Test
	void unitCyclesCollapse() throws Exception {
		CFGRuleSet g = cnf("S -> A | b\nA -> S | a\n");
		assertEquals("S -> a | b\n", g.toSortedString());
	}

	@Test
	void unitOnlyCycleEmptiesEverything() throws Exception {
		CFGRuleSet g = cnf("S -> A | a B\nA -> S\nB -> B\n");
		assertWellFormed(g);
		assertEquals(0, g.getNumRules());
		assertFalse(accepts(g, "a"));
	}

	private static LinkedHashSet<List<Symbol>> rhss(String... alts) {
		LinkedHashSet<List<Symbol>> ret = new LinkedHashSet<List<Symbol>>();
		for (String alt : alts)
			ret.add(toks(alt));
		return ret;
	}

	@Test
	void unitMeansOneState() throws Exception {
		HashSet<Symbol> states = new HashSet<Symbol>(Arrays.asList(sym("S"), sym("A")));
		assertTrue(CNFConverter.isUnit(toks("A"), states));
		assertFalse(CNFConverter.isUnit(toks("a"), states));
		assertFalse(CNFConverter.isUnit(toks("A A"), states));
	}

	@Test
	void unitRulesTakeTheirTargetsRules() throws Exception {
		LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> rules = new LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>>();
		rules.put(sym("S"), rhss("A", "b"));
		rules.put(sym("A"), rhss("a", "A S"));
		LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> out = CNFConverter.removeUnits(rules);
		assertEquals(Arrays.asList(toks("b"), toks("a"), toks("A S")), Arrays.asList(out.get(sym("S")).toArray()));
		assertEquals(rhss("a", "A S"), out.get(sym("A")));
	}

	@Test
	void epsilonPassReportsNullableStart() throws Exception {
		LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>> rules = new LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>>();
		rules.put(sym("S"), rhss("a S", "ε"));
		Pair<LinkedHashMap<Symbol, LinkedHashSet<List<Symbol>>>, Boolean> out = CNFConverter.removeEpsilons(sym("S"), rules);
		assertTrue(out.r());
		assertEquals(rhss("a S", "a"), out.l().get(sym("S")));
	}

	@Test
	void unreachableStatesAreDropped() throws Exception {
		CFGRuleSet g = cnf("S -> a\nX -> b\n");
		assertFalse(g.isState(sym("X")));
		assertEquals(1, g.getNumRules());
	}

	@Test
	void freshNamesArePrefixedAndCounted() throws Exception {
		CFGRuleSet g = cnf("S -> a b c\n");
		assertEquals("BIN_4 -> T_b_2 T_c_3\n"+
				"S -> T_a_1 BIN_4\n"+
				"T_a_1 -> a\n"+
				"T_b_2 -> b\n"+
				"T_c_3 -> c\n", g.toSortedString());
	}

	@Test
	void freshNamesSkipSymbolsInUse() throws Exception {
		CFGRuleSet g = cnf("S -> a b | T_a_1\n");
		assertTrue(g.isState(sym("T_a_2")));
		assertTrue(g.getTerminals().contains(sym("T_a_1")));
		assertTrue(accepts(g, "T_a_1"));
		assertTrue(accepts(g, "a b"));
	}

	@Test
	void counterRestartsForEachConversion() throws Exception {
		CNFConverter conv = new CNFConverter();
		CFGRuleSet g = fromText("S -> a b c\n");
		assertEquals(conv.convert(g).toSortedString(), conv.convert(g).toSortedString());
	}

	@Test
	void inputGrammarIsUntouched() throws Exception {
		CFGRuleSet g = fromResource("arith.cfg");
		String before = g.toString();
		new CNFConverter().convert(g);
		assertEquals(before, g.toString());
		assertEquals(6, g.getNumRules());
	}

	@Test
	void convertingCNFAgainChangesNothing() throws Exception {
		CFGRuleSet once = new CNFConverter().convert(fromResource("balanced-cnf.cfg"));
		CFGRuleSet twice = new CNFConverter().convert(once);
		assertEquals(new HashSet<CFGRule>(once.getRules()), new HashSet<CFGRule>(twice.getRules()));
	}

	@Test
	void pruningIsIdempotent() throws Exception {
		CFGRuleSet g = fromText("S -> A\nA -> a\nX -> Y\nY -> y\n");
		CFGRuleSet once = CNFConverter.prune(g);
		CFGRuleSet twice = CNFConverter.prune(once);
		assertEquals(2, once.getNumRules());
		assertEquals(once.getRules(), twice.getRules());
	}

	@Test
	void startWithoutRulesIsAnError() throws Exception {
		CFGRuleSet g = new CFGRuleSet(sym("X"), Arrays.asList(new CFGRule(sym("S"), sym("a"))));
		try {
			new CNFConverter().convert(g);
			fail("converted a grammar whose start has no rules");
		}
		catch (DataFormatException e) {
			assertTrue(e.getMessage().contains("no productions"), e.getMessage());
		}
	}

	@Test
	void onlyEpsilonStart() throws Exception {
		CFGRuleSet g = cnf("S -> e\n");
		assertTrue(g.isStartNullable());
		assertEquals(0, g.getNumRules());
		assertTrue(accepts(g, ""));
		assertFalse(accepts(g, "e"));
	}

	@Test
	void normalGrammarIsTakenAsIs() throws Exception {
		CFGRuleSet g = CNFConverter.asNormal(fromText("S -> A B | e\nA -> a\nB -> b\n"));
		assertTrue(g.isStartNullable());
		assertEquals(3, g.getNumRules());
		assertTrue(accepts(g, ""));
		assertTrue(accepts(g, "a b"));
	}

	@Test
	void abnormalGrammarIsRefused() throws Exception {
		try {
			CNFConverter.asNormal(fromResource("arith.cfg"));
			fail("took arith.cfg as CNF");
		}
		catch (ImproperConversionException e) {
			assertTrue(e.getMessage().contains("E -> E + T"), e.getMessage());
		}
	}
}
