package edu.isi.chomsky;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

class TokenizerTest {

	@Test
	void expressionsBecomeIds() throws Exception {
		Tokenizer t = Tokenizer.get("expr");
		assertEquals(Arrays.asList("(", "id", "+", "id", ")", "*", "id"), t.tokenize("(x+3)*y"));
		assertEquals(Arrays.asList("id", "+", "id", "*", "id"), t.tokenize("id + id * id"));
		assertEquals(Arrays.asList("id"), t.tokenize("  foo_bar42 "));
	}

	@Test
	void expressionJunkIsDropped() throws Exception {
		Tokenizer t = Tokenizer.get("expr");
		assertEquals(Arrays.asList("id", "id"), t.tokenize("a - b"));
		assertEquals(Collections.<String>emptyList(), t.tokenize("  - / "));
	}

	@Test
	void wordsAreLoweredAndCleaned() throws Exception {
		Tokenizer t = Tokenizer.get("words");
		assertEquals(Arrays.asList("she", "eats", "a", "cake"), t.tokenize("She eats a cake!"));
		assertEquals(Arrays.asList("don't", "stop"), t.tokenize("Don't STOP."));
		assertEquals(Arrays.asList("the", "cat"), t.tokenize("the,cat"));
		assertEquals(Collections.<String>emptyList(), t.tokenize("   "));
	}

	@Test
	void plainSplitsOnWhitespaceOnly() throws Exception {
		Tokenizer t = Tokenizer.get("plain");
		assertEquals(Arrays.asList("(", ")", "(("), t.tokenize(" ( )\t(( "));
		assertEquals(Arrays.asList("Mixed", "Case!"), t.tokenize("Mixed Case!"));
	}

	@Test
	void namedInstancesAreShared() throws Exception {
		assertSame(Tokenizer.get("words"), Tokenizer.get(Tokenizer.WORDS));
		assertEquals("expr", Tokenizer.get("expr").getName());
	}

	@Test
	void unknownTokenizer() {
		try {
			Tokenizer.get("chars");
			fail("unknown tokenizer accepted");
		}
		catch (ConfigureException e) {
			assertTrue(e.getMessage().contains("chars"), e.getMessage());
		}
	}

	@Test
	void inputPrefixAndQuotesAreStripped() {
		assertEquals("She eats a cake", Tokenizer.normalizeInput("w = She eats a cake"));
		assertEquals("the cat drinks the beer", Tokenizer.normalizeInput("w: the cat drinks the beer;"));
		assertEquals("she eats a cake", Tokenizer.normalizeInput("\"she eats a cake\""));
		assertEquals("id + id", Tokenizer.normalizeInput("W='id + id';"));
		assertEquals("hello", Tokenizer.normalizeInput("  hello  "));
		assertEquals("wow", Tokenizer.normalizeInput("wow"));
		// mismatched quotes stay
		assertEquals("'abc\"", Tokenizer.normalizeInput("'abc\""));
	}
}
