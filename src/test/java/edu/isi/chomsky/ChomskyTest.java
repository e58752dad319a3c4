package edu.isi.chomsky;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ChomskyTest {

	@TempDir
	File dir;

	private ByteArrayOutputStream err;

	@BeforeEach
	void captureDiagnostics() {
		err = new ByteArrayOutputStream();
		Debug.setStream(err);
	}

	@AfterEach
	void restoreDiagnostics() {
		Debug.setStream(System.err);
		Debug.setDbLevel(-1);
	}

	private String write(String name, String text) throws IOException {
		File f = new File(dir, name);
		Files.write(f.toPath(), text.getBytes(StandardCharsets.UTF_8));
		return f.getPath();
	}

	private List<String> read(String path) throws IOException {
		return Files.readAllLines(new File(path).toPath(), StandardCharsets.UTF_8);
	}

	@Test
	void parsesFileOfSentences() throws Exception {
		String g = write("arith.cfg", "E -> E + T | T\nT -> T * F | F\nF -> ( E ) | id\n");
		String in = write("input.txt", "x + y * z\nx + * y\nq\nx\n");
		String out = new File(dir, "out.txt").getPath();
		assertEquals(0, Chomsky.run(new String[] {"-k", "expr", "-q", "-o", out, g, in}));
		List<String> rows = read(out);
		assertEquals(2, rows.size());
		assertTrue(rows.get(0).startsWith("accepted\t(E "), rows.get(0));
		assertEquals("rejected", rows.get(1));
	}

	@Test
	void alreadyNormalGrammar() throws Exception {
		String g = write("paren.cfg", "S -> L R | L X | S S\nX -> S R\nL -> (\nR -> )\n");
		String in = write("input.txt", "( ) ( ( ) )\n) (\n");
		String out = new File(dir, "out.txt").getPath();
		assertEquals(0, Chomsky.run(new String[] {"--nocnf", "--tokenizer", "plain", "--quiet", "-o", out, g, in}));
		List<String> rows = read(out);
		assertEquals("accepted\t(S (S (L () (R ))) (S (L () (X (S (L () (R ))) (R )))))", rows.get(0));
		assertEquals("rejected", rows.get(1));
	}

	@Test
	void checkAndPrintGrammar() throws Exception {
		String g = write("ab.cfg", "S -> a S b | e\n");
		String in = write("input.txt", "a b\n");
		String out = new File(dir, "out.txt").getPath();
		assertEquals(0, Chomsky.run(new String[] {"-c", "-p", "-q", "-k", "plain", "-o", out, g, in}));
		String text = new String(Files.readAllBytes(new File(out).toPath()), StandardCharsets.UTF_8);
		assertTrue(text.startsWith("CFG info for ab.cfg:\n\t1 states\n\t2 rules\n"), text);
		assertTrue(text.contains("CFG info for ab.cfg in CNF:"), text);
		assertTrue(text.contains("start symbol derives the empty string"), text);
		assertTrue(text.contains("Active grammar (CNF), start symbol S, accepts the empty string\n"), text);
		assertTrue(text.contains("accepted\t(S "), text);
	}

	@Test
	void nonNormalGrammarWithNoCNFFails() throws Exception {
		String g = write("arith.cfg", "E -> E + T | T\nT -> id\n");
		String in = write("input.txt", "id\n");
		assertEquals(1, Chomsky.run(new String[] {"-n", g, in}));
	}

	@Test
	void malformedGrammarFails() throws Exception {
		String g = write("bad.cfg", "S -> a\nS a\n");
		String in = write("input.txt", "a\n");
		assertEquals(1, Chomsky.run(new String[] {g, in}));
	}

	@Test
	void missingGrammarFileFails() throws Exception {
		String in = write("input.txt", "a\n");
		assertEquals(1, Chomsky.run(new String[] {new File(dir, "nope.cfg").getPath(), in}));
	}

	@Test
	void badOptionsFail() throws Exception {
		String g = write("g.cfg", "S -> a\n");
		assertEquals(1, Chomsky.run(new String[] {"-k", "letters", g}));
		assertEquals(1, Chomsky.run(new String[] {"--check", "--nocnf", g}));
		assertEquals(1, Chomsky.run(new String[] {"-k", "plain"}));
	}

	// sentences come from stdin when only the bundled grammar is used
	private List<String> runWithStdin(String stdin, String[] argv) throws IOException {
		String out = new File(dir, "out.txt").getPath();
		String[] args = new String[argv.length+2];
		System.arraycopy(argv, 0, args, 0, argv.length);
		args[argv.length] = "-o";
		args[argv.length+1] = out;
		InputStream oldIn = System.in;
		System.setIn(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)));
		try {
			assertEquals(0, Chomsky.run(args));
		}
		finally {
			System.setIn(oldIn);
		}
		return read(out);
	}

	@Test
	void bundledArithmeticGrammar() throws Exception {
		List<String> rows = runWithStdin("x + y * 3\n(x +\n", new String[] {"-k", "expr", "-q"});
		assertEquals(2, rows.size());
		assertTrue(rows.get(0).startsWith("accepted\t(E "), rows.get(0));
		assertEquals("rejected", rows.get(1));
		assertTrue(err.toString("utf-8").contains("using bundled arith.cfg"));
	}

	@Test
	void bundledEnglishGrammar() throws Exception {
		List<String> rows = runWithStdin("She eats the cake with a fork.\ncake the eats\n", new String[] {"-q", "-c"});
		assertEquals("CFG info for english.cfg:", rows.get(0));
		assertTrue(rows.contains("accepted\t(S (NP she) (VP (VP (V eats) (NP (Det the) (N cake))) "+
				"(PP (P with) (NP (Det a) (N fork)))))"), rows.toString());
		assertEquals("rejected", rows.get(rows.size()-1));
	}

	@Test
	void helpPrintsUsage() throws Exception {
		assertEquals(0, Chomsky.run(new String[] {"-h"}));
		String text = err.toString("utf-8");
		assertTrue(text.contains("Usage: chomsky"), text);
		assertTrue(text.contains("--tokenizer"), text);
	}

	@Test
	void timingGoesToDiagnostics() throws Exception {
		String g = write("g.cfg", "S -> a S | a\n");
		String in = write("input.txt", "a a\n");
		String out = new File(dir, "out.txt").getPath();
		assertEquals(0, Chomsky.run(new String[] {"--time", "2", "-q", "-k", "plain", "-o", out, g, in}));
		String text = err.toString("utf-8");
		assertTrue(text.contains("epsilon removal: "), text);
		assertTrue(text.contains("total operation: "), text);
	}
}
