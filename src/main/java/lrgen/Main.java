package lrgen;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import lrgen.grammar.Production;
import lrgen.grammar.random.SentenceGenerator;
import lrgen.parser.lr.Generator;
import lrgen.parser.lr.ParseError;
import lrgen.parser.lr.ParseTrace;

/**
 * Command line interface: <code>Main [--dot] [--sample N] grammar-file [input...]</code>
 */
public class Main {

	private static final String USAGE = "Usage: Main [--dot] [--sample N] <grammar-file> [input...]";

	public static void main(String[] args) {
		System.exit(run(args));
	}

	/**
	 * @return exit code
	 */
	static int run(String[] args){
		boolean dot = false;
		int samples = 0;
		List<String> rest = new ArrayList<>();
		for (int i = 0; i < args.length; i++) {
			switch (args[i]) {
				case "--dot":
					dot = true;
					break;
				case "--sample":
					if (i + 1 >= args.length){
						System.err.println(USAGE);
						return 2;
					}
					try {
						samples = Integer.parseInt(args[++i]);
					} catch (NumberFormatException ex){
						System.err.println("Invalid number of samples: " + args[i]);
						return 2;
					}
					break;
				default:
					rest.add(args[i]);
			}
		}
		if (rest.isEmpty()){
			System.err.println(USAGE);
			return 2;
		}
		String grammarText;
		try {
			grammarText = new String(Files.readAllBytes(Paths.get(rest.get(0))), StandardCharsets.UTF_8);
		} catch (IOException ex){
			System.err.println("Can't read " + rest.get(0) + ": " + ex.getMessage());
			return 2;
		}
		try {
			Generator generator = Generator.fromText(grammarText);
			if (dot){
				System.out.println(generator.automaton.toDotString());
				return 0;
			}
			if (samples > 0){
				SentenceGenerator sentenceGenerator = new SentenceGenerator(generator.grammar);
				for (int i = 0; i < samples; i++) {
					System.out.println(sentenceGenerator.generateRandomSentenceString());
				}
				return 0;
			}
			System.out.println(generator.grammar.longDescription());
			System.out.println();
			System.out.println("FIRST sets:");
			System.out.println(generator.firstSets);
			System.out.println();
			System.out.println(generator.automaton);
			System.out.println();
			System.out.println(generator.table);
			if (rest.size() > 1){
				String input = String.join(" ", rest.subList(1, rest.size()));
				System.out.println();
				try {
					ParseTrace trace = generator.parse(input);
					System.out.println(trace);
					System.out.println();
					System.out.println("Derivation:");
					for (Production production : trace.rightmostDerivation()) {
						System.out.println(production.toSimpleString());
					}
				} catch (ParseError error){
					System.out.println(error.trace);
					throw error;
				}
			}
			return 0;
		} catch (LRException ex){
			System.err.println(ex.getMessage());
			return 1;
		}
	}
}
