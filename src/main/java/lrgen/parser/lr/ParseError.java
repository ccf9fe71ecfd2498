package lrgen.parser.lr;

import java.util.List;
import java.util.stream.Collectors;

import lrgen.LocatedLRException;
import lrgen.lexer.Token;

/**
 * The parser reached an error cell or couldn't continue after a reduce. The trace up to and including
 * the failing step stays available.
 */
public class ParseError extends LocatedLRException {

	public final Token token;
	/**
	 * Position of the offending token, the end marker has the position <code>number of tokens</code>
	 */
	public final int position;
	public final int state;
	/**
	 * Names of the expected terminals, ordered like the terminals of the grammar
	 */
	public final List<String> expected;
	public final ParseTrace trace;

	public ParseError(TraceStep errorStep, ParseTrace trace) {
		super(errorStep.token, String.format("%s at position %d %s (state %d), expected %s",
				errorStep.errorMessage, errorStep.position(), errorStep.token.location, errorStep.before.currentState(),
				errorStep.expected.stream().map(t -> t.name).collect(Collectors.toList())));
		this.token = errorStep.token;
		this.position = errorStep.position();
		this.state = errorStep.before.currentState();
		this.expected = errorStep.expected.stream().map(t -> t.name).collect(Collectors.toList());
		this.trace = trace;
	}
}
