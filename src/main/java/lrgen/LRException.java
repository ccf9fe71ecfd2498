package lrgen;

/**
 * Base class of all errors thrown while reading grammars, building parser tables and parsing.
 */
public class LRException extends RuntimeException {

	public LRException(String message) {
		super(message);
	}

	public LRException(String message, Throwable cause) {
		super(message, cause);
	}
}
