package com.grammar.depend.grammar.exception;

/**
 * A grammar file, or one of the grammars it imports, could not be read or understood.
 */
public class GrammarLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GrammarLoadException(String message) {
        super(message);
    }

    public GrammarLoadException(String message, Throwable cause) {
        super(message, cause);
    }

    public static GrammarLoadException at(String fileName, int line, String message) {
        return new GrammarLoadException(fileName + ":" + line + ": " + message);
    }
}
