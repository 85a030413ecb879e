package org.athos.parser;

import java.io.Serial;

/**
 * ParseException reports a lexical or syntax error in the C source.
 * The message includes the file name and line number of the offending
 * token, as in {@code Expected ';' but got '}' at main.c line 12}.
 */
public class ParseException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public final String fileName;
    public final int line;

    // Detailed error message that includes the source position
    private final String errorMessage;

    public ParseException(String fileName, int line, String message) {
        super(message);
        this.fileName = fileName;
        this.line = line;
        this.errorMessage = message + " at " + fileName + " line " + line;
    }

    /**
     * Returns the detailed error message.
     *
     * @return the detailed error message
     */
    @Override
    public String getMessage() {
        return errorMessage;
    }
}
