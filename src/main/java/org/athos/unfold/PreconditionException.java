package org.athos.unfold;

import java.io.Serial;

/**
 * Thrown when a program does not have the shape the unfolding transform
 * requires, for example when it has no main {@code while} loop.
 * The transform is aborted; the AST may already have been partially
 * modified and should be discarded.
 */
public class PreconditionException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public PreconditionException(String message) {
        super(message);
    }
}
