package org.kidoni.cas.op;

import java.util.List;

import org.kidoni.cas.error.CasError;
import org.kidoni.cas.error.ExpressionException;

/**
 * Evaluation of a function called by name, shared by the call nodes of both trees.
 */
public final class Functions {
    private Functions() {
    }

    public static double call(final String name, final List<Double> arguments) {
        UnaryOp op = UnaryOp.forFunctionName(name)
                .orElseThrow(() -> new ExpressionException(new CasError.UnknownFunction(name)));

        if (arguments.size() != 1) {
            throw new ExpressionException(new CasError.ArityMismatch(name, 1, arguments.size()));
        }

        return op.apply(arguments.get(0));
    }

    public static boolean isKnown(final String name) {
        return UnaryOp.forFunctionName(name).isPresent();
    }
}
