package org.kidoni.cas.error;

/**
 * Every way an operation of the engine can fail. Carried by {@link ExpressionException} inside the
 * tree operations and by {@link Result.Err} at the engine boundary.
 */
public sealed interface CasError {
    String message();

    record ParseError(String message, int offset) implements CasError {
    }

    record UndefinedVariable(String name) implements CasError {
        @Override
        public String message() {
            return "undefined variable: " + name;
        }
    }

    record DivisionByZero() implements CasError {
        @Override
        public String message() {
            return "division by zero";
        }
    }

    record DomainError(String operation, double value) implements CasError {
        @Override
        public String message() {
            return operation + " is undefined for " + value;
        }
    }

    record UnsupportedDifferentiation(String reason) implements CasError {
        @Override
        public String message() {
            return "cannot differentiate: " + reason;
        }
    }

    record UnsupportedIntegration(String reason) implements CasError {
        @Override
        public String message() {
            return "cannot integrate: " + reason;
        }
    }

    record UnsupportedEquation(String reason) implements CasError {
        @Override
        public String message() {
            return "cannot solve: " + reason;
        }
    }

    record NoExpression() implements CasError {
        @Override
        public String message() {
            return "no expression loaded";
        }
    }

    record UnrecognizedNode(String type) implements CasError {
        @Override
        public String message() {
            return "unrecognized node: " + type;
        }
    }

    record ArityMismatch(String function, int expected, int actual) implements CasError {
        @Override
        public String message() {
            return function + " expects " + expected + " argument(s) but got " + actual;
        }
    }

    record UnknownFunction(String name) implements CasError {
        @Override
        public String message() {
            return "unknown function: " + name;
        }
    }
}
