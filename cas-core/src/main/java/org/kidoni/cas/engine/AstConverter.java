package org.kidoni.cas.engine;

import org.kidoni.cas.ast.Node;
import org.kidoni.cas.error.CasError;
import org.kidoni.cas.error.ExpressionException;
import org.kidoni.cas.symbolic.Expr;

/**
 * Maps a parsed syntax tree node for node onto the symbolic tree.
 */
public final class AstConverter {
    private AstConverter() {
    }

    public static Expr convert(final Node node) {
        if (node instanceof Node.ConstNode c) {
            return new Expr.ConstExpr(c.value());
        }
        if (node instanceof Node.VarNode v) {
            return new Expr.VarExpr(v.name());
        }
        if (node instanceof Node.BinaryNode b) {
            return new Expr.BinaryExpr(b.op(), convert(b.left()), convert(b.right()));
        }
        if (node instanceof Node.UnaryNode u) {
            return new Expr.UnaryExpr(u.op(), convert(u.operand()));
        }
        if (node instanceof Node.CallNode c) {
            return new Expr.CallExpr(c.name(), c.arguments().stream().map(AstConverter::convert).toList());
        }
        throw new ExpressionException(new CasError.UnrecognizedNode(node == null ? "null" : node.getClass().getName()));
    }
}
