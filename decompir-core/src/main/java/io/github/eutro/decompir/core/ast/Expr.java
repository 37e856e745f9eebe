package io.github.eutro.decompir.core.ast;

import java.util.Set;

/**
 * An expression.
 */
public abstract class Expr extends Node {
    Expr(int id) {
        super(id);
    }

    /**
     * Dispatch on the variant of this expression.
     *
     * @param visitor The visitor.
     * @param <R>     The result type.
     * @return The result of the visitor method for this variant.
     */
    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Get the names of the variables whose values this expression reads.
     *
     * @return The names.
     */
    public abstract Set<String> use();

    public abstract Set<String> addressTaken();

    public abstract Set<String> variablesUsed();

    public boolean isIntegerConstant() {
        return false;
    }

    /**
     * Get the value of this expression. Check {@link #isIntegerConstant()} first.
     *
     * @return The value.
     * @throws IllegalStateException If this is not an integer constant.
     */
    public long getIntegerValue() {
        throw new IllegalStateException("expression " + id + " (" + getTag() + ") is not an integer constant");
    }

    @Override
    public String toCLike(int indent) {
        return toCLike();
    }

    @Override
    public abstract String toCLike();

    /**
     * A visitor over the variants of {@link Expr}.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        R visitIntegerConstant(IntegerConstant expr);

        R visitStringConstant(StringConstant expr);

        R visitLvalExpr(LvalExpr expr);

        R visitSubstitutedExpr(SubstitutedExpr expr);

        R visitCastExpr(CastExpr expr);

        R visitUnaryOp(UnaryOp expr);

        R visitBinaryOp(BinaryOp expr);

        R visitQuestion(Question expr);

        R visitAddressOf(AddressOf expr);
    }
}
