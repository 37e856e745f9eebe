package io.github.eutro.decompir.core.ast;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * The operator tokens of {@link UnaryOp} and {@link BinaryOp}, with their C renderings.
 */
public final class Operators {
    public static final String PLUS = "plus";
    public static final String MINUS = "minus";

    /**
     * Binary operator tokens, mapped to their C text.
     */
    public static final Map<String, String> BINARY;
    /**
     * Unary operator tokens, mapped to their C text.
     */
    public static final Map<String, String> UNARY;

    static {
        Map<String, String> binary = new HashMap<>();
        binary.put("and", " && ");
        binary.put("land", " && ");
        binary.put("lor", " || ");
        binary.put("band", " & ");
        binary.put("bor", " | ");
        binary.put("bxor", " ^ ");
        binary.put("asr", " >> "); // signed
        binary.put("lsr", " >> "); // unsigned
        binary.put("shiftrt", " >> ");
        binary.put("lsl", " << ");
        binary.put("shiftlt", " << ");
        binary.put(PLUS, " + ");
        binary.put(MINUS, " - ");
        binary.put("mult", " * ");
        binary.put("div", " / ");
        binary.put("mod", " % ");
        binary.put("eq", " == ");
        binary.put("ne", " != ");
        binary.put("neq", " != ");
        binary.put("gt", " > ");
        binary.put("ge", " >= ");
        binary.put("lt", " < ");
        binary.put("le", " <= ");
        BINARY = Collections.unmodifiableMap(binary);

        Map<String, String> unary = new HashMap<>();
        unary.put("neg", "-");
        unary.put("bnot", "~");
        unary.put("lnot", "!");
        UNARY = Collections.unmodifiableMap(unary);
    }

    private Operators() {
    }

    public static String binaryText(String op) {
        String text = BINARY.get(op);
        if (text == null) throw new IllegalArgumentException("unknown binary operator: " + op);
        return text;
    }

    public static String unaryText(String op) {
        String text = UNARY.get(op);
        if (text == null) throw new IllegalArgumentException("unknown unary operator: " + op);
        return text;
    }

    static String parenthesize(Expr operand) {
        String text = operand.toCLike();
        Expr shown = operand;
        while (shown instanceof SubstitutedExpr) shown = ((SubstitutedExpr) shown).substituted;
        return shown instanceof BinaryOp ? "(" + text + ")" : text;
    }
}
