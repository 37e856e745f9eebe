package io.github.eutro.decompir.api.serial;

import io.github.eutro.decompir.core.ast.*;
import io.github.eutro.decompir.core.build.SymbolTable;
import io.github.eutro.decompir.core.types.CType;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds a tree from {@link NodeRecord}s.
 * <p>
 * Nodes keep their recorded ids, and a child referenced by several records is built once and
 * shared. Placeholders omitted from the records are restored from the number of arguments.
 */
public final class AstDeserializer {
    private final Map<Integer, NodeRecord> records = new HashMap<>();
    private final Map<Integer, Node> built = new HashMap<>();
    private final Set<Integer> inProgress = new HashSet<>();
    private final SymbolTable symbols;

    /**
     * Construct a deserializer.
     *
     * @param records The records.
     * @param symbols The table variables are resolved in.
     * @throws IllegalArgumentException If two records have the same id.
     */
    public AstDeserializer(List<NodeRecord> records, SymbolTable symbols) {
        for (NodeRecord record : records) {
            if (this.records.put(record.id, record) != null) {
                throw new IllegalArgumentException("duplicate record for id " + record.id);
            }
        }
        this.symbols = symbols;
    }

    public Stmt readStmt(int id) {
        return as(Stmt.class, read(id));
    }

    public Expr readExpr(int id) {
        return as(Expr.class, read(id));
    }

    /**
     * Build the node with the given id.
     *
     * @param id The id.
     * @return The node.
     * @throws IllegalArgumentException If there is no record with the id, or it or one of its
     *                                  descendants is malformed or is its own ancestor.
     */
    public Node read(int id) {
        Node node = built.get(id);
        if (node != null) return node;
        NodeRecord record = records.get(id);
        if (record == null) throw new IllegalArgumentException("no record for node " + id);
        if (!inProgress.add(id)) throw new IllegalArgumentException("cycle at node " + id);
        try {
            node = build(record);
        } finally {
            inProgress.remove(id);
        }
        built.put(id, node);
        return node;
    }

    private <T extends Node> T as(Class<T> type, Node node) {
        if (!type.isInstance(node)) {
            throw new IllegalArgumentException("node " + node.id + " (" + node.getTag() + ") is not a " + type.getSimpleName());
        }
        return type.cast(node);
    }

    private Node arg(NodeRecord record, int i) {
        if (i >= record.args.size()) {
            throw new IllegalArgumentException("node " + record.id + " (" + record.tag + ") is missing argument " + i);
        }
        return read(record.args.get(i));
    }

    private <T extends Node> T arg(NodeRecord record, int i, Class<T> type) {
        return as(type, arg(record, i));
    }

    private <T extends Node> List<T> argsFrom(NodeRecord record, int start, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (int i = start; i < record.args.size(); i++) result.add(arg(record, i, type));
        return result;
    }

    private Offset optionalOffset(NodeRecord record, int i) {
        return i < record.args.size() ? arg(record, i, Offset.class) : NoOffset.INSTANCE;
    }

    private @Nullable CType optionalType(NodeRecord record, String key) {
        return record.has(key) ? CTypeJson.fromJson(record.get(key)) : null;
    }

    private Node build(NodeRecord r) {
        int id = r.id;
        switch (r.tag) {
            case "return":
                return new Return(id, r.args.isEmpty() ? null : arg(r, 0, Expr.class));
            case "block":
                return new Block(id, argsFrom(r, 0, Stmt.class));
            case "instrs":
                return new InstrSequence(id, argsFrom(r, 0, Instr.class));
            case "if":
                return new Branch(id,
                        arg(r, 0, Expr.class),
                        arg(r, 1, Stmt.class),
                        arg(r, 2, Stmt.class),
                        r.has("offset") ? r.get("offset").getAsInt() : 0);
            case "assign":
                return new Assign(id, arg(r, 0, Lval.class), arg(r, 1, Expr.class));
            case "call": {
                // an ignored result is omitted, so the first argument is the target
                boolean ignored = r.args.isEmpty() || !(arg(r, 0) instanceof Lval);
                int start = ignored ? 0 : 1;
                Lval lhs = ignored ? Lval.IGNORED : arg(r, 0, Lval.class);
                return new Call(id, lhs, arg(r, start, Expr.class), argsFrom(r, start + 1, Expr.class));
            }
            case "lval":
                return new Lval(id, arg(r, 0, LHost.class), optionalOffset(r, 1));
            case "var":
                return new Variable(id, symbols.getOrCreateSymbol(
                        CTypeJson.string(r.scalars, "name"),
                        optionalType(r, "vtype"),
                        r.has("altname") ? r.get("altname").getAsString() : null,
                        r.has("parameter") ? r.get("parameter").getAsInt() : null,
                        r.has("gaddr") ? r.get("gaddr").getAsLong() : null));
            case "memref":
                return new MemRef(id, arg(r, 0, Expr.class));
            case "no-offset":
                return new NoOffset(id);
            case "field-offset":
                return new FieldOffset(id,
                        CTypeJson.string(r.scalars, "fieldname"),
                        optionalType(r, "fieldtype"),
                        optionalOffset(r, 0));
            case "index-offset":
                return new IndexOffset(id, arg(r, 0, Expr.class), optionalOffset(r, 1));
            case "integer-constant":
                return new IntegerConstant(id,
                        r.get("value").getAsLong(),
                        r.has("macro") ? r.get("macro").getAsString() : null);
            case "string-constant":
                return new StringConstant(id,
                        r.args.isEmpty() ? null : arg(r, 0, Expr.class),
                        CTypeJson.string(r.scalars, "cstr"),
                        CTypeJson.string(r.scalars, "va"));
            case "lval-expr":
                return new LvalExpr(id, arg(r, 0, Lval.class));
            case "substituted-expr":
                return new SubstitutedExpr(id,
                        arg(r, 0, Lval.class),
                        r.get("assigned").getAsInt(),
                        arg(r, 1, Expr.class));
            case "cast-expr":
                return new CastExpr(id, CTypeJson.string(r.scalars, "type"), arg(r, 0, Expr.class));
            case "unary-op":
                return new UnaryOp(id, CTypeJson.string(r.scalars, "op"), arg(r, 0, Expr.class));
            case "binary-op":
                return new BinaryOp(id, CTypeJson.string(r.scalars, "op"), arg(r, 0, Expr.class), arg(r, 1, Expr.class));
            case "question":
                return new Question(id, arg(r, 0, Expr.class), arg(r, 1, Expr.class), arg(r, 2, Expr.class));
            case "address-of":
                return new AddressOf(id, arg(r, 0, Lval.class));
            default:
                throw new IllegalArgumentException("unknown tag " + r.tag + " for node " + id);
        }
    }
}
