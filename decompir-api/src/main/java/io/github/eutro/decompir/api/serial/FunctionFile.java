package io.github.eutro.decompir.api.serial;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.github.eutro.decompir.core.ast.Function;
import io.github.eutro.decompir.core.ast.Stmt;
import io.github.eutro.decompir.core.build.IdAllocator;
import io.github.eutro.decompir.core.build.SymbolTable;
import io.github.eutro.decompir.core.conf.CallingConvention;
import io.github.eutro.decompir.core.types.TypeLattice;
import org.jetbrains.annotations.Nullable;

import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * The JSON file form of one function: {@code {"name": ..., "body": <root id>, "nodes": [records...]}},
 * optionally with a {@code "convention"}.
 */
public final class FunctionFile {
    public final String name;
    @Nullable
    public final CallingConvention convention;
    public final int body;
    public final List<NodeRecord> nodes;

    public FunctionFile(String name, @Nullable CallingConvention convention, int body, List<NodeRecord> nodes) {
        this.name = name;
        this.convention = convention;
        this.body = body;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    /**
     * Flatten a function.
     *
     * @param func The function.
     * @return The file form.
     */
    public static FunctionFile of(Function func) {
        Stmt body = func.getBody();
        return new FunctionFile(func.name, func.convention, body.id, AstSerializer.records(body));
    }

    /**
     * Read a function file.
     *
     * @param reader The source of the JSON.
     * @return The file.
     * @throws JsonParseException If the JSON is malformed, or is not a function file.
     */
    public static FunctionFile read(Reader reader) {
        JsonElement element = JsonParser.parseReader(reader);
        if (!element.isJsonObject()) throw new JsonParseException("expected function object, got " + element);
        JsonObject obj = element.getAsJsonObject();
        List<NodeRecord> nodes = new ArrayList<>();
        for (JsonElement node : CTypeJson.member(obj, "nodes").getAsJsonArray()) {
            nodes.add(NodeRecord.fromJson(node));
        }
        CallingConvention convention = null;
        if (obj.has("convention")) {
            try {
                convention = CallingConvention.fromName(obj.get("convention").getAsString());
            } catch (IllegalArgumentException e) {
                throw new JsonParseException(e.getMessage(), e);
            }
        }
        return new FunctionFile(
                CTypeJson.string(obj, "name"),
                convention,
                CTypeJson.member(obj, "body").getAsInt(),
                nodes);
    }

    /**
     * Rebuild the function. Ids for new nodes are allocated after the largest recorded one.
     *
     * @param defaultConvention The convention, if the file names none.
     * @param lattice           The type lattice of the symbol table.
     * @return The function.
     */
    public Function toFunction(CallingConvention defaultConvention, TypeLattice lattice) {
        int maxId = body;
        for (NodeRecord node : nodes) maxId = Math.max(maxId, node.id);
        IdAllocator ids = new IdAllocator(maxId + 1);
        SymbolTable symbols = new SymbolTable(lattice, ids);
        Stmt stmt = new AstDeserializer(nodes, symbols).readStmt(body);
        return new Function(name, convention == null ? defaultConvention : convention, ids, symbols, stmt);
    }

    public JsonObject toJson() {
        JsonObject obj = new JsonObject();
        obj.addProperty("name", name);
        if (convention != null) obj.addProperty("convention", convention.name().toLowerCase(Locale.ROOT));
        obj.addProperty("body", body);
        JsonArray array = new JsonArray();
        for (NodeRecord node : nodes) array.add(node.toJson());
        obj.add("nodes", array);
        return obj;
    }

    public void write(Writer writer) {
        new GsonBuilder().setPrettyPrinting().create().toJson(toJson(), writer);
    }
}
