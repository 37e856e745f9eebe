package io.github.eutro.decompir.api.serial;

import com.google.gson.JsonObject;
import io.github.eutro.decompir.core.ast.*;
import io.github.eutro.decompir.core.util.TreeWalker;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Flattens a tree into {@link NodeRecord}s, in pre-order.
 * <p>
 * Every id is emitted once, so a subtree shared by several parents appears once. Placeholder
 * nodes (id {@link Node#NO_ID}) are neither emitted nor listed as children.
 */
public final class AstSerializer {
    private AstSerializer() {
    }

    public static List<NodeRecord> records(Node root) {
        List<NodeRecord> records = new ArrayList<>();
        Set<Integer> emitted = new HashSet<>();
        TreeWalker.preorder(root, node -> {
            if (emitted.add(node.id)) records.add(record(node));
        });
        return records;
    }

    public static NodeRecord record(Node node) {
        List<Integer> args = new ArrayList<>();
        for (Node child : node.children()) {
            if (child.isPresent()) args.add(child.id);
        }
        return new NodeRecord(node.id, node.getTag(), args, scalars(node));
    }

    private static JsonObject scalars(Node node) {
        JsonObject obj = new JsonObject();
        if (node instanceof IntegerConstant) {
            IntegerConstant constant = (IntegerConstant) node;
            obj.addProperty("value", constant.value);
            if (constant.macroName != null) obj.addProperty("macro", constant.macroName);
        } else if (node instanceof StringConstant) {
            StringConstant constant = (StringConstant) node;
            obj.addProperty("cstr", constant.text);
            obj.addProperty("va", constant.address);
        } else if (node instanceof UnaryOp) {
            obj.addProperty("op", ((UnaryOp) node).op);
        } else if (node instanceof BinaryOp) {
            obj.addProperty("op", ((BinaryOp) node).op);
        } else if (node instanceof CastExpr) {
            obj.addProperty("type", ((CastExpr) node).targetType);
        } else if (node instanceof FieldOffset) {
            FieldOffset offset = (FieldOffset) node;
            obj.addProperty("fieldname", offset.fieldName);
            if (offset.fieldType != null) obj.add("fieldtype", CTypeJson.toJson(offset.fieldType));
        } else if (node instanceof SubstitutedExpr) {
            obj.addProperty("assigned", ((SubstitutedExpr) node).assignId);
        } else if (node instanceof Branch) {
            obj.addProperty("offset", ((Branch) node).relativeOffset);
        } else if (node instanceof Variable) {
            VarInfo varInfo = ((Variable) node).varInfo;
            obj.addProperty("name", varInfo.name);
            if (varInfo.altname != null) obj.addProperty("altname", varInfo.altname);
            if (varInfo.parameter != null) obj.addProperty("parameter", varInfo.parameter);
            if (varInfo.globalAddress != null) obj.addProperty("gaddr", varInfo.globalAddress);
            if (varInfo.type != null) obj.add("vtype", CTypeJson.toJson(varInfo.type));
        }
        return obj;
    }
}
