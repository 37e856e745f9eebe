package io.github.eutro.decompir.api.serial;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import io.github.eutro.decompir.core.types.CType;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts type tokens to and from JSON objects tagged by {@link CType#getKind() kind}.
 */
public final class CTypeJson {
    private CTypeJson() {
    }

    public static JsonObject toJson(CType type) {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", type.getKind());
        if (type instanceof CType.Named) {
            obj.addProperty("name", ((CType.Named) type).name);
        } else if (type instanceof CType.Int) {
            obj.addProperty("ikind", ((CType.Int) type).ikind);
        } else if (type instanceof CType.Ptr) {
            obj.add("target", toJson(((CType.Ptr) type).target));
        } else if (type instanceof CType.Array) {
            CType.Array array = (CType.Array) type;
            obj.add("element", toJson(array.element));
            if (array.length != null) obj.addProperty("length", array.length);
        } else if (type instanceof CType.Struct) {
            CType.Struct struct = (CType.Struct) type;
            obj.addProperty("name", struct.name);
            JsonArray fields = new JsonArray();
            for (CType.Struct.Field field : struct.fields) {
                JsonObject fieldObj = new JsonObject();
                fieldObj.addProperty("name", field.name);
                fieldObj.add("type", toJson(field.type));
                fields.add(fieldObj);
            }
            obj.add("fields", fields);
        } else if (type instanceof CType.Fun) {
            CType.Fun fun = (CType.Fun) type;
            obj.add("ret", toJson(fun.returnType));
            JsonArray params = new JsonArray();
            for (CType.Fun.Param param : fun.params) {
                JsonObject paramObj = new JsonObject();
                paramObj.addProperty("name", param.name);
                paramObj.add("type", toJson(param.type));
                params.add(paramObj);
            }
            obj.add("params", params);
        }
        return obj;
    }

    /**
     * Read a type token.
     *
     * @param element The JSON.
     * @return The type.
     * @throws JsonParseException If the JSON is not a known kind of type.
     */
    public static CType fromJson(JsonElement element) {
        if (!element.isJsonObject()) throw new JsonParseException("expected type object, got " + element);
        JsonObject obj = element.getAsJsonObject();
        String kind = string(obj, "kind");
        switch (kind) {
            case "named":
                return CType.named(string(obj, "name"));
            case "void":
                return CType.voidType();
            case "int":
                try {
                    return CType.integer(string(obj, "ikind"));
                } catch (IllegalArgumentException e) {
                    throw new JsonParseException(e.getMessage(), e);
                }
            case "ptr":
                return CType.pointer(fromJson(member(obj, "target")));
            case "array":
                return CType.array(fromJson(member(obj, "element")),
                        obj.has("length") ? obj.get("length").getAsInt() : null);
            case "struct": {
                List<CType.Struct.Field> fields = new ArrayList<>();
                for (JsonElement field : member(obj, "fields").getAsJsonArray()) {
                    JsonObject fieldObj = field.getAsJsonObject();
                    fields.add(new CType.Struct.Field(string(fieldObj, "name"), fromJson(member(fieldObj, "type"))));
                }
                return CType.struct(string(obj, "name"), fields);
            }
            case "fun": {
                List<CType.Fun.Param> params = new ArrayList<>();
                for (JsonElement param : member(obj, "params").getAsJsonArray()) {
                    JsonObject paramObj = param.getAsJsonObject();
                    params.add(new CType.Fun.Param(string(paramObj, "name"), fromJson(member(paramObj, "type"))));
                }
                return CType.function(fromJson(member(obj, "ret")), params);
            }
            default:
                throw new JsonParseException("unknown type kind: " + kind);
        }
    }

    static JsonElement member(JsonObject obj, String key) {
        JsonElement element = obj.get(key);
        if (element == null || element.isJsonNull()) throw new JsonParseException("missing key " + key + " in " + obj);
        return element;
    }

    static String string(JsonObject obj, String key) {
        return member(obj, key).getAsString();
    }
}
