package io.github.eutro.decompir.api.serial;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The flat form of one node: its id, tag, the ids of its present children,
 * and the scalar fields of its variant.
 */
public final class NodeRecord {
    public final int id;
    public final String tag;
    public final List<Integer> args;
    /**
     * The variant-specific fields, like {@code value} or {@code op}.
     */
    public final JsonObject scalars;

    public NodeRecord(int id, String tag, List<Integer> args, JsonObject scalars) {
        this.id = id;
        this.tag = tag;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.scalars = scalars;
    }

    public boolean has(String key) {
        JsonElement element = scalars.get(key);
        return element != null && !element.isJsonNull();
    }

    public JsonElement get(String key) {
        return CTypeJson.member(scalars, key);
    }

    public JsonObject toJson() {
        JsonObject obj = new JsonObject();
        obj.addProperty("id", id);
        obj.addProperty("tag", tag);
        JsonArray argsArray = new JsonArray();
        for (Integer arg : args) argsArray.add(arg);
        obj.add("args", argsArray);
        for (Map.Entry<String, JsonElement> entry : scalars.entrySet()) {
            obj.add(entry.getKey(), entry.getValue());
        }
        return obj;
    }

    /**
     * Read a record.
     *
     * @param element The JSON.
     * @return The record.
     * @throws JsonParseException If the id, tag or args are missing or malformed.
     */
    public static NodeRecord fromJson(JsonElement element) {
        if (!element.isJsonObject()) throw new JsonParseException("expected node record, got " + element);
        JsonObject obj = element.getAsJsonObject();
        int id = CTypeJson.member(obj, "id").getAsInt();
        String tag = CTypeJson.string(obj, "tag");
        List<Integer> args = new ArrayList<>();
        if (obj.has("args")) {
            for (JsonElement arg : obj.get("args").getAsJsonArray()) args.add(arg.getAsInt());
        }
        JsonObject scalars = new JsonObject();
        for (Map.Entry<String, JsonElement> entry : obj.entrySet()) {
            switch (entry.getKey()) {
                case "id":
                case "tag":
                case "args":
                    break;
                default:
                    scalars.add(entry.getKey(), entry.getValue());
            }
        }
        return new NodeRecord(id, tag, args, scalars);
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
