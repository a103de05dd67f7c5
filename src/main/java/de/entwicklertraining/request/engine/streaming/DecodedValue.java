package de.entwicklertraining.request.engine.streaming;

import org.json.JSONArray;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * One value decoded from a JSON payload.
 *
 * <p>JSON payloads can be objects, arrays or scalars. The {@link Kind} tag tells them apart.
 * Only {@link Kind#OBJECT} values carry the {@link FrameFields} of the frame they came from;
 * arrays and scalars never do.
 *
 * <p>Instances are immutable. The JSON accessors return copies, so callers may modify what they get.
 */
public final class DecodedValue {

    /**
     * Shape of a decoded JSON value.
     */
    public enum Kind {
        OBJECT,
        ARRAY,
        STRING,
        NUMBER,
        BOOLEAN,
        NULL
    }

    private final Kind kind;
    private final Object value;
    private final FrameFields fields;

    private DecodedValue(Kind kind, Object value, FrameFields fields) {
        this.kind = kind;
        this.value = value;
        this.fields = fields;
    }

    /**
     * Wraps a value produced by {@link org.json.JSONTokener#nextValue()} or taken from a {@link JSONArray}.
     *
     * @param json the decoded value
     * @param fields the frame fields; ignored unless the value is an object
     * @return the tagged value
     */
    static DecodedValue of(Object json, FrameFields fields) {
        if (json == null || JSONObject.NULL.equals(json)) {
            return new DecodedValue(Kind.NULL, null, FrameFields.NONE);
        }
        if (json instanceof JSONObject object) {
            return new DecodedValue(Kind.OBJECT, copy(object), fields != null ? fields : FrameFields.NONE);
        }
        if (json instanceof JSONArray array) {
            return new DecodedValue(Kind.ARRAY, copy(array), FrameFields.NONE);
        }
        if (json instanceof String) {
            return new DecodedValue(Kind.STRING, json, FrameFields.NONE);
        }
        if (json instanceof Boolean) {
            return new DecodedValue(Kind.BOOLEAN, json, FrameFields.NONE);
        }
        if (json instanceof Number) {
            return new DecodedValue(Kind.NUMBER, json, FrameFields.NONE);
        }
        // JSONTokener only yields the types above
        return new DecodedValue(Kind.STRING, json.toString(), FrameFields.NONE);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isObject() {
        return kind == Kind.OBJECT;
    }

    /**
     * Returns the frame fields attached to this value.
     * Always {@link FrameFields#NONE} for non-object values.
     *
     * @return the frame fields
     */
    public FrameFields getFields() {
        return fields;
    }

    /**
     * @return a copy of the object
     * @throws IllegalStateException if this value is not an object
     */
    public JSONObject asObject() {
        if (kind != Kind.OBJECT) {
            throw new IllegalStateException("Decoded value is " + kind + ", not OBJECT");
        }
        return copy((JSONObject) value);
    }

    /**
     * @return a copy of the array
     * @throws IllegalStateException if this value is not an array
     */
    public JSONArray asArray() {
        if (kind != Kind.ARRAY) {
            throw new IllegalStateException("Decoded value is " + kind + ", not ARRAY");
        }
        return copy((JSONArray) value);
    }

    public Optional<String> asString() {
        return kind == Kind.STRING ? Optional.of((String) value) : Optional.empty();
    }

    public Optional<Number> asNumber() {
        return kind == Kind.NUMBER ? Optional.of((Number) value) : Optional.empty();
    }

    public Optional<Boolean> asBoolean() {
        return kind == Kind.BOOLEAN ? Optional.of((Boolean) value) : Optional.empty();
    }

    /**
     * Returns the JSON text of this value. Strings are quoted.
     *
     * @return the JSON representation
     */
    public String toJson() {
        return switch (kind) {
            case OBJECT, ARRAY -> value.toString();
            case STRING -> JSONObject.quote((String) value);
            case NUMBER, BOOLEAN -> String.valueOf(value);
            case NULL -> "null";
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DecodedValue other)) return false;
        if (kind != other.kind || !fields.equals(other.fields)) return false;
        return switch (kind) {
            case OBJECT -> ((JSONObject) value).similar(other.value);
            case ARRAY -> ((JSONArray) value).similar(other.value);
            case NUMBER -> numbersEqual((Number) value, (Number) other.value);
            default -> Objects.equals(value, other.value);
        };
    }

    @Override
    public int hashCode() {
        // JSON containers have no structural hashCode; the text form is stable for equal values
        return Objects.hash(kind, kind == Kind.NUMBER ? new BigDecimal(value.toString()).stripTrailingZeros() : toJson(), fields);
    }

    @Override
    public String toString() {
        if (kind == Kind.OBJECT && !fields.isEmpty()) {
            return toJson() + " " + fields;
        }
        return toJson();
    }

    private static boolean numbersEqual(Number a, Number b) {
        if (a instanceof BigInteger || a instanceof Integer || a instanceof Long) {
            if (b instanceof BigInteger || b instanceof Integer || b instanceof Long) {
                return new BigInteger(a.toString()).equals(new BigInteger(b.toString()));
            }
        }
        return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString())) == 0;
    }

    private static JSONObject copy(JSONObject object) {
        return new JSONObject(object.toString());
    }

    private static JSONArray copy(JSONArray array) {
        return new JSONArray(array.toString());
    }
}
