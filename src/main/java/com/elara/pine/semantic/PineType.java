package com.elara.pine.semantic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Static type of a script value.
 *
 * Scalars are shared constants; composite types (series, array, matrix, tuple, function,
 * user-defined) are built with the factory methods.
 */
public final class PineType {

    public enum Kind {
        INT("int"),
        FLOAT("float"),
        BOOL("bool"),
        STRING("string"),
        COLOR("color"),
        SERIES("series"),
        ARRAY("array"),
        MATRIX("matrix"),
        TUPLE("tuple"),
        FUNCTION("function"),
        USER_DEFINED("userDefined"),
        NA("na"),
        UNKNOWN("unknown"),
        VOID("void");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public static final PineType INT = new PineType(Kind.INT, null, null, null, null, null);
    public static final PineType FLOAT = new PineType(Kind.FLOAT, null, null, null, null, null);
    public static final PineType BOOL = new PineType(Kind.BOOL, null, null, null, null, null);
    public static final PineType STRING = new PineType(Kind.STRING, null, null, null, null, null);
    public static final PineType COLOR = new PineType(Kind.COLOR, null, null, null, null, null);
    public static final PineType NA = new PineType(Kind.NA, null, null, null, null, null);
    public static final PineType UNKNOWN = new PineType(Kind.UNKNOWN, null, null, null, null, null);
    public static final PineType VOID = new PineType(Kind.VOID, null, null, null, null, null);

    private final Kind kind;
    private final PineType elementType;
    private final List<PineType> elements;
    private final List<FunctionParam> params;
    private final PineType returnType;
    private final String name;

    private PineType(Kind kind, PineType elementType, List<PineType> elements,
                     List<FunctionParam> params, PineType returnType, String name) {
        this.kind = kind;
        this.elementType = elementType;
        this.elements = elements;
        this.params = params;
        this.returnType = returnType;
        this.name = name;
    }

    public static PineType series(PineType element) {
        return new PineType(Kind.SERIES, element, null, null, null, null);
    }

    public static PineType array(PineType element) {
        return new PineType(Kind.ARRAY, element, null, null, null, null);
    }

    public static PineType matrix(PineType element) {
        return new PineType(Kind.MATRIX, element, null, null, null, null);
    }

    public static PineType tuple(List<PineType> elements) {
        return new PineType(Kind.TUPLE, null, Collections.unmodifiableList(new ArrayList<>(elements)), null, null, null);
    }

    public static PineType function(List<FunctionParam> params, PineType returnType) {
        return new PineType(Kind.FUNCTION, null, null, Collections.unmodifiableList(new ArrayList<>(params)), returnType, null);
    }

    public static PineType userDefined(String name) {
        return new PineType(Kind.USER_DEFINED, null, null, null, null, name);
    }

    /**
     * Resolves a declared type name such as {@code float}, {@code array<int>} or a user type.
     * Returns UNKNOWN for null.
     */
    public static PineType fromName(String typeName) {
        if (typeName == null) return UNKNOWN;
        String t = typeName.trim();
        int lt = t.indexOf('<');
        if (lt > 0 && t.endsWith(">")) {
            String base = t.substring(0, lt);
            PineType inner = fromName(t.substring(lt + 1, t.length() - 1));
            switch (base) {
                case "array": return array(inner);
                case "matrix": return matrix(inner);
                case "series": return series(inner);
                default: return userDefined(t);
            }
        }
        switch (t) {
            case "int": return INT;
            case "float": return FLOAT;
            case "bool": return BOOL;
            case "string": return STRING;
            case "color": return COLOR;
            default: return userDefined(t);
        }
    }

    public Kind kind() { return kind; }
    public PineType elementType() { return elementType; }
    public List<PineType> elements() { return elements; }
    public List<FunctionParam> params() { return params; }
    public PineType returnType() { return returnType; }
    public String name() { return name; }

    public boolean isSeries() {
        return kind == Kind.SERIES;
    }

    /** The element type for a series, otherwise this type. */
    public PineType scalar() {
        return kind == Kind.SERIES ? elementType : this;
    }

    /** True when a value of this type may be stored where {@code target} is expected. */
    public boolean isAssignableTo(PineType target) {
        if (kind == target.kind) {
            if (kind == Kind.SERIES || kind == Kind.ARRAY) {
                return elementType.isAssignableTo(target.elementType);
            }
            return true;
        }
        if (kind == Kind.NA) return true;
        if (kind == Kind.INT && target.kind == Kind.FLOAT) return true;
        // series<T> converts to T
        if (kind == Kind.SERIES) return elementType.isAssignableTo(target);
        return kind == Kind.UNKNOWN || target.kind == Kind.UNKNOWN;
    }

    @Override
    public String toString() {
        switch (kind) {
            case SERIES:
            case ARRAY:
            case MATRIX:
                return kind.label() + "<" + elementType + ">";
            case TUPLE: {
                StringBuilder sb = new StringBuilder("[");
                for (int i = 0; i < elements.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(elements.get(i));
                }
                return sb.append(']').toString();
            }
            case FUNCTION: {
                StringBuilder sb = new StringBuilder("(");
                for (int i = 0; i < params.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(params.get(i).type());
                }
                return sb.append(") => ").append(returnType).toString();
            }
            case USER_DEFINED:
                return name;
            default:
                return kind.label();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PineType)) return false;
        PineType other = (PineType) o;
        return kind == other.kind
                && Objects.equals(elementType, other.elementType)
                && Objects.equals(elements, other.elements)
                && Objects.equals(returnType, other.returnType)
                && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, elementType, elements, returnType, name);
    }
}
