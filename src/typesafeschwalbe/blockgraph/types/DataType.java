package typesafeschwalbe.blockgraph.types;

import java.util.List;
import java.util.function.Function;

public class DataType<T> {

    public interface DataTypeValue<T> {}

    public static record ListType<T>(
        T elementType
    ) implements DataTypeValue<T> {}

    public static record Pair<T>(
        T firstType, T secondType
    ) implements DataTypeValue<T> {}

    public static record Closure<T>(
        T argumentType, T returnType
    ) implements DataTypeValue<T> {}

    public enum Type {
        ANY,      // = null
        BOOLEAN,  // = null
        INTEGER,  // = null
        FLOAT,    // = null
        LIST,     // ListType
        PAIR,     // Pair
        CLOSURE;  // Closure

        @Override
        public String toString() {
            switch(this) {
                case ANY: return "any type";
                case BOOLEAN: return "a boolean";
                case INTEGER: return "an integer";
                case FLOAT: return "a float";
                case LIST: return "a list";
                case PAIR: return "a pair";
                case CLOSURE: return "a function";
                default:
                    throw new RuntimeException("unhandled type!");
            }
        }

        public String label() {
            switch(this) {
                case ANY: return "?";
                case BOOLEAN: return "Bool";
                case INTEGER: return "Int";
                case FLOAT: return "Float";
                case LIST: return "List";
                case PAIR: return "Pair";
                case CLOSURE: return "Fun";
                default:
                    throw new RuntimeException("unhandled type!");
            }
        }
    }

    public final Type type;
    private final DataTypeValue<T> value;

    public DataType(Type type, DataTypeValue<T> value) {
        this.type = type;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public <V extends DataTypeValue<T>> V getValue() {
        return (V) this.value;
    }

    public boolean isUnbound() {
        return this.type == Type.ANY;
    }

    /**
     * The argument types of the constructor, in declaration order.
     */
    public List<T> children() {
        switch(this.type) {
            case ANY:
            case BOOLEAN:
            case INTEGER:
            case FLOAT: {
                return List.of();
            }
            case LIST: {
                ListType<T> data = this.getValue();
                return List.of(data.elementType);
            }
            case PAIR: {
                Pair<T> data = this.getValue();
                return List.of(data.firstType, data.secondType);
            }
            case CLOSURE: {
                Closure<T> data = this.getValue();
                return List.of(data.argumentType, data.returnType);
            }
            default: {
                throw new RuntimeException("unhandled type!");
            }
        }
    }

    @Override
    public String toString() {
        if(this.value == null) {
            return this.type.name();
        }
        return this.value.toString();
    }

    public <R> DataType<R> map(Function<T, R> f) {
        switch(this.type) {
            case ANY:
            case BOOLEAN:
            case INTEGER:
            case FLOAT: {
                return new DataType<>(this.type, null);
            }
            case LIST: {
                ListType<T> data = this.getValue();
                return new DataType<>(
                    this.type, new ListType<>(f.apply(data.elementType))
                );
            }
            case PAIR: {
                Pair<T> data = this.getValue();
                return new DataType<>(
                    this.type,
                    new Pair<>(
                        f.apply(data.firstType), f.apply(data.secondType)
                    )
                );
            }
            case CLOSURE: {
                Closure<T> data = this.getValue();
                return new DataType<>(
                    this.type,
                    new Closure<>(
                        f.apply(data.argumentType), f.apply(data.returnType)
                    )
                );
            }
            default: {
                throw new RuntimeException("unhandled type!");
            }
        }
    }

}
