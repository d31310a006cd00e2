package typesafeschwalbe.blockgraph;

import java.util.List;
import java.util.function.Function;

public class Result<T> {

    private final T value;
    private final List<Error> errors;

    private Result(T value, List<Error> errors) {
        this.value = value;
        this.errors = errors;
    }

    public static <T> Result<T> ofValue(T value) {
        return new Result<T>(value, null);
    }

    public static <T> Result<T> ofError(Error... errors) {
        return new Result<T>(null, List.of(errors));
    }

    public static <T> Result<T> ofError(List<Error> errors) {
        return new Result<T>(null, List.copyOf(errors));
    }

    public boolean isValue() {
        return this.errors == null;
    }

    public T getValue() {
        if(this.errors != null) {
            throw new IllegalStateException(
                "Attempted to get the value of a 'Result' holding errors!"
            );
        }
        return this.value;
    }

    public boolean isError() {
        return this.errors != null;
    }

    public List<Error> getError() {
        if(this.errors == null) {
            throw new IllegalStateException(
                "Attempted to get the errors of a 'Result' without any errors!"
            );
        }
        return this.errors;
    }

    public <R> Result<R> map(Function<T, R> f) {
        if(this.errors != null) {
            return new Result<R>(null, this.errors);
        }
        return new Result<R>(f.apply(this.value), null);
    }

}
