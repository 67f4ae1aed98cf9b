package rac.operator;

import java.util.Objects;

/**
 * A value paired with its 1-based position in the stream.
 *
 * @param <T> the value type
 */
public final class Enumerated<T> {

    final T value;

    final long index;

    public Enumerated(T value, long index) {
        this.value = Objects.requireNonNull(value, "value");
        this.index = index;
    }

    public T value() {
        return value;
    }

    public long index() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Enumerated)) {
            return false;
        }
        Enumerated<?> other = (Enumerated<?>) o;
        return index == other.index && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * value.hashCode() + Long.hashCode(index);
    }

    @Override
    public String toString() {
        return "(" + value + ", " + index + ")";
    }
}
