package rac.subject;

import java.util.Collections;
import java.util.List;

/**
 * A subject without memory: actors see only the events emitted after they joined.
 *
 * @param <T> the value type
 */
public final class DirectSubject<T> extends Subject<T> {

    public DirectSubject() {
        this(Object.class);
    }

    public DirectSubject(Class<?> type) {
        super(type);
    }

    @Override
    public Subject<T> similar() {
        return new DirectSubject<>(type);
    }

    @Override
    List<T> replay() {
        return Collections.emptyList();
    }
}
