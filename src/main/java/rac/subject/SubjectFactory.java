package rac.subject;

/**
 * Creates fresh subjects of one variant.
 */
public interface SubjectFactory {

    <T> Subject<T> create(Class<?> type);

    default <T> Subject<T> create() {
        return create(Object.class);
    }
}
