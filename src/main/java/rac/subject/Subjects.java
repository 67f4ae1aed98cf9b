package rac.subject;

import rac.util.RacConfig;

/**
 * Factories of the subject variants.
 */
public enum Subjects {
    ;

    static final SubjectFactory DIRECT = new SubjectFactory() {
        @Override
        public <T> Subject<T> create(Class<?> type) {
            return new DirectSubject<>(type);
        }
    };

    static final SubjectFactory RECENT = new SubjectFactory() {
        @Override
        public <T> Subject<T> create(Class<?> type) {
            return new RecentSubject<>(type);
        }
    };

    public static SubjectFactory direct() {
        return DIRECT;
    }

    public static SubjectFactory recent() {
        return RECENT;
    }

    public static SubjectFactory replay() {
        return replay(RacConfig.REPLAY_CAPACITY);
    }

    public static SubjectFactory replay(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity > 0 required but it was " + capacity);
        }
        return new SubjectFactory() {
            @Override
            public <T> Subject<T> create(Class<?> type) {
                return new ReplaySubject<>(type, capacity);
            }
        };
    }
}
