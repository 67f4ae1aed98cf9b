package rac.util;

import java.util.Arrays;

/**
 * Indexed storage for a dynamic set of inner subscribers.
 * <p>
 * Every added entry receives a stable slot index; the slot returns to the free
 * list when the entry is removed and is handed out again to a later entry.
 * {@link #unsubscribe()} terminates the tracker: every live entry is disposed and
 * later additions are rejected.
 *
 * @param <T> the entry type
 */
public abstract class InnerTracker<T> {

    static final Object[] EMPTY = new Object[0];

    static final Object[] TERMINATED = new Object[0];

    private volatile Object[] array = EMPTY;

    private int[] free = new int[0];

    private int freeCount;

    private volatile int size;

    protected abstract void unsubscribeEntry(T entry);

    protected abstract void setIndex(T entry, int index);

    /**
     * Disposes every live entry and rejects further additions. Idempotent.
     */
    @SuppressWarnings("unchecked")
    public final void unsubscribe() {
        Object[] a;
        synchronized (this) {
            a = array;
            if (a == TERMINATED) {
                return;
            }
            size = 0;
            freeCount = 0;
            array = TERMINATED;
        }
        for (Object e : a) {
            if (e != null) {
                unsubscribeEntry((T) e);
            }
        }
    }

    /**
     * Adds an entry and assigns its slot index.
     *
     * @param entry the entry
     * @return false if the tracker was already terminated
     */
    public final boolean add(T entry) {
        synchronized (this) {
            Object[] a = array;
            if (a == TERMINATED) {
                return false;
            }

            int idx;
            if (freeCount != 0) {
                idx = free[--freeCount];
            } else {
                int n = a.length;
                Object[] b = Arrays.copyOf(a, n != 0 ? n << 1 : 4);
                int[] f = new int[b.length];
                int j = 0;
                for (int i = b.length - 1; i > n; i--) {
                    f[j++] = i;
                }
                free = f;
                freeCount = j;
                array = b;
                a = b;
                idx = n;
            }
            setIndex(entry, idx);
            a[idx] = entry;
            size++;
            return true;
        }
    }

    /**
     * Removes the entry at the given slot, returning the slot to the free list.
     *
     * @param index the slot index
     */
    public final void remove(int index) {
        synchronized (this) {
            Object[] a = array;
            if (a != TERMINATED && a[index] != null) {
                a[index] = null;
                free[freeCount++] = index;
                size--;
            }
        }
    }

    public final boolean isEmpty() {
        return size == 0;
    }

    public final int size() {
        return size;
    }

    public final boolean isTerminated() {
        return array == TERMINATED;
    }
}
