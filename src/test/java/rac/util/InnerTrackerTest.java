package rac.util;

import org.junit.Assert;
import org.junit.Test;

public class InnerTrackerTest {

    static final class Entry {
        int index = -1;

        int disposed;
    }

    static final class EntryTracker extends InnerTracker<Entry> {
        @Override
        protected void unsubscribeEntry(Entry entry) {
            entry.disposed++;
        }

        @Override
        protected void setIndex(Entry entry, int index) {
            entry.index = index;
        }
    }

    @Test
    public void indicesAreAssignedAndReused() {
        EntryTracker tracker = new EntryTracker();
        Entry e0 = new Entry();
        Entry e1 = new Entry();
        Entry e2 = new Entry();

        Assert.assertTrue(tracker.isEmpty());

        Assert.assertTrue(tracker.add(e0));
        Assert.assertTrue(tracker.add(e1));
        Assert.assertTrue(tracker.add(e2));

        Assert.assertEquals(0, e0.index);
        Assert.assertEquals(1, e1.index);
        Assert.assertEquals(2, e2.index);
        Assert.assertEquals(3, tracker.size());

        tracker.remove(e1.index);
        Assert.assertEquals(2, tracker.size());

        Entry e3 = new Entry();
        tracker.add(e3);

        Assert.assertEquals(1, e3.index);
        Assert.assertEquals(3, tracker.size());
    }

    @Test
    public void growsBeyondInitialCapacity() {
        EntryTracker tracker = new EntryTracker();

        for (int i = 0; i < 100; i++) {
            Entry e = new Entry();
            tracker.add(e);
            Assert.assertEquals(i, e.index);
        }
        Assert.assertEquals(100, tracker.size());
    }

    @Test
    public void removeTwiceIsIgnored() {
        EntryTracker tracker = new EntryTracker();
        Entry e0 = new Entry();
        tracker.add(e0);

        tracker.remove(0);
        tracker.remove(0);

        Assert.assertTrue(tracker.isEmpty());
    }

    @Test
    public void unsubscribeDisposesLiveEntriesOnce() {
        EntryTracker tracker = new EntryTracker();
        Entry e0 = new Entry();
        Entry e1 = new Entry();
        Entry e2 = new Entry();
        tracker.add(e0);
        tracker.add(e1);
        tracker.add(e2);
        tracker.remove(e1.index);

        tracker.unsubscribe();
        tracker.unsubscribe();

        Assert.assertEquals(1, e0.disposed);
        Assert.assertEquals(0, e1.disposed);
        Assert.assertEquals(1, e2.disposed);
        Assert.assertTrue(tracker.isTerminated());
        Assert.assertTrue(tracker.isEmpty());

        Assert.assertFalse(tracker.add(new Entry()));
    }
}
