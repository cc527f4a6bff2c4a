package com.example.usagemeter.store;

public class SlidingWindowSnapshot {

    private final boolean admitted;
    private final long count;
    private final long oldestMillis;

    public SlidingWindowSnapshot(boolean admitted, long count, long oldestMillis) {
        this.admitted = admitted;
        this.count = count;
        this.oldestMillis = oldestMillis;
    }

    public boolean isAdmitted() {
        return admitted;
    }

    /**
     * @return entries in the window after this call, including the new one when admitted
     */
    public long getCount() {
        return count;
    }

    /**
     * @return score of the oldest entry still inside the window
     */
    public long getOldestMillis() {
        return oldestMillis;
    }
}
