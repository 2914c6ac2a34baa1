package arbor.example;

/**
 * A shared resource that counts how often tests used it.
 */
public final class HitCounter {
    private int hits = 0;

    public void hit() {
        this.hits++;
    }

    public int getHits() {
        return this.hits;
    }

    public void reset() {
        this.hits = 0;
    }
}
