import java.io.PrintStream;
import java.util.Objects;

// Immutable end-of-run counters of one Cache
public final class Stats {
    final long reads;
    final long writes;
    final long hits;
    final long misses;

    public Stats(long reads, long writes, long hits, long misses) {
        this.reads = reads;
        this.writes = writes;
        this.hits = hits;
        this.misses = misses;
    }

    // Input: Stream to print to, and whether these counters came from the prefetching cache
    // Output: Prints the five-line report block
    public void report(PrintStream out, boolean prefetch) {
        out.println("Prefetch " + (prefetch ? 1 : 0));
        out.println("Memory reads: " + reads);
        out.println("Memory writes: " + writes);
        out.println("Cache hits: " + hits);
        out.println("Cache misses: " + misses);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Stats)) {
            return false;
        }
        Stats other = (Stats) o;
        return reads == other.reads && writes == other.writes
            && hits == other.hits && misses == other.misses;
    }

    @Override
    public int hashCode() {
        return Objects.hash(reads, writes, hits, misses);
    }

    @Override
    public String toString() {
        return "reads: " + reads + " writes: " + writes + " hits: " + hits + " misses: " + misses;
    }
}
