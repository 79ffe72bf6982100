public class Block {
    boolean valid;
    long tag; // Address bits above index and offset
    long age; // Insertions (FIFO) or accesses (LRU) since this line was placed/used

    public Block() {
        this.valid = false;
        this.tag = 0;
        this.age = 0;
    }
}
