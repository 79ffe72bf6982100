// Validated command line: <cache_size> <associativity> <policy> <block_size> <trace_file>
public final class CacheConfig {
    public static final String USAGE =
        "Usage: cachesim <cache_size> <associativity> <policy> <block_size> <trace_file>";

    final int cacheSize;
    final int assoc;
    final int policy; // Cache.FIFO or Cache.LRU
    final int blockSize;
    final String traceFile;

    CacheConfig(int cacheSize, int assoc, int policy, int blockSize, String traceFile) {
        this.cacheSize = cacheSize;
        this.assoc = assoc;
        this.policy = policy;
        this.blockSize = blockSize;
        this.traceFile = traceFile;
    }

    // Returns true if x is a power of two
    static boolean isPowerOfTwo(long x) {
        return x > 0 && (x & (x - 1)) == 0;
    }

    // Input: The program's arguments
    // Output: A configuration every Cache constructor accepts
    // Throws IllegalArgumentException with the message to show the user
    public static CacheConfig parse(String[] args) {
        if (args.length != 5) {
            throw new IllegalArgumentException(USAGE);
        }

        int cacheSize = parseSize(args[0]);
        String assocStr = args[1];
        String policyStr = args[2];
        int blockSize = parseSize(args[3]);
        String traceFile = args[4];

        if (!isPowerOfTwo(cacheSize) || !isPowerOfTwo(blockSize)) {
            throw new IllegalArgumentException("Error: Cache size and block size must be powers of 2");
        }
        if (blockSize > cacheSize) {
            throw new IllegalArgumentException("Error: Block size must not exceed cache size");
        }

        int policy;
        if (policyStr.equalsIgnoreCase("fifo")) {
            policy = Cache.FIFO;
        }
        else if (policyStr.equalsIgnoreCase("lru")) {
            policy = Cache.LRU;
        }
        else {
            throw new IllegalArgumentException("Error: Invalid replacement policy");
        }

        int numBlocks = cacheSize / blockSize;
        int assoc;
        if (assocStr.equals("direct")) {
            assoc = 1;
        }
        else if (assocStr.equals("assoc")) { // one set, all lines in it
            assoc = numBlocks;
        }
        else if (assocStr.startsWith("assoc:")) {
            assoc = parseSize(assocStr.substring(6));
            if (!isPowerOfTwo(assoc)) {
                throw new IllegalArgumentException("Error: Associativity must be a power of 2");
            }
            if (assoc > numBlocks) {
                throw new IllegalArgumentException("Error: Associativity exceeds number of cache blocks");
            }
        }
        else {
            throw new IllegalArgumentException("Error: Invalid associativity");
        }

        return new CacheConfig(cacheSize, assoc, policy, blockSize, traceFile);
    }

    // Non-numeric or out of range sizes read as 0, which no check accepts
    private static int parseSize(String s) {
        try {
            return Integer.parseInt(s.trim());
        }
        catch (NumberFormatException e) {
            return 0;
        }
    }
}
