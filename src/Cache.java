public class Cache {
    // Replacement policies
    public static final int FIFO = 0;
    public static final int LRU = 1;

    // Parameters passed in from command line arguments
    int cacheSize; // Used to calculate numSets
    int assoc; // Number of columns in blocks array
    int blocksize; // Used to calculate numSets and offsetBits
    int policy; // Controls whether hits refresh a line's age
    boolean prefetch; // Fetch block n+1 on every miss of block n

    // Calculated from parameters
    int numSets;
    int offsetBits;
    int indexBits;

    Block[][] blocks; // Actual block storage

    // Performance tracking
    long numHits;
    long numMisses;
    long numReads; // Blocks read from memory, demand and prefetch
    long numWrites;

    public Cache(int cacheSize, int assoc, int blocksize, int policy, boolean prefetch) {
        if (assoc <= 0 || !CacheConfig.isPowerOfTwo(blocksize) || !CacheConfig.isPowerOfTwo(cacheSize)
                || cacheSize % ((long) assoc * blocksize) != 0
                || !CacheConfig.isPowerOfTwo(cacheSize / ((long) assoc * blocksize))) {
            throw new IllegalArgumentException("Invalid cache geometry: size " + cacheSize
                + ", assoc " + assoc + ", block size " + blocksize);
        }
        if (policy != FIFO && policy != LRU) {
            throw new IllegalArgumentException("Invalid replacement policy: " + policy);
        }
        this.cacheSize = cacheSize;
        this.assoc = assoc;
        this.blocksize = blocksize;
        this.policy = policy;
        this.prefetch = prefetch;

        this.numSets = cacheSize / (assoc * blocksize);
        this.offsetBits = log2(blocksize);
        this.indexBits = log2(this.numSets); // 0 when fully associative

        this.blocks = new Block[numSets][assoc];
        for (int i = 0; i < numSets; i++) {
            for (int j = 0; j < assoc; j++) {
                this.blocks[i][j] = new Block();
            }
        }
    }

    public Cache(CacheConfig config, boolean prefetch) {
        this(config.cacheSize, config.assoc, config.blockSize, config.policy, prefetch);
    }

    // Input: A power of two
    // Output: The number of bits needed to address that many items
    static int log2(long x) {
        int count = 0;
        while (x > 1) {
            x >>>= 1;
            count++;
        }
        return count;
    }

    // Input: An address and the # of bits used for block offset
    // Output: The address with its offset bits dropped
    public static long calcBlockId(long address, int offsetBits) {
        return address >>> offsetBits;
    }

    // Input: An address, the # of bits used for offset, and the # of bits used for index
    // Output: The set the address maps to
    public static int calcIndex(long address, int offsetBits, int indexBits) {
        if (indexBits == 0) {
            return 0;
        }
        long mask = (1L << indexBits) - 1;
        return (int)(calcBlockId(address, offsetBits) & mask);
    }

    // Input: An address, the # of bits used for offset, and the # of bits used for index
    // Output: Everything above the index bits
    public static long calcTag(long address, int offsetBits, int indexBits) {
        return address >>> (offsetBits + indexBits);
    }

    // Input: An address
    // Output: Slot holding a valid copy of the address's block, -1 on a miss
    public int find(long address) {
        Block[] set = this.blocks[calcIndex(address, this.offsetBits, this.indexBits)];
        long tag = calcTag(address, this.offsetBits, this.indexBits);
        for (int i = 0; i < set.length; i++) {
            if (set[i].valid && set[i].tag == tag) {
                return i;
            }
        }
        return -1;
    }

    // Installs the block containing address. Call exactly once per miss.
    // Input: An address that is not in the cache
    // Output: The slot the block was placed in
    int load(long address) {
        Block[] set = this.blocks[calcIndex(address, this.offsetBits, this.indexBits)];

        // First invalid slot wins; otherwise the oldest line, leftmost on ties
        int replaceIndex = -1;
        long maxAge = 0;
        for (int i = 0; i < set.length; i++) {
            if (!set[i].valid) {
                replaceIndex = i;
                break;
            }
            if (replaceIndex == -1 || set[i].age > maxAge) {
                maxAge = set[i].age;
                replaceIndex = i;
            }
        }

        Block cell = set[replaceIndex];
        cell.valid = true;
        cell.tag = calcTag(address, this.offsetBits, this.indexBits);
        age(set, replaceIndex);
        return replaceIndex;
    }

    // LRU: mark the hit line as most recently used. FIFO: nothing, insertion order alone decides.
    void touch(int index, int lineIndex) {
        if (this.policy != LRU) {
            return;
        }
        age(this.blocks[index], lineIndex);
    }

    // Resets the age of set[youngest] and ages every other valid line by one
    private static void age(Block[] set, int youngest) {
        for (int i = 0; i < set.length; i++) {
            if (!set[i].valid) {
                continue;
            }
            if (i == youngest) {
                set[i].age = 0;
            }
            else {
                set[i].age++;
            }
        }
    }

    // Input: A Command with an 'R' or 'W' cmd
    // Output: true on a hit
    public boolean access(Command command) {
        if (command.isWrite()) {
            return write(command.addr);
        }
        return read(command.addr);
    }

    public boolean read(long address) {
        return reference(address, false);
    }

    // Write-allocate, write-through: every write reaches memory exactly once
    public boolean write(long address) {
        return reference(address, true);
    }

    private boolean reference(long address, boolean isWrite) {
        int lineIndex = find(address);
        if (lineIndex != -1) { // hit
            this.numHits++;
            if (isWrite) {
                this.numWrites++;
            }
            touch(calcIndex(address, this.offsetBits, this.indexBits), lineIndex);
            return true;
        }

        // miss: fetch the block from memory, then perform the write
        this.numMisses++;
        this.numReads++;
        load(address);
        if (isWrite) {
            this.numWrites++;
        }
        if (this.prefetch) {
            prefetchNext(address);
        }
        return false;
    }

    // Brings in the block after the one containing address, unless already cached.
    // Counts as a memory read only; hits and misses are untouched.
    void prefetchNext(long address) {
        long nextAddress = (calcBlockId(address, this.offsetBits) + 1) << this.offsetBits;
        if (find(nextAddress) == -1) {
            this.numReads++;
            load(nextAddress);
        }
    }

    public Stats stats() {
        return new Stats(this.numReads, this.numWrites, this.numHits, this.numMisses);
    }
}
