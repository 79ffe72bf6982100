import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

public class CacheConfigTest {

	static CacheConfig parse(String... args) {
		return CacheConfig.parse(args);
	}

	static void assertRejected(String message, String... args) {
		try {
			CacheConfig.parse(args);
			fail("accepted " + String.join(" ", args));
		}
		catch (IllegalArgumentException e) {
			assertEquals(message, e.getMessage());
		}
	}

	@Test
	public void testDirect() {
		CacheConfig config = parse("128", "direct", "fifo", "16", "trace.txt");
		assertEquals(128, config.cacheSize);
		assertEquals(1, config.assoc);
		assertEquals(Cache.FIFO, config.policy);
		assertEquals(16, config.blockSize);
		assertEquals("trace.txt", config.traceFile);
	}

	@Test
	public void testFullyAssociative() {
		CacheConfig config = parse("256", "assoc", "lru", "16", "t");
		assertEquals(16, config.assoc);
		assertEquals(Cache.LRU, config.policy);
		assertEquals(1, new Cache(config, false).numSets);
	}

	@Test
	public void testSetAssociative() {
		CacheConfig config = parse("256", "assoc:4", "LRU", "16", "t");
		assertEquals(4, config.assoc);
		assertEquals(4, new Cache(config, true).numSets);
	}

	@Test
	public void testWrongArgumentCount() {
		assertRejected(CacheConfig.USAGE, "128", "direct", "lru", "16");
		assertRejected(CacheConfig.USAGE);
	}

	@Test
	public void testSizesMustBePowersOfTwo() {
		String message = "Error: Cache size and block size must be powers of 2";
		assertRejected(message, "100", "direct", "lru", "16", "t");
		assertRejected(message, "128", "direct", "lru", "12", "t");
		assertRejected(message, "0", "direct", "lru", "16", "t");
		assertRejected(message, "big", "direct", "lru", "16", "t");
		assertRejected(message, "-128", "direct", "lru", "16", "t");
	}

	@Test
	public void testBlockLargerThanCache() {
		assertRejected("Error: Block size must not exceed cache size", "16", "direct", "lru", "32", "t");
	}

	@Test
	public void testBadPolicy() {
		assertRejected("Error: Invalid replacement policy", "128", "direct", "random", "16", "t");
	}

	@Test
	public void testBadAssociativity() {
		assertRejected("Error: Invalid associativity", "128", "twoway", "lru", "16", "t");
		assertRejected("Error: Associativity must be a power of 2", "128", "assoc:3", "lru", "16", "t");
		assertRejected("Error: Associativity must be a power of 2", "128", "assoc:", "lru", "16", "t");
		assertRejected("Error: Associativity exceeds number of cache blocks", "128", "assoc:16", "lru", "16", "t");
	}
}
