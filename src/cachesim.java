import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

class cachesim {
	public static void main(String[] args) {
		// cachesim <cache_size> <associativity> <policy> <block_size> <trace_file>
		System.exit(run(args, System.out, System.err));
	}

	// Input: Command-line arguments and the streams to report on
	// Output: Process exit status, 0 on success
	static int run(String[] args, PrintStream out, PrintStream err) {
		CacheConfig config;
		try {
			config = CacheConfig.parse(args);
		}
		catch (IllegalArgumentException e) {
			err.println(e.getMessage());
			return 1;
		}

		// Read the whole trace first so a bad file never yields partial statistics
		List<Command> commands;
		try {
			commands = readTrace(config.traceFile);
		}
		catch (IOException e) {
			err.println("Error: Cannot open trace file " + config.traceFile);
			return 1;
		}

		// Same trace through two independent caches: no prefetch and prefetch
		Cache noPrefetch = new Cache(config, false);
		Cache withPrefetch = new Cache(config, true);
		for (Command command : commands) {
			noPrefetch.access(command);
			withPrefetch.access(command);
		}

		noPrefetch.stats().report(out, false);
		withPrefetch.stats().report(out, true);
		return 0;
	}

	// Input: Path of a trace file
	// Output: Its R/W commands in order, up to an "#eof" line; malformed lines are dropped
	static List<Command> readTrace(String file) throws IOException {
		List<Command> commands = new ArrayList<Command>();
		try (BufferedReader reader = new BufferedReader(new FileReader(file))) {
			String line;
			while ((line = reader.readLine()) != null) {
				if (line.startsWith("#eof")) {
					break;
				}
				Command command = Command.parse(line);
				if (command != null) {
					commands.add(command);
				}
			}
		}
		return commands;
	}
}
