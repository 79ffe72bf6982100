import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Command {
	// Trace line: "<pc>: <R/W> <address>", both numbers in hex
	private static final Pattern LINE =
		Pattern.compile("^\\s*(?:0[xX])?[0-9a-fA-F]+:\\s*(\\S)\\s*(?:0[xX])?([0-9a-fA-F]+)");

	char cmd;
	long addr;

	public Command(char cmd, long addr) {
		this.cmd = cmd; // 'R' or 'W'
		this.addr = addr; // Unsigned 64-bit address
	}

	public boolean isWrite() {
		return cmd == 'W';
	}

	// Input: One line of a trace file
	// Output: The Command on that line, or null if the line is malformed
	// or names an operation other than 'R' or 'W'
	public static Command parse(String line) {
		Matcher m = LINE.matcher(line);
		if (!m.find()) {
			return null;
		}
		char op = m.group(1).charAt(0);
		if (op != 'R' && op != 'W') {
			return null;
		}
		try {
			return new Command(op, Long.parseUnsignedLong(m.group(2), 16));
		}
		catch (NumberFormatException e) { // More than 64 bits of address
			return null;
		}
	}

	public String toString() {
		return "command: " + cmd + " address: " + Long.toHexString(addr);
	}
}
