package avatar.tools.symbols;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Symbol table reporter over an objdump listing (default {@code build/dis.txt}).
 */
public final class SymbolsMain {

    public static void main(String[] args) {
        final int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path listing = Paths.get("build", "dis.txt");
        String section = null;
        SortKey sortKey = SortKey.ADDRESS;
        boolean listSections = false;

        try {
            for (int i = 0; i < args.length; i++) {
                final String arg = args[i];
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage(out);
                    return 0;
                }
                if ("--list-sections".equals(arg) || "-l".equals(arg)) {
                    listSections = true;
                    continue;
                }
                if (arg.startsWith("--file=")) {
                    listing = Paths.get(arg.substring("--file=".length()));
                    continue;
                }
                if ("-f".equals(arg) || "--file".equals(arg)) {
                    if (i + 1 >= args.length) {
                        err.println("ERROR: " + arg + " requires a file argument");
                        return 2;
                    }
                    listing = Paths.get(args[++i]);
                    continue;
                }
                if (arg.startsWith("--section=")) {
                    section = arg.substring("--section=".length());
                    continue;
                }
                if (arg.startsWith("--sort=")) {
                    sortKey = SortKey.parse(arg.substring("--sort=".length()));
                    continue;
                }
                err.println("ERROR: unknown argument: " + arg);
                printUsage(err);
                return 2;
            }

            final List<String> lines = new SymbolTableReader(err).read(listing);
            if (lines.isEmpty()) {
                err.println("ERROR: no symbol rows in " + listing);
                return 1;
            }

            final SymbolAnalyzer analyzer = new SymbolAnalyzer(lines);
            if (analyzer.skippedLines() > 0) {
                err.println("WARN: skipped malformed rows: " + analyzer.skippedLines());
            }

            final SymbolReport report = new SymbolReport(out);
            if (listSections) {
                report.sectionList(analyzer);
            } else if (section != null) {
                report.sectionSymbols(analyzer, section, sortKey);
            } else {
                report.sectionAnalysis(analyzer);
            }
            return 0;
        } catch (IOException ex) {
            err.println("ERROR: cannot read symbol table: " + safeMsg(ex.getMessage()));
            return 1;
        } catch (IllegalArgumentException ex) {
            err.println("ERROR: " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: avatar-symbols [options]");
        out.println("Options:");
        out.println("  --file=<path>, -f <path>  Disassembly listing (default: build/dis.txt)");
        out.println("  --section=<name>          Show symbols of one section");
        out.println("  --sort=<key>              address (default), name, size, flags or type");
        out.println("  --list-sections, -l       List sections with symbol counts");
        out.println("  --help, -h                Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
