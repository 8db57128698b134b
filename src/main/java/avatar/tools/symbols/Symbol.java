package avatar.tools.symbols;

/**
 * One row of an objdump symbol table.
 */
public record Symbol(
        long address,
        String addressText,  // 16 hex digits as printed
        String flags,        // e.g. "l", "g", "F", "O"
        String type,         // "" when the row has no type column
        String section,      // e.g. ".text", "*ABS*", "*UND*"
        long size,
        String sizeText,     // as printed
        String name,
        int lineNumber       // 1-based within the symbol block
) {
}
