package avatar.tools.headers;

import java.util.Locale;
import java.util.Map;

/**
 * Copyright header layouts, chosen by file name or extension.
 */
public enum HeaderTemplate {
    C("", "/*", " *", " */", "Implementation of %s"),
    ASSEMBLY("", "/*", " *", " */", "Assembly implementation of %s"),
    SHELL("#!/bin/bash", "#", "#", "#", "Shell script: %s"),
    PYTHON("#!/usr/bin/env python3", "#", "#", "#", "Python script: %s"),
    MAKEFILE("", "#", "#", "#", "Build configuration: %s");

    static final String OWNER = "Avatar Project";
    static final String YEAR = "2024";

    private static final Map<String, HeaderTemplate> BY_NAME = Map.of(
            "Makefile", MAKEFILE,
            "makefile", MAKEFILE
    );

    private static final Map<String, HeaderTemplate> BY_EXTENSION = Map.ofEntries(
            Map.entry(".c", C),
            Map.entry(".h", C),
            Map.entry(".cpp", C),
            Map.entry(".hpp", C),
            Map.entry(".cc", C),
            Map.entry(".s", ASSEMBLY),
            Map.entry(".asm", ASSEMBLY),
            Map.entry(".sh", SHELL),
            Map.entry(".py", PYTHON)
    );

    private final String shebang;
    private final String open;
    private final String line;
    private final String close;
    private final String defaultBrief;

    HeaderTemplate(String shebang, String open, String line, String close, String defaultBrief) {
        this.shebang = shebang;
        this.open = open;
        this.line = line;
        this.close = close;
        this.defaultBrief = defaultBrief;
    }

    /**
     * Template for the file name, or null when none applies. The extension is
     * compared in lower case, so {@code .S} uses the assembly layout.
     */
    public static HeaderTemplate forFileName(String fileName) {
        final HeaderTemplate byName = BY_NAME.get(fileName);
        if (byName != null) {
            return byName;
        }
        final int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return null;
        }
        return BY_EXTENSION.get(fileName.substring(dot).toLowerCase(Locale.ROOT));
    }

    public boolean hasShebang() {
        return !shebang.isEmpty();
    }

    /** Full header, including this template's shebang line when it has one. */
    public String render(String fileName, String brief) {
        final String b = brief == null || brief.isBlank() ? String.format(defaultBrief, fileName) : brief;
        final StringBuilder sb = new StringBuilder();
        if (hasShebang()) {
            sb.append(shebang).append('\n');
        }
        sb.append(open).append('\n');
        sb.append(line).append(" Copyright (c) ").append(YEAR).append(' ').append(OWNER).append('\n');
        sb.append(line).append('\n');
        sb.append(line).append(" Licensed under the MIT License.\n");
        sb.append(line).append(" See LICENSE file in the project root for full license information.\n");
        sb.append(line).append('\n');
        sb.append(line).append(" @file ").append(fileName).append('\n');
        sb.append(line).append(" @brief ").append(b).append('\n');
        sb.append(line).append(" @author ").append(OWNER).append(" Team\n");
        sb.append(line).append(" @date ").append(YEAR).append('\n');
        sb.append(close).append('\n');
        sb.append('\n');
        return sb.toString();
    }

    /** Header without the shebang line, for files that already start with one. */
    public String renderBody(String fileName, String brief) {
        final String full = render(fileName, brief);
        return hasShebang() ? full.substring(shebang.length() + 1) : full;
    }
}
