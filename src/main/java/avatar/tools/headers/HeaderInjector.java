package avatar.tools.headers;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Prepends a copyright header to one file.
 */
public final class HeaderInjector {

    public enum Outcome {
        ADDED,
        WOULD_ADD,
        HAS_HEADER,
        NO_TEMPLATE,
        BINARY
    }

    private static final int DETECT_WINDOW = 1000;

    private final boolean dryRun;
    private final boolean force;

    public HeaderInjector(boolean dryRun, boolean force) {
        this.dryRun = dryRun;
        this.force = force;
    }

    public Outcome process(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        final String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException ex) {
            return Outcome.BINARY;
        }

        if (hasCopyrightHeader(content) && !force) {
            return Outcome.HAS_HEADER;
        }

        final String fileName = file.getFileName().toString();
        final HeaderTemplate template = HeaderTemplate.forFileName(fileName);
        if (template == null) {
            return Outcome.NO_TEMPLATE;
        }

        final String updated = withHeader(content, fileName, template);
        if (dryRun) {
            return Outcome.WOULD_ADD;
        }
        Files.writeString(file, updated, StandardCharsets.UTF_8);
        return Outcome.ADDED;
    }

    static boolean hasCopyrightHeader(String content) {
        final String head = content.length() > DETECT_WINDOW ? content.substring(0, DETECT_WINDOW) : content;
        return head.contains("Copyright") && head.contains(HeaderTemplate.OWNER);
    }

    static String withHeader(String content, String fileName, HeaderTemplate template) {
        if (content.startsWith("#!") && template.hasShebang()) {
            final int nl = content.indexOf('\n');
            if (nl >= 0) {
                // keep the file's own interpreter line on top
                return content.substring(0, nl + 1) + template.renderBody(fileName, null) + content.substring(nl + 1);
            }
        }
        return template.render(fileName, null) + content;
    }
}
