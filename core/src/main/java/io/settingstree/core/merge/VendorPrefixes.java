package io.settingstree.core.merge;

import io.settingstree.core.error.SourceException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads vendor-prefix tables: one {@code <vnd><TAB><vendor name>} per line, {@code #} comments. */
public final class VendorPrefixes {

    private VendorPrefixes() {
        // utility class
    }

    /**
     * Loads the table at {@code path}.
     *
     * @return vendor prefix to vendor name, in file order
     * @throws SourceException if the file cannot be read or a line has no tab
     */
    public static Map<String, String> load(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceException("Failed to read vendor prefixes: " + e.getMessage(), e, path.toString());
        }
        return parse(lines, path.toString());
    }

    static Map<String, String> parse(List<String> lines, String source) {
        Map<String, String> prefixes = new LinkedHashMap<>();
        int number = 0;
        for (String raw : lines) {
            number++;
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int tab = line.indexOf('\t');
            if (tab < 0) {
                throw new SourceException(
                        "Malformed vendor prefix line " + number + " in " + source + ": '" + line + "'", source);
            }
            prefixes.put(line.substring(0, tab), line.substring(tab + 1));
        }
        return Collections.unmodifiableMap(prefixes);
    }
}
