package io.settingstree.core.binding;

import java.nio.file.Path;
import java.util.Map;

/** Maps the file names used in {@code include:} directives to binding files. */
@FunctionalInterface
public interface IncludeResolver {

    /**
     * Resolves an include name.
     *
     * @param name the name as written after {@code include:}
     * @return the binding file, or null if no file has that name
     */
    Path resolve(String name);

    /** A resolver that knows no files. */
    static IncludeResolver none() {
        return name -> null;
    }

    /** A resolver backed by a file-name to path table. */
    static IncludeResolver of(Map<String, Path> fileNameToPath) {
        Map<String, Path> copy = Map.copyOf(fileNameToPath);
        return copy::get;
    }
}
