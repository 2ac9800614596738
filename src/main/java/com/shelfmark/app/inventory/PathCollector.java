package com.shelfmark.app.inventory;

import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.HashSet;
import java.util.Set;

/**
 * Records the absolute path of every visited file; feeds the deletion sweep.
 */
final class PathCollector implements FileVisitor {

    private final Set<String> paths = new HashSet<>();

    @Override
    public void visitFile(Path file, BasicFileAttributes attrs) {
        paths.add(file.toAbsolutePath().normalize().toString());
    }

    Set<String> paths() {
        return paths;
    }
}
