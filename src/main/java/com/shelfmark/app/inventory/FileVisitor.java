package com.shelfmark.app.inventory;

import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Receives every regular file a {@link Traversal} reaches.
 */
@FunctionalInterface
public interface FileVisitor {

    void visitFile(Path file, BasicFileAttributes attrs);
}
