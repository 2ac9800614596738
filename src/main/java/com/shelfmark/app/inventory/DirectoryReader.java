package com.shelfmark.app.inventory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens a directory for a {@link Traversal}.
 */
@FunctionalInterface
interface DirectoryReader {

    DirectoryReader DEFAULT = Files::newDirectoryStream;

    DirectoryStream<Path> open(Path dir) throws IOException;
}
