package com.shelfmark.app.inventory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Depth-first walk handing every regular file to a {@link FileVisitor}.
 * <p>
 * Symbolic links are never followed; links and special files are skipped.
 * An optional deadline is polled before each directory child. It is
 * cooperative: a visitor call already in progress is never interrupted.
 */
public final class Traversal {

    private static final Logger logger = LoggerFactory.getLogger(Traversal.class);

    private final Clock clock;
    private final Instant deadline;
    private final DirectoryReader reader;

    private Traversal(Clock clock, Instant deadline, DirectoryReader reader) {
        this.clock = clock;
        this.deadline = deadline;
        this.reader = reader;
    }

    public static Traversal unbounded() {
        return new Traversal(Clock.systemUTC(), null, DirectoryReader.DEFAULT);
    }

    /**
     * A traversal that stops once {@code budget} has elapsed from now.
     * Budgets reaching past {@link Instant#MAX} are capped there.
     */
    public static Traversal withDeadline(Clock clock, Duration budget) {
        return new Traversal(clock, deadlineAfter(clock.instant(), budget), DirectoryReader.DEFAULT);
    }

    /**
     * Same limits, with directories opened through {@code reader}.
     */
    Traversal readingWith(DirectoryReader reader) {
        return new Traversal(clock, deadline, reader);
    }

    static Instant deadlineAfter(Instant now, Duration budget) {
        if (budget.compareTo(Duration.between(now, Instant.MAX)) >= 0) {
            return Instant.MAX;
        }
        return now.plus(budget);
    }

    public void walk(Path root, FileVisitor visitor) throws TraversalException {
        visitDirectory(root, visitor);
    }

    private void visitDirectory(Path dir, FileVisitor visitor) throws TraversalException {
        try (DirectoryStream<Path> children = reader.open(dir)) {
            for (Path child : children) {
                checkDeadline();

                BasicFileAttributes attrs;
                try {
                    attrs = Files.readAttributes(child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                } catch (IOException e) {
                    logger.warn("Could not stat {}, skipping: {}", child, e.toString());
                    continue;
                }

                if (attrs.isDirectory()) {
                    // recurse, then carry on with the remaining siblings
                    visitDirectory(child, visitor);
                } else if (attrs.isRegularFile()) {
                    visitor.visitFile(child, attrs);
                } else {
                    logger.debug("Skipping non-regular entry {}", child);
                }
            }
        } catch (IOException e) {
            throw new TraversalException("Could not read entries in " + dir, e);
        } catch (DirectoryIteratorException e) {
            throw new TraversalException("Could not read entries in " + dir, e.getCause());
        }
    }

    private void checkDeadline() throws DeadlineExceededException {
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw new DeadlineExceededException(deadline);
        }
    }
}
