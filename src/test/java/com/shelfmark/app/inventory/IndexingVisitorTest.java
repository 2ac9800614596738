package com.shelfmark.app.inventory;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class IndexingVisitorTest {

    @Test
    void throughputIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.GERMANY);
            assertEquals("1.50", IndexingVisitor.throughput(3, 2), "MB/s must use a dot separator");
            assertEquals("7.00", IndexingVisitor.throughput(7, 0));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
