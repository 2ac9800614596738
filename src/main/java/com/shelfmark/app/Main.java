package com.shelfmark.app;

import com.shelfmark.app.cli.Cli;

public final class Main {

    private Main() {}

    public static void main(String[] args) {
        Cli.run(args);
    }
}
