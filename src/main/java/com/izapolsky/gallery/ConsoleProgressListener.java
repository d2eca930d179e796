package com.izapolsky.gallery;

import java.io.PrintStream;

/**
 * Single updating progress line on a console
 */
public class ConsoleProgressListener implements ProgressListener {

    private final PrintStream out;

    public ConsoleProgressListener(PrintStream out) {
        this.out = out;
    }

    @Override
    public void notifyCompleted(String label, int completed, int total, FetchOutcome outcome) {
        int percent = total == 0 ? 100 : (int) (100L * completed / total);
        out.print(String.format("\r%1$s: %2$3d%% | %3$d/%4$d img", label, percent, completed, total));
        if (completed >= total) {
            out.println();
        }
        out.flush();
    }
}
