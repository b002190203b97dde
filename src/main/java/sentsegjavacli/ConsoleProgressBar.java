package sentsegjavacli;

import java.io.PrintStream;

/**
 * Single-line progress bar redrawn in place with a carriage return.
 */
class ConsoleProgressBar {
    private final int width;
    private final PrintStream out;
    private int lastPercent = -1;

    ConsoleProgressBar(int width, PrintStream out) {
        this.width = width;
        this.out = out;
    }

    void update(int current, int total) {
        if (total <= 0) {
            return;
        }

        int percent = (int) ((long) current * 100 / total);
        if (percent == lastPercent) {
            return;
        }
        lastPercent = percent;

        out.print(render(percent));

        if (percent == 100) {
            out.println();
        }
    }

    String render(int percent) {
        int filled = percent * width / 100;
        StringBuilder sb = new StringBuilder();
        sb.append('\r');
        sb.append("[");
        for (int i = 0; i < width; i++) {
            sb.append(i < filled ? '=' : ' ');
        }
        sb.append("] ");
        sb.append(String.format("%3d%%", percent));
        return sb.toString();
    }
}
