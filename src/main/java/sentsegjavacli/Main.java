package sentsegjavacli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "sentsegcli",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "\033[1;34mRule-based multilingual sentence segmentation (SentsegJava) CLI\033[0m",
        subcommands = {
                SegmentCommand.class
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        // Called when no subcommand is provided
        System.out.println("Use --help or a subcommand (segment)");
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
