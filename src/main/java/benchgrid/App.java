package benchgrid;

import benchgrid.cli.BenchGridCommand;
import picocli.CommandLine;

public final class App {
    private App() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new BenchGridCommand()).execute(args);
        System.exit(code);
    }
}
