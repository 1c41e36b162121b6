package com.scoutmind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Scoutmind.
 * Routes to subcommands: research, history, serve.
 */
@Command(
        name = "scoutmind",
        mixinStandardHelpOptions = true,
        version = "Scoutmind 0.1.0",
        description = "LLM-driven product research powered by LangGraph4j",
        subcommands = {
                ResearchCommand.class,
                HistoryCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ScoutmindCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
