package xyz.firestige.fleet.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import picocli.CommandLine;

/**
 * 把命令行参数交给 picocli 执行，并把子命令的退出码交给 Spring Boot
 */
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final CommandLine.IFactory factory;
    private int exitCode;

    public CliRunner(CommandLine.IFactory factory) {
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        exitCode = newCommandLine(factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public static CommandLine newCommandLine(CommandLine.IFactory factory) {
        return new CommandLine(FleetCommand.class, factory)
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
