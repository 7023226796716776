package io.github.hide212131.skillpkg.app;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/** skillpkg CLI のルートコマンド。 */
@Command(name = "skillpkg", description = "スキルの依存関係を解決してインストールし、状態の整合性を保ちます。",
        mixinStandardHelpOptions = true, subcommands = { InitCommand.class, InstallCommand.class,
                UninstallCommand.class, DoctorCommand.class, DepsCommand.class, WhyCommand.class, TreeCommand.class,
                StatusCommand.class })
public final class SkillpkgCliApp {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    public SkillpkgCliApp() {
        // for picocli
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SkillpkgCliApp()).execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLine cmd = new CommandLine(new SkillpkgCliApp());
        cmd.setOut(new PrintWriter(out, true, StandardCharsets.UTF_8));
        cmd.setErr(new PrintWriter(err, true, StandardCharsets.UTF_8));
        return cmd.execute(args);
    }
}
