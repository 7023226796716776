package io.github.hide212131.skillpkg.app;

import io.github.hide212131.skillpkg.state.StateLedger;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/** deps サブコマンド。インストール済みスキルの依存先と依存元を表示する。 */
@Command(name = "deps", description = "スキルの依存関係を表示します。", mixinStandardHelpOptions = true)
public final class DepsCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Mixin
    private ProjectOption projectOption;

    @Parameters(index = "0", paramLabel = "NAME", description = "スキル名")
    private String name;

    @Override
    public Integer call() {
        Path project = projectOption.project();
        StateLedger ledger = SkillpkgContext.create(project).ledger();
        PrintWriter out = spec.commandLine().getOut();
        if (!ledger.isSkillInstalled(project, name)) {
            spec.commandLine().getErr().println("error: Skill not installed: " + name);
            return SkillpkgCliApp.EXIT_FAILURE;
        }
        print(out, "Depends on:", ledger.getDependencies(project, name));
        print(out, "Required by:", ledger.getDependents(project, name));
        return SkillpkgCliApp.EXIT_OK;
    }

    private static void print(PrintWriter out, String title, List<String> names) {
        out.println(title);
        if (names.isEmpty()) {
            out.println("  (none)");
        }
        names.forEach(item -> out.println("  " + item));
    }
}
