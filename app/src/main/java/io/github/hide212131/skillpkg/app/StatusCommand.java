package io.github.hide212131.skillpkg.app;

import io.github.hide212131.skillpkg.state.Ledger;
import io.github.hide212131.skillpkg.state.LedgerSnapshot;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** status サブコマンド。state.json に記録されたスキルとツールを一覧表示する。 */
@Command(name = "status", description = "インストール済みスキルを一覧表示します。", mixinStandardHelpOptions = true)
public final class StatusCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Mixin
    private ProjectOption projectOption;

    @Override
    public Integer call() {
        Path project = projectOption.project();
        LedgerSnapshot snapshot = SkillpkgContext.create(project).ledger().loadSnapshot(project);
        PrintWriter out = spec.commandLine().getOut();
        if (snapshot.recovered()) {
            spec.commandLine().getErr().println("warning: state.json was unreadable and has been ignored");
        }
        Ledger ledger = snapshot.ledger();
        if (ledger.skills().isEmpty()) {
            out.println("No skills installed.");
        }
        ledger.skills().forEach((name, entry) -> out.printf("%s@%s (installed by %s)%n", name, entry.version(),
                entry.installedBy().token()));
        ledger.tools().forEach((name, entry) -> out.printf("tool %s (%s)%n", name, entry.packageIdentifier()));
        return SkillpkgCliApp.EXIT_OK;
    }
}
