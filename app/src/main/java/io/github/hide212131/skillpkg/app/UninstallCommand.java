package io.github.hide212131.skillpkg.app;

import io.github.hide212131.skillpkg.installer.UninstallOptions;
import io.github.hide212131.skillpkg.installer.UninstallResult;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/** uninstall サブコマンド。 */
@Command(name = "uninstall", description = "スキルをアンインストールします。", mixinStandardHelpOptions = true)
public final class UninstallCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Mixin
    private ProjectOption projectOption;

    @Parameters(index = "0", paramLabel = "NAME", description = "スキル名")
    private String name;

    @Option(names = "--force", description = "他のスキルが依存していても削除する")
    private boolean force;

    @Option(names = "--remove-orphans", description = "不要になった依存スキルも削除する")
    private boolean removeOrphans;

    @Option(names = "--dry-run", description = "削除対象のみ表示する")
    private boolean dryRun;

    @Override
    public Integer call() {
        Path project = projectOption.project();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        UninstallResult result = SkillpkgContext.create(project).installer()
                .uninstall(project, name, new UninstallOptions(force, removeOrphans, dryRun));
        result.removed().forEach(removed -> out.println("  - " + removed));
        result.orphansRemoved().forEach(orphan -> out.println("  - " + orphan + " (orphan)"));
        result.errors().forEach(error -> err.println("error: " + error));
        if (!result.dependents().isEmpty()) {
            err.println("hint: use --force to remove it anyway");
        }
        return result.success() ? SkillpkgCliApp.EXIT_OK : SkillpkgCliApp.EXIT_FAILURE;
    }
}
