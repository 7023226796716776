package io.github.hide212131.skillpkg.app;

import io.github.hide212131.skillpkg.installer.InstallOptions;
import io.github.hide212131.skillpkg.installer.InstallResult;
import io.github.hide212131.skillpkg.installer.SkillInstallAction;
import io.github.hide212131.skillpkg.installer.SkillInstallResult;
import io.github.hide212131.skillpkg.resolver.InstallPlan;
import io.github.hide212131.skillpkg.resolver.InstallPlanner;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * install サブコマンド。取得元を省略した場合は skillpkg.json の全スキルをインストールする。
 */
@Command(name = "install", description = "スキルを依存関係ごとインストールします。", mixinStandardHelpOptions = true)
public final class InstallCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Mixin
    private ProjectOption projectOption;

    @Parameters(index = "0", arity = "0..1", paramLabel = "SOURCE", description = "スキルの取得元（ディレクトリ）")
    private String source;

    @Option(names = "--force", description = "インストール済みでも再インストールする")
    private boolean force;

    @Option(names = "--skip-deps", description = "依存スキルをインストールしない")
    private boolean skipDependencies;

    @Option(names = "--dry-run", description = "計画のみ表示し、何も変更しない")
    private boolean dryRun;

    @Override
    public Integer call() {
        Path project = projectOption.project();
        SkillpkgContext context = SkillpkgContext.create(project);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        InstallOptions options = new InstallOptions(force, skipDependencies, dryRun);

        if (dryRun && source != null && !skipDependencies) {
            InstallPlan plan = context.installer().plan(project, source);
            out.println(new InstallPlanner().format(plan));
            return plan.circularChain().isPresent() ? SkillpkgCliApp.EXIT_FAILURE : SkillpkgCliApp.EXIT_OK;
        }

        InstallResult result = source == null
                ? context.installer().installFromManifest(project, options)
                : context.installer().install(project, source, options);
        for (SkillInstallResult skill : result.skills()) {
            out.println(describe(skill));
        }
        result.toolsRequired().forEach(tool -> out.println("  ! " + tool + " (external tool, install manually)"));
        result.errors().forEach(error -> err.println("error: " + error));
        out.printf("installed=%d updated=%d skipped=%d failed=%d%n", result.stats().installed(),
                result.stats().updated(), result.stats().skipped(), result.stats().failed());
        return result.success() ? SkillpkgCliApp.EXIT_OK : SkillpkgCliApp.EXIT_FAILURE;
    }

    private static String describe(SkillInstallResult skill) {
        String marker = switch (skill.action()) {
            case INSTALLED -> "+";
            case UPDATED -> "~";
            case SKIPPED -> "=";
            case FAILED -> "x";
        };
        StringBuilder line = new StringBuilder("  ").append(marker).append(' ').append(skill.name());
        if (skill.action() != SkillInstallAction.FAILED) {
            line.append('@').append(skill.version());
        }
        skill.requiredBy().ifPresent(parent -> line.append(" (required by ").append(parent).append(')'));
        return line.toString();
    }
}
