package io.github.hide212131.skillpkg.app;

import io.github.hide212131.skillpkg.config.JsonManifestStore;
import io.github.hide212131.skillpkg.config.ProjectManifest;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/** init サブコマンド。プロジェクト直下に skillpkg.json を作成する。既存のマニフェストは変更しない。 */
@Command(name = "init", description = "skillpkg.json を作成します。", mixinStandardHelpOptions = true)
public final class InitCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Mixin
    private ProjectOption projectOption;

    @Parameters(index = "0", arity = "0..1", paramLabel = "NAME", description = "プロジェクト名（省略時はディレクトリ名）")
    private String name;

    @Override
    public Integer call() {
        Path project = projectOption.project();
        PrintWriter out = spec.commandLine().getOut();
        Path manifestPath = JsonManifestStore.manifestPath(project);
        if (Files.exists(manifestPath)) {
            out.println("skillpkg.json already exists: " + manifestPath);
            return SkillpkgCliApp.EXIT_OK;
        }
        String projectName = name != null ? name : String.valueOf(project.getFileName());
        ProjectManifest manifest = SkillpkgContext.create(project).manifests().initManifest(project, projectName);
        out.println("Created skillpkg.json for " + manifest.name());
        return SkillpkgCliApp.EXIT_OK;
    }
}
