package io.github.hide212131.skillpkg.app;

import io.github.hide212131.skillpkg.resolver.DependencyNode;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/** tree サブコマンド。取得元の依存ツリーを表示する。 */
@Command(name = "tree", description = "スキルの依存ツリーを表示します。", mixinStandardHelpOptions = true)
public final class TreeCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Mixin
    private ProjectOption projectOption;

    @Parameters(index = "0", paramLabel = "SOURCE", description = "スキルの取得元")
    private String source;

    @Override
    public Integer call() {
        Path project = projectOption.project();
        Optional<DependencyNode> tree = SkillpkgContext.create(project).installer().resolver()
                .buildDependencyTree(source);
        if (tree.isEmpty()) {
            spec.commandLine().getErr().println("error: Failed to fetch metadata for: " + source);
            return SkillpkgCliApp.EXIT_FAILURE;
        }
        print(spec.commandLine().getOut(), tree.get(), "");
        return SkillpkgCliApp.EXIT_OK;
    }

    private static void print(PrintWriter out, DependencyNode node, String indent) {
        out.println(indent + node.name() + "@" + node.version());
        node.tools().forEach(tool -> out.println(indent + "  ! " + tool));
        node.dependencies().forEach(child -> print(out, child, indent + "  "));
    }
}
