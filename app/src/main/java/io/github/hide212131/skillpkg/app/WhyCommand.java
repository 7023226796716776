package io.github.hide212131.skillpkg.app;

import io.github.hide212131.skillpkg.state.InstalledBy;
import io.github.hide212131.skillpkg.state.Ledger;
import io.github.hide212131.skillpkg.state.StateLedger;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/** why サブコマンド。スキルがインストールされた経緯をユーザー操作までさかのぼって表示する。 */
@Command(name = "why", description = "スキルがインストールされている理由を表示します。", mixinStandardHelpOptions = true)
public final class WhyCommand implements Callable<Integer> {

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
        List<String> chain = ledger.installChain(project, name);
        if (chain.isEmpty()) {
            spec.commandLine().getErr().println("error: Skill not installed: " + name);
            return SkillpkgCliApp.EXIT_FAILURE;
        }
        Ledger state = ledger.load(project);
        String last = chain.get(chain.size() - 1);
        boolean byUser = state.skill(last).map(entry -> entry.installedBy().isUser()).orElse(false);
        String origin = byUser
                ? "(" + InstalledBy.USER_TOKEN + ")"
                : "(installer " + state.skill(last).flatMap(entry -> entry.installedBy().skillName()).orElse("?")
                        + " is no longer installed)";
        spec.commandLine().getOut().println(String.join(" <- ", chain) + " <- " + origin);
        return SkillpkgCliApp.EXIT_OK;
    }
}
