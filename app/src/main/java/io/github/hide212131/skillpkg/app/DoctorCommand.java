package io.github.hide212131.skillpkg.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hide212131.skillpkg.doctor.DiagnosisResult;
import io.github.hide212131.skillpkg.doctor.Doctor;
import io.github.hide212131.skillpkg.doctor.Issue;
import io.github.hide212131.skillpkg.doctor.IssueSeverity;
import io.github.hide212131.skillpkg.doctor.RepairAction;
import io.github.hide212131.skillpkg.doctor.RepairOptions;
import io.github.hide212131.skillpkg.doctor.RepairResult;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * doctor サブコマンド。state.json・registry.json・スキルディレクトリ・skillpkg.json の不整合を診断し、必要なら修復する。
 */
@Command(name = "doctor", description = "インストール状態を診断・修復します。", mixinStandardHelpOptions = true)
public final class DoctorCommand implements Callable<Integer> {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ProjectOption projectOption;

    @Option(names = "--fix", description = "自動修復可能な問題を修復する")
    private boolean fix;

    @Option(names = "--dry-run", description = "--fix で実行される修復内容のみ表示する")
    private boolean dryRun;

    @Option(names = "--keep-orphans", description = "孤立したエントリやディレクトリを削除しない")
    private boolean keepOrphans;

    @Option(names = "--sync", description = "同期の鮮度も確認する")
    private boolean checkSync;

    @Option(names = "--json", description = "JSON で出力する")
    private boolean json;

    @Override
    public Integer call() throws JsonProcessingException {
        Path project = projectOption.project();
        Doctor doctor = SkillpkgContext.create(project).doctor();
        PrintWriter out = spec.commandLine().getOut();

        DiagnosisResult diagnosis = doctor.diagnose(project, checkSync);
        RepairResult repair = null;
        if (fix || dryRun) {
            repair = doctor.repair(project, new RepairOptions(true, dryRun, !keepOrphans, checkSync));
        }

        if (json) {
            out.println(MAPPER.writeValueAsString(toJson(diagnosis, repair)));
        } else {
            printText(out, diagnosis, repair);
        }
        if (repair != null && !dryRun) {
            return repair.success() && doctor.diagnose(project).healthy()
                    ? SkillpkgCliApp.EXIT_OK
                    : SkillpkgCliApp.EXIT_FAILURE;
        }
        return diagnosis.healthy() ? SkillpkgCliApp.EXIT_OK : SkillpkgCliApp.EXIT_FAILURE;
    }

    private static void printText(PrintWriter out, DiagnosisResult diagnosis, RepairResult repair) {
        out.printf("state.json: %d, registry.json: %d, disk: %d, synced: %d%n", diagnosis.stats().ledgerCount(),
                diagnosis.stats().registryCount(), diagnosis.stats().diskCount(), diagnosis.stats().syncedCount());
        if (diagnosis.issues().isEmpty()) {
            out.println("No issues found.");
        }
        for (Issue issue : diagnosis.issues()) {
            out.printf("[%s] %s: %s%n", issue.severity().value(), issue.type().value(), issue.message());
            out.printf("    -> %s%s%n", issue.suggestion(), issue.autoFixable() ? " (auto-fixable)" : "");
        }
        out.printf("%d errors, %d warnings, %d info%n", diagnosis.count(IssueSeverity.ERROR),
                diagnosis.count(IssueSeverity.WARNING), diagnosis.count(IssueSeverity.INFO));
        if (repair == null) {
            return;
        }
        out.println(repair.actions().isEmpty() ? "Nothing to repair." : "Repairs:");
        for (RepairAction action : repair.actions()) {
            out.printf("  %s %s%n", action.type().value(), action.description());
        }
        repair.errors().forEach(error -> out.println("  error: " + error));
        out.printf("fixed=%d remaining=%d%n", repair.issuesFixed(), repair.issuesRemaining());
    }

    private static ObjectNode toJson(DiagnosisResult diagnosis, RepairResult repair) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("healthy", diagnosis.healthy());
        ArrayNode issues = root.putArray("issues");
        for (Issue issue : diagnosis.issues()) {
            ObjectNode node = issues.addObject();
            node.put("type", issue.type().value());
            node.put("severity", issue.severity().value());
            node.put("skillName", issue.skillName());
            node.put("message", issue.message());
            node.put("suggestion", issue.suggestion());
            node.put("autoFixable", issue.autoFixable());
        }
        ObjectNode stats = root.putObject("stats");
        stats.put("ledgerCount", diagnosis.stats().ledgerCount());
        stats.put("registryCount", diagnosis.stats().registryCount());
        stats.put("diskCount", diagnosis.stats().diskCount());
        stats.put("syncedCount", diagnosis.stats().syncedCount());
        if (repair != null) {
            ObjectNode node = root.putObject("repair");
            node.put("success", repair.success());
            ArrayNode actions = node.putArray("actions");
            for (RepairAction action : repair.actions()) {
                ObjectNode item = actions.addObject();
                item.put("type", action.type().value());
                item.put("skillName", action.skillName());
                item.put("description", action.description());
            }
            ArrayNode errors = node.putArray("errors");
            repair.errors().forEach(errors::add);
            node.put("issuesFixed", repair.issuesFixed());
            node.put("issuesRemaining", repair.issuesRemaining());
        }
        return root;
    }
}
