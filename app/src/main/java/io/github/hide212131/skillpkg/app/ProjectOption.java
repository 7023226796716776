package io.github.hide212131.skillpkg.app;

import java.nio.file.Path;
import picocli.CommandLine.Option;

/** 各サブコマンド共通の --project オプション。 */
public final class ProjectOption {

    @Option(names = "--project", paramLabel = "DIR", defaultValue = ".", description = "プロジェクトディレクトリ（既定: カレント）")
    private Path project;

    Path project() {
        return project.toAbsolutePath().normalize();
    }
}
