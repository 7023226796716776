package io.github.hide212131.skillpkg.app;

import io.github.hide212131.skillpkg.config.JsonManifestStore;
import io.github.hide212131.skillpkg.config.ManifestStore;
import io.github.hide212131.skillpkg.config.SkillpkgConfiguration;
import io.github.hide212131.skillpkg.config.SkillpkgConfigurationLoader;
import io.github.hide212131.skillpkg.doctor.Doctor;
import io.github.hide212131.skillpkg.installer.Installer;
import io.github.hide212131.skillpkg.installer.LocalSkillFetcher;
import io.github.hide212131.skillpkg.state.StateLedger;
import io.github.hide212131.skillpkg.store.LocalSkillStore;
import io.github.hide212131.skillpkg.store.SkillStore;
import java.nio.file.Path;
import java.time.Clock;

/** コマンド実行ごとに組み立てるコンポーネント一式。 */
record SkillpkgContext(StateLedger ledger, SkillStore store, ManifestStore manifests, Installer installer,
        Doctor doctor) {

    static SkillpkgContext create(Path project) {
        SkillpkgConfiguration configuration = new SkillpkgConfigurationLoader().load(project);
        Clock clock = Clock.systemUTC();
        StateLedger ledger = new StateLedger(configuration.storeDir(), clock);
        SkillStore store = new LocalSkillStore(configuration.storeDir(), clock);
        ManifestStore manifests = new JsonManifestStore();
        Installer installer = new Installer(ledger, store, manifests,
                new LocalSkillFetcher(configuration.skillsBase()));
        return new SkillpkgContext(ledger, store, manifests, installer, new Doctor(ledger, store, manifests));
    }
}
