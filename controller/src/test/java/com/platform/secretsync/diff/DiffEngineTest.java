package com.platform.secretsync.diff;

import com.platform.secretsync.canonical.CanonicalSecret;
import com.platform.secretsync.canonical.CanonicalSet;
import com.platform.secretsync.canonical.ConfigEntry;
import com.platform.secretsync.provider.ProviderSecretRecord;
import com.platform.secretsync.provider.SecretVersion;
import com.platform.secretsync.provider.SoftDeleteRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DiffEngineTest {

    private static final String TARGET = "team-a/billing";
    private static final Map<String, String> MANAGED_TAGS =
        Map.of("managed-by", "secret-sync", "sync-target", "team-a.billing");
    private static final DiffEngine.Options APPLY = new DiffEngine.Options(true, false);

    private final DiffEngine engine = new DiffEngine();

    @Test
    void missingSecretIsCreated() {
        SecretDiff diff = engine.diff(TARGET, desired(secret("db-password", "pw", true)), actual(), APPLY);

        assertThat(diff.toCreate()).extracting(CanonicalSecret::name).containsExactly("db-password");
        assertThat(diff.drifts()).singleElement().extracting(DriftRecord::driftType).isEqualTo(DriftType.MISSING);
    }

    @Test
    void identicalValueProducesNoChange() {
        SecretDiff diff = engine.diff(TARGET, desired(secret("db-password", "pw", true)),
            actual(record("db-password", version("1", "pw", true, 1))), APPLY);

        assertThat(diff.isEmpty()).isTrue();
        assertThat(diff.drifts()).isEmpty();
    }

    @Test
    void changedValueIsUpdatedWithMaskedDrift() {
        SecretDiff diff = engine.diff(TARGET, desired(secret("api-key", "new-value-123456", true)),
            actual(record("api-key", version("1", "old-value-654321", true, 1))), APPLY);

        assertThat(diff.toUpdate()).extracting(CanonicalSecret::name).containsExactly("api-key");
        assertThat(diff.drifts()).singleElement().satisfies(drift -> {
            assertThat(drift.driftType()).isEqualTo(DriftType.VALUE_CHANGED);
            assertThat(drift.desired()).isEqualTo("new-****3456");
            assertThat(drift.actual()).isEqualTo("old-****4321");
            assertThat(drift.action()).isEqualTo("UPDATE");
        });
    }

    @Test
    void changedValueIsOnlyReportedWithoutTriggerUpdate() {
        SecretDiff diff = engine.diff(TARGET, desired(secret("api-key", "new", true)),
            actual(record("api-key", version("1", "old", true, 1))), new DiffEngine.Options(false, false));

        assertThat(diff.isEmpty()).isTrue();
        assertThat(diff.drifts()).singleElement().extracting(DriftRecord::action).isEqualTo("SKIPPED");
    }

    @Test
    void comparesAgainstLatestEnabledVersion() {
        ProviderSecretRecord record = record("token",
            version("1", "current", true, 1),
            version("2", "rolled-back", false, 2));

        assertThat(engine.diff(TARGET, desired(secret("token", "current", true)), actual(record), APPLY).isEmpty())
            .isTrue();
    }

    @Test
    void secretWithNoEnabledVersionGetsNewVersion() {
        SecretDiff diff = engine.diff(TARGET, desired(secret("token", "v", true)),
            actual(record("token", version("1", null, false, 1))), APPLY);

        assertThat(diff.toUpdate()).hasSize(1);
        assertThat(diff.drifts()).singleElement().extracting(DriftRecord::driftType)
            .isEqualTo(DriftType.DISABLED_IN_PROVIDER);
    }

    @Test
    void softDeletedSecretIsRecreated() {
        ProviderSecretRecord deleted = new ProviderSecretRecord("token", List.of(version("1", null, true, 1)),
            Map.of(), new SoftDeleteRecord(Instant.EPOCH, Instant.EPOCH.plusSeconds(3600)), "prod", "eu", MANAGED_TAGS);

        SecretDiff diff = engine.diff(TARGET, desired(secret("token", "v", true)), actual(deleted), APPLY);

        assertThat(diff.toCreate()).hasSize(1);
    }

    @Test
    void commentedOutEntryDisablesServedSecret() {
        SecretDiff diff = engine.diff(TARGET, desired(secret("old-token", "same", false)),
            actual(record("old-token", version("1", "same", true, 1))), APPLY);

        assertThat(diff.toUpdate()).isEmpty();
        assertThat(diff.toDisable()).containsExactly("old-token");
        assertThat(diff.drifts()).singleElement().extracting(DriftRecord::action).isEqualTo("DISABLE");
    }

    @Test
    void commentedOutEntryWithNewValueIsWrittenThenDisabled() {
        SecretDiff diff = engine.diff(TARGET, desired(secret("old-token", "changed", false)),
            actual(record("old-token", version("1", "same", true, 1))), APPLY);

        assertThat(diff.toUpdate()).extracting(CanonicalSecret::name).containsExactly("old-token");
        assertThat(diff.toDisable()).containsExactly("old-token");
    }

    @Test
    void commentedOutEntryThatIsNotServedIsLeftAlone() {
        SecretDiff diff = engine.diff(TARGET, desired(secret("old-token", "x", false)), actual(), APPLY);

        assertThat(diff.isEmpty()).isTrue();
        assertThat(diff.drifts()).isEmpty();
    }

    @Test
    void pruneDisablesOnlyActiveManagedSecretsMissingFromGit() {
        ProviderSecretRecord kept = record("kept", version("1", "v", true, 1));
        ProviderSecretRecord orphan = record("orphan", version("1", "v", true, 1));
        ProviderSecretRecord alreadyDisabled = record("stale", version("1", null, false, 1));
        ActualState actual = new ActualState(Map.of("kept", kept), List.of(kept, orphan, alreadyDisabled), Map.of());

        SecretDiff pruned = engine.diff(TARGET, desired(secret("kept", "v", true)), actual,
            new DiffEngine.Options(true, true));
        SecretDiff notPruned = engine.diff(TARGET, desired(secret("kept", "v", true)), actual, APPLY);

        assertThat(pruned.toDisable()).containsExactly("orphan");
        assertThat(pruned.drifts()).singleElement().extracting(DriftRecord::driftType).isEqualTo(DriftType.NOT_IN_GIT);
        assertThat(notPruned.isEmpty()).isTrue();
    }

    @Test
    void configsAreWrittenWhenMissingOrChanged() {
        ConfigEntry missing = config("/billing/prod/log.level", "INFO", null);
        ConfigEntry changed = config("billing:timeout", "30", "prod");
        ConfigEntry same = config("billing:retries", "3", "prod");
        CanonicalSet desired = new CanonicalSet(List.of(), List.of(missing, changed, same));
        ActualState actual = new ActualState(Map.of(), List.of(),
            Map.of("billing:timeout|prod", "10", "billing:retries|prod", "3"));

        SecretDiff diff = engine.diff(TARGET, desired, actual, APPLY);
        SecretDiff reportOnly = engine.diff(TARGET, desired, actual, new DiffEngine.Options(false, false));

        assertThat(diff.configsToWrite()).containsExactly(missing, changed);
        assertThat(reportOnly.configsToWrite()).containsExactly(missing);
    }

    @Test
    void discoveryThenSingleCorrectiveUpdateConverges() {
        CanonicalSet desired = desired(secret("api-key", "from-git", true));
        ProviderSecretRecord drifted = record("api-key", version("1", "edited-in-console", true, 1));

        SecretDiff discovered = engine.diff(TARGET, desired, actual(drifted), new DiffEngine.Options(false, false));
        SecretDiff corrective = engine.diff(TARGET, desired, actual(drifted), APPLY);
        ProviderSecretRecord afterApply = drifted.append(version("2", "from-git", true, 2));
        SecretDiff settled = engine.diff(TARGET, desired, actual(afterApply), APPLY);

        assertThat(discovered.isEmpty()).isTrue();
        assertThat(discovered.drifts()).hasSize(1);
        assertThat(corrective.writeCount()).isEqualTo(1);
        assertThat(settled.isEmpty()).isTrue();
    }

    private static CanonicalSet desired(CanonicalSecret... secrets) {
        return new CanonicalSet(List.of(secrets), List.of());
    }

    private static CanonicalSecret secret(String name, String value, boolean enabled) {
        return new CanonicalSecret(name, value, enabled, name, "billing/profiles/prod/application.secrets.env",
            "prod", "eu", MANAGED_TAGS);
    }

    private static ConfigEntry config(String name, String value, String label) {
        return new ConfigEntry(name, value, label, null, "billing/profiles/prod/application.properties", Map.of());
    }

    private static ProviderSecretRecord record(String name, SecretVersion... versions) {
        return new ProviderSecretRecord(name, List.of(versions), Map.of(), null, "prod", "eu", MANAGED_TAGS);
    }

    private static SecretVersion version(String id, String payload, boolean enabled, long epochSecond) {
        return SecretVersion.of(id, payload, enabled, Instant.ofEpochSecond(epochSecond));
    }

    private static ActualState actual(ProviderSecretRecord... records) {
        Map<String, ProviderSecretRecord> byName = new HashMap<>();
        for (ProviderSecretRecord record : records) {
            byName.put(record.name(), record);
        }
        return new ActualState(byName, List.of(records), Map.of());
    }
}
