package com.platform.secretsync.source;

import com.platform.secretsync.crd.SourceRef;
import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.error.SourceException;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.revwalk.RevCommit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ArgoCdSourceAdapterTest {

    private static final SyncTargetKey TARGET = new SyncTargetKey("team-a", "billing");
    private static final SourceRef REF = new SourceRef(SourceRef.ARGOCD_APPLICATION, "billing", "argocd");

    @TempDir
    Path tmp;

    private Git upstream;
    private SourceObjectReader reader;
    private ArgoCdSourceAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        upstream = Git.init().setDirectory(tmp.resolve("upstream").toFile()).setInitialBranch("main").call();
        reader = mock(SourceObjectReader.class);
        adapter = new ArgoCdSourceAdapter(reader, new GitTreeExporter(),
            new SnapshotCache(SourceTestSupport.properties(tmp.resolve("cache"))));
    }

    @AfterEach
    void tearDown() {
        upstream.close();
    }

    @Test
    void exportsTrackedBranchAtResolvedCommit() throws Exception {
        RevCommit commit = commit("billing/profiles/prod/application.secrets.env", "DB_PASSWORD=hunter2\n");
        application("main");

        Snapshot snapshot = adapter.pull(TARGET, REF);

        assertThat(snapshot.checksum()).isEqualTo(commit.name());
        assertThat(snapshot.revision()).isEqualTo(commit.name());
        assertThat(Files.readString(snapshot.contentRoot().resolve("billing/profiles/prod/application.secrets.env")))
            .isEqualTo("DB_PASSWORD=hunter2\n");
        assertThat(snapshot.contentRoot().resolve(".git")).doesNotExist();
    }

    @Test
    void newCommitsAreFetchedIntoExistingMirror() throws Exception {
        commit("billing/application.properties", "timeout=30\n");
        application("main");
        Snapshot first = adapter.pull(TARGET, REF);

        RevCommit second = commit("billing/application.properties", "timeout=45\n");
        Snapshot next = adapter.pull(TARGET, REF);

        assertThat(next.checksum()).isEqualTo(second.name());
        assertThat(next.sameContentAs(first)).isFalse();
        assertThat(Files.readString(next.contentRoot().resolve("billing/application.properties")))
            .isEqualTo("timeout=45\n");
    }

    @Test
    void unchangedCommitReusesSnapshot() throws Exception {
        commit("billing/application.properties", "timeout=30\n");
        application(null);

        Snapshot first = adapter.pull(TARGET, REF);
        Snapshot second = adapter.pull(TARGET, REF);

        assertThat(second.contentRoot()).isEqualTo(first.contentRoot());
    }

    @Test
    void unknownRevisionIsNotFound() throws Exception {
        commit("billing/application.properties", "timeout=30\n");
        application("release-9");

        assertThatThrownBy(() -> adapter.pull(TARGET, REF))
            .isInstanceOf(SourceException.class)
            .extracting(e -> ((SourceException) e).getErrorCode())
            .isEqualTo(ErrorCode.SOURCE_NOT_FOUND);
    }

    @Test
    void unreachableRepositoryIsFetchFailure() {
        Map<String, Object> source = Map.of("repoURL", tmp.resolve("nowhere").toUri().toString());
        when(reader.find(ArgoCdSourceAdapter.API_VERSION, "Application", "argocd", "billing"))
            .thenReturn(Optional.of(SourceTestSupport.resource(ArgoCdSourceAdapter.API_VERSION, "Application",
                "argocd", "billing", "spec", Map.of("source", source))));

        assertThatThrownBy(() -> adapter.pull(TARGET, REF))
            .isInstanceOf(SourceException.class)
            .extracting(e -> ((SourceException) e).getErrorCode())
            .isEqualTo(ErrorCode.SOURCE_FETCH_FAILED);
    }

    @Test
    void applicationWithoutRepoUrlIsNotFound() {
        when(reader.find(ArgoCdSourceAdapter.API_VERSION, "Application", "argocd", "billing"))
            .thenReturn(Optional.of(SourceTestSupport.resource(ArgoCdSourceAdapter.API_VERSION, "Application",
                "argocd", "billing", "spec", Map.of("destination", Map.of("namespace", "team-a")))));

        assertThatThrownBy(() -> adapter.pull(TARGET, REF))
            .isInstanceOf(SourceException.class)
            .hasMessageContaining("repoURL");
    }

    private RevCommit commit(String path, String content) throws Exception {
        Path file = tmp.resolve("upstream").resolve(path);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        upstream.add().addFilepattern(".").call();
        return upstream.commit().setMessage("update " + path).setAuthor("ci", "ci@example.com")
            .setCommitter("ci", "ci@example.com").setSign(false).call();
    }

    private void application(String targetRevision) {
        Map<String, Object> source = new HashMap<>();
        source.put("repoURL", tmp.resolve("upstream").toUri().toString());
        source.put("path", "billing");
        if (targetRevision != null) {
            source.put("targetRevision", targetRevision);
        }
        when(reader.find(ArgoCdSourceAdapter.API_VERSION, "Application", "argocd", "billing"))
            .thenReturn(Optional.of(SourceTestSupport.resource(ArgoCdSourceAdapter.API_VERSION, "Application",
                "argocd", "billing", "spec", Map.of("source", source))));
    }
}
