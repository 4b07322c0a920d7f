package com.platform.secretsync.resolver;

import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.error.ResolutionException;
import com.platform.secretsync.error.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectoryResolverTest {

    private final DirectoryResolver resolver = new DirectoryResolver();

    @TempDir
    Path root;

    @Test
    void singleServiceWithProfilesDirectory() throws IOException {
        write("profiles/prod/application.secrets.env", "A=1");
        write("profiles/prod/application.properties", "b=2");
        write("profiles/prod/README.md", "ignored");
        write("profiles/dev/application.secrets.env", "A=dev");

        List<ParsedEntry> entries = resolver.resolve(root, ".", "payments", "prod");

        assertThat(entries).extracting(ParsedEntry::relativePath)
            .containsExactly("profiles/prod/application.properties", "profiles/prod/application.secrets.env");
        assertThat(entries).extracting(ParsedEntry::serviceName).containsOnly("payments");
        assertThat(entries.get(0).classification()).isEqualTo(EntryClassification.PLAINTEXT_CONFIG);
        assertThat(entries.get(1).classification()).isEqualTo(EntryClassification.ENCRYPTED_SECRET);
        assertThat(entries.get(1).profile()).isEqualTo("prod");
    }

    @Test
    void singleServiceNameComesFromBasePath() throws IOException {
        write("services/billing/deployment-configuration/profiles/prod/application.secrets.yaml", "a: 1");

        List<ParsedEntry> entries = resolver.resolve(root, "./services/billing/", null, "prod");

        assertThat(entries).singleElement().satisfies(entry -> {
            assertThat(entry.serviceName()).isEqualTo("billing");
            assertThat(entry.relativePath())
                .isEqualTo("services/billing/deployment-configuration/profiles/prod/application.secrets.yaml");
        });
    }

    @Test
    void legacyLayoutWithoutProfilesDirectory() throws IOException {
        write("orders/prod/application.secrets.env", "A=1");

        assertThat(resolver.resolve(root, "orders", null, "prod"))
            .extracting(ParsedEntry::relativePath)
            .containsExactly("orders/prod/application.secrets.env");
    }

    @Test
    void monolithDiscoversEveryServiceSorted() throws IOException {
        write("billing/profiles/prod/application.secrets.env", "A=1");
        write("api/deployment-configuration/profiles/prod/application.secrets.env", "B=2");
        write("tools/nested/worker/profiles/prod/application.properties", "c=3");
        write(".git/profiles/prod/application.secrets.env", "hidden");

        List<ParsedEntry> entries = resolver.resolve(root, "", null, "prod");

        assertThat(entries).extracting(ParsedEntry::serviceName).containsExactly("api", "billing", "worker");
    }

    @Test
    void monolithSkipsServicesWithoutTheProfile() throws IOException {
        write("billing/profiles/prod/application.secrets.env", "A=1");
        write("reports/profiles/dev/application.secrets.env", "B=2");

        assertThat(resolver.resolve(root, null, null, "prod"))
            .extracting(ParsedEntry::serviceName)
            .containsExactly("billing");
    }

    @Test
    void monolithLegacyLayout() throws IOException {
        write("billing/prod/application.secrets.env", "A=1");
        write("search/prod/application.properties", "b=2");

        assertThat(resolver.resolve(root, "", null, "prod"))
            .extracting(ParsedEntry::serviceName)
            .containsExactly("billing", "search");
    }

    @Test
    void missingBasePathIsServiceNotFound() {
        assertThatThrownBy(() -> resolver.resolve(root, "nope", null, "prod"))
            .isInstanceOf(ResolutionException.class)
            .extracting(e -> ((ResolutionException) e).getErrorCode())
            .isEqualTo(ErrorCode.SERVICE_NOT_FOUND);
    }

    @Test
    void basePathEscapingTheRootIsRejected() {
        assertThatThrownBy(() -> resolver.resolve(root, "../..", null, "prod"))
            .isInstanceOf(ResolutionException.class);
    }

    @Test
    void missingProfileIsProfileNotFound() throws IOException {
        write("billing/profiles/dev/application.secrets.env", "A=1");

        assertThatThrownBy(() -> resolver.resolve(root, "billing", null, "prod"))
            .isInstanceOf(ResolutionException.class)
            .extracting(e -> ((ResolutionException) e).getErrorCode())
            .isEqualTo(ErrorCode.PROFILE_NOT_FOUND);
    }

    @Test
    void rootLevelServiceNeedsAName() throws IOException {
        write("profiles/prod/application.secrets.env", "A=1");

        assertThatThrownBy(() -> resolver.resolve(root, "", null, "prod"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void classifiesFileNames() {
        assertThat(DirectoryResolver.classify("application.properties")).contains(EntryClassification.PLAINTEXT_CONFIG);
        assertThat(DirectoryResolver.classify("application.secrets.env")).contains(EntryClassification.ENCRYPTED_SECRET);
        assertThat(DirectoryResolver.classify("application.secrets.")).isEmpty();
        assertThat(DirectoryResolver.classify("values.yaml")).isEmpty();
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }
}
