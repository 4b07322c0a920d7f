package com.platform.secretsync.resolver;

import com.platform.secretsync.error.ResolutionException;
import com.platform.secretsync.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Locates service roots and environment profiles inside a snapshot.
 *
 * <p>Supported layouts, relative to the search directory:
 * <ul>
 *   <li>single service: {@code [deployment-configuration/]profiles/{env}/} or legacy {@code {env}/}</li>
 *   <li>monolith: {@code {service}/[deployment-configuration/]profiles/{env}/} at any depth up to
 *       {@value #MAX_DEPTH}, or legacy {@code {service}/{env}/} directly below the search directory</li>
 * </ul>
 */
@Slf4j
@Component
public class DirectoryResolver {

    static final String PROFILES_DIR = "profiles";
    static final String DEPLOYMENT_CONFIG_DIR = "deployment-configuration";
    static final String PROPERTIES_FILE = "application.properties";
    static final String SECRETS_FILE_PREFIX = "application.secrets.";

    private static final int MAX_DEPTH = 5;

    /**
     * Resolves every profile file for {@code environment}.
     *
     * @param contentRoot        snapshot root
     * @param basePath           directory to search from; blank or {@code .} means the root
     * @param defaultServiceName explicit service name (the secrets prefix), may be null
     */
    public List<ParsedEntry> resolve(Path contentRoot, String basePath, String defaultServiceName,
                                     String environment) {
        Path root = contentRoot.toAbsolutePath().normalize();
        String normalizedBase = normalizeBasePath(basePath);
        Path searchDir = normalizedBase.isEmpty() ? root : root.resolve(normalizedBase).normalize();
        if (!searchDir.startsWith(root) || !Files.isDirectory(searchDir)) {
            throw ResolutionException.serviceNotFound(searchDir);
        }

        List<ServiceRoot> services = new ArrayList<>();
        if (isServiceRoot(searchDir, environment)) {
            services.add(new ServiceRoot(singleServiceName(normalizedBase, defaultServiceName), searchDir));
        } else {
            discoverServices(searchDir, environment, services);
        }
        if (services.isEmpty()) {
            throw ResolutionException.serviceNotFound(searchDir);
        }

        List<ParsedEntry> entries = new ArrayList<>();
        int resolvedProfiles = 0;
        for (ServiceRoot service : services) {
            Optional<Path> profileDir = profileDir(service.dir(), environment);
            if (profileDir.isEmpty()) {
                log.warn("Service {} has no profile '{}' under {}", service.name(), environment, service.dir());
                continue;
            }
            resolvedProfiles++;
            entries.addAll(readProfile(root, service.name(), environment, profileDir.get()));
        }
        if (resolvedProfiles == 0) {
            throw ResolutionException.profileNotFound(environment, searchDir);
        }
        log.debug("Resolved {} files for {} services under {}", entries.size(), services.size(), searchDir);
        return entries;
    }

    static String normalizeBasePath(String basePath) {
        if (basePath == null) {
            return "";
        }
        String trimmed = basePath.trim();
        while (trimmed.startsWith("./")) {
            trimmed = trimmed.substring(2);
        }
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return ".".equals(trimmed) ? "" : trimmed;
    }

    private static String singleServiceName(String normalizedBase, String defaultServiceName) {
        if (defaultServiceName != null && !defaultServiceName.isBlank()) {
            return defaultServiceName;
        }
        if (normalizedBase.isEmpty()) {
            throw new ValidationException("secrets.prefix",
                "a service name prefix is required when secrets live at the repository root");
        }
        return normalizedBase.substring(normalizedBase.lastIndexOf('/') + 1);
    }

    private static boolean isServiceRoot(Path dir, String environment) {
        return Files.isDirectory(dir.resolve(PROFILES_DIR))
            || Files.isDirectory(dir.resolve(DEPLOYMENT_CONFIG_DIR))
            || Files.isDirectory(dir.resolve(environment));
    }

    private static boolean isModernServiceRoot(Path dir) {
        return !DEPLOYMENT_CONFIG_DIR.equals(dir.getFileName().toString())
            && !PROFILES_DIR.equals(dir.getFileName().toString())
            && (Files.isDirectory(dir.resolve(PROFILES_DIR)) || Files.isDirectory(dir.resolve(DEPLOYMENT_CONFIG_DIR)));
    }

    private void discoverServices(Path searchDir, String environment, List<ServiceRoot> out) {
        List<Path> found = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(searchDir, MAX_DEPTH)) {
            walk.filter(Files::isDirectory)
                .filter(dir -> !dir.equals(searchDir))
                .filter(dir -> !isHidden(searchDir.relativize(dir)))
                .filter(DirectoryResolver::isModernServiceRoot)
                .sorted()
                .forEach(found::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + searchDir, e);
        }
        // Directories nested inside an already discovered service belong to it.
        List<Path> roots = new ArrayList<>();
        for (Path dir : found) {
            if (roots.stream().noneMatch(dir::startsWith)) {
                roots.add(dir);
            }
        }
        if (roots.isEmpty()) {
            try (Stream<Path> children = Files.list(searchDir)) {
                children.filter(Files::isDirectory)
                    .filter(dir -> !isHidden(dir.getFileName()))
                    .filter(dir -> Files.isDirectory(dir.resolve(environment)))
                    .sorted()
                    .forEach(roots::add);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list " + searchDir, e);
            }
        }
        for (Path dir : roots) {
            out.add(new ServiceRoot(dir.getFileName().toString(), dir));
        }
    }

    private static boolean isHidden(Path relative) {
        for (Path segment : relative) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    static Optional<Path> profileDir(Path serviceDir, String environment) {
        Path configRoot = Files.isDirectory(serviceDir.resolve(DEPLOYMENT_CONFIG_DIR))
            ? serviceDir.resolve(DEPLOYMENT_CONFIG_DIR)
            : serviceDir;
        Path profiles = configRoot.resolve(PROFILES_DIR);
        if (Files.isDirectory(profiles)) {
            Path modern = profiles.resolve(environment);
            return Files.isDirectory(modern) ? Optional.of(modern) : Optional.empty();
        }
        Path legacy = configRoot.resolve(environment);
        return Files.isDirectory(legacy) ? Optional.of(legacy) : Optional.empty();
    }

    private List<ParsedEntry> readProfile(Path root, String serviceName, String environment, Path profileDir) {
        List<ParsedEntry> entries = new ArrayList<>();
        try (Stream<Path> files = Files.list(profileDir)) {
            for (Path file : files.filter(Files::isRegularFile).sorted().toList()) {
                Optional<EntryClassification> classification = classify(file.getFileName().toString());
                if (classification.isEmpty()) {
                    continue;
                }
                String relative = root.relativize(file).toString().replace('\\', '/');
                entries.add(new ParsedEntry(relative, Files.readAllBytes(file), classification.get(),
                    serviceName, environment));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read profile " + profileDir, e);
        }
        if (entries.isEmpty()) {
            log.warn("No application files in {}", profileDir);
        }
        return entries;
    }

    static Optional<EntryClassification> classify(String fileName) {
        if (PROPERTIES_FILE.equals(fileName)) {
            return Optional.of(EntryClassification.PLAINTEXT_CONFIG);
        }
        if (fileName.startsWith(SECRETS_FILE_PREFIX) && fileName.length() > SECRETS_FILE_PREFIX.length()) {
            return Optional.of(EntryClassification.ENCRYPTED_SECRET);
        }
        return Optional.empty();
    }

    private record ServiceRoot(String name, Path dir) {
    }
}
