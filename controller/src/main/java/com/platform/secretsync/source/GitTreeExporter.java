package com.platform.secretsync.source;

import com.platform.secretsync.error.SourceException;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.TransportException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Maintains a bare mirror of a Git remote and exports single commits as plain directory trees.
 */
@Slf4j
@Component
public class GitTreeExporter {

    /**
     * Clones or fetches {@code repoUrl} into {@code mirrorDir} and resolves {@code revision} to a commit id.
     */
    public String fetch(String sourceRef, String repoUrl, String revision, Path mirrorDir) {
        try {
            Git git;
            if (Files.exists(mirrorDir.resolve("HEAD"))) {
                git = Git.open(mirrorDir.toFile());
                git.fetch()
                    .setRemote("origin")
                    .setRemoveDeletedRefs(true)
                    .call();
            } else {
                Files.createDirectories(mirrorDir);
                log.info("Cloning {} into {}", repoUrl, mirrorDir);
                git = Git.cloneRepository()
                    .setURI(repoUrl)
                    .setDirectory(mirrorDir.toFile())
                    .setBare(true)
                    .setCloneAllBranches(true)
                    .call();
            }
            try (git) {
                return resolve(git.getRepository(), sourceRef, revision).name();
            }
        } catch (TransportException e) {
            throw SourceException.fetchFailed(sourceRef, "Failed to reach " + repoUrl + ": " + e.getMessage(), e);
        } catch (GitAPIException | IOException e) {
            throw SourceException.fetchFailed(sourceRef, "Git fetch failed: " + e.getMessage(), e);
        }
    }

    /**
     * Writes every file of {@code commitId} below {@code targetDir}.
     */
    public int export(String sourceRef, Path mirrorDir, String commitId, Path targetDir) {
        int files = 0;
        try (Git git = Git.open(mirrorDir.toFile());
             RevWalk revWalk = new RevWalk(git.getRepository());
             TreeWalk treeWalk = new TreeWalk(git.getRepository())) {

            RevCommit commit = revWalk.parseCommit(ObjectId.fromString(commitId));
            treeWalk.addTree(commit.getTree());
            treeWalk.setRecursive(true);

            Path root = targetDir.toAbsolutePath().normalize();
            while (treeWalk.next()) {
                if (!treeWalk.getFileMode(0).equals(FileMode.REGULAR_FILE)
                        && !treeWalk.getFileMode(0).equals(FileMode.EXECUTABLE_FILE)) {
                    continue;
                }
                Path file = root.resolve(treeWalk.getPathString()).normalize();
                if (!file.startsWith(root)) {
                    continue;
                }
                Files.createDirectories(file.getParent());
                try (OutputStream out = Files.newOutputStream(file)) {
                    git.getRepository().open(treeWalk.getObjectId(0)).copyTo(out);
                }
                files++;
            }
        } catch (IOException e) {
            throw SourceException.fetchFailed(sourceRef, "Failed to export commit " + commitId, e);
        }
        return files;
    }

    private ObjectId resolve(Repository repository, String sourceRef, String revision) throws IOException {
        String rev = revision == null || revision.isBlank() ? Constants.HEAD : revision;
        String[] candidates = Constants.HEAD.equals(rev)
            ? new String[]{Constants.HEAD}
            : new String[]{
                Constants.R_REMOTES + "origin/" + rev,
                Constants.R_HEADS + rev,
                Constants.R_TAGS + rev + "^{commit}",
                rev + "^{commit}"
            };
        for (String candidate : candidates) {
            ObjectId id = repository.resolve(candidate);
            if (id != null) {
                return id;
            }
        }
        throw SourceException.notFound(sourceRef, "Revision " + rev + " not found");
    }
}
