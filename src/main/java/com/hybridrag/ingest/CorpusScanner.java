package com.hybridrag.ingest;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import com.hybridrag.store.PayloadFields;

/**
 * Enumerates documentation and code files under a project root by glob. Patterns are
 * matched against the {@code /}-separated root-relative path; a leading {@code **}/
 * also matches files at the root.
 */
public class CorpusScanner {
    private final Path projectRoot;
    private final List<PathMatcher> docMatchers;
    private final List<PathMatcher> codeMatchers;
    private final List<PathMatcher> excludeMatchers;

    public CorpusScanner(Path projectRoot, List<String> docPatterns, List<String> codePatterns,
            List<String> excludePatterns) {
        this.projectRoot = projectRoot;
        this.docMatchers = matchers(docPatterns);
        this.codeMatchers = matchers(codePatterns);
        this.excludeMatchers = matchers(excludePatterns);
    }

    public Corpus scan() throws IOException {
        List<String> docs = new ArrayList<>();
        List<String> code = new ArrayList<>();
        try (Stream<Path> files = Files.walk(projectRoot)) {
            for (Path file : files.filter(Files::isRegularFile).sorted().toList()) {
                String relative = relativize(file);
                Path relativePath = Path.of(relative);
                if (matchesAny(excludeMatchers, relativePath)) {
                    continue;
                }
                if (matchesAny(docMatchers, relativePath)) {
                    docs.add(relative);
                } else if (matchesAny(codeMatchers, relativePath)) {
                    code.add(relative);
                }
            }
        }
        return new Corpus(docs, code);
    }

    public String relativize(Path file) {
        return PayloadFields.normalizePath(projectRoot.relativize(file).toString());
    }

    public Path resolve(String relativePath) {
        return projectRoot.resolve(relativePath);
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path path) {
        return matchers.stream().anyMatch(matcher -> matcher.matches(path));
    }

    private static List<PathMatcher> matchers(List<String> patterns) {
        List<PathMatcher> out = new ArrayList<>();
        if (patterns == null) {
            return out;
        }
        for (String pattern : patterns) {
            out.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
            if (pattern.startsWith("**/")) {
                out.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern.substring(3)));
            }
        }
        return out;
    }

    public record Corpus(List<String> docs, List<String> code) {
        public List<String> all() {
            List<String> all = new ArrayList<>(docs);
            all.addAll(code);
            return all;
        }
    }
}
