package com.example.fstree;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Set;

/**
 * Reads {@link FileTreeConfig} from a JSON file. Absent or non-positive values fall back to the
 * defaults of {@link FileTreeConfig#defaults()}.
 */
public class ConfigLoader {
    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public FileTreeConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);
        FileTreeConfig defaults = FileTreeConfig.defaults();

        Path workingDirectory = raw.workingDirectory == null || raw.workingDirectory.isBlank()
                ? defaults.workingDirectory()
                : Path.of(raw.workingDirectory).toAbsolutePath().normalize();
        boolean followLinks = raw.followLinks != null && raw.followLinks;
        int copyBufferSize = raw.copyBufferSize != null && raw.copyBufferSize > 0
                ? raw.copyBufferSize
                : defaults.copyBufferSize();
        int threadCount = raw.threadCount != null && raw.threadCount > 0
                ? raw.threadCount
                : defaults.threadCount();
        boolean detectContentTypes = raw.detectContentTypes != null && raw.detectContentTypes;
        Optional<Set<PosixFilePermission>> directoryMode = Optional.ofNullable(raw.directoryMode)
                .filter(value -> !value.isBlank())
                .map(ConfigLoader::parseMode);

        return new FileTreeConfig(
                workingDirectory,
                followLinks,
                copyBufferSize,
                directoryMode,
                threadCount,
                detectContentTypes
        );
    }

    static Set<PosixFilePermission> parseMode(String value) {
        try {
            return PosixFilePermissions.fromString(value);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("directoryMode must look like rwxr-xr-x, got: " + value, ex);
        }
    }

    private static class RawConfig {
        public String workingDirectory;
        public Boolean followLinks;
        public Integer copyBufferSize;
        public String directoryMode;
        public Integer threadCount;
        public Boolean detectContentTypes;
    }
}
