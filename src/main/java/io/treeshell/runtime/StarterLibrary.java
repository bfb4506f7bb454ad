package io.treeshell.runtime;

import io.treeshell.config.TreeShellConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies the bundled system library into a state root.
 */
public final class StarterLibrary {
    private static final Logger log = LoggerFactory.getLogger(StarterLibrary.class);
    private static final String RESOURCE_ROOT = "/treeshell/system/";
    static final List<String> FILES = List.of(
            "families/system_family.json",
            "families/conversations_family.json",
            "families/agent_management_family.json",
            "nav_config.json",
            "zone_config.json",
            "shortcuts.json"
    );

    private StarterLibrary() {
    }

    /**
     * @param overwrite replace files that already exist; otherwise they are kept
     * @return relative names of the files written
     */
    public static List<String> install(TreeShellConfig config, boolean overwrite) {
        List<String> written = new ArrayList<>();
        try {
            Files.createDirectories(config.systemFamiliesDir());
            Files.createDirectories(config.userDir());
            for (String name : FILES) {
                Path target = config.systemDir().resolve(name);
                if (Files.exists(target) && !overwrite) {
                    continue;
                }
                try (InputStream in = StarterLibrary.class.getResourceAsStream(RESOURCE_ROOT + name)) {
                    if (in == null) {
                        throw new IllegalStateException("Missing bundled library file: " + name);
                    }
                    Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                }
                written.add(name);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to install starter library into " + config.systemDir(), e);
        }
        log.info("Installed {} starter library files into {}", written.size(), config.systemDir());
        return written;
    }
}
