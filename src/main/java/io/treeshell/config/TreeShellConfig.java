package io.treeshell.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class TreeShellConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SYSTEM_DIR = "system";
    public static final String USER_DIR = "user";
    public static final String FAMILIES_DIR = "families";
    public static final String FAMILY_FILE_SUFFIX = "_family.json";
    public static final String NAV_CONFIG_FILE = "nav_config.json";
    public static final String SETTINGS_FILE = "treeshell-settings.json";

    private final Path rootDir;
    private final Path systemDir;
    private final Path userDir;

    public TreeShellConfig(Path rootDir, Path systemDir, Path userDir) {
        this.rootDir = rootDir;
        this.systemDir = systemDir;
        this.userDir = userDir;
    }

    public static TreeShellConfig fromRoot(String root) {
        return fromRoot(root, null, null);
    }

    public static TreeShellConfig fromRoot(String root, String systemDir, String userDir) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        Path system = systemDir == null || systemDir.isBlank()
                ? base.resolve(SYSTEM_DIR)
                : Paths.get(systemDir).toAbsolutePath().normalize();
        Path user = userDir == null || userDir.isBlank()
                ? base.resolve(USER_DIR)
                : Paths.get(userDir).toAbsolutePath().normalize();
        return new TreeShellConfig(base, system, user);
    }

    /**
     * Family names double as the first segment of every semantic path, so only
     * lowercase identifiers are accepted.
     */
    public static boolean isValidFamilyName(String raw) {
        if (raw == null || raw.isBlank() || raw.length() > 64) {
            return false;
        }
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9' && i > 0)
                    || ch == '_' || ch == '-';
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    public static String familyFileName(String familyName) {
        return familyName + FAMILY_FILE_SUFFIX;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path systemDir() {
        return systemDir;
    }

    public Path userDir() {
        return userDir;
    }

    public Path systemFamiliesDir() {
        return systemDir.resolve(FAMILIES_DIR);
    }

    public Path userFamiliesDir() {
        return userDir.resolve(FAMILIES_DIR);
    }

    public Path systemFile(ConfigKind kind) {
        return systemDir.resolve(kind.systemFileName());
    }

    public Path customizationFile(ConfigKind kind) {
        return userDir.resolve(kind.customizationFileName());
    }

    public Path systemNavConfig() {
        return systemDir.resolve(NAV_CONFIG_FILE);
    }

    public Path userNavConfig() {
        return userDir.resolve(NAV_CONFIG_FILE);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path stateDir() {
        return rootDir.resolve("state");
    }

    public Path dbFile() {
        return stateDir().resolve("treeshell.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
