package io.treeshell.config;

/**
 * Configuration kinds that take part in the system/user layer merge.
 * Each kind has one system file (or directory) and one user customization record.
 */
public enum ConfigKind {
    NODES("families", "customize_nodes.json"),
    SHORTCUTS("shortcuts.json", "customize_shortcuts.json"),
    ZONES("zone_config.json", "customize_zones.json");

    private final String systemFileName;
    private final String customizationFileName;

    ConfigKind(String systemFileName, String customizationFileName) {
        this.systemFileName = systemFileName;
        this.customizationFileName = customizationFileName;
    }

    public String systemFileName() {
        return systemFileName;
    }

    public String customizationFileName() {
        return customizationFileName;
    }
}
