package io.treeshell.load;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.treeshell.config.TreeShellConfig;
import io.treeshell.model.Family;
import io.treeshell.model.ValidationWarning;
import io.treeshell.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads family files. A complete user family replaces the system family of the same name;
 * a user file that cannot be used falls back to the system file with a warning.
 */
public final class FamilyLoader {
    private static final Logger log = LoggerFactory.getLogger(FamilyLoader.class);

    /**
     * Names of every family with a file in either layer, sorted.
     */
    public Set<String> discover(TreeShellConfig config) {
        Set<String> names = new TreeSet<>();
        collectNames(config.systemFamiliesDir(), names);
        collectNames(config.userFamiliesDir(), names);
        return names;
    }

    public FamilyLoad load(TreeShellConfig config, String familyName) {
        String fileName = TreeShellConfig.familyFileName(familyName);
        return load(familyName, config.systemFamiliesDir().resolve(fileName), config.userFamiliesDir().resolve(fileName));
    }

    public FamilyLoad load(String familyName, Path systemFile, Path userFile) {
        List<ValidationWarning> warnings = new ArrayList<>();
        if (!TreeShellConfig.isValidFamilyName(familyName)) {
            warnings.add(ValidationWarning.system(familyName, "invalid family name"));
            return new FamilyLoad(null, Map.of(), warnings);
        }
        if (userFile != null && Files.isRegularFile(userFile)) {
            FamilyLoad user = loadLayer(familyName, userFile, ValidationWarning.Layer.USER);
            if (user.loaded()) {
                return user;
            }
            warnings.addAll(user.warnings());
            log.warn("User family {} is unusable, falling back to system definition", familyName);
        }
        if (systemFile == null || !Files.isRegularFile(systemFile)) {
            if (warnings.isEmpty()) {
                warnings.add(ValidationWarning.system(familyName, "family file not found"));
            }
            return new FamilyLoad(null, Map.of(), warnings);
        }
        FamilyLoad system = loadLayer(familyName, systemFile, ValidationWarning.Layer.SYSTEM);
        warnings.addAll(system.warnings());
        return new FamilyLoad(system.family(), system.nodes(), warnings);
    }

    private FamilyLoad loadLayer(String familyName, Path file, ValidationWarning.Layer layer) {
        List<ValidationWarning> warnings = new ArrayList<>();
        JsonNode root;
        try {
            root = Jsons.readTreeIfExists(file);
        } catch (IOException e) {
            warn(warnings, layer, familyName, "family file is not valid JSON: " + e.getMessage());
            return new FamilyLoad(null, Map.of(), warnings);
        }
        if (root == null || !root.isObject()) {
            warn(warnings, layer, familyName, "family file must contain a JSON object");
            return new FamilyLoad(null, Map.of(), warnings);
        }
        String declaredRoot = root.path("family_root").asText("");
        if (!familyName.equals(declaredRoot)) {
            warn(warnings, layer, familyName, "family_root '" + declaredRoot + "' does not match family name");
            return new FamilyLoad(null, Map.of(), warnings);
        }
        JsonNode nodesNode = root.get("nodes");
        if (nodesNode == null || !nodesNode.isObject()) {
            warn(warnings, layer, familyName, "family file has no 'nodes' object");
            return new FamilyLoad(null, Map.of(), warnings);
        }

        NodeValidator validator = new NodeValidator(Set.of(familyName));
        Map<String, ObjectNode> accepted = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = nodesNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String id = entry.getKey();
            if (!entry.getValue().isObject()) {
                warn(warnings, layer, id, "node definition must be an object");
                continue;
            }
            ObjectNode raw = (ObjectNode) entry.getValue();
            try {
                validator.validate(id, raw, note -> warn(warnings, layer, id, note));
                accepted.put(id, raw.deepCopy());
            } catch (InvalidEntryException e) {
                warn(warnings, layer, id, e.getMessage());
            }
        }
        if (!accepted.containsKey(familyName)) {
            warn(warnings, layer, familyName, "family root node is missing or invalid");
            return new FamilyLoad(null, Map.of(), warnings);
        }
        Family family = new Family(
                familyName,
                blankToNull(root.path("parent").asText(null)),
                root.path("domain").asText(""),
                root.path("description").asText(""),
                layer,
                List.copyOf(accepted.keySet())
        );
        log.debug("Loaded family {} from {} layer with {} nodes", familyName, layer, accepted.size());
        return new FamilyLoad(family, accepted, warnings);
    }

    private static void collectNames(Path dir, Set<String> out) {
        if (dir == null || !Files.isDirectory(dir)) {
            return;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + TreeShellConfig.FAMILY_FILE_SUFFIX)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                out.add(name.substring(0, name.length() - TreeShellConfig.FAMILY_FILE_SUFFIX.length()));
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list family files: " + dir, e);
        }
    }

    private static void warn(List<ValidationWarning> warnings, ValidationWarning.Layer layer, String id, String reason) {
        ValidationWarning warning = new ValidationWarning(layer, id, reason);
        log.warn("Validation warning: {}", warning);
        warnings.add(warning);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
