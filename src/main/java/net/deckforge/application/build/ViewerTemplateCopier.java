package net.deckforge.application.build;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.deckforge.config.DeckForgeProperties;
import net.deckforge.exception.BuildStructureException;
import net.deckforge.support.fs.AtomicFileWriter;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Copies the viewer's template files from {@code deckforge.template-dir} into a build directory.
 */
@Slf4j
@Component
public class ViewerTemplateCopier {

    /** Template file name mapped to its name inside the build directory. */
    static final Map<String, String> TEMPLATES = templates();

    private final DeckForgeProperties properties;

    public ViewerTemplateCopier(DeckForgeProperties properties) {
        this.properties = properties;
    }

    /**
     * @return warnings for templates that were expected but missing; empty when no template dir is configured
     * @throws BuildStructureException if a present template cannot be copied
     */
    public List<String> copyInto(Path buildDir) {
        List<String> warnings = new ArrayList<>();
        if (!StringUtils.hasText(properties.getTemplateDir())) {
            log.debug("No template directory configured; skipping viewer templates");
            return warnings;
        }
        Path templateDir = Path.of(properties.getTemplateDir());
        for (Map.Entry<String, String> template : TEMPLATES.entrySet()) {
            Path source = templateDir.resolve(template.getKey());
            if (!Files.isRegularFile(source)) {
                warnings.add("Template not found: " + source);
                log.warn("Template not found: {}", source);
                continue;
            }
            Path target = buildDir.resolve(template.getValue());
            try {
                AtomicFileWriter.copy(source, target);
            } catch (IOException e) {
                throw new BuildStructureException("Cannot copy template " + source, target, e);
            }
            log.info("Copied template {} as {}", template.getKey(), template.getValue());
        }
        return warnings;
    }

    private static Map<String, String> templates() {
        Map<String, String> templates = new LinkedHashMap<>();
        templates.put("presentation_unified.html", "index.html");
        templates.put("README.md", "README.md");
        return Collections.unmodifiableMap(templates);
    }
}
