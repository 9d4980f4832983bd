package com.boxcoxep.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class BoxCoxConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(BoxCoxConfigLoader.class);

    public static final String CONFIG_PROPERTY = "boxcox.config";
    public static final String CONFIG_RESOURCE = "/boxcox_config.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Resolve the configuration: the file named by the {@code boxcox.config} system property,
     * then the {@code /boxcox_config.json} classpath resource, then an empty root (all defaults).
     */
    public static BoxCoxConfig.ConfigRoot load() {
        // 1. System property
        String path = System.getProperty(CONFIG_PROPERTY);
        if (path != null && !path.isEmpty()) {
            return loadFile(new File(path));
        }

        // 2. Classpath
        try (InputStream is = BoxCoxConfigLoader.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is != null) {
                BoxCoxConfig.ConfigRoot root = read(is);
                logger.info("Loaded Box-Cox configuration from classpath {}", CONFIG_RESOURCE);
                return root;
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + CONFIG_RESOURCE + " from classpath", e);
        }

        // 3. Defaults
        logger.info("No Box-Cox configuration found, using defaults");
        return new BoxCoxConfig.ConfigRoot();
    }

    public static BoxCoxConfig.ConfigRoot loadFile(File file) {
        try {
            BoxCoxConfig.ConfigRoot root = MAPPER.readValue(file, BoxCoxConfig.ConfigRoot.class);
            logger.info("Loaded Box-Cox configuration from {}", file.getAbsolutePath());
            return root != null ? root : new BoxCoxConfig.ConfigRoot();
        } catch (IOException e) {
            throw new RuntimeException("Failed to load Box-Cox configuration from " + file, e);
        }
    }

    public static BoxCoxConfig.ConfigRoot read(InputStream jsonStream) {
        try {
            BoxCoxConfig.ConfigRoot root = MAPPER.readValue(jsonStream, BoxCoxConfig.ConfigRoot.class);
            return root != null ? root : new BoxCoxConfig.ConfigRoot();
        } catch (IOException e) {
            throw new RuntimeException("Failed to parse Box-Cox configuration JSON", e);
        }
    }
}
