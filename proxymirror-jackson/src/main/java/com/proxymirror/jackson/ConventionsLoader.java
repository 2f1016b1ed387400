package com.proxymirror.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proxymirror.intention.MirrorConventions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link MirrorConventions} from JSON. Keys left out of the file keep their defaults.
 */
public class ConventionsLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConventionsLoader.class);

    public static final String DEFAULT_RESOURCE = "proxymirror.json";

    private final ObjectMapper mapper;
    private final String resourceName;

    public ConventionsLoader() {
        this(ProxyMirrorJackson.createObjectMapper(), DEFAULT_RESOURCE);
    }

    public ConventionsLoader(ObjectMapper mapper, String resourceName) {
        this.mapper = mapper;
        this.resourceName = resourceName;
    }

    /**
     * Reads {@code explicitPath} if it exists, otherwise the classpath resource, otherwise
     * returns the defaults. A file that cannot be read also yields the defaults.
     *
     * @param explicitPath may be null
     */
    public MirrorConventions load(Path explicitPath) {
        try {
            if (explicitPath != null) {
                if (Files.exists(explicitPath)) {
                    return orDefaults(mapper.readValue(explicitPath.toFile(), MirrorConventions.class));
                }
                logger.warn("Conventions file {} not found", explicitPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(resourceName)) {
                if (resourceStream != null) {
                    return orDefaults(mapper.readValue(resourceStream, MirrorConventions.class));
                }
            }

            logger.debug("No {} found, using default conventions", resourceName);
            return MirrorConventions.DEFAULTS;
        } catch (IOException e) {
            logger.warn("Failed to load conventions, using defaults: {}", e.getMessage());
            return MirrorConventions.DEFAULTS;
        }
    }

    // A file holding just "null" reads as null
    private static MirrorConventions orDefaults(MirrorConventions conventions) {
        return conventions != null ? conventions : MirrorConventions.DEFAULTS;
    }
}
