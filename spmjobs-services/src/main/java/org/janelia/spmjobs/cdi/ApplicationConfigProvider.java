package org.janelia.spmjobs.cdi;

import org.apache.commons.lang3.StringUtils;
import org.janelia.spmjobs.config.ApplicationConfig;
import org.janelia.spmjobs.config.ApplicationConfigImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

public class ApplicationConfigProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationConfigProvider.class);

    private static final String DEFAULT_APPLICATION_CONFIG_RESOURCES = "/spmjobs.properties";
    static final String CONFIG_FILE_ENV_VAR = "SPMJOBS_CONFIG";

    private static final Map<String, String> APP_DYNAMIC_ARGS = new HashMap<>();

    public static void setAppDynamicArgs(Map<String, String> appDynamicArgs) {
        APP_DYNAMIC_ARGS.putAll(appDynamicArgs);
    }

    private ApplicationConfig applicationConfig = new ApplicationConfigImpl();

    public ApplicationConfigProvider fromDefaultResources() {
        return fromResource(DEFAULT_APPLICATION_CONFIG_RESOURCES)
                .fromEnvVar(CONFIG_FILE_ENV_VAR)
                .fromProperties(System.getProperties())
                .fromMap(System.getenv().entrySet().stream().collect(Collectors.toMap(entry -> "env." + entry.getKey(), Map.Entry::getValue)));
    }

    public ApplicationConfigProvider fromResource(String resourceName) {
        if (StringUtils.isBlank(resourceName)) {
            return this;
        }
        try (InputStream configStream = this.getClass().getResourceAsStream(resourceName)) {
            if (configStream == null) {
                LOG.warn("Configuration resource {} not found", resourceName);
                return this;
            }
            LOG.debug("Reading application config from resource {}", resourceName);
            return fromInputStream(configStream);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public ApplicationConfigProvider fromEnvVar(String envVarName) {
        if (StringUtils.isBlank(envVarName)) {
            return this;
        }
        String envVarValue = System.getenv(envVarName);
        if (StringUtils.isBlank(envVarValue)) {
            return this;
        }
        LOG.info("Reading application config from environment {} -> {}", envVarName, envVarValue);
        return fromFile(envVarValue);
    }

    public ApplicationConfigProvider fromFile(String fileName) {
        if (StringUtils.isBlank(fileName)) {
            return this;
        }
        File file = new File(fileName);
        if (file.exists() && file.isFile()) {
            try (InputStream fileInputStream = new FileInputStream(file)) {
                LOG.info("Reading application config from file {}", file);
                return fromInputStream(fileInputStream);
            } catch (IOException e) {
                LOG.error("Error reading configuration file {}", fileName, e);
                throw new UncheckedIOException(e);
            }
        } else {
            LOG.warn("Configuration file {} not found", fileName);
        }
        return this;
    }

    public ApplicationConfigProvider fromMap(Map<String, String> map) {
        applicationConfig.putAll(map);
        return this;
    }

    public ApplicationConfigProvider fromProperties(Properties properties) {
        properties.stringPropertyNames().forEach(k -> applicationConfig.put(k, properties.getProperty(k)));
        return this;
    }

    private ApplicationConfigProvider fromInputStream(InputStream stream) {
        try {
            applicationConfig.load(stream);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public ApplicationConfig build() {
        applicationConfig.putAll(APP_DYNAMIC_ARGS);
        return applicationConfig;
    }

}
