package sa.com.cloudsolutions.getterlint.configuration;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import sa.com.cloudsolutions.getterlint.constants.Constants;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Manages the configuration properties from the getterlint.yml file.
 */
public class Settings {
    /**
     * HashMap to store the configurations.
     */
    protected static HashMap<String, Object> props;

    /**
     * Private constructor to prevent class being initialized.
     */
    private Settings() {}

    /**
     * Load the configuration from the default getterlint.yml file on the classpath.
     * @throws IOException if the file could not be read.
     */
    public static void loadConfigMap() throws IOException {
        if (props == null) {
            props = new HashMap<>();
            try (InputStream in = Settings.class.getClassLoader().getResourceAsStream(Constants.DEFAULT_CONFIG)) {
                if (in == null) {
                    throw new FileNotFoundException(Constants.DEFAULT_CONFIG);
                }
                loadYamlConfig(createMapper().readValue(in, new TypeReference<Map<String, Object>>() {}));
            }
        }
    }

    public static void loadConfigMap(File f) throws IOException {
        if (!f.exists()) {
            throw new FileNotFoundException(f.getPath());
        }
        props = new HashMap<>();
        loadYamlConfig(createMapper().readValue(f, new TypeReference<Map<String, Object>>() {}));
    }

    /**
     * Discards any loaded configuration so that the next load starts afresh.
     */
    public static void reset() {
        props = null;
    }

    private static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.registerModule(new SimpleModule()
                .addDeserializer(Map.class, new LinkedHashMapDeserializer()));
        return mapper;
    }

    /**
     * Load configuration from a yaml document.
     *
     * Using yaml gives us nested properties and lists without resorting to comma separated values.
     * @param yamlProps the parsed contents of the configuration file
     */
    @SuppressWarnings("unchecked")
    private static void loadYamlConfig(Map<String, Object> yamlProps) {
        Map<String, Object> variables = (Map<String, Object>) yamlProps.getOrDefault(Constants.VARIABLES, new HashMap<>());
        if (variables == null) {
            variables = new HashMap<>();
        }
        String userDir = System.getProperty("user.home");
        variables.replaceAll((k, value) -> replaceEnvVariables(String.valueOf(value).replace("${USERDIR}", userDir)));
        props.put(Constants.VARIABLES, variables);

        replaceVariables(yamlProps, props);
    }

    /**
     * Replace variables from the yaml file with environment or internal variables
     *
     * @param source the source from which we will copy the data
     * @param target the destination where we will put the data
     */
    @SuppressWarnings("unchecked")
    private static void replaceVariables(Map<String, Object> source, Map<String, Object> target) {
        String userDir = System.getProperty("user.home");

        for (Map.Entry<String, Object> entry : source.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (value != null && !key.equals(Constants.VARIABLES)) {
                if (value instanceof Map) {
                    Map<String, Object> nestedMap = new HashMap<>();
                    replaceVariables((Map<String, Object>) value, nestedMap);
                    target.put(key, nestedMap);
                } else if (value instanceof List<?> list) {
                    List<Object> result = new ArrayList<>();
                    for (Object o : list) {
                        if (o instanceof String s) {
                            s = s.replace("${USERDIR}", userDir);
                            result.add(replaceEnvVariables(replaceYamlVariables(s)));
                        } else {
                            result.add(o);
                        }
                    }
                    target.put(key, result);
                }
                else if (value instanceof String v) {
                    v = v.replace("${USERDIR}", userDir);
                    v = replaceYamlVariables(v);
                    target.put(key, replaceEnvVariables(v));
                }
                else {
                    target.put(key, value);
                }
            }
        }
    }

    /**
     * Replace variables in the given property.
     * @param value the replacement
     * @return the updated value
     */
    @SuppressWarnings("unchecked")
    private static String replaceYamlVariables(String value) {
        Map<String, Object> variablesMap = (Map<String, Object>) props.get(Constants.VARIABLES);
        for (Map.Entry<String, Object> variable : variablesMap.entrySet()) {
            String key = "${" + variable.getKey() + "}";
            value = value.replace(key, String.valueOf(variable.getValue()));
        }
        return value;
    }

    /**
     * The value is checked for an environment variable and replaced if found.
     * The format is ${ENV_VAR_NAME}. Unknown variables are removed.
     *
     * @param value the configuration that needs to be searched for env variables
     * @return the value with the env variables replaced
     */
    private static String replaceEnvVariables(String value) {
        int startIndex;
        while ((startIndex = value.indexOf("${")) != -1) {
            int endIndex = value.indexOf("}", startIndex);
            if (endIndex == -1) {
                break;
            }
            String envVar = value.substring(startIndex + 2, endIndex);
            String envValue = System.getenv(envVar);
            if (envValue != null) {
                value = value.substring(0, startIndex) + envValue + value.substring(endIndex + 1);
            } else {
                value = value.substring(0, startIndex) + value.substring(endIndex + 1);
            }
        }
        return value;
    }

    /**
     * Get the property value for the given key.
     * The cls parameter is used to cast the result to the given class so that the callers
     * need not clutter their call with casts
     *
     * @param key the key to search for
     * @param cls try to map the result to this class
     * @return an optional with the result if it's found
     */
    public static <T> Optional<T> getProperty(String key, Class<T> cls) {
        Object property = getProperty(key);
        if(property != null) {
            return Optional.of(cls.cast(property));
        }

        return Optional.empty();
    }

    public static Object getProperty(String key) {
        if (props == null) {
            return null;
        }
        Object property = props.get(key);
        if(property != null) {
            return property;
        }
        String[] parts = key.split("\\.");
        if(parts.length > 1) {
            Object result = props.get(parts[0]);
            if (result instanceof Map<?,?> map) {
                return map.get(parts[1]);
            }
        }
        return null;
    }

    /**
     * Reads a list valued property.
     * A single scalar is treated as a list with one element.
     */
    public static <T> Collection<T> getPropertyList(String key, Class<T> cls) {
        Object property = getProperty(key);
        List<T> result = new ArrayList<>();
        if (property instanceof Collection<?> c) {
            for (Object o : c) {
                result.add(cls.cast(o));
            }
        }
        else if (property != null) {
            result.add(cls.cast(property));
        }
        return result;
    }

    public static boolean getBoolean(String key) {
        Object property = getProperty(key);
        if (property instanceof Boolean b) {
            return b;
        }
        return property != null && Boolean.parseBoolean(property.toString());
    }

    /**
     * The top level folder of the source code to be analyzed.
     */
    public static String getBasePath() {
        return (String) getProperty(Constants.BASE_PATH);
    }

    public static String[] getJarFiles() {
        Object deps = getProperty(Constants.DEPENDENCIES);
        if (deps instanceof String s) {
            return s.split(",");
        }
        if (deps instanceof Map<?, ?> dependencies) {
            Object jars = dependencies.get(Constants.JAR_FILES);
            if (jars instanceof Collection<?> c) {
                return c.stream().map(String::valueOf).toArray(String[]::new);
            }
        }
        return new String[] {};
    }

    public static class LinkedHashMapDeserializer extends JsonDeserializer<Map<String, Object>> {
        @Override
        @SuppressWarnings("unchecked")
        public Map<String, Object> deserialize(JsonParser p, DeserializationContext ctxt)
                throws IOException {
            return p.readValueAs(LinkedHashMap.class);
        }
    }
}
