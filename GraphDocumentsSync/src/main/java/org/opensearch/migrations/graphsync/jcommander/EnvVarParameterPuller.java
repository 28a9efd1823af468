package org.opensearch.migrations.graphsync.jcommander;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Utility class to inject environment variables into JCommander parameter objects.
 * The variable for {@code --memgraph-host} under prefix {@code OS_LOADER_} is {@code OS_LOADER_MEMGRAPH_HOST}.
 *
 * Only fields that are still unset (null, or a primitive at its zero value) are filled. Run it after parsing
 * the command line so that flags given on the command line win.
 */
@Slf4j
public class EnvVarParameterPuller {

    private static final Pattern CAMEL_CASE_PATTERN = Pattern.compile("([A-Z])");

    /**
     * Interface for retrieving environment variables.
     * Allows for dependency injection and testing.
     */
    @FunctionalInterface
    public interface EnvVarGetter {
        String getEnv(String name);
    }

    private EnvVarParameterPuller() {
        throw new IllegalStateException("EnvVarParameterPuller utility class should not be instantiated");
    }

    public static <T> T injectFromEnv(T params, String prefix) {
        return injectFromEnv(params, System::getenv, prefix);
    }

    /**
     * Injects environment variables into the provided parameters object using a custom getter.
     * Values are trimmed; a blank variable is ignored.
     *
     * @param params       The parameters object to inject environment variables into
     * @param envVarGetter The function to retrieve environment variable values
     * @param prefix       Prepended to every variable name
     */
    public static <T> T injectFromEnv(@NonNull T params, EnvVarGetter envVarGetter, String prefix) {
        List<String> addedEnvParams = new ArrayList<>();
        injectFromEnvRecursive(params, envVarGetter, addedEnvParams, prefix);

        if (!addedEnvParams.isEmpty()) {
            log.info("Adding parameters from the following environment variables: {}", addedEnvParams);
        }
        return params;
    }

    /**
     * Recursively processes parameter objects, including @ParametersDelegate fields.
     */
    private static void injectFromEnvRecursive(Object params,
                                               EnvVarGetter envVarGetter,
                                               List<String> addedEnvParams,
                                               String prefix)
    {
        Class<?> clazz = params.getClass();

        while (clazz != null && clazz != Object.class) {
            for (Field field : clazz.getDeclaredFields()) {
                try {
                    if (field.isAnnotationPresent(ParametersDelegate.class)) {
                        field.setAccessible(true);
                        var delegatedObject = field.get(params);
                        if (delegatedObject != null) {
                            injectFromEnvRecursive(delegatedObject, envVarGetter, addedEnvParams, prefix);
                        }
                    } else if (field.isAnnotationPresent(Parameter.class)) {
                        field.setAccessible(true);
                        if (!isUnset(field, field.get(params))) {
                            continue;
                        }
                        var annotation = field.getAnnotation(Parameter.class);
                        var nameAndValue = findEnvValue(annotation, envVarGetter, prefix);
                        if (nameAndValue != null && setFieldValue(params, field, nameAndValue.getValue())) {
                            addedEnvParams.add(nameAndValue.getKey());
                        }
                    }
                } catch (IllegalAccessException e) {
                    log.warn("Could not access field: {}", field.getName(), e);
                }
            }
            clazz = clazz.getSuperclass();
        }
    }

    private static boolean isUnset(Field field, Object value) {
        if (!field.getType().isPrimitive()) {
            return value == null;
        }
        if (value instanceof Boolean) {
            return !((Boolean) value);
        }
        if (value instanceof Number) {
            return ((Number) value).longValue() == 0;
        }
        return false;
    }

    private static Map.Entry<String, String> findEnvValue(Parameter annotation,
                                                          EnvVarGetter envVarGetter,
                                                          String prefix)
    {
        for (String name : annotation.names()) {
            // Short aliases like -v have no variable of their own
            if (!name.startsWith("--")) {
                continue;
            }
            var envName = toEnvVarName(name, prefix);
            var envValue = envVarGetter.getEnv(envName);
            if (envValue != null && !envValue.isBlank()) {
                return Map.entry(envName, envValue.trim());
            }
        }
        return null;
    }

    /**
     * Converts a flag name to its UPPER_SNAKE_CASE environment variable.
     * Examples:
     *   --opensearch-use-ssl -> OS_LOADER_OPENSEARCH_USE_SSL
     *   --defaultPageSize -> OS_LOADER_DEFAULT_PAGE_SIZE
     */
    public static String toEnvVarName(final String argName, String prefix) {
        String normalized = argName
            .replaceAll("^-+", "")
            .replace("-", "_");

        Matcher matcher = CAMEL_CASE_PATTERN.matcher(normalized);
        return prefix + matcher.replaceAll("_$1").toUpperCase(Locale.ROOT);
    }

    private static boolean setFieldValue(Object params, Field field, String value) throws IllegalAccessException {
        Class<?> type = field.getType();

        try {
            if (type == String.class) {
                field.set(params, value);
            } else if (type == int.class || type == Integer.class) {
                field.set(params, Integer.parseInt(value));
            } else if (type == long.class || type == Long.class) {
                field.set(params, Long.parseLong(value));
            } else if (type == boolean.class || type == Boolean.class) {
                var parsed = parseBoolean(value);
                if (parsed == null) {
                    log.warn("Ignoring environment value '{}' for boolean field '{}'", value, field.getName());
                    return false;
                }
                field.set(params, parsed);
            } else if (List.class.isAssignableFrom(type)) {
                field.set(params, Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toCollection(ArrayList::new)));
            } else {
                log.warn("Unsupported field type for environment variable injection: {} (field: {})",
                    type.getName(), field.getName());
                return false;
            }
            return true;
        } catch (NumberFormatException e) {
            log.error("Failed to parse environment variable value '{}' for field '{}' of type {}",
                value, field.getName(), type.getName(), e);
            return false;
        }
    }

    private static Boolean parseBoolean(String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
                return Boolean.TRUE;
            case "false":
            case "0":
            case "no":
                return Boolean.FALSE;
            default:
                return null;
        }
    }
}
