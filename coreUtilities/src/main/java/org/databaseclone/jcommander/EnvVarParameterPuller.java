package org.databaseclone.jcommander;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.databaseclone.arguments.ArgNameConstants;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Fills JCommander parameter objects from environment variables before the command line is
 * parsed, so that command line values still win.  Parameter names are converted to
 * UPPER_SNAKE_CASE and prefixed, e.g. {@code --source-database-id} becomes
 * {@code SOURCE_DATABASE_ID} and, with the prefix {@code APPWRITE_}, {@code --endpoint} becomes
 * {@code APPWRITE_ENDPOINT}.
 */
@Slf4j
public class EnvVarParameterPuller {

    public static final String DEFAULT_SUFFIX = "";
    private static final Pattern CAMEL_CASE_PATTERN = Pattern.compile("([A-Z])");

    @FunctionalInterface
    public interface EnvVarGetter {
        String getEnv(String name);
    }

    private EnvVarParameterPuller() {
        throw new IllegalStateException("EnvVarParameterPuller utility class should not be instantiated");
    }

    public static <T> T injectFromEnv(T params, String prefix) {
        return injectFromEnv(params, System::getenv, prefix, DEFAULT_SUFFIX);
    }

    public static <T> T injectFromEnv(T params, EnvVarGetter envVarGetter, String prefix) {
        return injectFromEnv(params, envVarGetter, prefix, DEFAULT_SUFFIX);
    }

    /**
     * @param params       the parameters object to fill
     * @param envVarGetter lookup for environment values
     * @param prefix       prepended to every derived variable name
     * @param suffix       appended to every derived variable name
     * @return the same parameters object
     */
    public static <T> T injectFromEnv(@NonNull T params, EnvVarGetter envVarGetter, String prefix, String suffix) {
        List<String> addedEnvParams = new ArrayList<>();
        injectFromEnvRecursive(params, envVarGetter, addedEnvParams, prefix, suffix);

        if (!addedEnvParams.isEmpty()) {
            log.atInfo().setMessage("Adding parameters from the following environment variables: {}")
                .addArgument(addedEnvParams)
                .log();
        }
        return params;
    }

    private static void injectFromEnvRecursive(Object params,
                                               EnvVarGetter envVarGetter,
                                               List<String> addedEnvParams,
                                               String prefix,
                                               String suffix)
    {
        Class<?> clazz = params.getClass();

        while (clazz != null && clazz != Object.class) {
            for (Field field : clazz.getDeclaredFields()) {
                field.setAccessible(true);

                try {
                    if (field.isAnnotationPresent(ParametersDelegate.class)) {
                        var delegatedObject = field.get(params);
                        if (delegatedObject != null) {
                            injectFromEnvRecursive(delegatedObject, envVarGetter, addedEnvParams, prefix, suffix);
                        }
                    } else if (field.isAnnotationPresent(Parameter.class)) {
                        var annotation = field.getAnnotation(Parameter.class);
                        var nameAndValue = findEnvValue(annotation, envVarGetter, prefix, suffix);
                        if (nameAndValue != null && setFieldValue(params, field, nameAndValue.getValue())) {
                            addedEnvParams.add(nameAndValue.getKey());
                        }
                    }
                } catch (IllegalAccessException e) {
                    log.atWarn().setMessage("Could not access field: {}").addArgument(field.getName()).setCause(e).log();
                }
            }
            clazz = clazz.getSuperclass();
        }
    }

    private static Map.Entry<String, String> findEnvValue(Parameter annotation,
                                                          EnvVarGetter envVarGetter,
                                                          String prefix,
                                                          String suffix)
    {
        for (String name : annotation.names()) {
            for (var envName : toEnvVarNames(name, prefix, suffix)) {
                var envValue = envVarGetter.getEnv(envName);
                if (envValue != null && !envValue.isBlank()) {
                    return Map.entry(envName, envValue);
                }
            }
        }
        return null;
    }

    /**
     * Returns the candidate environment variable names for an argument, most specific first.
     * Credential arguments also match the unprefixed name.
     */
    public static List<String> toEnvVarNames(final String argName, String prefix, String suffix) {
        String normalized = argName
            .replaceAll("^-+", "")
            .replace("-", "_");

        Matcher matcher = CAMEL_CASE_PATTERN.matcher(normalized);
        String envCase = matcher.replaceAll("_$1").toUpperCase();
        return Stream.concat(
            Stream.of(prefix + envCase + suffix),
            (!prefix.isEmpty() || !suffix.isEmpty()) &&
                ArgNameConstants.POSSIBLE_CREDENTIALS_ARG_FLAG_NAMES.matcher(argName).matches() ?
                Stream.of(envCase) : Stream.empty()).collect(Collectors.toList());
    }

    private static boolean setFieldValue(Object params, Field field, String value) throws IllegalAccessException {
        Class<?> type = field.getType();

        try {
            if (type == String.class) {
                field.set(params, value);
            } else if (type == int.class || type == Integer.class) {
                field.set(params, Integer.parseInt(value.trim()));
            } else if (type == long.class || type == Long.class) {
                field.set(params, Long.parseLong(value.trim()));
            } else if (type == boolean.class || type == Boolean.class) {
                field.set(params, Boolean.parseBoolean(value.trim()));
            } else if (type.isEnum()) {
                field.set(params, toEnumConstant(type, value));
            } else {
                log.atWarn().setMessage("Unsupported field type for environment variable injection: {} (field: {})")
                    .addArgument(type.getName())
                    .addArgument(field.getName())
                    .log();
                return false;
            }
            return true;
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException too
            log.atError().setMessage("Failed to parse environment variable value '{}' for field '{}' of type {}")
                .addArgument(value)
                .addArgument(field.getName())
                .addArgument(type.getName())
                .setCause(e)
                .log();
            return false;
        }
    }

    private static Object toEnumConstant(Class<?> enumType, String value) {
        var normalized = value.trim().replace('-', '_');
        for (Object constant : enumType.getEnumConstants()) {
            if (((Enum<?>) constant).name().equalsIgnoreCase(normalized)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("No " + enumType.getSimpleName() + " matches '" + value + "'");
    }
}
