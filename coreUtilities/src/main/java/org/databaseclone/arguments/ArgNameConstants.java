package org.databaseclone.arguments;

import java.util.List;
import java.util.regex.Pattern;

public class ArgNameConstants {

    private ArgNameConstants() {
        throw new IllegalStateException("Constant class should not be instantiated");
    }

    public static final Pattern POSSIBLE_CREDENTIALS_ARG_FLAG_NAMES =
        Pattern.compile("--(?:api-key|apiKey|project-id|projectId)");

    public static final String API_KEY_ARG_KEBAB_CASE = "--api-key";
    public static final String API_KEY_ARG_CAMEL_CASE = "--apiKey";
    public static final List<String> CENSORED_CONNECTION_ARGS = List.of(API_KEY_ARG_KEBAB_CASE, API_KEY_ARG_CAMEL_CASE);
}
