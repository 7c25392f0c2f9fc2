package org.databaseclone.arguments;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class ArgLogUtils {

    private ArgLogUtils() {
        throw new IllegalStateException("Utility class");
    }

    public static final String CENSORED_VALUE = "******";

    /**
     * Replaces the value following any censored flag with {@link #CENSORED_VALUE}.  Both the
     * separated form ({@code --api-key secret}) and the joined form ({@code --api-key=secret})
     * are redacted.
     */
    public static List<String> getRedactedArgs(String[] args, Collection<String> censoredArgs) {
        List<String> redactedArgs = new ArrayList<>();
        boolean shouldCensorNext = false;

        for (String arg : args) {
            if (shouldCensorNext) {
                redactedArgs.add(CENSORED_VALUE);
                shouldCensorNext = false;
            } else if (censoredArgs.contains(arg)) {
                redactedArgs.add(arg);
                shouldCensorNext = true;
            } else if (isJoinedCensoredArg(arg, censoredArgs)) {
                redactedArgs.add(arg.substring(0, arg.indexOf('=') + 1) + CENSORED_VALUE);
            } else {
                redactedArgs.add(arg);
            }
        }

        return redactedArgs;
    }

    /** Echoes the arguments with their censored values hidden, joined by single spaces */
    public static String redactedCommandLine(String[] args, Collection<String> censoredArgs) {
        return String.join(" ", getRedactedArgs(args, censoredArgs));
    }

    private static boolean isJoinedCensoredArg(String arg, Collection<String> censoredArgs) {
        var separator = arg.indexOf('=');
        return separator > 0 && censoredArgs.contains(arg.substring(0, separator));
    }
}
