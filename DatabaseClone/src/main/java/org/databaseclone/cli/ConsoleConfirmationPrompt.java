package org.databaseclone.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

public class ConsoleConfirmationPrompt implements ConfirmationPrompt {
    private static final Set<String> YES_ANSWERS = Set.of("y", "yes");

    private final BufferedReader reader;
    private final PrintStream out;

    public ConsoleConfirmationPrompt(InputStream in, PrintStream out) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public boolean confirm(String question) {
        out.print(question + " (y/N) ");
        out.flush();
        try {
            var answer = reader.readLine();
            return answer != null && YES_ANSWERS.contains(answer.trim().toLowerCase(Locale.ROOT));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read the answer from the console", e);
        }
    }

    @Override
    public void inform(String message) {
        out.println(message);
    }
}
