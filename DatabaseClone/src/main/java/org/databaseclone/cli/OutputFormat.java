package org.databaseclone.cli;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;

/** How command results are printed. */
public enum OutputFormat {
    HUMAN_READABLE,
    JSON;

    public static class OutputFormatConverter implements IStringConverter<OutputFormat> {
        @Override
        public OutputFormat convert(String value) {
            try {
                return OutputFormat.valueOf(value.trim().toUpperCase().replace('-', '_'));
            } catch (IllegalArgumentException e) {
                throw new ParameterException("Invalid output format: " + value + ".");
            }
        }
    }
}
