package io.seriescache.financial;

import picocli.CommandLine;

/** Lets picocli read {@code AAPL:60:s} straight into a {@link SeriesKey}. */
public class SeriesKeyConverter implements CommandLine.ITypeConverter<SeriesKey> {
    @Override
    public SeriesKey convert(String value) {
        try {
            return SeriesKey.parse(value);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.TypeConversionException(e.getMessage());
        }
    }
}
