package in.latentsource.infrastructure.feed;

import in.latentsource.domain.series.PriceSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a price history from a text or CSV export.
 *
 * Two layouts are accepted, line by line:
 * - exported records: every comma-separated field of the form {@code price:<value>}
 *   contributes one price, other fields are ignored; once a record has been seen,
 *   records without a price field are skipped
 * - plain CSV: the last field of the line is the price ("1.5" or "2021-01-01,1.5");
 *   a non-numeric first line is treated as a header
 *
 * Blank lines and lines made only of brackets (JSON array delimiters) are skipped.
 */
public final class PriceFeedReader {
    private static final Logger log = LoggerFactory.getLogger(PriceFeedReader.class);

    private static final String PRICE_TOKEN = "price";

    public static PriceSeries read(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            PriceSeries series = read(reader);
            log.info("Read {} prices from {}", series.size(), path);
            return series;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read price feed " + path, e);
        }
    }

    public static PriceSeries read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
            ? (BufferedReader) source
            : new BufferedReader(source);

        List<Double> prices = new ArrayList<>();
        String line;
        int lineNumber = 0;
        boolean recordFormat = false;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (isDelimiterOnly(line)) {
                continue;
            }
            String[] fields = line.split(",");
            boolean tokenLine = false;
            for (String field : fields) {
                String token = unquote(field);
                if (isPriceToken(token)) {
                    prices.add(parse(valueOf(token), lineNumber));
                    tokenLine = true;
                }
            }
            if (tokenLine) {
                recordFormat = true;
                continue;
            }
            if (recordFormat || line.trim().startsWith("{") || line.trim().startsWith("[")) {
                log.debug("Skipping record without price at line {}", lineNumber);
                continue;
            }

            String last = unquote(fields[fields.length - 1]);
            if (lineNumber == 1 && !isNumeric(last)) {
                log.debug("Skipping header line: {}", line);
                continue;
            }
            prices.add(parse(last, lineNumber));
        }

        double[] values = new double[prices.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = prices.get(i);
        }
        return PriceSeries.of(values);
    }

    private static boolean isDelimiterOnly(String line) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (!Character.isWhitespace(c) && c != '[' && c != ']' && c != ',') {
                return false;
            }
        }
        return true;
    }

    private static boolean isPriceToken(String token) {
        return token.startsWith(PRICE_TOKEN)
            && token.substring(PRICE_TOKEN.length()).trim().startsWith(":");
    }

    private static String valueOf(String token) {
        return unquote(token.substring(token.indexOf(':') + 1));
    }

    private static String unquote(String field) {
        String trimmed = field.trim();
        while (trimmed.startsWith("[") || trimmed.startsWith("{")) {
            trimmed = trimmed.substring(1).trim();
        }
        while (trimmed.endsWith("]") || trimmed.endsWith("}")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        return trimmed.replace("\"", "").replace("'", "").trim();
    }

    private static boolean isNumeric(String value) {
        try {
            Double.parseDouble(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static double parse(String value, int lineNumber) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                String.format("Line %d: invalid price '%s'", lineNumber, value), e);
        }
    }

    private PriceFeedReader() {}
}
