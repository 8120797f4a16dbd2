package com.ledgerengine.io;

import com.ledgerengine.common.Money;
import com.ledgerengine.common.exception.LedgerIOException;
import com.ledgerengine.common.exception.RecordParseException;
import com.ledgerengine.ledger.InputRecord;
import com.ledgerengine.transactions.Transaction;
import com.ledgerengine.transactions.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads transaction rows ({@code type, client, tx, amount}) from delimited text.
 *
 * Header names are matched case-insensitively and every value is trimmed.
 * Rows may be ragged: a row that stops before the amount column simply has no amount.
 * Each line is parsed on its own, so a row that cannot be turned into a transaction
 * (bad quoting included) comes out as a malformed record instead of failing the whole read.
 */
@Component
@Slf4j
public class TransactionCsvReader {

    static final String TYPE = "type";
    static final String CLIENT = "client";
    static final String TX = "tx";
    static final String AMOUNT = "amount";

    private static final List<String> REQUIRED_COLUMNS = List.of(TYPE, CLIENT, TX);

    private static final long MAX_CLIENT_ID = 0xFFFFL;
    private static final long MAX_TX_ID = 0xFFFFFFFFL;

    /**
     * Largest number of integer digits an amount may have.
     */
    private static final int MAX_AMOUNT_INTEGER_DIGITS = 28;

    private static final CSVFormat LINE_FORMAT = CSVFormat.DEFAULT.builder()
        .setIgnoreSurroundingSpaces(true)
        .setTrim(true)
        .build();

    /**
     * Lazily parse the rows of {@code reader}. The returned stream must be closed
     * to release the reader.
     *
     * @throws IOException if the header row cannot be read
     * @throws LedgerIOException if the header is malformed, repeats a column,
     *                           or lacks the type, client or tx column
     */
    public Stream<InputRecord> read(Reader reader) throws IOException {
        BufferedReader lines = reader instanceof BufferedReader
            ? (BufferedReader) reader
            : new BufferedReader(reader);

        String headerLine = nextNonBlankLine(lines);
        if (headerLine == null) {
            return Stream.<InputRecord>empty().onClose(() -> close(lines));
        }

        Map<String, Integer> columns;
        try {
            columns = parseHeader(headerLine);
        } catch (LedgerIOException e) {
            close(lines);
            throw e;
        }

        AtomicLong recordNumber = new AtomicLong();
        return lines.lines()
            .filter(line -> !line.isBlank())
            .map(line -> toInputRecord(recordNumber.incrementAndGet(), line, columns))
            .onClose(() -> close(lines));
    }

    InputRecord toInputRecord(long recordNumber, String line, Map<String, Integer> columns) {
        List<String> fields;
        try {
            fields = splitLine(line);
        } catch (IOException | UncheckedIOException e) {
            log.debug("Malformed record {}: {}", recordNumber, e.getMessage());
            return InputRecord.malformed(recordNumber, List.of(line.trim()),
                "Malformed row: " + e.getMessage());
        }

        try {
            return InputRecord.parsed(recordNumber, fields, parseTransaction(fields, columns));
        } catch (RecordParseException e) {
            log.debug("Malformed record {}: {}", recordNumber, e.getMessage());
            return InputRecord.malformed(recordNumber, fields, e.getMessage());
        }
    }

    private Map<String, Integer> parseHeader(String headerLine) {
        List<String> names;
        try {
            names = splitLine(headerLine);
        } catch (IOException | UncheckedIOException e) {
            throw new LedgerIOException("Malformed input header: " + headerLine.trim(), e);
        }

        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i).toLowerCase(Locale.ROOT);
            if (name.isEmpty()) {
                continue;
            }
            if (columns.putIfAbsent(name, i) != null) {
                throw new LedgerIOException("Input header " + names + " repeats column '" + name + "'");
            }
        }

        List<String> missing = REQUIRED_COLUMNS.stream()
            .filter(column -> !columns.containsKey(column))
            .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new LedgerIOException("Input header " + names + " is missing required columns " + missing);
        }
        return columns;
    }

    private List<String> splitLine(String line) throws IOException {
        try (CSVParser parser = LINE_FORMAT.parse(new StringReader(line))) {
            List<CSVRecord> records = parser.getRecords();
            List<String> fields = new ArrayList<>();
            if (!records.isEmpty()) {
                records.get(0).forEach(fields::add);
            }
            return fields;
        }
    }

    private Transaction parseTransaction(List<String> fields, Map<String, Integer> columns) {
        String rawType = field(fields, columns, TYPE);
        if (rawType.isEmpty()) {
            throw new RecordParseException("Missing transaction type");
        }

        String amount = field(fields, columns, AMOUNT);

        return Transaction.builder()
            .type(TransactionType.fromToken(rawType))
            .rawType(rawType)
            .client((int) parseId(field(fields, columns, CLIENT), CLIENT, MAX_CLIENT_ID))
            .tx(parseId(field(fields, columns, TX), TX, MAX_TX_ID))
            .amount(amount.isEmpty() ? null : parseAmount(amount))
            .build();
    }

    private long parseId(String value, String column, long max) {
        if (value.isEmpty()) {
            throw new RecordParseException("Missing " + column);
        }
        long id;
        try {
            id = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new RecordParseException("Invalid " + column + " '" + value + "': not a number", e);
        }
        if (id < 0 || id > max) {
            throw new RecordParseException(
                "Invalid " + column + " '" + value + "': must be between 0 and " + max);
        }
        return id;
    }

    private Money parseAmount(String value) {
        BigDecimal amount;
        try {
            amount = new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new RecordParseException("Invalid amount '" + value + "': not a decimal number", e);
        }

        if (amount.signum() == 0) {
            return Money.zero();
        }

        // precision - scale is the number of digits left of the decimal point
        long integerDigits = (long) amount.precision() - amount.scale();
        if (integerDigits > MAX_AMOUNT_INTEGER_DIGITS) {
            throw new RecordParseException("Invalid amount '" + value + "': too large");
        }
        // below 10^-5 the value rounds to zero at four decimals
        if (integerDigits < -Money.SCALE) {
            return Money.zero();
        }

        try {
            return Money.of(amount);
        } catch (ArithmeticException e) {
            throw new RecordParseException("Invalid amount '" + value + "': " + e.getMessage(), e);
        }
    }

    private String field(List<String> fields, Map<String, Integer> columns, String column) {
        Integer index = columns.get(column);
        if (index == null || index >= fields.size()) {
            return "";
        }
        return fields.get(index).trim();
    }

    private String nextNonBlankLine(BufferedReader lines) throws IOException {
        String line;
        while ((line = lines.readLine()) != null) {
            if (!line.isBlank()) {
                return line;
            }
        }
        return null;
    }

    private void close(Reader reader) {
        try {
            reader.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close transaction input", e);
        }
    }
}
