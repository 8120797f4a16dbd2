package com.ledgerengine.io;

import com.ledgerengine.common.Money;
import com.ledgerengine.common.exception.LedgerIOException;
import com.ledgerengine.ledger.InputRecord;
import com.ledgerengine.transactions.Transaction;
import com.ledgerengine.transactions.TransactionType;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class TransactionCsvReaderTest {

    private final TransactionCsvReader reader = new TransactionCsvReader();

    @Test
    void testReadsTypedRecordsWithWhitespace() throws IOException {
        List<InputRecord> records = read(
            "type, client, tx, amount\n" +
            "deposit,    1,  1,   1.5\n" +
            "  withdrawal , 2 , 5 , 0.25  \n");

        assertEquals(2, records.size());

        Transaction deposit = records.get(0).getTransaction();
        assertEquals(TransactionType.DEPOSIT, deposit.getType());
        assertEquals(1, deposit.getClient());
        assertEquals(1L, deposit.getTx());
        assertEquals(Money.of("1.5"), deposit.getAmount());
        assertEquals(1, records.get(0).getRecordNumber());

        Transaction withdrawal = records.get(1).getTransaction();
        assertEquals(TransactionType.WITHDRAWAL, withdrawal.getType());
        assertEquals(2, withdrawal.getClient());
        assertEquals(Money.of("0.25"), withdrawal.getAmount());
        assertEquals(List.of("withdrawal", "2", "5", "0.25"), records.get(1).getFields());
    }

    @Test
    void testTypeMatchingIsCaseInsensitive() throws IOException {
        List<InputRecord> records = read(
            "Type,Client,TX,Amount\n" +
            "DEPOSIT,1,1,1\n" +
            "Dispute,1,1,\n" +
            "ReSoLvE,1,1\n" +
            "ChargeBack,1,1\n");

        List<TransactionType> types = records.stream()
            .map(record -> record.getTransaction().getType())
            .collect(Collectors.toList());
        assertEquals(List.of(TransactionType.DEPOSIT, TransactionType.DISPUTE,
            TransactionType.RESOLVE, TransactionType.CHARGEBACK), types);
    }

    @Test
    void testRaggedRowsHaveNoAmount() throws IOException {
        List<InputRecord> records = read(
            "type,client,tx,amount\n" +
            "dispute,1,1\n" +
            "resolve,1,1,\n");

        assertFalse(records.get(0).isMalformed());
        assertFalse(records.get(0).getTransaction().hasAmount());
        assertFalse(records.get(1).getTransaction().hasAmount());
        assertEquals(3, records.get(0).getFields().size());
    }

    @Test
    void testUnknownTypeKeepsRawToken() throws IOException {
        List<InputRecord> records = read(
            "type,client,tx,amount\n" +
            "Transfer,3,9,2.0\n");

        Transaction transaction = records.get(0).getTransaction();
        assertEquals(TransactionType.UNKNOWN, transaction.getType());
        assertEquals("Transfer", transaction.getRawType());
    }

    @Test
    void testMalformedRowsBecomeParseErrors() throws IOException {
        List<InputRecord> records = read(
            "type,client,tx,amount\n" +
            "deposit,abc,1,1.0\n" +
            "deposit,70000,2,1.0\n" +
            "deposit,1,-3,1.0\n" +
            "deposit,1,4,ten\n" +
            ",1,5,1.0\n" +
            "deposit,1\n" +
            "deposit,1,7,1.0\n");

        assertEquals(7, records.size());
        assertTrue(records.get(0).getParseError().contains("client"));
        assertTrue(records.get(1).getParseError().contains("between 0 and 65535"));
        assertTrue(records.get(2).getParseError().contains("tx"));
        assertTrue(records.get(3).getParseError().contains("amount"));
        assertEquals("Missing transaction type", records.get(4).getParseError());
        assertEquals("Missing tx", records.get(5).getParseError());
        for (int i = 0; i < 6; i++) {
            assertTrue(records.get(i).isMalformed(), "record " + i);
        }
        assertFalse(records.get(6).isMalformed());
        assertEquals(7, records.get(6).getRecordNumber());
    }

    @Test
    void testLargestIdsAccepted() throws IOException {
        List<InputRecord> records = read(
            "type,client,tx,amount\n" +
            "deposit,65535,4294967295,1\n");

        Transaction transaction = records.get(0).getTransaction();
        assertEquals(65535, transaction.getClient());
        assertEquals(4294967295L, transaction.getTx());
    }

    @Test
    void testBlankLinesIgnored() throws IOException {
        List<InputRecord> records = read(
            "type,client,tx,amount\n" +
            "\n" +
            "deposit,1,1,1\n" +
            "\n");

        assertEquals(1, records.size());
    }

    @Test
    void testHeaderMissingRequiredColumn() {
        LedgerIOException e = assertThrows(LedgerIOException.class,
            () -> read("type,account,amount\ndeposit,1,1\n"));

        assertTrue(e.getMessage().contains("client"));
        assertTrue(e.getMessage().contains("tx"));
    }

    @Test
    void testEmptyInput() throws IOException {
        assertTrue(read("").isEmpty());
    }

    @Test
    void testHugeExponentAmountIsParseError() throws IOException {
        List<InputRecord> records = read(
            "type,client,tx,amount\n" +
            "deposit,1,1,1E1000000000\n" +
            "deposit,1,2,3.0\n");

        assertTrue(records.get(0).isMalformed());
        assertTrue(records.get(0).getParseError().contains("amount"));
        assertEquals(Money.of("3"), records.get(1).getTransaction().getAmount());
    }

    @Test
    void testVanishinglySmallAmountRoundsToZero() throws IOException {
        List<InputRecord> records = read(
            "type,client,tx,amount\n" +
            "deposit,1,1,1E-1000000000\n" +
            "deposit,1,2,0E+1000000000\n");

        assertEquals(Money.zero(), records.get(0).getTransaction().getAmount());
        assertEquals(Money.zero(), records.get(1).getTransaction().getAmount());
    }

    @Test
    void testBadQuotingIsParseErrorAndReadingContinues() throws IOException {
        List<InputRecord> records = read(
            "type,client,tx,amount\n" +
            "deposit,1,1,\"5.0\"x\n" +
            "deposit,1,2,3.0\n");

        assertEquals(2, records.size());
        assertTrue(records.get(0).isMalformed());
        assertEquals(List.of("deposit,1,1,\"5.0\"x"), records.get(0).getFields());
        assertTrue(records.get(0).getParseError().startsWith("Malformed row"));

        assertFalse(records.get(1).isMalformed());
        assertEquals(2L, records.get(1).getTransaction().getTx());
        assertEquals(2, records.get(1).getRecordNumber());
    }

    @Test
    void testQuotedValuesAccepted() throws IOException {
        List<InputRecord> records = read(
            "type,client,tx,amount\n" +
            "\"deposit\",\"1\",\"1\",\"2.5\"\n");

        assertEquals(Money.of("2.5"), records.get(0).getTransaction().getAmount());
    }

    @Test
    void testHeaderRepeatingColumn() {
        LedgerIOException e = assertThrows(LedgerIOException.class,
            () -> read("type,client,tx,amount,Amount\ndeposit,1,1,1,2\n"));

        assertTrue(e.getMessage().contains("repeats column 'amount'"));
    }

    @Test
    void testHeaderWithBlankColumnName() throws IOException {
        List<InputRecord> records = read(
            "type,client,,tx,amount\n" +
            "deposit,1,ignored,7,1.0\n");

        Transaction transaction = records.get(0).getTransaction();
        assertEquals(7L, transaction.getTx());
        assertEquals(Money.of("1"), transaction.getAmount());
    }

    @Test
    void testMalformedHeader() {
        assertThrows(LedgerIOException.class, () -> read("type,\"client\"x,tx,amount\n"));
    }

    private List<InputRecord> read(String csv) throws IOException {
        try (Stream<InputRecord> records = reader.read(new StringReader(csv))) {
            return records.collect(Collectors.toList());
        }
    }
}
