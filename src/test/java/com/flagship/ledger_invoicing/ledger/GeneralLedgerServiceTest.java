package com.flagship.ledger_invoicing.ledger;

import com.flagship.ledger_invoicing.exception.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

import static org.junit.jupiter.api.Assertions.*;

/**
 * General ledger grouping: accounts roll up into major accounts by code prefix.
 */
@SpringBootTest
@Testcontainers
class GeneralLedgerServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    private static final int DIGITS = 6;

    @Autowired
    private GeneralLedgerService generalLedgerService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private TransactionService transactionService;

    @Autowired
    private LedgerService ledgerService;

    private String majorCode;
    private UUID cashId;
    private UUID bankId;
    private UUID idleId;
    private UUID salesId;

    @BeforeEach
    void setUp() {
        // Fresh numeric prefixes keep each test's major accounts apart
        majorCode = String.valueOf(ThreadLocalRandom.current().nextInt(100_000, 500_000));
        String salesMajor = String.valueOf(ThreadLocalRandom.current().nextInt(500_000, 1_000_000));

        accountService.createAccount(majorCode, "Current assets", Account.AccountType.ASSET);
        cashId = accountService.createAccount(majorCode + "01", "Cash", Account.AccountType.ASSET).getId();
        bankId = accountService.createAccount(majorCode + "02", "Bank", Account.AccountType.ASSET).getId();
        idleId = accountService.createAccount(majorCode + "03", "Petty cash", Account.AccountType.ASSET).getId();
        salesId = accountService.createAccount(salesMajor + "01", "Sales", Account.AccountType.INCOME).getId();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void post(Instant occurredAt, UUID debitAccount, UUID creditAccount, String amount) {
        UUID transactionId = transactionService.createTransaction(new TransactionRequest(
            "Movement", occurredAt, Transaction.Direction.INCOME, CurrencyCode.USD, "tester", null)).getId();
        ledgerService.recordEntry(LedgerEntryRequest.debit(transactionId, debitAccount, new BigDecimal(amount)));
        ledgerService.recordEntry(LedgerEntryRequest.credit(transactionId, creditAccount, new BigDecimal(amount)));
    }

    private GeneralLedger.MajorAccount findMajor(GeneralLedger ledger, String code) {
        return ledger.getMajorAccounts().stream()
            .filter(m -> m.getCode().equals(code))
            .findFirst()
            .orElseThrow(() -> new AssertionError("Major account " + code + " missing"));
    }

    @Test
    @DisplayName("Sub-accounts roll up into their major account")
    void testGrouping() {
        printTestHeader("General Ledger Grouping");
        post(Instant.parse("2035-05-10T10:00:00Z"), cashId, salesId, "100.00");
        post(Instant.parse("2035-05-11T10:00:00Z"), bankId, salesId, "50.00");
        post(Instant.parse("2035-05-12T10:00:00Z"), salesId, cashId, "30.00");

        GeneralLedger ledger = generalLedgerService.generate(DIGITS, null, null, true);
        GeneralLedger.MajorAccount major = findMajor(ledger, majorCode);
        printOutput("Major account", major);

        assertEquals("Current assets", major.getName());
        assertEquals(0, major.getTotalDebit().compareTo(new BigDecimal("150.00")));
        assertEquals(0, major.getTotalCredit().compareTo(new BigDecimal("30.00")));
        assertEquals(0, major.getBalance().compareTo(new BigDecimal("120.00")));
        // The exact-code account plus three sub-accounts, including the idle one
        assertEquals(4, major.getSubAccounts().size());
        assertEquals(0, ledger.getTotalDebit().compareTo(ledger.getTotalCredit()));
        assertEquals(0, ledger.getDifference().compareTo(BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Accounts without movements appear with zero totals")
    void testIdleAccountsIncluded() {
        GeneralLedger ledger = generalLedgerService.generate(DIGITS, null, null, true);
        GeneralLedger.SubAccount idle = findMajor(ledger, majorCode).getSubAccounts().stream()
            .filter(s -> s.getCode().equals(majorCode + "03"))
            .findFirst()
            .orElseThrow();

        assertEquals(0, idle.getTotalDebit().compareTo(BigDecimal.ZERO));
        assertEquals(0, idle.getTotalCredit().compareTo(BigDecimal.ZERO));
        assertNotNull(idleId);
    }

    @Test
    @DisplayName("Date bounds are inclusive and exclude movements outside them")
    void testDateRange() {
        post(Instant.parse("2036-01-31T23:00:00Z"), cashId, salesId, "10.00");
        post(Instant.parse("2036-02-01T00:00:00Z"), cashId, salesId, "20.00");
        post(Instant.parse("2036-02-29T23:59:00Z"), cashId, salesId, "40.00");
        post(Instant.parse("2036-03-01T00:00:00Z"), cashId, salesId, "80.00");

        GeneralLedger february = generalLedgerService.generate(
            DIGITS, LocalDate.of(2036, 2, 1), LocalDate.of(2036, 2, 29), false);
        GeneralLedger.MajorAccount major = findMajor(february, majorCode);

        assertEquals(0, major.getTotalDebit().compareTo(new BigDecimal("60.00")));
        assertTrue(major.getSubAccounts().isEmpty());
    }

    @Test
    @DisplayName("Digits outside 1..10 and reversed dates are rejected")
    void testInvalidArguments() {
        assertThrows(ConstraintViolationException.class, () -> generalLedgerService.generate(0, null, null, false));
        assertThrows(ConstraintViolationException.class, () -> generalLedgerService.generate(11, null, null, false));
        assertThrows(ConstraintViolationException.class, () -> generalLedgerService.generate(
            4, LocalDate.of(2036, 2, 2), LocalDate.of(2036, 2, 1), false));
    }

    @Test
    @DisplayName("Short codes are right-padded with zeros to form the major code")
    void testMajorCode() {
        assertEquals("1101", GeneralLedgerService.majorCode("110105", 4));
        assertEquals("1100", GeneralLedgerService.majorCode("11", 4));
        assertEquals("1", GeneralLedgerService.majorCode("1", 1));
    }
}
