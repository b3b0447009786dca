package com.example.reports.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ReportParametersTest {

    @Test
    void currency_defaultsToUsdAndIsNormalized() {
        assertEquals("USD", ReportParameters.forPeriod(null, null, null).currency());
        assertEquals("USD", ReportParameters.forPeriod(null, null, "  ").currency());
        assertEquals("INR", ReportParameters.forPeriod(null, null, " inr ").currency());
    }

    @Test
    void currency_normalizationIgnoresDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals("INR", ReportParameters.forPeriod(null, null, "inr").currency());
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void effectiveAsOfDate_fallsBackToPeriodEnd() {
        LocalDate end = LocalDate.of(2025, 1, 31);

        assertEquals(end, ReportParameters.forPeriod(LocalDate.of(2025, 1, 1), end, "USD").effectiveAsOfDate());
        assertEquals(LocalDate.of(2024, 12, 31),
            ReportParameters.asOf(LocalDate.of(2024, 12, 31), "USD").effectiveAsOfDate());
    }

    @Test
    void filters_areCopied() {
        List<String> accounts = new ArrayList<>(List.of("acc-1"));
        ReportParameters parameters = new ReportParameters(null, null, null, "USD", 20, accounts, null, "expense");

        accounts.add("acc-2");

        assertEquals(List.of("acc-1"), parameters.accountIds());
        assertEquals(List.of(), parameters.categoryIds());
    }

    @Test
    void rowLists_dropNullEntries() {
        TransactionDetailRow transaction = new TransactionDetailRow(null, "Coffee", null, null, null,
            null, null, Arrays.asList("food", null), null, null);
        MerchantAnalysisRow merchant = new MerchantAnalysisRow("Cafe", 1, null, null, null, null, null, null);

        assertEquals(List.of("food"), transaction.tags());
        assertEquals(List.of(), merchant.categories());
    }

    @Test
    void sectionedRow_matchesExactTagOnly() {
        IncomeStatementRow total = new IncomeStatementRow("INCOME_TOTAL", "", null, null, null);

        assertTrue(total.isIn(IncomeStatementRow.Section.INCOME_TOTAL));
        assertFalse(total.isIn(IncomeStatementRow.Section.INCOME));
    }
}
