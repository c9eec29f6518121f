package com.meetinganalyzer.analysis.service;

import com.meetinganalyzer.analysis.model.CanonicalSchema;
import com.meetinganalyzer.analysis.model.FeatureCoverage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Pattern;

@Component
public class FeatureCoverageCalculator {

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final Map<String, List<String>> ERP_FEATURES = new LinkedHashMap<>();
    static final Map<String, List<String>> ASP_FEATURES = new LinkedHashMap<>();
    static final List<String> PRIORITY = List.of(
            "Tally import/export",
            "Bank reconciliation",
            "UPI/cards gateway",
            "Managed accounting (bills & receipts)",
            "Bank reconciliation + suspense",
            "Financial reports (non-audited)",
            "Dedicated remote accountant",
            "Defaulter tracking",
            "PO / WO approvals",
            "Inventory",
            "Reminders & Late fee calc",
            "GST/TDS reports",
            "Vendor accounting",
            "Role-based access",
            "Finalisation support & audit coordination",
            "Bookkeeping (all incomes/expenses)"
    );

    static {
        ERP_FEATURES.put("Tally import/export", List.of("tally", "tally import", "tally export"));
        ERP_FEATURES.put("E-invoicing", List.of("e-invoice", "e invoicing", "einvoice"));
        ERP_FEATURES.put("Bank reconciliation", List.of("bank reconciliation", "reco", "reconciliation"));
        ERP_FEATURES.put("Vendor accounting", List.of("vendor accounting", "vendors ledger"));
        ERP_FEATURES.put("Budgeting", List.of("budget", "budgeting"));
        ERP_FEATURES.put("350+ bill combinations", List.of("bill combinations", "billing combinations"));
        ERP_FEATURES.put("PO / WO approvals", List.of("purchase order", "po approval", "work order", "wo approval"));
        ERP_FEATURES.put("Asset tagging via QR", List.of("asset tag", "qr asset", "asset qr"));
        ERP_FEATURES.put("Inventory", List.of("inventory"));
        ERP_FEATURES.put("Meter reading → auto invoices", List.of("meter reading", "auto invoice", "metering"));
        ERP_FEATURES.put("Maker-checker billing", List.of("maker checker", "maker-checker"));
        ERP_FEATURES.put("Reminders & Late fee calc", List.of("reminder", "late fee"));
        ERP_FEATURES.put("UPI/cards gateway", List.of("upi", "payment gateway", "cards"));
        ERP_FEATURES.put("Virtual accounts per unit", List.of("virtual account", "virtual accounts"));
        ERP_FEATURES.put("Preventive maintenance", List.of("preventive maintenance", "pm schedule"));
        ERP_FEATURES.put("Role-based access", List.of("role based", "role-based"));
        ERP_FEATURES.put("Defaulter tracking", List.of("defaulter", "arrears tracking"));
        ERP_FEATURES.put("GST/TDS reports", List.of("gst", "tds"));
        ERP_FEATURES.put("Balance sheet & dashboards", List.of("balance sheet", "dashboard"));

        ASP_FEATURES.put("Managed accounting (bills & receipts)", List.of("managed accounting", "computerized bills", "receipts"));
        ASP_FEATURES.put("Bookkeeping (all incomes/expenses)", List.of("bookkeeping", "income expense"));
        ASP_FEATURES.put("Bank reconciliation + suspense", List.of("suspense", "bank reconciliation", "reco"));
        ASP_FEATURES.put("Financial reports (non-audited)", List.of("financial report", "non audited", "trial balance", "p&l", "profit and loss"));
        ASP_FEATURES.put("Finalisation support & audit coordination", List.of("finalisation", "audit coordination", "auditor"));
        ASP_FEATURES.put("Vendor & PO/WO management", List.of("vendor management", "po", "wo", "work order"));
        ASP_FEATURES.put("Inventory & amenities booking", List.of("inventory", "amenities booking", "amenity booking"));
        ASP_FEATURES.put("Dedicated remote accountant", List.of("remote accountant", "dedicated accountant"));
        ASP_FEATURES.put("Annual data backup", List.of("annual data back", "backup", "data backup"));
    }

    public FeatureCoverage calculate(String transcript) {
        String text = normalize(transcript);
        if (text.isEmpty()) {
            return new FeatureCoverage(CanonicalSchema.NOT_AVAILABLE, CanonicalSchema.NOT_AVAILABLE);
        }

        TreeSet<String> erpCovered = covered(text, ERP_FEATURES);
        TreeSet<String> aspCovered = covered(text, ASP_FEATURES);
        String summary = summary("ERP", erpCovered, ERP_FEATURES.size()) + " "
                + summary("ASP", aspCovered, ASP_FEATURES.size());

        TreeSet<String> missed = new TreeSet<>();
        ERP_FEATURES.keySet().stream().filter(feature -> !erpCovered.contains(feature)).forEach(missed::add);
        ASP_FEATURES.keySet().stream().filter(feature -> !aspCovered.contains(feature)).forEach(missed::add);

        List<String> ordered = new ArrayList<>(missed);
        ordered.sort(Comparator.comparingInt(FeatureCoverageCalculator::priorityOf));
        String missedText = ordered.isEmpty()
                ? CanonicalSchema.NOT_AVAILABLE
                : "- " + String.join("\n- ", ordered);
        return new FeatureCoverage(summary.strip(), missedText);
    }

    private static TreeSet<String> covered(String text, Map<String, List<String>> catalogue) {
        String padded = " " + text + " ";
        TreeSet<String> covered = new TreeSet<>();
        catalogue.forEach((feature, keywords) -> {
            for (String keyword : keywords) {
                String key = normalize(keyword);
                if (!key.isEmpty() && padded.contains(" " + key + " ")) {
                    covered.add(feature);
                    return;
                }
            }
        });
        return covered;
    }

    private static String summary(String label, TreeSet<String> covered, int total) {
        long percent = total == 0 ? 0 : Math.round(100.0 * covered.size() / total);
        String head = label + " Coverage: " + covered.size() + "/" + total + " (" + percent + "%).";
        if (!covered.isEmpty()) {
            head += " Covered: " + String.join(", ", covered) + ".";
        }
        return head;
    }

    private static int priorityOf(String feature) {
        int index = PRIORITY.indexOf(feature);
        return index < 0 ? Integer.MAX_VALUE : index;
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String stripped = PUNCTUATION.matcher(text).replaceAll("").toLowerCase(Locale.ROOT);
        return WHITESPACE.matcher(stripped).replaceAll(" ").strip();
    }
}
