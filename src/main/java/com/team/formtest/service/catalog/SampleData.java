package com.team.formtest.service.catalog;

import java.util.List;
import java.util.Random;

/**
 * Realistic sample values used by the rule-based generators.
 */
final class SampleData {

    static final List<String> DOMAINS = List.of(
            "example.com", "test.org", "demo.net", "sample.io",
            "gmail.com", "yahoo.com", "outlook.com", "hotmail.com");

    static final List<String> FIRST_NAMES = List.of(
            "James", "Mary", "John", "Patricia", "Robert", "Jennifer",
            "Michael", "Linda", "David", "Elizabeth", "William", "Barbara",
            "Richard", "Susan", "Joseph", "Jessica", "Thomas", "Sarah");

    static final List<String> LAST_NAMES = List.of(
            "Smith", "Johnson", "Williams", "Brown", "Jones", "Garcia",
            "Miller", "Davis", "Rodriguez", "Martinez", "Wilson", "Anderson");

    static final List<String> UNICODE_NAMES = List.of(
            "José", "Zoë", "Björk", "Łukasz", "Renée", "Siân", "Chloé", "Jürgen");

    static final List<String> CITIES = List.of(
            "New York", "Los Angeles", "Chicago", "Houston", "Phoenix",
            "Philadelphia", "San Antonio", "San Diego", "Dallas", "Austin");

    static final List<String> STATES = List.of(
            "AL", "AK", "AZ", "CA", "CO", "CT", "FL", "GA", "IL", "NY", "TX", "WA");

    static final List<String> STREETS = List.of("Main", "Oak", "Park", "First", "Maple", "Cedar");

    static final List<String> COMPANIES = List.of(
            "Tech Corp", "Data Systems", "Web Solutions", "Digital Inc");

    static final List<String> PHONE_FORMATS = List.of(
            "(555) 123-4567", "555-123-4567", "555.123.4567", "+1 555 123 4567", "5551234567");

    static final List<String> FILE_EXTENSIONS = List.of(".pdf", ".png", ".jpg", ".txt", ".docx");

    static final List<String> MALFORMED_EMAILS = List.of(
            "not-an-email", "@domain.com", "user@", "user name@domain.com", "user@domain..com");

    static final List<String> MALFORMED_PHONES = List.of("123", "abc-def-ghij", "555-12");

    static final String PARAGRAPH = "This is a sample textarea content with multiple lines.\n"
            + "It contains realistic text for testing purposes.";

    static final String UNICODE_PARAGRAPH = "Ünïcödé línë wïth àccents — 日本語のテキスト ✓\n"
            + "Second line with \"quotes\" & <angle brackets>.";

    private SampleData() {
    }

    static String pick(List<String> values, Random random) {
        return values.get(random.nextInt(values.size()));
    }
}
